package io.github.chirino.atlas.cluster;

import java.util.List;

/** Builds the single labelling prompt covering every cluster. */
final class SummaryPrompt {

    private SummaryPrompt() {}

    static String build(List<List<String>> titlesPerCluster) {
        StringBuilder prompt =
                new StringBuilder(
                        "For each group of document titles below, provide a very brief (not a full"
                                + " sentence, just descriptive words) description of the main"
                                + " subject or theme that unites them and best differentiates"
                                + " them from the other groups. Do not use markdown, just plain"
                                + " text.\n\n");
        for (int i = 0; i < titlesPerCluster.size(); i++) {
            prompt.append("Cluster ").append(i + 1).append(":\n");
            for (String title : titlesPerCluster.get(i)) {
                prompt.append("- ").append(title.replace('\n', ' ').strip()).append('\n');
            }
            prompt.append('\n');
        }
        prompt.append("\nReturn your answer as a numbered list, one description per cluster.");
        return prompt.toString();
    }
}
