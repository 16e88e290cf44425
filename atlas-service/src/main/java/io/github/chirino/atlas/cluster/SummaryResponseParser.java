package io.github.chirino.atlas.cluster;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a numbered-list answer ({@code "1. ...\n2. ..."}) back into one label per cluster.
 * Items are taken in order; a missing item leaves that cluster without a label.
 */
final class SummaryResponseParser {

    private static final Pattern ITEM =
            Pattern.compile("\\d+\\.\\s*(.+?)(?=\\n\\s*\\d+\\.|$)", Pattern.DOTALL);
    private static final Pattern CLUSTER_PREFIX =
            Pattern.compile("^\\*{0,2}Cluster \\d+\\*{0,2}:\\s*");

    private SummaryResponseParser() {}

    static List<String> parse(String response, int clusters) {
        List<String> labels = new ArrayList<>(clusters);
        if (response != null) {
            Matcher matcher = ITEM.matcher(response.strip());
            while (matcher.find() && labels.size() < clusters) {
                String label = clean(matcher.group(1));
                labels.add(label.isEmpty() ? null : label);
            }
        }
        while (labels.size() < clusters) {
            labels.add(null);
        }
        return labels;
    }

    static String clean(String label) {
        String single = label.strip().replaceAll("\\s+", " ");
        return CLUSTER_PREFIX.matcher(single).replaceFirst("").strip();
    }
}
