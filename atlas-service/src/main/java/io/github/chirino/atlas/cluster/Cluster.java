package io.github.chirino.atlas.cluster;

import io.github.chirino.atlas.model.Position;
import java.util.List;
import java.util.UUID;

/**
 * One group of the partition. {@code boundary} is a convex polygon (counter-clockwise, not
 * closed) containing every member position; {@code label} is null when labelling did not
 * produce one.
 */
public record Cluster(
        int id,
        List<UUID> memberIds,
        Position centroid,
        List<Position> boundary,
        String label,
        List<String> representativeTitles) {

    public Cluster {
        memberIds = List.copyOf(memberIds);
        boundary = List.copyOf(boundary);
        representativeTitles = List.copyOf(representativeTitles);
    }

    public int size() {
        return memberIds.size();
    }

    Cluster withLabel(String label) {
        return new Cluster(id, memberIds, centroid, boundary, label, representativeTitles);
    }
}
