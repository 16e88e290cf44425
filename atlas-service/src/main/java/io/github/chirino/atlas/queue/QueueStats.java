package io.github.chirino.atlas.queue;

import io.github.chirino.atlas.model.EnrichmentKind;
import io.github.chirino.atlas.model.QueueStatus;
import java.util.EnumMap;
import java.util.Map;

final class QueueStats {

    private QueueStats() {}

    /** Every kind and status present with a zero count. */
    static Map<EnrichmentKind, Map<QueueStatus, Long>> zeroed() {
        Map<EnrichmentKind, Map<QueueStatus, Long>> stats = new EnumMap<>(EnrichmentKind.class);
        for (EnrichmentKind kind : EnrichmentKind.values()) {
            Map<QueueStatus, Long> counts = new EnumMap<>(QueueStatus.class);
            for (QueueStatus status : QueueStatus.values()) {
                counts.put(status, 0L);
            }
            stats.put(kind, counts);
        }
        return stats;
    }
}
