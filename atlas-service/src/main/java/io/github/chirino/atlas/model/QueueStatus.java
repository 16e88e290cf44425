package io.github.chirino.atlas.model;

import java.util.Locale;

public enum QueueStatus {
    PENDING,
    PROCESSING,
    DONE,
    FAILED;

    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isActive() {
        return this == PENDING || this == PROCESSING;
    }

    public static QueueStatus fromValue(String value) {
        return QueueStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
