package io.github.chirino.atlas.query;

public enum ResultStatus {
    COMPLETE,
    TRUNCATED;

    public String toValue() {
        return name().toLowerCase();
    }
}
