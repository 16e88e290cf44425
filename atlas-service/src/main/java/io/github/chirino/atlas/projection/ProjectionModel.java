package io.github.chirino.atlas.projection;

import io.github.chirino.atlas.model.Position;

/**
 * A fitted, versioned mapping from embedding space to the 2-D map. Implementations are
 * immutable and safe to share between worker threads.
 */
public interface ProjectionModel {

    String version();

    int inputDimensions();

    /**
     * @throws ProjectionException if the vector length does not match {@link #inputDimensions()}
     */
    Position project(float[] embedding);
}
