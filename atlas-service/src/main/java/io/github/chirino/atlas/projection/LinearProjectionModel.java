package io.github.chirino.atlas.projection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.chirino.atlas.model.Position;
import java.util.Objects;

/**
 * Linear projection, as produced by PCA-style fitting: each coordinate is the dot product of a
 * component row with the standardized embedding, {@code (v - mean) / scale}, plus an offset.
 *
 * <pre>{@code
 * {
 *   "version": "pca-2024-06",
 *   "inputDimensions": 384,
 *   "mean": [...],
 *   "scale": [...],
 *   "components": [[...], [...]],
 *   "offset": [0.0, 0.0]
 * }
 * }</pre>
 *
 * {@code mean}, {@code scale} and {@code offset} are optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class LinearProjectionModel implements ProjectionModel {

    private final String version;
    private final int inputDimensions;
    private final double[] mean;
    private final double[] scale;
    private final double[][] components;
    private final double[] offset;

    @JsonCreator
    public LinearProjectionModel(
            @JsonProperty("version") String version,
            @JsonProperty("inputDimensions") int inputDimensions,
            @JsonProperty("mean") double[] mean,
            @JsonProperty("scale") double[] scale,
            @JsonProperty("components") double[][] components,
            @JsonProperty("offset") double[] offset) {
        if (version == null || version.isBlank()) {
            throw new ProjectionException("Projection model has no version");
        }
        if (inputDimensions <= 0) {
            throw new ProjectionException("Projection model inputDimensions must be positive");
        }
        if (components == null || components.length != 2) {
            throw new ProjectionException("Projection model needs exactly two component rows");
        }
        for (double[] row : components) {
            requireLength("components", row, inputDimensions);
        }
        this.version = version;
        this.inputDimensions = inputDimensions;
        this.mean =
                mean == null
                        ? new double[inputDimensions]
                        : requireLength("mean", mean, inputDimensions);
        this.scale = scale == null ? null : requireLength("scale", scale, inputDimensions);
        this.components = new double[][] {components[0].clone(), components[1].clone()};
        this.offset = offset == null ? new double[2] : requireLength("offset", offset, 2);
        if (this.scale != null) {
            for (double s : this.scale) {
                if (s == 0.0 || !Double.isFinite(s)) {
                    throw new ProjectionException("Projection model scale values must be non-zero");
                }
            }
        }
    }

    private static double[] requireLength(String name, double[] values, int expected) {
        if (values == null || values.length != expected) {
            throw new ProjectionException(
                    "Projection model "
                            + name
                            + " has "
                            + (values == null ? 0 : values.length)
                            + " values, expected "
                            + expected);
        }
        return values.clone();
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public int inputDimensions() {
        return inputDimensions;
    }

    @Override
    public Position project(float[] embedding) {
        Objects.requireNonNull(embedding, "embedding");
        if (embedding.length != inputDimensions) {
            throw new ProjectionException(
                    "Embedding has "
                            + embedding.length
                            + " dimensions, projection model "
                            + version
                            + " expects "
                            + inputDimensions);
        }
        double x = offset[0];
        double y = offset[1];
        for (int i = 0; i < inputDimensions; i++) {
            double v = embedding[i] - mean[i];
            if (scale != null) {
                v /= scale[i];
            }
            x += components[0][i] * v;
            y += components[1][i] * v;
        }
        return new Position(x, y);
    }
}
