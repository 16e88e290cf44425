package io.github.chirino.atlas.query;

/**
 * Query vector plus the minimum similarity ({@code 1 - cosine distance}) a result must reach.
 */
public record SemanticQuery(float[] vector, double similarityFloor) {

    public SemanticQuery {
        if (vector == null || vector.length == 0) {
            throw new InvalidQueryException("Semantic query vector must not be empty");
        }
        if (Double.isNaN(similarityFloor) || similarityFloor < 0.0 || similarityFloor > 1.0) {
            throw new InvalidQueryException(
                    "Similarity threshold must be between 0.0 and 1.0, got " + similarityFloor);
        }
        vector = vector.clone();
    }

    @Override
    public float[] vector() {
        return vector.clone();
    }
}
