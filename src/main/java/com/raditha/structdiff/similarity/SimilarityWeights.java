package com.raditha.structdiff.similarity;

/**
 * Weights for combining the two node similarity metrics.
 *
 * @param childKeyWeight Weight for the shared child identity key score (0.0-1.0)
 * @param textWeight     Weight for the textual overlap score (0.0-1.0)
 */
public record SimilarityWeights(
        double childKeyWeight,
        double textWeight) {

    /**
     * Validate weights sum to 1.0.
     */
    public SimilarityWeights {
        double sum = childKeyWeight + textWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException(
                    String.format("Weights must sum to 1.0, got %.3f", sum));
        }
    }

    /**
     * Balanced weights (default).
     */
    public static SimilarityWeights balanced() {
        return new SimilarityWeights(0.5, 0.5);
    }

    /**
     * Calculate combined score from individual metrics.
     */
    public double combine(double childKeyScore, double textScore) {
        return (childKeyScore * childKeyWeight) + (textScore * textWeight);
    }
}
