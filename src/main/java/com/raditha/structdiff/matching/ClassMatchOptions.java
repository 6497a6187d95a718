package com.raditha.structdiff.matching;

import org.jspecify.annotations.Nullable;

/**
 * Options for {@link ClassMatcher}.
 *
 * @param interfaceName       Supertype name used by the interface strategy
 * @param similarityThreshold Minimum similarity accepted by the similarity strategy (0.0-1.0)
 * @param includeNestedTypes  Consider nested types as candidates, not only top-level ones
 */
public record ClassMatchOptions(
        @Nullable String interfaceName,
        double similarityThreshold,
        boolean includeNestedTypes) {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.8;

    public ClassMatchOptions {
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be between 0.0 and 1.0");
        }
    }

    public static ClassMatchOptions defaults() {
        return new ClassMatchOptions(null, DEFAULT_SIMILARITY_THRESHOLD, false);
    }

    public static ClassMatchOptions forSimilarity(double threshold) {
        return new ClassMatchOptions(null, threshold, false);
    }

    public static ClassMatchOptions forInterface(String interfaceName) {
        return new ClassMatchOptions(interfaceName, DEFAULT_SIMILARITY_THRESHOLD, false);
    }

    public ClassMatchOptions withNestedTypes(boolean include) {
        return new ClassMatchOptions(interfaceName, similarityThreshold, include);
    }
}
