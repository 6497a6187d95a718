package com.raditha.structdiff.comparison;

/**
 * Decides whether two source slices count as unchanged.
 * Whitespace handling lives behind this predicate; the comparator never inspects text itself.
 */
@FunctionalInterface
public interface TextEquivalence {

    boolean equivalent(String oldText, String newText);

    /**
     * Byte-for-byte equality.
     */
    static TextEquivalence exact() {
        return String::equals;
    }
}
