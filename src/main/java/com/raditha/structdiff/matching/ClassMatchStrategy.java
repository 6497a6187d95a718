package com.raditha.structdiff.matching;

/**
 * How {@link ClassMatcher} looks for the counterpart of a type.
 */
public enum ClassMatchStrategy {
    /** Same name; fails when the type was renamed. */
    EXACT_NAME,
    /** First type declaring the requested supertype. */
    INTERFACE,
    /** Most similar type at or above the similarity threshold. */
    SIMILARITY,
    /** Exact name, then interface when one is given, then similarity. */
    AUTO
}
