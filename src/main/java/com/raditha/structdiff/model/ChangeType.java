package com.raditha.structdiff.model;

/**
 * Classification of a single reported change.
 */
public enum ChangeType {
    ADDED,
    REMOVED,
    MODIFIED,
    MOVED,
    RENAMED,
    UNCHANGED
}
