package com.raditha.structdiff.comparison;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * Per-comparison options.
 *
 * @param oldPath         Path attached to old-side locations, if any
 * @param newPath         Path attached to new-side locations, if any
 * @param includeContent  Copy raw source text into changes
 * @param textEquivalence Equality predicate for the early-termination check
 * @param detectRenames   Pair removed/added siblings with similar content as renames
 * @param detectMoves     Pair removed/added elements with equal identity under different parents as moves
 * @param renameThreshold Minimum similarity for a rename (0.0-1.0)
 * @param moveThreshold   Minimum similarity for a move (0.0-1.0); 0 accepts any identity match
 */
public record DiffOptions(
        @Nullable String oldPath,
        @Nullable String newPath,
        boolean includeContent,
        TextEquivalence textEquivalence,
        boolean detectRenames,
        boolean detectMoves,
        double renameThreshold,
        double moveThreshold) {

    public static final double DEFAULT_RENAME_THRESHOLD = 0.8;
    public static final double DEFAULT_MOVE_THRESHOLD = 0.95;

    public DiffOptions {
        Objects.requireNonNull(textEquivalence, "textEquivalence");
        if (renameThreshold < 0.0 || renameThreshold > 1.0) {
            throw new IllegalArgumentException("renameThreshold must be between 0.0 and 1.0");
        }
        if (moveThreshold < 0.0 || moveThreshold > 1.0) {
            throw new IllegalArgumentException("moveThreshold must be between 0.0 and 1.0");
        }
    }

    /**
     * Default options: content included, exact text equality, moves and renames detected.
     */
    public static DiffOptions defaults() {
        return new DiffOptions(null, null, true, TextEquivalence.exact(), true, true,
                DEFAULT_RENAME_THRESHOLD, DEFAULT_MOVE_THRESHOLD);
    }

    /**
     * Level-by-level comparison only: no rename or move pass.
     */
    public static DiffOptions structuralOnly() {
        return defaults().withRelocation(false, false);
    }

    public DiffOptions withPaths(@Nullable String oldFile, @Nullable String newFile) {
        return new DiffOptions(oldFile, newFile, includeContent, textEquivalence, detectRenames, detectMoves,
                renameThreshold, moveThreshold);
    }

    public DiffOptions withIncludeContent(boolean include) {
        return new DiffOptions(oldPath, newPath, include, textEquivalence, detectRenames, detectMoves,
                renameThreshold, moveThreshold);
    }

    public DiffOptions withTextEquivalence(TextEquivalence equivalence) {
        return new DiffOptions(oldPath, newPath, includeContent, equivalence, detectRenames, detectMoves,
                renameThreshold, moveThreshold);
    }

    public DiffOptions withRelocation(boolean renames, boolean moves) {
        return new DiffOptions(oldPath, newPath, includeContent, textEquivalence, renames, moves,
                renameThreshold, moveThreshold);
    }

    public boolean detectsRelocations() {
        return detectRenames || detectMoves;
    }
}
