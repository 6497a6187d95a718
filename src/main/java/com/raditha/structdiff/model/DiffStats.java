package com.raditha.structdiff.model;

import java.util.List;

/**
 * Counts of changes by type over a whole change hierarchy.
 */
public record DiffStats(
        int additions,
        int deletions,
        int modifications,
        int moves,
        int renames) {

    public static DiffStats of(List<Change> changes) {
        int additions = 0;
        int deletions = 0;
        int modifications = 0;
        int moves = 0;
        int renames = 0;

        for (Change change : Changes.flatten(changes)) {
            switch (change.type()) {
                case ADDED -> additions++;
                case REMOVED -> deletions++;
                case MODIFIED -> modifications++;
                case MOVED -> moves++;
                case RENAMED -> renames++;
                default -> {
                    // unchanged entries are never counted
                }
            }
        }
        return new DiffStats(additions, deletions, modifications, moves, renames);
    }

    public int total() {
        return additions + deletions + modifications + moves + renames;
    }

    @Override
    public String toString() {
        return String.format("+%d -%d ~%d moved %d renamed %d", additions, deletions, modifications, moves, renames);
    }
}
