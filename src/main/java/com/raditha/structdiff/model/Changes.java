package com.raditha.structdiff.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Query helpers over hierarchical change lists.
 */
public final class Changes {

    private Changes() {
    }

    /**
     * Depth-first, pre-order flatten of a change hierarchy.
     * Lossy: the nesting is gone in the result. Only meant for consumers that
     * cannot handle hierarchical output.
     */
    public static List<Change> flatten(List<Change> changes) {
        List<Change> result = new ArrayList<>();
        flattenInto(changes, result);
        return result;
    }

    private static void flattenInto(List<Change> changes, List<Change> result) {
        for (Change change : changes) {
            result.add(change);
            flattenInto(change.children(), result);
        }
    }

    /**
     * Count every change in the hierarchy, nested ones included.
     */
    public static int countAll(List<Change> changes) {
        int count = 0;
        for (Change change : changes) {
            count += 1 + countAll(change.children());
        }
        return count;
    }

    /**
     * Find the first change (pre-order) with the given name.
     */
    public static Optional<Change> findByName(List<Change> changes, String name) {
        return flatten(changes).stream()
                .filter(c -> name.equals(c.name()))
                .findFirst();
    }

    /**
     * All changes of one kind, nested ones included.
     */
    public static List<Change> ofKind(List<Change> changes, ChangeKind kind) {
        return flatten(changes).stream()
                .filter(c -> c.kind() == kind)
                .toList();
    }

    /**
     * All changes of one type, nested ones included.
     */
    public static List<Change> ofType(List<Change> changes, ChangeType type) {
        return flatten(changes).stream()
                .filter(c -> c.type() == type)
                .toList();
    }
}
