package com.raditha.structdiff.analyzer;

import com.raditha.structdiff.matching.ClassMatch;
import com.raditha.structdiff.model.Change;

import java.util.List;

/**
 * A matched type together with the member changes between source and match.
 *
 * @param match   How the counterpart was found
 * @param changes Changes inside the type, from the source type to its match
 */
public record ClassComparison(ClassMatch match, List<Change> changes) {

    public ClassComparison {
        changes = List.copyOf(changes);
    }

    public boolean isIdentical() {
        return changes.isEmpty();
    }
}
