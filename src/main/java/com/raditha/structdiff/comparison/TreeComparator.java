package com.raditha.structdiff.comparison;

import com.raditha.structdiff.model.Change;
import com.raditha.structdiff.model.SyntaxNode;

import java.util.List;

/**
 * Compares two syntax trees and reports a hierarchical list of changes.
 */
public interface TreeComparator {

    /**
     * Compare two trees.
     *
     * @param oldRoot Root of the old version
     * @param newRoot Root of the new version
     * @param options Comparison options
     * @param token   Cancellation signal
     * @return Changes below the roots; empty when the trees are equivalent
     * @throws ComparisonCancelledException if {@code token} was cancelled
     */
    List<Change> compare(SyntaxNode oldRoot, SyntaxNode newRoot, DiffOptions options, CancellationToken token);

    default List<Change> compare(SyntaxNode oldRoot, SyntaxNode newRoot, DiffOptions options) {
        return compare(oldRoot, newRoot, options, CancellationToken.NONE);
    }

    default List<Change> compare(SyntaxNode oldRoot, SyntaxNode newRoot) {
        return compare(oldRoot, newRoot, DiffOptions.defaults(), CancellationToken.NONE);
    }
}
