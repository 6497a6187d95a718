package com.raditha.structdiff.matching;

import com.raditha.structdiff.model.SyntaxNode;

/**
 * Counterpart of a type found in a target tree.
 *
 * @param node         The matched type node
 * @param path         Dotted path of the matched type through its enclosing types
 * @param similarity   Similarity between source and match (1.0 for name matches)
 * @param strategyUsed The strategy that produced the match; never {@link ClassMatchStrategy#AUTO}
 */
public record ClassMatch(
        SyntaxNode node,
        String path,
        double similarity,
        ClassMatchStrategy strategyUsed) {

    public boolean isExactMatch() {
        return strategyUsed == ClassMatchStrategy.EXACT_NAME || similarity >= 1.0;
    }
}
