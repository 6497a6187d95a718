package com.raditha.structdiff.similarity;

import com.raditha.structdiff.model.SyntaxNode;

import java.util.HashSet;
import java.util.Set;

/**
 * Calculates structural similarity from the identity keys of a node's children.
 * Uses Jaccard similarity for fast comparison.
 */
public class ChildKeySimilarity {

    private final SignatureHasher hasher;

    public ChildKeySimilarity(SignatureHasher hasher) {
        this.hasher = hasher;
    }

    /**
     * Calculate structural similarity between the children of two nodes.
     *
     * @param a First node
     * @param b Second node
     * @return Similarity score (0.0 to 1.0)
     */
    public double calculate(SyntaxNode a, SyntaxNode b) {
        if (!a.hasChildren() && !b.hasChildren()) {
            return 1.0;
        }

        if (!a.hasChildren() || !b.hasChildren()) {
            return 0.0;
        }

        return jaccardSimilarity(childKeys(a), childKeys(b));
    }

    private Set<IdentityKey> childKeys(SyntaxNode node) {
        Set<IdentityKey> keys = new HashSet<>();
        for (SyntaxNode child : node.children()) {
            keys.add(hasher.identityKey(child));
        }
        return keys;
    }

    /**
     * Calculate Jaccard similarity between two sets.
     * Jaccard = |A ∩ B| / |A ∪ B|
     */
    private double jaccardSimilarity(Set<IdentityKey> set1, Set<IdentityKey> set2) {
        Set<IdentityKey> intersection = new HashSet<>(set1);
        intersection.retainAll(set2);

        Set<IdentityKey> union = new HashSet<>(set1);
        union.addAll(set2);

        if (union.isEmpty()) {
            return 0.0;
        }

        return (double) intersection.size() / union.size();
    }
}
