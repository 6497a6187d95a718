package com.raditha.structdiff.matching;

import com.raditha.structdiff.model.SyntaxNode;
import com.raditha.structdiff.similarity.IdentityKey;
import com.raditha.structdiff.similarity.SignatureHasher;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches two ordered sibling lists by identity key.
 * <p>
 * Matching is a single hash lookup per old sibling. When one key occurs several
 * times in a list (overloads the signature cannot tell apart, unnamed statements)
 * the occurrences are paired in source order: first old with first new.
 */
public class NodeMatcher {

    private final SignatureHasher hasher;

    public NodeMatcher() {
        this(new SignatureHasher());
    }

    public NodeMatcher(SignatureHasher hasher) {
        this.hasher = hasher;
    }

    /**
     * Result of matching one level of siblings.
     *
     * @param matchedPairs Pairs found in both lists, in old source order
     * @param unmatchedOld Old siblings without counterpart, in old source order
     * @param unmatchedNew New siblings without counterpart, in new source order
     */
    public record MatchResult(
            List<MatchedPair> matchedPairs,
            List<SyntaxNode> unmatchedOld,
            List<SyntaxNode> unmatchedNew) {

        public boolean allMatched() {
            return unmatchedOld.isEmpty() && unmatchedNew.isEmpty();
        }
    }

    /**
     * An old node and the new node it corresponds to.
     */
    public record MatchedPair(SyntaxNode oldNode, SyntaxNode newNode) {
    }

    /**
     * Partition two sibling lists into matched pairs, unmatched old and unmatched new nodes.
     */
    public MatchResult match(List<SyntaxNode> oldSiblings, List<SyntaxNode> newSiblings) {
        Map<IdentityKey, Deque<Integer>> newIndex = new HashMap<>(newSiblings.size() * 2);
        for (int i = 0; i < newSiblings.size(); i++) {
            newIndex.computeIfAbsent(hasher.identityKey(newSiblings.get(i)), k -> new ArrayDeque<>()).add(i);
        }

        List<MatchedPair> matched = new ArrayList<>(Math.min(oldSiblings.size(), newSiblings.size()));
        List<SyntaxNode> unmatchedOld = new ArrayList<>();
        boolean[] newMatched = new boolean[newSiblings.size()];

        for (SyntaxNode oldNode : oldSiblings) {
            Deque<Integer> candidates = newIndex.get(hasher.identityKey(oldNode));
            Integer newPosition = candidates == null ? null : candidates.pollFirst();
            if (newPosition != null) {
                matched.add(new MatchedPair(oldNode, newSiblings.get(newPosition)));
                newMatched[newPosition] = true;
            } else {
                unmatchedOld.add(oldNode);
            }
        }

        List<SyntaxNode> unmatchedNew = new ArrayList<>();
        for (int i = 0; i < newSiblings.size(); i++) {
            if (!newMatched[i]) {
                unmatchedNew.add(newSiblings.get(i));
            }
        }

        return new MatchResult(matched, unmatchedOld, unmatchedNew);
    }

    public SignatureHasher getHasher() {
        return hasher;
    }
}
