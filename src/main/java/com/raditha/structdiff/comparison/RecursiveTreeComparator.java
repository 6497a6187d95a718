package com.raditha.structdiff.comparison;

import com.raditha.structdiff.matching.NodeMatcher;
import com.raditha.structdiff.model.Change;
import com.raditha.structdiff.model.ChangeKind;
import com.raditha.structdiff.model.ChangeType;
import com.raditha.structdiff.model.Location;
import com.raditha.structdiff.model.SyntaxNode;
import com.raditha.structdiff.similarity.IdentityKey;
import com.raditha.structdiff.similarity.SignatureHasher;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Compares syntax trees level by level.
 * <p>
 * Every node is visited at most once, at the level where it lives. Matched pairs whose
 * raw text is equivalent are dropped without looking at their subtrees; all other matched
 * pairs become a Modified entry holding the changes found one level down. Unmatched
 * siblings become Removed or Added entries, which the {@link RelocationDetector} may then
 * turn into renames and moves.
 * <p>
 * Raw text leaves out code the active symbols exclude, so edits there never produce a
 * change. Reported content is the node's source text, the same under every profile.
 * <p>
 * Single-threaded: one instance may be shared, but each call runs sequentially.
 */
public class RecursiveTreeComparator implements TreeComparator {

    private static final Comparator<Change> BY_LINE = Comparator.comparingInt(Change::sortLine);

    private final NodeMatcher matcher;
    private final SignatureHasher hasher;
    private final RelocationDetector relocationDetector;

    public RecursiveTreeComparator() {
        this(new NodeMatcher());
    }

    public RecursiveTreeComparator(NodeMatcher matcher) {
        this.matcher = matcher;
        this.hasher = matcher.getHasher();
        this.relocationDetector = new RelocationDetector(hasher);
    }

    @Override
    public List<Change> compare(SyntaxNode oldRoot, SyntaxNode newRoot, DiffOptions options,
            CancellationToken token) {
        Objects.requireNonNull(oldRoot, "oldRoot");
        Objects.requireNonNull(newRoot, "newRoot");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(token, "token");

        token.throwIfCancellationRequested();
        if (isUnchanged(oldRoot, newRoot, options)) {
            return List.of();
        }

        Walk walk = new Walk(options, token);
        List<Change> changes = walk.compareChildren(oldRoot, newRoot, List.of());

        if (options.detectsRelocations() && !walk.orphans.isEmpty()) {
            changes = relocationDetector.detect(changes, walk.orphans, options, token);
        }
        return changes;
    }

    /**
     * Similarity of two nodes, exposed for class matching.
     */
    public double similarity(SyntaxNode a, SyntaxNode b) {
        return hasher.similarity(a, b);
    }

    private static boolean isUnchanged(SyntaxNode oldNode, SyntaxNode newNode, DiffOptions options) {
        return options.textEquivalence().equivalent(oldNode.rawText(), newNode.rawText())
                && Objects.equals(oldNode.signature(), newNode.signature());
    }

    /**
     * State of one compare call. Holds the unmatched nodes collected for the relocation pass.
     */
    private final class Walk {
        private final DiffOptions options;
        private final CancellationToken token;
        private final List<Orphan> orphans = new ArrayList<>();

        Walk(DiffOptions options, CancellationToken token) {
            this.options = options;
            this.token = token;
        }

        List<Change> compareChildren(SyntaxNode oldParent, SyntaxNode newParent, List<IdentityKey> path) {
            token.throwIfCancellationRequested();

            NodeMatcher.MatchResult match = matcher.match(oldParent.children(), newParent.children());
            List<Change> changes = new ArrayList<>();

            for (NodeMatcher.MatchedPair pair : match.matchedPairs()) {
                Change change = compareMatched(pair.oldNode(), pair.newNode(), path);
                if (change != null) {
                    changes.add(change);
                }
            }

            for (SyntaxNode oldChild : match.unmatchedOld()) {
                Change removed = Change.removed(kindOf(oldChild), oldChild.name(),
                        Location.of(options.oldPath(), oldChild.range()), content(oldChild));
                orphans.add(new Orphan(removed, oldChild, hasher.identityKey(oldChild), path, orphans.size()));
                changes.add(removed);
            }

            for (SyntaxNode newChild : match.unmatchedNew()) {
                Change added = Change.added(kindOf(newChild), newChild.name(),
                        Location.of(options.newPath(), newChild.range()), content(newChild));
                orphans.add(new Orphan(added, newChild, hasher.identityKey(newChild), path, orphans.size()));
                changes.add(added);
            }

            changes.sort(BY_LINE);
            return changes;
        }

        private Change compareMatched(SyntaxNode oldNode, SyntaxNode newNode, List<IdentityKey> path) {
            if (isUnchanged(oldNode, newNode, options)) {
                return null;
            }

            List<IdentityKey> childPath = new ArrayList<>(path.size() + 1);
            childPath.addAll(path);
            childPath.add(hasher.identityKey(newNode));

            List<Change> nested = compareChildren(oldNode, newNode, List.copyOf(childPath));

            return new Change(
                    ChangeType.MODIFIED,
                    kindOf(newNode),
                    newNode.name(),
                    null,
                    Location.of(options.oldPath(), oldNode.range()),
                    Location.of(options.newPath(), newNode.range()),
                    content(oldNode),
                    content(newNode),
                    nested,
                    Set.of());
        }

        private String content(SyntaxNode node) {
            return options.includeContent() ? node.sourceText() : null;
        }
    }

    private static ChangeKind kindOf(SyntaxNode node) {
        return ChangeKind.from(node.kind());
    }
}
