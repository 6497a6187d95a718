package com.raditha.structdiff.comparison;

import com.raditha.structdiff.model.Change;
import com.raditha.structdiff.model.ChangeType;
import com.raditha.structdiff.model.SyntaxNode;
import com.raditha.structdiff.similarity.IdentityKey;
import com.raditha.structdiff.similarity.SignatureHasher;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Second pass over a finished level-by-level walk.
 * Turns Removed/Added pairs into Renamed entries (same parent, different name, similar
 * content) and Moved entries (same identity key, different parent). The replacement takes
 * the place of the Removed entry; the paired Added entry is dropped.
 */
class RelocationDetector {

    private final SignatureHasher hasher;

    RelocationDetector(SignatureHasher hasher) {
        this.hasher = hasher;
    }

    /**
     * A possible Removed/Added pairing.
     */
    private record Candidate(Orphan removed, Orphan added, double similarity) {
    }

    List<Change> detect(List<Change> changes, List<Orphan> orphans, DiffOptions options, CancellationToken token) {
        List<Orphan> removed = new ArrayList<>();
        List<Orphan> added = new ArrayList<>();
        for (Orphan orphan : orphans) {
            if (orphan.change().type() == ChangeType.REMOVED) {
                removed.add(orphan);
            } else {
                added.add(orphan);
            }
        }
        if (removed.isEmpty() || added.isEmpty()) {
            return changes;
        }

        Map<Change, Change> replacements = new IdentityHashMap<>();
        Set<Change> consumedAdded = Collections.newSetFromMap(new IdentityHashMap<>());

        if (options.detectRenames()) {
            detectRenames(removed, added, options.renameThreshold(), replacements, consumedAdded, token);
        }
        if (options.detectMoves()) {
            detectMoves(removed, added, options.moveThreshold(), replacements, consumedAdded, token);
        }

        if (replacements.isEmpty()) {
            return changes;
        }
        return rebuild(changes, replacements, consumedAdded);
    }

    private void detectRenames(List<Orphan> removed, List<Orphan> added, double threshold,
            Map<Change, Change> replacements, Set<Change> consumedAdded, CancellationToken token) {
        Map<List<IdentityKey>, List<Orphan>> addedByParent = new LinkedHashMap<>();
        for (Orphan orphan : added) {
            addedByParent.computeIfAbsent(orphan.parentPath(), k -> new ArrayList<>()).add(orphan);
        }

        List<Candidate> candidates = new ArrayList<>();
        for (Orphan oldOrphan : removed) {
            token.throwIfCancellationRequested();
            List<Orphan> siblings = addedByParent.getOrDefault(oldOrphan.parentPath(), List.of());
            for (Orphan newOrphan : siblings) {
                SyntaxNode oldNode = oldOrphan.node();
                SyntaxNode newNode = newOrphan.node();
                if (oldNode.kind() != newNode.kind() || oldNode.name() == null || newNode.name() == null
                        || oldNode.name().equals(newNode.name())) {
                    continue;
                }
                double similarity = hasher.similarity(oldNode, newNode);
                if (similarity >= threshold) {
                    candidates.add(new Candidate(oldOrphan, newOrphan, similarity));
                }
            }
        }

        candidates.sort(Comparator.comparingDouble(Candidate::similarity).reversed()
                .thenComparingInt(c -> c.removed().order())
                .thenComparingInt(c -> c.added().order()));

        for (Candidate candidate : candidates) {
            Change oldChange = candidate.removed().change();
            Change newChange = candidate.added().change();
            if (replacements.containsKey(oldChange) || consumedAdded.contains(newChange)) {
                continue;
            }
            replacements.put(oldChange, new Change(
                    ChangeType.RENAMED,
                    oldChange.kind(),
                    newChange.name(),
                    oldChange.name(),
                    oldChange.oldLocation(),
                    newChange.newLocation(),
                    oldChange.oldContent(),
                    newChange.newContent(),
                    List.of(),
                    Set.of()));
            consumedAdded.add(newChange);
        }
    }

    private void detectMoves(List<Orphan> removed, List<Orphan> added, double threshold,
            Map<Change, Change> replacements, Set<Change> consumedAdded, CancellationToken token) {
        // identity key -> removed elements with their parent path, built once per comparison
        Map<IdentityKey, Deque<Orphan>> removedIndex = new HashMap<>();
        for (Orphan orphan : removed) {
            if (!replacements.containsKey(orphan.change()) && orphan.node().name() != null) {
                removedIndex.computeIfAbsent(orphan.key(), k -> new ArrayDeque<>()).add(orphan);
            }
        }
        if (removedIndex.isEmpty()) {
            return;
        }

        for (Orphan newOrphan : added) {
            token.throwIfCancellationRequested();
            if (consumedAdded.contains(newOrphan.change())) {
                continue;
            }
            Deque<Orphan> candidates = removedIndex.get(newOrphan.key());
            if (candidates == null) {
                continue;
            }
            Iterator<Orphan> it = candidates.iterator();
            while (it.hasNext()) {
                Orphan oldOrphan = it.next();
                if (oldOrphan.sameParentAs(newOrphan)) {
                    continue;
                }
                if (threshold > 0.0 && hasher.similarity(oldOrphan.node(), newOrphan.node()) < threshold) {
                    continue;
                }
                Change oldChange = oldOrphan.change();
                Change newChange = newOrphan.change();
                replacements.put(oldChange, new Change(
                        ChangeType.MOVED,
                        oldChange.kind(),
                        oldChange.name(),
                        null,
                        oldChange.oldLocation(),
                        newChange.newLocation(),
                        oldChange.oldContent(),
                        newChange.newContent(),
                        List.of(),
                        Set.of()));
                consumedAdded.add(newChange);
                it.remove();
                break;
            }
        }
    }

    private List<Change> rebuild(List<Change> changes, Map<Change, Change> replacements, Set<Change> consumedAdded) {
        List<Change> result = new ArrayList<>(changes.size());
        for (Change change : changes) {
            if (consumedAdded.contains(change)) {
                continue;
            }
            Change replacement = replacements.get(change);
            if (replacement != null) {
                result.add(replacement);
            } else if (change.hasChildren()) {
                result.add(change.withChildren(rebuild(change.children(), replacements, consumedAdded)));
            } else {
                result.add(change);
            }
        }
        return result;
    }
}
