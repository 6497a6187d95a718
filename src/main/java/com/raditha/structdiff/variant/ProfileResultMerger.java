package com.raditha.structdiff.variant;

import com.raditha.structdiff.model.Change;
import com.raditha.structdiff.model.ChangeKind;
import com.raditha.structdiff.model.ChangeType;
import com.raditha.structdiff.model.Location;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Folds per-profile change lists into one list annotated with the profiles each change
 * holds under.
 * <p>
 * Two changes fold when type, kind, name, old name and old/new content agree; locations
 * stand in for content when content was omitted. Children of folded changes are merged
 * the same way. A change that holds under every analyzed profile gets an empty profile set.
 * Not thread-safe; called once per run after all profile tasks are done.
 */
public class ProfileResultMerger {

    private static final Comparator<Change> BY_LINE = Comparator.comparingInt(Change::sortLine);

    /**
     * Identity used to fold changes across profiles. {@code occurrence} keeps identical
     * changes reported twice by the same profile apart.
     */
    record FoldKey(ChangeType type, ChangeKind kind, String name, String oldName,
            String oldIdentity, String newIdentity, int occurrence) {

        static FoldKey of(Change change, int occurrence) {
            return new FoldKey(change.type(), change.kind(), change.name(), change.oldName(),
                    identity(change.oldContent(), change.oldLocation()),
                    identity(change.newContent(), change.newLocation()),
                    occurrence);
        }

        FoldKey withOccurrence(int n) {
            return new FoldKey(type, kind, name, oldName, oldIdentity, newIdentity, n);
        }

        private static String identity(String content, Location location) {
            if (content != null) {
                return content;
            }
            return location != null ? "@" + location.toDisplayString() : null;
        }
    }

    private static final class Accumulator {
        final Change first;
        final Set<String> profiles = new LinkedHashSet<>();
        final Map<String, List<Change>> childrenByProfile = new LinkedHashMap<>();

        Accumulator(Change first) {
            this.first = first;
        }
    }

    /**
     * Merge the results of several profiles.
     *
     * @param changesByProfile each profile's changes, in the order the caller requested the profiles
     * @return merged changes in source order
     */
    public List<Change> merge(Map<String, List<Change>> changesByProfile) {
        Objects.requireNonNull(changesByProfile, "changesByProfile");
        Set<String> allProfiles = new LinkedHashSet<>(changesByProfile.keySet());
        return mergeLevel(changesByProfile, allProfiles);
    }

    private List<Change> mergeLevel(Map<String, List<Change>> changesByProfile, Set<String> allProfiles) {
        Map<FoldKey, Accumulator> folded = new LinkedHashMap<>();

        for (Map.Entry<String, List<Change>> entry : changesByProfile.entrySet()) {
            String profile = entry.getKey();
            Map<FoldKey, Integer> seen = new HashMap<>();

            for (Change change : entry.getValue()) {
                FoldKey base = FoldKey.of(change, 0);
                int occurrence = seen.merge(base, 1, Integer::sum) - 1;
                FoldKey key = base.withOccurrence(occurrence);

                Accumulator acc = folded.computeIfAbsent(key, k -> new Accumulator(change));
                acc.profiles.add(profile);
                acc.childrenByProfile.put(profile, change.children());
            }
        }

        List<Change> result = new ArrayList<>(folded.size());
        for (Accumulator acc : folded.values()) {
            List<Change> children = acc.childrenByProfile.values().stream().allMatch(List::isEmpty)
                    ? List.of()
                    : mergeLevel(acc.childrenByProfile, allProfiles);
            Set<String> profiles = acc.profiles.equals(allProfiles) ? Set.of() : acc.profiles;
            result.add(acc.first.withChildren(children).withApplicableProfiles(profiles));
        }

        result.sort(BY_LINE);
        return result;
    }
}
