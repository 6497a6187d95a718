package com.raditha.structdiff.variant;

import com.raditha.structdiff.model.Change;
import com.raditha.structdiff.model.Changes;
import com.raditha.structdiff.model.DiffStats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of comparing two source versions under several compilation profiles.
 *
 * @param changes          Merged change hierarchy; each change lists the profiles it holds under,
 *                         or none when it holds under all analyzed profiles
 * @param analyzedProfiles Profiles whose comparison ran, in the order requested; empty for a
 *                         single-variant run
 * @param failedProfiles   Profiles skipped because a version failed to parse, with the reason
 * @param multiVariant     False when the sources carry no conditional directives and one run sufficed
 */
public record MultiVariantResult(
        List<Change> changes,
        List<String> analyzedProfiles,
        Map<String, String> failedProfiles,
        boolean multiVariant) {

    public MultiVariantResult {
        changes = List.copyOf(changes);
        analyzedProfiles = List.copyOf(analyzedProfiles);
        failedProfiles = Collections.unmodifiableMap(new LinkedHashMap<>(failedProfiles));
    }

    public static MultiVariantResult singleVariant(List<Change> changes) {
        return new MultiVariantResult(changes, List.of(), Map.of(), false);
    }

    public boolean hasChanges() {
        return !changes.isEmpty();
    }

    public DiffStats stats() {
        return DiffStats.of(changes);
    }

    /**
     * Lossy flat view of {@link #changes()}.
     */
    public List<Change> flatten() {
        return Changes.flatten(changes);
    }

    /**
     * The changes that hold under one profile, hierarchy kept.
     */
    public List<Change> changesFor(String profile) {
        return filter(changes, profile);
    }

    private static List<Change> filter(List<Change> changes, String profile) {
        List<Change> result = new ArrayList<>();
        for (Change change : changes) {
            if (change.isUniversal() || change.applicableProfiles().contains(profile)) {
                result.add(change.withChildren(filter(change.children(), profile)));
            }
        }
        return result;
    }

    /**
     * One-line summary for logs.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(stats());
        if (multiVariant) {
            sb.append(" across ").append(analyzedProfiles.size()).append(" profile(s) ").append(analyzedProfiles);
        } else {
            sb.append(" (single variant)");
        }
        if (!failedProfiles.isEmpty()) {
            sb.append(", skipped ").append(failedProfiles.keySet());
        }
        return sb.toString();
    }
}
