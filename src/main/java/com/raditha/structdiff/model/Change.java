package com.raditha.structdiff.model;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A single element-level change between two versions of a source file.
 * Nested changes are owned by their parent through {@code children}; unchanged
 * subtrees are never represented.
 *
 * @param type               What happened to the element
 * @param kind               Kind of the element
 * @param name               Element name (the new name for renames)
 * @param oldName            Previous name, set only for {@link ChangeType#RENAMED}
 * @param oldLocation        Position in the old version, absent for additions
 * @param newLocation        Position in the new version, absent for removals
 * @param oldContent         Old source text, absent for additions or when content is omitted
 * @param newContent         New source text, absent for removals or when content is omitted
 * @param children           Changes nested inside this element
 * @param applicableProfiles Profiles under which this change holds; empty means all analyzed profiles
 */
public record Change(
        ChangeType type,
        ChangeKind kind,
        @Nullable String name,
        @Nullable String oldName,
        @Nullable Location oldLocation,
        @Nullable Location newLocation,
        @Nullable String oldContent,
        @Nullable String newContent,
        List<Change> children,
        Set<String> applicableProfiles) {

    public Change {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(kind, "kind");
        children = children == null ? List.of() : List.copyOf(children);
        applicableProfiles = applicableProfiles == null || applicableProfiles.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(applicableProfiles));
    }

    public static Change added(ChangeKind kind, @Nullable String name, Location newLocation,
            @Nullable String newContent) {
        return new Change(ChangeType.ADDED, kind, name, null, null, newLocation, null, newContent,
                List.of(), Set.of());
    }

    public static Change removed(ChangeKind kind, @Nullable String name, Location oldLocation,
            @Nullable String oldContent) {
        return new Change(ChangeType.REMOVED, kind, name, null, oldLocation, null, oldContent, null,
                List.of(), Set.of());
    }

    public Change withChildren(List<Change> newChildren) {
        return new Change(type, kind, name, oldName, oldLocation, newLocation, oldContent, newContent,
                newChildren, applicableProfiles);
    }

    public Change withApplicableProfiles(Set<String> profiles) {
        return new Change(type, kind, name, oldName, oldLocation, newLocation, oldContent, newContent,
                children, profiles);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * True when this change holds under every analyzed profile.
     */
    public boolean isUniversal() {
        return applicableProfiles.isEmpty();
    }

    /**
     * First line of the element in the new version, or in the old one for removals.
     */
    public int sortLine() {
        if (newLocation != null) {
            return newLocation.startLine();
        }
        return oldLocation != null ? oldLocation.startLine() : 0;
    }

    /**
     * Format as "MODIFIED METHOD add [L4-6]".
     */
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder();
        sb.append(type).append(' ').append(kind).append(' ');
        if (oldName != null) {
            sb.append(oldName).append(" -> ");
        }
        sb.append(name != null ? name : "<unnamed>");
        Location location = newLocation != null ? newLocation : oldLocation;
        if (location != null) {
            sb.append(" [").append(location.toDisplayString()).append(']');
        }
        if (!applicableProfiles.isEmpty()) {
            sb.append(' ').append(applicableProfiles);
        }
        return sb.toString();
    }
}
