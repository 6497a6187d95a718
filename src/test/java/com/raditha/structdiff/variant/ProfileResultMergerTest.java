package com.raditha.structdiff.variant;

import com.raditha.structdiff.model.Change;
import com.raditha.structdiff.model.ChangeKind;
import com.raditha.structdiff.model.ChangeType;
import com.raditha.structdiff.model.Location;
import com.raditha.structdiff.model.Range;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProfileResultMergerTest {

    private ProfileResultMerger merger;

    @BeforeEach
    void setUp() {
        merger = new ProfileResultMerger();
    }

    @Test
    void testChangeInEveryProfileIsUniversal() {
        Change shared = added("shared", 5);
        Map<String, List<Change>> input = new LinkedHashMap<>();
        input.put("java11", List.of(shared));
        input.put("java17", List.of(added("shared", 5)));

        List<Change> merged = merger.merge(input);

        assertEquals(1, merged.size());
        assertTrue(merged.get(0).isUniversal());
    }

    @Test
    void testChangeInOneProfileKeepsThatProfile() {
        Map<String, List<Change>> input = new LinkedHashMap<>();
        input.put("java11", List.of(added("shared", 5), added("legacy", 9)));
        input.put("java17", List.of(added("shared", 5)));

        List<Change> merged = merger.merge(input);

        assertEquals(2, merged.size());
        assertTrue(merged.get(0).isUniversal());
        assertEquals("legacy", merged.get(1).name());
        assertEquals(Set.of("java11"), merged.get(1).applicableProfiles());
    }

    @Test
    void testRestrictedRequestOmitsOtherProfilesChanges() {
        Map<String, List<Change>> input = new LinkedHashMap<>();
        input.put("java17", List.of(added("shared", 5)));

        List<Change> merged = merger.merge(input);

        assertTrue(merged.stream().noneMatch(c -> "legacy".equals(c.name())));
    }

    @Test
    void testChildrenMergedUnderFoldedParent() {
        Change parent11 = modified("Feature", 1).withChildren(List.of(added("legacy", 8)));
        Change parent17 = modified("Feature", 1).withChildren(List.of(added("modern", 5)));
        Map<String, List<Change>> input = new LinkedHashMap<>();
        input.put("java11", List.of(parent11));
        input.put("java17", List.of(parent17));

        List<Change> merged = merger.merge(input);

        assertEquals(1, merged.size());
        Change feature = merged.get(0);
        assertTrue(feature.isUniversal());
        assertEquals(2, feature.children().size());
        assertEquals("modern", feature.children().get(0).name());
        assertEquals(Set.of("java17"), feature.children().get(0).applicableProfiles());
        assertEquals("legacy", feature.children().get(1).name());
        assertEquals(Set.of("java11"), feature.children().get(1).applicableProfiles());
    }

    @Test
    void testDifferentContentDoesNotFold() {
        Change a = Change.added(ChangeKind.METHOD, "m", location(3), "void m() { a(); }");
        Change b = Change.added(ChangeKind.METHOD, "m", location(3), "void m() { b(); }");
        Map<String, List<Change>> input = new LinkedHashMap<>();
        input.put("java8", List.of(a));
        input.put("java11", List.of(b));

        List<Change> merged = merger.merge(input);

        assertEquals(2, merged.size());
        assertEquals(Set.of("java8"), merged.get(0).applicableProfiles());
        assertEquals(Set.of("java11"), merged.get(1).applicableProfiles());
    }

    @Test
    void testLocationsStandInForOmittedContent() {
        Change atThree = Change.added(ChangeKind.METHOD, "m", location(3), null);
        Change atSeven = Change.added(ChangeKind.METHOD, "m", location(7), null);
        Map<String, List<Change>> input = new LinkedHashMap<>();
        input.put("java8", List.of(atThree));
        input.put("java11", List.of(atSeven));

        assertEquals(2, merger.merge(input).size());
    }

    @Test
    void testRepeatedIdenticalChangesKeptApart() {
        Change init = Change.added(ChangeKind.OTHER, "<init>", location(4), "{ }");
        Map<String, List<Change>> input = new LinkedHashMap<>();
        input.put("java8", List.of(init, init));
        input.put("java11", List.of(init));

        List<Change> merged = merger.merge(input);

        assertEquals(2, merged.size());
        assertTrue(merged.get(0).isUniversal());
        assertEquals(Set.of("java8"), merged.get(1).applicableProfiles());
    }

    @Test
    void testProfileOrderFollowsCaller() {
        Map<String, List<Change>> input = new LinkedHashMap<>();
        input.put("java21", List.of(added("x", 1)));
        input.put("java8", List.of(added("x", 1)));
        input.put("java11", List.of());

        Change merged = merger.merge(input).get(0);

        assertEquals(List.of("java21", "java8"), List.copyOf(merged.applicableProfiles()));
    }

    private static Change added(String name, int line) {
        return Change.added(ChangeKind.METHOD, name, location(line), "void " + name + "() {}");
    }

    private static Change modified(String name, int line) {
        return new Change(ChangeType.MODIFIED, ChangeKind.TYPE, name, null, location(line), location(line),
                "class " + name + " {}", "class " + name + " { ... }", List.of(), Set.of());
    }

    private static Location location(int line) {
        return Location.of(null, new Range(line, line, 1, 10));
    }
}
