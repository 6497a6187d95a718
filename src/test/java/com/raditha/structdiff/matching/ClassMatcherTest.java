package com.raditha.structdiff.matching;

import com.raditha.structdiff.model.NodeKind;
import com.raditha.structdiff.model.SyntaxNode;
import com.raditha.structdiff.parser.JavaSourceParser;
import com.raditha.structdiff.parser.SourceParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ClassMatcherTest {

    private static final String MATH_HELPER = """
            package demo;

            public class MathHelper {
                public int add(int a, int b) {
                    return a + b;
                }

                public int subtract(int a, int b) {
                    return a - b;
                }
            }
            """;

    private static final String CALCULATOR = """
            package demo;

            public class Logger {
                public void log(String message) {
                    System.out.println(message);
                }
            }

            public class Calculator {
                public int add(int a, int b) {
                    return a + b;
                }

                public int subtract(int a, int b) {
                    return a - b;
                }
            }
            """;

    private ClassMatcher matcher;
    private JavaSourceParser parser;

    @BeforeEach
    void setUp() {
        matcher = new ClassMatcher();
        parser = new JavaSourceParser();
    }

    @Test
    void testAutoFallsBackToSimilarityOnRename() throws SourceParseException {
        SyntaxNode source = firstType(MATH_HELPER);
        SyntaxNode target = parser.parse(CALCULATOR, Set.of());

        Optional<ClassMatch> match = matcher.findMatch(source, target, ClassMatchStrategy.AUTO,
                ClassMatchOptions.forSimilarity(0.7));

        assertTrue(match.isPresent());
        assertEquals("Calculator", match.get().node().name());
        assertEquals(ClassMatchStrategy.SIMILARITY, match.get().strategyUsed());
        assertTrue(match.get().similarity() >= 0.9);
    }

    @Test
    void testExactNameFailsOnRename() throws SourceParseException {
        SyntaxNode source = firstType(MATH_HELPER);
        SyntaxNode target = parser.parse(CALCULATOR, Set.of());

        assertTrue(matcher.findMatch(source, target, ClassMatchStrategy.EXACT_NAME, ClassMatchOptions.defaults())
                .isEmpty());
    }

    @Test
    void testAutoPrefersExactName() throws SourceParseException {
        SyntaxNode source = firstType(MATH_HELPER);
        SyntaxNode target = parser.parse(MATH_HELPER.replace("a - b", "b - a"), Set.of());

        ClassMatch match = matcher.findMatch(source, target, ClassMatchStrategy.AUTO, ClassMatchOptions.defaults())
                .orElseThrow();

        assertEquals(ClassMatchStrategy.EXACT_NAME, match.strategyUsed());
        assertEquals("MathHelper", match.path());
        assertTrue(match.isExactMatch());
    }

    @Test
    void testPerfectThresholdDegradesAutoToExactName() throws SourceParseException {
        SyntaxNode source = firstType(MATH_HELPER);
        SyntaxNode target = parser.parse(CALCULATOR.replace("a - b", "b - a"), Set.of());

        assertTrue(matcher.findMatch(source, target, ClassMatchStrategy.AUTO, ClassMatchOptions.forSimilarity(1.0))
                .isEmpty());
    }

    @Test
    void testInterfaceStrategy() throws SourceParseException {
        SyntaxNode source = firstType(MATH_HELPER);
        SyntaxNode target = parser.parse("""
                import java.io.Serializable;

                class Plain {
                }

                class Sortable implements Comparable<Sortable> {
                    public int compareTo(Sortable other) {
                        return 0;
                    }
                }

                class Stored extends Base implements java.io.Serializable {
                }
                """, Set.of());

        assertEquals("Sortable", matcher.findMatch(source, target, ClassMatchStrategy.INTERFACE,
                ClassMatchOptions.forInterface("Comparable")).orElseThrow().node().name());
        assertEquals("Stored", matcher.findMatch(source, target, ClassMatchStrategy.INTERFACE,
                ClassMatchOptions.forInterface("Serializable")).orElseThrow().node().name());
        assertEquals("Stored", matcher.findMatch(source, target, ClassMatchStrategy.INTERFACE,
                ClassMatchOptions.forInterface("Base")).orElseThrow().node().name());
        assertTrue(matcher.findMatch(source, target, ClassMatchStrategy.INTERFACE,
                ClassMatchOptions.forInterface("Runnable")).isEmpty());
        assertTrue(matcher.findMatch(source, target, ClassMatchStrategy.INTERFACE,
                ClassMatchOptions.defaults()).isEmpty());
    }

    @Test
    void testNestedTypesOnlyWhenRequested() throws SourceParseException {
        SyntaxNode source = firstType(MATH_HELPER);
        SyntaxNode target = parser.parse("""
                public class Outer {
                    static class MathHelper {
                        int add(int a, int b) {
                            return a + b;
                        }
                    }
                }
                """, Set.of());

        assertTrue(matcher.findMatch(source, target, ClassMatchStrategy.EXACT_NAME, ClassMatchOptions.defaults())
                .isEmpty());

        ClassMatch nested = matcher.findMatch(source, target, ClassMatchStrategy.EXACT_NAME,
                ClassMatchOptions.defaults().withNestedTypes(true)).orElseThrow();
        assertEquals("Outer.MathHelper", nested.path());
    }

    @Test
    void testSimilarityBelowThresholdFindsNothing() throws SourceParseException {
        SyntaxNode source = firstType(MATH_HELPER);
        SyntaxNode target = parser.parse("""
                public class Unrelated {
                    private String name;

                    public String getName() {
                        return name;
                    }
                }
                """, Set.of());

        assertTrue(matcher.findMatch(source, target, ClassMatchStrategy.SIMILARITY, ClassMatchOptions.defaults())
                .isEmpty());
    }

    @Test
    void testDeclaresCapability() {
        SyntaxNode type = new SyntaxNode(NodeKind.TYPE, "T", null,
                new com.raditha.structdiff.model.Range(1, 1, 1, 1), "", java.util.List.of(),
                java.util.List.of("java.util.List<String>", "Handler"));

        assertTrue(ClassMatcher.declaresCapability(type, "List"));
        assertTrue(ClassMatcher.declaresCapability(type, "Handler"));
        assertFalse(ClassMatcher.declaresCapability(type, "Hand"));
    }

    @Test
    void testInvalidThresholdRejected() {
        assertThrows(IllegalArgumentException.class, () -> ClassMatchOptions.forSimilarity(1.5));
    }

    private SyntaxNode firstType(String text) throws SourceParseException {
        SyntaxNode root = parser.parse(text, Set.of());
        return matcher.collectTypes(root, false).get(0).node();
    }
}
