package com.raditha.structdiff.parser;

import com.raditha.structdiff.model.NodeKind;
import com.raditha.structdiff.model.SyntaxNode;
import com.raditha.structdiff.profile.ProfileResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JavaSourceParserTest {

    private static final String SAMPLE = """
            package com.example;

            import java.util.List;
            import static java.util.Objects.requireNonNull;

            public class Sample implements Runnable, Comparable<Sample> {
                private int count;

                static {
                    System.out.println("init");
                }

                public Sample(int count) {
                    this.count = count;
                }

                public void run() {
                    count++;
                }

                public int compareTo(Sample other) {
                    return Integer.compare(count, other.count);
                }

                enum Mode { FAST, SLOW }

                record Point(int x, int y) {}
            }
            """;

    private static final String GATED = """
            public class Feature {
                public void common() {
                }
            #if JAVA_17_OR_LATER
                public void modern() {
                }
            #else
                public void legacy() {
                }
            #endif
            }
            """;

    private JavaSourceParser parser;

    @BeforeEach
    void setUp() {
        parser = new JavaSourceParser();
    }

    @Test
    void testTreeShape() throws SourceParseException {
        SyntaxNode root = parser.parse(SAMPLE, Set.of());

        assertEquals(NodeKind.FILE, root.kind());
        assertEquals("Sample", root.name());
        assertEquals(SAMPLE, root.rawText());
        assertEquals(3, root.children().size());
        assertEquals("import java.util.List", root.children().get(0).name());
        assertEquals("import static java.util.Objects.requireNonNull", root.children().get(1).name());

        SyntaxNode namespace = root.children().get(2);
        assertEquals(NodeKind.NAMESPACE, namespace.kind());
        assertEquals("com.example", namespace.name());

        SyntaxNode sample = namespace.children().get(0);
        assertEquals(NodeKind.TYPE, sample.kind());
        assertTrue(sample.capabilities().containsAll(List.of("Runnable", "Comparable<Sample>", "Comparable")));

        List<String> members = sample.children().stream().map(SyntaxNode::displayName).toList();
        assertEquals(List.of("count", "<clinit>", "Sample", "run", "compareTo", "Mode", "Point"), members);

        SyntaxNode compareTo = sample.children().get(4);
        assertEquals(NodeKind.METHOD, compareTo.kind());
        assertEquals("public int compareTo(Sample)", compareTo.signature());
        assertFalse(compareTo.hasChildren());

        SyntaxNode mode = sample.children().get(5);
        assertEquals(List.of("FAST", "SLOW"), mode.children().stream().map(SyntaxNode::name).toList());
        assertEquals(NodeKind.FIELD, mode.children().get(0).kind());

        SyntaxNode point = sample.children().get(6);
        assertEquals(NodeKind.PROPERTY, point.children().get(0).kind());
        assertEquals("y", point.children().get(1).name());
    }

    @Test
    void testRawTextIsExactSlice() throws SourceParseException {
        SyntaxNode root = parser.parse(SAMPLE, Set.of());
        SyntaxNode sample = root.children().get(2).children().get(0);
        SyntaxNode run = sample.children().get(3);

        assertEquals("public void run() {\n        count++;\n    }", run.rawText());
        assertEquals(17, run.range().startLine());
        assertEquals("private int count;", sample.children().get(0).rawText());
        assertTrue(sample.rawText().startsWith("public class Sample"));
        assertTrue(sample.rawText().endsWith("}"));
    }

    @Test
    void testProfilesSelectMembers() throws SourceParseException {
        ProfileResolver resolver = new ProfileResolver();

        SyntaxNode modern = parser.parse(GATED, resolver.resolve("java17")).children().get(0);
        SyntaxNode legacy = parser.parse(GATED, resolver.resolve("java11")).children().get(0);

        assertEquals(List.of("common", "modern"), modern.children().stream().map(SyntaxNode::name).toList());
        assertEquals(List.of("common", "legacy"), legacy.children().stream().map(SyntaxNode::name).toList());
        assertEquals(modern.sourceText(), legacy.sourceText());
        assertTrue(modern.sourceText().contains("#if JAVA_17_OR_LATER"));
        assertEquals(5, modern.children().get(1).range().startLine());
    }

    @Test
    void testRawTextLeavesOutInactiveLines() throws SourceParseException {
        ProfileResolver resolver = new ProfileResolver();

        SyntaxNode modern = parser.parse(GATED, resolver.resolve("java17")).children().get(0);
        SyntaxNode legacy = parser.parse(GATED, resolver.resolve("java11")).children().get(0);

        assertEquals("""
                public class Feature {
                    public void common() {
                    }
                    public void modern() {
                    }
                }""", modern.rawText());
        assertFalse(legacy.rawText().contains("modern"));
        assertFalse(legacy.rawText().contains("#"));
        assertEquals("public void legacy() {\n    }", legacy.children().get(1).rawText());
    }

    @Test
    void testRawTextEqualsSourceTextWithoutDirectives() throws SourceParseException {
        SyntaxNode root = parser.parse(SAMPLE, Set.of());

        assertEquals(root.sourceText(), root.rawText());
        assertEquals(SAMPLE, root.sourceText());
    }

    @Test
    void testSyntaxErrorReported() {
        SourceParseException e = assertThrows(SourceParseException.class,
                () -> parser.parse("public class {", Set.of()));

        assertFalse(e.getProblems().isEmpty());
    }

    @Test
    void testUnbalancedDirectiveReported() {
        assertThrows(SourceParseException.class,
                () -> parser.parse("class A {\n#if JAVA_17\n}\n", Set.of()));
    }

    @Test
    void testFileNameAndLanguageLevel() throws SourceParseException {
        SyntaxNode root = parser.withFileName("Empty.java").parse("class A {}", Set.of());

        assertEquals("Empty.java", root.name());
        assertEquals(1, root.children().size());
        assertThrows(IllegalArgumentException.class, () -> JavaSourceParser.forLanguageLevel("JAVA_99"));
        assertEquals(JavaSourceParser.DEFAULT_LANGUAGE_LEVEL, JavaSourceParser.forLanguageLevel("java_17").getLanguageLevel());
    }
}
