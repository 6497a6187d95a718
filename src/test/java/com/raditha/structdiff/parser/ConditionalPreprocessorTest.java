package com.raditha.structdiff.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConditionalPreprocessorTest {

    private ConditionalPreprocessor preprocessor;

    @BeforeEach
    void setUp() {
        preprocessor = new ConditionalPreprocessor();
    }

    @Test
    void testSelectsActiveBranchAndKeepsLines() throws SourceParseException {
        String text = "#if A\nx\n#else\ny\n#endif\n";

        assertEquals("\nx\n\n\n\n", preprocessor.process(text, Set.of("A")));
        assertEquals("\n\n\ny\n\n", preprocessor.process(text, Set.of()));
    }

    @Test
    void testReportsBlankedLines() throws SourceParseException {
        String text = "keep\n#if A\nx\n#else\ny\n#endif\ntail\n";

        ConditionalPreprocessor.Result result = preprocessor.preprocess(text, Set.of("A"));

        assertEquals("keep\n\nx\n\n\n\ntail\n", result.text());
        assertEquals("{2, 4, 5, 6}", result.blankedLines().toString());
    }

    @Test
    void testElifChain() throws SourceParseException {
        String text = "#if A\na\n#elif B\nb\n#elif C\nc\n#else\nd\n#endif";

        assertEquals("b", preprocessor.process(text, Set.of("B", "C")).strip());
        assertEquals("a", preprocessor.process(text, Set.of("A", "B")).strip());
        assertEquals("d", preprocessor.process(text, Set.of()).strip());
    }

    @Test
    void testNestedBlockInsideInactiveParent() throws SourceParseException {
        String text = "#if A\n#if true\ninner\n#endif\n#else\nouter\n#endif\n";

        assertEquals("outer", preprocessor.process(text, Set.of()).strip());
        assertEquals("inner", preprocessor.process(text, Set.of("A")).strip());
    }

    @Test
    void testDefineAndUndef() throws SourceParseException {
        String text = "#define FEATURE\n#if FEATURE\non\n#endif\n#undef FEATURE\n#if FEATURE\nstill\n#endif\n";

        assertEquals("on", preprocessor.process(text, Set.of()).strip());
    }

    @Test
    void testDefineInInactiveBlockIgnored() throws SourceParseException {
        String text = "#if false\n#define FEATURE\n#endif\n#if FEATURE\non\n#endif\n";

        assertEquals("", preprocessor.process(text, Set.of()).strip());
    }

    @Test
    void testWindowsLineEndingsPreserved() throws SourceParseException {
        String text = "a\r\n#if A\r\nb\r\n#endif\r\nc";

        assertEquals("a\r\n\r\n\r\n\r\nc", preprocessor.process(text, Set.of()));
    }

    @Test
    void testExpressions() throws SourceParseException {
        Set<String> symbols = Set.of("A", "C");

        assertTrue(ConditionalPreprocessor.evaluate("A && !B || C", symbols, 1));
        assertTrue(ConditionalPreprocessor.evaluate("(A || B) && C", symbols, 1));
        assertFalse(ConditionalPreprocessor.evaluate("A && (B || !C)", symbols, 1));
        assertTrue(ConditionalPreprocessor.evaluate("A == C", symbols, 1));
        assertTrue(ConditionalPreprocessor.evaluate("A != B", symbols, 1));
        assertTrue(ConditionalPreprocessor.evaluate("!B == A", symbols, 1));
        assertFalse(ConditionalPreprocessor.evaluate("false", symbols, 1));
        assertTrue(ConditionalPreprocessor.evaluate(" true ", symbols, 1));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "#endif\n",
            "#if A\nx\n",
            "#if A\n#else\n#else\n#endif\n",
            "#if A\n#else\n#elif B\n#endif\n",
            "#if A &&\n#endif\n",
            "#if\n#endif\n",
            "#if (A\n#endif\n",
            "#if A + B\n#endif\n",
            "#define 1X\n"
    })
    void testMalformedInputRejected(String text) {
        SourceParseException e = assertThrows(SourceParseException.class, () -> preprocessor.process(text, Set.of()));
        assertTrue(e.getMessage().startsWith("Line "));
        assertFalse(e.getProblems().isEmpty());
    }
}
