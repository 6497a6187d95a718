package com.raditha.structdiff.profile;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DirectiveDetectorTest {

    @Test
    void testRecognizesDirectives() {
        assertTrue(DirectiveDetector.hasConditionalDirectives("class A {\n#if JAVA_17\n}\n#endif\n"));
        assertTrue(DirectiveDetector.hasConditionalDirectives("    #  endif"));
        assertTrue(DirectiveDetector.hasConditionalDirectives("#IF X"));
        assertTrue(DirectiveDetector.hasConditionalDirectives("#define FEATURE"));
        assertTrue(DirectiveDetector.hasConditionalDirectives("a\n#else"));
    }

    @Test
    void testIgnoresLookalikes() {
        assertFalse(DirectiveDetector.hasConditionalDirectives("#ifdef X"));
        assertFalse(DirectiveDetector.hasConditionalDirectives("#include <stdio.h>"));
        assertFalse(DirectiveDetector.hasConditionalDirectives("// #if X"));
        assertFalse(DirectiveDetector.hasConditionalDirectives("int a = b; # if"));
        assertFalse(DirectiveDetector.hasConditionalDirectives("class A {}"));
        assertFalse(DirectiveDetector.hasConditionalDirectives(null));
    }
}
