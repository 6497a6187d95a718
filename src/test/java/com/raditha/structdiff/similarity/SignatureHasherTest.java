package com.raditha.structdiff.similarity;

import com.raditha.structdiff.model.NodeKind;
import com.raditha.structdiff.model.SyntaxNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.raditha.structdiff.TreeFixtures.field;
import static com.raditha.structdiff.TreeFixtures.method;
import static com.raditha.structdiff.TreeFixtures.type;
import static org.junit.jupiter.api.Assertions.*;

class SignatureHasherTest {

    private SignatureHasher hasher;

    @BeforeEach
    void setUp() {
        hasher = new SignatureHasher();
    }

    @Test
    void testOverloadsGetDistinctKeys() {
        IdentityKey intKey = hasher.identityKey(method("print", "int value", 1, "out(value);"));
        IdentityKey stringKey = hasher.identityKey(method("print", "String value", 2, "out(value);"));

        assertNotEquals(intKey, stringKey);
        assertEquals("(intvalue)", intKey.parameterSignature());
    }

    @Test
    void testKeyIgnoresBodyAndPosition() {
        IdentityKey before = hasher.identityKey(method("run", "", 3, "a();"));
        IdentityKey after = hasher.identityKey(method("run", "", 30, "b();"));

        assertEquals(before, after);
    }

    @Test
    void testNonMethodKeysHaveNoParameters() {
        IdentityKey key = hasher.identityKey(field("count", 1, "private int count;"));

        assertEquals(NodeKind.FIELD, key.kind());
        assertEquals("count", key.name());
        assertNull(key.parameterSignature());
    }

    @Test
    void testParameterSignatureNormalization() {
        assertEquals("(int,String)", SignatureHasher.parameterSignature("public int add(int , String)"));
        assertEquals("(Map<String,List<Integer>>)",
                SignatureHasher.parameterSignature("void m(Map<String, List<Integer>>) throws IOException"));
        assertEquals("(Function<A,B>)", SignatureHasher.parameterSignature("void m(Function<A, B>) "));
        assertEquals("()", SignatureHasher.parameterSignature("public class Foo"));
        assertEquals("()", SignatureHasher.parameterSignature(null));
    }

    @Test
    void testRenameAloneKeepsFullSimilarity() {
        SyntaxNode add = method("add", "int a, int b", 1, "return a + b;");
        SyntaxNode sum = method("sum", "int a, int b", 1, "return a + b;");

        assertEquals(1.0, hasher.similarity(add, sum), 0.001);
    }

    @Test
    void testContainersCombineChildKeysAndText() {
        SyntaxNode left = type("A", 1, method("x", "", 2, "one();"), method("y", "", 3, "two();"));
        SyntaxNode right = type("B", 1, method("x", "", 2, "one();"), method("z", "", 3, "two();"));

        double score = hasher.similarity(left, right);

        // Jaccard 1/3 on child keys, high text overlap
        assertTrue(score > 0.5, "score was " + score);
        assertTrue(score < 0.9, "score was " + score);
    }

    @Test
    void testUnrelatedLeavesStayBelowRenameThreshold() {
        SyntaxNode a = method("load", "Path path", 1, "return Files.readString(path);");
        SyntaxNode b = method("count", "", 1, "total++;");

        assertTrue(hasher.similarity(a, b) < 0.8);
    }
}
