package com.raditha.structdiff.similarity;

import com.raditha.structdiff.model.NodeKind;
import com.raditha.structdiff.model.SyntaxNode;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes identity keys and similarity scores for syntax nodes.
 * Stateless and safe to share between threads.
 */
public class SignatureHasher {

    private final SimilarityWeights weights;
    private final ChildKeySimilarity childKeySimilarity;
    private final TextSimilarity textSimilarity;

    public SignatureHasher() {
        this(SimilarityWeights.balanced());
    }

    public SignatureHasher(SimilarityWeights weights) {
        this.weights = weights;
        this.childKeySimilarity = new ChildKeySimilarity(this);
        this.textSimilarity = new TextSimilarity();
    }

    /**
     * Identity key of a node: kind and name, plus the parameter types for methods so
     * that overloads get distinct keys.
     */
    public IdentityKey identityKey(SyntaxNode node) {
        String parameters = node.kind() == NodeKind.METHOD ? parameterSignature(node.signature()) : null;
        return new IdentityKey(node.kind(), node.name(), parameters);
    }

    /**
     * Similarity of two nodes in [0, 1], combining shared child identity keys and the
     * textual overlap of their content. Used only when identity keys do not match.
     */
    public double similarity(SyntaxNode a, SyntaxNode b) {
        double textScore = textSimilarity.calculate(contentTokens(a), contentTokens(b));
        if (!a.hasChildren() && !b.hasChildren()) {
            return textScore;
        }
        double childScore = childKeySimilarity.calculate(a, b);
        return weights.combine(childScore, textScore);
    }

    /**
     * Extract the normalized parameter list "(int,String)" from a signature such as
     * "public int add(int a, String b)". Returns "()" when the signature carries no list.
     */
    static String parameterSignature(@Nullable String signature) {
        if (signature == null) {
            return "()";
        }
        int open = signature.indexOf('(');
        if (open < 0) {
            return "()";
        }
        int depth = 0;
        int close = -1;
        for (int i = open; i < signature.length(); i++) {
            char c = signature.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    close = i;
                    break;
                }
            }
        }
        String list = close < 0 ? signature.substring(open) : signature.substring(open, close + 1);
        return list.replaceAll("\\s+", "");
    }

    /**
     * Tokens of the content that identifies a node independent of its own name:
     * the children's raw text for containers, the raw text minus the name token for leaves.
     */
    List<String> contentTokens(SyntaxNode node) {
        if (node.hasChildren()) {
            List<String> tokens = new ArrayList<>();
            for (SyntaxNode child : node.children()) {
                tokens.addAll(TextSimilarity.tokenize(child.rawText()));
            }
            return tokens;
        }

        List<String> tokens = new ArrayList<>(TextSimilarity.tokenize(node.rawText()));
        if (node.name() != null) {
            tokens.remove(node.name());
        }
        return tokens;
    }
}
