package com.raditha.structdiff.model;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Immutable structural node of a parsed source file.
 * Children are kept in source order.
 *
 * @param kind         Structural kind of the node
 * @param name         Declared name; statements and some other nodes have none
 * @param signature    Summary of modifiers and parameters, used to tell overloads apart
 * @param range        Span of the node in its source
 * @param rawText      Text of the node as compiled under the active symbols: the slice covered by
 *                     {@code range} without directive lines and inactive lines. Compared for equality.
 * @param children     Structural children in source order
 * @param capabilities Names of the supertypes a type declares (empty for non-types)
 * @param sourceText   Exact slice of the caller's text covered by {@code range}, directives included.
 *                     The same under every profile; reported as change content.
 */
public record SyntaxNode(
        NodeKind kind,
        @Nullable String name,
        @Nullable String signature,
        Range range,
        String rawText,
        List<SyntaxNode> children,
        List<String> capabilities,
        String sourceText) {

    public SyntaxNode {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(range, "range");
        rawText = rawText == null ? "" : rawText;
        children = children == null ? List.of() : List.copyOf(children);
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        sourceText = sourceText == null ? rawText : sourceText;
    }

    /**
     * Create a node whose source text is its raw text, as for sources without directives.
     */
    public SyntaxNode(NodeKind kind, @Nullable String name, @Nullable String signature, Range range,
            String rawText, List<SyntaxNode> children, List<String> capabilities) {
        this(kind, name, signature, range, rawText, children, capabilities, rawText);
    }

    /**
     * Create a node without declared capabilities.
     */
    public static SyntaxNode of(NodeKind kind, @Nullable String name, @Nullable String signature,
            Range range, String rawText, List<SyntaxNode> children) {
        return new SyntaxNode(kind, name, signature, range, rawText, children, List.of());
    }

    /**
     * Create a leaf node.
     */
    public static SyntaxNode leaf(NodeKind kind, @Nullable String name, Range range, String rawText) {
        return new SyntaxNode(kind, name, null, range, rawText, List.of(), List.of());
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Name used in paths and log output; falls back to the kind for unnamed nodes.
     */
    public String displayName() {
        return name != null ? name : kind.name().toLowerCase();
    }

    @Override
    public String toString() {
        return kind + " " + displayName() + " " + range;
    }
}
