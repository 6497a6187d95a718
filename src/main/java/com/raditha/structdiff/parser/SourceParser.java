package com.raditha.structdiff.parser;

import com.raditha.structdiff.model.SyntaxNode;

import java.util.Set;

/**
 * Turns source text into a syntax tree.
 * <p>
 * Implementations must be deterministic for identical text and symbols, and safe to call
 * from several threads at once.
 */
public interface SourceParser {

    /**
     * Parse {@code text} with the given preprocessor symbols active.
     *
     * @throws SourceParseException when the text cannot be parsed under these symbols
     */
    SyntaxNode parse(String text, Set<String> activeSymbols) throws SourceParseException;
}
