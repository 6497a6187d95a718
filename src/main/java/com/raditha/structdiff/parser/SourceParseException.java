package com.raditha.structdiff.parser;

import java.util.List;

/**
 * Source text could not be turned into a syntax tree.
 */
public class SourceParseException extends Exception {

    private final transient List<String> problems;

    public SourceParseException(String message) {
        this(message, List.of(message));
    }

    public SourceParseException(String message, List<String> problems) {
        super(message);
        this.problems = List.copyOf(problems);
    }

    public SourceParseException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    /**
     * Individual problems reported by the parser or preprocessor.
     */
    public List<String> getProblems() {
        return problems;
    }
}
