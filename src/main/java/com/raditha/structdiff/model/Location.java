package com.raditha.structdiff.model;

import org.jspecify.annotations.Nullable;

/**
 * Position of a changed element in one version of a file.
 *
 * @param file  Path of the file the element lives in, if known
 * @param range Span of the element
 */
public record Location(@Nullable String file, Range range) {

    public static Location of(@Nullable String file, Range range) {
        return new Location(file, range);
    }

    public int startLine() {
        return range.startLine();
    }

    public int endLine() {
        return range.endLine();
    }

    /**
     * Format as "Foo.java:L12-20", or just the range when no file is attached.
     */
    public String toDisplayString() {
        return file == null ? range.toDisplayString() : file + ":" + range.toDisplayString();
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
