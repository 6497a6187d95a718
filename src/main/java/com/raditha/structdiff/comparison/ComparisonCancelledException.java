package com.raditha.structdiff.comparison;

import java.util.concurrent.CancellationException;

/**
 * Thrown when a comparison is aborted through its {@link CancellationToken}.
 * Whatever was computed before the abort is discarded.
 */
public class ComparisonCancelledException extends CancellationException {

    public ComparisonCancelledException() {
        super("Comparison was cancelled");
    }

    public ComparisonCancelledException(String message) {
        super(message);
    }
}
