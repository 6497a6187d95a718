package com.raditha.structdiff.comparison;

import org.jspecify.annotations.Nullable;

/**
 * Cooperative cancellation signal shared between a caller and a running comparison.
 * The comparator polls it between sibling groups, so work inside one group runs to its end.
 */
public final class CancellationToken {

    /**
     * A token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken(false, null);

    private final boolean cancellable;
    private final @Nullable CancellationToken parent;
    private volatile boolean cancelled;

    public CancellationToken() {
        this(true, null);
    }

    private CancellationToken(boolean cancellable, @Nullable CancellationToken parent) {
        this.cancellable = cancellable;
        this.parent = parent;
    }

    /**
     * A token that is cancelled when this one is, and can also be cancelled on its own
     * without affecting this one.
     */
    public CancellationToken newLinkedToken() {
        return new CancellationToken(true, this);
    }

    /**
     * Request cancellation. Idempotent.
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancellationRequested() {
        return cancelled || (parent != null && parent.isCancellationRequested());
    }

    /**
     * @throws ComparisonCancelledException if cancellation was requested
     */
    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new ComparisonCancelledException();
        }
    }
}
