package com.raditha.structdiff.similarity;

import com.raditha.structdiff.model.NodeKind;
import org.jspecify.annotations.Nullable;

/**
 * Identity of a structural element across two versions of a tree.
 * Two nodes with equal keys are taken to be the same element, possibly modified.
 *
 * @param kind               Node kind
 * @param name               Declared name, null for unnamed nodes
 * @param parameterSignature Normalized parameter types for methods, null otherwise
 */
public record IdentityKey(
        NodeKind kind,
        @Nullable String name,
        @Nullable String parameterSignature) {

    @Override
    public String toString() {
        String base = kind + ":" + (name != null ? name : "<unnamed>");
        return parameterSignature != null ? base + parameterSignature : base;
    }
}
