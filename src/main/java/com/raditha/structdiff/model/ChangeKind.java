package com.raditha.structdiff.model;

/**
 * Kind of code element a {@link Change} refers to.
 * Mirrors {@link NodeKind} plus {@link #LINE}, which only line-based diffing produces.
 */
public enum ChangeKind {
    FILE,
    NAMESPACE,
    TYPE,
    METHOD,
    PROPERTY,
    FIELD,
    STATEMENT,
    OTHER,
    LINE;

    public static ChangeKind from(NodeKind kind) {
        return switch (kind) {
            case FILE -> FILE;
            case NAMESPACE -> NAMESPACE;
            case TYPE -> TYPE;
            case METHOD -> METHOD;
            case PROPERTY -> PROPERTY;
            case FIELD -> FIELD;
            case STATEMENT -> STATEMENT;
            case OTHER -> OTHER;
        };
    }
}
