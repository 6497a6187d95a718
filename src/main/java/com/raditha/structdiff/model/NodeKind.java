package com.raditha.structdiff.model;

/**
 * Kind of a structural syntax node as produced by a parser collaborator.
 */
public enum NodeKind {
    FILE,
    NAMESPACE,
    TYPE,
    METHOD,
    PROPERTY,
    FIELD,
    STATEMENT,
    OTHER
}
