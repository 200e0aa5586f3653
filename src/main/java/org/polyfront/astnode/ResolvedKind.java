package org.polyfront.astnode;

/**
 * How an identifier was classified by scope resolution.
 */
public enum ResolvedKind {
    // Block-scoped binding, or a function-scoped one found in the function's var set
    LOCAL,
    PARAM,
    GLOBAL,
    IMPORTED,
    NOT_RESOLVED
}
