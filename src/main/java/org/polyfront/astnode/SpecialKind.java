package org.polyfront.astnode;

/**
 * Built-in forms that are not ordinary identifiers: language keywords used as
 * values, operators, and the pseudo-identifiers of the host environment.
 */
public enum SpecialKind {
    THIS, SUPER, NEW, NEW_TARGET,
    // Host environment pseudo-identifiers, shadowable by local bindings
    EVAL, UNDEFINED, REQUIRE, EXPORTS, MODULE, DEFINE, ARGUMENTS,
    TYPEOF, INSTANCEOF, IN, SIZEOF, DELETE, VOID,
    SPREAD, YIELD, YIELD_STAR, AWAIT,
    USE_STRICT, ENCODED_STRING,
    OPERATOR,
    INCR_PREFIX, INCR_POSTFIX, DECR_PREFIX, DECR_POSTFIX
}
