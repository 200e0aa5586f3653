package org.polyfront.astnode;

/**
 * Attributes and properties expressed by a keyword in the source.
 */
public enum KeywordAttribute {
    // storage and mutability
    STATIC, EXTERN, CONST, LET, VAR, MUTABLE, LAZY,
    // visibility and inheritance
    PRIVATE, PROTECTED, ABSTRACT, FINAL, SEALED, OVERRIDE, IMPLICIT,
    CASE_CLASS, PACKAGE_OBJECT,
    // function properties
    GETTER, SETTER, GENERATOR, ASYNC,
    // JVM member modifiers
    PUBLIC, VOLATILE, TRANSIENT, NATIVE, SYNCHRONIZED, STRICTFP, DEFAULT,
    // a declared exception, carried with its type in AttributeNode.name
    THROWS
}
