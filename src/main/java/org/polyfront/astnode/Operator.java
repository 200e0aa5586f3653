package org.polyfront.astnode;

/**
 * Arithmetic, bitwise, comparison and logical operators shared by all languages.
 */
public enum Operator {
    PLUS, MINUS, MULT, DIV, MOD, POW,
    LSL, LSR, ASR,
    BIT_OR, BIT_XOR, BIT_AND, BIT_NOT,
    AND, OR, NOT, NULLISH,
    EQ, NOT_EQ, PHYS_EQ, NOT_PHYS_EQ,
    LT, LT_E, GT, GT_E,
    CONCAT
}
