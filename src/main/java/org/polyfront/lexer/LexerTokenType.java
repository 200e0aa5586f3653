package org.polyfront.lexer;

/**
 * Token classes produced by the {@link Lexer}.
 * <p>
 * WHITESPACE, COMMENT and NEWLINE are raw layout tokens. NEWLINES is never
 * produced by the lexer: the parser-side {@code TokenStream} synthesizes it
 * from a run of line breaks that contains a blank line.
 */
public enum LexerTokenType {
    IDENTIFIER,
    KEYWORD,
    OPERATOR,
    DELIMITER,
    INTEGER,
    FLOAT,
    CHARACTER,
    STRING,
    WHITESPACE,
    COMMENT,
    NEWLINE,
    NEWLINES,
    EOF
}
