package org.polyfront.runtime;

import org.polyfront.lexer.LexerToken;

import java.io.Serial;

/**
 * Raised by the parser when the current token does not match what the grammar
 * production expects.
 */
public class UnexpectedTokenException extends FrontendException {
    @Serial
    private static final long serialVersionUID = 1L;

    public final transient LexerToken token;
    public final String expected;

    public UnexpectedTokenException(LexerToken token, String expected, ErrorMessageUtil errorUtil) {
        super("Expected " + expected + " but got " + token.type + " '" + token.text + "'", token.info, errorUtil);
        this.token = token;
        this.expected = expected;
    }
}
