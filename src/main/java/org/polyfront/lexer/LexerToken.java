package org.polyfront.lexer;

/**
 * The LexerToken class represents a lexical token: a keyword, identifier,
 * operator, literal, layout token, comment or the end of file.
 *
 * <p>This class encapsulates the type, the exact source text and the position
 * handle of a token. The type is represented by an instance of the
 * LexerTokenType enum.</p>
 */
public class LexerToken {
    /**
     * The type of the token, represented by an instance of the LexerTokenType enum.
     */
    public final LexerTokenType type;

    /**
     * The exact source text of the token.
     */
    public final String text;

    /**
     * Where the token comes from.
     */
    public final SourceInfo info;

    /**
     * Constructs a new LexerToken with the specified type, text and position.
     *
     * @param type the type of the token
     * @param text the text of the token
     * @param info the position handle of the token
     */
    public LexerToken(LexerTokenType type, String text, SourceInfo info) {
        this.type = type;
        this.text = text;
        this.info = info;
    }

    public boolean isLayout() {
        return type == LexerTokenType.NEWLINE || type == LexerTokenType.NEWLINES;
    }

    /**
     * Returns a string representation of the token.
     * The string representation includes the type and text of the token.
     *
     * @return a string representation of the token
     */
    @Override
    public String toString() {
        return "LexerToken{" + "type=" + type + ", text='" + text + '\'' + '}';
    }
}
