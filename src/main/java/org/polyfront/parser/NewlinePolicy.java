package org.polyfront.parser;

import org.polyfront.lexer.LexerToken;

/**
 * Decides whether a run of line breaks becomes a visible layout token.
 * Grammars without significant newlines pass no policy to the {@link TokenStream}.
 */
@FunctionalInterface
public interface NewlinePolicy {

    /**
     * @param previous      the last significant token before the line break, null at the start of the unit
     * @param next          the first significant token after the line break
     * @param insideNesting true when the line break sits inside a region where newlines are disabled
     * @return true to emit a NEWLINE/NEWLINES token
     */
    boolean isSignificant(LexerToken previous, LexerToken next, boolean insideNesting);
}
