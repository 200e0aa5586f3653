package org.polyfront.parser;

import org.polyfront.core.FrontendContext;
import org.polyfront.lexer.LexerToken;
import org.polyfront.lexer.LexerTokenType;
import org.polyfront.runtime.UnexpectedTokenException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * TokenStream wraps a pre-lexed token list into a cursor with one token of
 * lookahead for recursive-descent parsers.
 * <p>
 * Whitespace and comments are skipped transparently. A run of line breaks is
 * turned into one layout token (NEWLINE, or NEWLINES when the run contains a
 * blank line) when the {@link NewlinePolicy} says it is significant, and
 * dropped otherwise.
 * <p>
 * The cursor is mutated in place; it belongs to a single parser.
 */
public class TokenStream {
    private final List<LexerToken> tokens;
    private final NewlinePolicy newlinePolicy;
    private final FrontendContext ctx;
    // Open delimiters of the tokens consumed so far
    private final Deque<String> regions = new ArrayDeque<>();
    // Index of the next raw token to read
    private int index;
    // Last non-layout token moved past
    private LexerToken previous;

    /**
     * The current significant token.
     */
    public LexerToken token;

    /**
     * Creates the stream and loads the first significant token.
     *
     * @param tokens        the token list, terminated by exactly one EOF token
     * @param newlinePolicy decides newline significance, or null when newlines never matter
     * @param ctx           the unit's context, used for token tracing and error messages
     */
    public TokenStream(List<LexerToken> tokens, NewlinePolicy newlinePolicy, FrontendContext ctx) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type != LexerTokenType.EOF) {
            throw new IllegalArgumentException("token list must end with an EOF token");
        }
        this.tokens = tokens;
        this.newlinePolicy = newlinePolicy;
        this.ctx = ctx;
        this.index = 0;
        nextToken();
    }

    /**
     * Drops the current token and loads the next significant one.
     * Once EOF is reached the stream stays on it.
     */
    public void nextToken() {
        if (token != null) {
            if (token.type == LexerTokenType.EOF) {
                return;
            }
            if (!token.isLayout()) {
                trackRegion(token);
                previous = token;
            }
        }
        while (true) {
            LexerToken raw = tokens.get(index);
            if (raw.type == LexerTokenType.EOF) {
                token = raw;
                break;
            }
            index++;
            if (raw.type == LexerTokenType.WHITESPACE
                    || (raw.type == LexerTokenType.COMMENT && !spansLines(raw))) {
                continue;
            }
            // A comment spanning a line break ends the line like a line break does
            if (raw.type == LexerTokenType.NEWLINE || raw.type == LexerTokenType.COMMENT) {
                int lineBreaks = 1;
                while (index < tokens.size() - 1) {
                    LexerTokenType type = tokens.get(index).type;
                    if (type == LexerTokenType.NEWLINE) {
                        lineBreaks++;
                    } else if (type != LexerTokenType.WHITESPACE && type != LexerTokenType.COMMENT) {
                        break;
                    }
                    index++;
                }
                if (newlinePolicy != null
                        && newlinePolicy.isSignificant(previous, tokens.get(index), insideNesting())) {
                    LexerTokenType type = lineBreaks > 1 ? LexerTokenType.NEWLINES : LexerTokenType.NEWLINE;
                    token = new LexerToken(type, raw.type == LexerTokenType.NEWLINE ? raw.text : "\n", raw.info);
                    break;
                }
                continue;
            }
            token = raw;
            break;
        }
        ctx.traceToken(token.type + " '" + token.text + "' " + token.info.location());
    }

    private static boolean spansLines(LexerToken comment) {
        return comment.text.indexOf('\n') >= 0;
    }

    private void trackRegion(LexerToken consumed) {
        if (consumed.type != LexerTokenType.DELIMITER) {
            return;
        }
        switch (consumed.text) {
            case "(", "[", "{" -> regions.push(consumed.text);
            case ")", "]", "}" -> {
                if (!regions.isEmpty()) {
                    regions.pop();
                }
            }
            default -> {
            }
        }
    }

    private boolean insideNesting() {
        String top = regions.peek();
        return "(".equals(top) || "[".equals(top);
    }

    /**
     * Returns the next significant token after the current one without consuming
     * anything. Layout is skipped, so this answers "what follows the newline".
     */
    public LexerToken peekNext() {
        if (token.type == LexerTokenType.EOF) {
            return token;
        }
        int i = index;
        while (i < tokens.size() - 1) {
            LexerTokenType type = tokens.get(i).type;
            if (type != LexerTokenType.WHITESPACE && type != LexerTokenType.COMMENT && type != LexerTokenType.NEWLINE) {
                break;
            }
            i++;
        }
        return tokens.get(i);
    }

    /**
     * True when the current token is the given keyword, operator or delimiter.
     */
    public boolean is(String text) {
        return isText(token, text);
    }

    public static boolean isText(LexerToken token, String text) {
        return (token.type == LexerTokenType.KEYWORD
                || token.type == LexerTokenType.OPERATOR
                || token.type == LexerTokenType.DELIMITER)
                && token.text.equals(text);
    }

    public boolean is(LexerTokenType type) {
        return token.type == type;
    }

    public boolean isEof() {
        return token.type == LexerTokenType.EOF;
    }

    /**
     * Consumes the current token if it is the given keyword, operator or delimiter.
     *
     * @return the consumed token
     * @throws UnexpectedTokenException otherwise
     */
    public LexerToken accept(String text) {
        if (!is(text)) {
            throw error("'" + text + "'");
        }
        LexerToken accepted = token;
        nextToken();
        return accepted;
    }

    /**
     * Accepts the end of the unit. EOF is never advanced past.
     */
    public LexerToken acceptEof() {
        if (!isEof()) {
            throw error("end of file");
        }
        return token;
    }

    public UnexpectedTokenException error(String expected) {
        return new UnexpectedTokenException(token, expected, ctx.errorUtil);
    }

    public FrontendContext context() {
        return ctx;
    }
}
