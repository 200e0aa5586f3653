package org.polyfront.lexer;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The Lexer class converts Scala-family source text into a classified list of
 * tokens, each carrying a {@link SourceInfo}.
 * <p>
 * Layout is preserved: whitespace and comments are returned as WHITESPACE and
 * COMMENT tokens and every line break as one NEWLINE token. Deciding which of
 * them matter is left to the parser side ({@code TokenStream}).
 * <p>
 * NOTE:
 * The Lexer is permissive. A character it does not know becomes a one-character
 * OPERATOR token and an unterminated string ends at the end of the line; the
 * parser reports the error at that position.
 */
public class Lexer {
    public static final Set<String> KEYWORDS = Set.of(
            "abstract", "case", "catch", "class", "def", "do", "else", "extends",
            "false", "final", "finally", "for", "forSome", "if", "implicit", "import",
            "lazy", "match", "new", "null", "object", "override", "package", "private",
            "protected", "return", "sealed", "super", "this", "throw", "trait", "try",
            "true", "type", "val", "var", "while", "with", "yield", "_");

    // Array to mark operator characters
    private static final boolean[] isOperatorChar;
    // Array to mark single-character delimiters
    private static final boolean[] isDelimiter;

    static {
        isOperatorChar = new boolean[128];
        for (char c : "!#%&*+-/:<=>?\\^|~".toCharArray()) {
            isOperatorChar[c] = true;
        }
        isDelimiter = new boolean[128];
        for (char c : "()[]{},;.@".toCharArray()) {
            isDelimiter[c] = true;
        }
    }

    private final String fileName;
    private final String input;
    private final int length;
    private int position;
    private int line;
    private int lineStart;

    public Lexer(String fileName, String input) {
        this.fileName = fileName;
        this.input = input;
        this.length = input.length();
        this.position = 0;
        this.line = 1;
        this.lineStart = 0;
    }

    private static boolean isIdentifierStart(int codePoint) {
        return codePoint == '_' || codePoint == '$' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_START);
    }

    private static boolean isIdentifierPart(int codePoint) {
        return codePoint == '_' || codePoint == '$' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_CONTINUE);
    }

    private static boolean isOperatorChar(char c) {
        return c < 128 && isOperatorChar[c];
    }

    private int currentCodePoint() {
        return input.codePointAt(position);
    }

    private char charAt(int index) {
        return index < length ? input.charAt(index) : '\0';
    }

    /**
     * Tokenizes the whole input. The returned list always ends with exactly one EOF token.
     *
     * @return the list of tokens
     */
    public List<LexerToken> tokenize() {
        List<LexerToken> tokens = new ArrayList<>();
        LexerToken token;
        while ((token = nextToken()) != null) {
            tokens.add(token);
        }
        tokens.add(new LexerToken(LexerTokenType.EOF, "", info("", position)));
        return tokens;
    }

    private SourceInfo info(String text, int start) {
        return new SourceInfo(text, fileName, line, start - lineStart + 1, start);
    }

    private LexerToken make(LexerTokenType type, int start) {
        String text = input.substring(start, position);
        return new LexerToken(type, text, info(text, start));
    }

    public LexerToken nextToken() {
        if (position >= length) {
            return null;
        }
        int start = position;
        char current = input.charAt(position);

        if (current == '\n') {
            position++;
            LexerToken token = make(LexerTokenType.NEWLINE, start);
            line++;
            lineStart = position;
            return token;
        } else if (current == '\r' && charAt(position + 1) == '\n') {
            position += 2;
            LexerToken token = make(LexerTokenType.NEWLINE, start);
            line++;
            lineStart = position;
            return token;
        } else if (current == ' ' || current == '\t' || current == '\f' || current == '\r') {
            return consumeWhitespace(start);
        } else if (current == '/' && charAt(position + 1) == '/') {
            while (position < length && input.charAt(position) != '\n' && input.charAt(position) != '\r') {
                position++;
            }
            return make(LexerTokenType.COMMENT, start);
        } else if (current == '/' && charAt(position + 1) == '*') {
            return consumeBlockComment(start);
        } else if (current >= '0' && current <= '9') {
            return consumeNumber(start);
        } else if (current == '"') {
            return consumeString(start);
        } else if (current == '\'') {
            return consumeCharacter(start);
        } else if (current == '`') {
            return consumeBackquoted(start);
        } else if (isIdentifierStart(currentCodePoint())) {
            return consumeIdentifier(start);
        } else if (current < 128 && isDelimiter[current]) {
            position++;
            return make(LexerTokenType.DELIMITER, start);
        } else if (isOperatorChar(current)) {
            while (position < length && isOperatorChar(input.charAt(position))
                    && !(input.charAt(position) == '/' && (charAt(position + 1) == '/' || charAt(position + 1) == '*'))) {
                position++;
            }
            return make(LexerTokenType.OPERATOR, start);
        }
        position += Character.charCount(currentCodePoint());
        return make(LexerTokenType.OPERATOR, start);
    }

    private LexerToken consumeWhitespace(int start) {
        while (position < length) {
            char c = input.charAt(position);
            if (c == ' ' || c == '\t' || c == '\f' || (c == '\r' && charAt(position + 1) != '\n')) {
                position++;
            } else {
                break;
            }
        }
        return make(LexerTokenType.WHITESPACE, start);
    }

    // Scala block comments nest
    private LexerToken consumeBlockComment(int start) {
        int startLine = line;
        int startColumn = start - lineStart + 1;
        int depth = 0;
        while (position < length) {
            if (input.charAt(position) == '/' && charAt(position + 1) == '*') {
                depth++;
                position += 2;
            } else if (input.charAt(position) == '*' && charAt(position + 1) == '/') {
                depth--;
                position += 2;
                if (depth == 0) {
                    break;
                }
            } else {
                if (input.charAt(position) == '\n') {
                    line++;
                    lineStart = position + 1;
                }
                position++;
            }
        }
        String text = input.substring(start, position);
        return new LexerToken(LexerTokenType.COMMENT, text,
                new SourceInfo(text, fileName, startLine, startColumn, start));
    }

    private LexerToken consumeNumber(int start) {
        boolean isFloat = false;
        if (input.charAt(position) == '0' && (charAt(position + 1) == 'x' || charAt(position + 1) == 'X')) {
            position += 2;
            while (position < length && (Character.digit(input.charAt(position), 16) >= 0 || input.charAt(position) == '_')) {
                position++;
            }
        } else {
            consumeDigits();
            if (charAt(position) == '.' && Character.isDigit(charAt(position + 1))) {
                isFloat = true;
                position++;
                consumeDigits();
            }
            if (charAt(position) == 'e' || charAt(position) == 'E') {
                int save = position;
                position++;
                if (charAt(position) == '+' || charAt(position) == '-') {
                    position++;
                }
                if (Character.isDigit(charAt(position))) {
                    isFloat = true;
                    consumeDigits();
                } else {
                    position = save;
                }
            }
        }
        char suffix = charAt(position);
        if (suffix == 'L' || suffix == 'l') {
            position++;
        } else if (suffix == 'f' || suffix == 'F' || suffix == 'd' || suffix == 'D') {
            isFloat = true;
            position++;
        }
        return make(isFloat ? LexerTokenType.FLOAT : LexerTokenType.INTEGER, start);
    }

    private void consumeDigits() {
        while (position < length && (Character.isDigit(input.charAt(position)) || input.charAt(position) == '_')) {
            position++;
        }
    }

    private LexerToken consumeString(int start) {
        if (input.startsWith("\"\"\"", position)) {
            int end = input.indexOf("\"\"\"", position + 3);
            int stop = end < 0 ? length : end + 3;
            int startLine = line;
            int startColumn = start - lineStart + 1;
            for (int i = position; i < stop; i++) {
                if (input.charAt(i) == '\n') {
                    line++;
                    lineStart = i + 1;
                }
            }
            position = stop;
            String text = input.substring(start, position);
            return new LexerToken(LexerTokenType.STRING, text,
                    new SourceInfo(text, fileName, startLine, startColumn, start));
        }
        position++;
        while (position < length) {
            char c = input.charAt(position);
            if (c == '\\') {
                position = Math.min(position + 2, length);
            } else if (c == '"') {
                position++;
                break;
            } else if (c == '\n' || c == '\r') {
                break;
            } else {
                position++;
            }
        }
        return make(LexerTokenType.STRING, start);
    }

    private LexerToken consumeCharacter(int start) {
        int end;
        if (charAt(position + 1) == '\\') {
            end = input.indexOf('\'', position + 3);
        } else {
            end = charAt(position + 2) == '\'' ? position + 2 : -1;
        }
        if (end < 0) {
            position++;
            return make(LexerTokenType.OPERATOR, start);
        }
        position = end + 1;
        return make(LexerTokenType.CHARACTER, start);
    }

    private LexerToken consumeBackquoted(int start) {
        int end = input.indexOf('`', position + 1);
        position = end < 0 ? length : end + 1;
        return make(LexerTokenType.IDENTIFIER, start);
    }

    private LexerToken consumeIdentifier(int start) {
        position += Character.charCount(currentCodePoint());
        while (position < length) {
            int cp = currentCodePoint();
            if (isIdentifierPart(cp)) {
                position += Character.charCount(cp);
            } else {
                break;
            }
        }
        // Scala allows an operator suffix after an underscore: `unary_-`
        if (input.charAt(position - 1) == '_' && position < length && isOperatorChar(input.charAt(position))) {
            while (position < length && isOperatorChar(input.charAt(position))) {
                position++;
            }
        }
        String text = input.substring(start, position);
        LexerTokenType type = KEYWORDS.contains(text) ? LexerTokenType.KEYWORD : LexerTokenType.IDENTIFIER;
        return new LexerToken(type, text, info(text, start));
    }
}
