package org.polyfront.runtime;

import org.polyfront.lexer.LexerToken;
import org.polyfront.lexer.LexerTokenType;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * Utility class for generating error messages with context from a list of tokens.
 */
public class ErrorMessageUtil {
    private final String fileName;
    private final List<LexerToken> tokens;
    // Index of the last token found by offset, searches start from here
    private int lastIndex;

    /**
     * Constructs an ErrorMessageUtil with the specified file name and list of tokens.
     *
     * @param fileName the name of the file
     * @param tokens   the list of tokens
     */
    public ErrorMessageUtil(String fileName, List<LexerToken> tokens) {
        this.fileName = fileName;
        this.tokens = tokens;
        this.lastIndex = 0;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * Quotes the specified string for inclusion in an error message.
     * Escapes special characters such as newlines, tabs, and backslashes.
     *
     * @param str the string to quote
     * @return the quoted and escaped string
     */
    private static String errorMessageQuote(String str) {
        StringBuilder escaped = new StringBuilder();
        for (char c : str.toCharArray()) {
            switch (c) {
                case '\n':
                    escaped.append("\\n");
                    break;
                case '\t':
                    escaped.append("\\t");
                    break;
                case '\\':
                    escaped.append("\\\\");
                    break;
                case '\"':
                    escaped.append("\\\"");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return "\"" + escaped + "\"";
    }

    /**
     * Converts a range of tokens into a single string of text, excluding EOF tokens.
     */
    public static String toText(List<LexerToken> tokens, int codeStart, int codeEnd) {
        StringBuilder sb = new StringBuilder();
        codeStart = Math.max(codeStart, 0);
        codeEnd = Math.min(codeEnd, tokens.size() - 1);
        for (int i = codeStart; i <= codeEnd; i++) {
            LexerToken tok = tokens.get(i);
            if (tok.type != LexerTokenType.EOF) {
                sb.append(tok.text);
            }
        }
        return sb.toString();
    }

    /**
     * Finds the index of the token that starts at the given info's offset.
     *
     * @return the token index, or -1 for fake infos and unknown offsets
     */
    public int indexOf(SourceInfo info) {
        if (info == null || info.isFake() || tokens.isEmpty()) {
            return -1;
        }
        int start = tokens.get(Math.min(lastIndex, tokens.size() - 1)).info.offset <= info.offset ? lastIndex : 0;
        for (int i = start; i < tokens.size(); i++) {
            int offset = tokens.get(i).info.offset;
            if (offset == info.offset) {
                lastIndex = i;
                return i;
            }
            if (offset > info.offset) {
                break;
            }
        }
        return -1;
    }

    /**
     * Generates an error message with context from the token list.
     *
     * @param info    where the error occurred
     * @param message the error message
     * @return the formatted error message with context
     */
    public String errorMessage(SourceInfo info, String message) {
        if (info == null || info.isFake()) {
            return message + " in " + fileName;
        }
        int index = indexOf(info);
        String position = " at " + fileName + " line " + info.line + ", column " + info.column;
        if (index < 0) {
            return message + position;
        }
        // Retrieve the string context around the error by collecting tokens near the index
        String nearString = toText(tokens, index - 4, index + 2);
        return message + position + ", near " + errorMessageQuote(nearString);
    }
}
