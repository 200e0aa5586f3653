package org.polyfront.parser;

import org.polyfront.lexer.LexerToken;
import org.polyfront.lexer.LexerTokenType;

import java.util.Set;

/**
 * Token classification tables for the Scala-family grammar.
 */
public final class ScalaTokens {

    // Operators that are reserved words and can never be used as identifiers
    public static final Set<String> RESERVED_OPERATORS = Set.of(":", "=", "=>", "<-", "<:", "<%", ">:", "#", "⇒", "←");

    public static final Set<String> LOCAL_MODIFIERS = Set.of("abstract", "final", "sealed", "implicit", "lazy");
    public static final Set<String> ACCESS_MODIFIERS = Set.of("private", "protected");
    public static final Set<String> DEFINITION_INTRO = Set.of("def", "val", "var", "type");

    // Reserved words and reserved operators that cannot start a statement
    private static final Set<String> CANNOT_BEGIN_STATEMENT = Set.of(
            "catch", "else", "extends", "finally", "forSome", "match", "with", "yield",
            ",", ".", ";", ":", "=", "=>", "<-", "<:", "<%", ">:", "#", "[", ")", "]", "}");

    // Reserved words that can end a statement
    private static final Set<String> KEYWORDS_ENDING_STATEMENT = Set.of(
            "this", "null", "true", "false", "return", "type", "_");

    /**
     * Scala's newline rules: a line break is a statement separator only if the
     * previous token can end a statement, the next can begin one, and the line
     * break is not inside parentheses or brackets.
     */
    public static final NewlinePolicy NEWLINE_POLICY = (previous, next, insideNesting) ->
            !insideNesting && previous != null && canEndStatement(previous) && canBeginStatement(next);

    private ScalaTokens() {
    }

    public static boolean canEndStatement(LexerToken token) {
        return switch (token.type) {
            case IDENTIFIER, INTEGER, FLOAT, CHARACTER, STRING -> true;
            case OPERATOR -> !RESERVED_OPERATORS.contains(token.text);
            case KEYWORD -> KEYWORDS_ENDING_STATEMENT.contains(token.text);
            case DELIMITER -> token.text.equals(")") || token.text.equals("]") || token.text.equals("}");
            default -> false;
        };
    }

    public static boolean canBeginStatement(LexerToken token) {
        if (token.type == LexerTokenType.EOF) {
            return false;
        }
        return !(isReservedText(token) && CANNOT_BEGIN_STATEMENT.contains(token.text));
    }

    private static boolean isReservedText(LexerToken token) {
        return token.type == LexerTokenType.KEYWORD
                || token.type == LexerTokenType.DELIMITER
                || (token.type == LexerTokenType.OPERATOR && RESERVED_OPERATORS.contains(token.text));
    }

    /**
     * Plain and back-quoted identifiers, and operator identifiers such as {@code +} or {@code ::}.
     */
    public static boolean isIdent(LexerToken token) {
        return token.type == LexerTokenType.IDENTIFIER
                || (token.type == LexerTokenType.OPERATOR && !RESERVED_OPERATORS.contains(token.text));
    }

    public static boolean isStatSeqEnd(LexerToken token) {
        return token.type == LexerTokenType.EOF || TokenStream.isText(token, "}");
    }

    public static boolean isStatSep(LexerToken token) {
        return token.isLayout() || TokenStream.isText(token, ";");
    }

    public static boolean isModifier(LexerToken token) {
        return token.type == LexerTokenType.KEYWORD
                && (LOCAL_MODIFIERS.contains(token.text)
                || ACCESS_MODIFIERS.contains(token.text)
                || token.text.equals("override"));
    }

    public static boolean isAnnotation(LexerToken token) {
        return TokenStream.isText(token, "@");
    }

    public static boolean isTemplateIntro(LexerToken token) {
        return token.type == LexerTokenType.KEYWORD
                && (token.text.equals("class") || token.text.equals("object")
                || token.text.equals("trait") || token.text.equals("case"));
    }

    public static boolean isDefinitionIntro(LexerToken token) {
        return token.type == LexerTokenType.KEYWORD && DEFINITION_INTRO.contains(token.text);
    }

    public static boolean isLiteral(LexerToken token) {
        return switch (token.type) {
            case INTEGER, FLOAT, CHARACTER, STRING -> true;
            case KEYWORD -> token.text.equals("true") || token.text.equals("false") || token.text.equals("null");
            default -> false;
        };
    }
}
