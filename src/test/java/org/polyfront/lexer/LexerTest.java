package org.polyfront.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<LexerToken> significant(List<LexerToken> tokens) {
        return tokens.stream()
                .filter(t -> t.type != LexerTokenType.WHITESPACE && t.type != LexerTokenType.COMMENT
                        && t.type != LexerTokenType.NEWLINE)
                .collect(Collectors.toList());
    }

    @Test
    public void testClassifiesTokens() {
        List<LexerToken> tokens = significant(new Lexer("a.scala", "val x = 42 + 1.5").tokenize());

        assertEquals(LexerTokenType.KEYWORD, tokens.get(0).type);
        assertEquals(LexerTokenType.IDENTIFIER, tokens.get(1).type);
        assertEquals(LexerTokenType.OPERATOR, tokens.get(2).type);
        assertEquals(LexerTokenType.INTEGER, tokens.get(3).type);
        assertEquals(LexerTokenType.OPERATOR, tokens.get(4).type);
        assertEquals(LexerTokenType.FLOAT, tokens.get(5).type);
        assertEquals(LexerTokenType.EOF, tokens.get(6).type);
    }

    @Test
    public void testEndsWithExactlyOneEof() {
        List<LexerToken> tokens = new Lexer("a.scala", "").tokenize();
        assertEquals(1, tokens.size());
        assertEquals(LexerTokenType.EOF, tokens.get(0).type);

        tokens = new Lexer("a.scala", "x\n").tokenize();
        assertEquals(1, tokens.stream().filter(t -> t.type == LexerTokenType.EOF).count());
        assertEquals(LexerTokenType.EOF, tokens.get(tokens.size() - 1).type);
    }

    @Test
    public void testLayoutIsPreserved() {
        List<LexerToken> tokens = new Lexer("a.scala", "a // note\n\n  b /* x */").tokenize();

        assertEquals(2, tokens.stream().filter(t -> t.type == LexerTokenType.NEWLINE).count());
        assertEquals(2, tokens.stream().filter(t -> t.type == LexerTokenType.COMMENT).count());
        assertTrue(tokens.stream().anyMatch(t -> t.type == LexerTokenType.WHITESPACE));
        // NEWLINES only ever comes from the token stream
        assertTrue(tokens.stream().noneMatch(t -> t.type == LexerTokenType.NEWLINES));
    }

    @Test
    public void testPositions() {
        List<LexerToken> tokens = significant(new Lexer("pos.scala", "def f\n  = g").tokenize());
        LexerToken g = tokens.get(3);

        assertEquals("g", g.text);
        assertEquals("pos.scala", g.info.fileName);
        assertEquals(2, g.info.line);
        assertEquals(5, g.info.column);
        assertEquals(10, g.info.offset);
        assertFalse(g.info.isFake());
    }

    @Test
    public void testTokenTextsConcatenateToSource() {
        String code = "object A {\n  /* nested /* comment */ */\n  val s = \"a\\\"b\"\r\n  'c'\n}\n";
        StringBuilder sb = new StringBuilder();
        for (LexerToken token : new Lexer("a.scala", code).tokenize()) {
            sb.append(token.text);
        }
        assertEquals(code, sb.toString());
    }

    @Test
    public void testUnderscoreIsKeywordAndOperatorSuffix() {
        List<LexerToken> tokens = significant(new Lexer("a.scala", "_ unary_- x_1").tokenize());

        assertEquals(LexerTokenType.KEYWORD, tokens.get(0).type);
        assertEquals("unary_-", tokens.get(1).text);
        assertEquals(LexerTokenType.IDENTIFIER, tokens.get(1).type);
        assertEquals("x_1", tokens.get(2).text);
    }

    @Test
    public void testUnicodeIdentifier() {
        List<LexerToken> tokens = significant(new Lexer("a.scala", "val größe = 1").tokenize());
        assertEquals("größe", tokens.get(1).text);
        assertEquals(LexerTokenType.IDENTIFIER, tokens.get(1).type);
    }

    @Test
    public void testFakeInfo() {
        SourceInfo fake = SourceInfo.fake("!tmp1!");
        assertTrue(fake.isFake());
        assertEquals("<fake !tmp1!>", fake.location());
    }
}
