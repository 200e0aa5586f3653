package org.polyfront.parser;

import org.junit.jupiter.api.Test;
import org.polyfront.core.FrontendContext;
import org.polyfront.core.FrontendOptions;
import org.polyfront.lexer.Lexer;
import org.polyfront.lexer.LexerToken;
import org.polyfront.lexer.LexerTokenType;
import org.polyfront.runtime.ErrorMessageUtil;
import org.polyfront.runtime.UnexpectedTokenException;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TokenStreamTest {

    private static TokenStream stream(String code, NewlinePolicy policy) {
        List<LexerToken> tokens = new Lexer("t.scala", code).tokenize();
        FrontendContext ctx = new FrontendContext(new FrontendOptions(), new ErrorMessageUtil("t.scala", tokens));
        return new TokenStream(tokens, policy, ctx);
    }

    private static List<String> drain(TokenStream in) {
        List<String> seen = new ArrayList<>();
        while (!in.isEof()) {
            seen.add(in.token.type == LexerTokenType.NEWLINE || in.token.type == LexerTokenType.NEWLINES
                    ? in.token.type.name() : in.token.text);
            in.nextToken();
        }
        return seen;
    }

    @Test
    public void testSkipsLayoutWithoutPolicy() {
        TokenStream in = stream("a /* c */ b\n\n c", null);
        assertEquals(List.of("a", "b", "c"), drain(in));
    }

    @Test
    public void testLineBreakBecomesSeparator() {
        TokenStream in = stream("a\nb", ScalaTokens.NEWLINE_POLICY);
        assertEquals(List.of("a", "NEWLINE", "b"), drain(in));
    }

    @Test
    public void testBlankLineBecomesNewlines() {
        TokenStream in = stream("a\n  // comment\n\nb", ScalaTokens.NEWLINE_POLICY);
        assertEquals(List.of("a", "NEWLINES", "b"), drain(in));
    }

    @Test
    public void testNewlineSuppressedInsideParentheses() {
        TokenStream in = stream("f(a\nb)\nc", ScalaTokens.NEWLINE_POLICY);
        assertEquals(List.of("f", "(", "a", "b", ")", "NEWLINE", "c"), drain(in));
    }

    @Test
    public void testNewlineKeptInsideBraces() {
        TokenStream in = stream("{a\nb}", ScalaTokens.NEWLINE_POLICY);
        assertEquals(List.of("{", "a", "NEWLINE", "b", "}"), drain(in));
    }

    @Test
    public void testNewlineDroppedAfterOperatorOrBeforeElse() {
        assertEquals(List.of("a", "+", "b"), drain(stream("a +\nb", null)));
        assertEquals(List.of("x", "=", "1"), drain(stream("x =\n1", ScalaTokens.NEWLINE_POLICY)));
        assertEquals(List.of(")", "else", "y"), drain(stream(")\nelse y", ScalaTokens.NEWLINE_POLICY)));
    }

    @Test
    public void testNoSeparatorAtEndOfUnit() {
        TokenStream in = stream("a\n\n", ScalaTokens.NEWLINE_POLICY);
        assertEquals(List.of("a"), drain(in));
    }

    @Test
    public void testPeekNextSkipsLayout() {
        TokenStream in = stream("a\n  b", ScalaTokens.NEWLINE_POLICY);
        in.nextToken();
        assertEquals(LexerTokenType.NEWLINE, in.token.type);
        assertEquals("b", in.peekNext().text);
        assertEquals(LexerTokenType.NEWLINE, in.token.type);
    }

    @Test
    public void testStaysOnEof() {
        TokenStream in = stream("a", null);
        in.nextToken();
        assertTrue(in.isEof());
        in.nextToken();
        assertTrue(in.isEof());
        assertSame(in.token, in.acceptEof());
    }

    @Test
    public void testAcceptReportsExpectedToken() {
        TokenStream in = stream("a", null);
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> in.accept("{"));
        assertEquals("'{'", e.expected);
        assertEquals("a", e.token.text);
    }

    @Test
    public void testRejectsTokenListWithoutEof() {
        List<LexerToken> tokens = new Lexer("t.scala", "a").tokenize();
        List<LexerToken> truncated = tokens.subList(0, tokens.size() - 1);
        FrontendContext ctx = new FrontendContext(new FrontendOptions(), new ErrorMessageUtil("t.scala", tokens));
        assertThrows(IllegalArgumentException.class, () -> new TokenStream(truncated, null, ctx));
    }

    @Test
    public void testMultiLineCommentEndsTheLine() {
        TokenStream in = stream("a /* x\n y */ b", ScalaTokens.NEWLINE_POLICY);
        assertEquals(List.of("a", "NEWLINE", "b"), drain(in));

        TokenStream sameLine = stream("a /* x */ b", ScalaTokens.NEWLINE_POLICY);
        assertEquals(List.of("a", "b"), drain(sameLine));

        TokenStream nested = stream("f(a /* x\n */ b)", ScalaTokens.NEWLINE_POLICY);
        assertEquals(List.of("f", "(", "a", "b", ")"), drain(nested));
    }
}
