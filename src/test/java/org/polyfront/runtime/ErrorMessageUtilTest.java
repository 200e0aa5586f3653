package org.polyfront.runtime;

import org.junit.jupiter.api.Test;
import org.polyfront.lexer.Lexer;
import org.polyfront.lexer.LexerToken;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorMessageUtilTest {

    private static final String CODE = "val x = 1\nval y = 2\n";

    private final List<LexerToken> tokens = new Lexer("t.scala", CODE).tokenize();

    private SourceInfo infoOf(String text, int occurrence) {
        int seen = 0;
        for (LexerToken token : tokens) {
            if (token.text.equals(text) && seen++ == occurrence) {
                return token.info;
            }
        }
        throw new IllegalArgumentException(text);
    }

    @Test
    public void testMessageWithContext() {
        ErrorMessageUtil util = new ErrorMessageUtil("t.scala", tokens);
        String message = util.errorMessage(infoOf("x", 0), "oops");
        assertEquals("oops at t.scala line 1, column 5, near \"val x =\"", message);
    }

    @Test
    public void testLineBreaksAreEscaped() {
        ErrorMessageUtil util = new ErrorMessageUtil("t.scala", tokens);
        String message = util.errorMessage(infoOf("val", 1), "oops");
        assertTrue(message.startsWith("oops at t.scala line 2, column 1"), message);
        assertTrue(message.contains("\\n"), message);
        assertFalse(message.contains("\n"), message);
    }

    @Test
    public void testFakeInfo() {
        ErrorMessageUtil util = new ErrorMessageUtil("t.scala", tokens);
        assertEquals("oops in t.scala", util.errorMessage(SourceInfo.fake("tmp"), "oops"));
        assertEquals(-1, util.indexOf(SourceInfo.fake("tmp")));
    }

    @Test
    public void testIndexOfSearchesBackwards() {
        ErrorMessageUtil util = new ErrorMessageUtil("t.scala", tokens);
        int y = util.indexOf(infoOf("y", 0));
        int x = util.indexOf(infoOf("x", 0));
        assertTrue(x >= 0 && y > x);
        assertEquals("x", tokens.get(x).text);
    }

    @Test
    public void testExceptionMessages() {
        SourceInfo info = infoOf("y", 0);
        TodoConstructException todo = new TodoConstructException("pattern definition", info);
        assertEquals("TODO construct: pattern definition", todo.getRawMessage());
        assertEquals("pattern definition", todo.category);
        assertSame(info, todo.getInfo());
        assertTrue(todo.getMessage().endsWith("t.scala line 2, column 5"), todo.getMessage());

        ParseError error = new ParseError("t.scala", info, todo);
        assertSame(todo, error.getCause());
        assertTrue(error.getRawMessage().startsWith("Parse error in t.scala: TODO construct"));
    }
}
