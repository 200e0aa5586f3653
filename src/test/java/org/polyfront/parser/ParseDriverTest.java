package org.polyfront.parser;

import org.junit.jupiter.api.Test;
import org.polyfront.core.FrontendOptions;
import org.polyfront.cst.ScalaCst.Program;
import org.polyfront.runtime.ParseError;
import org.polyfront.runtime.TodoConstructException;
import org.polyfront.runtime.UnexpectedTokenException;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;

public class ParseDriverTest {

    private static final String BROKEN = "object A {\n  def f = 1\n  val = 2\n}\n";

    private static FrontendOptions recovering() {
        FrontendOptions options = new FrontendOptions();
        options.errorRecovery = true;
        options.showParsingError = false;
        return options;
    }

    @Test
    public void testCleanUnitStat() {
        ParseResult<Program> result = ParseDriver.parse("ok.scala", "object A {\n  def f = 1\n}\n", recovering());
        assertFalse(result.stat().hasFailed());
        assertEquals(3, result.stat().totalLineCount);
        assertEquals(0, result.stat().errorLineCount);
        assertEquals(1, result.ast().stats().size());
    }

    @Test
    public void testRecoveryAbandonsUnit() {
        ParseResult<Program> result = ParseDriver.parse("broken.scala", BROKEN, recovering());

        assertTrue(result.ast().stats().isEmpty());
        ParseStat stat = result.stat();
        assertTrue(stat.hasFailed());
        assertEquals(4, stat.totalLineCount);
        assertEquals(4, stat.errorLineCount);
        assertEquals(3, stat.failureInfo.line);
        assertEquals("broken.scala", stat.fileName);
    }

    @Test
    public void testWithoutRecoveryRaisesParseError() {
        FrontendOptions options = new FrontendOptions();
        ParseError e = assertThrows(ParseError.class, () -> ParseDriver.parse("broken.scala", BROKEN, options));
        assertInstanceOf(TodoConstructException.class, e.getCause());
        assertEquals(3, e.getInfo().line);
    }

    @Test
    public void testUnexpectedTokenIsCause() {
        ParseError e = assertThrows(ParseError.class,
                () -> ParseDriver.parse("t.scala", "object A {\n  def f = (1\n}\n", new FrontendOptions()));
        UnexpectedTokenException cause = (UnexpectedTokenException) e.getCause();
        assertEquals("}", cause.token.text);
    }

    @Test
    public void testParsingErrorIsShownOnStderr() {
        FrontendOptions options = recovering();
        options.showParsingError = true;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        System.setErr(new PrintStream(err));
        try {
            ParseDriver.parse("broken.scala", BROKEN, options);
        } finally {
            System.setErr(originalErr);
        }
        assertTrue(err.toString().contains("parse error"));
    }

    @Test
    public void testUnitsAreIndependent() {
        FrontendOptions options = recovering();
        ParseResult<Program> failed = ParseDriver.parse("a.scala", BROKEN, options);
        ParseResult<Program> ok = ParseDriver.parse("b.scala", "object B\n", options);
        assertTrue(failed.stat().hasFailed());
        assertFalse(ok.stat().hasFailed());
        assertEquals(1, ok.ast().stats().size());
    }

    @Test
    public void testOptionsAreNotMutated() {
        FrontendOptions options = recovering();
        ParseDriver.parse("a.scala", "object A\n", options);
        assertNull(options.fileName);
    }

    @Test
    public void testEmptyUnit() {
        ParseResult<Program> result = ParseDriver.parse("empty.scala", "", recovering());
        assertEquals(0, result.stat().totalLineCount);
        assertTrue(result.ast().stats().isEmpty());
        assertFalse(result.stat().hasFailed());
    }
}
