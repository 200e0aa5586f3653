package org.polyfront.core;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;

public class FrontendOptionsTest {

    @Test
    public void testDefaults() {
        FrontendOptions options = new FrontendOptions();
        assertFalse(options.errorRecovery);
        assertFalse(options.transpileXml);
        assertFalse(options.debugEnabled);
        assertFalse(options.traceTokens);
        assertTrue(options.showParsingError);
        assertNull(options.fileName);
    }

    @Test
    public void testFromYamlResource() throws IOException {
        try (InputStream input = getClass().getResourceAsStream("/options.yaml")) {
            assertNotNull(input);
            FrontendOptions options = FrontendOptions.fromYaml(input);
            assertTrue(options.errorRecovery);
            assertTrue(options.transpileXml);
            assertFalse(options.debugEnabled);
            assertFalse(options.traceTokens);
            assertFalse(options.showParsingError);
        }
    }

    @Test
    public void testAbsentKeysKeepDefaults() {
        FrontendOptions options = FrontendOptions.fromYaml("error-recovery: true\n");
        assertTrue(options.errorRecovery);
        assertTrue(options.showParsingError);

        FrontendOptions empty = FrontendOptions.fromYaml("");
        assertFalse(empty.errorRecovery);
    }

    @Test
    public void testUnknownKeyIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> FrontendOptions.fromYaml("error-recovery: true\nrecover-harder: true\n"));
        assertTrue(e.getMessage().contains("recover-harder"));
    }

    @Test
    public void testNonBooleanValueIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> FrontendOptions.fromYaml("debug: sometimes\n"));
        assertThrows(IllegalArgumentException.class, () -> FrontendOptions.fromYaml("- debug\n"));
    }

    @Test
    public void testCloneIsIndependent() {
        FrontendOptions options = new FrontendOptions();
        options.fileName = "a.scala";
        FrontendOptions copy = options.clone();
        copy.errorRecovery = true;
        copy.fileName = "b.scala";

        assertFalse(options.errorRecovery);
        assertEquals("a.scala", options.fileName);
    }

    @Test
    public void testContextHoldsACopy() {
        FrontendOptions options = new FrontendOptions();
        FrontendContext ctx = new FrontendContext(options, null);
        options.debugEnabled = true;

        assertFalse(ctx.options.debugEnabled);
        assertEquals("-", ctx.fileName());
    }
}
