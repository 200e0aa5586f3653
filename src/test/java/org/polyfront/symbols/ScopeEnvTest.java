package org.polyfront.symbols;

import org.junit.jupiter.api.Test;
import org.polyfront.astnode.ResolvedKind;
import org.polyfront.lexer.SourceInfo;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeEnvTest {

    private static SourceInfo at(String name, int offset) {
        return new SourceInfo(name, "s.js", 1, offset + 1, offset);
    }

    @Test
    public void testNearestBindingWins() {
        ScopeEnv env = ScopeEnv.empty()
                .withLocal("x", at("x", 0))
                .withParam("x", at("x", 10));
        assertEquals(ResolvedKind.PARAM, env.lookup("x").kind());
        assertEquals(10, env.lookup("x").defSite().offset);
        assertTrue(env.toString().startsWith("ScopeEnv{locals=[x:param, x:local]"), env.toString());
    }

    @Test
    public void testExtendingDoesNotChangeTheOriginal() {
        ScopeEnv outer = ScopeEnv.empty().withLocal("a", at("a", 0));
        ScopeEnv inner = outer.withLocal("b", at("b", 5));
        assertTrue(inner.isBound("b"));
        assertFalse(outer.isBound("b"));
        assertTrue(inner.isBound("a"));
    }

    @Test
    public void testVarIsFunctionScoped() {
        ScopeEnv env = ScopeEnv.empty();
        ScopeEnv block = env.withLocal("y", at("y", 0));
        block.declareVar("v", at("v", 4));
        // visible from the enclosing block of the same function
        assertTrue(env.isBound("v"));
        assertEquals(ResolvedKind.LOCAL, env.lookup("v").kind());
        // the block binding itself stays in the block
        assertFalse(env.isBound("y"));
    }

    @Test
    public void testNestedFunctionHasPrivateVars() {
        ScopeEnv env = ScopeEnv.empty();
        env.declareVar("outer", at("outer", 0));
        ScopeEnv fn = env.enterFunction();
        fn.declareVar("inner", at("inner", 10));

        assertTrue(fn.isBound("outer"));
        assertTrue(fn.isBound("inner"));
        assertFalse(env.isBound("inner"));
    }

    @Test
    public void testLocalShadowsVar() {
        ScopeEnv env = ScopeEnv.empty();
        env.declareVar("x", at("x", 0));
        ScopeEnv inner = env.withParam("x", at("x", 8));
        assertEquals(ResolvedKind.PARAM, inner.lookup("x").kind());
    }

    @Test
    public void testImportAndUnbound() {
        ScopeEnv env = ScopeEnv.empty().withImport("React", at("React", 7));
        assertEquals(ResolvedKind.IMPORTED, env.lookup("React").kind());
        assertNull(env.lookup("missing"));
        assertTrue(env.toString().contains("React:imported"));
    }
}
