package org.polyfront.astnode;

import org.junit.jupiter.api.Test;
import org.polyfront.lexer.SourceInfo;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IdInfoTest {

    @Test
    public void testLaterPassOverwritesWithQualifiedGlobal() {
        IdNode pi = new IdNode("Pi", new SourceInfo("Pi", "t.scala", 3, 9, 40));
        pi.idInfo.setResolved(ResolvedName.NOT_RESOLVED);
        IdInfo shared = pi.idInfo;

        // a naming pass that knows `import scala.math._` rewrites the cell in place
        pi.idInfo.setResolved(ResolvedName.global(List.of("scala", "math")));

        assertSame(shared, pi.idInfo);
        ResolvedName resolved = pi.idInfo.getResolved();
        assertEquals(ResolvedKind.GLOBAL, resolved.kind());
        assertEquals(List.of("scala", "math"), resolved.qualifier());
        assertNull(resolved.defSite());
        assertTrue(new ProgramNode("t.scala", List.of(new ExprStmtNode(pi))).toString()
                .contains("IdNode: Pi [GLOBAL scala.math]"));
    }

    @Test
    public void testQualifierIsCopied() {
        List<String> path = new ArrayList<>(List.of("java", "lang"));
        ResolvedName name = ResolvedName.global(path);
        path.add("reflect");
        assertEquals(List.of("java", "lang"), name.qualifier());
        assertThrows(UnsupportedOperationException.class, () -> name.qualifier().add("x"));
    }

    @Test
    public void testLocalNamesHaveNoQualifier() {
        SourceInfo site = new SourceInfo("x", "t.js", 1, 5, 4);
        assertEquals(List.of(), ResolvedName.local(site).qualifier());
        assertEquals(List.of(), ResolvedName.NOT_RESOLVED.qualifier());
        assertEquals(ResolvedName.local(site), new ResolvedName(ResolvedKind.LOCAL, site, null));
        assertEquals("?", new IdInfo().toString());
        assertEquals("LOCAL", new IdInfo(ResolvedName.local(site)).toString());
    }
}
