package org.polyfront.astvisitor;

import org.junit.jupiter.api.Test;
import org.polyfront.astnode.*;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PrintVisitorTest {

    private static ProgramNode program() {
        IdNode x = new IdNode("x", new SourceInfo("x", "t.scala", 2, 3, 12));
        LiteralNode one = new LiteralNode(LiteralNode.Kind.INT, "1", new SourceInfo("1", "t.scala", 2, 7, 16));
        CallNode plus = new CallNode(SpecialNode.operator(Operator.PLUS, SourceInfo.fake("+")),
                List.of(ArgumentNode.arg(x), ArgumentNode.arg(one)));
        return new ProgramNode("t.scala", List.of(new ExprStmtNode(plus)));
    }

    @Test
    public void testHeaders() {
        String printed = program().toString();
        String[] lines = printed.split("\n");

        assertEquals("ProgramNode: t.scala  pos:fake", lines[0]);
        assertTrue(printed.contains("IdNode: x [?]  pos:2:3"), printed);
        assertTrue(printed.contains("LiteralNode: INT 1  pos:2:7"), printed);
        assertTrue(printed.contains("SpecialNode: OPERATOR PLUS  pos:fake"), printed);
    }

    @Test
    public void testNestingIsIndented() {
        String printed = program().toString();
        for (String line : printed.split("\n")) {
            if (line.trim().startsWith("IdNode")) {
                assertTrue(line.startsWith("  "), line);
            }
        }
    }

    @Test
    public void testCollectorSkipsFakeInfos() {
        List<SourceInfo> infos = SourceInfoCollector.collect(program());
        assertEquals(2, infos.size());
        assertEquals(12, infos.get(0).offset);
        assertEquals(16, infos.get(1).offset);
    }
}
