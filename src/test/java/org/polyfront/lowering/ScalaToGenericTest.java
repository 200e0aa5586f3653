package org.polyfront.lowering;

import org.junit.jupiter.api.Test;
import org.polyfront.astnode.*;
import org.polyfront.astvisitor.SourceInfoCollector;
import org.polyfront.core.FrontendContext;
import org.polyfront.core.FrontendOptions;
import org.polyfront.cst.ScalaCst.Program;
import org.polyfront.lexer.LexerToken;
import org.polyfront.lexer.SourceInfo;
import org.polyfront.parser.ParseDriver;
import org.polyfront.parser.ParseResult;
import org.polyfront.runtime.ErrorMessageUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ScalaToGenericTest {

    private static ProgramNode lower(String fileName, String code) {
        ParseResult<Program> parsed = ParseDriver.parse(fileName, code, new FrontendOptions());
        FrontendOptions options = new FrontendOptions();
        options.fileName = fileName;
        FrontendContext ctx = new FrontendContext(options, new ErrorMessageUtil(fileName, parsed.tokens()));
        return new ScalaToGeneric(ctx).program(parsed.ast());
    }

    private static String resource(String name) {
        try (InputStream in = ScalaToGenericTest.class.getResourceAsStream("/" + name)) {
            assertNotNull(in);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    private static String withoutPositions(Node node) {
        return node.toString().replaceAll(" {2}pos:\\S+", "");
    }

    @Test
    public void testBasicFile() {
        ProgramNode program = lower("basic.scala", resource("basic.scala"));
        assertEquals(2, program.items.size());

        ImportAllNode imp = (ImportAllNode) program.items.get(0);
        assertEquals("math", imp.module.path.get(0).name);

        DefinitionNode def = (DefinitionNode) program.items.get(1);
        assertEquals("mathFunction", def.entity.name.name);
        FunctionDefinitionNode fn = (FunctionDefinitionNode) def.definition;
        assertEquals(FunctionDefinitionNode.Kind.FUNCTION, fn.kind);
        assertEquals(TypeNode.Kind.BUILTIN, fn.parameters.get(0).type.kind);

        BlockNode body = (BlockNode) fn.body;
        assertEquals(2, body.elements.size());
        DefinitionNode numSquare = (DefinitionNode) body.elements.get(0);
        assertTrue(numSquare.entity.hasAttribute(KeywordAttribute.CONST));
        CallNode mult = (CallNode) ((VariableDefinitionNode) numSquare.definition).init;
        assertEquals(Operator.MULT, ((SpecialNode) mult.function).operator);

        DotAccessNode toInt = (DotAccessNode) ((ExprStmtNode) body.elements.get(1)).expr;
        CallNode plus = (CallNode) toInt.expr;
        assertEquals(Operator.PLUS, ((SpecialNode) plus.function).operator);
    }

    @Test
    public void testBlankLinesDoNotChangeTheTree() {
        String once = resource("basic.scala");
        String spread = once.replace("\n\n", "\n\n\n\n");
        assertNotEquals(once, spread);
        assertEquals(withoutPositions(lower("a.scala", once)), withoutPositions(lower("a.scala", spread)));
    }

    @Test
    public void testPositionsComeFromTokens() {
        String code = resource("basic.scala");
        ParseResult<Program> parsed = ParseDriver.parse("basic.scala", code, new FrontendOptions());
        Set<Integer> offsets = new HashSet<>();
        for (LexerToken token : parsed.tokens()) {
            offsets.add(token.info.offset);
        }
        List<SourceInfo> infos = SourceInfoCollector.collect(lower("basic.scala", code));
        assertFalse(infos.isEmpty());
        for (SourceInfo info : infos) {
            assertFalse(info.isFake(), "no synthesized leaf expected: " + info);
            assertTrue(offsets.contains(info.offset), "leaf without token: " + info);
        }
    }

    @Test
    public void testClassWithParents() {
        ProgramNode program = lower("p.scala",
                "package a.b\n\nabstract class P(x: Int) extends Q(x) with R {\n  var n: Long = 0\n  type T = List[Int]\n}\n");
        PackageNode pkg = (PackageNode) program.items.get(0);
        assertEquals(2, pkg.path.size());

        DefinitionNode def = (DefinitionNode) program.items.get(1);
        assertTrue(def.entity.hasAttribute(KeywordAttribute.ABSTRACT));
        ClassDefinitionNode cls = (ClassDefinitionNode) def.definition;
        assertEquals(ClassDefinitionNode.Kind.CLASS, cls.kind);
        assertEquals(1, cls.parameters.size());
        assertInstanceOf(CallNode.class, cls.parents.get(0));
        assertInstanceOf(TypeNode.class, cls.parents.get(1));

        DefinitionNode n = (DefinitionNode) cls.body.get(0).value;
        assertTrue(n.entity.hasAttribute(KeywordAttribute.MUTABLE));
        assertEquals(TypeNode.Kind.BUILTIN, ((VariableDefinitionNode) n.definition).type.kind);

        TypeDefinitionNode alias = (TypeDefinitionNode) ((DefinitionNode) cls.body.get(1).value).definition;
        assertEquals(TypeDefinitionNode.Kind.ALIAS, alias.kind);
        assertEquals(TypeNode.Kind.APPLY, alias.alias.kind);
    }

    @Test
    public void testImportSelectors() {
        ProgramNode program = lower("i.scala", "import a.b.{c, d => e, f => _, _}\n");
        assertEquals(4, program.items.size());
        ImportFromNode c = (ImportFromNode) program.items.get(0);
        assertEquals("c", c.name.name);
        assertNull(c.alias);
        assertEquals(2, c.module.path.size());
        assertEquals("e", ((ImportFromNode) program.items.get(1)).alias.name);
        assertEquals("ImportHide", ((OtherDirectiveNode) program.items.get(2)).category);
        assertInstanceOf(ImportAllNode.class, program.items.get(3));
    }

    @Test
    public void testExpressions() {
        ProgramNode program = lower("e.scala",
                "object O {\n  val u = ()\n  val t = (1, \"s\")\n  val n = new Foo(1)\n  val m = xs map f\n  val c = y: Int\n}\n");
        ClassDefinitionNode obj = (ClassDefinitionNode) ((DefinitionNode) program.items.get(0)).definition;
        assertEquals(ClassDefinitionNode.Kind.OBJECT, obj.kind);

        LiteralNode unit = (LiteralNode) init(obj, 0);
        assertEquals(LiteralNode.Kind.UNIT, unit.kind);
        ContainerNode tuple = (ContainerNode) init(obj, 1);
        assertEquals(ContainerNode.Kind.TUPLE, tuple.kind);

        CallNode newCall = (CallNode) init(obj, 2);
        assertEquals(SpecialKind.NEW, ((SpecialNode) newCall.function).kind);
        assertEquals(ArgumentNode.Kind.ARG_TYPE, newCall.arguments.get(0).kind);
        assertEquals(2, newCall.arguments.size());

        // an alphanumeric operator is a method call
        CallNode map = (CallNode) init(obj, 3);
        assertEquals("map", ((IdNode) ((DotAccessNode) map.function).field).name);

        assertInstanceOf(CastNode.class, init(obj, 4));
    }

    private static Node init(ClassDefinitionNode cls, int index) {
        DefinitionNode def = (DefinitionNode) cls.body.get(index).value;
        return ((VariableDefinitionNode) def.definition).init;
    }

    @Test
    public void testIdentifiersStayUnresolved() {
        ProgramNode program = lower("r.scala", "def f(x: Int) = x\n");
        FunctionDefinitionNode fn = (FunctionDefinitionNode) ((DefinitionNode) program.items.get(0)).definition;
        IdNode x = (IdNode) ((ExprStmtNode) fn.body).expr;
        assertFalse(x.idInfo.isResolved());
    }
}
