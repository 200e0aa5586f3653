package org.polyfront.lowering;

import org.junit.jupiter.api.Test;
import org.polyfront.astnode.*;
import org.polyfront.core.FrontendContext;
import org.polyfront.core.FrontendOptions;
import org.polyfront.cst.JsCst.*;
import org.polyfront.lexer.SourceInfo;
import org.polyfront.runtime.TodoConstructException;
import org.polyfront.runtime.UnhandledConstructException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JsToGenericTest {

    private int offset = 0;

    // A position for a token of the unit under construction; every call gets a fresh offset
    private SourceInfo tok(String text) {
        SourceInfo info = new SourceInfo(text, "t.js", 1, offset + 1, offset);
        offset += text.length() + 1;
        return info;
    }

    private Name n(String name) {
        return new Name(name, tok(name));
    }

    private V v(String name) {
        return new V(n(name));
    }

    private Num num(String value) {
        return new Num(value, tok(value));
    }

    private St exprSt(Expr e) {
        return new St(new ExprStmt(e, tok(";")));
    }

    private St decl(VarKind kind, VarBinding... bindings) {
        return new St(new VarsDecl(kind, tok(kind.name().toLowerCase()), Arrays.asList(bindings)));
    }

    private Block block(Item... items) {
        return new Block(tok("{"), Arrays.asList(items), tok("}"));
    }

    private FuncDecl function(String name, List<Param> params, Item... body) {
        return new FuncDecl(FuncKind.F_FUNC, tok("function"), name == null ? null : new PnId(n(name)), null, null,
                params, Arrays.asList(body));
    }

    private Apply call(Expr fn, Expr... args) {
        return new Apply(fn, tok("("), Arrays.asList(args), tok(")"));
    }

    private static ProgramNode lower(ModuleItem... items) {
        return lower(new FrontendOptions(), items);
    }

    private static ProgramNode lower(FrontendOptions options, ModuleItem... items) {
        options.fileName = "t.js";
        return new JsToGeneric(new FrontendContext(options, null)).program(new Program(Arrays.asList(items)));
    }

    private static ResolvedKind kindOf(Node node) {
        return ((IdNode) node).idInfo.getResolved().kind();
    }

    private static Node exprOf(Node stmt) {
        return ((ExprStmtNode) stmt).expr;
    }

    private static Node initOf(Node def) {
        return ((VariableDefinitionNode) ((DefinitionNode) def).definition).init;
    }

    private static String nameOf(Node def) {
        return ((DefinitionNode) def).entity.name.name;
    }

    private static List<Node> bodyOf(Node def) {
        FunctionDefinitionNode fn = (FunctionDefinitionNode) ((DefinitionNode) def).definition;
        return ((BlockNode) fn.body).elements;
    }

    // ------------------------------------------------------------------
    // Resolution
    // ------------------------------------------------------------------

    @Test
    public void testLocalShadowsParameter() {
        // function f(x) { { let x = 1; x; } x; }
        Name innerX = n("x");
        ProgramNode program = lower(new It(new FunDecl(function("f", List.of(new ParamClassic(n("x"), null)),
                new St(block(decl(VarKind.LET, new VarClassic(innerX, num("1"))), exprSt(v("x")))),
                exprSt(v("x"))))));

        List<Node> body = bodyOf(program.items.get(0));
        BlockNode inner = (BlockNode) body.get(0);
        IdNode innerUse = (IdNode) exprOf(inner.elements.get(1));
        assertEquals(ResolvedKind.LOCAL, kindOf(innerUse));
        assertSame(innerX.info(), innerUse.idInfo.getResolved().defSite());

        assertEquals(ResolvedKind.PARAM, kindOf(exprOf(body.get(1))));
    }

    @Test
    public void testSpecialFormsAndShadowing() {
        // require("a"); function g(require) { require("b"); } console;
        ProgramNode program = lower(
                new It(exprSt(call(v("require"), new Str("a", tok("\"a\""))))),
                new It(new FunDecl(function("g", List.of(new ParamClassic(n("require"), null)),
                        exprSt(call(v("require"), new Str("b", tok("\"b\""))))))),
                new It(exprSt(v("console"))));

        CallNode outer = (CallNode) exprOf(program.items.get(0));
        assertEquals(SpecialKind.REQUIRE, ((SpecialNode) outer.function).kind);

        CallNode inner = (CallNode) exprOf(bodyOf(program.items.get(1)).get(0));
        assertEquals(ResolvedKind.PARAM, kindOf(inner.function));

        assertEquals(ResolvedKind.NOT_RESOLVED, kindOf(exprOf(program.items.get(2))));
    }

    @Test
    public void testModuleLevelDeclarationsAreVisibleAfterwards() {
        // const a = 1; a; var b; b;
        ProgramNode program = lower(
                new It(decl(VarKind.CONST, new VarClassic(n("a"), num("1")))),
                new It(exprSt(v("a"))),
                new It(decl(VarKind.VAR, new VarClassic(n("b"), null))),
                new It(exprSt(v("b"))));
        assertEquals(ResolvedKind.LOCAL, kindOf(exprOf(program.items.get(1))));
        assertEquals(ResolvedKind.LOCAL, kindOf(exprOf(program.items.get(3))));
        assertTrue(((DefinitionNode) program.items.get(0)).entity.hasAttribute(KeywordAttribute.CONST));
        assertEquals(ResolvedKind.LOCAL, kindOf(((DefinitionNode) program.items.get(0)).entity.name));
    }

    @Test
    public void testFunctionNameVisibleInItsBody() {
        // const h = function fact(k) { return fact(k); };
        FuncDecl fact = function("fact", List.of(new ParamClassic(n("k"), null)),
                new St(new Return(tok("return"), call(v("fact"), v("k")))));
        ProgramNode program = lower(new It(decl(VarKind.CONST, new VarClassic(n("h"), new FunctionExpr(fact)))));

        LambdaNode lambda = (LambdaNode) initOf(program.items.get(0));
        ReturnNode ret = (ReturnNode) ((BlockNode) lambda.function.body).elements.get(0);
        CallNode recursive = (CallNode) ret.value;
        assertEquals(ResolvedKind.LOCAL, kindOf(recursive.function));
        assertEquals(ResolvedKind.PARAM, kindOf(recursive.arguments.get(0).value));
    }

    @Test
    public void testVarInNestedFunctionDoesNotLeak() {
        // function f() { var inner; } inner;
        ProgramNode program = lower(
                new It(new FunDecl(function("f", List.of(), decl(VarKind.VAR, new VarClassic(n("inner"), null))))),
                new It(exprSt(v("inner"))));
        assertEquals(ResolvedKind.NOT_RESOLVED, kindOf(exprOf(program.items.get(1))));
    }

    @Test
    public void testCatchBinding() {
        // try { } catch (e) { e; } try { } catch { }
        Try withName = new Try(tok("try"), block(), tok("catch"), n("e"), block(exprSt(v("e"))), null, null);
        Try withoutName = new Try(tok("try"), block(), tok("catch"), null, block(), tok("finally"), block());
        ProgramNode program = lower(new It(new St(withName)), new It(new St(withoutName)));

        TryNode first = (TryNode) program.items.get(0);
        CatchNode handler = first.catches.get(0);
        assertEquals(PatternNode.Kind.ID, handler.pattern.kind);
        BlockNode handlerBody = (BlockNode) handler.body;
        assertEquals(ResolvedKind.LOCAL, kindOf(exprOf(handlerBody.elements.get(0))));

        TryNode second = (TryNode) program.items.get(1);
        assertEquals(PatternNode.Kind.UNDERSCORE, second.catches.get(0).pattern.kind);
        assertNotNull(second.finallyBody);
    }

    // ------------------------------------------------------------------
    // Destructuring
    // ------------------------------------------------------------------

    private PatObj objPattern(String... names) {
        List<PatternProperty> properties = new ArrayList<>();
        for (String name : names) {
            properties.add(new PatId(n(name), null));
        }
        return new PatObj(tok("{"), properties, tok("}"));
    }

    @Test
    public void testObjectDestructuring() {
        // var {x, y} = point; x;
        ProgramNode program = lower(
                new It(decl(VarKind.VAR, new VarPattern(objPattern("x", "y"), v("point")))),
                new It(exprSt(v("x"))));

        assertEquals(4, program.items.size());
        for (int i = 0; i < 3; i++) {
            assertTrue(((DefinitionNode) program.items.get(i)).entity.hasAttribute(KeywordAttribute.VAR));
        }
        DefinitionNode temp = (DefinitionNode) program.items.get(0);
        assertEquals("!tmp1!", temp.entity.name.name);
        assertTrue(temp.entity.name.info.isFake());
        assertEquals(ResolvedKind.NOT_RESOLVED, kindOf(initOf(temp)));

        assertEquals("x", nameOf(program.items.get(1)));
        DotAccessNode xAccess = (DotAccessNode) initOf(program.items.get(1));
        assertEquals("!tmp1!", ((IdNode) xAccess.expr).name);
        assertEquals(ResolvedKind.LOCAL, kindOf(xAccess.expr));
        assertEquals("x", ((IdNode) xAccess.field).name);
        assertEquals("y", nameOf(program.items.get(2)));

        assertEquals(ResolvedKind.LOCAL, kindOf(exprOf(program.items.get(3))));
    }

    @Test
    public void testSimpleDeclarationsCreateNoTemporary() {
        // var a = 1, b = a;
        St source = decl(VarKind.VAR, new VarClassic(n("a"), num("1")), new VarClassic(n("b"), v("a")));
        ProgramNode first = lower(new It(source));
        ProgramNode second = lower(new It(source));

        assertEquals(2, first.items.size());
        for (Node item : first.items) {
            assertFalse(nameOf(item).startsWith("!tmp"));
        }
        assertEquals(ResolvedKind.LOCAL, kindOf(initOf(first.items.get(1))));
        assertEquals(first.toString(), second.toString());
    }

    @Test
    public void testArrayDestructuringSkipsHoles() {
        // let [a, , b] = pair;
        List<PatternProperty> elements = Arrays.asList(new PatId(n("a"), null), null, new PatId(n("b"), null));
        ProgramNode program = lower(new It(decl(VarKind.LET,
                new VarPattern(new PatArr(tok("["), elements, tok("]")), v("pair")))));

        assertEquals(3, program.items.size());
        ArrayAccessNode b = (ArrayAccessNode) initOf(program.items.get(2));
        assertEquals("2", ((LiteralNode) b.index).value);
        assertTrue(((DefinitionNode) program.items.get(2)).entity.hasAttribute(KeywordAttribute.LET));
    }

    @Test
    public void testNestedPatternGetsItsOwnTemporary() {
        // const {p: {q}} = o;
        PatProp nested = new PatProp(new PnId(n("p")), new PatNest(objPattern("q"), null));
        ProgramNode program = lower(new It(decl(VarKind.CONST,
                new VarPattern(new PatObj(tok("{"), List.of(nested), tok("}")), v("o")))));

        assertEquals(3, program.items.size());
        assertEquals("!tmp1!", nameOf(program.items.get(0)));
        assertEquals("!tmp2!", nameOf(program.items.get(1)));
        assertEquals("q", nameOf(program.items.get(2)));
    }

    @Test
    public void testUnsupportedPatternsAreTodo() {
        PatObj rest = new PatObj(tok("{"), List.of(new PatDots(tok("..."), n("others"))), tok("}"));
        TodoConstructException e = assertThrows(TodoConstructException.class,
                () -> lower(new It(decl(VarKind.LET, new VarPattern(rest, v("o"))))));
        assertEquals("VarPattern:rest property", e.category);

        PatObj withDefault = new PatObj(tok("{"), List.of(new PatId(n("x"), num("1"))), tok("}"));
        e = assertThrows(TodoConstructException.class,
                () -> lower(new It(decl(VarKind.LET, new VarPattern(withDefault, v("o"))))));
        assertEquals("VarPattern:default value", e.category);
    }

    @Test
    public void testPatternParameter() {
        // function f({a}) { return a; }
        FuncDecl f = function("f", List.of(new ParamPattern(objPattern("a"), null)),
                new St(new Return(tok("return"), v("a"))));
        ProgramNode program = lower(new It(new FunDecl(f)));

        FunctionDefinitionNode fn = (FunctionDefinitionNode) ((DefinitionNode) program.items.get(0)).definition;
        IdNode param = fn.parameters.get(0).name;
        assertEquals("!arg0!", param.name);
        assertTrue(param.info.isFake());

        List<Node> body = bodyOf(program.items.get(0));
        DefinitionNode a = (DefinitionNode) body.get(0);
        assertTrue(a.entity.hasAttribute(KeywordAttribute.LET));
        assertEquals(ResolvedKind.PARAM, kindOf(((DotAccessNode) initOf(a)).expr));
        assertEquals(ResolvedKind.LOCAL, kindOf(((ReturnNode) body.get(1)).value));
    }

    // ------------------------------------------------------------------
    // Modules
    // ------------------------------------------------------------------

    @Test
    public void testImports() {
        // import React, {useState as us, b} from "react"; import * as ns from "n"; import "./a.css"; us;
        ImportClause names = new ImportNames(List.of(new NameAlias(n("useState"), n("us")), new NameAlias(n("b"), null)));
        ProgramNode program = lower(
                new ImportItem(tok("import"), new ImportFrom(n("React"), names, n("react"))),
                new ImportItem(tok("import"), new ImportFrom(null, new ImportNamespace(tok("*"), n("ns")), n("n"))),
                new ImportItem(tok("import"), new ImportEffect(n("./a.css"))),
                new It(exprSt(v("us"))));

        ImportFromNode def = (ImportFromNode) program.items.get(0);
        assertEquals(JsToGeneric.DEFAULT_EXPORT, def.name.name);
        assertEquals("React", def.alias.name);
        assertTrue(def.module.isFile());
        assertEquals("us", ((ImportFromNode) program.items.get(1)).alias.name);
        assertNull(((ImportFromNode) program.items.get(2)).alias);
        assertEquals("ns", ((ImportAsNode) program.items.get(3)).alias.name);
        assertEquals("ImportCss", ((OtherDirectiveNode) program.items.get(4)).category);
        assertEquals(ResolvedKind.IMPORTED, kindOf(exprOf(program.items.get(5))));
    }

    @Test
    public void testTypeImportsAreDropped() {
        ImportClause types = new ImportTypes(List.of(new NameAlias(n("T"), null)));
        ProgramNode program = lower(new ImportItem(tok("import"), new ImportFrom(null, types, n("t"))));
        assertTrue(program.items.isEmpty());
    }

    @Test
    public void testDefaultExportOfExpression() {
        ProgramNode program = lower(new ExportItem(tok("export"), new ExportDefaultExpr(tok("default"), num("42"))));
        assertEquals(2, program.items.size());
        assertEquals(JsToGeneric.DEFAULT_EXPORT, nameOf(program.items.get(0)));
        assertEquals(JsToGeneric.DEFAULT_EXPORT, ((ExportNode) program.items.get(1)).name.name);
    }

    @Test
    public void testExportedDeclarations() {
        // export function f() {} export default function () {} export default class C {}
        ProgramNode program = lower(
                new ExportItem(tok("export"), new ExportDeclaration(new FunDecl(function("f", List.of())))),
                new ExportItem(tok("export"), new ExportDefaultDecl(tok("default"),
                        new FunDecl(function(null, List.of())))),
                new ExportItem(tok("export"), new ExportDefaultDecl(tok("default"),
                        new ClassItem(new ClassDecl(tok("class"), n("C"), null, List.of())))));

        assertEquals(7, program.items.size());
        assertEquals("f", nameOf(program.items.get(0)));
        assertEquals("f", ((ExportNode) program.items.get(1)).name.name);

        assertEquals(JsToGeneric.DEFAULT_EXPORT, nameOf(program.items.get(2)));
        assertInstanceOf(FunctionDefinitionNode.class, ((DefinitionNode) program.items.get(2)).definition);
        assertEquals(JsToGeneric.DEFAULT_EXPORT, ((ExportNode) program.items.get(3)).name.name);

        assertEquals("C", nameOf(program.items.get(4)));
        assertEquals(JsToGeneric.DEFAULT_EXPORT, nameOf(program.items.get(5)));
        assertEquals("C", ((IdNode) initOf(program.items.get(5))).name);
        assertInstanceOf(ExportNode.class, program.items.get(6));
    }

    @Test
    public void testExportNamesAndReexports() {
        // const a = 1; export {a, a as b}; export {x as y} from "m";
        ProgramNode program = lower(
                new It(decl(VarKind.CONST, new VarClassic(n("a"), num("1")))),
                new ExportItem(tok("export"), new ExportNames(List.of(new NameAlias(n("a"), null),
                        new NameAlias(n("a"), n("b"))))),
                new ExportItem(tok("export"), new ReExportNames(List.of(new NameAlias(n("x"), n("y"))), n("m"))));

        ExportNode a = (ExportNode) program.items.get(1);
        assertEquals(ResolvedKind.LOCAL, kindOf(a.name));
        assertEquals("b", nameOf(program.items.get(2)));
        assertEquals(ResolvedKind.LOCAL, kindOf(initOf(program.items.get(2))));
        assertEquals("b", ((ExportNode) program.items.get(3)).name.name);

        ImportFromNode reimport = (ImportFromNode) program.items.get(4);
        assertEquals("x", reimport.name.name);
        assertEquals("!tmp_x", reimport.alias.name);
        assertEquals("y", nameOf(program.items.get(5)));
        assertEquals("y", ((ExportNode) program.items.get(6)).name.name);
    }

    @Test
    public void testUnsupportedModuleForms() {
        UnhandledConstructException e = assertThrows(UnhandledConstructException.class,
                () -> lower(new ExportItem(tok("export"), new ReExportNamespace(tok("*"), n("m")))));
        assertEquals("reexporting namespace", e.category);

        e = assertThrows(UnhandledConstructException.class,
                () -> lower(new It(new InterfaceDecl(tok("interface"), n("I")))));
        assertEquals("Typescript", e.category);

        e = assertThrows(UnhandledConstructException.class,
                () -> lower(new It(new FunDecl(function(null, List.of())))));
        assertEquals("anonymous function declaration", e.category);

        TodoConstructException todo = assertThrows(TodoConstructException.class,
                () -> lower(new It(new ItemTodo("decorator", tok("@")))));
        assertEquals("ItemTodo", todo.category);
    }

    // ------------------------------------------------------------------
    // Statements and expressions
    // ------------------------------------------------------------------

    @Test
    public void testForOfBecomesIteratorLoop() {
        // for (const item of xs) { item; }
        ForOf loop = new ForOf(tok("for"), new ForLhsVar(VarKind.CONST, tok("const"), new VarClassic(n("item"), null)),
                tok("of"), v("xs"), block(exprSt(v("item"))));
        ProgramNode program = lower(new It(new St(loop)));

        ForNode forNode = (ForNode) program.items.get(0);
        assertEquals(2, forNode.init.size());
        assertEquals(JsTranspile.ITERATOR, nameOf(forNode.init.get(0)));
        assertEquals(JsTranspile.STEP, nameOf(forNode.init.get(1)));
        assertNull(forNode.next);
        CallNode not = (CallNode) forNode.condition;
        assertEquals(Operator.NOT, ((SpecialNode) not.function).operator);

        BlockNode body = (BlockNode) forNode.body;
        DefinitionNode item = (DefinitionNode) body.elements.get(0);
        assertEquals("item", item.entity.name.name);
        assertTrue(item.entity.hasAttribute(KeywordAttribute.CONST));
        BlockNode userBody = (BlockNode) body.elements.get(1);
        assertEquals(ResolvedKind.LOCAL, kindOf(exprOf(userBody.elements.get(0))));
    }

    @Test
    public void testForOfKeepsLabelsAndJumps() {
        // outer: for (const x of xs) { continue outer; break; }
        ForOf loop = new ForOf(tok("for"), new ForLhsVar(VarKind.CONST, tok("const"), new VarClassic(n("x"), null)),
                tok("of"), v("xs"), block(new St(new Continue(tok("continue"), n("outer"))),
                new St(new Break(tok("break"), null))));
        ProgramNode program = lower(new It(new St(new Labeled(n("outer"), loop))));

        LabelNode label = assertInstanceOf(LabelNode.class, program.items.get(0));
        assertEquals("outer", label.label.name);
        ForNode forNode = assertInstanceOf(ForNode.class, label.body);
        // no step expression, so continue goes straight back to the condition
        assertNull(forNode.next);

        BlockNode userBody = (BlockNode) ((BlockNode) forNode.body).elements.get(1);
        JumpNode continueOuter = assertInstanceOf(JumpNode.class, userBody.elements.get(0));
        assertEquals(JumpNode.Kind.CONTINUE, continueOuter.kind);
        assertEquals("outer", continueOuter.label.name);
        JumpNode plainBreak = assertInstanceOf(JumpNode.class, userBody.elements.get(1));
        assertEquals(JumpNode.Kind.BREAK, plainBreak.kind);
        assertNull(plainBreak.label);
    }

    @Test
    public void testNumericLiteralKinds() {
        String[] ints = {"42", "1_000", "10n", "0x1F", "0b1010_0101", "0o17n"};
        String[] floats = {"1.5", ".5", "1e3", "1_000.25"};
        for (String value : ints) {
            LiteralNode lit = (LiteralNode) exprOf(lower(new It(exprSt(num(value)))).items.get(0));
            assertEquals(LiteralNode.Kind.INT, lit.kind, value);
            assertEquals(value, lit.value);
        }
        for (String value : floats) {
            LiteralNode lit = (LiteralNode) exprOf(lower(new It(exprSt(num(value)))).items.get(0));
            assertEquals(LiteralNode.Kind.FLOAT, lit.kind, value);
        }
    }

    @Test
    public void testForOfWithPatternFailurePrefix() {
        PatObj rest = new PatObj(tok("{"), List.of(new PatDots(tok("..."), n("r"))), tok("}"));
        ForOf loop = new ForOf(tok("for"), new ForLhsVar(VarKind.LET, tok("let"), new VarPattern(rest, null)),
                tok("of"), v("xs"), block());
        TodoConstructException e = assertThrows(TodoConstructException.class, () -> lower(new It(new St(loop))));
        assertEquals("ForOf:rest property", e.category);
    }

    @Test
    public void testForIn() {
        // for (let k in o) k;
        ForIn loop = new ForIn(tok("for"), new ForLhsVar(VarKind.LET, tok("let"), new VarClassic(n("k"), null)),
                tok("in"), v("o"), new ExprStmt(v("k"), tok(";")));
        ProgramNode program = lower(new It(new St(loop)));
        ForEachNode forEach = (ForEachNode) program.items.get(0);
        assertEquals("k", ((IdNode) forEach.pattern.value).name);
        assertEquals(ResolvedKind.LOCAL, kindOf(exprOf(forEach.body)));

        ForIn withPattern = new ForIn(tok("for"), new ForLhsVar(VarKind.LET, tok("let"),
                new VarPattern(objPattern("a"), null)), tok("in"), v("o"), block());
        TodoConstructException e = assertThrows(TodoConstructException.class,
                () -> lower(new It(new St(withPattern))));
        assertEquals("For in with (pattern) vars?", e.category);
    }

    @Test
    public void testWithIsTodo() {
        With with = new With(tok("with"), v("o"), block());
        TodoConstructException e = assertThrows(TodoConstructException.class, () -> lower(new It(new St(with))));
        assertEquals("with", e.category);
    }

    @Test
    public void testArrowExpressionBodyReturns() {
        // const inc = x => x + 1;
        Arrow arrow = new Arrow(null, List.of(new ParamClassic(n("x"), null)), tok("=>"),
                new ArrowExprBody(new Binary(v("x"), BinaryOp.B_ADD, tok("+"), num("1"))));
        ProgramNode program = lower(new It(decl(VarKind.CONST, new VarClassic(n("inc"), new ArrowExpr(arrow)))));

        FunctionDefinitionNode fn = ((LambdaNode) initOf(program.items.get(0))).function;
        assertEquals(FunctionDefinitionNode.Kind.ARROW, fn.kind);
        ReturnNode ret = (ReturnNode) fn.body;
        assertTrue(ret.info.isFake());
        CallNode plus = (CallNode) ret.value;
        assertEquals(Operator.PLUS, ((SpecialNode) plus.function).operator);
        assertEquals(ResolvedKind.PARAM, kindOf(plus.arguments.get(0).value));
    }

    @Test
    public void testUseStrictAndCompoundAssignment() {
        ProgramNode program = lower(
                new It(exprSt(new Str("use strict", tok("\"use strict\"")))),
                new It(exprSt(new Assign(v("total"), BinaryOp.B_ADD, tok("+="), num("2")))));

        CallNode strict = (CallNode) exprOf(program.items.get(0));
        assertEquals(SpecialKind.USE_STRICT, ((SpecialNode) strict.function).kind);
        AssignOpNode assign = (AssignOpNode) exprOf(program.items.get(1));
        assertEquals(Operator.PLUS, assign.operator);
    }

    @Test
    public void testClassMembers() {
        // class K extends Base { static count = 0; get size() {} [key]() {} }
        FuncDecl getter = new FuncDecl(FuncKind.F_GET, tok("get"), new PnId(n("size")), null, null, List.of(), List.of());
        FuncDecl computed = new FuncDecl(FuncKind.F_METHOD, null,
                new PnComputed(tok("["), v("key"), tok("]")), null, null, List.of(), List.of());
        ClassDecl decl = new ClassDecl(tok("class"), n("K"), v("Base"), List.of(
                new CField(tok("static"), new PnId(n("count")), num("0")),
                new CMethod(null, getter),
                new CMethod(null, computed)));
        ProgramNode program = lower(new It(new ClassItem(decl)));

        ClassDefinitionNode cls = (ClassDefinitionNode) ((DefinitionNode) program.items.get(0)).definition;
        assertEquals(1, cls.parents.size());
        DefinitionNode count = (DefinitionNode) cls.body.get(0).value;
        assertTrue(count.entity.hasAttribute(KeywordAttribute.STATIC));
        FunctionDefinitionNode size = (FunctionDefinitionNode) ((DefinitionNode) cls.body.get(1).value).definition;
        assertTrue(size.properties.get(0).isKeyword(KeywordAttribute.GETTER));
        assertEquals(FieldNode.Kind.DYNAMIC, cls.body.get(2).kind);
    }

    @Test
    public void testTemplateString() {
        Encaps encaps = new Encaps(null, tok("`"), List.of(new Str("a", tok("a")), v("b")));
        ProgramNode program = lower(new It(exprSt(encaps)));
        CallNode call = (CallNode) exprOf(program.items.get(0));
        assertEquals(SpecialKind.ENCODED_STRING, ((SpecialNode) call.function).kind);
        assertEquals(2, call.arguments.size());
    }

    // ------------------------------------------------------------------
    // JSX
    // ------------------------------------------------------------------

    private Xml element() {
        // <div className="c">hi<Child/></div>
        Xml child = new Xml(n("Child"), List.of(), List.of());
        return new Xml(n("div"), List.of(new XmlAttrValue(n("className"), new Str("c", tok("\"c\"")))),
                List.of(new XmlText(n("hi")), new XmlChild(child)));
    }

    @Test
    public void testXmlKeptByDefault() {
        ProgramNode program = lower(new It(exprSt(new XmlExpr(element()))));
        XmlNode xml = (XmlNode) exprOf(program.items.get(0));
        assertEquals("div", xml.tag.name);
        assertEquals(1, xml.attributes.size());
        assertEquals(2, xml.body.size());
    }

    @Test
    public void testXmlTranspiledToCreateElement() {
        FrontendOptions options = new FrontendOptions();
        options.transpileXml = true;
        ProgramNode program = lower(options, new It(exprSt(new XmlExpr(element()))));

        CallNode call = (CallNode) exprOf(program.items.get(0));
        DotAccessNode createElement = (DotAccessNode) call.function;
        assertEquals("createElement", ((IdNode) createElement.field).name);
        assertEquals("React", ((IdNode) createElement.expr).name);
        assertEquals(4, call.arguments.size());
        assertEquals(LiteralNode.Kind.STRING, ((LiteralNode) call.arguments.get(0).value).kind);
        assertInstanceOf(RecordNode.class, call.arguments.get(1).value);
        CallNode child = (CallNode) call.arguments.get(3).value;
        assertEquals("Child", ((IdNode) child.arguments.get(0).value).name);
        assertEquals(LiteralNode.Kind.NULL, ((LiteralNode) child.arguments.get(1).value).kind);
    }
}
