package org.polyfront.lowering;

import org.junit.jupiter.api.Test;
import org.polyfront.astnode.*;
import org.polyfront.core.FrontendContext;
import org.polyfront.core.FrontendOptions;
import org.polyfront.cst.JavaCst.*;
import org.polyfront.lexer.SourceInfo;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JavaToGenericTest {

    private int offset = 0;

    private SourceInfo tok(String text) {
        SourceInfo info = new SourceInfo(text, "T.java", 1, offset + 1, offset);
        offset += text.length() + 1;
        return info;
    }

    private Name n(String name) {
        return new Name(name, tok(name));
    }

    private List<Name> path(String dotted) {
        List<Name> out = new ArrayList<>();
        for (String part : dotted.split("\\.")) {
            out.add(n(part));
        }
        return out;
    }

    private Expr name(String dotted) {
        return new QualifiedName(path(dotted));
    }

    private Type cls(String name, TypeArgument... args) {
        return new TClass(List.of(new ClassTypePart(n(name), List.of(args))));
    }

    private Type basic(String name) {
        return new TBasic(n(name));
    }

    private Block block(Stmt... stmts) {
        return new Block(tok("{"), List.of(stmts), tok("}"));
    }

    private Mod mod(ModifierKind kind) {
        return new Modifier(kind, tok(kind.name().toLowerCase()));
    }

    private static JavaToGeneric lowering() {
        FrontendOptions options = new FrontendOptions();
        options.fileName = "T.java";
        return new JavaToGeneric(new FrontendContext(options, null));
    }

    private static ProgramNode lower(PackageDecl pkg, List<ImportDecl> imports, Decl... decls) {
        return lowering().program(new CompilationUnit(pkg, imports, List.of(decls)));
    }

    private static Operator operatorOf(Node node) {
        SpecialNode special = (SpecialNode) ((CallNode) node).function;
        assertEquals(SpecialKind.OPERATOR, special.kind);
        return special.operator;
    }

    private static List<String> pathOf(TypeNode type) {
        List<String> out = new ArrayList<>();
        for (IdNode id : type.path) {
            out.add(id.name);
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Compilation unit
    // ------------------------------------------------------------------

    @Test
    public void testPackageAndImports() {
        ProgramNode program = lower(new PackageDecl(tok("package"), path("org.demo")),
                List.of(new ImportAll(tok("import"), false, path("java.util"), tok("*")),
                        new ImportFrom(tok("import"), true, path("java.lang.Math"), n("max"))));

        assertEquals(3, program.items.size());
        PackageNode pkg = assertInstanceOf(PackageNode.class, program.items.get(0));
        assertEquals("demo", pkg.path.get(1).name);
        ImportAllNode all = assertInstanceOf(ImportAllNode.class, program.items.get(1));
        assertEquals("util", all.module.path.get(1).name);
        ImportFromNode from = assertInstanceOf(ImportFromNode.class, program.items.get(2));
        assertEquals("max", from.name.name);
        assertEquals(3, from.module.path.size());
        assertNull(from.alias);
    }

    // ------------------------------------------------------------------
    // Declarations
    // ------------------------------------------------------------------

    @Test
    public void testClassWithParentsModifiersAndThrows() {
        // public final class Box<T> extends Base implements Runnable {
        //     @Override public void run() throws IOException {}
        // }
        Annotation override = new Annotation(tok("@"), path("Override"), null);
        MethodDecl run = new MethodDecl(new VarDef(n("run"), List.of(override, mod(ModifierKind.PUBLIC)), basic("void")),
                List.of(), List.of(), List.of(cls("IOException")), block());
        ClassDecl box = new ClassDecl(tok("class"), ClassKind.CLASS, n("Box"), List.of(new TypeParam(n("T"), List.of())),
                List.of(mod(ModifierKind.PUBLIC), mod(ModifierKind.FINAL)), cls("Base"), List.of(cls("Runnable")),
                List.of(new MethodD(run)));

        DefinitionNode def = (DefinitionNode) lower(null, List.of(), new ClassD(box)).items.get(0);
        assertEquals("Box", def.entity.name.name);
        assertEquals("T", def.entity.typeParameters.get(0).name);
        assertEquals(KeywordAttribute.PUBLIC, def.entity.attributes.get(0).keyword);
        assertEquals(KeywordAttribute.FINAL, def.entity.attributes.get(1).keyword);

        ClassDefinitionNode cls = assertInstanceOf(ClassDefinitionNode.class, def.definition);
        assertEquals(ClassDefinitionNode.Kind.CLASS, cls.kind);
        assertEquals(List.of("Base"), pathOf((TypeNode) cls.parents.get(0)));
        assertEquals(List.of("Runnable"), pathOf((TypeNode) cls.parents.get(1)));

        DefinitionNode method = (DefinitionNode) cls.body.get(0).value;
        List<AttributeNode> attrs = method.entity.attributes;
        assertNull(attrs.get(0).keyword);
        assertEquals(List.of("Override"), pathOf(attrs.get(0).name));
        assertEquals(KeywordAttribute.PUBLIC, attrs.get(1).keyword);
        assertEquals(KeywordAttribute.THROWS, attrs.get(2).keyword);
        assertEquals(List.of("IOException"), pathOf(attrs.get(2).name));

        FunctionDefinitionNode fn = assertInstanceOf(FunctionDefinitionNode.class, method.definition);
        assertEquals(FunctionDefinitionNode.Kind.METHOD, fn.kind);
        assertEquals(TypeNode.Kind.BUILTIN, fn.returnType.kind);
        assertInstanceOf(BlockNode.class, fn.body);
    }

    @Test
    public void testInterfaceAndAbstractMethod() {
        MethodDecl size = new MethodDecl(new VarDef(n("size"), List.of(), basic("int")), List.of(), List.of(),
                List.of(), null);
        ClassDecl sized = new ClassDecl(tok("interface"), ClassKind.INTERFACE, n("Sized"), List.of(), List.of(), null,
                List.of(cls("Countable")), List.of(new MethodD(size)));

        DefinitionNode def = (DefinitionNode) lower(null, List.of(), new ClassD(sized)).items.get(0);
        ClassDefinitionNode cls = (ClassDefinitionNode) def.definition;
        assertEquals(ClassDefinitionNode.Kind.INTERFACE, cls.kind);
        assertEquals(1, cls.parents.size());
        FunctionDefinitionNode fn = (FunctionDefinitionNode) ((DefinitionNode) cls.body.get(0).value).definition;
        assertNull(fn.body);
    }

    @Test
    public void testEnumBecomesSumType() {
        EnumDecl color = new EnumDecl(tok("enum"), n("Color"), List.of(), List.of(),
                List.of(new EnumConstant(n("RED"), null, null),
                        new EnumConstant(n("GREEN"), List.of(new IntLit("2", tok("2"))), null)),
                List.of());

        DefinitionNode def = (DefinitionNode) lower(null, List.of(), new EnumD(color)).items.get(0);
        TypeDefinitionNode sum = assertInstanceOf(TypeDefinitionNode.class, def.definition);
        assertEquals(TypeDefinitionNode.Kind.SUM, sum.kind);
        assertEquals(2, sum.alternatives.size());
        assertEquals("GREEN", sum.alternatives.get(1).name.name);
        assertEquals(OrTypeElementNode.Kind.ENUM, sum.alternatives.get(1).kind);
    }

    @Test
    public void testStaticInitializerAndFields() {
        VarWithInit counter = new VarWithInit(new VarDef(n("count"), List.of(mod(ModifierKind.STATIC)), basic("int")),
                new ExprInit(new IntLit("0", tok("0"))));
        ClassDecl holder = new ClassDecl(tok("class"), ClassKind.CLASS, n("Holder"), List.of(), List.of(), null,
                List.of(), List.of(new FieldD(counter), new InitD(true, block()), new InitD(false, block())));

        ClassDefinitionNode cls = (ClassDefinitionNode) ((DefinitionNode) lower(null, List.of(), new ClassD(holder))
                .items.get(0)).definition;
        DefinitionNode field = (DefinitionNode) cls.body.get(0).value;
        assertEquals(KeywordAttribute.STATIC, field.entity.attributes.get(0).keyword);
        assertEquals("0", ((LiteralNode) ((VariableDefinitionNode) field.definition).init).value);
        assertEquals("StaticInit", ((OtherStmtNode) cls.body.get(1).value).category);
        assertInstanceOf(BlockNode.class, cls.body.get(2).value);
    }

    @Test
    public void testVariadicParameter() {
        MethodDecl main = new MethodDecl(new VarDef(n("main"), List.of(), basic("void")), List.of(),
                List.of(new ParamSpread(tok("..."), new VarDef(n("args"), List.of(), cls("String")))), List.of(),
                block());
        FunctionDefinitionNode fn = (FunctionDefinitionNode) ((DefinitionNode) lowering().decl(new MethodD(main)))
                .definition;
        assertEquals(ParameterNode.Kind.VARIADIC, fn.parameters.get(0).kind);
        assertEquals("args", fn.parameters.get(0).name.name);
    }

    @Test
    public void testAnnotationArguments() {
        // @SuppressWarnings(value = {"a", "b"})
        Annotation a = new Annotation(tok("@"), path("SuppressWarnings"),
                List.of(new AnnotPair(n("value"), tok("="), new AnnotArray(tok("{"), List.of(
                        new AnnotExpr(new StrLit("a", tok("\"a\""))), new AnnotExpr(new StrLit("b", tok("\"b\""))))))));
        AttributeNode attr = lowering().annotation(a);
        AssignNode pair = assertInstanceOf(AssignNode.class, attr.arguments.get(0).value);
        ContainerNode list = assertInstanceOf(ContainerNode.class, pair.right);
        assertEquals(2, list.elements.size());
    }

    // ------------------------------------------------------------------
    // Types
    // ------------------------------------------------------------------

    @Test
    public void testGenericAndWildcardTypes() {
        // List<? extends Number>, Map<String, ?>, int[][]
        TypeNode list = lowering().type(cls("List", new TQuestion(tok("?"), false, cls("Number"))));
        assertEquals(TypeNode.Kind.APPLY, list.kind);
        TypeNode wildcard = list.args.get(0);
        assertEquals(List.of("?"), pathOf(wildcard));
        assertEquals(List.of("Number"), pathOf(wildcard.args.get(0)));

        TypeNode map = lowering().type(cls("Map", new TArgument(cls("String")), new TQuestion(tok("?"), false, null)));
        assertEquals(TypeNode.Kind.BUILTIN, map.args.get(1).kind);

        TypeNode matrix = lowering().type(new TArray(new TArray(basic("int"))));
        assertEquals(TypeNode.Kind.ARRAY, matrix.kind);
        assertEquals(TypeNode.Kind.ARRAY, matrix.args.get(0).kind);
    }

    @Test
    public void testQualifiedClassType() {
        TypeNode entry = lowering().type(new TClass(List.of(new ClassTypePart(n("Map"), List.of()),
                new ClassTypePart(n("Entry"), List.of(new TArgument(cls("K")), new TArgument(cls("V")))))));
        assertEquals(List.of("Map", "Entry"), pathOf(entry));
        assertEquals(2, entry.args.size());
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    @Test
    public void testShiftOperatorsKeepSignedness() {
        JavaToGeneric lowering = lowering();
        assertEquals(Operator.LSL, operatorOf(lowering.expr(new Infix(name("a"), BinaryOp.SHL, tok("<<"), name("b")))));
        assertEquals(Operator.ASR, operatorOf(lowering.expr(new Infix(name("a"), BinaryOp.SHR, tok(">>"), name("b")))));
        assertEquals(Operator.LSR, operatorOf(lowering.expr(new Infix(name("a"), BinaryOp.USHR, tok(">>>"), name("b")))));
        for (BinaryOp op : BinaryOp.values()) {
            assertNotNull(JavaToGeneric.BINARY_OPERATORS.get(op), op.name());
        }
        for (ModifierKind kind : ModifierKind.values()) {
            assertNotNull(JavaToGeneric.MODIFIERS.get(kind), kind.name());
        }
    }

    @Test
    public void testQualifiedNameBecomesDotChain() {
        DotAccessNode pi = assertInstanceOf(DotAccessNode.class, lowering().expr(name("java.lang.Math.PI")));
        assertEquals("PI", ((IdNode) pi.field).name);
        DotAccessNode math = (DotAccessNode) pi.expr;
        assertEquals("Math", ((IdNode) math.field).name);
        assertEquals("java", ((IdNode) ((DotAccessNode) math.expr).expr).name);

        DotAccessNode field = (DotAccessNode) lowering().expr(name("this.count"));
        assertEquals(SpecialKind.THIS, ((SpecialNode) field.expr).kind);
        assertInstanceOf(IdNode.class, lowering().expr(name("x")));
    }

    @Test
    public void testNewWithAnonymousClass() {
        Expr anon = new NewClass(tok("new"), cls("Runnable"), List.of(), List.of());
        CallNode call = (CallNode) lowering().expr(anon);
        assertEquals(SpecialKind.NEW, ((SpecialNode) call.function).kind);
        AnonClassNode cls = assertInstanceOf(AnonClassNode.class, call.arguments.get(0).value);
        assertEquals(List.of("Runnable"), pathOf((TypeNode) cls.classDefinition.parents.get(0)));

        Expr plain = new NewClass(tok("new"), cls("ArrayList", new TArgument(cls("String"))),
                List.of(new IntLit("8", tok("8"))), null);
        CallNode create = (CallNode) lowering().expr(plain);
        assertEquals(ArgumentNode.Kind.ARG_TYPE, create.arguments.get(0).kind);
        assertEquals(TypeNode.Kind.APPLY, ((TypeNode) create.arguments.get(0).value).kind);
        assertEquals("8", ((LiteralNode) create.arguments.get(1).value).value);
    }

    @Test
    public void testNewArrayCountsAllDimensions() {
        // new int[n][]
        CallNode call = (CallNode) lowering().expr(new NewArray(tok("new"), basic("int"), List.of(name("n")), 1, null));
        TypeNode t = (TypeNode) call.arguments.get(0).value;
        assertEquals(TypeNode.Kind.ARRAY, t.kind);
        assertEquals(TypeNode.Kind.ARRAY, t.args.get(0).kind);
        assertEquals(TypeNode.Kind.BUILTIN, t.args.get(0).args.get(0).kind);
        assertEquals(2, call.arguments.size());
    }

    @Test
    public void testInstanceOfAndMethodRef() {
        CallNode test = (CallNode) lowering().expr(new InstanceOf(name("o"), tok("instanceof"), cls("String")));
        assertEquals(SpecialKind.INSTANCEOF, ((SpecialNode) test.function).kind);
        assertEquals(ArgumentNode.Kind.ARG_TYPE, test.arguments.get(1).kind);

        OtherExprNode ref = (OtherExprNode) lowering().expr(new MethodRef(null, cls("String"), tok("::"), n("valueOf")));
        assertEquals("MethodRef", ref.category);
        assertEquals("valueOf", ((IdNode) ref.parts.get(1)).name);
    }

    @Test
    public void testLambdaWithUntypedParameters() {
        // (a, b) -> a + b
        Expr sum = new Infix(name("a"), BinaryOp.PLUS, tok("+"), name("b"));
        Lambda lambda = new Lambda(List.of(new ParamClassic(new VarDef(n("a"), List.of(), null)),
                new ParamClassic(new VarDef(n("b"), List.of(), null))), tok("->"), new ExprSt(sum, null));

        LambdaNode node = assertInstanceOf(LambdaNode.class, lowering().expr(lambda));
        assertEquals(FunctionDefinitionNode.Kind.LAMBDA, node.function.kind);
        assertEquals(2, node.function.parameters.size());
        assertNull(node.function.parameters.get(0).type);
        ExprStmtNode body = assertInstanceOf(ExprStmtNode.class, node.function.body);
        assertEquals(Operator.PLUS, operatorOf(body.expr));
    }

    @Test
    public void testCompoundAssignment() {
        AssignOpNode node = (AssignOpNode) lowering().expr(
                new AssignOp(name("x"), BinaryOp.USHR, tok(">>>="), new IntLit("1", tok("1"))));
        assertEquals(Operator.LSR, node.operator);
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    @Test
    public void testForeachKeepsDeclaredType() {
        // for (String s : xs) ;
        Stmt loop = new For(tok("for"), new Foreach(new VarDef(n("s"), List.of(), cls("String")), tok(":"), name("xs")),
                new Empty(tok(";")));
        ForEachNode each = assertInstanceOf(ForEachNode.class, lowering().stmt(loop));
        assertEquals("s", ((IdNode) each.pattern.value).name);
        assertEquals(List.of("String"), pathOf(each.pattern.type));
        assertEquals("xs", ((IdNode) each.collection).name);
    }

    @Test
    public void testClassicForWithSeveralUpdates() {
        // for (int i = 0, j = 9; i < j; i++, j--) ;
        ForInit init = new ForInitVars(List.of(
                new VarWithInit(new VarDef(n("i"), List.of(), basic("int")), new ExprInit(new IntLit("0", tok("0")))),
                new VarWithInit(new VarDef(n("j"), List.of(), basic("int")), new ExprInit(new IntLit("9", tok("9"))))));
        Stmt loop = new For(tok("for"), new ForClassic(init, new Infix(name("i"), BinaryOp.LT, tok("<"), name("j")),
                List.of(new Postfix(name("i"), IncrDecr.INCR, tok("++")), new Postfix(name("j"), IncrDecr.DECR, tok("--")))),
                new Empty(tok(";")));

        ForNode node = assertInstanceOf(ForNode.class, lowering().stmt(loop));
        assertEquals(2, node.init.size());
        assertInstanceOf(DefinitionNode.class, node.init.get(0));
        assertEquals(Operator.LT, operatorOf(node.condition));
        assertEquals(2, assertInstanceOf(SeqNode.class, node.next).exprs.size());
    }

    @Test
    public void testLabeledLoopJumps() {
        // outer: for (;;) { continue outer; break; }
        Stmt loop = new For(tok("for"), new ForClassic(null, null, List.of()),
                block(new Continue(tok("continue"), n("outer")), new Break(tok("break"), null)));
        LabelNode label = assertInstanceOf(LabelNode.class, lowering().stmt(new Label(n("outer"), loop)));
        assertEquals("outer", label.label.name);

        ForNode node = assertInstanceOf(ForNode.class, label.body);
        assertTrue(node.init.isEmpty());
        assertNull(node.condition);
        assertNull(node.next);
        BlockNode body = (BlockNode) node.body;
        JumpNode next = (JumpNode) body.elements.get(0);
        assertEquals(JumpNode.Kind.CONTINUE, next.kind);
        assertEquals("outer", next.label.name);
        assertNull(((JumpNode) body.elements.get(1)).label);
    }

    @Test
    public void testSwitchGroupsFallThrough() {
        // switch (k) { case 1: case 2: f(); default: break; }
        Stmt call = new ExprSt(new Call(name("f"), tok("("), List.of(), tok(")")), tok(";"));
        Stmt sw = new Switch(tok("switch"), name("k"), List.of(
                new SwitchGroup(List.of(new Case(tok("case"), new IntLit("1", tok("1"))),
                        new Case(tok("case"), new IntLit("2", tok("2")))), List.of(call)),
                new SwitchGroup(List.of(new Default(tok("default"))), List.of(new Break(tok("break"), null)))));

        SwitchNode node = assertInstanceOf(SwitchNode.class, lowering().stmt(sw));
        assertEquals(3, node.cases.size());
        assertTrue(node.cases.get(0).body.isEmpty());
        assertEquals(1, node.cases.get(1).body.size());
        assertNull(node.cases.get(2).value);
    }

    @Test
    public void testTryCatchFinally() {
        // try { f(); } catch (IOException e) { } finally { }
        Stmt call = new ExprSt(new Call(name("f"), tok("("), List.of(), tok(")")), tok(";"));
        Stmt t = new Try(tok("try"), block(call),
                List.of(new Catch(tok("catch"), new VarDef(n("e"), List.of(), cls("IOException")), block())),
                block());

        TryNode node = assertInstanceOf(TryNode.class, lowering().stmt(t));
        assertEquals(1, node.catches.size());
        PatternNode pattern = node.catches.get(0).pattern;
        assertEquals("e", ((IdNode) pattern.value).name);
        assertEquals(List.of("IOException"), pathOf(pattern.type));
        assertNotNull(node.finallyBody);
    }

    @Test
    public void testSynchronizedAndAssert() {
        OtherStmtNode sync = (OtherStmtNode) lowering().stmt(new Sync(tok("synchronized"), name("lock"), block()));
        assertEquals("Sync", sync.category);
        assertEquals(2, sync.parts.size());

        OtherStmtNode check = (OtherStmtNode) lowering().stmt(
                new Assert(tok("assert"), name("ok"), new StrLit("broken", tok("\"broken\""))));
        assertEquals("Assert", check.category);
        assertEquals(2, check.parts.size());
    }

    @Test
    public void testLocalVariableAndClass() {
        Stmt local = new LocalVar(new VarWithInit(new VarDef(n("x"), List.of(mod(ModifierKind.FINAL)), basic("long")),
                null));
        DefinitionNode def = assertInstanceOf(DefinitionNode.class, lowering().stmt(local));
        assertNull(((VariableDefinitionNode) def.definition).init);
        assertEquals(KeywordAttribute.FINAL, def.entity.attributes.get(0).keyword);

        ClassDecl helper = new ClassDecl(tok("class"), ClassKind.CLASS, n("Helper"), List.of(), List.of(), null,
                List.of(), List.of());
        DefinitionNode cls = assertInstanceOf(DefinitionNode.class, lowering().stmt(new LocalClass(helper)));
        assertEquals("Helper", cls.entity.name.name);
    }
}
