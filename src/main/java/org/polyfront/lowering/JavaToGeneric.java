package org.polyfront.lowering;

import org.polyfront.astnode.AnonClassNode;
import org.polyfront.astnode.ArgumentNode;
import org.polyfront.astnode.ArrayAccessNode;
import org.polyfront.astnode.AssignNode;
import org.polyfront.astnode.AssignOpNode;
import org.polyfront.astnode.AttributeNode;
import org.polyfront.astnode.BlockNode;
import org.polyfront.astnode.CallNode;
import org.polyfront.astnode.CaseNode;
import org.polyfront.astnode.CastNode;
import org.polyfront.astnode.CatchNode;
import org.polyfront.astnode.ClassDefinitionNode;
import org.polyfront.astnode.ConditionalNode;
import org.polyfront.astnode.ContainerNode;
import org.polyfront.astnode.DefinitionNode;
import org.polyfront.astnode.DoWhileNode;
import org.polyfront.astnode.DotAccessNode;
import org.polyfront.astnode.EllipsisNode;
import org.polyfront.astnode.EntityNode;
import org.polyfront.astnode.ExprStmtNode;
import org.polyfront.astnode.FieldNode;
import org.polyfront.astnode.ForEachNode;
import org.polyfront.astnode.ForNode;
import org.polyfront.astnode.FunctionDefinitionNode;
import org.polyfront.astnode.IdNode;
import org.polyfront.astnode.IfNode;
import org.polyfront.astnode.ImportAllNode;
import org.polyfront.astnode.ImportFromNode;
import org.polyfront.astnode.JumpNode;
import org.polyfront.astnode.KeywordAttribute;
import org.polyfront.astnode.LabelNode;
import org.polyfront.astnode.LambdaNode;
import org.polyfront.astnode.LiteralNode;
import org.polyfront.astnode.ModuleName;
import org.polyfront.astnode.Node;
import org.polyfront.astnode.Operator;
import org.polyfront.astnode.OrTypeElementNode;
import org.polyfront.astnode.OtherExprNode;
import org.polyfront.astnode.OtherStmtNode;
import org.polyfront.astnode.PackageNode;
import org.polyfront.astnode.ParameterNode;
import org.polyfront.astnode.PatternNode;
import org.polyfront.astnode.ProgramNode;
import org.polyfront.astnode.ReturnNode;
import org.polyfront.astnode.SeqNode;
import org.polyfront.astnode.SpecialKind;
import org.polyfront.astnode.SpecialNode;
import org.polyfront.astnode.SwitchNode;
import org.polyfront.astnode.ThrowNode;
import org.polyfront.astnode.TryNode;
import org.polyfront.astnode.TypeDefinitionNode;
import org.polyfront.astnode.TypeNode;
import org.polyfront.astnode.VariableDefinitionNode;
import org.polyfront.astnode.WhileNode;
import org.polyfront.core.FrontendContext;
import org.polyfront.cst.JavaCst.*;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.polyfront.lowering.LoweringUtils.fake;
import static org.polyfront.lowering.LoweringUtils.special;

/**
 * Lowers a Java CST to the Generic AST.
 * <p>
 * Classes and interfaces become class definitions whose parents are the
 * extended type followed by the implemented ones. An enum becomes a sum type
 * of its constants; constant arguments and enum bodies are not kept. A dotted
 * name is split into a chain of dot accesses. Names are not resolved.
 */
public class JavaToGeneric {

    static final Map<BinaryOp, Operator> BINARY_OPERATORS = new EnumMap<>(BinaryOp.class);
    static final Map<ModifierKind, KeywordAttribute> MODIFIERS = new EnumMap<>(ModifierKind.class);

    static {
        BINARY_OPERATORS.put(BinaryOp.PLUS, Operator.PLUS);
        BINARY_OPERATORS.put(BinaryOp.MINUS, Operator.MINUS);
        BINARY_OPERATORS.put(BinaryOp.MULT, Operator.MULT);
        BINARY_OPERATORS.put(BinaryOp.DIV, Operator.DIV);
        BINARY_OPERATORS.put(BinaryOp.MOD, Operator.MOD);
        BINARY_OPERATORS.put(BinaryOp.SHL, Operator.LSL);
        // >> keeps the sign bit, >>> does not
        BINARY_OPERATORS.put(BinaryOp.SHR, Operator.ASR);
        BINARY_OPERATORS.put(BinaryOp.USHR, Operator.LSR);
        BINARY_OPERATORS.put(BinaryOp.BIT_AND, Operator.BIT_AND);
        BINARY_OPERATORS.put(BinaryOp.BIT_OR, Operator.BIT_OR);
        BINARY_OPERATORS.put(BinaryOp.BIT_XOR, Operator.BIT_XOR);
        BINARY_OPERATORS.put(BinaryOp.AND, Operator.AND);
        BINARY_OPERATORS.put(BinaryOp.OR, Operator.OR);
        BINARY_OPERATORS.put(BinaryOp.LT, Operator.LT);
        BINARY_OPERATORS.put(BinaryOp.GT, Operator.GT);
        BINARY_OPERATORS.put(BinaryOp.LE, Operator.LT_E);
        BINARY_OPERATORS.put(BinaryOp.GE, Operator.GT_E);
        BINARY_OPERATORS.put(BinaryOp.EQ, Operator.EQ);
        BINARY_OPERATORS.put(BinaryOp.NE, Operator.NOT_EQ);

        MODIFIERS.put(ModifierKind.PUBLIC, KeywordAttribute.PUBLIC);
        MODIFIERS.put(ModifierKind.PROTECTED, KeywordAttribute.PROTECTED);
        MODIFIERS.put(ModifierKind.PRIVATE, KeywordAttribute.PRIVATE);
        MODIFIERS.put(ModifierKind.ABSTRACT, KeywordAttribute.ABSTRACT);
        MODIFIERS.put(ModifierKind.FINAL, KeywordAttribute.FINAL);
        MODIFIERS.put(ModifierKind.STATIC, KeywordAttribute.STATIC);
        MODIFIERS.put(ModifierKind.TRANSIENT, KeywordAttribute.TRANSIENT);
        MODIFIERS.put(ModifierKind.VOLATILE, KeywordAttribute.VOLATILE);
        MODIFIERS.put(ModifierKind.NATIVE, KeywordAttribute.NATIVE);
        MODIFIERS.put(ModifierKind.STRICTFP, KeywordAttribute.STRICTFP);
        MODIFIERS.put(ModifierKind.SYNCHRONIZED, KeywordAttribute.SYNCHRONIZED);
        MODIFIERS.put(ModifierKind.DEFAULT, KeywordAttribute.DEFAULT);
    }

    private final FrontendContext ctx;

    public JavaToGeneric(FrontendContext ctx) {
        this.ctx = ctx;
    }

    public ProgramNode program(CompilationUnit unit) {
        ctx.logDebug("lowering Java unit " + ctx.fileName());
        List<Node> items = new ArrayList<>();
        if (unit.pkg() != null) {
            items.add(new PackageNode(unit.pkg().packageTok(), ids(unit.pkg().path())));
        }
        for (ImportDecl imp : unit.imports()) {
            items.add(importDecl(imp));
        }
        items.addAll(decls(unit.decls()));
        return new ProgramNode(ctx.fileName(), items);
    }

    private static IdNode id(Name name) {
        return new IdNode(name.name(), name.info());
    }

    private static List<IdNode> ids(List<Name> names) {
        List<IdNode> out = new ArrayList<>();
        for (Name name : names) {
            out.add(id(name));
        }
        return out;
    }

    // The static flag of an import is not kept
    Node importDecl(ImportDecl imp) {
        if (imp instanceof ImportAll all) {
            return new ImportAllNode(all.importTok(), ModuleName.dotted(ids(all.path())), all.star());
        }
        ImportFrom from = (ImportFrom) imp;
        return new ImportFromNode(from.importTok(), ModuleName.dotted(ids(from.path())), id(from.name()), null);
    }

    // ------------------------------------------------------------------
    // Modifiers
    // ------------------------------------------------------------------

    List<AttributeNode> modifiers(List<Mod> mods) {
        List<AttributeNode> out = new ArrayList<>();
        for (Mod mod : mods) {
            if (mod instanceof Modifier m) {
                out.add(new AttributeNode(MODIFIERS.get(m.kind()), m.info()));
            } else {
                out.add(annotation((Annotation) mod));
            }
        }
        return out;
    }

    AttributeNode annotation(Annotation a) {
        List<ArgumentNode> args = new ArrayList<>();
        if (a.args() != null) {
            for (AnnotArg arg : a.args()) {
                if (arg instanceof AnnotValue v) {
                    args.add(ArgumentNode.arg(elementValue(v.value())));
                } else {
                    AnnotPair pair = (AnnotPair) arg;
                    args.add(ArgumentNode.arg(new AssignNode(id(pair.key()), pair.eq(), elementValue(pair.value()))));
                }
            }
        }
        return AttributeNode.named(TypeNode.named(ids(a.name())), args, a.at());
    }

    private Node elementValue(ElementValue value) {
        if (value instanceof AnnotExpr e) {
            return expr(e.expr());
        }
        if (value instanceof AnnotNested nested) {
            AttributeNode annotation = annotation(nested.annotation());
            return new OtherExprNode("Annot", List.of(annotation), annotation.getInfo());
        }
        AnnotArray array = (AnnotArray) value;
        List<Node> elements = new ArrayList<>();
        for (ElementValue element : array.elements()) {
            elements.add(elementValue(element));
        }
        return new ContainerNode(ContainerNode.Kind.LIST, elements, array.lbrace());
    }

    // ------------------------------------------------------------------
    // Types
    // ------------------------------------------------------------------

    TypeNode type(Type t) {
        if (t instanceof TBasic basic) {
            return TypeNode.builtin(id(basic.name()));
        }
        if (t instanceof TArray array) {
            TypeNode element = type(array.element());
            return TypeNode.array(element, null, element.getInfo());
        }
        TClass cls = (TClass) t;
        List<IdNode> path = new ArrayList<>();
        List<TypeNode> args = new ArrayList<>();
        for (ClassTypePart part : cls.parts()) {
            path.add(id(part.name()));
            // arguments of an outer class, as in Outer<T>.Inner, are dropped
            args.clear();
            for (TypeArgument arg : part.args()) {
                args.add(typeArgument(arg));
            }
        }
        return args.isEmpty() ? TypeNode.named(path) : TypeNode.apply(path, args);
    }

    // A wildcard is the builtin type "?", applied to its bound when it has one
    private TypeNode typeArgument(TypeArgument arg) {
        if (arg instanceof TArgument a) {
            return type(a.type());
        }
        TQuestion q = (TQuestion) arg;
        String text = q.isSuper() ? "? super" : "?";
        IdNode question = new IdNode(text, q.question());
        if (q.bound() == null) {
            return TypeNode.builtin(question);
        }
        return TypeNode.apply(List.of(question), List.of(type(q.bound())));
    }

    private static List<IdNode> typeParams(List<TypeParam> params) {
        List<IdNode> out = new ArrayList<>();
        for (TypeParam param : params) {
            out.add(id(param.name()));
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Declarations
    // ------------------------------------------------------------------

    List<Node> decls(List<Decl> decls) {
        List<Node> out = new ArrayList<>();
        for (Decl decl : decls) {
            out.add(decl(decl));
        }
        return out;
    }

    private List<FieldNode> classBody(List<Decl> decls) {
        List<FieldNode> fields = new ArrayList<>();
        for (Node node : decls(decls)) {
            fields.add(node instanceof DefinitionNode def
                    ? FieldNode.stmt(def)
                    : new FieldNode(FieldNode.Kind.STMT, null, node));
        }
        return fields;
    }

    Node decl(Decl decl) {
        if (decl instanceof ClassD c) {
            return classDecl(c.decl());
        }
        if (decl instanceof EnumD e) {
            return enumDecl(e.decl());
        }
        if (decl instanceof AnnotationTypeD a) {
            AnnotationTypeDecl at = a.decl();
            ClassDefinitionNode cls = new ClassDefinitionNode(ClassDefinitionNode.Kind.INTERFACE, at.atTok(),
                    List.of(), List.of(), classBody(at.body()));
            return new DefinitionNode(new EntityNode(id(at.name()), modifiers(at.mods())), cls);
        }
        if (decl instanceof MethodD m) {
            return method(m.decl());
        }
        if (decl instanceof FieldD f) {
            return varDecl(f.field());
        }
        if (decl instanceof InitD init) {
            BlockNode body = block(init.body());
            return init.isStatic() ? new OtherStmtNode("StaticInit", List.of(body), body.getInfo()) : body;
        }
        if (decl instanceof EmptyDecl empty) {
            return new BlockNode(empty.semicolon(), List.of(), empty.semicolon());
        }
        DeclEllipsis ellipsis = (DeclEllipsis) decl;
        return new ExprStmtNode(new EllipsisNode(ellipsis.info()));
    }

    DefinitionNode classDecl(ClassDecl decl) {
        ClassDefinitionNode.Kind kind = decl.kind() == ClassKind.INTERFACE
                ? ClassDefinitionNode.Kind.INTERFACE : ClassDefinitionNode.Kind.CLASS;
        List<Node> parents = new ArrayList<>();
        if (decl.extendsType() != null) {
            parents.add(type(decl.extendsType()));
        }
        for (Type impl : decl.impls()) {
            parents.add(type(impl));
        }
        ClassDefinitionNode cls = new ClassDefinitionNode(kind, decl.kindTok(), parents, List.of(),
                classBody(decl.body()));
        return new DefinitionNode(new EntityNode(id(decl.name()), modifiers(decl.mods()),
                typeParams(decl.typeParams())), cls);
    }

    DefinitionNode enumDecl(EnumDecl decl) {
        List<OrTypeElementNode> constants = new ArrayList<>();
        for (EnumConstant constant : decl.constants()) {
            constants.add(new OrTypeElementNode(OrTypeElementNode.Kind.ENUM, id(constant.name()), null, null));
        }
        return new DefinitionNode(new EntityNode(id(decl.name()), modifiers(decl.mods())),
                TypeDefinitionNode.sum(constants, decl.enumTok()));
    }

    DefinitionNode method(MethodDecl m) {
        VarDef v = m.var();
        List<AttributeNode> attrs = modifiers(v.mods());
        for (Type thrown : m.throwsList()) {
            TypeNode t = type(thrown);
            attrs.add(new AttributeNode(KeywordAttribute.THROWS, t, List.of(), t.getInfo()));
        }
        TypeNode returnType = v.type() == null ? null : type(v.type());
        FunctionDefinitionNode fn = new FunctionDefinitionNode(FunctionDefinitionNode.Kind.METHOD, v.name().info(),
                params(m.params()), returnType, m.body() == null ? null : block(m.body()), new ArrayList<>());
        return new DefinitionNode(new EntityNode(id(v.name()), attrs, typeParams(m.typeParams())), fn);
    }

    DefinitionNode varDecl(VarWithInit v) {
        VarDef def = v.var();
        Node init = v.init() == null ? null : init(v.init());
        return new DefinitionNode(new EntityNode(id(def.name()), modifiers(def.mods())),
                new VariableDefinitionNode(def.name().info(), init, def.type() == null ? null : type(def.type())));
    }

    private Node init(Init init) {
        if (init instanceof ExprInit e) {
            return expr(e.expr());
        }
        ArrayInit array = (ArrayInit) init;
        List<Node> elements = new ArrayList<>();
        for (Init element : array.elements()) {
            elements.add(init(element));
        }
        return new ContainerNode(ContainerNode.Kind.ARRAY, elements, array.lbrace());
    }

    List<ParameterNode> params(List<Param> params) {
        List<ParameterNode> out = new ArrayList<>();
        for (Param p : params) {
            boolean spread = p instanceof ParamSpread;
            VarDef v = spread ? ((ParamSpread) p).var() : ((ParamClassic) p).var();
            out.add(new ParameterNode(spread ? ParameterNode.Kind.VARIADIC : ParameterNode.Kind.CLASSIC, id(v.name()),
                    v.type() == null ? null : type(v.type()), null, modifiers(v.mods()), v.name().info()));
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    private static Node nameHead(Name name) {
        return switch (name.name()) {
            case "this" -> new SpecialNode(SpecialKind.THIS, name.info());
            case "super" -> new SpecialNode(SpecialKind.SUPER, name.info());
            default -> id(name);
        };
    }

    // a.b.c is read as field accesses on a; telling packages from classes needs types
    private static Node qualifiedName(QualifiedName q) {
        List<Name> parts = q.parts();
        Node result = nameHead(parts.get(0));
        for (int i = 1; i < parts.size(); i++) {
            Name part = parts.get(i);
            result = new DotAccessNode(result, fake("."), id(part));
        }
        return result;
    }

    private List<ArgumentNode> args(List<Expr> exprs) {
        List<ArgumentNode> out = new ArrayList<>();
        for (Expr e : exprs) {
            out.add(ArgumentNode.arg(expr(e)));
        }
        return out;
    }

    private static TypeNode arrayOf(TypeNode element, int dims) {
        TypeNode t = element;
        for (int i = 0; i < dims; i++) {
            t = TypeNode.array(t, null, element.getInfo());
        }
        return t;
    }

    Node expr(Expr e) {
        if (e instanceof QualifiedName q) {
            return qualifiedName(q);
        }
        if (e instanceof IntLit i) {
            return new LiteralNode(LiteralNode.Kind.INT, i.value(), i.info());
        }
        if (e instanceof FloatLit f) {
            return new LiteralNode(LiteralNode.Kind.FLOAT, f.value(), f.info());
        }
        if (e instanceof StrLit s) {
            return new LiteralNode(LiteralNode.Kind.STRING, s.value(), s.info());
        }
        if (e instanceof CharLit c) {
            return new LiteralNode(LiteralNode.Kind.CHAR, c.value(), c.info());
        }
        if (e instanceof BoolLit b) {
            return new LiteralNode(LiteralNode.Kind.BOOL, String.valueOf(b.value()), b.info());
        }
        if (e instanceof NullLit n) {
            return new LiteralNode(LiteralNode.Kind.NULL, "null", n.info());
        }
        if (e instanceof ClassLiteral c) {
            return new OtherExprNode("ClassLiteral", List.of(type(c.type())), c.classTok());
        }
        if (e instanceof NewClass n) {
            TypeNode t = type(n.type());
            List<ArgumentNode> args = new ArrayList<>();
            if (n.body() == null) {
                args.add(new ArgumentNode(ArgumentNode.Kind.ARG_TYPE, t));
            } else {
                ClassDefinitionNode anon = new ClassDefinitionNode(ClassDefinitionNode.Kind.CLASS, n.newTok(),
                        List.of(t), List.of(), classBody(n.body()));
                args.add(ArgumentNode.arg(new AnonClassNode(anon)));
            }
            args.addAll(args(n.args()));
            return new CallNode(new SpecialNode(SpecialKind.NEW, n.newTok()), args);
        }
        if (e instanceof NewArray n) {
            List<ArgumentNode> args = new ArrayList<>();
            args.add(new ArgumentNode(ArgumentNode.Kind.ARG_TYPE,
                    arrayOf(type(n.element()), n.dimExprs().size() + n.extraDims())));
            if (n.init() != null) {
                args.add(ArgumentNode.arg(init(n.init())));
            }
            args.addAll(args(n.dimExprs()));
            return new CallNode(new SpecialNode(SpecialKind.NEW, n.newTok()), args);
        }
        if (e instanceof NewQualifiedClass n) {
            List<Node> parts = new ArrayList<>();
            parts.add(expr(n.outer()));
            parts.add(type(n.type()));
            for (Expr arg : n.args()) {
                parts.add(expr(arg));
            }
            if (n.body() != null) {
                parts.addAll(decls(n.body()));
            }
            return new OtherExprNode("NewQualifiedClass", parts, n.newTok());
        }
        if (e instanceof MethodRef ref) {
            Node target = ref.target() != null ? expr(ref.target()) : type(ref.targetType());
            return new OtherExprNode("MethodRef", List.of(target, id(ref.method())), ref.colons());
        }
        if (e instanceof Call call) {
            return new CallNode(expr(call.fn()), args(call.args()));
        }
        if (e instanceof Dot dot) {
            return new DotAccessNode(expr(dot.expr()), dot.dot(), id(dot.field()));
        }
        if (e instanceof ArrayAccess access) {
            return new ArrayAccessNode(expr(access.array()), access.lbracket(), expr(access.index()));
        }
        if (e instanceof Unary u) {
            Operator op = switch (u.op()) {
                case PLUS -> Operator.PLUS;
                case MINUS -> Operator.MINUS;
                case TILDE -> Operator.BIT_NOT;
                case NOT -> Operator.NOT;
            };
            return LoweringUtils.operator(op, u.opTok(), expr(u.expr()));
        }
        if (e instanceof Postfix postfix) {
            SpecialKind kind = postfix.op() == IncrDecr.INCR ? SpecialKind.INCR_POSTFIX : SpecialKind.DECR_POSTFIX;
            return special(kind, postfix.opTok(), expr(postfix.expr()));
        }
        if (e instanceof Prefix prefix) {
            SpecialKind kind = prefix.op() == IncrDecr.INCR ? SpecialKind.INCR_PREFIX : SpecialKind.DECR_PREFIX;
            return special(kind, prefix.opTok(), expr(prefix.expr()));
        }
        if (e instanceof Infix infix) {
            return LoweringUtils.operator(BINARY_OPERATORS.get(infix.op()), infix.opTok(), expr(infix.left()),
                    expr(infix.right()));
        }
        if (e instanceof Cast cast) {
            return new CastNode(type(cast.type()), cast.lparen(), expr(cast.expr()));
        }
        if (e instanceof InstanceOf inst) {
            List<ArgumentNode> args = new ArrayList<>();
            args.add(ArgumentNode.arg(expr(inst.expr())));
            args.add(new ArgumentNode(ArgumentNode.Kind.ARG_TYPE, type(inst.type())));
            return new CallNode(new SpecialNode(SpecialKind.INSTANCEOF, inst.instanceofTok()), args);
        }
        if (e instanceof Conditional c) {
            return new ConditionalNode(expr(c.cond()), expr(c.then()), expr(c.otherwise()));
        }
        if (e instanceof Assign assign) {
            return new AssignNode(expr(assign.lhs()), assign.eq(), expr(assign.rhs()));
        }
        if (e instanceof AssignOp assign) {
            return new AssignOpNode(expr(assign.lhs()), BINARY_OPERATORS.get(assign.op()), assign.opTok(),
                    expr(assign.rhs()));
        }
        if (e instanceof Lambda lambda) {
            return new LambdaNode(new FunctionDefinitionNode(FunctionDefinitionNode.Kind.LAMBDA, lambda.arrow(),
                    params(lambda.params()), null, stmt(lambda.body()), new ArrayList<>()));
        }
        Ellipsis ellipsis = (Ellipsis) e;
        return new EllipsisNode(ellipsis.info());
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    BlockNode block(Block block) {
        List<Node> stmts = new ArrayList<>();
        for (Stmt s : block.stmts()) {
            stmts.add(stmt(s));
        }
        return new BlockNode(block.lbrace(), stmts, block.rbrace());
    }

    private List<Node> stmts(List<Stmt> stmts) {
        List<Node> out = new ArrayList<>();
        for (Stmt s : stmts) {
            out.add(stmt(s));
        }
        return out;
    }

    private static Node seqOrNull(List<Node> exprs) {
        if (exprs.isEmpty()) {
            return null;
        }
        return exprs.size() == 1 ? exprs.get(0) : new SeqNode(exprs);
    }

    private static IdNode label(Name name) {
        return name == null ? null : id(name);
    }

    // case 1: case 2: body becomes an empty case 1 falling through to case 2
    private List<CaseNode> cases(SwitchGroup group) {
        List<CaseNode> out = new ArrayList<>();
        List<CaseLabel> labels = group.labels();
        for (int i = 0; i < labels.size(); i++) {
            List<Node> body = i == labels.size() - 1 ? stmts(group.body()) : List.of();
            CaseLabel label = labels.get(i);
            if (label instanceof Case c) {
                out.add(new CaseNode(c.caseTok(), expr(c.expr()), body));
            } else {
                out.add(new CaseNode(((Default) label).defaultTok(), null, body));
            }
        }
        return out;
    }

    private PatternNode typedPattern(VarDef v) {
        IdNode name = id(v.name());
        return v.type() == null ? PatternNode.id(name) : PatternNode.typed(name, type(v.type()));
    }

    private Node forStmt(For f) {
        Node body = stmt(f.body());
        if (f.control() instanceof Foreach each) {
            return new ForEachNode(f.forTok(), typedPattern(each.var()), each.colon(), expr(each.collection()), body);
        }
        ForClassic classic = (ForClassic) f.control();
        List<Node> init = new ArrayList<>();
        if (classic.init() instanceof ForInitVars vars) {
            for (VarWithInit v : vars.vars()) {
                init.add(varDecl(v));
            }
        } else if (classic.init() instanceof ForInitExprs exprs) {
            for (Expr e : exprs.exprs()) {
                init.add(expr(e));
            }
        }
        List<Node> updates = new ArrayList<>();
        for (Expr e : classic.updates()) {
            updates.add(expr(e));
        }
        return new ForNode(f.forTok(), init, classic.cond() == null ? null : expr(classic.cond()),
                seqOrNull(updates), body);
    }

    Node stmt(Stmt s) {
        if (s instanceof Empty empty) {
            return new BlockNode(empty.semicolon(), List.of(), empty.semicolon());
        }
        if (s instanceof Block b) {
            return block(b);
        }
        if (s instanceof ExprSt es) {
            return new ExprStmtNode(expr(es.expr()));
        }
        if (s instanceof If i) {
            Node otherwise = i.otherwise() == null ? null : stmt(i.otherwise());
            return new IfNode(i.ifTok(), expr(i.cond()), stmt(i.then()), otherwise);
        }
        if (s instanceof Switch sw) {
            List<CaseNode> cases = new ArrayList<>();
            for (SwitchGroup group : sw.groups()) {
                cases.addAll(cases(group));
            }
            return new SwitchNode(sw.switchTok(), expr(sw.expr()), cases);
        }
        if (s instanceof While w) {
            return new WhileNode(w.whileTok(), expr(w.cond()), stmt(w.body()));
        }
        if (s instanceof Do d) {
            return new DoWhileNode(d.doTok(), stmt(d.body()), expr(d.cond()));
        }
        if (s instanceof For f) {
            return forStmt(f);
        }
        if (s instanceof Break b) {
            return new JumpNode(JumpNode.Kind.BREAK, b.breakTok(), label(b.label()));
        }
        if (s instanceof Continue c) {
            return new JumpNode(JumpNode.Kind.CONTINUE, c.continueTok(), label(c.label()));
        }
        if (s instanceof Return r) {
            return new ReturnNode(r.returnTok(), r.value() == null ? null : expr(r.value()));
        }
        if (s instanceof Label l) {
            return new LabelNode(id(l.label()), stmt(l.body()));
        }
        if (s instanceof Sync sync) {
            return new OtherStmtNode("Sync", List.of(expr(sync.lock()), stmt(sync.body())), sync.syncTok());
        }
        if (s instanceof Try t) {
            List<CatchNode> catches = new ArrayList<>();
            for (Catch c : t.catches()) {
                catches.add(new CatchNode(c.catchTok(), typedPattern(c.param()), block(c.body())));
            }
            return new TryNode(t.tryTok(), block(t.body()), catches,
                    t.finallyBody() == null ? null : block(t.finallyBody()));
        }
        if (s instanceof Throw t) {
            return new ThrowNode(t.throwTok(), expr(t.value()));
        }
        if (s instanceof LocalVar v) {
            return varDecl(v.var());
        }
        if (s instanceof LocalClass c) {
            return classDecl(c.decl());
        }
        Assert a = (Assert) s;
        List<Node> parts = new ArrayList<>();
        parts.add(expr(a.cond()));
        if (a.message() != null) {
            parts.add(expr(a.message()));
        }
        return new OtherStmtNode("Assert", parts, a.assertTok());
    }
}
