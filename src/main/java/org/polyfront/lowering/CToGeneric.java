package org.polyfront.lowering;

import org.polyfront.astnode.ArgumentNode;
import org.polyfront.astnode.ArrayAccessNode;
import org.polyfront.astnode.AssignNode;
import org.polyfront.astnode.AssignOpNode;
import org.polyfront.astnode.AttributeNode;
import org.polyfront.astnode.BlockNode;
import org.polyfront.astnode.CallNode;
import org.polyfront.astnode.CaseNode;
import org.polyfront.astnode.CastNode;
import org.polyfront.astnode.ConditionalNode;
import org.polyfront.astnode.ContainerNode;
import org.polyfront.astnode.DeRefNode;
import org.polyfront.astnode.DefinitionNode;
import org.polyfront.astnode.DoWhileNode;
import org.polyfront.astnode.DotAccessNode;
import org.polyfront.astnode.EllipsisNode;
import org.polyfront.astnode.EntityNode;
import org.polyfront.astnode.ExprStmtNode;
import org.polyfront.astnode.FieldNode;
import org.polyfront.astnode.ForNode;
import org.polyfront.astnode.FunctionDefinitionNode;
import org.polyfront.astnode.IdNode;
import org.polyfront.astnode.IfNode;
import org.polyfront.astnode.ImportAsNode;
import org.polyfront.astnode.JumpNode;
import org.polyfront.astnode.KeywordAttribute;
import org.polyfront.astnode.LabelNode;
import org.polyfront.astnode.LiteralNode;
import org.polyfront.astnode.MacroDefinitionNode;
import org.polyfront.astnode.ModuleName;
import org.polyfront.astnode.Node;
import org.polyfront.astnode.Operator;
import org.polyfront.astnode.OrTypeElementNode;
import org.polyfront.astnode.OtherExprNode;
import org.polyfront.astnode.OtherStmtNode;
import org.polyfront.astnode.ParameterNode;
import org.polyfront.astnode.ProgramNode;
import org.polyfront.astnode.RecordNode;
import org.polyfront.astnode.RefNode;
import org.polyfront.astnode.ReturnNode;
import org.polyfront.astnode.SeqNode;
import org.polyfront.astnode.SpecialKind;
import org.polyfront.astnode.SpecialNode;
import org.polyfront.astnode.SwitchNode;
import org.polyfront.astnode.TypeDefinitionNode;
import org.polyfront.astnode.TypeNode;
import org.polyfront.astnode.VariableDefinitionNode;
import org.polyfront.astnode.WhileNode;
import org.polyfront.core.FrontendContext;
import org.polyfront.cst.CCst.*;
import org.polyfront.lexer.SourceInfo;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.polyfront.lowering.LoweringUtils.fake;
import static org.polyfront.lowering.LoweringUtils.field;
import static org.polyfront.lowering.LoweringUtils.special;

/**
 * Lowers a C CST to the Generic AST.
 * <p>
 * Operators go through fixed translation tables. A struct becomes a product
 * type of its fields, a union and an enum become sum types. Anonymous structs,
 * unions, enums and fields are named {@value #FAKE_NAME} so that every
 * definition has an identifier. Names are not resolved.
 */
public class CToGeneric {

    public static final String FAKE_NAME = "FakeNAME";

    static final Map<ArithOp, Operator> ARITH_OPERATORS = new EnumMap<>(ArithOp.class);
    static final Map<LogicalOp, Operator> LOGICAL_OPERATORS = new EnumMap<>(LogicalOp.class);

    static {
        ARITH_OPERATORS.put(ArithOp.PLUS, Operator.PLUS);
        ARITH_OPERATORS.put(ArithOp.MINUS, Operator.MINUS);
        ARITH_OPERATORS.put(ArithOp.MULT, Operator.MULT);
        ARITH_OPERATORS.put(ArithOp.DIV, Operator.DIV);
        ARITH_OPERATORS.put(ArithOp.MOD, Operator.MOD);
        ARITH_OPERATORS.put(ArithOp.DEC_LEFT, Operator.LSL);
        ARITH_OPERATORS.put(ArithOp.DEC_RIGHT, Operator.LSR);
        ARITH_OPERATORS.put(ArithOp.AND, Operator.BIT_AND);
        ARITH_OPERATORS.put(ArithOp.OR, Operator.BIT_OR);
        ARITH_OPERATORS.put(ArithOp.XOR, Operator.BIT_XOR);

        LOGICAL_OPERATORS.put(LogicalOp.INF, Operator.LT);
        LOGICAL_OPERATORS.put(LogicalOp.SUP, Operator.GT);
        LOGICAL_OPERATORS.put(LogicalOp.INF_EQ, Operator.LT_E);
        LOGICAL_OPERATORS.put(LogicalOp.SUP_EQ, Operator.GT_E);
        LOGICAL_OPERATORS.put(LogicalOp.EQ, Operator.EQ);
        LOGICAL_OPERATORS.put(LogicalOp.NOT_EQ, Operator.NOT_EQ);
        LOGICAL_OPERATORS.put(LogicalOp.AND_LOG, Operator.AND);
        LOGICAL_OPERATORS.put(LogicalOp.OR_LOG, Operator.OR);
    }

    private final FrontendContext ctx;

    public CToGeneric(FrontendContext ctx) {
        this.ctx = ctx;
    }

    public ProgramNode program(Program program) {
        ctx.logDebug("lowering C unit " + ctx.fileName());
        List<Node> items = new ArrayList<>();
        for (Toplevel toplevel : program.toplevels()) {
            items.add(toplevel(toplevel));
        }
        return new ProgramNode(ctx.fileName(), items);
    }

    private static IdNode id(Name name) {
        return new IdNode(name.name(), name.info());
    }

    private static IdNode idOrFake(Name name) {
        return name == null ? new IdNode(FAKE_NAME, fake(FAKE_NAME)) : id(name);
    }

    static Operator binaryOperator(BinaryOp op) {
        if (op instanceof Arith a) {
            return ARITH_OPERATORS.get(a.op());
        }
        return LOGICAL_OPERATORS.get(((Logical) op).op());
    }

    // ------------------------------------------------------------------
    // Toplevel
    // ------------------------------------------------------------------

    Node toplevel(Toplevel toplevel) {
        if (toplevel instanceof Include include) {
            return new ImportAsNode(include.includeTok(), ModuleName.file(id(include.file())), null);
        }
        if (toplevel instanceof Define define) {
            Node body = define.body() == null ? null : expr(define.body());
            return new DefinitionNode(new EntityNode(id(define.name()), new ArrayList<>()),
                    new MacroDefinitionNode(define.name().info(), List.of(), body));
        }
        if (toplevel instanceof Macro macro) {
            List<IdNode> params = new ArrayList<>();
            for (Name param : macro.params()) {
                params.add(id(param));
            }
            Node body = macro.body() == null ? null : expr(macro.body());
            return new DefinitionNode(new EntityNode(id(macro.name()), new ArrayList<>()),
                    new MacroDefinitionNode(macro.name().info(), params, body));
        }
        if (toplevel instanceof StructDef struct) {
            return structDef(struct);
        }
        if (toplevel instanceof TypeDef typeDef) {
            return new DefinitionNode(new EntityNode(id(typeDef.name()), new ArrayList<>()),
                    TypeDefinitionNode.alias(type(typeDef.type()), typeDef.typedefTok()));
        }
        if (toplevel instanceof EnumDef enumDef) {
            List<OrTypeElementNode> constants = new ArrayList<>();
            for (EnumConstant constant : enumDef.constants()) {
                Node value = constant.value() == null ? null : expr(constant.value());
                constants.add(new OrTypeElementNode(OrTypeElementNode.Kind.ENUM, id(constant.name()), null, value));
            }
            return new DefinitionNode(new EntityNode(idOrFake(enumDef.name()), new ArrayList<>()),
                    TypeDefinitionNode.sum(constants, enumDef.enumTok()));
        }
        if (toplevel instanceof FuncDefItem f) {
            return funcDef(f.def());
        }
        if (toplevel instanceof Prototype p) {
            return funcDef(p.def());
        }
        return varDecl(((Global) toplevel).var());
    }

    DefinitionNode structDef(StructDef struct) {
        EntityNode entity = new EntityNode(idOrFake(struct.name()), new ArrayList<>());
        if (struct.kind() == StructKind.STRUCT) {
            List<FieldNode> fields = new ArrayList<>();
            for (FieldDef f : struct.fields()) {
                IdNode name = idOrFake(f.name());
                fields.add(FieldNode.stmt(new DefinitionNode(new EntityNode(name, new ArrayList<>()),
                        new VariableDefinitionNode(name.info, null, type(f.type())))));
            }
            return new DefinitionNode(entity, TypeDefinitionNode.product(fields, struct.kindTok()));
        }
        List<OrTypeElementNode> alternatives = new ArrayList<>();
        for (FieldDef f : struct.fields()) {
            alternatives.add(new OrTypeElementNode(OrTypeElementNode.Kind.UNION, idOrFake(f.name()), type(f.type()), null));
        }
        return new DefinitionNode(entity, TypeDefinitionNode.sum(alternatives, struct.kindTok()));
    }

    private static List<AttributeNode> storage(Storage storage) {
        List<AttributeNode> attrs = new ArrayList<>();
        switch (storage) {
            case EXTERN -> attrs.add(new AttributeNode(KeywordAttribute.EXTERN, fake("extern")));
            case STATIC -> attrs.add(new AttributeNode(KeywordAttribute.STATIC, fake("static")));
            default -> {
            }
        }
        return attrs;
    }

    DefinitionNode funcDef(FuncDef f) {
        List<ParameterNode> params = new ArrayList<>();
        for (Parameter p : f.params()) {
            params.add(parameter(p));
        }
        Node body = f.body() == null ? null : blockOf(f.body());
        FunctionDefinitionNode fn = new FunctionDefinitionNode(FunctionDefinitionNode.Kind.FUNCTION,
                f.name().info(), params, type(f.returnType()), body, new ArrayList<>());
        return new DefinitionNode(new EntityNode(id(f.name()), storage(f.storage())), fn);
    }

    private ParameterNode parameter(Parameter p) {
        IdNode name = p.name() == null ? null : id(p.name());
        SourceInfo info = name != null ? name.info : fake("parameter");
        return new ParameterNode(ParameterNode.Kind.CLASSIC, name, type(p.type()), null, List.of(), info);
    }

    DefinitionNode varDecl(VarDecl v) {
        Node init = v.init() == null ? null : expr(v.init());
        return new DefinitionNode(new EntityNode(id(v.name()), storage(v.storage())),
                new VariableDefinitionNode(v.name().info(), init, type(v.type())));
    }

    // ------------------------------------------------------------------
    // Types
    // ------------------------------------------------------------------

    TypeNode type(Type t) {
        if (t instanceof TBase base) {
            return TypeNode.builtin(id(base.name()));
        }
        if (t instanceof TPointer pointer) {
            return TypeNode.pointer(type(pointer.type()), pointer.star());
        }
        if (t instanceof TArray array) {
            Node size = array.size() == null ? null : expr(array.size());
            return TypeNode.array(type(array.type()), size, size != null ? size.getInfo() : fake("[]"));
        }
        if (t instanceof TFunction function) {
            List<TypeNode> params = new ArrayList<>();
            for (Parameter p : function.params()) {
                params.add(type(p.type()));
            }
            TypeNode result = type(function.returnType());
            return TypeNode.function(params, result, result.getInfo());
        }
        if (t instanceof TStructName struct) {
            return TypeNode.named(List.of(id(struct.name())));
        }
        if (t instanceof TEnumName enumName) {
            return TypeNode.named(List.of(id(enumName.name())));
        }
        return TypeNode.named(List.of(id(((TTypeName) t).name())));
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    private Node unary(Unary u) {
        Node e = expr(u.expr());
        SourceInfo tok = u.opTok();
        return switch (u.op()) {
            case GET_REF -> new RefNode(tok, e);
            case DE_REF -> new DeRefNode(tok, e);
            case UN_PLUS -> LoweringUtils.operator(Operator.PLUS, tok, e);
            case UN_MINUS -> LoweringUtils.operator(Operator.MINUS, tok, e);
            case TILDE -> LoweringUtils.operator(Operator.BIT_NOT, tok, e);
            case NOT -> LoweringUtils.operator(Operator.NOT, tok, e);
            case GET_REF_LABEL -> new OtherExprNode("GetRefLabel", List.of(e), tok);
        };
    }

    private Node initializer(Initializer init) {
        if (init instanceof InitExpr e) {
            return expr(e.expr());
        }
        InitDesignated d = (InitDesignated) init;
        return new OtherExprNode("ArrayInitDesignator", List.of(expr(d.index()), initializer(d.value())), d.lbracket());
    }

    Node expr(Expr e) {
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
        if (e instanceof Id id) {
            return id(id.name());
        }
        if (e instanceof Ellipses ellipses) {
            return new EllipsisNode(ellipses.info());
        }
        if (e instanceof Call call) {
            List<ArgumentNode> args = new ArrayList<>();
            for (Argument arg : call.args()) {
                args.add(arg instanceof Arg a
                        ? ArgumentNode.arg(expr(a.expr()))
                        : new ArgumentNode(ArgumentNode.Kind.ARG_TYPE, type(((ArgType) arg).type())));
            }
            return new CallNode(expr(call.fn()), args);
        }
        if (e instanceof Assign assign) {
            Node lhs = expr(assign.lhs());
            Node rhs = expr(assign.rhs());
            if (assign.op() == null) {
                return new AssignNode(lhs, assign.opTok(), rhs);
            }
            return new AssignOpNode(lhs, ARITH_OPERATORS.get(assign.op()), assign.opTok(), rhs);
        }
        if (e instanceof ArrayAccess access) {
            return new ArrayAccessNode(expr(access.array()), access.lbracket(), expr(access.index()));
        }
        if (e instanceof RecordAccess access) {
            return new DotAccessNode(expr(access.expr()), access.dot(), id(access.field()));
        }
        if (e instanceof RecordPtAccess access) {
            return new DotAccessNode(new DeRefNode(access.arrow(), expr(access.expr())), access.arrow(),
                    id(access.field()));
        }
        if (e instanceof Cast cast) {
            return new CastNode(type(cast.type()), cast.lparen(), expr(cast.expr()));
        }
        if (e instanceof Postfix postfix) {
            SpecialKind kind = postfix.op() == IncrDecr.INCR ? SpecialKind.INCR_POSTFIX : SpecialKind.DECR_POSTFIX;
            return special(kind, postfix.opTok(), expr(postfix.expr()));
        }
        if (e instanceof Prefix prefix) {
            SpecialKind kind = prefix.op() == IncrDecr.INCR ? SpecialKind.INCR_PREFIX : SpecialKind.DECR_PREFIX;
            return special(kind, prefix.opTok(), expr(prefix.expr()));
        }
        if (e instanceof Unary u) {
            return unary(u);
        }
        if (e instanceof Binary b) {
            return LoweringUtils.operator(binaryOperator(b.op()), b.opTok(), expr(b.left()), expr(b.right()));
        }
        if (e instanceof CondExpr c) {
            return new ConditionalNode(expr(c.cond()), expr(c.then()), expr(c.otherwise()));
        }
        if (e instanceof Sequence s) {
            return new SeqNode(List.of(expr(s.left()), expr(s.right())));
        }
        if (e instanceof SizeOfExpr s) {
            return special(SpecialKind.SIZEOF, s.sizeofTok(), expr(s.expr()));
        }
        if (e instanceof SizeOfType s) {
            List<ArgumentNode> args = new ArrayList<>();
            args.add(new ArgumentNode(ArgumentNode.Kind.ARG_TYPE, type(s.type())));
            return new CallNode(new SpecialNode(SpecialKind.SIZEOF, s.sizeofTok()), args);
        }
        if (e instanceof ArrayInit init) {
            List<Node> elements = new ArrayList<>();
            for (Initializer element : init.elements()) {
                elements.add(initializer(element));
            }
            return new ContainerNode(ContainerNode.Kind.ARRAY, elements, init.lbrace());
        }
        if (e instanceof RecordInit init) {
            List<FieldNode> fields = new ArrayList<>();
            for (FieldInit f : init.fields()) {
                fields.add(FieldNode.stmt(field(id(f.field()), expr(f.value()))));
            }
            return new RecordNode(fields, init.lbrace());
        }
        GccConstructor gcc = (GccConstructor) e;
        List<ArgumentNode> args = new ArrayList<>();
        args.add(new ArgumentNode(ArgumentNode.Kind.ARG_TYPE, type(gcc.type())));
        args.add(ArgumentNode.arg(expr(gcc.init())));
        return new CallNode(new SpecialNode(SpecialKind.NEW, fake("new")), args);
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    private BlockNode blockOf(Block block) {
        List<Node> stmts = new ArrayList<>();
        for (Stmt s : block.stmts()) {
            stmts.addAll(stmt(s));
        }
        return new BlockNode(block.lbrace(), stmts, block.rbrace());
    }

    private Node stmt1(Stmt s) {
        return LoweringUtils.stmtOfStmts(stmt(s));
    }

    private List<Node> stmts(List<Stmt> stmts) {
        List<Node> out = new ArrayList<>();
        for (Stmt s : stmts) {
            out.addAll(stmt(s));
        }
        return out;
    }

    List<Node> stmt(Stmt s) {
        if (s instanceof Vars vars) {
            List<Node> out = new ArrayList<>();
            for (VarDecl v : vars.vars()) {
                out.add(varDecl(v));
            }
            return out;
        }
        return List.of(singleStmt(s));
    }

    private Node singleStmt(Stmt s) {
        if (s instanceof ExprSt es) {
            return new ExprStmtNode(expr(es.expr()));
        }
        if (s instanceof Block block) {
            return blockOf(block);
        }
        if (s instanceof If i) {
            Node otherwise = i.otherwise() == null ? null : stmt1(i.otherwise());
            return new IfNode(i.ifTok(), expr(i.cond()), stmt1(i.then()), otherwise);
        }
        if (s instanceof Switch sw) {
            List<CaseNode> cases = new ArrayList<>();
            for (CaseClause clause : sw.cases()) {
                if (clause instanceof Case c) {
                    cases.add(new CaseNode(c.caseTok(), expr(c.expr()), stmts(c.body())));
                } else {
                    Default d = (Default) clause;
                    cases.add(new CaseNode(d.defaultTok(), null, stmts(d.body())));
                }
            }
            return new SwitchNode(sw.switchTok(), expr(sw.expr()), cases);
        }
        if (s instanceof While w) {
            return new WhileNode(w.whileTok(), expr(w.cond()), stmt1(w.body()));
        }
        if (s instanceof DoWhile d) {
            return new DoWhileNode(d.doTok(), stmt1(d.body()), expr(d.cond()));
        }
        if (s instanceof For f) {
            List<Node> init = new ArrayList<>();
            if (f.init() != null) {
                init.add(expr(f.init()));
            }
            return new ForNode(f.forTok(), init, f.cond() == null ? null : expr(f.cond()),
                    f.next() == null ? null : expr(f.next()), stmt1(f.body()));
        }
        if (s instanceof Return r) {
            return new ReturnNode(r.returnTok(), r.value() == null ? null : expr(r.value()));
        }
        if (s instanceof Continue c) {
            return new JumpNode(JumpNode.Kind.CONTINUE, c.info(), null);
        }
        if (s instanceof Break b) {
            return new JumpNode(JumpNode.Kind.BREAK, b.info(), null);
        }
        if (s instanceof Label l) {
            return new LabelNode(id(l.label()), stmt1(l.body()));
        }
        if (s instanceof Goto g) {
            return new JumpNode(JumpNode.Kind.GOTO, g.gotoTok(), id(g.label()));
        }
        Asm asm = (Asm) s;
        List<Node> parts = new ArrayList<>();
        for (Expr part : asm.parts()) {
            parts.add(expr(part));
        }
        return new OtherStmtNode("Asm", parts, asm.asmTok());
    }
}
