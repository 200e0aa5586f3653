package org.polyfront.lowering;

import org.polyfront.astnode.ArgumentNode;
import org.polyfront.astnode.AssignNode;
import org.polyfront.astnode.AttributeNode;
import org.polyfront.astnode.BlockNode;
import org.polyfront.astnode.CallNode;
import org.polyfront.astnode.CastNode;
import org.polyfront.astnode.ClassDefinitionNode;
import org.polyfront.astnode.ContainerNode;
import org.polyfront.astnode.DefinitionKind;
import org.polyfront.astnode.DefinitionNode;
import org.polyfront.astnode.DotAccessNode;
import org.polyfront.astnode.EntityNode;
import org.polyfront.astnode.ExprStmtNode;
import org.polyfront.astnode.FieldNode;
import org.polyfront.astnode.FunctionDefinitionNode;
import org.polyfront.astnode.IdNode;
import org.polyfront.astnode.IfNode;
import org.polyfront.astnode.ImportAllNode;
import org.polyfront.astnode.ImportFromNode;
import org.polyfront.astnode.KeywordAttribute;
import org.polyfront.astnode.LiteralNode;
import org.polyfront.astnode.ModuleName;
import org.polyfront.astnode.Node;
import org.polyfront.astnode.Operator;
import org.polyfront.astnode.OtherDirectiveNode;
import org.polyfront.astnode.OtherExprNode;
import org.polyfront.astnode.PackageNode;
import org.polyfront.astnode.ParameterNode;
import org.polyfront.astnode.ProgramNode;
import org.polyfront.astnode.ReturnNode;
import org.polyfront.astnode.SpecialKind;
import org.polyfront.astnode.SpecialNode;
import org.polyfront.astnode.ThrowNode;
import org.polyfront.astnode.TypeDefinitionNode;
import org.polyfront.astnode.TypeNode;
import org.polyfront.astnode.VariableDefinitionNode;
import org.polyfront.astnode.WhileNode;
import org.polyfront.core.FrontendContext;
import org.polyfront.cst.ScalaCst.*;
import org.polyfront.runtime.TodoConstructException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;
import static org.polyfront.lowering.LoweringUtils.args;

/**
 * Lowers a Scala CST to the Generic AST.
 * <p>
 * Identifiers are not resolved here; their resolution cells stay empty.
 */
public class ScalaToGeneric {

    private static final Map<String, Operator> BINARY_OPERATORS = Map.ofEntries(
            entry("+", Operator.PLUS),
            entry("-", Operator.MINUS),
            entry("*", Operator.MULT),
            entry("/", Operator.DIV),
            entry("%", Operator.MOD),
            entry("<<", Operator.LSL),
            entry(">>>", Operator.LSR),
            entry(">>", Operator.ASR),
            entry("|", Operator.BIT_OR),
            entry("^", Operator.BIT_XOR),
            entry("&", Operator.BIT_AND),
            entry("&&", Operator.AND),
            entry("||", Operator.OR),
            entry("==", Operator.EQ),
            entry("!=", Operator.NOT_EQ),
            entry("eq", Operator.PHYS_EQ),
            entry("ne", Operator.NOT_PHYS_EQ),
            entry("<", Operator.LT),
            entry("<=", Operator.LT_E),
            entry(">", Operator.GT),
            entry(">=", Operator.GT_E),
            entry("++", Operator.CONCAT));

    private static final Map<String, Operator> PREFIX_OPERATORS = Map.of(
            "-", Operator.MINUS,
            "+", Operator.PLUS,
            "!", Operator.NOT,
            "~", Operator.BIT_NOT);

    private static final Set<String> BUILTIN_TYPES = Set.of(
            "Int", "Long", "Short", "Byte", "Char", "Float", "Double", "Boolean", "Unit", "String");

    private final FrontendContext ctx;

    public ScalaToGeneric(FrontendContext ctx) {
        this.ctx = ctx;
    }

    public ProgramNode program(Program program) {
        ctx.logDebug("lowering Scala unit " + ctx.fileName());
        List<Node> items = new ArrayList<>();
        for (BlockStat stat : program.stats()) {
            items.addAll(blockStat(stat));
        }
        return new ProgramNode(ctx.fileName(), items);
    }

    private static IdNode id(Ident ident) {
        return new IdNode(ident.name(), ident.info());
    }

    private static List<IdNode> ids(List<Ident> idents) {
        List<IdNode> out = new ArrayList<>();
        for (Ident ident : idents) {
            out.add(id(ident));
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Statements and directives
    // ------------------------------------------------------------------

    List<Node> blockStat(BlockStat stat) {
        List<Node> out = new ArrayList<>();
        if (stat instanceof D d) {
            out.add(definition(d.definition()));
        } else if (stat instanceof I i) {
            out.addAll(importClause(i.importClause()));
        } else if (stat instanceof E e) {
            out.add(asStatement(expr(e.expr())));
        } else if (stat instanceof P p) {
            out.add(new PackageNode(p.pkg().packageTok(), ids(p.pkg().name())));
        } else if (stat instanceof Packaging packaging) {
            out.add(new PackageNode(packaging.pkg().packageTok(), ids(packaging.pkg().name())));
            for (BlockStat inner : packaging.stats()) {
                out.addAll(blockStat(inner));
            }
            out.add(new OtherDirectiveNode("PackageEnd", List.of(), packaging.rbrace()));
        } else {
            BlockTodo todo = (BlockTodo) stat;
            throw new TodoConstructException(todo.category(), todo.info());
        }
        return out;
    }

    /**
     * Statement-like expressions stand on their own; other expressions are
     * wrapped in an expression statement.
     */
    private static Node asStatement(Node node) {
        if (node instanceof IfNode || node instanceof WhileNode || node instanceof ReturnNode
                || node instanceof ThrowNode || node instanceof BlockNode) {
            return node;
        }
        return new ExprStmtNode(node);
    }

    List<Node> importClause(Import imp) {
        List<Node> out = new ArrayList<>();
        for (ImportExpr ie : imp.exprs()) {
            ImportSpec spec = ie.spec();
            if (spec instanceof ImportId importId) {
                out.add(new ImportFromNode(imp.importTok(), ModuleName.dotted(ids(ie.path())), id(importId.name()), null));
            } else if (spec instanceof ImportWildcard wildcard) {
                out.add(new ImportAllNode(imp.importTok(), ModuleName.dotted(ids(ie.path())), wildcard.underscore()));
            } else {
                for (ImportSelector selector : ((ImportSelectors) spec).selectors()) {
                    Ident name = selector.name();
                    if (name.name().equals("_")) {
                        out.add(new ImportAllNode(imp.importTok(), ModuleName.dotted(ids(ie.path())), name.info()));
                    } else if (selector.alias() == null) {
                        out.add(new ImportFromNode(imp.importTok(), ModuleName.dotted(ids(ie.path())), id(name), null));
                    } else if (selector.alias().name().equals("_")) {
                        // {name => _} hides name from a following wildcard
                        out.add(new OtherDirectiveNode("ImportHide", List.of(id(name)), selector.arrow()));
                    } else {
                        out.add(new ImportFromNode(imp.importTok(), ModuleName.dotted(ids(ie.path())), id(name),
                                id(selector.alias())));
                    }
                }
            }
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Definitions
    // ------------------------------------------------------------------

    private static KeywordAttribute keyword(ModifierKind kind) {
        return switch (kind) {
            case ABSTRACT -> KeywordAttribute.ABSTRACT;
            case FINAL -> KeywordAttribute.FINAL;
            case SEALED -> KeywordAttribute.SEALED;
            case IMPLICIT -> KeywordAttribute.IMPLICIT;
            case LAZY -> KeywordAttribute.LAZY;
            case PRIVATE -> KeywordAttribute.PRIVATE;
            case PROTECTED -> KeywordAttribute.PROTECTED;
            case OVERRIDE -> KeywordAttribute.OVERRIDE;
            case CASE_CLASS_OR_OBJECT -> KeywordAttribute.CASE_CLASS;
            case PACKAGE_OBJECT -> KeywordAttribute.PACKAGE_OBJECT;
        };
    }

    List<AttributeNode> attributes(List<Attribute> attrs) {
        List<AttributeNode> out = new ArrayList<>();
        for (Attribute attr : attrs) {
            if (attr instanceof Modifier m) {
                out.add(new AttributeNode(keyword(m.kind()), m.info()));
            } else {
                Annotation a = (Annotation) attr;
                out.add(AttributeNode.named(type(a.type()), arguments(a.arguments()), a.at()));
            }
        }
        return out;
    }

    Node definition(Definition definition) {
        if (definition instanceof DefTodo todo) {
            throw new TodoConstructException(todo.category(), todo.info());
        }
        DefEnt def = (DefEnt) definition;
        Entity entity = def.entity();
        List<AttributeNode> attrs = attributes(entity.attrs());
        DefinitionKind kind;
        if (def.kind() instanceof FuncDef f) {
            kind = function(f);
        } else if (def.kind() instanceof VarDef v) {
            attrs.add(new AttributeNode(v.kind() == VariableKind.VAL ? KeywordAttribute.CONST : KeywordAttribute.MUTABLE,
                    v.kindTok()));
            kind = new VariableDefinitionNode(v.kindTok(), v.body() == null ? null : expr(v.body()),
                    v.type() == null ? null : type(v.type()));
        } else if (def.kind() instanceof TypeDef t) {
            kind = TypeDefinitionNode.alias(type(t.body()), t.typeTok());
        } else {
            kind = template((Template) def.kind());
        }
        return new DefinitionNode(new EntityNode(id(entity.name()), attrs, ids(entity.typeParams())), kind);
    }

    private List<ParameterNode> parameters(List<List<Binding>> clauses) {
        List<ParameterNode> out = new ArrayList<>();
        for (List<Binding> clause : clauses) {
            for (Binding b : clause) {
                List<AttributeNode> attrs = new ArrayList<>();
                if (b.implicitTok() != null) {
                    attrs.add(new AttributeNode(KeywordAttribute.IMPLICIT, b.implicitTok()));
                }
                out.add(new ParameterNode(ParameterNode.Kind.CLASSIC, id(b.name()),
                        b.type() == null ? null : type(b.type()), null, attrs, b.name().info()));
            }
        }
        return out;
    }

    FunctionDefinitionNode function(FuncDef f) {
        Node body = null;
        if (f.body() instanceof BlockExpr block) {
            body = expr(block);
        } else if (f.body() != null) {
            body = asStatement(expr(f.body()));
        }
        FunctionDefinitionNode.Kind kind = f.kind() == FunctionKind.DEF
                ? FunctionDefinitionNode.Kind.FUNCTION : FunctionDefinitionNode.Kind.LAMBDA;
        return new FunctionDefinitionNode(kind, f.kindTok(), parameters(f.params()),
                f.returnType() == null ? null : type(f.returnType()), body, new ArrayList<>());
    }

    ClassDefinitionNode template(Template t) {
        ClassDefinitionNode.Kind kind = switch (t.kind()) {
            case CLASS -> ClassDefinitionNode.Kind.CLASS;
            case TRAIT -> ClassDefinitionNode.Kind.TRAIT;
            case OBJECT -> ClassDefinitionNode.Kind.OBJECT;
        };
        List<Node> parents = new ArrayList<>();
        for (int i = 0; i < t.parents().size(); i++) {
            Node parent = type(t.parents().get(i));
            if (i == 0) {
                // constructor arguments belong to the superclass
                for (Arguments arguments : t.parentArgs()) {
                    parent = new CallNode(parent, arguments(List.of(arguments)));
                }
            }
            parents.add(parent);
        }
        List<FieldNode> body = new ArrayList<>();
        if (t.body() != null) {
            for (BlockStat stat : t.body()) {
                for (Node node : blockStat(stat)) {
                    body.add(node instanceof DefinitionNode def
                            ? FieldNode.stmt(def)
                            : new FieldNode(FieldNode.Kind.STMT, null, node));
                }
            }
        }
        return new ClassDefinitionNode(kind, t.kindTok(), parents, parameters(t.classParams()), body);
    }

    // ------------------------------------------------------------------
    // Types
    // ------------------------------------------------------------------

    TypeNode type(Type t) {
        if (t instanceof TyName name) {
            List<Ident> path = name.path();
            if (path.size() == 1 && BUILTIN_TYPES.contains(path.get(0).name())) {
                return TypeNode.builtin(id(path.get(0)));
            }
            return TypeNode.named(ids(path));
        }
        if (t instanceof TyApp app) {
            if (!(app.type() instanceof TyName name)) {
                throw new TodoConstructException("higher-kinded type application", app.lbracket());
            }
            List<TypeNode> args = new ArrayList<>();
            for (Type arg : app.args()) {
                args.add(type(arg));
            }
            return TypeNode.apply(ids(name.path()), args);
        }
        if (t instanceof TyTuple tuple) {
            List<TypeNode> types = new ArrayList<>();
            for (Type component : tuple.types()) {
                types.add(type(component));
            }
            return TypeNode.tuple(types, tuple.lparen());
        }
        if (t instanceof TyFunction fn) {
            List<TypeNode> params = new ArrayList<>();
            for (Type param : fn.params()) {
                params.add(type(param));
            }
            return TypeNode.function(params, type(fn.result()), fn.arrow());
        }
        TyTodo todo = (TyTodo) t;
        throw new TodoConstructException(todo.category(), todo.info());
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    private List<ArgumentNode> arguments(List<Arguments> argumentLists) {
        List<ArgumentNode> out = new ArrayList<>();
        for (Arguments arguments : argumentLists) {
            if (arguments instanceof Args a) {
                for (Expr e : a.args()) {
                    out.add(ArgumentNode.arg(expr(e)));
                }
            } else {
                out.add(ArgumentNode.arg(expr(((ArgBlock) arguments).block())));
            }
        }
        return out;
    }

    private static Node pathHead(Ident ident) {
        return switch (ident.name()) {
            case "this" -> new SpecialNode(SpecialKind.THIS, ident.info());
            case "super" -> new SpecialNode(SpecialKind.SUPER, ident.info());
            default -> id(ident);
        };
    }

    private static LiteralNode literal(Literal l) {
        LiteralNode.Kind kind = switch (l.kind()) {
            case INT -> LiteralNode.Kind.INT;
            case FLOAT -> LiteralNode.Kind.FLOAT;
            case CHAR -> LiteralNode.Kind.CHAR;
            case STRING -> LiteralNode.Kind.STRING;
            case BOOL -> LiteralNode.Kind.BOOL;
            case NULL -> LiteralNode.Kind.NULL;
        };
        return new LiteralNode(kind, l.text(), l.info());
    }

    Node expr(Expr e) {
        if (e instanceof L l) {
            return literal(l.literal());
        }
        if (e instanceof Name name) {
            List<Ident> path = name.path();
            Node node = pathHead(path.get(0));
            for (int i = 1; i < path.size(); i++) {
                node = new DotAccessNode(node, path.get(i).info(), id(path.get(i)));
            }
            return node;
        }
        if (e instanceof Tuple tuple) {
            if (tuple.elements().isEmpty()) {
                return new LiteralNode(LiteralNode.Kind.UNIT, "()", tuple.lparen());
            }
            if (tuple.elements().size() == 1) {
                return expr(tuple.elements().get(0));
            }
            List<Node> elements = new ArrayList<>();
            for (Expr element : tuple.elements()) {
                elements.add(expr(element));
            }
            return new ContainerNode(ContainerNode.Kind.TUPLE, elements, tuple.lparen());
        }
        if (e instanceof DotAccess dot) {
            return new DotAccessNode(expr(dot.expr()), dot.dot(), id(dot.name()));
        }
        if (e instanceof Call call) {
            Node fn = expr(call.fn());
            for (Arguments arguments : call.arguments()) {
                fn = new CallNode(fn, arguments(List.of(arguments)));
            }
            return fn;
        }
        if (e instanceof InstanciatedExpr inst) {
            List<Node> parts = new ArrayList<>();
            parts.add(expr(inst.expr()));
            for (Type t : inst.types()) {
                parts.add(type(t));
            }
            return new OtherExprNode("TypeArguments", parts, inst.lbracket());
        }
        if (e instanceof TypedExpr typed) {
            return new CastNode(type(typed.type()), typed.colon(), expr(typed.expr()));
        }
        if (e instanceof Infix infix) {
            Node left = expr(infix.left());
            Node right = expr(infix.right());
            Operator op = BINARY_OPERATORS.get(infix.op().name());
            if (op != null) {
                return LoweringUtils.operator(op, infix.op().info(), left, right);
            }
            // any other operator is a method of the left operand
            return new CallNode(new DotAccessNode(left, infix.op().info(), id(infix.op())), args(right));
        }
        if (e instanceof Prefix prefix) {
            Operator op = PREFIX_OPERATORS.get(prefix.op().name());
            if (op == null) {
                throw new TodoConstructException("prefix operator " + prefix.op().name(), prefix.op().info());
            }
            return LoweringUtils.operator(op, prefix.op().info(), expr(prefix.expr()));
        }
        if (e instanceof Assign assign) {
            return new AssignNode(expr(assign.lhs()), assign.eq(), expr(assign.rhs()));
        }
        if (e instanceof New n) {
            List<ArgumentNode> args = new ArrayList<>();
            args.add(new ArgumentNode(ArgumentNode.Kind.ARG_TYPE, type(n.type())));
            args.addAll(arguments(n.arguments()));
            return new CallNode(new SpecialNode(SpecialKind.NEW, n.newTok()), args);
        }
        if (e instanceof BlockExpr block) {
            List<Node> stats = new ArrayList<>();
            for (BlockStat stat : block.stats()) {
                stats.addAll(blockStat(stat));
            }
            return new BlockNode(block.lbrace(), stats, block.rbrace());
        }
        if (e instanceof S s) {
            return stmt(s.stmt());
        }
        ExprTodo todo = (ExprTodo) e;
        throw new TodoConstructException(todo.category(), todo.info());
    }

    Node stmt(Stmt s) {
        if (s instanceof If i) {
            Node otherwise = i.elseBranch() == null ? null : expr(i.elseBranch());
            return new IfNode(i.ifTok(), expr(i.cond()), expr(i.then()), otherwise);
        }
        if (s instanceof While w) {
            return new WhileNode(w.whileTok(), expr(w.cond()), expr(w.body()));
        }
        if (s instanceof Return r) {
            return new ReturnNode(r.returnTok(), r.value() == null ? null : expr(r.value()));
        }
        Throw t = (Throw) s;
        return new ThrowNode(t.throwTok(), expr(t.value()));
    }
}
