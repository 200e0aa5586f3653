package org.polyfront.lowering;

import org.polyfront.astnode.AnonClassNode;
import org.polyfront.astnode.ArrayAccessNode;
import org.polyfront.astnode.AssignNode;
import org.polyfront.astnode.AssignOpNode;
import org.polyfront.astnode.AttributeNode;
import org.polyfront.astnode.BlockNode;
import org.polyfront.astnode.CallNode;
import org.polyfront.astnode.CaseNode;
import org.polyfront.astnode.CatchNode;
import org.polyfront.astnode.ClassDefinitionNode;
import org.polyfront.astnode.ConditionalNode;
import org.polyfront.astnode.ContainerNode;
import org.polyfront.astnode.DefinitionKind;
import org.polyfront.astnode.DefinitionNode;
import org.polyfront.astnode.DoWhileNode;
import org.polyfront.astnode.DotAccessNode;
import org.polyfront.astnode.EntityNode;
import org.polyfront.astnode.ExportNode;
import org.polyfront.astnode.ExprStmtNode;
import org.polyfront.astnode.FieldNode;
import org.polyfront.astnode.ForEachNode;
import org.polyfront.astnode.ForNode;
import org.polyfront.astnode.FunctionDefinitionNode;
import org.polyfront.astnode.IdInfo;
import org.polyfront.astnode.IdNode;
import org.polyfront.astnode.IfNode;
import org.polyfront.astnode.ImportAsNode;
import org.polyfront.astnode.ImportFromNode;
import org.polyfront.astnode.JumpNode;
import org.polyfront.astnode.KeywordAttribute;
import org.polyfront.astnode.LabelNode;
import org.polyfront.astnode.LambdaNode;
import org.polyfront.astnode.LiteralNode;
import org.polyfront.astnode.ModuleName;
import org.polyfront.astnode.Node;
import org.polyfront.astnode.Operator;
import org.polyfront.astnode.OtherDirectiveNode;
import org.polyfront.astnode.OtherExprNode;
import org.polyfront.astnode.ParameterNode;
import org.polyfront.astnode.PatternNode;
import org.polyfront.astnode.ProgramNode;
import org.polyfront.astnode.RecordNode;
import org.polyfront.astnode.ResolvedName;
import org.polyfront.astnode.ReturnNode;
import org.polyfront.astnode.SeqNode;
import org.polyfront.astnode.SpecialKind;
import org.polyfront.astnode.SpecialNode;
import org.polyfront.astnode.SwitchNode;
import org.polyfront.astnode.ThrowNode;
import org.polyfront.astnode.TryNode;
import org.polyfront.astnode.VariableDefinitionNode;
import org.polyfront.astnode.WhileNode;
import org.polyfront.astnode.XmlNode;
import org.polyfront.core.FrontendContext;
import org.polyfront.cst.JsCst.*;
import org.polyfront.lexer.SourceInfo;
import org.polyfront.runtime.TodoConstructException;
import org.polyfront.runtime.UnhandledConstructException;
import org.polyfront.symbols.ScopeEnv;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.polyfront.lowering.LoweringUtils.args;
import static org.polyfront.lowering.LoweringUtils.fake;
import static org.polyfront.lowering.LoweringUtils.field;
import static org.polyfront.lowering.LoweringUtils.resolvedId;
import static org.polyfront.lowering.LoweringUtils.special;
import static org.polyfront.lowering.LoweringUtils.variable;

/**
 * Lowers a JavaScript CST to the Generic AST.
 * <p>
 * A {@link ScopeEnv} is threaded through the walk so that every identifier
 * use gets its resolution: a local or parameter binding when one is in scope,
 * one of the special forms ({@code require}, {@code undefined}...) otherwise,
 * and "not resolved" for everything else. A binding shadows a special form of
 * the same name.
 * <p>
 * One instance lowers one unit; it numbers the temporaries it synthesizes.
 */
public class JsToGeneric {

    /**
     * The name under which a default export is bound and exported.
     */
    public static final String DEFAULT_EXPORT = "!default!";

    private static final Map<String, SpecialKind> SPECIAL_NAMES = Map.of(
            "eval", SpecialKind.EVAL,
            "undefined", SpecialKind.UNDEFINED,
            "require", SpecialKind.REQUIRE,
            "exports", SpecialKind.EXPORTS,
            "module", SpecialKind.MODULE,
            "define", SpecialKind.DEFINE,
            "arguments", SpecialKind.ARGUMENTS);

    // Decimal or radix-prefixed integer, with digit separators and an optional BigInt suffix
    private static final Pattern INT_LITERAL = Pattern.compile("[0-9][0-9_]*n?|0[xXoObB][0-9a-fA-F_]+n?");

    private static final Map<BinaryOp, Operator> BINARY_OPERATORS = new EnumMap<>(BinaryOp.class);

    static {
        BINARY_OPERATORS.put(BinaryOp.B_ADD, Operator.PLUS);
        BINARY_OPERATORS.put(BinaryOp.B_SUB, Operator.MINUS);
        BINARY_OPERATORS.put(BinaryOp.B_MUL, Operator.MULT);
        BINARY_OPERATORS.put(BinaryOp.B_DIV, Operator.DIV);
        BINARY_OPERATORS.put(BinaryOp.B_MOD, Operator.MOD);
        BINARY_OPERATORS.put(BinaryOp.B_EXPO, Operator.POW);
        BINARY_OPERATORS.put(BinaryOp.B_LE, Operator.LT_E);
        BINARY_OPERATORS.put(BinaryOp.B_GE, Operator.GT_E);
        BINARY_OPERATORS.put(BinaryOp.B_LT, Operator.LT);
        BINARY_OPERATORS.put(BinaryOp.B_GT, Operator.GT);
        BINARY_OPERATORS.put(BinaryOp.B_LSL, Operator.LSL);
        BINARY_OPERATORS.put(BinaryOp.B_LSR, Operator.LSR);
        BINARY_OPERATORS.put(BinaryOp.B_ASR, Operator.ASR);
        BINARY_OPERATORS.put(BinaryOp.B_EQUAL, Operator.EQ);
        BINARY_OPERATORS.put(BinaryOp.B_NOTEQUAL, Operator.NOT_EQ);
        BINARY_OPERATORS.put(BinaryOp.B_PHYSEQUAL, Operator.PHYS_EQ);
        BINARY_OPERATORS.put(BinaryOp.B_NOTPHYSEQUAL, Operator.NOT_PHYS_EQ);
        BINARY_OPERATORS.put(BinaryOp.B_BITAND, Operator.BIT_AND);
        BINARY_OPERATORS.put(BinaryOp.B_BITOR, Operator.BIT_OR);
        BINARY_OPERATORS.put(BinaryOp.B_BITXOR, Operator.BIT_XOR);
        BINARY_OPERATORS.put(BinaryOp.B_AND, Operator.AND);
        BINARY_OPERATORS.put(BinaryOp.B_OR, Operator.OR);
        BINARY_OPERATORS.put(BinaryOp.B_NULLISH, Operator.NULLISH);
    }

    private final FrontendContext ctx;
    private int tempCounter;

    public JsToGeneric(FrontendContext ctx) {
        this.ctx = ctx;
    }

    public ProgramNode program(Program program) {
        ctx.logDebug("lowering JavaScript unit " + ctx.fileName());
        ScopeEnv env = ScopeEnv.empty();
        List<Node> items = new ArrayList<>();
        for (ModuleItem item : program.items()) {
            List<Node> lowered = moduleItem(env, item);
            items.addAll(lowered);
            env = bindDefinitions(env, lowered);
        }
        ctx.logDebug("lowered " + items.size() + " items, " + tempCounter + " temporaries");
        return new ProgramNode(ctx.fileName(), items);
    }

    String freshTemp() {
        tempCounter++;
        return "!tmp" + tempCounter + "!";
    }

    static KeywordAttribute kindAttribute(VarKind kind) {
        return switch (kind) {
            case VAR -> KeywordAttribute.VAR;
            case LET -> KeywordAttribute.LET;
            case CONST -> KeywordAttribute.CONST;
        };
    }

    /**
     * Extends the environment with what the lowered nodes define: block-scoped
     * declarations and imports are prepended, {@code var} declarations go to the
     * function-scoped set.
     */
    ScopeEnv bindDefinitions(ScopeEnv env, List<Node> nodes) {
        for (Node node : nodes) {
            if (node instanceof DefinitionNode def) {
                IdNode name = def.entity.name;
                if (def.entity.hasAttribute(KeywordAttribute.VAR)) {
                    env.declareVar(name.name, name.info);
                } else if (def.entity.hasAttribute(KeywordAttribute.LET)
                        || def.entity.hasAttribute(KeywordAttribute.CONST)) {
                    env = env.withLocal(name.name, name.info);
                }
            } else if (node instanceof ImportFromNode imp) {
                IdNode bound = imp.alias != null ? imp.alias : imp.name;
                env = env.withImport(bound.name, bound.info);
            } else if (node instanceof ImportAsNode imp && imp.alias != null) {
                env = env.withImport(imp.alias.name, imp.alias.info);
            }
        }
        return env;
    }

    // ------------------------------------------------------------------
    // Module items
    // ------------------------------------------------------------------

    List<Node> moduleItem(ScopeEnv env, ModuleItem moduleItem) {
        if (moduleItem instanceof It it) {
            return item(env, it.item(), null);
        }
        if (moduleItem instanceof ImportItem imp) {
            return importDecl(imp.importTok(), imp.decl());
        }
        ExportItem exp = (ExportItem) moduleItem;
        return exportDecl(env, exp.exportTok(), exp.decl());
    }

    private static IdNode importedName(String name, SourceInfo info) {
        return new IdNode(name, info, new IdInfo(ResolvedName.imported(info)));
    }

    private static ModuleName module(Name path) {
        return ModuleName.file(new IdNode(path.name(), path.info()));
    }

    List<Node> importDecl(SourceInfo importTok, ImportDecl decl) {
        List<Node> out = new ArrayList<>();
        if (decl instanceof ImportEffect effect) {
            Name path = effect.path();
            String category = path.name().endsWith(".css") ? "ImportCss" : "ImportEffect";
            out.add(new OtherDirectiveNode(category,
                    List.of(new LiteralNode(LiteralNode.Kind.STRING, path.name(), path.info())), importTok));
            return out;
        }
        ImportFrom from = (ImportFrom) decl;
        Name def = from.defaultName();
        if (def != null) {
            out.add(new ImportFromNode(importTok, module(from.path()),
                    new IdNode(DEFAULT_EXPORT, def.info()), importedName(def.name(), def.info())));
        }
        ImportClause clause = from.clause();
        if (clause instanceof ImportNamespace ns) {
            out.add(new ImportAsNode(importTok, module(from.path()),
                    importedName(ns.alias().name(), ns.alias().info())));
        } else if (clause instanceof ImportNames names) {
            for (NameAlias na : names.names()) {
                Name n = na.name();
                if (na.alias() == null) {
                    out.add(new ImportFromNode(importTok, module(from.path()), importedName(n.name(), n.info()), null));
                } else {
                    out.add(new ImportFromNode(importTok, module(from.path()), new IdNode(n.name(), n.info()),
                            importedName(na.alias().name(), na.alias().info())));
                }
            }
        }
        // type-only imports have no runtime counterpart
        return out;
    }

    private static ExportNode export(SourceInfo exportTok, String name, SourceInfo defSite) {
        return new ExportNode(exportTok, resolvedId(name, defSite, ResolvedName.local(defSite)));
    }

    List<Node> exportDecl(ScopeEnv env, SourceInfo exportTok, ExportDecl decl) {
        List<Node> out = new ArrayList<>();
        if (decl instanceof ExportDefaultExpr def) {
            SourceInfo tok = def.defaultTok();
            out.add(variable(new IdNode(DEFAULT_EXPORT, tok), KeywordAttribute.CONST, tok, expr(env, def.expr())));
            out.add(export(exportTok, DEFAULT_EXPORT, tok));
        } else if (decl instanceof ExportDeclaration declaration) {
            for (Node node : item(env, declaration.item(), null)) {
                if (!(node instanceof DefinitionNode def)) {
                    throw new UnhandledConstructException("exporting a stmt", exportTok);
                }
                out.add(def);
                out.add(export(exportTok, def.entity.name.name, def.entity.name.info));
            }
        } else if (decl instanceof ExportDefaultDecl def) {
            out.addAll(item(env, def.item(), def.defaultTok()));
            out.add(export(exportTok, DEFAULT_EXPORT, def.defaultTok()));
        } else if (decl instanceof ExportNames names) {
            for (NameAlias na : names.names()) {
                Name n = na.name();
                if (na.alias() == null) {
                    out.add(new ExportNode(exportTok, idRef(env, n)));
                } else {
                    Name alias = na.alias();
                    out.add(variable(new IdNode(alias.name(), alias.info()), KeywordAttribute.CONST, fake("const"),
                            identifier(env, n)));
                    out.add(export(exportTok, alias.name(), alias.info()));
                }
            }
        } else if (decl instanceof ReExportNames re) {
            for (NameAlias na : re.names()) {
                Name n = na.name();
                String tmp = "!tmp_" + n.name();
                out.add(new ImportFromNode(exportTok, module(re.path()), new IdNode(n.name(), n.info()),
                        importedName(tmp, n.info())));
                Name exported = na.alias() != null ? na.alias() : n;
                out.add(variable(new IdNode(exported.name(), exported.info()), KeywordAttribute.CONST, fake("const"),
                        importedName(tmp, n.info())));
                out.add(export(exportTok, exported.name(), exported.info()));
            }
        } else {
            throw new UnhandledConstructException("reexporting namespace", exportTok);
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Items
    // ------------------------------------------------------------------

    private static DefinitionNode constDefinition(IdNode name, SourceInfo kindInfo, DefinitionKind definition) {
        name.idInfo.setResolved(ResolvedName.local(name.info));
        List<AttributeNode> attrs = new ArrayList<>();
        attrs.add(new AttributeNode(KeywordAttribute.CONST, kindInfo));
        return new DefinitionNode(new EntityNode(name, attrs), definition);
    }

    /**
     * Lowers a declaration item. A named function or class becomes a constant
     * definition; under {@code export default} it is additionally bound to
     * {@link #DEFAULT_EXPORT}.
     *
     * @param defaultTok the {@code default} keyword when exported as default, else null
     */
    List<Node> item(ScopeEnv env, Item item, SourceInfo defaultTok) {
        if (item instanceof St st) {
            if (defaultTok != null) {
                throw new UnhandledConstructException("exporting a stmt", defaultTok);
            }
            return stmt(env, st.stmt());
        }
        if (item instanceof InterfaceDecl decl) {
            throw new UnhandledConstructException("Typescript", decl.interfaceTok());
        }
        if (item instanceof ItemTodo todo) {
            throw new TodoConstructException("ItemTodo", todo.info());
        }

        Name name;
        SourceInfo kindTok;
        DefinitionKind definition;
        if (item instanceof FunDecl fun) {
            FuncDecl decl = fun.decl();
            name = decl.name() instanceof PnId id ? id.name() : null;
            kindTok = decl.kindTok();
            ScopeEnv fenv = name == null ? env : env.withLocal(name.name(), name.info());
            definition = funcDecl(fenv, decl, FunctionDefinitionNode.Kind.FUNCTION);
            if (name == null && defaultTok == null) {
                throw new UnhandledConstructException("anonymous function declaration", kindTok);
            }
        } else {
            ClassDecl decl = ((ClassItem) item).decl();
            name = decl.name();
            kindTok = decl.classTok();
            definition = classDecl(env, decl);
            if (name == null && defaultTok == null) {
                throw new UnhandledConstructException("anonymous class declaration", kindTok);
            }
        }

        List<Node> out = new ArrayList<>();
        if (name == null) {
            out.add(constDefinition(new IdNode(DEFAULT_EXPORT, defaultTok), defaultTok, definition));
            return out;
        }
        out.add(constDefinition(new IdNode(name.name(), name.info()), kindTok, definition));
        if (defaultTok != null) {
            out.add(variable(new IdNode(DEFAULT_EXPORT, defaultTok), KeywordAttribute.CONST, defaultTok,
                    resolvedId(name.name(), name.info(), ResolvedName.local(name.info()))));
        }
        return out;
    }

    /**
     * Lowers a sequence of items, threading the environment so that each item
     * sees the declarations of the items before it.
     */
    List<Node> stmtItemList(ScopeEnv env, List<Item> items) {
        List<Node> out = new ArrayList<>();
        for (Item item : items) {
            List<Node> lowered = item(env, item, null);
            out.addAll(lowered);
            env = bindDefinitions(env, lowered);
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    /**
     * Lowers a statement that must stay a single node, such as a loop body.
     */
    Node stmt1(ScopeEnv env, Stmt s) {
        return LoweringUtils.stmtOfStmts(stmt(env, s));
    }

    List<Node> stmt(ScopeEnv env, Stmt s) {
        List<Node> out = new ArrayList<>();
        if (s instanceof VarsDecl decl) {
            for (VarBinding binding : decl.bindings()) {
                List<Node> defs = varBinding(env, decl.kind(), decl.kindTok(), binding);
                out.addAll(defs);
                env = bindDefinitions(env, defs);
            }
        } else if (s instanceof Block block) {
            out.add(new BlockNode(block.lbrace(), stmtItemList(env, block.items()), block.rbrace()));
        } else if (s instanceof Nop) {
            return out;
        } else if (s instanceof ExprStmt es) {
            if (es.expr() instanceof Str str && str.value().equals("use strict")) {
                out.add(new ExprStmtNode(special(SpecialKind.USE_STRICT, str.info())));
            } else {
                out.add(new ExprStmtNode(expr(env, es.expr())));
            }
        } else if (s instanceof If ifStmt) {
            Node otherwise = ifStmt.otherwise() == null ? null : stmt1(env, ifStmt.otherwise());
            out.add(new IfNode(ifStmt.ifTok(), expr(env, ifStmt.cond()), stmt1(env, ifStmt.then()), otherwise));
        } else if (s instanceof Do doStmt) {
            out.add(new DoWhileNode(doStmt.doTok(), stmt1(env, doStmt.body()), expr(env, doStmt.cond())));
        } else if (s instanceof While whileStmt) {
            out.add(new WhileNode(whileStmt.whileTok(), expr(env, whileStmt.cond()), stmt1(env, whileStmt.body())));
        } else if (s instanceof For forStmt) {
            out.add(forClassic(env, forStmt));
        } else if (s instanceof ForIn forIn) {
            out.add(forIn(env, forIn));
        } else if (s instanceof ForOf forOf) {
            out.add(JsTranspile.forOf(this, env, forOf));
        } else if (s instanceof Switch sw) {
            List<CaseNode> cases = new ArrayList<>();
            for (CaseClause clause : sw.cases()) {
                if (clause instanceof Case c) {
                    cases.add(new CaseNode(c.caseTok(), expr(env, c.expr()), stmtItemList(env, c.body())));
                } else {
                    Default d = (Default) clause;
                    cases.add(new CaseNode(d.defaultTok(), null, stmtItemList(env, d.body())));
                }
            }
            out.add(new SwitchNode(sw.switchTok(), expr(env, sw.discriminant()), cases));
        } else if (s instanceof Continue c) {
            out.add(new JumpNode(JumpNode.Kind.CONTINUE, c.continueTok(), label(c.label())));
        } else if (s instanceof Break b) {
            out.add(new JumpNode(JumpNode.Kind.BREAK, b.breakTok(), label(b.label())));
        } else if (s instanceof Return r) {
            out.add(new ReturnNode(r.returnTok(), r.value() == null ? null : expr(env, r.value())));
        } else if (s instanceof With w) {
            throw new TodoConstructException("with", w.withTok());
        } else if (s instanceof Labeled l) {
            out.add(new LabelNode(new IdNode(l.label().name(), l.label().info()), stmt1(env, l.body())));
        } else if (s instanceof Throw t) {
            out.add(new ThrowNode(t.throwTok(), expr(env, t.value())));
        } else if (s instanceof Try t) {
            out.add(tryStmt(env, t));
        } else {
            throw new UnhandledConstructException(s.getClass().getSimpleName(), fake("stmt"));
        }
        return out;
    }

    private static IdNode label(Name name) {
        return name == null ? null : new IdNode(name.name(), name.info());
    }

    List<Node> varBinding(ScopeEnv env, VarKind kind, SourceInfo kindTok, VarBinding binding) {
        if (binding instanceof VarClassic classic) {
            Node init = classic.init() == null ? null : expr(env, classic.init());
            Name n = classic.name();
            return List.of(variable(new IdNode(n.name(), n.info()), kindAttribute(kind), kindTok, init));
        }
        VarPattern pattern = (VarPattern) binding;
        if (pattern.init() == null) {
            throw new TodoConstructException("VarPattern:pattern without initializer", kindTok);
        }
        return JsTranspile.varPattern(this, env, kind, kindTok, pattern.pattern(), expr(env, pattern.init()),
                "VarPattern:");
    }

    private Node forClassic(ScopeEnv env, For forStmt) {
        List<Node> init = new ArrayList<>();
        ScopeEnv loopEnv = env;
        if (forStmt.init() instanceof ForInitVars vars) {
            init.addAll(stmt(env, vars.decl()));
            loopEnv = bindDefinitions(env, init);
        } else if (forStmt.init() instanceof ForInitExpr e) {
            init.add(expr(env, e.expr()));
        }
        Node cond = forStmt.cond() == null ? null : expr(loopEnv, forStmt.cond());
        Node next = forStmt.next() == null ? null : expr(loopEnv, forStmt.next());
        return new ForNode(forStmt.forTok(), init, cond, next, stmt1(loopEnv, forStmt.body()));
    }

    private Node forIn(ScopeEnv env, ForIn forIn) {
        PatternNode pattern;
        ScopeEnv bodyEnv = env;
        if (forIn.lhs() instanceof ForLhsVar lhs) {
            if (!(lhs.binding() instanceof VarClassic classic) || classic.init() != null) {
                throw new TodoConstructException("For in with (pattern) vars?", lhs.kindTok());
            }
            Name n = classic.name();
            IdNode id = new IdNode(n.name(), n.info(), new IdInfo(ResolvedName.local(n.info())));
            pattern = PatternNode.id(id);
            if (lhs.kind() == VarKind.VAR) {
                env.declareVar(n.name(), n.info());
            } else {
                bodyEnv = env.withLocal(n.name(), n.info());
            }
        } else {
            Expr lhs = ((ForLhsExpr) forIn.lhs()).expr();
            if (!(lhs instanceof V v)) {
                throw new TodoConstructException("For in with complex left-hand side", forIn.forTok());
            }
            pattern = PatternNode.id(idRef(env, v.name()));
        }
        return new ForEachNode(forIn.forTok(), pattern, forIn.inTok(), expr(env, forIn.collection()),
                stmt1(bodyEnv, forIn.body()));
    }

    private Node tryStmt(ScopeEnv env, Try t) {
        List<CatchNode> catches = new ArrayList<>();
        if (t.catchTok() != null) {
            PatternNode pattern;
            ScopeEnv catchEnv = env;
            if (t.catchName() == null) {
                pattern = new PatternNode(PatternNode.Kind.UNDERSCORE, null, t.catchTok());
            } else {
                Name n = t.catchName();
                pattern = PatternNode.id(new IdNode(n.name(), n.info(), new IdInfo(ResolvedName.local(n.info()))));
                catchEnv = env.withLocal(n.name(), n.info());
            }
            catches.add(new CatchNode(t.catchTok(), pattern, stmt1(catchEnv, t.catchBody())));
        }
        Node finallyBody = t.finallyBody() == null ? null : stmt1(env, t.finallyBody());
        return new TryNode(t.tryTok(), stmt1(env, t.body()), catches, finallyBody);
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    /**
     * Resolves a name against the environment, ignoring special forms.
     */
    IdNode idRef(ScopeEnv env, Name n) {
        ResolvedName resolved = env.lookup(n.name());
        return new IdNode(n.name(), n.info(), new IdInfo(resolved != null ? resolved : ResolvedName.NOT_RESOLVED));
    }

    /**
     * Lowers an identifier use. Bindings win over special forms.
     */
    Node identifier(ScopeEnv env, Name n) {
        if (!env.isBound(n.name())) {
            SpecialKind special = SPECIAL_NAMES.get(n.name());
            if (special != null) {
                return new SpecialNode(special, n.info());
            }
        }
        return idRef(env, n);
    }

    Node expr(ScopeEnv env, Expr e) {
        if (e instanceof V v) {
            return identifier(env, v.name());
        }
        if (e instanceof Bool b) {
            return new LiteralNode(LiteralNode.Kind.BOOL, String.valueOf(b.value()), b.info());
        }
        if (e instanceof Num n) {
            LiteralNode.Kind kind = INT_LITERAL.matcher(n.value()).matches()
                    ? LiteralNode.Kind.INT : LiteralNode.Kind.FLOAT;
            return new LiteralNode(kind, n.value(), n.info());
        }
        if (e instanceof Str s) {
            return new LiteralNode(LiteralNode.Kind.STRING, s.value(), s.info());
        }
        if (e instanceof Regexp r) {
            return new LiteralNode(LiteralNode.Kind.REGEXP, r.value(), r.info());
        }
        if (e instanceof Null n) {
            return new LiteralNode(LiteralNode.Kind.NULL, "null", n.info());
        }
        if (e instanceof This t) {
            return new SpecialNode(SpecialKind.THIS, t.info());
        }
        if (e instanceof Super s) {
            return new SpecialNode(SpecialKind.SUPER, s.info());
        }
        if (e instanceof Unary u) {
            return unary(u, expr(env, u.expr()));
        }
        if (e instanceof Binary b) {
            Node left = expr(env, b.left());
            Node right = expr(env, b.right());
            if (b.op() == BinaryOp.B_INSTANCEOF) {
                return special(SpecialKind.INSTANCEOF, b.opTok(), left, right);
            }
            if (b.op() == BinaryOp.B_IN) {
                return special(SpecialKind.IN, b.opTok(), left, right);
            }
            return LoweringUtils.operator(BINARY_OPERATORS.get(b.op()), b.opTok(), left, right);
        }
        if (e instanceof Period p) {
            return new DotAccessNode(expr(env, p.expr()), p.dot(), new IdNode(p.name().name(), p.name().info()));
        }
        if (e instanceof Bracket b) {
            return new ArrayAccessNode(expr(env, b.expr()), b.lbracket(), expr(env, b.index()));
        }
        if (e instanceof ObjectLit obj) {
            List<FieldNode> fields = new ArrayList<>();
            for (Property property : obj.properties()) {
                fields.add(property(env, property));
            }
            return new RecordNode(fields, obj.lbrace());
        }
        if (e instanceof ArrayLit arr) {
            List<Node> elements = new ArrayList<>();
            for (Expr element : arr.elements()) {
                elements.add(element == null
                        ? new OtherExprNode("Nop", List.of(), arr.lbracket())
                        : expr(env, element));
            }
            return new ContainerNode(ContainerNode.Kind.ARRAY, elements, arr.lbracket());
        }
        if (e instanceof Apply a) {
            List<Node> values = new ArrayList<>();
            for (Expr arg : a.args()) {
                values.add(expr(env, arg));
            }
            return new CallNode(expr(env, a.fn()), args(values));
        }
        if (e instanceof Conditional c) {
            return new ConditionalNode(expr(env, c.cond()), expr(env, c.then()), expr(env, c.otherwise()));
        }
        if (e instanceof Assign a) {
            Node lhs = expr(env, a.lhs());
            Node rhs = expr(env, a.rhs());
            if (a.op() == null) {
                return new AssignNode(lhs, a.opTok(), rhs);
            }
            Operator op = BINARY_OPERATORS.get(a.op());
            if (op == null) {
                throw new UnhandledConstructException("compound assignment with " + a.op(), a.opTok());
            }
            return new AssignOpNode(lhs, op, a.opTok(), rhs);
        }
        if (e instanceof AssignPattern a) {
            throw new TodoConstructException("AssignPattern", a.eq());
        }
        if (e instanceof Seq s) {
            return new SeqNode(List.of(expr(env, s.left()), expr(env, s.right())));
        }
        if (e instanceof FunctionExpr f) {
            FuncDecl decl = f.decl();
            ScopeEnv fenv = decl.name() instanceof PnId id ? env.withLocal(id.name().name(), id.name().info()) : env;
            return new LambdaNode(funcDecl(fenv, decl, FunctionDefinitionNode.Kind.FUNCTION));
        }
        if (e instanceof ClassExpr c) {
            return new AnonClassNode(classDecl(env, c.decl()));
        }
        if (e instanceof ArrowExpr a) {
            return new LambdaNode(arrow(env, a.arrow()));
        }
        if (e instanceof Yield y) {
            SpecialKind kind = y.star() ? SpecialKind.YIELD_STAR : SpecialKind.YIELD;
            return y.value() == null ? special(kind, y.yieldTok()) : special(kind, y.yieldTok(), expr(env, y.value()));
        }
        if (e instanceof Await a) {
            return special(SpecialKind.AWAIT, a.awaitTok(), expr(env, a.value()));
        }
        if (e instanceof NewTarget n) {
            return special(SpecialKind.NEW_TARGET, n.newTok());
        }
        if (e instanceof Encaps enc) {
            List<Node> parts = new ArrayList<>();
            for (Expr part : enc.parts()) {
                parts.add(expr(env, part));
            }
            Node strings = new CallNode(new SpecialNode(SpecialKind.ENCODED_STRING, enc.backquote()), args(parts));
            return enc.tag() == null ? strings : new CallNode(expr(env, enc.tag()), args(strings));
        }
        if (e instanceof XmlExpr x) {
            return ctx.options.transpileXml ? JsTranspile.xml(this, env, x.xml()) : xml(env, x.xml());
        }
        if (e instanceof Paren p) {
            return expr(env, p.expr());
        }
        throw new UnhandledConstructException(e.getClass().getSimpleName(), fake("expr"));
    }

    private static Node unary(Unary u, Node e) {
        SourceInfo tok = u.opTok();
        return switch (u.op()) {
            case U_NEW -> special(SpecialKind.NEW, tok, e);
            case U_DELETE -> special(SpecialKind.DELETE, tok, e);
            case U_VOID -> special(SpecialKind.VOID, tok, e);
            case U_TYPEOF -> special(SpecialKind.TYPEOF, tok, e);
            case U_BITNOT -> LoweringUtils.operator(Operator.BIT_NOT, tok, e);
            case U_NOT -> LoweringUtils.operator(Operator.NOT, tok, e);
            case U_MINUS -> LoweringUtils.operator(Operator.MINUS, tok, e);
            case U_PLUS -> LoweringUtils.operator(Operator.PLUS, tok, e);
            case U_PRE_INCR -> special(SpecialKind.INCR_PREFIX, tok, e);
            case U_PRE_DECR -> special(SpecialKind.DECR_PREFIX, tok, e);
            case U_POST_INCR -> special(SpecialKind.INCR_POSTFIX, tok, e);
            case U_POST_DECR -> special(SpecialKind.DECR_POSTFIX, tok, e);
            case U_SPREAD -> special(SpecialKind.SPREAD, tok, e);
        };
    }

    private IdNode propertyId(PropertyName name) {
        if (name instanceof PnId id) {
            return new IdNode(id.name().name(), id.name().info());
        }
        if (name instanceof PnString str) {
            return new IdNode(str.value().name(), str.value().info());
        }
        if (name instanceof PnNum num) {
            return new IdNode(num.value().name(), num.value().info());
        }
        return null;
    }

    FieldNode property(ScopeEnv env, Property property) {
        if (property instanceof PField f) {
            Node value = expr(env, f.value());
            if (f.name() instanceof PnComputed c) {
                return new FieldNode(FieldNode.Kind.DYNAMIC, expr(env, c.expr()), value);
            }
            return FieldNode.stmt(field(propertyId(f.name()), value));
        }
        if (property instanceof PMethod m) {
            return method(env, m.decl(), new ArrayList<>());
        }
        if (property instanceof PShorthand s) {
            Name n = s.name();
            return FieldNode.stmt(field(new IdNode(n.name(), n.info()), identifier(env, n)));
        }
        PSpread spread = (PSpread) property;
        return new FieldNode(FieldNode.Kind.SPREAD, null, expr(env, spread.expr()));
    }

    private FieldNode method(ScopeEnv env, FuncDecl decl, List<AttributeNode> attrs) {
        FunctionDefinitionNode fn = funcDecl(env, decl, FunctionDefinitionNode.Kind.METHOD);
        if (decl.name() instanceof PnComputed c) {
            return new FieldNode(FieldNode.Kind.DYNAMIC, expr(env, c.expr()), new LambdaNode(fn));
        }
        return FieldNode.stmt(new DefinitionNode(new EntityNode(propertyId(decl.name()), attrs), fn));
    }

    ClassDefinitionNode classDecl(ScopeEnv env, ClassDecl decl) {
        List<Node> parents = new ArrayList<>();
        if (decl.extendsExpr() != null) {
            parents.add(expr(env, decl.extendsExpr()));
        }
        List<FieldNode> body = new ArrayList<>();
        for (ClassElement element : decl.body()) {
            if (element instanceof CExtraSemicolon) {
                continue;
            }
            List<AttributeNode> attrs = new ArrayList<>();
            if (element instanceof CField f) {
                if (f.staticTok() != null) {
                    attrs.add(new AttributeNode(KeywordAttribute.STATIC, f.staticTok()));
                }
                Node value = f.value() == null ? null : expr(env, f.value());
                if (f.name() instanceof PnComputed c) {
                    body.add(new FieldNode(FieldNode.Kind.DYNAMIC, expr(env, c.expr()), value));
                } else {
                    IdNode name = propertyId(f.name());
                    body.add(FieldNode.stmt(new DefinitionNode(new EntityNode(name, attrs),
                            new VariableDefinitionNode(name.info, value, null))));
                }
            } else {
                CMethod m = (CMethod) element;
                if (m.staticTok() != null) {
                    attrs.add(new AttributeNode(KeywordAttribute.STATIC, m.staticTok()));
                }
                body.add(method(env, m.decl(), attrs));
            }
        }
        return new ClassDefinitionNode(ClassDefinitionNode.Kind.CLASS, decl.classTok(), parents, List.of(), body);
    }

    // ------------------------------------------------------------------
    // Functions
    // ------------------------------------------------------------------

    // Lowered parameters, the declarations unpacking pattern parameters, and
    // the environment of the function body
    private record Params(List<ParameterNode> params, List<Node> prologue, ScopeEnv env) {
    }

    private Params parameters(ScopeEnv env, List<Param> params) {
        List<ParameterNode> out = new ArrayList<>();
        List<Node> prologue = new ArrayList<>();
        List<org.polyfront.cst.JsCst.Pattern> patterns = new ArrayList<>();
        List<IdNode> patternParams = new ArrayList<>();
        for (int i = 0; i < params.size(); i++) {
            Param param = params.get(i);
            if (param instanceof ParamClassic classic) {
                Name n = classic.name();
                Node def = classic.defaultValue() == null ? null : expr(env, classic.defaultValue());
                IdNode id = new IdNode(n.name(), n.info(), new IdInfo(ResolvedName.param(n.info())));
                out.add(ParameterNode.classic(id, null, def));
                env = env.withParam(n.name(), n.info());
            } else if (param instanceof ParamEllipsis ellipsis) {
                Name n = ellipsis.name();
                IdNode id = new IdNode(n.name(), n.info(), new IdInfo(ResolvedName.param(n.info())));
                out.add(new ParameterNode(ParameterNode.Kind.VARIADIC, id, null, null, List.of(), ellipsis.dots()));
                env = env.withParam(n.name(), n.info());
            } else {
                ParamPattern pattern = (ParamPattern) param;
                String name = "!arg" + i + "!";
                SourceInfo info = fake(name);
                Node def = pattern.defaultValue() == null ? null : expr(env, pattern.defaultValue());
                out.add(ParameterNode.classic(resolvedId(name, info, ResolvedName.param(info)), null, def));
                env = env.withParam(name, info);
                patterns.add(pattern.pattern());
                patternParams.add(resolvedId(name, info, ResolvedName.param(info)));
            }
        }
        for (int i = 0; i < patterns.size(); i++) {
            List<Node> defs = JsTranspile.paramPattern(this, env, patterns.get(i), patternParams.get(i));
            prologue.addAll(defs);
            env = bindDefinitions(env, defs);
        }
        return new Params(out, prologue, env);
    }

    FunctionDefinitionNode funcDecl(ScopeEnv env, FuncDecl decl, FunctionDefinitionNode.Kind kind) {
        ScopeEnv fenv = env.enterFunction();
        List<AttributeNode> properties = new ArrayList<>();
        if (decl.kind() == FuncKind.F_GET) {
            properties.add(new AttributeNode(KeywordAttribute.GETTER, decl.kindTok()));
        } else if (decl.kind() == FuncKind.F_SET) {
            properties.add(new AttributeNode(KeywordAttribute.SETTER, decl.kindTok()));
        }
        if (decl.generatorTok() != null) {
            properties.add(new AttributeNode(KeywordAttribute.GENERATOR, decl.generatorTok()));
        }
        if (decl.asyncTok() != null) {
            properties.add(new AttributeNode(KeywordAttribute.ASYNC, decl.asyncTok()));
        }
        Params params = parameters(fenv, decl.params());
        List<Node> body = new ArrayList<>(params.prologue());
        body.addAll(stmtItemList(params.env(), decl.body()));
        SourceInfo info = decl.kindTok() != null ? decl.kindTok() : fake("function");
        return new FunctionDefinitionNode(kind, info, params.params(), null,
                new BlockNode(fake("{"), body, fake("}")), properties);
    }

    /**
     * An arrow with an expression body gets an implicit {@code return}.
     */
    FunctionDefinitionNode arrow(ScopeEnv env, Arrow arrow) {
        ScopeEnv fenv = env.enterFunction();
        List<AttributeNode> properties = new ArrayList<>();
        if (arrow.asyncTok() != null) {
            properties.add(new AttributeNode(KeywordAttribute.ASYNC, arrow.asyncTok()));
        }
        Params params = parameters(fenv, arrow.params());
        List<Node> body = new ArrayList<>(params.prologue());
        Node bodyNode;
        if (arrow.body() instanceof ArrowExprBody e) {
            body.add(new ReturnNode(fake("return"), expr(params.env(), e.expr())));
            bodyNode = LoweringUtils.stmtOfStmts(body);
        } else {
            ArrowBlockBody b = (ArrowBlockBody) arrow.body();
            body.addAll(stmtItemList(params.env(), b.items()));
            bodyNode = new BlockNode(b.lbrace(), body, b.rbrace());
        }
        return new FunctionDefinitionNode(FunctionDefinitionNode.Kind.ARROW, arrow.arrow(), params.params(), null,
                bodyNode, properties);
    }

    // ------------------------------------------------------------------
    // JSX
    // ------------------------------------------------------------------

    FieldNode xmlAttribute(ScopeEnv env, XmlAttr attr) {
        if (attr instanceof XmlAttrValue v) {
            return FieldNode.stmt(field(new IdNode(v.name().name(), v.name().info()), expr(env, v.value())));
        }
        XmlAttrSpread spread = (XmlAttrSpread) attr;
        return new FieldNode(FieldNode.Kind.SPREAD, null, expr(env, spread.expr()));
    }

    private Node xml(ScopeEnv env, Xml xml) {
        List<FieldNode> attrs = new ArrayList<>();
        for (XmlAttr attr : xml.attrs()) {
            attrs.add(xmlAttribute(env, attr));
        }
        List<Node> body = new ArrayList<>();
        for (XmlBody child : xml.body()) {
            if (child instanceof XmlText text) {
                body.add(new LiteralNode(LiteralNode.Kind.STRING, text.text().name(), text.text().info()));
            } else if (child instanceof XmlExprBody e) {
                body.add(expr(env, e.expr()));
            } else {
                body.add(xml(env, ((XmlChild) child).xml()));
            }
        }
        IdNode tag = xml.tag() == null ? null : new IdNode(xml.tag().name(), xml.tag().info());
        return new XmlNode(tag, attrs, body, tag != null ? tag.info : fake("<>"));
    }
}
