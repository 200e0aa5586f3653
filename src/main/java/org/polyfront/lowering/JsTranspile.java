package org.polyfront.lowering;

import org.polyfront.astnode.ArrayAccessNode;
import org.polyfront.astnode.AssignNode;
import org.polyfront.astnode.BlockNode;
import org.polyfront.astnode.CallNode;
import org.polyfront.astnode.DotAccessNode;
import org.polyfront.astnode.ExprStmtNode;
import org.polyfront.astnode.FieldNode;
import org.polyfront.astnode.ForNode;
import org.polyfront.astnode.IdNode;
import org.polyfront.astnode.KeywordAttribute;
import org.polyfront.astnode.LiteralNode;
import org.polyfront.astnode.Node;
import org.polyfront.astnode.Operator;
import org.polyfront.astnode.RecordNode;
import org.polyfront.astnode.ResolvedName;
import org.polyfront.cst.JsCst.ForLhsExpr;
import org.polyfront.cst.JsCst.ForLhsVar;
import org.polyfront.cst.JsCst.ForOf;
import org.polyfront.cst.JsCst.Name;
import org.polyfront.cst.JsCst.PatArr;
import org.polyfront.cst.JsCst.PatDots;
import org.polyfront.cst.JsCst.PatId;
import org.polyfront.cst.JsCst.PatNest;
import org.polyfront.cst.JsCst.PatObj;
import org.polyfront.cst.JsCst.PatProp;
import org.polyfront.cst.JsCst.Pattern;
import org.polyfront.cst.JsCst.PatternProperty;
import org.polyfront.cst.JsCst.PnComputed;
import org.polyfront.cst.JsCst.PnId;
import org.polyfront.cst.JsCst.PnNum;
import org.polyfront.cst.JsCst.PnString;
import org.polyfront.cst.JsCst.PropertyName;
import org.polyfront.cst.JsCst.VarClassic;
import org.polyfront.cst.JsCst.VarKind;
import org.polyfront.cst.JsCst.VarPattern;
import org.polyfront.cst.JsCst.Xml;
import org.polyfront.cst.JsCst.XmlAttr;
import org.polyfront.cst.JsCst.XmlBody;
import org.polyfront.cst.JsCst.XmlChild;
import org.polyfront.cst.JsCst.XmlExprBody;
import org.polyfront.cst.JsCst.XmlText;
import org.polyfront.lexer.SourceInfo;
import org.polyfront.runtime.TodoConstructException;
import org.polyfront.symbols.ScopeEnv;

import java.util.ArrayList;
import java.util.List;

import static org.polyfront.lowering.LoweringUtils.fake;
import static org.polyfront.lowering.LoweringUtils.resolvedId;
import static org.polyfront.lowering.LoweringUtils.variable;

/**
 * Desugarings of the JavaScript lowering that rewrite a construct into
 * simpler ones: destructuring declarations, for-of loops and JSX elements.
 * <p>
 * A destructuring declaration {@code var {x, y} = point} becomes
 * <pre>
 *   var !tmp1! = point;
 *   var x = !tmp1!.x;
 *   var y = !tmp1!.y;
 * </pre>
 * where the temporary carries a fake position. Declarations that are already
 * simple are never rewritten again.
 */
public class JsTranspile {

    static final String ITERATOR = "!iterator!";
    static final String STEP = "!step!";

    // The value a pattern is taken apart from: a temporary or a parameter
    private record Source(String name, SourceInfo info, ResolvedName resolved) {
        IdNode ref() {
            return resolvedId(name, info, resolved);
        }
    }

    /**
     * Lowers {@code kind pattern = init} where init is already lowered.
     *
     * @param failurePrefix prepended to the category of a TODO raised for an
     *                      unsupported pattern shape
     * @return the temporary declaration followed by one declaration per bound name
     */
    public static List<Node> varPattern(JsToGeneric lowering, ScopeEnv env, VarKind kind, SourceInfo kindTok,
                                        Pattern pattern, Node init, String failurePrefix) {
        String tempName = lowering.freshTemp();
        SourceInfo tempInfo = fake(tempName);
        KeywordAttribute attr = JsToGeneric.kindAttribute(kind);
        List<Node> out = new ArrayList<>();
        out.add(variable(new IdNode(tempName, tempInfo), attr, kindTok, init));
        Source source = new Source(tempName, tempInfo, ResolvedName.local(tempInfo));
        try {
            compilePattern(lowering, env, attr, kindTok, source, pattern, out);
        } catch (TodoConstructException e) {
            throw new TodoConstructException(failurePrefix + e.category, e.getInfo(), e);
        }
        return out;
    }

    /**
     * Binds the names of a parameter pattern from the synthesized parameter
     * that replaces it.
     */
    public static List<Node> paramPattern(JsToGeneric lowering, ScopeEnv env, Pattern pattern, IdNode param) {
        List<Node> out = new ArrayList<>();
        Source source = new Source(param.name, param.info, param.idInfo.getResolved());
        try {
            compilePattern(lowering, env, KeywordAttribute.LET, fake("let"), source, pattern, out);
        } catch (TodoConstructException e) {
            throw new TodoConstructException("ParamPattern:" + e.category, e.getInfo(), e);
        }
        return out;
    }

    private static void compilePattern(JsToGeneric lowering, ScopeEnv env, KeywordAttribute attr,
                                       SourceInfo kindTok, Source source, Pattern pattern, List<Node> out) {
        if (pattern instanceof PatObj obj) {
            for (PatternProperty property : obj.properties()) {
                if (property instanceof PatId id) {
                    Node access = new DotAccessNode(source.ref(), fake("."), new IdNode(id.name().name(), id.name().info()));
                    bindTo(lowering, env, attr, kindTok, property, access, out);
                } else if (property instanceof PatProp prop) {
                    Node access = propertyAccess(lowering, env, source, prop.name());
                    bindTo(lowering, env, attr, kindTok, prop.value(), access, out);
                } else if (property instanceof PatDots dots) {
                    throw new TodoConstructException("rest property", dots.dots());
                } else {
                    throw new TodoConstructException("nested pattern without key", obj.lbrace());
                }
            }
        } else if (pattern instanceof PatArr arr) {
            List<PatternProperty> elements = arr.elements();
            for (int i = 0; i < elements.size(); i++) {
                PatternProperty element = elements.get(i);
                if (element == null) {
                    continue;
                }
                if (element instanceof PatDots dots) {
                    throw new TodoConstructException("rest element", dots.dots());
                }
                if (element instanceof PatProp) {
                    throw new TodoConstructException("property in array pattern", arr.lbracket());
                }
                Node index = new LiteralNode(LiteralNode.Kind.INT, String.valueOf(i), fake(String.valueOf(i)));
                Node access = new ArrayAccessNode(source.ref(), fake("["), index);
                bindTo(lowering, env, attr, kindTok, element, access, out);
            }
        } else {
            throw new TodoConstructException("pattern " + pattern.getClass().getSimpleName(), kindTok);
        }
    }

    private static void bindTo(JsToGeneric lowering, ScopeEnv env, KeywordAttribute attr, SourceInfo kindTok,
                               PatternProperty target, Node access, List<Node> out) {
        if (target instanceof PatId id) {
            if (id.defaultValue() != null) {
                throw new TodoConstructException("default value", id.name().info());
            }
            out.add(variable(new IdNode(id.name().name(), id.name().info()), attr, kindTok, access));
        } else if (target instanceof PatNest nest) {
            if (nest.defaultValue() != null) {
                throw new TodoConstructException("default value", kindTok);
            }
            String tempName = lowering.freshTemp();
            SourceInfo tempInfo = fake(tempName);
            out.add(variable(new IdNode(tempName, tempInfo), attr, kindTok, access));
            compilePattern(lowering, env, attr, kindTok,
                    new Source(tempName, tempInfo, ResolvedName.local(tempInfo)), nest.pattern(), out);
        } else {
            throw new TodoConstructException("pattern target " + target.getClass().getSimpleName(), kindTok);
        }
    }

    private static Node propertyAccess(JsToGeneric lowering, ScopeEnv env, Source source, PropertyName key) {
        if (key instanceof PnId id) {
            return new DotAccessNode(source.ref(), fake("."), new IdNode(id.name().name(), id.name().info()));
        }
        if (key instanceof PnString str) {
            Node index = new LiteralNode(LiteralNode.Kind.STRING, str.value().name(), str.value().info());
            return new ArrayAccessNode(source.ref(), fake("["), index);
        }
        if (key instanceof PnNum num) {
            Node index = new LiteralNode(LiteralNode.Kind.INT, num.value().name(), num.value().info());
            return new ArrayAccessNode(source.ref(), fake("["), index);
        }
        PnComputed computed = (PnComputed) key;
        return new ArrayAccessNode(source.ref(), computed.lbracket(), lowering.expr(env, computed.expr()));
    }

    /**
     * Expands {@code for (lhs of collection) body} into the iteration protocol:
     * <pre>
     *   for (let !iterator! = collection[Symbol.iterator](), !step!;
     *        !(!step! = !iterator!.next()).done; ) {
     *     lhs = !step!.value;
     *     body
     *   }
     * </pre>
     * The loop stays a loop, so labels, break and continue keep their meaning.
     */
    public static Node forOf(JsToGeneric lowering, ScopeEnv env, ForOf stmt) {
        SourceInfo ofTok = stmt.ofTok();
        SourceInfo iteratorInfo = fake(ITERATOR);
        SourceInfo stepInfo = fake(STEP);
        ResolvedName iteratorName = ResolvedName.local(iteratorInfo);
        ResolvedName stepName = ResolvedName.local(stepInfo);

        // collection[Symbol.iterator]()
        Node symbolIterator = new DotAccessNode(lowering.identifier(env, new Name("Symbol", fake("Symbol"))),
                fake("."), new IdNode("iterator", fake("iterator")));
        Node getIterator = new CallNode(
                new ArrayAccessNode(lowering.expr(env, stmt.collection()), fake("["), symbolIterator), List.of());
        List<Node> init = new ArrayList<>();
        init.add(variable(new IdNode(ITERATOR, iteratorInfo), KeywordAttribute.LET, fake("let"), getIterator));
        init.add(variable(new IdNode(STEP, stepInfo), KeywordAttribute.LET, fake("let"), null));

        // !(!step! = !iterator!.next()).done
        Node next = new CallNode(new DotAccessNode(resolvedId(ITERATOR, iteratorInfo, iteratorName), fake("."),
                new IdNode("next", fake("next"))), List.of());
        Node assignStep = new AssignNode(resolvedId(STEP, stepInfo, stepName), fake("="), next);
        Node done = new DotAccessNode(assignStep, fake("."), new IdNode("done", fake("done")));
        Node cond = LoweringUtils.operator(Operator.NOT, fake("!"), done);

        ScopeEnv loopEnv = env.withLocal(ITERATOR, iteratorInfo).withLocal(STEP, stepInfo);
        Node stepValue = new DotAccessNode(resolvedId(STEP, stepInfo, stepName), fake("."),
                new IdNode("value", fake("value")));

        List<Node> bindings;
        try {
            bindings = bindLhs(lowering, loopEnv, stmt, stepValue);
        } catch (TodoConstructException e) {
            throw new TodoConstructException("ForOf:" + e.category, e.getInfo(), e);
        }
        ScopeEnv bodyEnv = lowering.bindDefinitions(loopEnv, bindings);
        List<Node> body = new ArrayList<>(bindings);
        body.add(lowering.stmt1(bodyEnv, stmt.body()));
        return new ForNode(stmt.forTok(), init, cond, null, new BlockNode(ofTok, body, fake("}")));
    }

    private static List<Node> bindLhs(JsToGeneric lowering, ScopeEnv env, ForOf stmt, Node stepValue) {
        if (stmt.lhs() instanceof ForLhsExpr lhs) {
            Node target = lowering.expr(env, lhs.expr());
            return List.of(new ExprStmtNode(new AssignNode(target, stmt.ofTok(), stepValue)));
        }
        ForLhsVar lhs = (ForLhsVar) stmt.lhs();
        if (lhs.binding() instanceof VarClassic classic) {
            if (classic.init() != null) {
                throw new TodoConstructException("initializer in loop variable", classic.name().info());
            }
            IdNode name = new IdNode(classic.name().name(), classic.name().info());
            return List.of(variable(name, JsToGeneric.kindAttribute(lhs.kind()), lhs.kindTok(), stepValue));
        }
        VarPattern pattern = (VarPattern) lhs.binding();
        if (pattern.init() != null) {
            throw new TodoConstructException("initializer in loop pattern", lhs.kindTok());
        }
        return varPattern(lowering, env, lhs.kind(), lhs.kindTok(), pattern.pattern(), stepValue, "");
    }

    /**
     * Rewrites a JSX element into {@code React.createElement(tag, props, children...)}.
     * Lower-case tags are intrinsic elements and become strings; other tags are
     * references to components.
     */
    public static Node xml(JsToGeneric lowering, ScopeEnv env, Xml xml) {
        List<Node> args = new ArrayList<>();
        Node react = lowering.identifier(env, new Name("React", fake("React")));
        if (xml.tag() == null) {
            args.add(new DotAccessNode(react, fake("."), new IdNode("Fragment", fake("Fragment"))));
            react = lowering.identifier(env, new Name("React", fake("React")));
        } else if (Character.isLowerCase(xml.tag().name().charAt(0))) {
            args.add(new LiteralNode(LiteralNode.Kind.STRING, xml.tag().name(), xml.tag().info()));
        } else {
            args.add(lowering.identifier(env, xml.tag()));
        }

        if (xml.attrs().isEmpty()) {
            args.add(new LiteralNode(LiteralNode.Kind.NULL, "null", fake("null")));
        } else {
            List<FieldNode> props = new ArrayList<>();
            for (XmlAttr attr : xml.attrs()) {
                props.add(lowering.xmlAttribute(env, attr));
            }
            args.add(new RecordNode(props, props.get(0).getInfo()));
        }

        for (XmlBody child : xml.body()) {
            if (child instanceof XmlText text) {
                args.add(new LiteralNode(LiteralNode.Kind.STRING, text.text().name(), text.text().info()));
            } else if (child instanceof XmlExprBody body) {
                args.add(lowering.expr(env, body.expr()));
            } else {
                args.add(xml(lowering, env, ((XmlChild) child).xml()));
            }
        }
        Node createElement = new DotAccessNode(react, fake("."), new IdNode("createElement", fake("createElement")));
        return new CallNode(createElement, LoweringUtils.args(args));
    }
}
