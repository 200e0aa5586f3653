package org.polyfront.parser;

import org.polyfront.cst.ScalaCst.Arguments;
import org.polyfront.cst.ScalaCst.Attribute;
import org.polyfront.cst.ScalaCst.Binding;
import org.polyfront.cst.ScalaCst.BlockStat;
import org.polyfront.cst.ScalaCst.D;
import org.polyfront.cst.ScalaCst.DefEnt;
import org.polyfront.cst.ScalaCst.E;
import org.polyfront.cst.ScalaCst.Entity;
import org.polyfront.cst.ScalaCst.Expr;
import org.polyfront.cst.ScalaCst.FuncDef;
import org.polyfront.cst.ScalaCst.FunctionKind;
import org.polyfront.cst.ScalaCst.I;
import org.polyfront.cst.ScalaCst.Ident;
import org.polyfront.cst.ScalaCst.Modifier;
import org.polyfront.cst.ScalaCst.ModifierKind;
import org.polyfront.cst.ScalaCst.Template;
import org.polyfront.cst.ScalaCst.TemplateKind;
import org.polyfront.cst.ScalaCst.Type;
import org.polyfront.cst.ScalaCst.TypeDef;
import org.polyfront.cst.ScalaCst.VarDef;
import org.polyfront.cst.ScalaCst.VariableKind;
import org.polyfront.lexer.LexerToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Definitions and declarations: templates ({@code class}, {@code trait},
 * {@code object}), functions, values, variables and type aliases, and the
 * statements of template bodies and blocks.
 */
public class ParseDefinitions {

    /**
     * {@code package object id ClassTemplateOpt}, after {@code package} was accepted.
     */
    static List<BlockStat> packageObjectDef(ScalaParser parser, LexerToken packageTok) {
        List<Attribute> attrs = new ArrayList<>();
        attrs.add(new Modifier(ModifierKind.PACKAGE_OBJECT, packageTok.info, null));
        return List.of(new D(templateDef(parser, attrs)));
    }

    /**
     * Dispatches on the keyword after the attributes.
     */
    static List<BlockStat> defOrTmplDef(ScalaParser parser, List<Attribute> attrs) {
        if (ScalaTokens.isDefinitionIntro(parser.in.token)) {
            return List.of(new D(defOrDcl(parser, attrs)));
        }
        return List.of(new D(tmplDef(parser, attrs)));
    }

    /**
     * <pre>
     * TmplDef ::= [case] class ClassDef
     *           | [case] object ObjectDef
     *           | trait TraitDef
     * </pre>
     */
    static DefEnt tmplDef(ScalaParser parser, List<Attribute> attrs) {
        TokenStream in = parser.in;
        if (in.is("case")) {
            LexerToken caseTok = in.token;
            LexerToken next = in.peekNext();
            if (!TokenStream.isText(next, "class") && !TokenStream.isText(next, "object")) {
                throw parser.todo("case clause");
            }
            in.nextToken();
            attrs = new ArrayList<>(attrs);
            attrs.add(new Modifier(ModifierKind.CASE_CLASS_OR_OBJECT, caseTok.info, null));
        }
        if (in.is("class") || in.is("trait") || in.is("object")) {
            return templateDef(parser, attrs);
        }
        throw in.error("start of definition");
    }

    static DefEnt templateDef(ScalaParser parser, List<Attribute> attrs) {
        TokenStream in = parser.in;
        LexerToken kindTok = in.token;
        TemplateKind kind = switch (kindTok.text) {
            case "class" -> TemplateKind.CLASS;
            case "trait" -> TemplateKind.TRAIT;
            case "object" -> TemplateKind.OBJECT;
            default -> throw in.error("class, trait or object");
        };
        in.nextToken();
        Ident name = parser.ident();
        List<Ident> typeParams = typeParamClauseOpt(parser);
        List<List<Binding>> classParams = new ArrayList<>();
        if (kind == TemplateKind.CLASS) {
            if (ScalaTokens.isModifier(in.token)) {
                throw parser.todo("constructor modifier");
            }
            classParams = paramClauses(parser);
        }

        List<Type> parents = new ArrayList<>();
        List<Arguments> parentArgs = new ArrayList<>();
        if (in.is("extends")) {
            in.nextToken();
            if (!in.is("{")) {
                parents.add(ParseTypes.annotType(parser));
                while (in.is("(")) {
                    parentArgs.add(ParseExpressions.argumentExprs(parser));
                }
                while (in.is("with")) {
                    in.nextToken();
                    parents.add(ParseTypes.annotType(parser));
                }
            }
        }
        parser.newLineOptWhenFollowedBy("{");
        List<BlockStat> body = in.is("{") ? templateBody(parser) : null;
        Template template = new Template(kind, kindTok.info, classParams, parents, parentArgs, body);
        return new DefEnt(new Entity(name, attrs, typeParams), template);
    }

    static List<BlockStat> templateBody(ScalaParser parser) {
        parser.in.accept("{");
        if (parser.in.is("=>")) {
            throw parser.todo("self type");
        }
        List<BlockStat> stats = templateStatSeq(parser);
        parser.in.accept("}");
        return stats;
    }

    public static List<BlockStat> templateStatSeq(ScalaParser parser) {
        return StatementSequence.statSeq(parser, "start of definition", ParseDefinitions::templateStat);
    }

    /**
     * <pre>
     * TemplateStat ::= Import
     *                | {Annotation [nl]} {Modifier} Def
     *                | {Annotation [nl]} {Modifier} Dcl
     *                | Expr
     * </pre>
     * Blocks use the same productions; a local definition only differs in the
     * modifiers it may carry, which are not checked.
     */
    static List<BlockStat> templateStat(ScalaParser parser) {
        TokenStream in = parser.in;
        if (in.is("import")) {
            return List.of(new I(ParseDirectives.importClause(parser)));
        }
        if (ScalaTokens.isAnnotation(in.token) || ScalaTokens.isModifier(in.token)
                || ScalaTokens.isTemplateIntro(in.token) || ScalaTokens.isDefinitionIntro(in.token)) {
            List<Attribute> attrs = ParseModifiers.annotationsAndModifiers(parser, true);
            return defOrTmplDef(parser, attrs);
        }
        if (ParseExpressions.isExprIntro(in.token)) {
            Expr e = ParseExpressions.expr(parser);
            return List.of(new E(e));
        }
        return null;
    }

    /**
     * {@code val}, {@code var}, {@code def} or {@code type}.
     */
    static DefEnt defOrDcl(ScalaParser parser, List<Attribute> attrs) {
        TokenStream in = parser.in;
        return switch (in.token.text) {
            case "val", "var" -> patDefOrDcl(parser, attrs);
            case "def" -> funDefOrDcl(parser, attrs);
            case "type" -> typeDefOrDcl(parser, attrs);
            default -> throw in.error("definition");
        };
    }

    /**
     * {@code (val | var) id [: Type] [= Expr]}. Patterns and multiple names
     * are not supported.
     */
    static DefEnt patDefOrDcl(ScalaParser parser, List<Attribute> attrs) {
        TokenStream in = parser.in;
        LexerToken kindTok = in.token;
        VariableKind kind = kindTok.text.equals("val") ? VariableKind.VAL : VariableKind.VAR;
        in.nextToken();
        if (!ScalaTokens.isIdent(in.token)) {
            throw parser.todo("pattern definition");
        }
        Ident name = parser.ident();
        if (in.is(",")) {
            throw parser.todo("multiple names in " + kindTok.text);
        }
        Type type = null;
        if (in.is(":")) {
            in.nextToken();
            type = ParseTypes.type(parser);
        }
        Expr body = null;
        if (in.is("=")) {
            in.nextToken();
            body = ParseExpressions.expr(parser);
        }
        VarDef def = new VarDef(kind, kindTok.info, type, body);
        return new DefEnt(new Entity(name, attrs, List.of()), def);
    }

    /**
     * <pre>
     * FunDef ::= def id [TypeParamClause] ParamClauses [: Type] = Expr
     *          | def id [TypeParamClause] ParamClauses [nl] { Block }
     * </pre>
     * Without {@code =} and block this is a declaration.
     */
    static DefEnt funDefOrDcl(ScalaParser parser, List<Attribute> attrs) {
        TokenStream in = parser.in;
        LexerToken kindTok = in.accept("def");
        if (in.is("this")) {
            throw parser.todo("auxiliary constructor");
        }
        Ident name = parser.ident();
        List<Ident> typeParams = typeParamClauseOpt(parser);
        List<List<Binding>> params = paramClauses(parser);
        Type returnType = null;
        if (in.is(":")) {
            in.nextToken();
            returnType = ParseTypes.type(parser);
        }
        Expr body = null;
        if (in.is("=")) {
            in.nextToken();
            body = ParseExpressions.expr(parser);
        } else {
            parser.newLineOptWhenFollowedBy("{");
            if (in.is("{")) {
                body = ParseExpressions.blockExpr(parser);
            }
        }
        FuncDef def = new FuncDef(FunctionKind.DEF, kindTok.info, params, returnType, body);
        return new DefEnt(new Entity(name, attrs, typeParams), def);
    }

    /**
     * {@code type id [TypeParamClause] = Type}
     */
    static DefEnt typeDefOrDcl(ScalaParser parser, List<Attribute> attrs) {
        TokenStream in = parser.in;
        LexerToken typeTok = in.accept("type");
        Ident name = parser.ident();
        List<Ident> typeParams = typeParamClauseOpt(parser);
        if (!in.is("=")) {
            throw parser.todo("abstract type");
        }
        in.nextToken();
        TypeDef def = new TypeDef(typeTok.info, ParseTypes.type(parser));
        return new DefEnt(new Entity(name, attrs, typeParams), def);
    }

    /**
     * {@code [ id {, id} ]}. Variance annotations and bounds are not supported.
     */
    static List<Ident> typeParamClauseOpt(ScalaParser parser) {
        TokenStream in = parser.in;
        List<Ident> typeParams = new ArrayList<>();
        if (!in.is("[")) {
            return typeParams;
        }
        in.nextToken();
        while (true) {
            if (in.is("+") || in.is("-")) {
                throw parser.todo("variance annotation");
            }
            typeParams.add(parser.ident());
            if (in.is("<:") || in.is(">:") || in.is("<%") || in.is(":") || in.is("[")) {
                throw parser.todo("type parameter bound");
            }
            if (!in.is(",")) {
                break;
            }
            in.nextToken();
        }
        in.accept("]");
        return typeParams;
    }

    /**
     * {@code {( [implicit] Param {, Param} )}}
     */
    static List<List<Binding>> paramClauses(ScalaParser parser) {
        TokenStream in = parser.in;
        List<List<Binding>> clauses = new ArrayList<>();
        while (in.is("(")) {
            in.nextToken();
            List<Binding> clause = new ArrayList<>();
            LexerToken implicitTok = null;
            if (in.is("implicit")) {
                implicitTok = in.accept("implicit");
            }
            if (!in.is(")")) {
                clause.add(param(parser, implicitTok));
                while (in.is(",")) {
                    in.nextToken();
                    clause.add(param(parser, implicitTok));
                }
            }
            in.accept(")");
            clauses.add(clause);
        }
        return clauses;
    }

    /**
     * {@code id : Type}. By-name, repeated and defaulted parameters are not supported.
     */
    static Binding param(ScalaParser parser, LexerToken implicitTok) {
        TokenStream in = parser.in;
        if (ScalaTokens.isAnnotation(in.token) || ScalaTokens.isModifier(in.token)
                || in.is("val") || in.is("var")) {
            throw parser.todo("class parameter modifier");
        }
        Ident name = parser.ident();
        Type type = null;
        if (in.is(":")) {
            in.nextToken();
            if (in.is("=>")) {
                throw parser.todo("by-name parameter");
            }
            type = ParseTypes.type(parser);
            if (in.is("*")) {
                throw parser.todo("repeated parameter");
            }
        }
        if (in.is("=")) {
            throw parser.todo("default argument");
        }
        return new Binding(name, type, implicitTok == null ? null : implicitTok.info);
    }
}
