package org.polyfront.parser;

import org.polyfront.cst.ScalaCst.Ident;
import org.polyfront.cst.ScalaCst.TyApp;
import org.polyfront.cst.ScalaCst.TyFunction;
import org.polyfront.cst.ScalaCst.TyName;
import org.polyfront.cst.ScalaCst.TyTuple;
import org.polyfront.cst.ScalaCst.Type;
import org.polyfront.lexer.LexerToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Types: paths, applied types, tuples and function types.
 * Existential, compound, infix and projection types are reported as TODO.
 */
public class ParseTypes {

    /**
     * <pre>
     * Type ::= FunctionArgTypes => Type
     *        | SimpleType
     * </pre>
     */
    public static Type type(ScalaParser parser) {
        TokenStream in = parser.in;
        Type t;
        if (in.is("(")) {
            LexerToken lparen = in.accept("(");
            List<Type> types = in.is(")") ? new ArrayList<>() : types(parser);
            LexerToken rparen = in.accept(")");
            if (in.is("=>")) {
                LexerToken arrow = in.accept("=>");
                return new TyFunction(types, arrow.info, type(parser));
            }
            t = new TyTuple(lparen.info, types, rparen.info);
        } else {
            t = simpleType(parser);
        }
        if (in.is("=>")) {
            LexerToken arrow = in.accept("=>");
            return new TyFunction(List.of(t), arrow.info, type(parser));
        }
        if (in.is("with") || in.is("forSome")) {
            throw parser.todo("compound type");
        }
        return t;
    }

    public static List<Type> types(ScalaParser parser) {
        List<Type> types = new ArrayList<>();
        types.add(type(parser));
        while (parser.in.is(",")) {
            parser.in.nextToken();
            types.add(type(parser));
        }
        return types;
    }

    /**
     * {@code SimpleType ::= StableId {TypeArgs}}
     */
    public static Type simpleType(ScalaParser parser) {
        TokenStream in = parser.in;
        if (in.is("_")) {
            throw parser.todo("wildcard type");
        }
        List<Ident> path = new ArrayList<>();
        path.add(parser.identOrThis());
        while (in.is(".")) {
            in.nextToken();
            if (in.is("type")) {
                throw parser.todo("singleton type");
            }
            path.add(parser.ident());
        }
        Type t = new TyName(path);
        while (in.is("[")) {
            LexerToken lbracket = in.accept("[");
            List<Type> args = types(parser);
            LexerToken rbracket = in.accept("]");
            t = new TyApp(t, lbracket.info, args, rbracket.info);
        }
        if (in.is("#")) {
            throw parser.todo("type projection");
        }
        return t;
    }

    /**
     * Same as {@link #type} where only a simple type can appear, as for parents
     * of a template.
     */
    public static Type annotType(ScalaParser parser) {
        return simpleType(parser);
    }
}
