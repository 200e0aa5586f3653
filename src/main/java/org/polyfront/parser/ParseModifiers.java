package org.polyfront.parser;

import org.polyfront.cst.ScalaCst.Annotation;
import org.polyfront.cst.ScalaCst.Arguments;
import org.polyfront.cst.ScalaCst.Attribute;
import org.polyfront.cst.ScalaCst.Ident;
import org.polyfront.cst.ScalaCst.Modifier;
import org.polyfront.cst.ScalaCst.ModifierKind;
import org.polyfront.cst.ScalaCst.Type;
import org.polyfront.lexer.LexerToken;
import org.polyfront.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Annotations and modifiers in front of a definition. Attributes are returned
 * in the order they were written.
 */
public class ParseModifiers {

    public static List<Attribute> annotationsAndModifiers(ScalaParser parser, boolean skipNewLines) {
        List<Attribute> attrs = new ArrayList<>(annotations(parser, skipNewLines));
        attrs.addAll(modifiers(parser));
        return attrs;
    }

    /**
     * {@code {@ SimpleType {ArgumentExprs} [nl]}}
     */
    public static List<Attribute> annotations(ScalaParser parser, boolean skipNewLines) {
        TokenStream in = parser.in;
        List<Attribute> annotations = new ArrayList<>();
        while (ScalaTokens.isAnnotation(in.token)) {
            LexerToken at = in.accept("@");
            Type type = ParseTypes.simpleType(parser);
            List<Arguments> arguments = new ArrayList<>();
            while (in.is("(")) {
                arguments.add(ParseExpressions.argumentExprs(parser));
            }
            annotations.add(new Annotation(at.info, type, arguments));
            if (skipNewLines) {
                parser.newLineOpt();
            }
        }
        return annotations;
    }

    /**
     * <pre>
     * Modifiers ::= {Modifier}
     * Modifier  ::= LocalModifier | AccessModifier | override
     * </pre>
     * A single NEWLINE between modifiers is skipped.
     */
    public static List<Attribute> modifiers(ScalaParser parser) {
        TokenStream in = parser.in;
        List<Attribute> modifiers = new ArrayList<>();
        while (true) {
            LexerToken t = in.token;
            if (t.type == LexerTokenType.KEYWORD && ScalaTokens.ACCESS_MODIFIERS.contains(t.text)) {
                in.nextToken();
                modifiers.add(new Modifier(modifierKind(t), t.info, accessQualifierOpt(parser)));
            } else if (ScalaTokens.isModifier(t)) {
                in.nextToken();
                modifiers.add(new Modifier(modifierKind(t), t.info, null));
            } else if (t.type == LexerTokenType.NEWLINE) {
                in.nextToken();
            } else {
                return modifiers;
            }
        }
    }

    /**
     * {@code AccessQualifier ::= [ (id | this) ]}
     */
    static Ident accessQualifierOpt(ScalaParser parser) {
        TokenStream in = parser.in;
        if (!in.is("[")) {
            return null;
        }
        in.nextToken();
        Ident qualifier = parser.identOrThis();
        in.accept("]");
        return qualifier;
    }

    static ModifierKind modifierKind(LexerToken t) {
        return switch (t.text) {
            case "abstract" -> ModifierKind.ABSTRACT;
            case "final" -> ModifierKind.FINAL;
            case "sealed" -> ModifierKind.SEALED;
            case "implicit" -> ModifierKind.IMPLICIT;
            case "lazy" -> ModifierKind.LAZY;
            case "private" -> ModifierKind.PRIVATE;
            case "protected" -> ModifierKind.PROTECTED;
            case "override" -> ModifierKind.OVERRIDE;
            default -> throw new IllegalArgumentException("not a modifier: " + t.text);
        };
    }
}
