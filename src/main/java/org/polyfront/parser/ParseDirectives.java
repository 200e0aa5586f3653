package org.polyfront.parser;

import org.polyfront.cst.ScalaCst.Attribute;
import org.polyfront.cst.ScalaCst.BlockStat;
import org.polyfront.cst.ScalaCst.I;
import org.polyfront.cst.ScalaCst.Ident;
import org.polyfront.cst.ScalaCst.Import;
import org.polyfront.cst.ScalaCst.ImportExpr;
import org.polyfront.cst.ScalaCst.ImportId;
import org.polyfront.cst.ScalaCst.ImportSelector;
import org.polyfront.cst.ScalaCst.ImportSelectors;
import org.polyfront.cst.ScalaCst.ImportSpec;
import org.polyfront.cst.ScalaCst.ImportWildcard;
import org.polyfront.cst.ScalaCst.P;
import org.polyfront.cst.ScalaCst.Package;
import org.polyfront.cst.ScalaCst.Packaging;
import org.polyfront.lexer.LexerToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Packages, imports and the top-level statement sequence.
 */
public class ParseDirectives {

    public static List<BlockStat> topStatSeq(ScalaParser parser) {
        return StatementSequence.statSeq(parser, "class or object definition", ParseDirectives::topStat);
    }

    /**
     * <pre>
     * TopStat ::= {Annotation [nl]} {Modifier} TmplDef
     *           | Import
     *           | Packaging
     *           | PackageObject
     * </pre>
     * Top-level {@code def}, {@code val} and {@code type} are accepted too.
     */
    static List<BlockStat> topStat(ScalaParser parser) {
        TokenStream in = parser.in;
        if (in.is("package")) {
            LexerToken packageTok = in.accept("package");
            if (in.is("object")) {
                return ParseDefinitions.packageObjectDef(parser, packageTok);
            }
            P header = packageHeader(parser, packageTok);
            return List.of(packagingBody(parser, header.pkg()));
        }
        if (in.is("import")) {
            return List.of(new I(importClause(parser)));
        }
        if (ScalaTokens.isAnnotation(in.token) || ScalaTokens.isModifier(in.token)
                || ScalaTokens.isTemplateIntro(in.token) || ScalaTokens.isDefinitionIntro(in.token)) {
            List<Attribute> attrs = ParseModifiers.annotationsAndModifiers(parser, true);
            return ParseDefinitions.defOrTmplDef(parser, attrs);
        }
        return null;
    }

    /**
     * {@code package QualId}, after the {@code package} keyword was accepted.
     */
    static P packageHeader(ScalaParser parser, LexerToken packageTok) {
        List<Ident> name = parser.qualId();
        parser.newLineOptWhenFollowedBy("{");
        return new P(new Package(packageTok.info, name));
    }

    /**
     * {@code { TopStatSeq }} of a {@code package a.b { ... }}.
     */
    static Packaging packagingBody(ScalaParser parser, Package pkg) {
        LexerToken lbrace = parser.in.accept("{");
        List<BlockStat> stats = topStatSeq(parser);
        LexerToken rbrace = parser.in.accept("}");
        return new Packaging(pkg, lbrace.info, stats, rbrace.info);
    }

    /**
     * {@code Import ::= import ImportExpr {, ImportExpr}}
     */
    public static Import importClause(ScalaParser parser) {
        LexerToken importTok = parser.in.accept("import");
        List<ImportExpr> exprs = new ArrayList<>();
        exprs.add(importExpr(parser));
        while (parser.in.is(",")) {
            parser.in.nextToken();
            exprs.add(importExpr(parser));
        }
        return new Import(importTok.info, exprs);
    }

    /**
     * {@code ImportExpr ::= StableId . (id | _ | ImportSelectors)}
     */
    static ImportExpr importExpr(ScalaParser parser) {
        TokenStream in = parser.in;
        List<Ident> path = new ArrayList<>();
        Ident last = parser.identOrThis();
        while (in.is(".")) {
            in.nextToken();
            path.add(last);
            if (in.is("_")) {
                ImportSpec wildcard = new ImportWildcard(in.accept("_").info);
                return new ImportExpr(path, wildcard);
            }
            if (in.is("{")) {
                return new ImportExpr(path, importSelectors(parser));
            }
            last = parser.ident();
        }
        return new ImportExpr(path, new ImportId(last));
    }

    static ImportSelectors importSelectors(ScalaParser parser) {
        TokenStream in = parser.in;
        LexerToken lbrace = in.accept("{");
        List<ImportSelector> selectors = new ArrayList<>();
        selectors.add(importSelector(parser));
        while (in.is(",")) {
            in.nextToken();
            selectors.add(importSelector(parser));
        }
        LexerToken rbrace = in.accept("}");
        return new ImportSelectors(lbrace.info, selectors, rbrace.info);
    }

    static ImportSelector importSelector(ScalaParser parser) {
        TokenStream in = parser.in;
        Ident name = wildcardOrIdent(parser);
        if (!in.is("=>")) {
            return new ImportSelector(name, null, null);
        }
        LexerToken arrow = in.accept("=>");
        return new ImportSelector(name, arrow.info, wildcardOrIdent(parser));
    }

    private static Ident wildcardOrIdent(ScalaParser parser) {
        if (parser.in.is("_")) {
            LexerToken underscore = parser.in.accept("_");
            return new Ident(underscore.text, underscore.info);
        }
        return parser.ident();
    }
}
