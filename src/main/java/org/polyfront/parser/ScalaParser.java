package org.polyfront.parser;

import org.polyfront.core.FrontendContext;
import org.polyfront.cst.ScalaCst.BlockStat;
import org.polyfront.cst.ScalaCst.Ident;
import org.polyfront.cst.ScalaCst.Program;
import org.polyfront.lexer.LexerToken;
import org.polyfront.lexer.LexerTokenType;
import org.polyfront.runtime.TodoConstructException;

import java.util.ArrayList;
import java.util.List;

/**
 * The ScalaParser turns the token list of one Scala-family compilation unit into
 * a {@link Program}.
 * <p>
 * The parser is a hand-written recursive descent over a {@link TokenStream} with
 * one token of lookahead. The productions live in static helper classes that take
 * the parser as first argument ({@link StatementSequence}, {@link ParseDirectives},
 * {@link ParseModifiers}, {@link ParseDefinitions}, {@link ParseTypes} and
 * {@link ParseExpressions}); this class keeps the cursor, the name productions
 * and the compilation unit entry point.
 * <p>
 * Any grammar violation raises an UnexpectedTokenException; constructs outside
 * the supported subset raise a TodoConstructException. Neither is caught here:
 * {@link ParseDriver} decides about recovery.
 */
public class ScalaParser {
    public final TokenStream in;
    public final FrontendContext ctx;

    public ScalaParser(List<LexerToken> tokens, FrontendContext ctx) {
        this.ctx = ctx;
        this.in = new TokenStream(tokens, ScalaTokens.NEWLINE_POLICY, ctx);
    }

    /**
     * Parses the whole unit. The unit must be consumed up to EOF.
     */
    public Program parse() {
        List<BlockStat> stats = compilationUnit();
        LexerToken eof = in.acceptEof();
        ctx.logDebug("parsed " + stats.size() + " top-level statements in " + ctx.fileName());
        return new Program(stats, eof.info);
    }

    /**
     * <pre>
     * CompilationUnit ::= {package QualId semi} TopStatSeq
     * </pre>
     */
    List<BlockStat> compilationUnit() {
        List<BlockStat> stats = new ArrayList<>();
        while (in.is(";")) {
            in.nextToken();
        }
        if (!in.is("package")) {
            stats.addAll(ParseDirectives.topStatSeq(this));
            return stats;
        }
        LexerToken packageTok = in.accept("package");
        if (in.is("object")) {
            stats.addAll(ParseDefinitions.packageObjectDef(this, packageTok));
            if (!in.isEof()) {
                StatementSequence.acceptStatSep(this);
                stats.addAll(ParseDirectives.topStatSeq(this));
            }
            return stats;
        }
        var pkg = ParseDirectives.packageHeader(this, packageTok);
        if (in.isEof()) {
            stats.add(pkg);
        } else if (ScalaTokens.isStatSep(in.token)) {
            in.nextToken();
            stats.add(pkg);
            stats.addAll(compilationUnit());
        } else {
            stats.add(ParseDirectives.packagingBody(this, pkg.pkg()));
            StatementSequence.acceptStatSepOpt(this);
            stats.addAll(ParseDirectives.topStatSeq(this));
        }
        return stats;
    }

    // ------------------------------------------------------------------
    // Names
    // ------------------------------------------------------------------

    /**
     * Accepts a plain, back-quoted or operator identifier.
     */
    public Ident ident() {
        if (!ScalaTokens.isIdent(in.token)) {
            throw in.error("identifier");
        }
        LexerToken t = in.token;
        in.nextToken();
        return new Ident(t.text, t.info);
    }

    /**
     * Accepts an identifier, or {@code this} where a path may start with it.
     */
    public Ident identOrThis() {
        if (in.is("this") || in.is("super")) {
            LexerToken t = in.token;
            in.nextToken();
            return new Ident(t.text, t.info);
        }
        return ident();
    }

    /**
     * {@code QualId ::= id {. id}}
     */
    public List<Ident> qualId() {
        List<Ident> path = new ArrayList<>();
        path.add(ident());
        while (in.is(".")) {
            in.nextToken();
            path.add(ident());
        }
        return path;
    }

    // ------------------------------------------------------------------
    // Newlines
    // ------------------------------------------------------------------

    /**
     * Skips one NEWLINE (not a blank line).
     */
    public void newLineOpt() {
        if (in.is(LexerTokenType.NEWLINE)) {
            in.nextToken();
        }
    }

    public void newLinesOpt() {
        if (in.token.isLayout()) {
            in.nextToken();
        }
    }

    /**
     * Skips a NEWLINE only when the token after it is the given one, as in
     * {@code class A\n{ ... }}.
     */
    public void newLineOptWhenFollowedBy(String text) {
        if (in.is(LexerTokenType.NEWLINE) && TokenStream.isText(in.peekNext(), text)) {
            in.nextToken();
        }
    }

    public TodoConstructException todo(String category) {
        return new TodoConstructException(category, in.token.info);
    }
}
