package org.polyfront.parser;

import org.polyfront.core.FrontendContext;
import org.polyfront.core.FrontendOptions;
import org.polyfront.cst.ScalaCst.Program;
import org.polyfront.lexer.Lexer;
import org.polyfront.lexer.LexerToken;
import org.polyfront.lexer.LexerTokenType;
import org.polyfront.runtime.ErrorMessageUtil;
import org.polyfront.runtime.FrontendException;
import org.polyfront.runtime.ParseError;
import org.polyfront.runtime.TodoConstructException;
import org.polyfront.runtime.UnexpectedTokenException;

import java.util.List;

/**
 * Entry point for parsing one Scala-family unit with unit-granular error recovery.
 * <p>
 * Without recovery a grammar violation is raised as a {@link ParseError}. With
 * recovery the unit is abandoned: the result holds an empty program and the
 * {@link ParseStat} records the failure and counts every line of the unit as failed.
 * A fresh parser and cursor are created for every call.
 */
public class ParseDriver {

    public static ParseResult<Program> parse(String fileName, String code, FrontendOptions options) {
        List<LexerToken> tokens = new Lexer(fileName, code).tokenize();
        return parse(fileName, tokens, options);
    }

    public static ParseResult<Program> parse(String fileName, List<LexerToken> tokens, FrontendOptions options) {
        FrontendOptions unitOptions = options.clone();
        unitOptions.fileName = fileName;
        FrontendContext ctx = new FrontendContext(unitOptions, new ErrorMessageUtil(fileName, tokens));
        ParseStat stat = new ParseStat(fileName, countLines(tokens));
        try {
            Program program = new ScalaParser(tokens, ctx).parse();
            return new ParseResult<>(program, tokens, stat);
        } catch (UnexpectedTokenException | TodoConstructException e) {
            return recover(ctx, tokens, stat, e);
        }
    }

    private static ParseResult<Program> recover(FrontendContext ctx, List<LexerToken> tokens, ParseStat stat,
                                                FrontendException e) {
        if (!ctx.options.errorRecovery) {
            throw new ParseError(ctx.fileName(), e.getInfo(), e);
        }
        if (ctx.options.showParsingError) {
            System.err.println("parse error: " + e.getMessage());
        }
        stat.recordFailure(e.getInfo(), e.getRawMessage());
        ctx.logDebug("recovered from parse failure in " + ctx.fileName() + ", " + stat.errorLineCount + " lines lost");
        LexerToken eof = tokens.get(tokens.size() - 1);
        return new ParseResult<>(new Program(List.of(), eof.info), tokens, stat);
    }

    /**
     * Counts source lines: a trailing line break does not start a new line, an
     * empty unit has none.
     */
    static int countLines(List<LexerToken> tokens) {
        if (tokens.size() <= 1) {
            return 0;
        }
        LexerToken eof = tokens.get(tokens.size() - 1);
        LexerToken last = tokens.get(tokens.size() - 2);
        return last.type == LexerTokenType.NEWLINE ? eof.info.line - 1 : eof.info.line;
    }
}
