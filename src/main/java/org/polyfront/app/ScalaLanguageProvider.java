package org.polyfront.app;

import org.polyfront.astnode.ProgramNode;
import org.polyfront.core.FrontendContext;
import org.polyfront.core.FrontendOptions;
import org.polyfront.cst.ScalaCst.Program;
import org.polyfront.lexer.Lexer;
import org.polyfront.lexer.LexerToken;
import org.polyfront.lowering.ScalaToGeneric;
import org.polyfront.parser.ParseDriver;
import org.polyfront.parser.ParseResult;
import org.polyfront.runtime.ErrorMessageUtil;

import java.util.List;

/**
 * Runs the Scala-family pipeline on one unit: tokenize, parse, lower.
 * <p>
 * The unit comes from {@code options.code} and {@code options.fileName}. When
 * recovery is enabled and the unit does not parse, the lowered program is
 * empty and the returned {@link org.polyfront.parser.ParseStat} holds the
 * failure. Lowering conditions ({@code TodoConstructException},
 * {@code UnhandledConstructException}) are not caught here.
 */
public class ScalaLanguageProvider {

    public static ParseResult<ProgramNode> compile(FrontendOptions options) {
        FrontendOptions unitOptions = options.clone();
        String fileName = unitOptions.fileName == null ? "-" : unitOptions.fileName;
        unitOptions.fileName = fileName;

        List<LexerToken> tokens = new Lexer(fileName, unitOptions.code).tokenize();
        FrontendContext ctx = new FrontendContext(unitOptions, new ErrorMessageUtil(fileName, tokens));
        ctx.logDebug("parse code: " + fileName + ", " + tokens.size() + " tokens");

        ParseResult<Program> parsed = ParseDriver.parse(fileName, tokens, unitOptions);
        ProgramNode program = new ScalaToGeneric(ctx).program(parsed.ast());
        if (unitOptions.debugEnabled) {
            ctx.logDebug(program.toString());
        }
        return new ParseResult<>(program, tokens, parsed.stat());
    }
}
