package org.polyfront.parser;

import org.polyfront.cst.ScalaCst.BlockStat;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Statement sequences and their separators.
 * <p>
 * A separator is a NEWLINE, a NEWLINES or a {@code ;}. A sequence ends at
 * {@code }} or EOF, and the separator before the end may be left out.
 */
public class StatementSequence {

    /**
     * Parses statements until the end of the sequence.
     *
     * @param parser   the parser
     * @param errorMsg what the parser expected when a statement does not start
     * @param stat     parses one statement; returns null when no statement starts at the current token
     * @return the statements in source order
     */
    public static List<BlockStat> statSeq(ScalaParser parser, String errorMsg,
                                          Function<ScalaParser, List<BlockStat>> stat) {
        List<BlockStat> stats = new ArrayList<>();
        while (!ScalaTokens.isStatSeqEnd(parser.in.token)) {
            List<BlockStat> parsed = stat.apply(parser);
            if (parsed != null) {
                stats.addAll(parsed);
            } else if (!ScalaTokens.isStatSep(parser.in.token)) {
                throw parser.in.error(errorMsg);
            }
            acceptStatSepOpt(parser);
        }
        return stats;
    }

    public static void acceptStatSep(ScalaParser parser) {
        if (parser.in.token.isLayout()) {
            parser.in.nextToken();
        } else {
            parser.in.accept(";");
        }
    }

    public static void acceptStatSepOpt(ScalaParser parser) {
        if (!ScalaTokens.isStatSeqEnd(parser.in.token)) {
            acceptStatSep(parser);
        }
    }
}
