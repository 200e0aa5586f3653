package org.polyfront.app;

import org.polyfront.astnode.ProgramNode;
import org.polyfront.core.FrontendOptions;
import org.polyfront.parser.ParseResult;
import org.polyfront.parser.ParseStat;
import org.polyfront.runtime.FrontendException;
import org.polyfront.runtime.TodoConstructException;
import org.polyfront.runtime.UnhandledConstructException;

import java.util.List;

/**
 * Parses and lowers a list of units and reports coverage.
 * <p>
 * Each unit gets a fresh parser, cursor and scope state. A unit whose lowering
 * raises a TODO or unhandled construct is marked failed and the batch goes on.
 * With recovery enabled a parse failure is recorded the same way; without it
 * the {@link org.polyfront.runtime.ParseError} ends the run.
 */
public class BatchRunner {

    public static BatchReport run(List<SourceUnit> units, FrontendOptions options) {
        BatchReport report = new BatchReport();
        for (SourceUnit unit : units) {
            report.add(runUnit(unit, options));
        }
        return report;
    }

    static BatchReport.UnitReport runUnit(SourceUnit unit, FrontendOptions options) {
        FrontendOptions unitOptions = options.clone();
        unitOptions.fileName = unit.fileName();
        unitOptions.code = unit.code();
        try {
            ParseResult<ProgramNode> result = ScalaLanguageProvider.compile(unitOptions);
            ParseStat stat = result.stat();
            int totalLines = stat.totalLineCount;
            if (stat.hasFailed()) {
                return new BatchReport.UnitReport(unit.fileName(), totalLines, stat.errorLineCount,
                        "ParseError", stat.failureMessage, stat.failureInfo);
            }
            return new BatchReport.UnitReport(unit.fileName(), totalLines, 0, null, null, null);
        } catch (TodoConstructException | UnhandledConstructException e) {
            return failed(unit, e, countLines(unit.code()));
        }
    }

    private static BatchReport.UnitReport failed(SourceUnit unit, FrontendException e, int totalLines) {
        String kind = e instanceof TodoConstructException ? "TodoConstruct" : "UnhandledConstruct";
        return new BatchReport.UnitReport(unit.fileName(), totalLines, totalLines, kind, e.getRawMessage(),
                e.getInfo());
    }

    /**
     * Lines of a source text; a trailing line break does not start a new line.
     */
    static int countLines(String code) {
        if (code == null || code.isEmpty()) {
            return 0;
        }
        int lines = 1;
        for (int i = 0; i < code.length(); i++) {
            if (code.charAt(i) == '\n' && i < code.length() - 1) {
                lines++;
            }
        }
        return lines;
    }
}
