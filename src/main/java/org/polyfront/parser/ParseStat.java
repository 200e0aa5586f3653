package org.polyfront.parser;

import org.polyfront.lexer.SourceInfo;

/**
 * Parse coverage of one compilation unit. A unit that failed to parse counts
 * all of its lines as failed.
 */
public class ParseStat {
    public final String fileName;
    public final int totalLineCount;
    public int errorLineCount = 0;
    // Position and message of the failure, null while the unit parsed cleanly
    public SourceInfo failureInfo;
    public String failureMessage;

    public ParseStat(String fileName, int totalLineCount) {
        this.fileName = fileName;
        this.totalLineCount = totalLineCount;
    }

    public void recordFailure(SourceInfo info, String message) {
        this.errorLineCount = totalLineCount;
        this.failureInfo = info;
        this.failureMessage = message;
    }

    public boolean hasFailed() {
        return failureMessage != null;
    }

    @Override
    public String toString() {
        return "ParseStat{" + fileName + ", lines=" + totalLineCount + ", errorLines=" + errorLineCount
                + (hasFailed() ? ", failure=" + failureMessage + " at " + failureInfo.location() : "") + "}";
    }
}
