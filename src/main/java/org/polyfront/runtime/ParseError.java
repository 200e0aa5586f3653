package org.polyfront.runtime;

import org.polyfront.lexer.SourceInfo;

import java.io.Serial;

/**
 * Fatal parse failure of a whole compilation unit, raised when error recovery
 * is disabled. The grammar violation that caused it is kept as the cause.
 */
public class ParseError extends FrontendException {
    @Serial
    private static final long serialVersionUID = 1L;

    public ParseError(String fileName, SourceInfo info, FrontendException cause) {
        super("Parse error in " + fileName + ": " + cause.getRawMessage(), info, cause);
    }
}
