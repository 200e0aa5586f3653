package org.polyfront.runtime;

import org.polyfront.lexer.SourceInfo;

import java.io.Serial;

/**
 * A construct that is recognized but not supported yet. The category is a
 * free-text diagnostic such as "ForOf:..." or "with".
 */
public class TodoConstructException extends FrontendException {
    @Serial
    private static final long serialVersionUID = 1L;

    public final String category;

    public TodoConstructException(String category, SourceInfo info) {
        super("TODO construct: " + category, info);
        this.category = category;
    }

    public TodoConstructException(String category, SourceInfo info, Throwable cause) {
        super("TODO construct: " + category, info, cause);
        this.category = category;
    }
}
