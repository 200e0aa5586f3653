package org.polyfront.runtime;

import org.polyfront.lexer.SourceInfo;

import java.io.Serial;

/**
 * A construct that lowering refuses to map because it is not meaningful in the
 * place it appears (a statement exported as a declaration, a TypeScript-only
 * declaration, ...). Stops the lowering of the unit.
 */
public class UnhandledConstructException extends FrontendException {
    @Serial
    private static final long serialVersionUID = 1L;

    public final String category;

    public UnhandledConstructException(String category, SourceInfo info) {
        super("Unhandled construct: " + category, info);
        this.category = category;
    }
}
