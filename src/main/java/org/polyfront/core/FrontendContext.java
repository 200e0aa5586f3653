package org.polyfront.core;

import org.polyfront.runtime.ErrorMessageUtil;

/**
 * The FrontendContext holds what one compilation unit needs while it is parsed
 * and lowered: a private copy of the options, the error message formatter and
 * the debug output.
 * <p>
 * A context is never shared between units.
 */
public class FrontendContext {
    /**
     * Read-only copy of the options the run was started with.
     */
    public final FrontendOptions options;
    /**
     * Formats messages with the tokens around a failure; null when no token list exists.
     */
    public final ErrorMessageUtil errorUtil;

    public FrontendContext(FrontendOptions options, ErrorMessageUtil errorUtil) {
        this.options = options.clone();
        this.errorUtil = errorUtil;
    }

    public String fileName() {
        return options.fileName == null ? "-" : options.fileName;
    }

    public void logDebug(String message) {
        if (options.debugEnabled) {
            System.out.println(message);
        }
    }

    public void traceToken(String message) {
        if (options.traceTokens) {
            System.out.println("token: " + message);
        }
    }

    @Override
    public String toString() {
        return "FrontendContext{fileName=" + fileName() + ", options=" + options + "}";
    }
}
