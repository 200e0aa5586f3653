package org.polyfront.runtime;

import org.polyfront.lexer.SourceInfo;

import java.io.Serial;

/**
 * FrontendException is the base class of every condition raised while parsing
 * or lowering a compilation unit. It extends RuntimeException and provides
 * detailed error messages that include the file name, line and column.
 */
public class FrontendException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    // Where the error happened; may be a fake info for synthesized nodes
    private final SourceInfo info;
    // Detailed error message that includes additional context about the error
    private final String errorMessage;

    public FrontendException(String message, SourceInfo info) {
        super(message);
        this.info = info;
        this.errorMessage = message + " at " + describe(info);
    }

    public FrontendException(String message, SourceInfo info, Throwable cause) {
        super(message, cause);
        this.info = info;
        this.errorMessage = message + " at " + describe(info);
    }

    /**
     * Constructs an exception whose message is formatted with the token context
     * known to an {@link ErrorMessageUtil}.
     */
    public FrontendException(String message, SourceInfo info, ErrorMessageUtil errorUtil) {
        super(message);
        this.info = info;
        this.errorMessage = errorUtil == null ? message + " at " + describe(info) : errorUtil.errorMessage(info, message);
    }

    private static String describe(SourceInfo info) {
        return info == null ? "unknown position" : info.location();
    }

    public SourceInfo getInfo() {
        return info;
    }

    /**
     * Returns the message without position decoration.
     */
    public String getRawMessage() {
        return super.getMessage();
    }

    /**
     * Returns the detailed error message.
     *
     * @return the detailed error message
     */
    @Override
    public String getMessage() {
        return errorMessage;
    }
}
