package com.mathclip.table;

/**
 * Signals a malformed command table resource or file.
 */
public class CommandTableException extends IllegalStateException {

    public CommandTableException(String message) {
        super(message);
    }

    public CommandTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
