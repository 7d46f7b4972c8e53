package com.heronix.callgate.exception;

/**
 * Exception thrown when a protocol precondition fails.
 *
 * Every failure aborts the whole invocation; the host unit of work rolls back ledger writes
 * and integration storage.
 */
public class ProtocolException extends RuntimeException {

    private final ProtocolError error;

    public ProtocolException(ProtocolError error) {
        super(error.getDefaultMessage());
        this.error = error;
    }

    public ProtocolException(ProtocolError error, String message) {
        super(message);
        this.error = error;
    }

    public ProtocolException(ProtocolError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public ProtocolError getError() {
        return error;
    }

    public String getCode() {
        return error.name();
    }

    public static void require(boolean condition, ProtocolError error) {
        if (!condition) {
            throw new ProtocolException(error);
        }
    }
}
