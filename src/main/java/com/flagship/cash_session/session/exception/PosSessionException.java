package com.flagship.cash_session.session.exception;

/**
 * Base class of every rejected session operation. A rejected operation has
 * written nothing.
 */
public abstract class PosSessionException extends RuntimeException {

    private final ErrorKind kind;

    protected PosSessionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PosSessionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
