package com.flagship.cash_session.session.exception;

/**
 * Failure categories of session operations, exposed as {@code code} in API errors.
 */
public enum ErrorKind {
    ALREADY_ACTIVE,
    NOT_FOUND,
    ALREADY_CLOSED,
    NOT_ACTIVE,
    JUSTIFICATION_REQUIRED,
    INVALID_INPUT,
    SESSIONS_DISABLED
}
