package com.flagship.cash_session.session.exception;

import java.util.UUID;

public class SessionAlreadyClosedException extends PosSessionException {

    public SessionAlreadyClosedException(UUID sessionId) {
        super(ErrorKind.ALREADY_CLOSED, "POS session is already closed: " + sessionId);
    }

    public SessionAlreadyClosedException(UUID sessionId, Throwable cause) {
        super(ErrorKind.ALREADY_CLOSED, "POS session is already closed: " + sessionId, cause);
    }
}
