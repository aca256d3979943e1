package com.flagship.cash_session.session.exception;

import java.util.UUID;

public class SessionNotActiveException extends PosSessionException {

    public SessionNotActiveException(UUID sessionId) {
        super(ErrorKind.NOT_ACTIVE, "POS session is not active: " + sessionId);
    }

    private SessionNotActiveException(String message) {
        super(ErrorKind.NOT_ACTIVE, message);
    }

    /**
     * The session exists but has no Z ticket yet.
     */
    public static SessionNotActiveException notClosed(UUID sessionId) {
        return new SessionNotActiveException("POS session is still open: " + sessionId);
    }
}
