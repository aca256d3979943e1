package com.flagship.cash_session.session.exception;

import java.util.UUID;

public class SessionNotFoundException extends PosSessionException {

    public SessionNotFoundException(UUID sessionId) {
        super(ErrorKind.NOT_FOUND, "POS session not found: " + sessionId);
    }

    /**
     * No session is active, for lookups of the current session.
     */
    public static SessionNotFoundException noActiveSession() {
        return new SessionNotFoundException("No active POS session");
    }

    private SessionNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
