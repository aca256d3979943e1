package com.flagship.cash_session.session.exception;

import java.util.UUID;

public class SessionAlreadyActiveException extends PosSessionException {

    public SessionAlreadyActiveException(UUID activeSessionId) {
        super(ErrorKind.ALREADY_ACTIVE, "There is already an active POS session: " + activeSessionId);
    }

    public SessionAlreadyActiveException(Throwable cause) {
        super(ErrorKind.ALREADY_ACTIVE, "There is already an active POS session", cause);
    }
}
