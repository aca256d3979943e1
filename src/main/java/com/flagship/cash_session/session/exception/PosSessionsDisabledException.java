package com.flagship.cash_session.session.exception;

public class PosSessionsDisabledException extends PosSessionException {

    public PosSessionsDisabledException() {
        super(ErrorKind.SESSIONS_DISABLED, "POS sessions are not enabled");
    }
}
