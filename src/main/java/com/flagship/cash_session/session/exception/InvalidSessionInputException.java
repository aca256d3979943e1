package com.flagship.cash_session.session.exception;

public class InvalidSessionInputException extends PosSessionException {

    public InvalidSessionInputException(String message) {
        super(ErrorKind.INVALID_INPUT, message);
    }
}
