package com.flagship.cash_session.session;

/**
 * Status of a POS session. The only transition is ACTIVE to CLOSED.
 */
public enum PosSessionStatus {
    ACTIVE,
    CLOSED
}
