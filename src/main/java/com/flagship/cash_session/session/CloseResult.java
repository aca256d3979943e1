package com.flagship.cash_session.session;

import lombok.Value;

/**
 * Closed session together with its Z ticket.
 */
@Value
public class CloseResult {
    ClosedPosSession session;
    String zTicket;
}
