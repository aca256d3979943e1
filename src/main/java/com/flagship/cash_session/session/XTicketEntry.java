package com.flagship.cash_session.session;

import lombok.Value;

import java.time.Instant;

/**
 * Audit entry written each time an X ticket is printed.
 */
@Value
public class XTicketEntry {
    Instant generatedAt;
    SessionOperator generatedBy;
}
