package com.flagship.cash_session.session;

import lombok.Value;

/**
 * Staff member acting on a session.
 */
@Value
public class SessionOperator {
    String userId;
    String login;
    String alias;

    public static SessionOperator of(String userId, String login, String alias) {
        return new SessionOperator(userId, login, alias);
    }

    /**
     * Alias, else login, else user id. Blank values count as absent.
     */
    public String displayName() {
        if (alias != null && !alias.isBlank()) {
            return alias;
        }
        if (login != null && !login.isBlank()) {
            return login;
        }
        return userId;
    }
}
