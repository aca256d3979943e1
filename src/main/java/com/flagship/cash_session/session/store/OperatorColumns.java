package com.flagship.cash_session.session.store;

import com.flagship.cash_session.session.SessionOperator;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Operator snapshot embedded in session and X ticket rows. Column names are
 * overridden by each owner.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperatorColumns {

    @Column(name = "user_id", length = 100)
    private String userId;

    @Column(name = "login", length = 100)
    private String login;

    @Column(name = "alias", length = 100)
    private String alias;

    static OperatorColumns fromDomain(SessionOperator operator) {
        return new OperatorColumns(operator.getUserId(), operator.getLogin(), operator.getAlias());
    }

    SessionOperator toDomain() {
        return SessionOperator.of(userId, login, alias);
    }
}
