package com.flagship.cash_session.order;

import java.util.Arrays;

/**
 * Payment methods accepted by order management.
 *
 * {@link #POINT_OF_SALE} is physical cash handed over at the counter and is the
 * only method that moves money in or out of the drawer.
 */
public enum PaymentMethod {
    CARD("card"),
    BANK_TRANSFER("bank-transfer"),
    BITCOIN("bitcoin"),
    LIGHTNING("lightning"),
    POINT_OF_SALE("point-of-sale"),
    FREE("free");

    private final String tag;

    PaymentMethod(String tag) {
        this.tag = tag;
    }

    /**
     * Wire and ticket name of the method, e.g. {@code point-of-sale}.
     */
    public String getTag() {
        return tag;
    }

    public boolean isCash() {
        return this == POINT_OF_SALE;
    }

    public static PaymentMethod fromTag(String tag) {
        return Arrays.stream(values())
            .filter(method -> method.tag.equals(tag))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown payment method: " + tag));
    }
}
