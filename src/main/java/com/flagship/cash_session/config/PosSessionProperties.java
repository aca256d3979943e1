package com.flagship.cash_session.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * POS session settings, bound from {@code pos.*}.
 */
@Validated
@ConfigurationProperties(prefix = "pos")
public class PosSessionProperties {

    /**
     * Printed as the first word of every ticket.
     */
    @NotBlank
    private String brandName = "POS";

    /**
     * When false, opening a session is refused.
     */
    private boolean enabled = true;

    /**
     * When false, a cash delta above the tolerance is accepted without a
     * justification.
     */
    private boolean cashDeltaJustificationMandatory = true;

    /**
     * Largest absolute cash delta that does not count as a balance error.
     */
    @NotNull
    @DecimalMin("0")
    private BigDecimal cashTolerance = new BigDecimal("0.01");

    @Valid
    private final Ticket ticket = new Ticket();

    public String getBrandName() {
        return brandName;
    }

    public void setBrandName(String brandName) {
        this.brandName = brandName;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isCashDeltaJustificationMandatory() {
        return cashDeltaJustificationMandatory;
    }

    public void setCashDeltaJustificationMandatory(boolean cashDeltaJustificationMandatory) {
        this.cashDeltaJustificationMandatory = cashDeltaJustificationMandatory;
    }

    public BigDecimal getCashTolerance() {
        return cashTolerance;
    }

    public void setCashTolerance(BigDecimal cashTolerance) {
        this.cashTolerance = cashTolerance;
    }

    public Ticket getTicket() {
        return ticket;
    }

    public static class Ticket {

        /**
         * Zone in which ticket timestamps are printed.
         */
        @NotNull
        private ZoneId zoneId = ZoneOffset.UTC;

        public ZoneId getZoneId() {
            return zoneId;
        }

        public void setZoneId(ZoneId zoneId) {
            this.zoneId = zoneId;
        }
    }
}
