package com.podium.domain;

import java.util.Locale;

/**
 * Stable error kinds of the market engine.
 * Hosts render {@link #reason()} to callers, so names must not change.
 */
public enum MarketError {
    NOT_ADMIN(403),
    NOT_OWNER(403),
    INVALID_AMOUNT(400),
    INVALID_FEE_VALUE(400),
    INVALID_WEIGHT(400),
    INVALID_DURATION(400),
    TIER_NOT_FOUND(404),
    TIER_NAME_EXISTS(409),
    SUBSCRIPTION_NOT_FOUND(404),
    ALREADY_SUBSCRIBED(409),
    EMERGENCY_PAUSE(423),
    INSUFFICIENT_VAULT_BALANCE(409),
    INSUFFICIENT_CALLER_BALANCE(402),
    SUPPLY_UNDERFLOW(409),
    OUTPOST_NOT_FOUND(404),
    OUTPOST_EXISTS(409),
    ARITHMETIC_OVERFLOW(500);

    private final int httpStatus;

    MarketError(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public String reason() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Status code a web host answers with. */
    public int httpStatus() {
        return httpStatus;
    }
}
