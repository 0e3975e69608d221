package com.podium.application.config;

/**
 * Known configuration keys of the market engine.
 * Required keys have no default and must be set in config.properties, .env or PODIUM_* env vars.
 */
public enum ConfigKey {
    PROTOCOL_ADMIN("protocol.admin", false, null),
    PROTOCOL_TREASURY("protocol.treasury", false, null),

    // Trading fees (basis points of 10000)
    FEES_PROTOCOL_BPS("fees.protocolBps", true, "400"),
    FEES_SUBJECT_BPS("fees.subjectBps", true, "800"),
    FEES_REFERRAL_BPS("fees.referralBps", true, "200"),

    // Subscription fees (basis points of 10000)
    FEES_SUBSCRIPTION_PROTOCOL_BPS("fees.subscriptionProtocolBps", true, "500"),
    FEES_SUBSCRIPTION_REFERRER_BPS("fees.subscriptionReferrerBps", true, "1000"),

    CURVE_WEIGHT_A("curve.weightA", true, "173"),
    CURVE_WEIGHT_B("curve.weightB", true, "257"),
    CURVE_WEIGHT_C("curve.weightC", true, "23"),

    OUTPOST_PURCHASE_PRICE("outpost.purchasePrice", true, "100000000"),
    OUTPOST_ROYALTY_NUMERATOR("outpost.royaltyNumerator", true, "5"),
    OUTPOST_ROYALTY_DENOMINATOR("outpost.royaltyDenominator", true, "100"),

    SUBSCRIPTION_AUTO_CLEAR_EXPIRED("subscription.autoClearExpired", true, "false"),
    EVENTS_RECENT_CAPACITY("events.recentCapacity", true, "256"),
    DEV_FAUCET_ENABLED("dev.faucet.enabled", true, "false");

    private final String key;
    private final boolean optional;
    private final String defaultValue;

    ConfigKey(String key, boolean optional, String defaultValue) {
        this.key = key;
        this.optional = optional;
        this.defaultValue = defaultValue;
    }

    public String key() { return key; }
    public boolean isOptional() { return optional; }
    public String defaultValue() { return defaultValue; }
}
