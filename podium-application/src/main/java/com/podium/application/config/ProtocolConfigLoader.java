package com.podium.application.config;

import com.podium.application.ports.ConfigPort;
import com.podium.domain.account.Address;
import com.podium.domain.config.ProtocolConfig;
import com.podium.domain.curve.CurveWeights;
import com.podium.domain.fee.FeeSchedule;
import com.podium.domain.outpost.Royalty;

/**
 * Builds the initial {@link ProtocolConfig} from key/value configuration.
 */
public final class ProtocolConfigLoader {

    private ProtocolConfigLoader() {}

    /**
     * @throws IllegalStateException listing every validation error
     */
    public static ProtocolConfig load(ConfigPort config) {
        ConfigValidationResult res = new ConfigValidator().validate(config);
        if (!res.isValid()) {
            throw new IllegalStateException("Invalid protocol config: " + res.summary());
        }
        return new ProtocolConfig(
                fees(config),
                weights(config),
                Address.of(config.get(ConfigKey.PROTOCOL_TREASURY.key())),
                longOf(config, ConfigKey.OUTPOST_PURCHASE_PRICE),
                royalty(config)
        );
    }

    public static Address admin(ConfigPort config) {
        String v = config.get(ConfigKey.PROTOCOL_ADMIN.key());
        if (v == null || v.isBlank()) {
            throw new IllegalStateException("Missing required config: " + ConfigKey.PROTOCOL_ADMIN.key());
        }
        return Address.of(v);
    }

    public static boolean autoClearExpired(ConfigPort config) {
        ConfigKey k = ConfigKey.SUBSCRIPTION_AUTO_CLEAR_EXPIRED;
        return config.getBoolean(k.key(), Boolean.parseBoolean(k.defaultValue()));
    }

    static FeeSchedule fees(ConfigPort config) {
        return new FeeSchedule(
                intOf(config, ConfigKey.FEES_PROTOCOL_BPS),
                intOf(config, ConfigKey.FEES_SUBJECT_BPS),
                intOf(config, ConfigKey.FEES_REFERRAL_BPS),
                intOf(config, ConfigKey.FEES_SUBSCRIPTION_PROTOCOL_BPS),
                intOf(config, ConfigKey.FEES_SUBSCRIPTION_REFERRER_BPS)
        );
    }

    static CurveWeights weights(ConfigPort config) {
        return new CurveWeights(
                longOf(config, ConfigKey.CURVE_WEIGHT_A),
                longOf(config, ConfigKey.CURVE_WEIGHT_B),
                longOf(config, ConfigKey.CURVE_WEIGHT_C)
        );
    }

    static Royalty royalty(ConfigPort config) {
        return new Royalty(
                longOf(config, ConfigKey.OUTPOST_ROYALTY_NUMERATOR),
                longOf(config, ConfigKey.OUTPOST_ROYALTY_DENOMINATOR)
        );
    }

    private static int intOf(ConfigPort config, ConfigKey k) {
        return config.getInt(k.key(), Integer.parseInt(k.defaultValue()));
    }

    private static long longOf(ConfigPort config, ConfigKey k) {
        return config.getLong(k.key(), Long.parseLong(k.defaultValue()));
    }
}
