package com.podium.application.config;

import com.podium.application.ports.ConfigPort;
import com.podium.domain.DomainException;
import com.podium.domain.account.Address;

public final class ConfigValidator {

    public ConfigValidationResult validate(ConfigPort config) {
        ConfigValidationResult res = new ConfigValidationResult();

        for (ConfigKey k : ConfigKey.values()) {
            if (k.isOptional()) continue;
            String v = config.get(k.key());
            if (v == null || v.isBlank()) {
                res.addError("Missing required config: " + k.key());
            }
        }

        checkAddress(config, ConfigKey.PROTOCOL_ADMIN, res);
        checkAddress(config, ConfigKey.PROTOCOL_TREASURY, res);

        for (ConfigKey k : ConfigKey.values()) {
            if (k.defaultValue() == null || isBooleanKey(k)) continue;
            String raw = config.get(k.key(), k.defaultValue());
            try {
                Long.parseLong(raw.trim());
            } catch (NumberFormatException e) {
                res.addError(k.key() + " is not a number: " + raw);
            }
        }
        if (!res.isValid()) return res;

        // Range checks reuse the domain constructors.
        try {
            ProtocolConfigLoader.fees(config);
        } catch (DomainException | IllegalArgumentException e) {
            res.addError("Invalid fees: " + e.getMessage());
        }
        try {
            ProtocolConfigLoader.weights(config);
        } catch (DomainException | IllegalArgumentException e) {
            res.addError("Invalid curve weights: " + e.getMessage());
        }
        try {
            ProtocolConfigLoader.royalty(config);
        } catch (DomainException | IllegalArgumentException e) {
            res.addError("Invalid outpost royalty: " + e.getMessage());
        }
        if (config.getLong(ConfigKey.OUTPOST_PURCHASE_PRICE.key(), 0L) <= 0) {
            res.addError(ConfigKey.OUTPOST_PURCHASE_PRICE.key() + " must be > 0");
        }
        if (config.getInt(ConfigKey.EVENTS_RECENT_CAPACITY.key(), 0) <= 0) {
            res.addError(ConfigKey.EVENTS_RECENT_CAPACITY.key() + " must be > 0");
        }

        if (isTrue(config, ConfigKey.DEV_FAUCET_ENABLED)) {
            res.addWarning(ConfigKey.DEV_FAUCET_ENABLED.key() + " is on: anyone can mint settlement balance");
        }
        String admin = config.get(ConfigKey.PROTOCOL_ADMIN.key());
        String treasury = config.get(ConfigKey.PROTOCOL_TREASURY.key());
        if (Address.of(admin).equals(Address.of(treasury))) {
            res.addWarning("protocol.treasury is the admin account");
        }

        return res;
    }

    private static void checkAddress(ConfigPort config, ConfigKey key, ConfigValidationResult res) {
        String v = config.get(key.key());
        if (v == null || v.isBlank()) return;
        try {
            Address.of(v);
        } catch (IllegalArgumentException e) {
            res.addError(key.key() + " is not an address: " + e.getMessage());
        }
    }

    private static boolean isTrue(ConfigPort config, ConfigKey key) {
        return Boolean.parseBoolean(config.get(key.key(), key.defaultValue()).trim());
    }

    private static boolean isBooleanKey(ConfigKey k) {
        return "true".equals(k.defaultValue()) || "false".equals(k.defaultValue());
    }
}
