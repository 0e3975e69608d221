package com.podium.api.wiring;

import com.podium.application.ports.ConfigPort;
import org.springframework.core.env.Environment;

/**
 * Engine config read from the Spring environment under the {@code podium.} prefix,
 * falling back to the file/env profile.
 *
 * Example: {@code podium.fees.protocolBps} in application.yml wins over
 * {@code fees.protocolBps} in config/config.properties.
 */
final class SpringEnvironmentConfig implements ConfigPort {

    static final String PREFIX = "podium.";

    private final Environment env;
    private final ConfigPort fallback;

    SpringEnvironmentConfig(Environment env, ConfigPort fallback) {
        this.env = env;
        this.fallback = fallback;
    }

    @Override
    public String get(String key) {
        return get(key, null);
    }

    @Override
    public String get(String key, String defaultValue) {
        String v = env.getProperty(PREFIX + key);
        if (v != null) return v;
        return fallback.get(key, defaultValue);
    }

    @Override
    public int getInt(String key, int defaultValue) {
        String v = get(key, null);
        return v == null ? defaultValue : Integer.parseInt(v.trim());
    }

    @Override
    public long getLong(String key, long defaultValue) {
        String v = get(key, null);
        return v == null ? defaultValue : Long.parseLong(v.trim());
    }
}
