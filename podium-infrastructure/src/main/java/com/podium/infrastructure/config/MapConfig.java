package com.podium.infrastructure.config;

import com.podium.application.ports.ConfigPort;

import java.util.HashMap;
import java.util.Map;

/**
 * In-memory configuration, optionally layered over another {@link ConfigPort}.
 * Entries set here win over the delegate.
 */
public final class MapConfig implements ConfigPort {

    private final ConfigPort delegate;
    private final Map<String, String> values = new HashMap<>();

    public MapConfig() {
        this(null);
    }

    public MapConfig(ConfigPort delegate) {
        this.delegate = delegate;
    }

    public static MapConfig of(Map<String, String> values) {
        MapConfig c = new MapConfig();
        values.forEach(c::with);
        return c;
    }

    public MapConfig with(String key, String value) {
        if (key != null && value != null) values.put(key, value);
        return this;
    }

    @Override
    public String get(String key) {
        return get(key, null);
    }

    @Override
    public String get(String key, String defaultValue) {
        String v = values.get(key);
        if (v != null) return v;
        return delegate == null ? defaultValue : delegate.get(key, defaultValue);
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
