package com.podium.application.ports;

/**
 * Abstraction over configuration.
 * Infrastructure provides implementation (file/env/in-memory).
 */
public interface ConfigPort {

    String get(String key);

    String get(String key, String defaultValue);

    int getInt(String key, int defaultValue);

    long getLong(String key, long defaultValue);

    default boolean getBoolean(String key, boolean defaultValue) {
        String v = get(key, null);
        return v == null ? defaultValue : Boolean.parseBoolean(v.trim());
    }
}
