package com.podium.infrastructure.config;

import com.podium.application.config.ConfigKey;
import com.podium.application.ports.ConfigPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

/**
 * File + env configuration of a market engine profile.
 *
 * Load order (low -> high priority):
 *  1) config.properties (profile dir)
 *  2) .env (profile dir, optional)
 *  3) OS environment variables, PODIUM_* names (highest priority)
 *
 * Profile dir is {@code ./config} or {@code ./config/<profile>}.
 */
public final class FileConfigService implements ConfigPort {

    private static final Logger log = LoggerFactory.getLogger(FileConfigService.class);

    private final Properties props = new Properties();
    private final Path profileDir;

    private FileConfigService(Path profileDir, Map<String, String> env) throws IOException {
        this.profileDir = profileDir;
        loadAll();
        applyEnvOverrides(env);
    }

    public static FileConfigService defaultFromWorkingDir() throws IOException {
        return defaultFromWorkingDir(null);
    }

    public static FileConfigService defaultFromWorkingDir(String profile) throws IOException {
        Path base = Path.of(System.getProperty("user.dir")).resolve("config");
        if (profile != null && !profile.isBlank()) {
            base = base.resolve(profile.trim());
        }
        return fromDirectory(base);
    }

    public static FileConfigService fromDirectory(Path profileDir) throws IOException {
        return fromDirectory(profileDir, System.getenv());
    }

    /** Same as {@link #fromDirectory(Path)} with an explicit environment. */
    public static FileConfigService fromDirectory(Path profileDir, Map<String, String> env) throws IOException {
        return new FileConfigService(profileDir, env);
    }

    public Path getProfileDir() {
        return profileDir;
    }

    private void loadAll() throws IOException {
        if (profileDir == null) return;

        Path file = profileDir.resolve("config.properties");
        if (Files.exists(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                props.load(in);
            }
        }

        Map<String, String> dotEnv = DotEnv.loadIfExists(profileDir.resolve(".env"));
        for (Map.Entry<String, String> e : dotEnv.entrySet()) {
            props.setProperty(e.getKey(), e.getValue());
        }
    }

    private void applyEnvOverrides(Map<String, String> env) {
        // known keys may be set without any file
        for (ConfigKey k : ConfigKey.values()) {
            String val = env.get(toEnvKey(k.key()));
            if (val != null) props.setProperty(k.key(), val);
        }
        for (String key : props.stringPropertyNames()) {
            String val = env.get(toEnvKey(key));
            if (val != null) props.setProperty(key, val);
        }
    }

    /**
     * Maps a Java-properties key into an env-var key.
     *
     * Examples:
     * - protocol.treasury   -> PODIUM_PROTOCOL_TREASURY
     * - fees.protocolBps    -> PODIUM_FEES_PROTOCOL_BPS
     */
    static String toEnvKey(String key) {
        String s = key.replace('.', '_');
        s = s.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return "PODIUM_" + s.toUpperCase();
    }

    @Override
    public String get(String key) {
        return get(key, null);
    }

    @Override
    public String get(String key, String defaultValue) {
        String v = props.getProperty(key);
        return (v == null) ? defaultValue : v;
    }

    @Override
    public int getInt(String key, int defaultValue) {
        String v = get(key, null);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("[CONFIG] not an int key={} value={}, using {}", key, v, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public long getLong(String key, long defaultValue) {
        String v = get(key, null);
        if (v == null) return defaultValue;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            log.warn("[CONFIG] not a long key={} value={}, using {}", key, v, defaultValue);
            return defaultValue;
        }
    }
}
