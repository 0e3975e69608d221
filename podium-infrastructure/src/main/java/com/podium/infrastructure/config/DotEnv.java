package com.podium.infrastructure.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * .env reader for local profiles.
 *
 * Accepts {@code KEY=value} and {@code export KEY=value}. Lines starting
 * with # are comments; a value wrapped in single or double quotes keeps
 * its inner text as is. Later lines win.
 */
public final class DotEnv {

    private static final String EXPORT = "export ";

    private DotEnv() {}

    public static Map<String, String> loadIfExists(Path envFile) throws IOException {
        if (envFile == null || !Files.exists(envFile)) return new LinkedHashMap<>();
        return parse(Files.readString(envFile, StandardCharsets.UTF_8));
    }

    static Map<String, String> parse(String content) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String line : content.split("\\R")) {
            String t = line.trim();
            if (t.isEmpty() || t.startsWith("#")) continue;
            if (t.startsWith(EXPORT)) t = t.substring(EXPORT.length()).trim();

            int eq = t.indexOf('=');
            if (eq <= 0) continue;

            String key = t.substring(0, eq).trim();
            out.put(key, unquote(t.substring(eq + 1).trim()));
        }
        return out;
    }

    private static String unquote(String val) {
        if (val.length() >= 2) {
            char first = val.charAt(0);
            char last = val.charAt(val.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return val.substring(1, val.length() - 1);
            }
        }
        int hash = val.indexOf(" #");
        return hash >= 0 ? val.substring(0, hash).trim() : val;
    }
}
