package com.podium.cli.tools;

import com.podium.application.config.ConfigKey;
import com.podium.application.ports.ConfigPort;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;

public final class ConfigPrinter {

    private ConfigPrinter() {}

    /** Every known key with its value, or its default marked as such. */
    static Map<String, String> effective(ConfigPort cfg) {
        Map<String, String> out = new LinkedHashMap<>();
        for (ConfigKey k : ConfigKey.values()) {
            String v = cfg.get(k.key());
            if (v != null && !v.isBlank()) {
                out.put(k.key(), v.trim());
            } else if (k.defaultValue() != null) {
                out.put(k.key(), k.defaultValue() + " (default)");
            } else {
                out.put(k.key(), "<missing>");
            }
        }
        return out;
    }

    public static void printEffective(ConfigPort cfg, PrintStream out) {
        out.println();
        out.println("Effective config");
        for (Map.Entry<String, String> e : effective(cfg).entrySet()) {
            out.println(" - " + e.getKey() + " = " + e.getValue());
        }
        out.println();
    }
}
