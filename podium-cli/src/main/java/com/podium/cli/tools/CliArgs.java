package com.podium.cli.tools;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code --flag value} options plus positionals. Flags listed as switches take no value.
 */
final class CliArgs {

    private final Map<String, String> options = new HashMap<>();
    private final List<String> positionals = new ArrayList<>();

    private CliArgs() {}

    static CliArgs parse(String[] args, Set<String> switches) {
        CliArgs out = new CliArgs();
        for (int i = 0; i < args.length; i++) {
            String a = args[i] == null ? "" : args[i].trim();
            if (a.isEmpty()) continue;
            if (a.startsWith("--")) {
                String name = a.substring(2).toLowerCase();
                if (switches.contains(name)) {
                    out.options.put(name, "true");
                } else if (i + 1 < args.length) {
                    out.options.put(name, args[++i].trim());
                } else {
                    throw new IllegalArgumentException("Missing value for " + a);
                }
            } else {
                out.positionals.add(a);
            }
        }
        return out;
    }

    String option(String name) {
        return options.get(name);
    }

    boolean has(String name) {
        return options.containsKey(name);
    }

    long longOption(String name, long def) {
        String v = options.get(name);
        return v == null ? def : parseLong(name, v);
    }

    List<String> positionals() {
        return positionals;
    }

    static int parseInt(String what, String v) {
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(what + " must be a whole number within int range, got: " + v, e);
        }
    }

    static long parseLong(String what, String v) {
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(what + " must be a whole number, got: " + v, e);
        }
    }
}
