package com.podium.cli.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.podium.application.config.ConfigValidationResult;
import com.podium.application.config.ConfigValidator;
import com.podium.application.ports.ConfigPort;
import com.podium.infrastructure.config.FileConfigService;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Set;

/**
 * Diagnostics for the engine configuration.
 *
 * Usage:
 *   java -jar podium-cli.jar validate-config [--profile <name>] [--dir <path>] [--full] [--json]
 *
 * Exit codes:
 *   0: OK
 *   2: Problems found
 */
public final class ConfigDoctor {

    private ConfigDoctor() {}

    public static int run(String[] args) {
        return run(args, System.out);
    }

    public static int run(String[] args, PrintStream out) {
        CliArgs a;
        try {
            a = CliArgs.parse(args, Set.of("full", "json"));
        } catch (IllegalArgumentException e) {
            out.println("validate-config: " + e.getMessage());
            return 2;
        }
        String profile = a.option("profile");
        boolean json = a.has("json");

        FileConfigService cfg;
        try {
            cfg = a.has("dir")
                    ? FileConfigService.fromDirectory(Path.of(a.option("dir")))
                    : FileConfigService.defaultFromWorkingDir(profile);
        } catch (IOException e) {
            out.println(json ? failureJson(e.getMessage()) : "Doctor failed: " + e.getMessage());
            return 2;
        }

        ConfigValidationResult res = new ConfigValidator().validate(cfg);

        if (json) {
            out.println(reportJson(profile, cfg, res, a.has("full")));
            return res.isValid() ? 0 : 2;
        }

        if (a.has("full")) {
            printEnvironment(out, cfg.getProfileDir());
            ConfigPrinter.printEffective(cfg, out);
        }

        for (String w : res.warnings()) {
            out.println("Warning: " + w);
        }

        if (res.isValid()) {
            out.println("Config OK.");
            return 0;
        }

        out.println("Config problems:");
        for (String err : res.errors()) {
            out.println(" - " + err);
        }
        out.println();
        out.println("Tips:");
        out.println(" - Put protocol.admin and protocol.treasury in config/"
                + (profile != null ? profile + "/" : "") + "config.properties");
        out.println(" - Or set env overrides like PODIUM_PROTOCOL_ADMIN, PODIUM_PROTOCOL_TREASURY, ...");
        return 2;
    }

    private static String reportJson(String profile, ConfigPort cfg, ConfigValidationResult res, boolean full) {
        ObjectMapper om = new ObjectMapper();
        ObjectNode root = om.createObjectNode();
        root.put("ok", res.isValid());
        root.put("profile", profile);
        root.put("generated_at_utc", Instant.now().toString());
        ArrayNode errors = root.putArray("errors");
        res.errors().forEach(errors::add);
        ArrayNode warnings = root.putArray("warnings");
        res.warnings().forEach(warnings::add);
        if (full) {
            ObjectNode effective = root.putObject("effective");
            ConfigPrinter.effective(cfg).forEach(effective::put);
        }
        return root.toString();
    }

    private static String failureJson(String message) {
        ObjectNode root = new ObjectMapper().createObjectNode();
        root.put("ok", false);
        root.put("error", message);
        return root.toString();
    }

    private static void printEnvironment(PrintStream out, Path dir) {
        out.println("=== Podium Doctor Report ===");
        out.println("java: " + System.getProperty("java.version"));
        out.println("workdir: " + System.getProperty("user.dir"));
        out.println("configDir: " + dir);
        out.println("exists: " + (dir != null && Files.exists(dir)));
        out.println("config.properties: " + (dir != null && Files.exists(dir.resolve("config.properties"))));
        out.println(".env: " + (dir != null && Files.exists(dir.resolve(".env"))));
        out.println("============================");
    }
}
