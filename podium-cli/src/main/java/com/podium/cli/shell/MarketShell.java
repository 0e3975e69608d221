package com.podium.cli.shell;

import com.podium.application.config.ConfigKey;
import com.podium.infrastructure.bootstrap.MarketBootstrap;
import com.podium.infrastructure.bootstrap.MarketRuntime;
import com.podium.infrastructure.config.MapConfig;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.IOException;
import java.io.PrintStream;

/**
 * Interactive sandbox: a fresh in-memory market with the dev faucet on.
 *
 * Usage:
 *   java -jar podium-cli.jar shell [--admin <addr>] [--treasury <addr>]
 */
public final class MarketShell {

    static final String DEFAULT_ADMIN = "0xad";
    static final String DEFAULT_TREASURY = "0x7e";

    private MarketShell() {}

    public static int run(String[] args) {
        String admin = DEFAULT_ADMIN;
        String treasury = DEFAULT_TREASURY;
        for (int i = 0; i + 1 < args.length; i++) {
            if ("--admin".equalsIgnoreCase(args[i])) admin = args[++i];
            else if ("--treasury".equalsIgnoreCase(args[i])) treasury = args[++i];
        }

        MarketRuntime runtime = MarketBootstrap.create(sandboxConfig(admin, treasury));

        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            LineReader reader = LineReaderBuilder.builder().terminal(terminal).build();
            PrintStream out = new PrintStream(terminal.output(), true);
            ShellSession session = new ShellSession(runtime, out);
            out.println("podium sandbox. admin=" + runtime.admin().shortHex() + " (help for commands)");

            while (true) {
                String line;
                try {
                    line = reader.readLine("podium> ");
                } catch (UserInterruptException e) {
                    continue;
                } catch (EndOfFileException e) {
                    return 0;
                }
                if (!session.execute(line)) return 0;
            }
        } catch (IOException e) {
            System.err.println("Cannot open terminal: " + e.getMessage());
            return 1;
        }
    }

    static MapConfig sandboxConfig(String admin, String treasury) {
        return new MapConfig()
                .with(ConfigKey.PROTOCOL_ADMIN.key(), admin)
                .with(ConfigKey.PROTOCOL_TREASURY.key(), treasury)
                .with(ConfigKey.DEV_FAUCET_ENABLED.key(), "true");
    }
}
