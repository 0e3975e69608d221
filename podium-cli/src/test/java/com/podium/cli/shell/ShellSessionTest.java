package com.podium.cli.shell;

import com.podium.infrastructure.bootstrap.MarketBootstrap;
import com.podium.infrastructure.bootstrap.MarketRuntime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ShellSessionTest {

    private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
    private ShellSession session;

    @BeforeEach
    void setUp() {
        MarketRuntime runtime = MarketBootstrap.create(MarketShell.sandboxConfig("0xad", "0x7e"));
        session = new ShellSession(runtime, new PrintStream(buf, true, StandardCharsets.UTF_8));
    }

    private String run(String line) {
        buf.reset();
        assertThat(session.execute(line)).isTrue();
        return buf.toString(StandardCharsets.UTF_8).trim();
    }

    @Test
    void tradesThroughTheSandbox() {
        assertThat(run("faucet 0xb1 1000000000")).isEqualTo("balance 1000000000");
        assertThat(run("quote 0x5b 3")).isEqualTo("base 400000000 protocol 16000000 subject 32000000 total 448000000");
        assertThat(run("buy 0xb1 0x5b 3")).isEqualTo("bought 3 paid 448000000 supply 3");
        assertThat(run("balance 0xb1 0x5b")).isEqualTo("passes 3");
        assertThat(run("vault")).isEqualTo("vault 400000000");
        assertThat(run("sell 0xb1 0x5b 3")).isEqualTo("sold 3 received 352000000 supply 0");
        assertThat(run("stats 0x5b")).isEqualTo("supply 0 last_price 400000000");
    }

    @Test
    void outpostsTiersAndSubscriptions() {
        run("faucet 0xa1 1000000000");
        run("faucet 0xf1 10000");
        String created = run("outpost 0xa1 hall");
        assertThat(created).startsWith("outpost 0x");
        String outpost = created.substring("outpost ".length());

        assertThat(run("tier 0xa1 " + outpost + " basic 1000 week")).isEqualTo("tier 0 basic");
        assertThat(run("subscribe 0xf1 " + outpost + " 4294967296")).isEqualTo("bad input: not a tier id: 4294967296");
        assertThat(run("subscribe 0xf1 " + outpost + " 0")).startsWith("subscribed tier 0 until ");
        assertThat(run("subscribe 0xf1 " + outpost + " 0")).startsWith("error already_subscribed:");
        assertThat(run("cancel 0xf1 " + outpost)).isEqualTo("cancelled tier 0");
        assertThat(run("pause 0xa1 " + outpost)).isEqualTo("paused true");
    }

    @Test
    void errorsAndBadInputKeepTheShellRunning() {
        assertThat(run("sell 0xb1 0x5b 1")).startsWith("error supply_underflow:");
        assertThat(run("buy 0xb1 0x5b")).startsWith("bad input: usage: buy");
        assertThat(run("buy 0xb1 0x5b many")).isEqualTo("bad input: not a number: many");
        assertThat(run("frobnicate")).startsWith("unknown command: frobnicate");
        assertThat(run("")).isEmpty();
        assertThat(session.execute("exit")).isFalse();
    }
}
