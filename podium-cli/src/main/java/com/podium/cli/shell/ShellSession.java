package com.podium.cli.shell;

import com.podium.application.service.MarketEngine;
import com.podium.application.service.PassQuote;
import com.podium.application.service.PassTrade;
import com.podium.domain.MarketException;
import com.podium.domain.account.Address;
import com.podium.domain.ledger.PassStats;
import com.podium.domain.outpost.Outpost;
import com.podium.domain.outpost.Subscription;
import com.podium.domain.outpost.SubscriptionTier;
import com.podium.domain.outpost.TierDuration;
import com.podium.infrastructure.bootstrap.MarketRuntime;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * Line commands against an in-memory engine. One instance per shell.
 */
public final class ShellSession {

    static final String HELP = String.join(System.lineSeparator(),
            "commands:",
            "  faucet <account> <amount>",
            "  buy <buyer> <target> <amount> [referrer]",
            "  sell <seller> <target> <amount>",
            "  quote <target> <amount>",
            "  stats <target>",
            "  balance <account> [target]",
            "  vault",
            "  outpost <creator> <name>",
            "  tier <owner> <outpost> <name> <price> <WEEK|MONTH|YEAR>",
            "  subscribe <subscriber> <outpost> <tierId> [referrer]",
            "  cancel <subscriber> <outpost>",
            "  pause <owner> <outpost>",
            "  help | exit");

    private final MarketRuntime runtime;
    private final PrintStream out;

    public ShellSession(MarketRuntime runtime, PrintStream out) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.out = Objects.requireNonNull(out, "out");
    }

    /** @return false when the shell should end */
    public boolean execute(String line) {
        if (line == null) return false;
        String[] t = line.trim().split("\\s+");
        if (t.length == 0 || t[0].isEmpty()) return true;

        String cmd = t[0].toLowerCase();
        String[] a = Arrays.copyOfRange(t, 1, t.length);
        try {
            switch (cmd) {
                case "exit", "quit" -> {
                    return false;
                }
                case "help" -> out.println(HELP);
                case "faucet" -> faucet(a);
                case "buy" -> buy(a);
                case "sell" -> sell(a);
                case "quote" -> quote(a);
                case "stats" -> stats(a);
                case "balance" -> balance(a);
                case "vault" -> out.println("vault " + engine().trading().vaultBalance());
                case "outpost" -> outpost(a);
                case "tier" -> tier(a);
                case "subscribe" -> subscribe(a);
                case "cancel" -> cancel(a);
                case "pause" -> pause(a);
                default -> out.println("unknown command: " + cmd + " (try help)");
            }
        } catch (MarketException e) {
            out.println("error " + e.reason() + ": " + e.getMessage());
        } catch (IllegalArgumentException e) {
            out.println("bad input: " + e.getMessage());
        }
        return true;
    }

    private void faucet(String[] a) {
        need(a, 2, "faucet <account> <amount>");
        if (!runtime.faucetEnabled()) {
            out.println("faucet disabled");
            return;
        }
        Address acct = Address.of(a[0]);
        out.println("balance " + runtime.faucet(acct, number(a[1])));
    }

    private void buy(String[] a) {
        need(a, 3, "buy <buyer> <target> <amount> [referrer]");
        Address referrer = a.length > 3 ? Address.of(a[3]) : null;
        PassTrade trade = engine().trading().buy(Address.of(a[0]), Address.of(a[1]), number(a[2]), referrer);
        out.println("bought " + trade.quote().amount() + " paid " + trade.quote().callerAmount()
                + " supply " + trade.supplyAfter());
    }

    private void sell(String[] a) {
        need(a, 3, "sell <seller> <target> <amount>");
        PassTrade trade = engine().trading().sell(Address.of(a[0]), Address.of(a[1]), number(a[2]));
        out.println("sold " + trade.quote().amount() + " received " + trade.quote().callerAmount()
                + " supply " + trade.supplyAfter());
    }

    private void quote(String[] a) {
        need(a, 2, "quote <target> <amount>");
        PassQuote q = engine().trading().quoteBuy(Address.of(a[0]), number(a[1]), false);
        out.println("base " + q.basePrice() + " protocol " + q.protocolFee() + " subject " + q.subjectFee()
                + " total " + q.callerAmount());
    }

    private void stats(String[] a) {
        need(a, 1, "stats <target>");
        PassStats s = engine().trading().stats(Address.of(a[0]));
        out.println("supply " + s.totalSupply() + " last_price " + s.lastPrice());
    }

    private void balance(String[] a) {
        need(a, 1, "balance <account> [target]");
        Address acct = Address.of(a[0]);
        if (a.length > 1) {
            out.println("passes " + engine().trading().passBalance(acct, Address.of(a[1])));
        } else {
            out.println("balance " + runtime.settlement().balance(acct));
        }
    }

    private void outpost(String[] a) {
        need(a, 2, "outpost <creator> <name>");
        Outpost o = engine().outposts().create(Address.of(a[0]), a[1], "", "");
        out.println("outpost " + o.address());
    }

    private void tier(String[] a) {
        need(a, 5, "tier <owner> <outpost> <name> <price> <duration>");
        SubscriptionTier t = engine().subscriptions().createTier(Address.of(a[0]), Address.of(a[1]),
                a[2], number(a[3]), TierDuration.parse(a[4]));
        out.println("tier " + t.id() + " " + t.name());
    }

    private void subscribe(String[] a) {
        need(a, 3, "subscribe <subscriber> <outpost> <tierId> [referrer]");
        Address referrer = a.length > 3 ? Address.of(a[3]) : null;
        Subscription s = engine().subscriptions().subscribe(Address.of(a[0]), Address.of(a[1]),
                tierId(a[2]), referrer);
        out.println("subscribed tier " + s.tierId() + " until " + s.endTime());
    }

    private void cancel(String[] a) {
        need(a, 2, "cancel <subscriber> <outpost>");
        Subscription s = engine().subscriptions().cancel(Address.of(a[0]), Address.of(a[1]));
        out.println("cancelled tier " + s.tierId());
    }

    private void pause(String[] a) {
        need(a, 2, "pause <owner> <outpost>");
        boolean paused = engine().outposts().togglePause(Address.of(a[0]), Address.of(a[1]));
        out.println("paused " + paused);
    }

    private MarketEngine engine() {
        return runtime.engine();
    }

    private static void need(String[] a, int n, String usage) {
        if (a.length < n) throw new IllegalArgumentException("usage: " + usage);
    }

    private static int tierId(String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a tier id: " + s, e);
        }
    }

    private static long number(String s) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: " + s, e);
        }
    }
}
