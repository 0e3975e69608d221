package com.podium.cli.tools;

import com.podium.domain.MarketException;
import com.podium.domain.curve.BondingCurve;
import com.podium.domain.curve.CurveWeights;
import com.podium.domain.fee.BuySplit;
import com.podium.domain.fee.FeeSchedule;
import com.podium.domain.fee.FeeSplitter;
import com.podium.domain.fee.SellSplit;

import java.io.PrintStream;
import java.util.List;
import java.util.Set;

/**
 * Prices a buy of {@code amount} passes at {@code supply}, and the sale of the
 * same passes right after.
 *
 * Usage:
 *   java -jar podium-cli.jar quote <supply> <amount> [--referrer] [--weights a,b,c]
 *        [--fees protocol,subject,referral]
 */
public final class QuoteTool {

    private QuoteTool() {}

    public static int run(String[] args) {
        return run(args, System.out);
    }

    public static int run(String[] args, PrintStream out) {
        try {
            CliArgs a = CliArgs.parse(args, Set.of("referrer"));
            List<String> pos = a.positionals();
            if (pos.size() != 2) {
                throw new IllegalArgumentException("usage: quote <supply> <amount> [--referrer] [--weights a,b,c]");
            }
            long supply = CliArgs.parseLong("supply", pos.get(0));
            long amount = CliArgs.parseLong("amount", pos.get(1));
            if (supply < 0 || amount <= 0) {
                throw new IllegalArgumentException("supply must be >= 0 and amount > 0");
            }
            CurveWeights weights = CurveWeightsOption.parse(a.option("weights"));
            FeeSchedule fees = feesOption(a.option("fees"));
            boolean referrer = a.has("referrer");

            BuySplit buy = FeeSplitter.splitBuy(BondingCurve.buyPrice(supply, amount, weights), referrer, fees);
            SellSplit sell = FeeSplitter.splitSell(BondingCurve.sellPrice(supply + amount, amount, weights), fees);

            out.printf("buy %d at supply %d%n", amount, supply);
            row(out, "base", buy.base());
            row(out, "protocol_fee", buy.protocolFee());
            row(out, "subject_fee", buy.subjectFee());
            row(out, "referral_fee", buy.referralFee());
            row(out, "total", buy.total());
            out.printf("sell %d back at supply %d%n", amount, supply + amount);
            row(out, "base", sell.base());
            row(out, "protocol_fee", sell.protocolFee());
            row(out, "subject_fee", sell.subjectFee());
            row(out, "net", sell.netToSeller());
            row(out, "round_trip_cost", buy.total() - sell.netToSeller());
            return 0;
        } catch (IllegalArgumentException | MarketException e) {
            out.println("quote: " + e.getMessage());
            return 2;
        }
    }

    private static FeeSchedule feesOption(String raw) {
        FeeSchedule defaults = FeeSchedule.defaults();
        if (raw == null || raw.isBlank()) return defaults;
        String[] p = raw.split(",");
        if (p.length != 3) {
            throw new IllegalArgumentException("--fees expects protocol,subject,referral, got: " + raw);
        }
        return defaults.withTradingFees(
                CliArgs.parseInt("protocol fee", p[0]),
                CliArgs.parseInt("subject fee", p[1]),
                CliArgs.parseInt("referral fee", p[2]));
    }

    private static void row(PrintStream out, String label, long value) {
        out.printf("  %-16s %20d  (%s)%n", label, value, CurveTool.units(value));
    }
}
