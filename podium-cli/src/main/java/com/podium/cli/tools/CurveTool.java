package com.podium.cli.tools;

import com.podium.domain.MarketException;
import com.podium.domain.curve.BondingCurve;
import com.podium.domain.curve.CurveWeights;

import java.io.PrintStream;
import java.util.Set;

/**
 * Prints the unit price progression of the bonding curve.
 *
 * Usage:
 *   java -jar podium-cli.jar curve [--from N] [--count N] [--weights a,b,c]
 *
 * Exit codes:
 *   0: OK
 *   2: Bad arguments
 */
public final class CurveTool {

    static final long MAX_ROWS = 10_000;

    private CurveTool() {}

    public static int run(String[] args) {
        return run(args, System.out);
    }

    public static int run(String[] args, PrintStream out) {
        try {
            CliArgs a = CliArgs.parse(args, Set.of());
            long from = a.longOption("from", 0);
            long count = a.longOption("count", 20);
            CurveWeights weights = CurveWeightsOption.parse(a.option("weights"));
            if (from < 0 || count <= 0 || count > MAX_ROWS) {
                throw new IllegalArgumentException("--from must be >= 0 and --count in [1," + MAX_ROWS + "]");
            }

            out.printf("weights a=%d b=%d c=%d%n", weights.a(), weights.b(), weights.c());
            out.printf("%12s  %24s  %16s%n", "supply", "unit_price", "units");
            for (long s = from; s < from + count; s++) {
                long price = BondingCurve.unitPrice(s, weights);
                out.printf("%12d  %24d  %16s%n", s, price, units(price));
            }
            return 0;
        } catch (IllegalArgumentException | MarketException e) {
            out.println("curve: " + e.getMessage());
            return 2;
        }
    }

    /** Smallest units rendered as whole units with 8 decimals. */
    static String units(long amount) {
        long whole = amount / BondingCurve.UNIT_SCALE;
        long frac = Math.abs(amount % BondingCurve.UNIT_SCALE);
        return whole + "." + String.format("%08d", frac);
    }
}
