package com.podium.cli.tools;

import com.podium.domain.curve.CurveWeights;

final class CurveWeightsOption {

    private CurveWeightsOption() {}

    /** {@code a,b,c}; null means the default weights. */
    static CurveWeights parse(String raw) {
        if (raw == null || raw.isBlank()) return CurveWeights.defaults();
        String[] parts = raw.split(",");
        if (parts.length != 3) {
            throw new IllegalArgumentException("--weights expects a,b,c, got: " + raw);
        }
        return new CurveWeights(
                CliArgs.parseLong("weight a", parts[0]),
                CliArgs.parseLong("weight b", parts[1]),
                CliArgs.parseLong("weight c", parts[2]));
    }
}
