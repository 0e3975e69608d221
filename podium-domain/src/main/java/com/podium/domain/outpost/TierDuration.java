package com.podium.domain.outpost;

import com.podium.domain.MarketError;
import com.podium.domain.MarketException;

import java.util.Locale;

public enum TierDuration {
    WEEK(1, 604_800L),
    MONTH(2, 2_592_000L),
    YEAR(3, 31_536_000L);

    private final int code;
    private final long seconds;

    TierDuration(int code, long seconds) {
        this.code = code;
        this.seconds = seconds;
    }

    public int code() { return code; }
    public long seconds() { return seconds; }

    public static TierDuration fromCode(int code) {
        for (TierDuration d : values()) {
            if (d.code == code) return d;
        }
        throw new MarketException(MarketError.INVALID_DURATION, "Unknown duration code: " + code);
    }

    /**
     * Accepts the enum name in any case or its numeric code.
     */
    public static TierDuration parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MarketException(MarketError.INVALID_DURATION, "Duration is blank");
        }
        String s = raw.trim().toUpperCase(Locale.ROOT);
        for (TierDuration d : values()) {
            if (d.name().equals(s)) return d;
        }
        try {
            return fromCode(Integer.parseInt(s));
        } catch (NumberFormatException e) {
            throw new MarketException(MarketError.INVALID_DURATION, "Unknown duration: " + raw);
        }
    }
}
