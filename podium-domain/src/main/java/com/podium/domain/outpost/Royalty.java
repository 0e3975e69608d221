package com.podium.domain.outpost;

public record Royalty(long numerator, long denominator) {

    public Royalty {
        if (denominator <= 0) throw new IllegalArgumentException("royalty denominator must be > 0");
        if (numerator < 0 || numerator > denominator) {
            throw new IllegalArgumentException("royalty numerator out of [0," + denominator + "]: " + numerator);
        }
    }

    public static Royalty defaults() {
        return new Royalty(5, 100);
    }
}
