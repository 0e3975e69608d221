package com.podium.infrastructure.clock;

import com.podium.application.ports.ClockPort;

import java.time.Clock;
import java.util.Objects;

public final class SystemClockAdapter implements ClockPort {

    private final Clock clock;

    public SystemClockAdapter() {
        this(Clock.systemUTC());
    }

    public SystemClockAdapter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public long now() {
        return clock.instant().getEpochSecond();
    }
}
