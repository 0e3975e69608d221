package com.podium.application.ports;

public interface ClockPort {

    /** Wall-clock time in epoch seconds. */
    long now();
}
