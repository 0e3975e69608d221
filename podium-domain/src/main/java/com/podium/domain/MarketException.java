package com.podium.domain;

import java.util.Objects;

public final class MarketException extends DomainException {

    private final MarketError error;

    public MarketException(MarketError error, String message) {
        super(message == null || message.isBlank() ? error.name() : message);
        this.error = Objects.requireNonNull(error, "error");
    }

    public MarketException(MarketError error, String message, Throwable cause) {
        super(message == null || message.isBlank() ? error.name() : message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    public static MarketException of(MarketError error) {
        return new MarketException(error, error.name());
    }

    public MarketError error() {
        return error;
    }

    public String reason() {
        return error.reason();
    }
}
