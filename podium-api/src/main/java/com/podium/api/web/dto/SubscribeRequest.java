package com.podium.api.web.dto;

import jakarta.validation.constraints.PositiveOrZero;

public record SubscribeRequest(
        @PositiveOrZero int tierId,
        String referrer
) {}
