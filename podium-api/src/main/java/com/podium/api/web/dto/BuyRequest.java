package com.podium.api.web.dto;

import jakarta.validation.constraints.Positive;

/** referrer is optional. */
public record BuyRequest(
        @Positive long amount,
        String referrer
) {}
