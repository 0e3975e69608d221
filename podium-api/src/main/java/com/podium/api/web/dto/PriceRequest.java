package com.podium.api.web.dto;

import jakarta.validation.constraints.Positive;

public record PriceRequest(
        @Positive long price
) {}
