package com.podium.api.web.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * duration is WEEK, MONTH, YEAR or the numeric code 1, 2, 3.
 * price is checked by the engine so a non-positive value reports invalid_amount.
 */
public record CreateTierRequest(
        @NotBlank String name,
        long price,
        @NotBlank String duration
) {}
