package com.podium.api.web.dto;

import jakarta.validation.constraints.NotBlank;

public record TreasuryRequest(
        @NotBlank String treasury
) {}
