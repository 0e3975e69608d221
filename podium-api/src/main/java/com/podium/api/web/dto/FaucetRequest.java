package com.podium.api.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record FaucetRequest(
        @NotBlank String account,
        @Positive long amount
) {}
