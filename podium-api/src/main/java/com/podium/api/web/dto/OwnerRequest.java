package com.podium.api.web.dto;

import jakarta.validation.constraints.NotBlank;

public record OwnerRequest(
        @NotBlank String newOwner
) {}
