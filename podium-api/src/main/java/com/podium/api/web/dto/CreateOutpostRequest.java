package com.podium.api.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateOutpostRequest(
        @NotBlank @Size(max = 128) String name,
        @Size(max = 1024) String description,
        @Size(max = 512) String uri
) {}
