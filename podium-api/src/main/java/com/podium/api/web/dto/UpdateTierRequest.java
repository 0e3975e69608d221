package com.podium.api.web.dto;

/** Either field may be omitted; at least one must be set. */
public record UpdateTierRequest(
        Long price,
        String duration
) {}
