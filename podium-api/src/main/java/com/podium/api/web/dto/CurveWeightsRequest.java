package com.podium.api.web.dto;

public record CurveWeightsRequest(
        long a,
        long b,
        long c
) {}
