package com.podium.api.web.dto;

public record SubscriptionFeesRequest(
        int protocolBps,
        int referrerBps
) {}
