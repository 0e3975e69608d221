package com.podium.api.web.dto;

public record TradingFeesRequest(
        int protocolBps,
        int subjectBps,
        int referralBps
) {}
