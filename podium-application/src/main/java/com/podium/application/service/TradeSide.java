package com.podium.application.service;

public enum TradeSide {
    BUY,
    SELL
}
