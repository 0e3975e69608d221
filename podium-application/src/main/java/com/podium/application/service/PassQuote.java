package com.podium.application.service;

import com.podium.domain.account.Address;

/**
 * Priced trade before execution.
 *
 * @param callerAmount for a buy, what the buyer pays in total; for a sell, what the seller receives
 * @param referralFee  always 0 on the sell side
 */
public record PassQuote(
        TradeSide side,
        Address target,
        long supply,
        long amount,
        long basePrice,
        long protocolFee,
        long subjectFee,
        long referralFee,
        long callerAmount
) {}
