package com.podium.domain.fee;

/**
 * Seller side of a trade: fees are deducted from the base price withdrawn from the vault.
 */
public record SellSplit(long base, long protocolFee, long subjectFee, long netToSeller) {
}
