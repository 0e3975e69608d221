package com.podium.api.web.dto;

import com.podium.domain.account.Address;
import com.podium.domain.outpost.Outpost;

public record OutpostResponse(
        Address address,
        Address owner,
        String name,
        String description,
        String uri,
        long price,
        boolean paused,
        long royaltyNumerator,
        long royaltyDenominator,
        int tierCount,
        long createdAt
) {
    public static OutpostResponse of(Outpost o) {
        return new OutpostResponse(o.address(), o.owner(), o.name(), o.description(), o.uri(),
                o.price(), o.paused(), o.royalty().numerator(), o.royalty().denominator(),
                o.tierCount(), o.createdAt());
    }
}
