package com.podium.api.web.dto;

import com.podium.domain.outpost.SubscriptionTier;

public record TierResponse(
        int id,
        String name,
        long price,
        String duration,
        long durationSeconds
) {
    public static TierResponse of(SubscriptionTier t) {
        return new TierResponse(t.id(), t.name(), t.price(), t.duration().name(), t.duration().seconds());
    }
}
