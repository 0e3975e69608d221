package com.podium.api.web.dto;

import com.podium.application.service.SubscriptionDetails;
import com.podium.domain.account.Address;
import com.podium.domain.outpost.Subscription;

public record SubscriptionResponse(
        Address subscriber,
        Address outpost,
        int tierId,
        String tierName,
        long startTime,
        long endTime,
        boolean active,
        boolean expired
) {
    public static SubscriptionResponse of(Address outpost, SubscriptionDetails d) {
        Subscription s = d.subscription();
        return new SubscriptionResponse(s.subscriber(), outpost, s.tierId(), d.tier().name(),
                s.startTime(), s.endTime(), d.active(), d.expired());
    }
}
