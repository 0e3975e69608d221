package com.podium.api.web;

import com.podium.api.web.dto.CreateTierRequest;
import com.podium.api.web.dto.TierResponse;
import com.podium.api.web.dto.UpdateTierRequest;
import com.podium.application.service.SubscriptionService;
import com.podium.domain.account.Address;
import com.podium.domain.outpost.SubscriptionTier;
import com.podium.domain.outpost.TierDuration;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/outposts/{address}/tiers")
public class TierController {

    private final SubscriptionService subscriptions;

    public TierController(SubscriptionService subscriptions) {
        this.subscriptions = subscriptions;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TierResponse create(@RequestHeader(value = Callers.HEADER, required = false) String caller,
                               @PathVariable("address") String address,
                               @Valid @RequestBody CreateTierRequest req) {
        SubscriptionTier tier = subscriptions.createTier(Callers.parse(caller), Address.of(address),
                req.name(), req.price(), TierDuration.parse(req.duration()));
        return TierResponse.of(tier);
    }

    @GetMapping
    public List<TierResponse> list(@PathVariable("address") String address) {
        return subscriptions.tiers(Address.of(address)).stream().map(TierResponse::of).toList();
    }

    @GetMapping("/{tierId}")
    public TierResponse one(@PathVariable("address") String address, @PathVariable("tierId") int tierId) {
        return TierResponse.of(subscriptions.tier(Address.of(address), tierId));
    }

    /** Applies the price first, then the duration. */
    @PutMapping("/{tierId}")
    public TierResponse update(@RequestHeader(value = Callers.HEADER, required = false) String caller,
                               @PathVariable("address") String address,
                               @PathVariable("tierId") int tierId,
                               @RequestBody UpdateTierRequest req) {
        if (req.price() == null && (req.duration() == null || req.duration().isBlank())) {
            throw new IllegalArgumentException("Nothing to update: set price and/or duration");
        }
        Address who = Callers.parse(caller);
        Address outpost = Address.of(address);
        SubscriptionTier tier = null;
        if (req.price() != null) {
            tier = subscriptions.updateTierPrice(who, outpost, tierId, req.price());
        }
        if (req.duration() != null && !req.duration().isBlank()) {
            tier = subscriptions.updateTierDuration(who, outpost, tierId, TierDuration.parse(req.duration()));
        }
        return TierResponse.of(tier);
    }
}
