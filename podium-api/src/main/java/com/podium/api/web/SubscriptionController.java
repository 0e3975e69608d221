package com.podium.api.web;

import com.podium.api.web.dto.SubscribeRequest;
import com.podium.api.web.dto.SubscriptionResponse;
import com.podium.application.service.SubscriptionService;
import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import com.podium.domain.account.Address;
import com.podium.domain.outpost.Subscription;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/outposts/{address}/subscriptions")
public class SubscriptionController {

    private final SubscriptionService subscriptions;

    public SubscriptionController(SubscriptionService subscriptions) {
        this.subscriptions = subscriptions;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SubscriptionResponse subscribe(@RequestHeader(value = Callers.HEADER, required = false) String caller,
                                          @PathVariable("address") String address,
                                          @Valid @RequestBody SubscribeRequest req) {
        Address subscriber = Callers.parse(caller);
        Address outpost = Address.of(address);
        subscriptions.subscribe(subscriber, outpost, req.tierId(), Callers.optional(req.referrer()));
        return details(subscriber, outpost);
    }

    @DeleteMapping
    public Map<String, Object> cancel(@RequestHeader(value = Callers.HEADER, required = false) String caller,
                                      @PathVariable("address") String address) {
        Subscription removed = subscriptions.cancel(Callers.parse(caller), Address.of(address));
        return Map.of(
                "status", "cancelled",
                "subscriber", removed.subscriber().value(),
                "tierId", removed.tierId()
        );
    }

    @GetMapping("/{subscriber}")
    public SubscriptionResponse one(@PathVariable("address") String address,
                                    @PathVariable("subscriber") String subscriber) {
        return details(Address.of(subscriber), Address.of(address));
    }

    @GetMapping("/{subscriber}/active")
    public Map<String, Object> active(@PathVariable("address") String address,
                                      @PathVariable("subscriber") String subscriber,
                                      @RequestParam("tierId") int tierId) {
        boolean active = subscriptions.isActive(Address.of(subscriber), Address.of(address), tierId);
        return Map.of("active", active, "tierId", tierId);
    }

    private SubscriptionResponse details(Address subscriber, Address outpost) {
        return subscriptions.subscription(subscriber, outpost)
                .map(d -> SubscriptionResponse.of(outpost, d))
                .orElseThrow(() -> new MarketException(MarketError.SUBSCRIPTION_NOT_FOUND,
                        "No subscription of " + subscriber + " on " + outpost));
    }
}
