package com.podium.api.web;

import com.podium.api.web.dto.CreateOutpostRequest;
import com.podium.api.web.dto.OutpostResponse;
import com.podium.api.web.dto.OwnerRequest;
import com.podium.api.web.dto.PriceRequest;
import com.podium.application.service.OutpostService;
import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import com.podium.domain.account.Address;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/outposts")
public class OutpostController {

    private final OutpostService outposts;

    public OutpostController(OutpostService outposts) {
        this.outposts = outposts;
    }

    /**
     * Creates an outpost owned by the caller. The purchase price is charged to the caller.
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public OutpostResponse create(@RequestHeader(value = Callers.HEADER, required = false) String caller,
                                  @Valid @RequestBody CreateOutpostRequest req) {
        return OutpostResponse.of(outposts.create(Callers.parse(caller), req.name(), req.description(), req.uri()));
    }

    @GetMapping
    public List<OutpostResponse> list() {
        return outposts.outposts().stream().map(OutpostResponse::of).toList();
    }

    @GetMapping("/{address}")
    public OutpostResponse one(@PathVariable("address") String address) {
        Address a = Address.of(address);
        return outposts.outpost(a)
                .map(OutpostResponse::of)
                .orElseThrow(() -> new MarketException(MarketError.OUTPOST_NOT_FOUND, "No outpost at " + a));
    }

    @PostMapping("/{address}/price")
    public Map<String, Object> price(@RequestHeader(value = Callers.HEADER, required = false) String caller,
                                     @PathVariable("address") String address,
                                     @Valid @RequestBody PriceRequest req) {
        long price = outposts.updatePrice(Callers.parse(caller), Address.of(address), req.price());
        return Map.of("outpost", Address.of(address).value(), "price", price);
    }

    @PostMapping("/{address}/pause")
    public Map<String, Object> pause(@RequestHeader(value = Callers.HEADER, required = false) String caller,
                                     @PathVariable("address") String address) {
        boolean paused = outposts.togglePause(Callers.parse(caller), Address.of(address));
        return Map.of("outpost", Address.of(address).value(), "paused", paused);
    }

    @PostMapping("/{address}/owner")
    public Map<String, Object> owner(@RequestHeader(value = Callers.HEADER, required = false) String caller,
                                     @PathVariable("address") String address,
                                     @Valid @RequestBody OwnerRequest req) {
        Address newOwner = Address.of(req.newOwner());
        Address previous = outposts.transferOwnership(Callers.parse(caller), Address.of(address), newOwner);
        return Map.of(
                "outpost", Address.of(address).value(),
                "previousOwner", previous.value(),
                "owner", newOwner.value()
        );
    }
}
