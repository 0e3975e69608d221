package com.podium.api.web;

import com.podium.api.web.dto.BuyRequest;
import com.podium.api.web.dto.SellRequest;
import com.podium.application.service.PassQuote;
import com.podium.application.service.PassTrade;
import com.podium.application.service.PassTradingService;
import com.podium.domain.account.Address;
import com.podium.domain.ledger.PassStats;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/passes/{target}")
public class PassController {

    private final PassTradingService trading;

    public PassController(PassTradingService trading) {
        this.trading = trading;
    }

    @GetMapping
    public Map<String, Object> stats(@PathVariable("target") String target) {
        Address t = Address.of(target);
        PassStats s = trading.stats(t);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("target", t.value());
        out.put("totalSupply", s.totalSupply());
        out.put("lastPrice", s.lastPrice());
        return out;
    }

    @GetMapping("/quote/buy")
    public PassQuote quoteBuy(@PathVariable("target") String target,
                              @RequestParam("amount") long amount,
                              @RequestParam(value = "withReferrer", defaultValue = "false") boolean withReferrer) {
        return trading.quoteBuy(Address.of(target), amount, withReferrer);
    }

    @GetMapping("/quote/sell")
    public PassQuote quoteSell(@PathVariable("target") String target,
                               @RequestParam("amount") long amount) {
        return trading.quoteSell(Address.of(target), amount);
    }

    @PostMapping("/buy")
    public PassTrade buy(@RequestHeader(value = Callers.HEADER, required = false) String caller,
                         @PathVariable("target") String target,
                         @Valid @RequestBody BuyRequest req) {
        return trading.buy(Callers.parse(caller), Address.of(target), req.amount(), Callers.optional(req.referrer()));
    }

    @PostMapping("/sell")
    public PassTrade sell(@RequestHeader(value = Callers.HEADER, required = false) String caller,
                          @PathVariable("target") String target,
                          @Valid @RequestBody SellRequest req) {
        return trading.sell(Callers.parse(caller), Address.of(target), req.amount());
    }

    @GetMapping("/balance/{account}")
    public Map<String, Object> balance(@PathVariable("target") String target,
                                       @PathVariable("account") String account) {
        Address t = Address.of(target);
        Address a = Address.of(account);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("target", t.value());
        out.put("account", a.value());
        out.put("balance", trading.passBalance(a, t));
        return out;
    }
}
