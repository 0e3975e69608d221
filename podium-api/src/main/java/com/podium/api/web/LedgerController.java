package com.podium.api.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.podium.application.service.PassTradingService;
import com.podium.domain.account.Address;
import com.podium.infrastructure.bootstrap.MarketRuntime;
import com.podium.infrastructure.events.EventJson;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only views over the vault, settlement balances and recent events.
 */
@RestController
@RequestMapping("/api/v1")
public class LedgerController {

    private final PassTradingService trading;
    private final MarketRuntime runtime;
    private final ObjectMapper mapper;

    public LedgerController(PassTradingService trading, MarketRuntime runtime, ObjectMapper mapper) {
        this.trading = trading;
        this.runtime = runtime;
        this.mapper = mapper;
    }

    @GetMapping("/vault")
    public Map<String, Object> vault() {
        Address account = runtime.engine().context().vaultAccount();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("balance", trading.vaultBalance());
        out.put("account", account.value());
        out.put("settlementBalance", runtime.settlement().balance(account));
        return out;
    }

    @GetMapping("/accounts/{account}")
    public Map<String, Object> account(@PathVariable("account") String account) {
        Address a = Address.of(account);
        return Map.of("account", a.value(), "balance", runtime.settlement().balance(a));
    }

    @GetMapping("/events")
    public Map<String, Object> events(@RequestParam(value = "limit", defaultValue = "50") int limit) {
        List<ObjectNode> items = runtime.recentEvents().recent(limit).stream()
                .map(e -> EventJson.toNode(mapper, e))
                .toList();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("total", runtime.recentEvents().total());
        out.put("items", items);
        return out;
    }
}
