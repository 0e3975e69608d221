package com.podium.api.web;

import com.podium.api.web.dto.FaucetRequest;
import com.podium.domain.account.Address;
import com.podium.infrastructure.bootstrap.MarketRuntime;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Credits settlement funds to an account. Answers 404 unless dev.faucet.enabled=true.
 */
@RestController
public class DevFaucetController {

    private final MarketRuntime runtime;

    public DevFaucetController(MarketRuntime runtime) {
        this.runtime = runtime;
    }

    @PostMapping("/api/v1/dev/faucet")
    public ResponseEntity<Map<String, Object>> faucet(@Valid @RequestBody FaucetRequest req) {
        if (!runtime.faucetEnabled()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                    "status", "error",
                    "reason", "faucet_disabled",
                    "message", "dev.faucet.enabled is false"
            ));
        }
        Address account = Address.of(req.account());
        long balance = runtime.faucet(account, req.amount());
        return ResponseEntity.ok(Map.of("account", account.value(), "balance", balance));
    }
}
