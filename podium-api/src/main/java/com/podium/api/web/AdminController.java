package com.podium.api.web;

import com.podium.api.web.dto.CurveWeightsRequest;
import com.podium.api.web.dto.PriceRequest;
import com.podium.api.web.dto.ProtocolConfigResponse;
import com.podium.api.web.dto.SubscriptionFeesRequest;
import com.podium.api.web.dto.TradingFeesRequest;
import com.podium.api.web.dto.TreasuryRequest;
import com.podium.application.service.ProtocolAdminService;
import com.podium.domain.account.Address;
import com.podium.infrastructure.bootstrap.MarketRuntime;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Protocol admin endpoints. The engine rejects any caller other than the configured admin.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final ProtocolAdminService admin;
    private final MarketRuntime runtime;

    public AdminController(ProtocolAdminService admin, MarketRuntime runtime) {
        this.admin = admin;
        this.runtime = runtime;
    }

    @GetMapping("/config")
    public ProtocolConfigResponse config() {
        return ProtocolConfigResponse.of(runtime.admin(), admin.config());
    }

    @PostMapping("/fees/trading")
    public ProtocolConfigResponse tradingFees(@RequestHeader(value = Callers.HEADER, required = false) String caller,
                                              @RequestBody TradingFeesRequest req) {
        Address who = Callers.parse(caller);
        log.info("[ADMIN_HTTP] action=TRADING_FEES caller={} body={}", who.shortHex(), req);
        admin.updateTradingFees(who, req.protocolBps(), req.subjectBps(), req.referralBps());
        return config();
    }

    @PostMapping("/fees/subscription")
    public ProtocolConfigResponse subscriptionFees(@RequestHeader(value = Callers.HEADER, required = false) String caller,
                                                   @RequestBody SubscriptionFeesRequest req) {
        Address who = Callers.parse(caller);
        log.info("[ADMIN_HTTP] action=SUBSCRIPTION_FEES caller={} body={}", who.shortHex(), req);
        admin.updateSubscriptionFees(who, req.protocolBps(), req.referrerBps());
        return config();
    }

    @PostMapping("/weights")
    public ProtocolConfigResponse weights(@RequestHeader(value = Callers.HEADER, required = false) String caller,
                                          @RequestBody CurveWeightsRequest req) {
        Address who = Callers.parse(caller);
        log.info("[ADMIN_HTTP] action=WEIGHTS caller={} body={}", who.shortHex(), req);
        admin.updateCurveWeights(who, req.a(), req.b(), req.c());
        return config();
    }

    @PostMapping("/treasury")
    public ProtocolConfigResponse treasury(@RequestHeader(value = Callers.HEADER, required = false) String caller,
                                           @Valid @RequestBody TreasuryRequest req) {
        Address who = Callers.parse(caller);
        log.info("[ADMIN_HTTP] action=TREASURY caller={}", who.shortHex());
        admin.updateTreasury(who, Address.of(req.treasury()));
        return config();
    }

    /** Price is validated by the engine so a non-positive value reports invalid_amount. */
    @PostMapping("/outpost-price")
    public ProtocolConfigResponse outpostPrice(@RequestHeader(value = Callers.HEADER, required = false) String caller,
                                               @RequestBody PriceRequest req) {
        Address who = Callers.parse(caller);
        log.info("[ADMIN_HTTP] action=OUTPOST_PRICE caller={} price={}", who.shortHex(), req.price());
        admin.updateOutpostPurchasePrice(who, req.price());
        return config();
    }
}
