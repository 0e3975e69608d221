package com.podium.infrastructure.bootstrap;

import com.podium.application.config.ConfigKey;
import com.podium.application.config.ProtocolConfigLoader;
import com.podium.application.market.AddressDerivation;
import com.podium.application.ports.ClockPort;
import com.podium.application.ports.ConfigPort;
import com.podium.application.service.MarketEngine;
import com.podium.domain.config.ProtocolConfig;
import com.podium.infrastructure.clock.SystemClockAdapter;
import com.podium.infrastructure.config.FileConfigService;
import com.podium.infrastructure.events.FanOutEventAdapter;
import com.podium.infrastructure.events.LoggingEventAdapter;
import com.podium.infrastructure.events.RecordingEventAdapter;
import com.podium.infrastructure.settlement.InMemorySettlementLedger;
import com.podium.infrastructure.token.InMemoryPassTokenLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

public final class MarketBootstrap {

    private static final Logger log = LoggerFactory.getLogger(MarketBootstrap.class);

    private MarketBootstrap() {
    }

    /**
     * Loads config from the working directory (config.properties + .env if present) and wires an engine.
     */
    public static MarketRuntime fromWorkingDir(String profile) {
        try {
            return create(FileConfigService.defaultFromWorkingDir(profile));
        } catch (IOException e) {
            throw new UncheckedIOException(
                    "Failed to load config from working directory. " +
                    "Make sure config/config.properties exists and try again.", e);
        }
    }

    public static MarketRuntime create(ConfigPort config) {
        return create(config, new SystemClockAdapter());
    }

    /**
     * Wires an in-memory engine using the provided config and clock.
     *
     * @throws IllegalStateException if the config does not validate
     */
    public static MarketRuntime create(ConfigPort config, ClockPort clock) {
        ProtocolConfig protocol = ProtocolConfigLoader.load(config);

        InMemorySettlementLedger settlement = new InMemorySettlementLedger();
        InMemoryPassTokenLedger passTokens = new InMemoryPassTokenLedger(AddressDerivation.escrowAccount());
        RecordingEventAdapter recent = new RecordingEventAdapter(config.getInt(
                ConfigKey.EVENTS_RECENT_CAPACITY.key(),
                Integer.parseInt(ConfigKey.EVENTS_RECENT_CAPACITY.defaultValue())));

        MarketEngine engine = MarketEngine.create(
                protocol,
                ProtocolConfigLoader.admin(config),
                ProtocolConfigLoader.autoClearExpired(config),
                settlement,
                passTokens,
                clock,
                new FanOutEventAdapter(List.of(new LoggingEventAdapter(), recent))
        );

        boolean faucet = config.getBoolean(ConfigKey.DEV_FAUCET_ENABLED.key(), false);
        log.info("[BOOT] engine ready admin={} treasury={} weights={} faucet={}",
                engine.authorization().admin().shortHex(), protocol.treasury().shortHex(),
                protocol.weights(), faucet);
        return new MarketRuntime(engine, settlement, passTokens, recent, faucet);
    }
}
