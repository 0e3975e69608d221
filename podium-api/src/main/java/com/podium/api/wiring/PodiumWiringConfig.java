package com.podium.api.wiring;

import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.podium.application.ports.ConfigPort;
import com.podium.application.service.OutpostService;
import com.podium.application.service.PassTradingService;
import com.podium.application.service.ProtocolAdminService;
import com.podium.application.service.SubscriptionService;
import com.podium.domain.account.Address;
import com.podium.infrastructure.bootstrap.MarketBootstrap;
import com.podium.infrastructure.bootstrap.MarketRuntime;
import com.podium.infrastructure.config.FileConfigService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.io.IOException;

@Configuration
public class PodiumWiringConfig {

    @Bean
    public ConfigPort configPort(Environment env) throws IOException {
        String profile = env.getProperty("podium.profile", "");
        return new SpringEnvironmentConfig(env, FileConfigService.defaultFromWorkingDir(profile));
    }

    @Bean
    public MarketRuntime marketRuntime(ConfigPort config) {
        return MarketBootstrap.create(config);
    }

    @Bean
    public PassTradingService passTradingService(MarketRuntime runtime) {
        return runtime.engine().trading();
    }

    @Bean
    public OutpostService outpostService(MarketRuntime runtime) {
        return runtime.engine().outposts();
    }

    @Bean
    public SubscriptionService subscriptionService(MarketRuntime runtime) {
        return runtime.engine().subscriptions();
    }

    @Bean
    public ProtocolAdminService protocolAdminService(MarketRuntime runtime) {
        return runtime.engine().admin();
    }

    /** Addresses travel as plain hex strings. */
    @Bean
    public Module podiumAddressModule() {
        SimpleModule m = new SimpleModule("podium-addresses");
        m.addSerializer(Address.class, ToStringSerializer.instance);
        return m;
    }
}
