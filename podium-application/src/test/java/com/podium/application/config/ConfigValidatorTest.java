package com.podium.application.config;

import com.podium.application.support.TestConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigValidatorTest {

    private static TestConfig minimal() {
        return new TestConfig()
                .with("protocol.admin", "0xad")
                .with("protocol.treasury", "0x7e");
    }

    @Test
    void adminAndTreasuryAloneAreEnough() {
        ConfigValidationResult res = new ConfigValidator().validate(minimal());

        assertThat(res.isValid()).isTrue();
        assertThat(res.errors()).isEmpty();
        assertThat(res.warnings()).isEmpty();
    }

    @Test
    void faucetAndSharedTreasuryOnlyWarn() {
        TestConfig cfg = new TestConfig()
                .with("protocol.admin", "0xad")
                .with("protocol.treasury", "0x00ad")
                .with("dev.faucet.enabled", "true");

        ConfigValidationResult res = new ConfigValidator().validate(cfg);

        assertThat(res.isValid()).isTrue();
        assertThat(res.warnings()).containsExactly(
                "dev.faucet.enabled is on: anyone can mint settlement balance",
                "protocol.treasury is the admin account");
    }

    @Test
    void missingRequiredKeysAreListed() {
        ConfigValidationResult res = new ConfigValidator().validate(new TestConfig());

        assertThat(res.isValid()).isFalse();
        assertThat(res.errors()).contains(
                "Missing required config: protocol.admin",
                "Missing required config: protocol.treasury");
    }

    @Test
    void malformedAddressesAndNumbersAreReported() {
        TestConfig cfg = new TestConfig()
                .with("protocol.admin", "not-hex")
                .with("protocol.treasury", "0x7e")
                .with("fees.protocolBps", "four");

        ConfigValidationResult res = new ConfigValidator().validate(cfg);

        assertThat(res.errors()).anyMatch(e -> e.startsWith("protocol.admin is not an address"));
        assertThat(res.errors()).contains("fees.protocolBps is not a number: four");
    }

    @Test
    void outOfRangeValuesAreReported() {
        TestConfig cfg = minimal()
                .with("fees.subjectBps", "20000")
                .with("curve.weightC", "0")
                .with("outpost.royaltyNumerator", "200")
                .with("outpost.purchasePrice", "0")
                .with("events.recentCapacity", "-1");

        ConfigValidationResult res = new ConfigValidator().validate(cfg);

        assertThat(res.errors()).hasSize(5);
        assertThat(res.errors()).anyMatch(e -> e.startsWith("Invalid fees"));
        assertThat(res.errors()).anyMatch(e -> e.startsWith("Invalid curve weights"));
        assertThat(res.errors()).anyMatch(e -> e.startsWith("Invalid outpost royalty"));
        assertThat(res.errors()).contains("outpost.purchasePrice must be > 0", "events.recentCapacity must be > 0");
    }
}
