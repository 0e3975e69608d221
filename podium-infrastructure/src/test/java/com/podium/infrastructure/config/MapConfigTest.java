package com.podium.infrastructure.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MapConfigTest {

    @Test
    void entriesWinOverDelegate() {
        MapConfig base = MapConfig.of(Map.of("a", "1", "b", "2"));
        MapConfig layered = new MapConfig(base).with("b", "20");

        assertThat(layered.get("a")).isEqualTo("1");
        assertThat(layered.getInt("b", 0)).isEqualTo(20);
        assertThat(layered.get("c", "d")).isEqualTo("d");
    }

    @Test
    void numbersParseStrictly() {
        MapConfig cfg = new MapConfig().with("n", "x");

        assertThatThrownBy(() -> cfg.getLong("n", 0)).isInstanceOf(NumberFormatException.class);
    }
}
