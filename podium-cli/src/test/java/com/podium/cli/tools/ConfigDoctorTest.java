package com.podium.cli.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigDoctorTest {

    private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8);

    private String output() {
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void validDirectoryIsOk(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("config.properties"), "protocol.admin=0xad\nprotocol.treasury=0x7e\n");

        int code = ConfigDoctor.run(new String[]{"--dir", dir.toString()}, out);

        assertThat(code).isZero();
        assertThat(output()).contains("Config OK.");
    }

    @Test
    void problemsAreListed(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("config.properties"), "protocol.admin=0xad\nfees.protocolBps=20000\n");

        int code = ConfigDoctor.run(new String[]{"--dir", dir.toString()}, out);

        assertThat(code).isEqualTo(2);
        assertThat(output())
                .contains("Config problems:")
                .contains("Missing required config: protocol.treasury");
    }

    @Test
    void jsonReportCarriesEffectiveValues(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("config.properties"), "protocol.admin=0xad\nprotocol.treasury=0x7e\n");

        int code = ConfigDoctor.run(new String[]{"--dir", dir.toString(), "--json", "--full"}, out);

        JsonNode report = new ObjectMapper().readTree(output());
        assertThat(code).isZero();
        assertThat(report.get("ok").asBoolean()).isTrue();
        assertThat(report.get("errors")).isEmpty();
        assertThat(report.get("warnings")).isEmpty();
        assertThat(report.get("effective").get("fees.protocolBps").asText()).isEqualTo("400 (default)");
        assertThat(report.get("effective").get("protocol.admin").asText()).isEqualTo("0xad");
    }
}
