package com.podium.cli.tools;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class CurveToolTest {

    private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8);

    private String output() {
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void printsDefaultCurveRows() {
        int code = CurveTool.run(new String[]{"--from", "0", "--count", "3"}, out);

        assertThat(code).isZero();
        String[] lines = output().split("\\R");
        assertThat(lines[0]).isEqualTo("weights a=173 b=257 c=23");
        assertThat(lines).hasSize(5);
        assertThat(lines[4]).contains("2").contains("200000000").endsWith("2.00000000");
    }

    @Test
    void customWeightsAreEchoed() {
        int code = CurveTool.run(new String[]{"--count", "1", "--weights", "500,500,10"}, out);

        assertThat(code).isZero();
        assertThat(output()).startsWith("weights a=500 b=500 c=10");
    }

    @Test
    void badArgumentsExitTwo() {
        assertThat(CurveTool.run(new String[]{"--count", "0"}, out)).isEqualTo(2);
        assertThat(CurveTool.run(new String[]{"--from"}, out)).isEqualTo(2);
        assertThat(CurveTool.run(new String[]{"--weights", "0,1,1"}, out)).isEqualTo(2);
        assertThat(output()).contains("curve: ");
    }

    @Test
    void unitsKeepEightDecimals() {
        assertThat(CurveTool.units(100_000_000L)).isEqualTo("1.00000000");
        assertThat(CurveTool.units(27_200_000_000L)).isEqualTo("272.00000000");
        assertThat(CurveTool.units(5)).isEqualTo("0.00000005");
    }
}
