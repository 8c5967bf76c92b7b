package io.nosqlbench.auctionsim.command.config;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.auctionsim.config.SimulationConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class CMD_configTest {

    @TempDir
    Path tempDir;

    private int run(ByteArrayOutputStream outContent, String... args) {
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(outContent));
        try {
            return new CommandLine(new CMD_config()).execute(args);
        } finally {
            System.setOut(originalOut);
        }
    }

    @Test
    public void testPrintsDefaults() {
        ByteArrayOutputStream outContent = new ByteArrayOutputStream();
        int exitCode = run(outContent);

        assertEquals(0, exitCode);
        SimulationConfig printed = SimulationConfig.fromJson(outContent.toString());
        assertThat(printed.getAuction().getTotalAuctions()).isEqualTo(40);
        assertThat(printed.getBidder().getTotalBidders()).isEqualTo(100);
        assertThat(printed.getSystem().getSeed()).isNull();
        assertThat(outContent.toString()).contains("\"total_auctions\": 40");
    }

    @Test
    public void testOptionsOverrideDefaults() {
        ByteArrayOutputStream outContent = new ByteArrayOutputStream();
        int exitCode = run(outContent, "--auctions", "12", "--probability", "0.75", "--seed", "99",
            "--bidder-threads", "8", "--no-profile", "--log-level", "debug");

        assertEquals(0, exitCode);
        SimulationConfig printed = SimulationConfig.fromJson(outContent.toString());
        assertThat(printed.getAuction().getTotalAuctions()).isEqualTo(12);
        assertThat(printed.getBidder().getBidProbability()).isEqualTo(0.75);
        assertThat(printed.getSystem().getSeed()).isEqualTo(99L);
        assertThat(printed.getSystem().getBidderThreads()).isEqualTo(8);
        assertThat(printed.getSystem().isEnableProfiling()).isFalse();
        assertThat(printed.getSystem().getLogLevel()).isEqualTo("debug");
    }

    @Test
    public void testSavedConfigurationRoundTripsThroughConfigOption() throws IOException {
        Path saved = tempDir.resolve("nested").resolve("sim.json");
        assertEquals(0, run(new ByteArrayOutputStream(), "--timeout-ms", "2500", "--save", saved.toString()));
        assertThat(saved).exists();

        ByteArrayOutputStream outContent = new ByteArrayOutputStream();
        assertEquals(0, run(outContent, "--config", saved.toString(), "--bidders", "3"));
        SimulationConfig printed = SimulationConfig.fromJson(outContent.toString());
        assertThat(printed.getAuction().getTimeoutMs()).isEqualTo(2500L);
        assertThat(printed.getBidder().getTotalBidders()).isEqualTo(3);
    }

    @Test
    public void testSaveRefusesToOverwriteWithoutForce() throws IOException {
        Path saved = tempDir.resolve("existing.json");
        Files.writeString(saved, "{}");

        assertEquals(2, run(new ByteArrayOutputStream(), "--save", saved.toString()));
        assertThat(Files.readString(saved)).isEqualTo("{}");

        assertEquals(0, run(new ByteArrayOutputStream(), "--save", saved.toString(), "--force"));
        assertThat(Files.readString(saved)).contains("total_auctions");
    }

    @Test
    public void testInvalidConfigurationExitsWithOne() {
        assertEquals(1, run(new ByteArrayOutputStream(), "--auctions", "0"));
        assertEquals(1, run(new ByteArrayOutputStream(), "--log-level", "chatty"));
        assertEquals(1, run(new ByteArrayOutputStream(), "--min-multiplier", "3", "--max-multiplier", "2"));
    }
}
