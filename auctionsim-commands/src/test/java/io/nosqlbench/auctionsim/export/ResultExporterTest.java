package io.nosqlbench.auctionsim.export;

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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.nosqlbench.auctionsim.model.AuctionItem;
import io.nosqlbench.auctionsim.model.AuctionResult;
import io.nosqlbench.auctionsim.model.Bid;
import io.nosqlbench.auctionsim.model.ResourceUsage;
import io.nosqlbench.auctionsim.model.SimulationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultExporterTest {

    private static final Instant START = Instant.parse("2024-05-01T10:15:00Z");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path outputDir;
    private ResultExporter exporter;

    @BeforeEach
    void setUp() {
        outputDir = tempDir.resolve("output");
        exporter = new ResultExporter(outputDir, CLOCK);
    }

    private static SimulationResult sampleResult() {
        AuctionItem lamp = new AuctionItem(1, "Lamp, Brass", "Home", "Acme", "New", "Gold", "M", 1.5,
            "Brass", 2020, "USA", "Common", 120.0, "A lamp", "Dimmable", 12, 2.0, "10x10x30 cm", "CE", 7.5);
        AuctionResult won = AuctionResult.of(1, lamp, 3,
            Optional.of(new Bid(42, 1, 180.5, START.plusMillis(300))), START, START.plusMillis(1000));
        AuctionResult unsold = AuctionResult.of(2, AuctionItem.of(2, "Chair", 45.0), 0,
            Optional.empty(), START, START.plusMillis(1000));
        return new SimulationResult(2, Duration.ofSeconds(2), START, START.plusSeconds(2),
            List.of(won, unsold), 1, 1, 3, null);
    }

    @Test
    void testJsonExportUsesTimestampedNameAndSnakeCase() throws IOException {
        Path path = exporter.exportToJson(sampleResult());

        assertThat(path.getFileName().toString()).isEqualTo("simulation_20240501_101530.json");
        assertThat(path.getParent()).isEqualTo(outputDir);

        JsonObject root = JsonParser.parseString(Files.readString(path)).getAsJsonObject();
        assertThat(root.get("total_auctions").getAsInt()).isEqualTo(2);
        assertThat(root.get("total_bids").getAsInt()).isEqualTo(3);
        assertThat(root.get("total_duration").getAsString()).isEqualTo("PT2S");
        assertThat(root.get("start_time").getAsString()).isEqualTo("2024-05-01T10:15:00Z");

        JsonArray auctions = root.getAsJsonArray("auction_results");
        assertThat(auctions).hasSize(2);
        JsonObject first = auctions.get(0).getAsJsonObject();
        assertThat(first.get("status").getAsString()).isEqualTo("completed");
        assertThat(first.getAsJsonObject("item").get("base_price").getAsDouble()).isEqualTo(120.0);
        assertThat(first.getAsJsonObject("winning_bid").get("bidder_id").getAsInt()).isEqualTo(42);
        JsonObject second = auctions.get(1).getAsJsonObject();
        assertThat(second.get("status").getAsString()).isEqualTo("no_bids");
        assertThat(second.has("winning_bid")).isFalse();
    }

    @Test
    void testCsvExport() throws IOException {
        Path path = exporter.exportToCsv(sampleResult());

        assertThat(path.getFileName().toString()).isEqualTo("simulation_20240501_101530.csv");
        List<String> lines = Files.readAllLines(path);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo(ResultExporter.CSV_HEADER);
        assertThat(lines.get(1)).isEqualTo("1,\"Lamp, Brass\",Home,120.00,completed,3,42,180.50,1000");
        assertThat(lines.get(2)).isEqualTo("2,Chair,,45.00,no_bids,0,N/A,N/A,1000");
    }

    @Test
    void testCsvFieldQuoting() {
        assertThat(ResultExporter.csvField("plain")).isEqualTo("plain");
        assertThat(ResultExporter.csvField("a,b")).isEqualTo("\"a,b\"");
        assertThat(ResultExporter.csvField("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
        assertThat(ResultExporter.csvField(null)).isEmpty();
    }

    @Test
    void testSummaryIncludesOverviewAndStatistics() throws IOException {
        Path path = exporter.exportSummary(sampleResult(), "\nDETAILED STATISTICS\nmarker\n");

        assertThat(path.getFileName().toString()).isEqualTo("summary_20240501_101530.txt");
        String text = Files.readString(path);
        assertThat(text).startsWith("AUCTION SIMULATION SUMMARY");
        assertThat(text).contains("Generated: 2024-05-01 10:15:30");
        assertThat(text).contains("Duration: 2000 ms");
        assertThat(text).contains("Total Auctions: 2");
        assertThat(text).contains("Successful:     1");
        assertThat(text).contains("DETAILED STATISTICS");
    }

    @Test
    void testResourceMetricsExport() throws IOException {
        ResourceUsage usage = new ResourceUsage(10.0, 14.5, 20.0, 15.0, 64, 8, 5);
        Path path = exporter.exportResourceMetrics(usage);

        assertThat(path.getFileName().toString()).isEqualTo("resources_20240501_101530.txt");
        String text = Files.readString(path);
        assertThat(text).contains("RESOURCE USAGE REPORT");
        assertThat(text).contains("Peak:        20.00 MB");
        assertThat(text).contains("Delta:       +4.50 MB");
        assertThat(text).contains("Peak Threads:      64");
    }

    @Test
    void testUnwritableOutputDirectoryFails() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        ResultExporter blocked = new ResultExporter(blocker.resolve("nested"), CLOCK);

        assertThatThrownBy(() -> blocked.exportToCsv(sampleResult())).isInstanceOf(IOException.class);
    }
}
