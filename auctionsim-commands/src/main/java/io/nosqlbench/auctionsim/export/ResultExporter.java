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

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.nosqlbench.auctionsim.model.AuctionResult;
import io.nosqlbench.auctionsim.model.ResourceUsage;
import io.nosqlbench.auctionsim.model.SimulationResult;
import io.nosqlbench.auctionsim.monitor.ResourceMonitor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Writes simulation results to timestamped files under an output directory.
 *
 * <p>Each export method names its file {@code <kind>_<yyyyMMdd_HHmmss>.<ext>} using the exporter's
 * clock and creates the output directory when it is missing.</p>
 */
public class ResultExporter {

    private static final Logger logger = LogManager.getLogger(ResultExporter.class);

    static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss", Locale.ROOT);
    static final DateTimeFormatter REPORT_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

    public static final String CSV_HEADER =
        "AuctionID,ItemName,ItemCategory,BasePrice,Status,TotalBids,WinnerBidderID,WinningAmount,Duration_ms";

    static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
        .registerTypeAdapter(Instant.class, new InstantAdapter().nullSafe())
        .registerTypeAdapter(Duration.class, new DurationAdapter().nullSafe())
        .create();

    private final Path outputDir;
    private final Clock clock;

    public ResultExporter(Path outputDir) {
        this(outputDir, Clock.systemDefaultZone());
    }

    public ResultExporter(Path outputDir, Clock clock) {
        this.outputDir = outputDir;
        this.clock = clock;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    private Path target(String kind, String extension) throws IOException {
        Files.createDirectories(outputDir);
        String stamp = LocalDateTime.now(clock).format(FILE_TIMESTAMP);
        return outputDir.resolve(kind + "_" + stamp + "." + extension);
    }

    /**
     * Writes the whole result, per-auction detail included, as pretty-printed JSON.
     *
     * @param result the result to write
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    public Path exportToJson(SimulationResult result) throws IOException {
        Path path = target("simulation", "json");
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(result, writer);
        }
        logger.info("Exported JSON results to {}", path);
        return path;
    }

    /**
     * Writes one CSV row per auction.
     *
     * @param result the result to write
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    public Path exportToCsv(SimulationResult result) throws IOException {
        Path path = target("simulation", "csv");
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(CSV_HEADER);
            writer.write('\n');
            for (AuctionResult auction : result.auctionResults()) {
                writer.write(csvRow(auction));
                writer.write('\n');
            }
        }
        logger.info("Exported CSV results to {}", path);
        return path;
    }

    static String csvRow(AuctionResult auction) {
        String winnerId = "N/A";
        String winningAmount = "N/A";
        if (auction.winningBid() != null) {
            winnerId = Integer.toString(auction.winningBid().bidderId());
            winningAmount = String.format(Locale.ROOT, "%.2f", auction.winningBid().amount());
        }
        return String.join(",",
            Integer.toString(auction.auctionId()),
            csvField(auction.item().name()),
            csvField(auction.item().category()),
            String.format(Locale.ROOT, "%.2f", auction.item().basePrice()),
            auction.status().label(),
            Integer.toString(auction.totalBids()),
            winnerId,
            winningAmount,
            Long.toString(auction.duration().toMillis())
        );
    }

    static String csvField(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    /**
     * Writes a human-readable summary followed by the given statistics report.
     *
     * @param result      the result to summarize
     * @param statsReport a pre-rendered statistics report, may be empty
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    public Path exportSummary(SimulationResult result, String statsReport) throws IOException {
        Path path = target("summary", "txt");
        StringBuilder sb = new StringBuilder();
        sb.append("AUCTION SIMULATION SUMMARY\n");
        sb.append("=".repeat(56)).append("\n\n");
        sb.append("Generated: ").append(LocalDateTime.now(clock).format(REPORT_TIMESTAMP)).append("\n\n");

        sb.append("Timing:\n");
        sb.append("   |- Start:    ").append(result.startTime()).append('\n');
        sb.append("   |- End:      ").append(result.endTime()).append('\n');
        sb.append(String.format(Locale.ROOT, "   `- Duration: %d ms%n%n", result.totalDuration().toMillis()));

        sb.append("Overview:\n");
        sb.append(String.format(Locale.ROOT, "   |- Total Auctions: %d%n", result.totalAuctions()));
        sb.append(String.format(Locale.ROOT, "   |- Successful:     %d%n", result.successfulAuctions()));
        sb.append(String.format(Locale.ROOT, "   |- Failed:         %d%n", result.failedAuctions()));
        sb.append(String.format(Locale.ROOT, "   `- Total Bids:     %d%n", result.totalBids()));

        if (statsReport != null && !statsReport.isEmpty()) {
            sb.append(statsReport);
        }
        Files.writeString(path, sb.toString(), StandardCharsets.UTF_8);
        logger.info("Exported summary to {}", path);
        return path;
    }

    /**
     * Writes the resource usage report.
     *
     * @param usage sampled resource usage
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    public Path exportResourceMetrics(ResourceUsage usage) throws IOException {
        Path path = target("resources", "txt");
        Files.writeString(path, ResourceMonitor.formatReport(usage), StandardCharsets.UTF_8);
        logger.info("Exported resource metrics to {}", path);
        return path;
    }

    static final class InstantAdapter extends TypeAdapter<Instant> {
        @Override
        public void write(JsonWriter out, Instant value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public Instant read(JsonReader in) throws IOException {
            return Instant.parse(in.nextString());
        }
    }

    static final class DurationAdapter extends TypeAdapter<Duration> {
        @Override
        public void write(JsonWriter out, Duration value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public Duration read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NUMBER) {
                return Duration.ofMillis(in.nextLong());
            }
            return Duration.parse(in.nextString());
        }
    }
}
