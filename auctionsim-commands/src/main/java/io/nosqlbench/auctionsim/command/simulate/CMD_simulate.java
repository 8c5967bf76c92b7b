package io.nosqlbench.auctionsim.command.simulate;

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

import com.google.gson.JsonParseException;
import io.nosqlbench.auctionsim.auction.AuctionManager;
import io.nosqlbench.auctionsim.command.common.ConfigFileOption;
import io.nosqlbench.auctionsim.command.common.RandomSeedOption;
import io.nosqlbench.auctionsim.command.common.SimulationOptions;
import io.nosqlbench.auctionsim.command.common.VerbosityOption;
import io.nosqlbench.auctionsim.config.InvalidConfigurationException;
import io.nosqlbench.auctionsim.config.SimulationConfig;
import io.nosqlbench.auctionsim.export.ResultExporter;
import io.nosqlbench.auctionsim.model.ResourceUsage;
import io.nosqlbench.auctionsim.model.SimulationResult;
import io.nosqlbench.auctionsim.monitor.ResourceMonitor;
import io.nosqlbench.auctionsim.report.ConsoleReport;
import io.nosqlbench.auctionsim.stats.ResultAnalyzer;
import io.nosqlbench.auctionsim.stats.Statistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/// Runs a full auction simulation and reports on it
///
/// The run proceeds in order:
///
/// 1. Load the configuration file (or defaults) and overlay command line options
/// 2. Validate the result, exiting with status 1 on any violation
/// 3. Run every auction concurrently with the bidder pool, sampling resources unless disabled
/// 4. Print results, statistics and resource usage to the console
/// 5. Export JSON, CSV, summary and resource files unless `--no-export` is given
///
/// A failed export is reported and the remaining exports still run.
@CommandLine.Command(name = "simulate",
    description = "Run concurrent sealed-bid auctions against a pool of simulated bidders")
public class CMD_simulate implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_simulate.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_INVALID_CONFIG = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Mixin
    private ConfigFileOption configFileOption = new ConfigFileOption();

    @CommandLine.Mixin
    private SimulationOptions simulationOptions = new SimulationOptions();

    @CommandLine.Mixin
    private RandomSeedOption randomSeedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Option(names = {"-o", "--output-dir"},
        description = "Directory for exported results (default: ${DEFAULT-VALUE})",
        defaultValue = "./output")
    private Path outputDir = Paths.get("./output");

    @CommandLine.Option(names = {"--no-export"}, description = "Skip writing result files")
    private boolean noExport = false;

    @Override
    public Integer call() {
        SimulationConfig config;
        try {
            verbosityOption.validate();
            config = configFileOption.load();
            simulationOptions.applyTo(config);
            randomSeedOption.applyTo(config);
            verbosityOption.applyTo(config);
            config.validate();
        } catch (InvalidConfigurationException | IllegalStateException | JsonParseException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_INVALID_CONFIG;
        } catch (IOException e) {
            logger.error("Unable to read configuration {}: {}", configFileOption.getConfigPath(), e.toString());
            return EXIT_ERROR;
        }
        VerbosityOption.configureLogging(config);

        ConsoleReport report = new ConsoleReport(verbosityOption.showNormalOutput()
            ? System.out
            : new PrintStream(OutputStream.nullOutputStream()));
        report.printBanner();
        report.printConfiguration(config);

        SimulationResult result;
        try {
            result = runSimulation(config);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Simulation interrupted");
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            logger.error("Simulation failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }

        ResultAnalyzer analyzer = new ResultAnalyzer();
        Statistics statistics = analyzer.analyze(result);
        String statisticsReport = analyzer.formatReport(statistics);

        report.printResults(result);
        report.printWinners(statistics);
        report.printStatistics(statisticsReport);
        result.resources().ifPresent(usage -> report.printResourceUsage(usage, result));

        if (!noExport) {
            exportResults(report, result, statisticsReport);
        }
        report.printFinalSummary(result, statistics, noExport ? null : outputDir);
        return EXIT_SUCCESS;
    }

    private SimulationResult runSimulation(SimulationConfig config) throws InterruptedException {
        AuctionManager manager = new AuctionManager(config);
        if (!config.getSystem().isEnableProfiling()) {
            return manager.run();
        }
        ResourceMonitor monitor = new ResourceMonitor();
        monitor.start();
        SimulationResult result;
        try {
            result = manager.run();
        } finally {
            monitor.stop();
        }
        ResourceUsage usage = monitor.getStats();
        return result.withResourceUsage(usage);
    }

    private void exportResults(ConsoleReport report, SimulationResult result, String statisticsReport) {
        ResultExporter exporter = new ResultExporter(outputDir);
        report.printExportHeader();
        try {
            report.printExported("JSON", exporter.exportToJson(result));
        } catch (IOException | RuntimeException e) {
            logger.warn("JSON export failed", e);
            report.printExportFailed("JSON", e);
        }
        try {
            report.printExported("CSV", exporter.exportToCsv(result));
        } catch (IOException | RuntimeException e) {
            logger.warn("CSV export failed", e);
            report.printExportFailed("CSV", e);
        }
        try {
            report.printExported("Summary", exporter.exportSummary(result, statisticsReport));
        } catch (IOException | RuntimeException e) {
            logger.warn("Summary export failed", e);
            report.printExportFailed("Summary", e);
        }
        if (result.resources().isPresent()) {
            try {
                report.printExported("Resources", exporter.exportResourceMetrics(result.resources().get()));
            } catch (IOException | RuntimeException e) {
                logger.warn("Resource export failed", e);
                report.printExportFailed("Resources", e);
            }
        }
    }
}
