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

import com.google.gson.JsonParseException;
import io.nosqlbench.auctionsim.command.common.ConfigFileOption;
import io.nosqlbench.auctionsim.command.common.RandomSeedOption;
import io.nosqlbench.auctionsim.command.common.SimulationOptions;
import io.nosqlbench.auctionsim.config.InvalidConfigurationException;
import io.nosqlbench.auctionsim.config.SimulationConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Prints the effective configuration: the configuration file (or defaults) with command line
/// options applied, as JSON. With `--save` the same JSON is also written to a file, which can
/// then be passed back to `simulate --config`.
@CommandLine.Command(name = "config",
    description = "Print the effective simulation configuration as JSON")
public class CMD_config implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_config.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_INVALID_CONFIG = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Mixin
    private ConfigFileOption configFileOption = new ConfigFileOption();

    @CommandLine.Mixin
    private SimulationOptions simulationOptions = new SimulationOptions();

    @CommandLine.Mixin
    private RandomSeedOption randomSeedOption = new RandomSeedOption();

    @CommandLine.Option(names = {"--log-level"},
        description = "Log level to record in the configuration: trace, debug, info, warn, error")
    private String logLevel;

    @CommandLine.Option(names = {"--save"}, description = "Also write the configuration to this file")
    private Path savePath;

    @CommandLine.Option(names = {"-f", "--force"}, description = "Overwrite the --save file if it exists")
    private boolean force = false;

    @Override
    public Integer call() {
        SimulationConfig config;
        try {
            config = configFileOption.load();
            simulationOptions.applyTo(config);
            randomSeedOption.applyTo(config);
            if (logLevel != null) {
                config.getSystem().setLogLevel(logLevel);
            }
            config.validate();
        } catch (InvalidConfigurationException | JsonParseException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_INVALID_CONFIG;
        } catch (IOException e) {
            logger.error("Unable to read configuration {}: {}", configFileOption.getConfigPath(), e.toString());
            return EXIT_ERROR;
        }

        System.out.println(config.toJson());

        if (savePath != null) {
            if (Files.exists(savePath) && !force) {
                logger.error("Output file {} already exists. Use --force to overwrite.", savePath);
                return EXIT_ERROR;
            }
            try {
                Path parent = savePath.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                config.save(savePath);
                logger.info("Saved configuration to {}", savePath);
            } catch (IOException e) {
                logger.error("Unable to write configuration {}: {}", savePath, e.toString());
                return EXIT_ERROR;
            }
        }
        return EXIT_SUCCESS;
    }
}
