package io.nosqlbench.auctionsim.command.common;

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
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

import java.util.Locale;

/**
 * Shared verbosity options. {@code -v/--verbose} and {@code -q/--quiet} shift the log level
 * and console output; {@code --log-level} sets the level explicitly.
 */
public class VerbosityOption {

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output (debug logging)"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Suppress console report output and log warnings only"
    )
    private boolean quiet = false;

    @CommandLine.Option(
        names = {"--log-level"},
        description = "Log level: trace, debug, info, warn, error (default: from config)"
    )
    private String logLevel;

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public boolean showNormalOutput() {
        return !quiet;
    }

    /**
     * Validates that verbose and quiet are not both enabled.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException("Cannot specify both --verbose and --quiet options");
        }
    }

    /**
     * Overlays the requested log level onto the configuration. An explicit {@code --log-level}
     * wins over {@code -v} and {@code -q}.
     *
     * @param config the configuration to update
     */
    public void applyTo(SimulationConfig config) {
        if (logLevel != null) {
            config.getSystem().setLogLevel(logLevel.toLowerCase(Locale.ROOT));
        } else if (verbose) {
            config.getSystem().setLogLevel("debug");
        } else if (quiet) {
            config.getSystem().setLogLevel("warn");
        }
    }

    /**
     * Sets the root log level from a validated configuration.
     *
     * @param config a validated configuration
     */
    public static void configureLogging(SimulationConfig config) {
        Configurator.setRootLevel(Level.toLevel(config.getSystem().getLogLevel(), Level.INFO));
    }
}
