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
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;

/// Shared `-c/--config` option naming a JSON configuration file.
///
/// Without the option the built-in defaults are used.
public class ConfigFileOption {

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "JSON configuration file (default: built-in defaults)"
    )
    private Path configPath;

    public Path getConfigPath() {
        return configPath;
    }

    public boolean isSpecified() {
        return configPath != null;
    }

    /// Loads the named file, or the defaults when no file was named.
    ///
    /// @throws IOException if the named file is missing or unreadable
    public SimulationConfig load() throws IOException {
        if (configPath == null) {
            return SimulationConfig.defaults();
        }
        return SimulationConfig.load(configPath);
    }
}
