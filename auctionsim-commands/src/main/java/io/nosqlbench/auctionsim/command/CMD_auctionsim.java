package io.nosqlbench.auctionsim.command;

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

import io.nosqlbench.auctionsim.command.config.CMD_config;
import io.nosqlbench.auctionsim.command.simulate.CMD_simulate;
import picocli.CommandLine;

/// Concurrent sealed-bid auction simulator
///
/// This is the top level command which serves as an entry point for all sub-commands
@CommandLine.Command(name = "auctionsim",
    mixinStandardHelpOptions = true,
    version = "auctionsim 0.1.0",
    description = "Simulate many concurrent sealed-bid auctions fed by a pool of bidders",
    subcommands = {CMD_simulate.class, CMD_config.class, CommandLine.HelpCommand.class})
public class CMD_auctionsim {

    /// run an auctionsim command
    /// @param args command line args
    public static void main(String[] args) {
        CommandLine commandLine = newCommandLine();
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /// The configured command line used by [#main(String[])].
    /// @return a new command line for the root command
    public static CommandLine newCommandLine() {
        return new CommandLine(new CMD_auctionsim())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }
}
