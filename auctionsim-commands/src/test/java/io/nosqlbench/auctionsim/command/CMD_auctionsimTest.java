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

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class CMD_auctionsimTest {

    @Test
    void testSubcommandsAreRegistered() {
        CommandLine commandLine = CMD_auctionsim.newCommandLine();
        assertThat(commandLine.getSubcommands()).containsKeys("simulate", "config", "help");
    }

    @Test
    void testUsageListsSubcommands() {
        CommandLine commandLine = CMD_auctionsim.newCommandLine();
        StringWriter out = new StringWriter();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("auctionsim").contains("simulate").contains("config");
    }

    @Test
    void testSimulateOptionsAreCaseInsensitive() {
        CommandLine commandLine = CMD_auctionsim.newCommandLine();
        CommandLine.ParseResult parsed = commandLine.parseArgs("simulate", "--AUCTIONS", "5", "--No-Export");
        assertThat(parsed.hasSubcommand()).isTrue();
        assertThat(parsed.subcommand().commandSpec().name()).isEqualTo("simulate");
        assertThat(parsed.subcommand().matchedOptions()).hasSize(2);
    }

    @Test
    void testUnknownOptionIsAUsageError() {
        CommandLine commandLine = CMD_auctionsim.newCommandLine();
        commandLine.setErr(new PrintWriter(new StringWriter()));
        assertThat(commandLine.execute("simulate", "--bogus")).isEqualTo(2);
    }
}
