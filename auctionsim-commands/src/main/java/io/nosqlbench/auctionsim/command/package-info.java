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
/// The `auctionsim` command line
///
/// [CMD_auctionsim] is the entry point. Each subcommand lives in its own package and shares
/// option mixins from `command.common`:
///
/// - `simulate` runs a simulation, prints the console report and exports result files
/// - `config` prints, and optionally saves, the effective configuration
///
/// Exit codes are 0 for success, 1 for an invalid configuration and 2 for runtime or I/O errors.
package io.nosqlbench.auctionsim.command;
