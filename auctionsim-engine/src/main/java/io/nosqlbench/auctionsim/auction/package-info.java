/// The auction engine: the per-auction bid-collection state machine, item generation, and the
/// manager that runs a whole simulation.
///
/// ## Key Components
///
/// - {@link io.nosqlbench.auctionsim.auction.Auction}: one timed sealed-bid auction
/// - {@link io.nosqlbench.auctionsim.auction.AuctionState}: auction lifecycle
/// - {@link io.nosqlbench.auctionsim.auction.ItemGenerator}: randomized auction items
/// - {@link io.nosqlbench.auctionsim.auction.AuctionManager}: orchestration and aggregation
package io.nosqlbench.auctionsim.auction;

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
