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

/**
 * Lifecycle of an {@link Auction}.
 *
 * <p>State Transitions:
 * <ul>
 *   <li><strong>COLLECTING → DRAINING:</strong> the bidding window closed, by timeout or by an
 *       explicit {@link Auction#close()}</li>
 *   <li><strong>DRAINING → RESOLVED:</strong> already-buffered bids were drained and the winner
 *       was determined</li>
 * </ul>
 *
 * <p>{@link #RESOLVED} is terminal. Only the thread running the auction moves it forward.
 */
public enum AuctionState {
    /** Accepting bids from the inbound buffer. Initial state. */
    COLLECTING,
    /** Window closed; taking only bids that are already buffered, without waiting. */
    DRAINING,
    /** Result produced. Terminal; the bid list is read-only from here on. */
    RESOLVED;

    public boolean acceptsBids() {
        return this != RESOLVED;
    }
}
