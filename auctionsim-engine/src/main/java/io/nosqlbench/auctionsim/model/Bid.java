package io.nosqlbench.auctionsim.model;

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

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * A sealed bid placed by one bidder on one auction. Bids are created at the moment a bidder
 * decides to submit and are handed over to the auction through its inbound bid buffer.
 *
 * @param bidderId  the bidder that placed the bid
 * @param auctionId the auction the bid is for
 * @param amount    the offered amount
 * @param timestamp when the bid was created
 */
public record Bid(int bidderId, int auctionId, double amount, Instant timestamp) {

    /**
     * Ordering in which the first element is the winning bid: highest amount first, and among
     * equal amounts the earliest timestamp first.
     */
    public static final Comparator<Bid> WINNING_ORDER =
        Comparator.comparingDouble(Bid::amount).reversed()
            .thenComparing(Bid::timestamp);

    public Bid {
        Objects.requireNonNull(timestamp, "timestamp");
        if (Double.isNaN(amount)) {
            throw new IllegalArgumentException("bid amount must be a number");
        }
    }

    /**
     * Returns true if this bid wins over the other bid under {@link #WINNING_ORDER}.
     *
     * @param other the bid to compare with
     * @return true if this bid ranks strictly ahead of {@code other}
     */
    public boolean beats(Bid other) {
        return WINNING_ORDER.compare(this, other) < 0;
    }
}
