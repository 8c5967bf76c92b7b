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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of one auction, produced exactly once when the auction resolves.
 *
 * <p>A result has a winning bid if and only if its status is {@link AuctionStatus#COMPLETED},
 * which in turn requires at least one received bid. {@link AuctionStatus#NO_BIDS} always comes
 * with a zero bid count and no winner. The canonical constructor rejects any other
 * combination.</p>
 *
 * @param auctionId  the auction id
 * @param item       the item that was auctioned
 * @param totalBids  number of bids the auction received before it resolved
 * @param winningBid the winning bid, or null when there were no bids
 * @param status     terminal status
 * @param startTime  when the auction started collecting bids
 * @param endTime    when the auction stopped collecting bids
 * @param duration   {@code endTime - startTime}
 */
public record AuctionResult(
    int auctionId,
    AuctionItem item,
    int totalBids,
    Bid winningBid,
    AuctionStatus status,
    Instant startTime,
    Instant endTime,
    Duration duration
) {

    public AuctionResult {
        Objects.requireNonNull(item, "item");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(endTime, "endTime");
        Objects.requireNonNull(duration, "duration");
        if (totalBids < 0) {
            throw new IllegalArgumentException("total bids must not be negative, got " + totalBids);
        }
        switch (status) {
            case COMPLETED:
                if (winningBid == null || totalBids < 1) {
                    throw new IllegalArgumentException("auction #" + auctionId
                        + " is completed but has winner=" + winningBid + " and " + totalBids + " bids");
                }
                break;
            case NO_BIDS:
                if (winningBid != null || totalBids != 0) {
                    throw new IllegalArgumentException("auction #" + auctionId
                        + " has no_bids status but has winner=" + winningBid + " and " + totalBids + " bids");
                }
                break;
            default:
                throw new IllegalArgumentException("unknown status " + status);
        }
    }

    /**
     * Builds a result, deriving the status from whether a winner is present.
     *
     * @param auctionId the auction id
     * @param item      the auctioned item
     * @param totalBids number of received bids
     * @param winner    the winning bid, if any
     * @param startTime collection start
     * @param endTime   collection end
     * @return the result
     */
    public static AuctionResult of(int auctionId, AuctionItem item, int totalBids, Optional<Bid> winner,
                                   Instant startTime, Instant endTime) {
        AuctionStatus status = winner.isPresent() ? AuctionStatus.COMPLETED : AuctionStatus.NO_BIDS;
        return new AuctionResult(auctionId, item, totalBids, winner.orElse(null), status,
            startTime, endTime, Duration.between(startTime, endTime));
    }

    /**
     * @return the winning bid, empty when the auction received no bids
     */
    public Optional<Bid> winner() {
        return Optional.ofNullable(winningBid);
    }

    /**
     * @return true when the auction completed with a winner
     */
    public boolean isSuccessful() {
        return status == AuctionStatus.COMPLETED && winningBid != null;
    }
}
