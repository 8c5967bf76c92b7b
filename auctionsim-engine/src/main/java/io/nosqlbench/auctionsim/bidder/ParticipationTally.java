package io.nosqlbench.auctionsim.bidder;

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

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counts of {@link ParticipationOutcome}s over one bidder fan-out.
 *
 * <p>A bid counted as {@link ParticipationOutcome#SUBMITTED} reached an auction's inbound
 * buffer. It may still have been dropped if the auction was already draining, so
 * {@link #getSubmitted()} is an upper bound on the bids the auctions recorded.</p>
 */
public final class ParticipationTally {

    private final Map<ParticipationOutcome, AtomicLong> counts = new EnumMap<>(ParticipationOutcome.class);
    private final AtomicLong pairings = new AtomicLong(0);

    public ParticipationTally() {
        for (ParticipationOutcome outcome : ParticipationOutcome.values()) {
            counts.put(outcome, new AtomicLong(0));
        }
    }

    void record(ParticipationOutcome outcome) {
        counts.get(outcome).incrementAndGet();
        pairings.incrementAndGet();
    }

    /**
     * @param outcome the outcome to count
     * @return the number of pairings that ended with {@code outcome}
     */
    public long count(ParticipationOutcome outcome) {
        return counts.get(outcome).get();
    }

    /**
     * @return the number of pairings recorded
     */
    public long getPairings() {
        return pairings.get();
    }

    public long getSubmitted() {
        return count(ParticipationOutcome.SUBMITTED);
    }

    public long getAbandoned() {
        return count(ParticipationOutcome.ABANDONED_THINKING) + count(ParticipationOutcome.ABANDONED_SENDING);
    }

    @Override
    public String toString() {
        return String.format(
            "ParticipationTally[pairings=%d, submitted=%d, not_interested=%d, abandoned_thinking=%d, abandoned_sending=%d]",
            getPairings(), getSubmitted(), count(ParticipationOutcome.NOT_INTERESTED),
            count(ParticipationOutcome.ABANDONED_THINKING), count(ParticipationOutcome.ABANDONED_SENDING)
        );
    }
}
