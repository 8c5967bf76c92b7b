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

/// How one (bidder, auction) pairing ended. None of these is an error.
public enum ParticipationOutcome {
    /// The interest draw failed; nothing else happened.
    NOT_INTERESTED,
    /// The window closed while the bidder was thinking.
    ABANDONED_THINKING,
    /// The window closed, or the auction resolved, while the bid was being handed over.
    ABANDONED_SENDING,
    /// The bid entered the auction's inbound buffer.
    SUBMITTED;

    public boolean isAbandoned() {
        return this == ABANDONED_THINKING || this == ABANDONED_SENDING;
    }
}
