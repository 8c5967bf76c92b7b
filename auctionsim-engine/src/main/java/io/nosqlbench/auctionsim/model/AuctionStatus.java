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

import com.google.gson.annotations.SerializedName;

/**
 * Terminal outcome of a resolved auction. Both values are valid terminal states; an auction
 * without bids is not a failure of the engine.
 */
public enum AuctionStatus {

    /** At least one bid was received and a winner was selected. */
    @SerializedName("completed")
    COMPLETED("completed"),

    /** No bid reached the auction before it closed. */
    @SerializedName("no_bids")
    NO_BIDS("no_bids");

    private final String label;

    AuctionStatus(String label) {
        this.label = label;
    }

    /**
     * Returns the lower-case label used in reports and exports.
     *
     * @return the status label
     */
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
