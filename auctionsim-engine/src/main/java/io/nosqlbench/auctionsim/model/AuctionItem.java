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

/**
 * An item offered in a single auction. Items are generated once, before the auction they
 * belong to starts, and are never mutated afterwards.
 *
 * <p>The schema is fixed at twenty descriptive attributes. Only {@link #basePrice()} takes
 * part in the bidding protocol: bidders scale it by their configured multipliers to decide
 * how much to offer. Everything else is carried through to results and exports.</p>
 *
 * @param id            identifier, equal to the id of the auction that sells the item
 * @param name          display name, "&lt;brand&gt; &lt;category&gt; &lt;id&gt;" for generated items
 * @param category      category such as Electronics or Art
 * @param brand         brand name
 * @param condition     New, Used, Refurbished and so on
 * @param color         primary color
 * @param size          size label
 * @param weight        weight in kilograms
 * @param material      primary material
 * @param yearMade      manufacturing year
 * @param origin        country of origin
 * @param rarity        rarity label
 * @param basePrice     starting price that bid amounts are derived from
 * @param description   free-form description
 * @param features      key features
 * @param warrantyMonths warranty length in months
 * @param shipWeight    shipping weight in kilograms
 * @param dimensions    L x W x H in centimetres
 * @param certification certification label
 * @param rating        quality rating
 */
public record AuctionItem(
    int id,
    String name,
    String category,
    String brand,
    String condition,
    String color,
    String size,
    double weight,
    String material,
    int yearMade,
    String origin,
    String rarity,
    double basePrice,
    String description,
    String features,
    int warrantyMonths,
    double shipWeight,
    String dimensions,
    String certification,
    double rating
) {

    public AuctionItem {
        if (basePrice < 0.0d) {
            throw new IllegalArgumentException("base price must not be negative, got " + basePrice);
        }
    }

    /**
     * Creates an item with only the attributes the bidding protocol cares about. The remaining
     * descriptive attributes are left empty. Mostly useful for tests.
     *
     * @param id        the item id
     * @param name      the item name
     * @param basePrice the base price
     * @return a minimal item
     */
    public static AuctionItem of(int id, String name, double basePrice) {
        return new AuctionItem(id, name, "", "", "", "", "", 0.0d, "", 0, "", "", basePrice,
            "", "", 0, 0.0d, "", "", 0.0d);
    }
}
