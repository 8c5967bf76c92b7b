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

import io.nosqlbench.auctionsim.model.AuctionItem;
import io.nosqlbench.auctionsim.util.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

/// Generates auction items with randomized attributes.
///
/// Thread-safe: the single random source is guarded by a lock, so concurrent callers each get a
/// whole item drawn from one consistent stretch of the stream.
public class ItemGenerator {

    static final List<String> CATEGORIES =
        List.of("Electronics", "Art", "Collectibles", "Jewelry", "Furniture", "Books", "Clothing");
    static final List<String> BRANDS =
        List.of("Apple", "Samsung", "Sony", "Nike", "Canon", "Rolex", "Generic");
    static final List<String> CONDITIONS = List.of("New", "Like New", "Used", "Refurbished", "Fair");
    static final List<String> COLORS = List.of("Black", "White", "Silver", "Gold", "Blue", "Red", "Green");
    static final List<String> SIZES = List.of("Small", "Medium", "Large", "XL", "XXL", "One Size");
    static final List<String> MATERIALS =
        List.of("Metal", "Plastic", "Wood", "Leather", "Fabric", "Glass", "Ceramic");
    static final List<String> RARITIES = List.of("Common", "Uncommon", "Rare", "Very Rare", "Ultra Rare");
    static final List<String> ORIGINS = List.of("USA", "China", "Japan", "Germany", "Italy", "France", "UK");
    static final List<String> CERTIFICATIONS =
        List.of("CE", "FCC", "ISO9001", "RoHS", "None", "UL", "Energy Star");

    static final double MIN_BASE_PRICE = 10.0d;
    static final double MAX_BASE_PRICE = 5000.0d;

    private final ReentrantLock lock = new ReentrantLock();
    private final UniformRandomProvider rng;

    /// Creates a generator with a fresh, non-reproducible seed.
    public ItemGenerator() {
        this(RandomGenerators.freshSeed());
    }

    /// @param seed seed for a reproducible item catalogue
    public ItemGenerator(long seed) {
        this.rng = RandomGenerators.create(seed);
    }

    /// Generates one item.
    ///
    /// @param id the item id, also used in its name
    /// @return a new item
    public AuctionItem generateItem(int id) {
        lock.lock();
        try {
            String category = RandomGenerators.pick(rng, CATEGORIES);
            String brand = RandomGenerators.pick(rng, BRANDS);
            String condition = RandomGenerators.pick(rng, CONDITIONS);
            String color = RandomGenerators.pick(rng, COLORS);
            String size = RandomGenerators.pick(rng, SIZES);
            double weight = RandomGenerators.uniformDouble(rng, 0.1d, 50.0d);
            String material = RandomGenerators.pick(rng, MATERIALS);
            int yearMade = RandomGenerators.uniformInt(rng, 2010, 2024);
            String origin = RandomGenerators.pick(rng, ORIGINS);
            String rarity = RandomGenerators.pick(rng, RARITIES);
            double basePrice = RandomGenerators.uniformDouble(rng, MIN_BASE_PRICE, MAX_BASE_PRICE);
            int warrantyMonths = RandomGenerators.uniformInt(rng, 0, 36);
            double shipWeight = RandomGenerators.uniformDouble(rng, 0.2d, 55.0d);
            String dimensions = String.format(Locale.ROOT, "%.1fx%.1fx%.1f",
                RandomGenerators.uniformDouble(rng, 5.0d, 100.0d),
                RandomGenerators.uniformDouble(rng, 5.0d, 100.0d),
                RandomGenerators.uniformDouble(rng, 5.0d, 100.0d));
            String certification = RandomGenerators.pick(rng, CERTIFICATIONS);
            double rating = RandomGenerators.uniformDouble(rng, 3.0d, 10.0d);

            return new AuctionItem(
                id,
                brand + " " + category + " " + id,
                category,
                brand,
                condition,
                color,
                size,
                weight,
                material,
                yearMade,
                origin,
                rarity,
                basePrice,
                "High quality " + category + " from " + brand,
                "Premium " + category + " with excellent quality",
                warrantyMonths,
                shipWeight,
                dimensions,
                certification,
                rating
            );
        } finally {
            lock.unlock();
        }
    }

    /// Generates `count` items with ids `1..count`.
    public List<AuctionItem> generateItems(int count) {
        List<AuctionItem> items = new ArrayList<>(count);
        for (int id = 1; id <= count; id++) {
            items.add(generateItem(id));
        }
        return items;
    }
}
