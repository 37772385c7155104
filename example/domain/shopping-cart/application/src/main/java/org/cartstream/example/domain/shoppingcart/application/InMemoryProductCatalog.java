/*
 * Copyright 2024 The CartStream Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.cartstream.example.domain.shoppingcart.application;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A fixed product catalog kept in memory.
 */
public class InMemoryProductCatalog implements ProductPriceLookup {
    private final Map<String, BigDecimal> prices;

    public InMemoryProductCatalog(Map<String, BigDecimal> prices) {
        requireNonNull(prices, "prices cannot be null");
        this.prices = Collections.unmodifiableMap(new LinkedHashMap<>(prices));
    }

    /**
     * @return A catalog with the sample products {@code product-001} to {@code product-005}
     */
    public static InMemoryProductCatalog sampleCatalog() {
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        prices.put("product-001", new BigDecimal("29.99"));
        prices.put("product-002", new BigDecimal("49.99"));
        prices.put("product-003", new BigDecimal("19.99"));
        prices.put("product-004", new BigDecimal("99.99"));
        prices.put("product-005", new BigDecimal("149.99"));
        return new InMemoryProductCatalog(prices);
    }

    @Override
    public Optional<BigDecimal> priceOf(String productId) {
        return Optional.ofNullable(prices.get(productId));
    }
}
