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


package org.cartstream.example.domain.shoppingcart.model;

import static java.util.Objects.requireNonNull;

/**
 * A quantity of a product, as requested when removing items from a shopping cart.
 */
public record ProductItem(String productId, int quantity) {
    public ProductItem {
        requireNonNull(productId, "productId cannot be null");
        if (productId.isBlank()) {
            throw new IllegalArgumentException("productId cannot be blank");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive but was " + quantity);
        }
    }
}
