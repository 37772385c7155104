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

import java.math.BigDecimal;

import static java.util.Objects.requireNonNull;

/**
 * A quantity of a product together with the name and unit price it had when it was added to a shopping cart.
 */
public record PricedProductItem(String productId, String productName, int quantity, BigDecimal unitPrice) {
    public PricedProductItem {
        requireNonNull(productId, "productId cannot be null");
        requireNonNull(productName, "productName cannot be null");
        requireNonNull(unitPrice, "unitPrice cannot be null");
        if (productId.isBlank()) {
            throw new IllegalArgumentException("productId cannot be blank");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive but was " + quantity);
        }
        if (unitPrice.signum() < 0) {
            throw new IllegalArgumentException("unitPrice cannot be negative but was " + unitPrice);
        }
    }

    public BigDecimal totalPrice() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }

    PricedProductItem withQuantity(int quantity) {
        return new PricedProductItem(productId, productName, quantity, unitPrice);
    }
}
