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

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Read model of a single shopping cart.
 *
 * @param lastActivityAt The timestamp of the latest event of the cart
 */
public record ShoppingCartSummary(String shoppingCartId, String customerId, ShoppingCartStatus status, ProductItems items,
                                  Instant openedAt, @Nullable Instant confirmedAt, @Nullable Instant cancelledAt, Instant lastActivityAt) {

    public List<PricedProductItem> productItems() {
        return items.asList();
    }

    public BigDecimal totalAmount() {
        return items.totalAmount();
    }

    public long totalItemsCount() {
        return items.totalItemsCount();
    }
}
