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
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read model of all shopping carts of one customer.
 *
 * @param totalSpent The sum of the amounts of all confirmed carts
 * @param carts      One entry per cart in the order the carts were opened
 */
public record CustomerShoppingSummary(String customerId, int totalCarts, int activeCartsCount, int confirmedCartsCount, int cancelledCartsCount,
                                      BigDecimal totalSpent, Instant lastActivityAt, List<CartOverview> carts) {

    public CustomerShoppingSummary {
        carts = List.copyOf(carts);
    }

    public Optional<CartOverview> cart(String shoppingCartId) {
        return carts.stream().filter(cart -> cart.shoppingCartId().equals(shoppingCartId)).findFirst();
    }

    public record CartOverview(String shoppingCartId, ShoppingCartStatus status, ProductItems items, Instant openedAt) {
        public BigDecimal totalAmount() {
            return items.totalAmount();
        }
    }
}
