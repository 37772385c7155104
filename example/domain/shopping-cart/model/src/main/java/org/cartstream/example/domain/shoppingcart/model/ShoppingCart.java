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

import java.time.Instant;

/**
 * The state of a shopping cart as rebuilt from its events. {@link Confirmed} and {@link Cancelled} are terminal.
 */
public sealed interface ShoppingCart {

    static ShoppingCart absent() {
        return Absent.INSTANCE;
    }

    /**
     * No event has been written for the shopping cart
     */
    final class Absent implements ShoppingCart {
        static final Absent INSTANCE = new Absent();

        private Absent() {
        }

        @Override
        public String toString() {
            return "Absent";
        }
    }

    record Opened(String shoppingCartId, String customerId, ProductItems items, Instant openedAt) implements ShoppingCart {
    }

    record Confirmed(String shoppingCartId, String customerId, ProductItems items, Instant openedAt, Instant confirmedAt) implements ShoppingCart {
    }

    record Cancelled(String shoppingCartId, String customerId, ProductItems items, Instant openedAt, Instant cancelledAt) implements ShoppingCart {
    }
}
