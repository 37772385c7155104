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
 * The events of a shopping cart. The simple class name of each event is used as its cloud event type, so renaming an event
 * breaks already persisted streams.
 */
public sealed interface ShoppingCartEvent {
    String shoppingCartId();

    /**
     * @return When the event occurred
     */
    Instant timestamp();

    record ShoppingCartOpened(String shoppingCartId, String customerId, Instant openedAt) implements ShoppingCartEvent {
        @Override
        public Instant timestamp() {
            return openedAt;
        }
    }

    record ProductItemAddedToShoppingCart(String shoppingCartId, PricedProductItem productItem, Instant addedAt) implements ShoppingCartEvent {
        @Override
        public Instant timestamp() {
            return addedAt;
        }
    }

    record ProductItemRemovedFromShoppingCart(String shoppingCartId, ProductItem productItem, Instant removedAt) implements ShoppingCartEvent {
        @Override
        public Instant timestamp() {
            return removedAt;
        }
    }

    record ShoppingCartConfirmed(String shoppingCartId, Instant confirmedAt) implements ShoppingCartEvent {
        @Override
        public Instant timestamp() {
            return confirmedAt;
        }
    }

    record ShoppingCartCancelled(String shoppingCartId, Instant cancelledAt) implements ShoppingCartEvent {
        @Override
        public Instant timestamp() {
            return cancelledAt;
        }
    }
}
