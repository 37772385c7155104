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
 * The commands a shopping cart handles. Commands are never persisted.
 */
public sealed interface ShoppingCartCommand {
    String shoppingCartId();

    record OpenShoppingCart(String shoppingCartId, String customerId) implements ShoppingCartCommand {
        public OpenShoppingCart {
            requireNonNull(shoppingCartId, "shoppingCartId cannot be null");
            requireNonNull(customerId, "customerId cannot be null");
        }
    }

    record AddProductItemToShoppingCart(String shoppingCartId, PricedProductItem productItem) implements ShoppingCartCommand {
        public AddProductItemToShoppingCart {
            requireNonNull(shoppingCartId, "shoppingCartId cannot be null");
            requireNonNull(productItem, "productItem cannot be null");
        }
    }

    record RemoveProductItemFromShoppingCart(String shoppingCartId, ProductItem productItem) implements ShoppingCartCommand {
        public RemoveProductItemFromShoppingCart {
            requireNonNull(shoppingCartId, "shoppingCartId cannot be null");
            requireNonNull(productItem, "productItem cannot be null");
        }
    }

    record ConfirmShoppingCart(String shoppingCartId) implements ShoppingCartCommand {
        public ConfirmShoppingCart {
            requireNonNull(shoppingCartId, "shoppingCartId cannot be null");
        }
    }

    record CancelShoppingCart(String shoppingCartId) implements ShoppingCartCommand {
        public CancelShoppingCart {
            requireNonNull(shoppingCartId, "shoppingCartId cannot be null");
        }
    }
}
