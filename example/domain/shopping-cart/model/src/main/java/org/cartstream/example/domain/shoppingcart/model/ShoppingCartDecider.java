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

import org.cartstream.dsl.decider.Decider;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCart.Absent;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCart.Cancelled;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCart.Confirmed;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCart.Opened;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartCommand.AddProductItemToShoppingCart;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartCommand.CancelShoppingCart;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartCommand.ConfirmShoppingCart;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartCommand.OpenShoppingCart;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartCommand.RemoveProductItemFromShoppingCart;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent.ProductItemAddedToShoppingCart;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent.ProductItemRemovedFromShoppingCart;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent.ShoppingCartCancelled;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent.ShoppingCartConfirmed;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent.ShoppingCartOpened;

import java.time.Clock;
import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * The decision logic of a shopping cart. All event timestamps are taken from the supplied {@link Clock}.
 */
public class ShoppingCartDecider implements Decider<ShoppingCartCommand, ShoppingCart, ShoppingCartEvent> {
    private final Clock clock;

    public ShoppingCartDecider(Clock clock) {
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.clock = clock;
    }

    @Override
    public ShoppingCart initialState() {
        return ShoppingCart.absent();
    }

    @Override
    public ShoppingCartEvent decide(ShoppingCartCommand command, ShoppingCart state) {
        String shoppingCartId = command.shoppingCartId();
        Instant now = clock.instant();

        if (command instanceof OpenShoppingCart open) {
            if (!(state instanceof Absent)) {
                throw new IllegalShoppingCartStateException(shoppingCartId, "Shopping cart already exists");
            }
            return new ShoppingCartOpened(shoppingCartId, open.customerId(), now);
        }

        if (state instanceof Absent) {
            throw new IllegalShoppingCartStateException(shoppingCartId, "Shopping cart doesn't exist");
        }

        if (command instanceof AddProductItemToShoppingCart add) {
            Opened opened = requireOpen(state, shoppingCartId, "Cannot add product to a closed shopping cart");
            PricedProductItem productItem = add.productItem();
            if (!opened.items().canAdd(productItem.productId(), productItem.quantity())) {
                throw new IllegalShoppingCartStateException(shoppingCartId, "Quantity of product " + productItem.productId() + " in shopping cart cannot exceed " + Integer.MAX_VALUE);
            }
            return new ProductItemAddedToShoppingCart(shoppingCartId, add.productItem(), now);
        } else if (command instanceof RemoveProductItemFromShoppingCart remove) {
            Opened opened = requireOpen(state, shoppingCartId, "Cannot remove product from a closed shopping cart");
            int quantityInCart = opened.items().quantityOf(remove.productItem().productId());
            if (quantityInCart == 0) {
                throw new IllegalShoppingCartStateException(shoppingCartId, "Product item not found in shopping cart");
            } else if (quantityInCart < remove.productItem().quantity()) {
                throw new IllegalShoppingCartStateException(shoppingCartId, "Cannot remove more items than available in cart");
            }
            return new ProductItemRemovedFromShoppingCart(shoppingCartId, remove.productItem(), now);
        } else if (command instanceof ConfirmShoppingCart) {
            Opened opened = requireOpen(state, shoppingCartId, "Cannot confirm a shopping cart that is not open");
            if (opened.items().isEmpty()) {
                throw new IllegalShoppingCartStateException(shoppingCartId, "Cannot confirm an empty shopping cart");
            }
            return new ShoppingCartConfirmed(shoppingCartId, now);
        } else if (command instanceof CancelShoppingCart) {
            requireOpen(state, shoppingCartId, "Cannot cancel a shopping cart that is not open");
            return new ShoppingCartCancelled(shoppingCartId, now);
        }
        throw new IllegalArgumentException("Unsupported command " + command.getClass().getName());
    }

    @Override
    public ShoppingCart evolve(ShoppingCart state, ShoppingCartEvent event) {
        if (event instanceof ShoppingCartOpened cartOpened) {
            return state instanceof Absent ? new Opened(cartOpened.shoppingCartId(), cartOpened.customerId(), ProductItems.empty(), cartOpened.openedAt()) : state;
        } else if (!(state instanceof Opened opened)) {
            return state;
        } else if (event instanceof ProductItemAddedToShoppingCart added) {
            return new Opened(opened.shoppingCartId(), opened.customerId(), opened.items().add(added.productItem()), opened.openedAt());
        } else if (event instanceof ProductItemRemovedFromShoppingCart removed) {
            return new Opened(opened.shoppingCartId(), opened.customerId(), opened.items().remove(removed.productItem()), opened.openedAt());
        } else if (event instanceof ShoppingCartConfirmed confirmed) {
            return new Confirmed(opened.shoppingCartId(), opened.customerId(), opened.items(), opened.openedAt(), confirmed.confirmedAt());
        } else if (event instanceof ShoppingCartCancelled cancelled) {
            return new Cancelled(opened.shoppingCartId(), opened.customerId(), opened.items(), opened.openedAt(), cancelled.cancelledAt());
        }
        return state;
    }

    @Override
    public boolean isTerminal(ShoppingCart state) {
        return state instanceof Confirmed || state instanceof Cancelled;
    }

    private static Opened requireOpen(ShoppingCart state, String shoppingCartId, String message) {
        if (!(state instanceof Opened opened)) {
            throw new IllegalShoppingCartStateException(shoppingCartId, message);
        }
        return opened;
    }
}
