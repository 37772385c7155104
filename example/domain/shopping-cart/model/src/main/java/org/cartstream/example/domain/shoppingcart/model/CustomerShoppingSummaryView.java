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

import org.cartstream.dsl.view.View;
import org.cartstream.example.domain.shoppingcart.model.CustomerShoppingSummary.CartOverview;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent.ProductItemAddedToShoppingCart;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent.ProductItemRemovedFromShoppingCart;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent.ShoppingCartCancelled;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent.ShoppingCartConfirmed;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent.ShoppingCartOpened;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

import static org.cartstream.example.domain.shoppingcart.model.ShoppingCartStatus.CANCELLED;
import static org.cartstream.example.domain.shoppingcart.model.ShoppingCartStatus.CONFIRMED;
import static org.cartstream.example.domain.shoppingcart.model.ShoppingCartStatus.OPENED;

/**
 * Folds the events of all shopping carts of one customer into a {@link CustomerShoppingSummary}. The summary is created by the first
 * {@link ShoppingCartOpened} event of the customer. Events of carts that the summary doesn't track leave it unchanged.
 * <p>
 * Applying the same event twice counts it twice.
 */
public class CustomerShoppingSummaryView implements View<CustomerShoppingSummary, ShoppingCartEvent> {

    @Override
    public @Nullable CustomerShoppingSummary initialState() {
        return null;
    }

    @Override
    public @Nullable CustomerShoppingSummary evolve(@Nullable CustomerShoppingSummary summary, ShoppingCartEvent event) {
        if (event instanceof ShoppingCartOpened opened) {
            return open(summary, opened);
        } else if (summary == null || summary.cart(event.shoppingCartId()).isEmpty()) {
            return summary;
        }

        if (event instanceof ProductItemAddedToShoppingCart added) {
            return updateCart(summary, event, cart -> new CartOverview(cart.shoppingCartId(), cart.status(), cart.items().add(added.productItem()), cart.openedAt()),
                    0, 0, 0, BigDecimal.ZERO);
        } else if (event instanceof ProductItemRemovedFromShoppingCart removed) {
            return updateCart(summary, event, cart -> new CartOverview(cart.shoppingCartId(), cart.status(), cart.items().remove(removed.productItem()), cart.openedAt()),
                    0, 0, 0, BigDecimal.ZERO);
        } else if (event instanceof ShoppingCartConfirmed) {
            CartOverview cart = summary.cart(event.shoppingCartId()).get();
            return updateCart(summary, event, c -> new CartOverview(c.shoppingCartId(), CONFIRMED, c.items(), c.openedAt()),
                    -1, 1, 0, cart.totalAmount());
        } else if (event instanceof ShoppingCartCancelled) {
            return updateCart(summary, event, c -> new CartOverview(c.shoppingCartId(), CANCELLED, c.items(), c.openedAt()),
                    -1, 0, 1, BigDecimal.ZERO);
        }
        return summary;
    }

    private static CustomerShoppingSummary open(@Nullable CustomerShoppingSummary summary, ShoppingCartOpened opened) {
        if (summary == null) {
            summary = new CustomerShoppingSummary(opened.customerId(), 0, 0, 0, 0, BigDecimal.ZERO, opened.openedAt(), List.of());
        } else if (summary.cart(opened.shoppingCartId()).isPresent()) {
            return summary;
        }
        // Carts are kept in the order they were opened, regardless of the order the streams are folded in
        List<CartOverview> carts = new ArrayList<>(summary.carts());
        int index = carts.size();
        while (index > 0 && carts.get(index - 1).openedAt().isAfter(opened.openedAt())) {
            index--;
        }
        carts.add(index, new CartOverview(opened.shoppingCartId(), OPENED, ProductItems.empty(), opened.openedAt()));
        return new CustomerShoppingSummary(summary.customerId(), summary.totalCarts() + 1, summary.activeCartsCount() + 1, summary.confirmedCartsCount(),
                summary.cancelledCartsCount(), summary.totalSpent(), latest(summary.lastActivityAt(), opened.openedAt()), carts);
    }

    private static CustomerShoppingSummary updateCart(CustomerShoppingSummary summary, ShoppingCartEvent event, UnaryOperator<CartOverview> fn,
                                                      int activeDelta, int confirmedDelta, int cancelledDelta, BigDecimal spent) {
        List<CartOverview> carts = new ArrayList<>(summary.carts().size());
        for (CartOverview cart : summary.carts()) {
            carts.add(cart.shoppingCartId().equals(event.shoppingCartId()) ? fn.apply(cart) : cart);
        }
        return new CustomerShoppingSummary(summary.customerId(), summary.totalCarts(), summary.activeCartsCount() + activeDelta,
                summary.confirmedCartsCount() + confirmedDelta, summary.cancelledCartsCount() + cancelledDelta, summary.totalSpent().add(spent),
                latest(summary.lastActivityAt(), event.timestamp()), carts);
    }

    private static Instant latest(Instant first, Instant second) {
        return second.isAfter(first) ? second : first;
    }
}
