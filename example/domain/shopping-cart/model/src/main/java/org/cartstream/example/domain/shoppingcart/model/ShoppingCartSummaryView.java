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
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent.ProductItemAddedToShoppingCart;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent.ProductItemRemovedFromShoppingCart;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent.ShoppingCartCancelled;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent.ShoppingCartConfirmed;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent.ShoppingCartOpened;
import org.jspecify.annotations.Nullable;

import static org.cartstream.example.domain.shoppingcart.model.ShoppingCartStatus.CANCELLED;
import static org.cartstream.example.domain.shoppingcart.model.ShoppingCartStatus.CONFIRMED;
import static org.cartstream.example.domain.shoppingcart.model.ShoppingCartStatus.OPENED;

/**
 * Folds the events of one shopping cart into a {@link ShoppingCartSummary}. The summary is absent until the cart has been opened.
 */
public class ShoppingCartSummaryView implements View<ShoppingCartSummary, ShoppingCartEvent> {

    @Override
    public @Nullable ShoppingCartSummary initialState() {
        return null;
    }

    @Override
    public @Nullable ShoppingCartSummary evolve(@Nullable ShoppingCartSummary summary, ShoppingCartEvent event) {
        if (event instanceof ShoppingCartOpened opened) {
            return summary != null ? summary : new ShoppingCartSummary(opened.shoppingCartId(), opened.customerId(), OPENED, ProductItems.empty(),
                    opened.openedAt(), null, null, opened.openedAt());
        } else if (summary == null || !summary.shoppingCartId().equals(event.shoppingCartId())) {
            return summary;
        }

        if (event instanceof ProductItemAddedToShoppingCart added) {
            return new ShoppingCartSummary(summary.shoppingCartId(), summary.customerId(), summary.status(), summary.items().add(added.productItem()),
                    summary.openedAt(), summary.confirmedAt(), summary.cancelledAt(), added.addedAt());
        } else if (event instanceof ProductItemRemovedFromShoppingCart removed) {
            return new ShoppingCartSummary(summary.shoppingCartId(), summary.customerId(), summary.status(), summary.items().remove(removed.productItem()),
                    summary.openedAt(), summary.confirmedAt(), summary.cancelledAt(), removed.removedAt());
        } else if (event instanceof ShoppingCartConfirmed confirmed) {
            return new ShoppingCartSummary(summary.shoppingCartId(), summary.customerId(), CONFIRMED, summary.items(),
                    summary.openedAt(), confirmed.confirmedAt(), null, confirmed.confirmedAt());
        } else if (event instanceof ShoppingCartCancelled cancelled) {
            return new ShoppingCartSummary(summary.shoppingCartId(), summary.customerId(), CANCELLED, summary.items(),
                    summary.openedAt(), null, cancelled.cancelledAt(), cancelled.cancelledAt());
        }
        return summary;
    }
}
