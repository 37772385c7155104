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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The product lines of a shopping cart, one per product id, in the order the products were first added.
 * Every line has a positive quantity. Instances are immutable.
 */
public final class ProductItems {
    private static final ProductItems EMPTY = new ProductItems(Collections.emptyMap());

    private final Map<String, PricedProductItem> items;

    private ProductItems(Map<String, PricedProductItem> items) {
        this.items = items;
    }

    public static ProductItems empty() {
        return EMPTY;
    }

    public static ProductItems of(List<PricedProductItem> items) {
        ProductItems productItems = EMPTY;
        for (PricedProductItem item : items) {
            productItems = productItems.add(item);
        }
        return productItems;
    }

    /**
     * Add {@code item}. If the product is already present the quantities are summed and the name and unit price of the existing line are kept.
     *
     * @throws ArithmeticException If the summed quantity doesn't fit in an {@code int}, see {@link #canAdd(String, int)}
     */
    public ProductItems add(PricedProductItem item) {
        requireNonNull(item, "item cannot be null");
        Map<String, PricedProductItem> copy = new LinkedHashMap<>(items);
        copy.merge(item.productId(), item, (existing, added) -> existing.withQuantity(Math.addExact(existing.quantity(), added.quantity())));
        return new ProductItems(Collections.unmodifiableMap(copy));
    }

    /**
     * Subtract the quantity of {@code item}, the line is dropped when its quantity reaches zero. Removing a product that isn't present is a no-op.
     */
    public ProductItems remove(ProductItem item) {
        requireNonNull(item, "item cannot be null");
        PricedProductItem existing = items.get(item.productId());
        if (existing == null) {
            return this;
        }
        Map<String, PricedProductItem> copy = new LinkedHashMap<>(items);
        int remaining = existing.quantity() - item.quantity();
        if (remaining <= 0) {
            copy.remove(item.productId());
        } else {
            copy.put(item.productId(), existing.withQuantity(remaining));
        }
        return new ProductItems(Collections.unmodifiableMap(copy));
    }

    /**
     * @return {@code true} if adding {@code quantity} more of {@code productId} keeps the quantity of the line within {@code Integer.MAX_VALUE}
     */
    public boolean canAdd(String productId, int quantity) {
        return quantity <= Integer.MAX_VALUE - quantityOf(productId);
    }

    public Optional<PricedProductItem> find(String productId) {
        return Optional.ofNullable(items.get(productId));
    }

    public int quantityOf(String productId) {
        return find(productId).map(PricedProductItem::quantity).orElse(0);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public BigDecimal totalAmount() {
        return items.values().stream().map(PricedProductItem::totalPrice).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public long totalItemsCount() {
        return items.values().stream().mapToLong(PricedProductItem::quantity).sum();
    }

    public List<PricedProductItem> asList() {
        return List.copyOf(items.values());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProductItems)) return false;
        ProductItems that = (ProductItems) o;
        // Insertion order is part of the value
        return Objects.equals(asList(), that.asList());
    }

    @Override
    public int hashCode() {
        return asList().hashCode();
    }

    @Override
    public String toString() {
        return "ProductItems" + items.values();
    }
}
