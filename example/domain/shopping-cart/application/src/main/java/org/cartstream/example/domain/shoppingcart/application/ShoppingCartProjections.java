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


package org.cartstream.example.domain.shoppingcart.application;

import io.cloudevents.CloudEvent;
import org.cartstream.application.converter.CloudEventConverter;
import org.cartstream.dsl.view.InMemoryViewStateRepository;
import org.cartstream.dsl.view.MaterializedView;
import org.cartstream.eventstore.api.blocking.EventStoreQueries;
import org.cartstream.eventstore.api.blocking.EventStream;
import org.cartstream.example.domain.shoppingcart.model.CustomerShoppingSummary;
import org.cartstream.example.domain.shoppingcart.model.CustomerShoppingSummary.CartOverview;
import org.cartstream.example.domain.shoppingcart.model.CustomerShoppingSummaryView;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartEvent.ShoppingCartOpened;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartSummary;
import org.cartstream.example.domain.shoppingcart.model.ShoppingCartSummaryView;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static java.util.Objects.requireNonNull;

/**
 * Read models of shopping carts built from the event store.
 * <p>
 * Shopping cart summaries are always folded from the event streams when queried. Customer shopping summaries are materialized in memory.
 * They are rebuilt from every stream by {@link #rebuild()} and kept up to date by {@link #shoppingCartChanged(List)} after each successful write.
 * An incremental update re-folds the streams of all shopping carts of the affected customer, so updates racing each other for the same customer
 * always end up reflecting everything that was written before the last of them ran.
 * </p>
 */
public class ShoppingCartProjections {
    private static final Logger log = LoggerFactory.getLogger(ShoppingCartProjections.class);

    private static final Comparator<ShoppingCartSummary> MOST_RECENTLY_ACTIVE_FIRST =
            Comparator.comparing(ShoppingCartSummary::lastActivityAt).reversed().thenComparing(ShoppingCartSummary::shoppingCartId);

    private final EventStoreQueries eventStoreQueries;
    private final CloudEventConverter<ShoppingCartEvent> cloudEventConverter;
    private final ShoppingCartSummaryView shoppingCartSummaryView = new ShoppingCartSummaryView();
    private final CustomerShoppingSummaryView customerShoppingSummaryView = new CustomerShoppingSummaryView();
    private final InMemoryViewStateRepository<CustomerShoppingSummary, String> customerShoppingSummaries = new InMemoryViewStateRepository<>();
    private final ConcurrentMap<String, String> customerIdByShoppingCartId = new ConcurrentHashMap<>();
    // Incremental updates hold the read lock, a rebuild holds the write lock
    private final ReadWriteLock rebuildLock = new ReentrantReadWriteLock();
    private final AtomicBoolean stale = new AtomicBoolean(true);

    public ShoppingCartProjections(EventStoreQueries eventStoreQueries, CloudEventConverter<ShoppingCartEvent> cloudEventConverter) {
        requireNonNull(eventStoreQueries, EventStoreQueries.class.getSimpleName() + " cannot be null");
        requireNonNull(cloudEventConverter, CloudEventConverter.class.getSimpleName() + " cannot be null");
        this.eventStoreQueries = eventStoreQueries;
        this.cloudEventConverter = cloudEventConverter;
    }

    /**
     * @return The summary of a shopping cart and the version it was folded from, or empty if the cart has no events
     */
    public Optional<ShoppingCartDetails> shoppingCart(String shoppingCartId) {
        requireNonNull(shoppingCartId, "Shopping cart id cannot be null");
        EventStream<CloudEvent> eventStream = eventStoreQueries.read(shoppingCartId);
        return Optional.ofNullable(shoppingCartSummaryView.evolve(cloudEventConverter.toDomainEvents(eventStream.events())))
                .map(summary -> new ShoppingCartDetails(summary, eventStream.version()));
    }

    /**
     * @return The summaries of all shopping carts, the most recently active cart first
     */
    public List<ShoppingCartSummary> allShoppingCarts() {
        return eventStoreQueries.readAll()
                .map(eventStream -> shoppingCartSummaryView.evolve(cloudEventConverter.toDomainEvents(eventStream.events())))
                .filter(Objects::nonNull)
                .sorted(MOST_RECENTLY_ACTIVE_FIRST)
                .toList();
    }

    public Optional<CustomerShoppingSummary> customerShoppingSummary(String customerId) {
        requireNonNull(customerId, "Customer id cannot be null");
        if (stale.get()) {
            rebuild();
        }
        return customerShoppingSummaries.findById(customerId);
    }

    /**
     * Discard the customer shopping summaries and fold every event in the event store into new ones.
     */
    public void rebuild() {
        rebuildLock.writeLock().lock();
        try {
            customerShoppingSummaries.deleteAll();
            customerIdByShoppingCartId.clear();
            MaterializedView<ShoppingCartEvent> materializedView = MaterializedView.create(this::customerIdOf, customerShoppingSummaryView, customerShoppingSummaries);
            eventStoreQueries.readAll().forEach(eventStream -> cloudEventConverter.toDomainEvents(eventStream.events()).forEach(materializedView::update));
            stale.set(false);
            log.info("Rebuilt customer shopping summaries from {} shopping cart(s)", customerIdByShoppingCartId.size());
        } finally {
            rebuildLock.writeLock().unlock();
        }
    }

    /**
     * Mark the customer shopping summaries as outdated, they are rebuilt on the next query.
     * Waits for a rebuild in progress, which may already have read the streams this call invalidates.
     */
    public void invalidate() {
        rebuildLock.writeLock().lock();
        try {
            stale.set(true);
        } finally {
            rebuildLock.writeLock().unlock();
        }
    }

    /**
     * Update the customer shopping summaries after {@code newEvents} have been written to the event store.
     * If the update fails the summaries are invalidated and the failure is logged, the events have already been written at this point.
     */
    public void shoppingCartChanged(List<ShoppingCartEvent> newEvents) {
        requireNonNull(newEvents, "New events cannot be null");
        rebuildLock.readLock().lock();
        try {
            for (ShoppingCartEvent event : newEvents) {
                customerIdOf(event);
            }
            newEvents.stream().map(ShoppingCartEvent::shoppingCartId).distinct().forEach(this::refreshCustomerOf);
        } catch (RuntimeException e) {
            stale.set(true);
            log.error("Failed to update customer shopping summaries after events were written, they will be rebuilt on the next query", e);
        } finally {
            rebuildLock.readLock().unlock();
        }
    }

    private void refreshCustomerOf(String shoppingCartId) {
        String customerId = customerIdByShoppingCartId.get(shoppingCartId);
        if (customerId == null) {
            log.debug("Shopping cart {} was opened before the customer shopping summaries were built, rebuilding on the next query", shoppingCartId);
            stale.set(true);
            return;
        }
        customerShoppingSummaries.update(customerId, current -> {
            List<String> shoppingCartIds = new ArrayList<>();
            if (current != null) {
                current.carts().stream().map(CartOverview::shoppingCartId).forEach(shoppingCartIds::add);
            }
            if (!shoppingCartIds.contains(shoppingCartId)) {
                shoppingCartIds.add(shoppingCartId);
            }
            return summarize(shoppingCartIds);
        });
    }

    private @Nullable CustomerShoppingSummary summarize(List<String> shoppingCartIds) {
        CustomerShoppingSummary summary = customerShoppingSummaryView.initialState();
        for (String shoppingCartId : shoppingCartIds) {
            summary = customerShoppingSummaryView.evolve(summary, cloudEventConverter.toDomainEvents(eventStoreQueries.read(shoppingCartId).events()));
        }
        return summary;
    }

    private @Nullable String customerIdOf(ShoppingCartEvent event) {
        if (event instanceof ShoppingCartOpened opened) {
            customerIdByShoppingCartId.putIfAbsent(opened.shoppingCartId(), opened.customerId());
            return opened.customerId();
        }
        return customerIdByShoppingCartId.get(event.shoppingCartId());
    }
}
