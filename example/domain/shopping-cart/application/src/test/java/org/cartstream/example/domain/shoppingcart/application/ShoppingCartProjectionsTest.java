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
import org.cartstream.eventstore.api.blocking.EventStoreQueries;
import org.cartstream.eventstore.api.blocking.EventStream;
import org.cartstream.eventstore.inmemory.InMemoryEventStore;
import org.cartstream.example.domain.shoppingcart.model.CustomerShoppingSummary;
import org.cartstream.example.domain.shoppingcart.model.CustomerShoppingSummary.CartOverview;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ShoppingCartProjectionsTest {

    private InMemoryEventStore eventStore;
    private ShoppingCarts shoppingCarts;

    @BeforeEach
    void create_event_store() {
        eventStore = new InMemoryEventStore();
        AtomicInteger ids = new AtomicInteger();
        shoppingCarts = new ShoppingCarts(eventStore, InMemoryProductCatalog.sampleCatalog(), new TestClock(Instant.parse("2024-05-01T10:00:00Z")), () -> "id-" + ids.incrementAndGet());
    }

    @Nested
    @DisplayName("invalidation")
    class Invalidation {

        @Test
        void invalidating_while_a_rebuild_is_running_causes_another_rebuild_on_the_next_query() throws Exception {
            // Given
            shoppingCarts.openShoppingCart("customer-1");
            PausingEventStoreQueries queries = new PausingEventStoreQueries(eventStore);
            ShoppingCartProjections projections = new ShoppingCartProjections(queries, ShoppingCarts.cloudEventConverter(ShoppingCarts.objectMapper()));

            Thread rebuild = new Thread(projections::rebuild);
            rebuild.start();
            assertThat(queries.streamsRead.await(5, SECONDS)).isTrue();

            // When
            shoppingCarts.openShoppingCart("customer-1");
            Thread invalidate = new Thread(projections::invalidate);
            invalidate.start();
            await().atMost(5, SECONDS).until(() -> invalidate.getState() == Thread.State.WAITING);
            queries.resume.countDown();
            rebuild.join(TimeUnit.SECONDS.toMillis(5));
            invalidate.join(TimeUnit.SECONDS.toMillis(5));

            // Then
            assertThat(projections.customerShoppingSummary("customer-1"))
                    .map(CustomerShoppingSummary::carts)
                    .hasValueSatisfying(carts -> assertThat(carts).extracting(CartOverview::shoppingCartId).containsExactlyInAnyOrder("id-1", "id-2"));
        }

        @Test
        void invalidated_summaries_are_rebuilt_from_the_event_store_on_the_next_query() {
            // Given
            shoppingCarts.openShoppingCart("customer-1");
            ShoppingCartProjections projections = new ShoppingCartProjections(eventStore, ShoppingCarts.cloudEventConverter(ShoppingCarts.objectMapper()));
            projections.rebuild();
            shoppingCarts.openShoppingCart("customer-1");

            // When
            projections.invalidate();

            // Then
            assertThat(projections.customerShoppingSummary("customer-1"))
                    .map(CustomerShoppingSummary::carts)
                    .hasValueSatisfying(carts -> assertThat(carts).hasSize(2));
        }
    }

    // Holds the first readAll() after the streams are read until resumed
    private static class PausingEventStoreQueries implements EventStoreQueries {
        private final EventStoreQueries delegate;
        private final AtomicBoolean paused = new AtomicBoolean();
        final CountDownLatch streamsRead = new CountDownLatch(1);
        final CountDownLatch resume = new CountDownLatch(1);

        PausingEventStoreQueries(EventStoreQueries delegate) {
            this.delegate = delegate;
        }

        @Override
        public Stream<String> streamIds() {
            return delegate.streamIds();
        }

        @Override
        public EventStream<CloudEvent> read(String streamId, int skip, int limit) {
            return delegate.read(streamId, skip, limit);
        }

        @Override
        public Stream<EventStream<CloudEvent>> readAll() {
            List<EventStream<CloudEvent>> eventStreams = delegate.readAll().toList();
            if (paused.compareAndSet(false, true)) {
                streamsRead.countDown();
                try {
                    resume.await(5, SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }
            return eventStreams.stream();
        }
    }
}
