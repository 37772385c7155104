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


package org.cartstream.dsl.view;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayNameGeneration(ReplaceUnderscores.class)
class MaterializedViewTest {

    record Deposited(String account, int amount) {
    }

    // The balance is created by the first deposit, negative deposits don't concern the view
    private final View<Integer, Deposited> balance = View.create(null, (state, event) -> {
        if (event.amount() < 0) {
            return state;
        }
        return state == null ? event.amount() : state + event.amount();
    });

    @Test
    void view_evolves_from_absent_state() {
        assertThat(balance.evolve(List.of(new Deposited("a", 1), new Deposited("a", 2)))).isEqualTo(3);
        assertThat(balance.evolve(List.of())).isNull();
    }

    @Test
    void materialized_view_stores_one_document_per_id() {
        // Given
        InMemoryViewStateRepository<Integer, String> repository = new InMemoryViewStateRepository<>();
        MaterializedView<Deposited> materializedView = MaterializedView.create(Deposited::account, balance, repository);

        // When
        materializedView.update(new Deposited("a", 5));
        materializedView.update(new Deposited("b", 1));
        materializedView.update(new Deposited("a", 5));

        // Then
        assertThat(repository.findById("a")).contains(10);
        assertThat(repository.findById("b")).contains(1);
    }

    @Test
    void materialized_view_doesnt_create_documents_for_events_that_dont_concern_it() {
        // Given
        InMemoryViewStateRepository<Integer, String> repository = new InMemoryViewStateRepository<>();
        MaterializedView<Deposited> materializedView = MaterializedView.create(Deposited::account, balance, repository);

        // When
        materializedView.update(new Deposited("a", -1));

        // Then
        assertThat(repository.findById("a")).isEmpty();
        assertThat(repository.findAll()).isEmpty();
    }

    @Test
    void events_without_an_id_are_ignored() {
        // Given
        InMemoryViewStateRepository<Integer, String> repository = new InMemoryViewStateRepository<>();
        MaterializedView<Deposited> materializedView = MaterializedView.create(__ -> null, balance, repository);

        // When
        materializedView.update(new Deposited("a", 1));

        // Then
        assertThat(repository.findAll()).isEmpty();
    }

    @Test
    void default_update_skips_saving_unchanged_state() {
        // Given
        Map<String, Integer> saved = new HashMap<>();
        AtomicInteger saves = new AtomicInteger();
        ViewStateRepository<Integer, String> repository = new ViewStateRepository<>() {
            @Override
            public Optional<Integer> findById(String id) {
                return Optional.ofNullable(saved.get(id));
            }

            @Override
            public void save(String id, Integer state) {
                saves.incrementAndGet();
                saved.put(id, state);
            }
        };
        MaterializedView<Deposited> materializedView = MaterializedView.create(Deposited::account, balance, repository);

        // When
        materializedView.update(new Deposited("a", 2));
        materializedView.update(new Deposited("a", -2));

        // Then
        assertThat(saved).containsEntry("a", 2);
        assertThat(saves).hasValue(1);
    }
}
