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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

import static java.util.Objects.requireNonNull;

/**
 * A thread-safe {@link ViewStateRepository} that keeps the view state in memory. {@link #update(Object, UnaryOperator)} is atomic per id.
 */
public class InMemoryViewStateRepository<S, ID> implements ViewStateRepository<S, ID> {
    private final ConcurrentMap<ID, S> states = new ConcurrentHashMap<>();

    @Override
    public Optional<@NonNull S> findById(@NonNull ID id) {
        requireNonNull(id, "id cannot be null");
        return Optional.ofNullable(states.get(id));
    }

    @Override
    public void save(@NonNull ID id, @NonNull S state) {
        requireNonNull(id, "id cannot be null");
        requireNonNull(state, "state cannot be null");
        states.put(id, state);
    }

    @Override
    public void update(@NonNull ID id, UnaryOperator<@Nullable S> fn) {
        requireNonNull(id, "id cannot be null");
        states.compute(id, (__, currentState) -> {
            S updatedState = fn.apply(currentState);
            return updatedState == null ? currentState : updatedState;
        });
    }

    /**
     * @return A snapshot of all view states
     */
    public List<S> findAll() {
        Collection<S> values = states.values();
        return List.copyOf(values);
    }

    public void deleteAll() {
        states.clear();
    }
}
