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

import java.util.Arrays;
import java.util.List;
import java.util.function.BiFunction;
import java.util.stream.Stream;

/**
 * A structure for representing and updating views based on state and an event. A {@code null} state means that the view
 * doesn't exist (yet), for example before the event that creates it has been applied.
 *
 * @param <S> The type of the state that this view produces
 * @param <E> The type of the event that is used to create the state
 */
public interface View<S, E> {
    /**
     * @return The initial state, {@code null} if the view is absent until its first event
     */
    @Nullable
    S initialState();

    /**
     * Evolve state by applying the event
     *
     * @param state The current state
     * @param event The event
     * @return The evolved state. Return {@code state} itself if the event doesn't concern this view.
     */
    @Nullable
    S evolve(@Nullable S state, @NonNull E event);

    @SuppressWarnings("unchecked")
    default @Nullable S evolve(@NonNull E event, @NonNull E event2, @NonNull E... moreEvents) {
        return evolve(initialState(), Stream.concat(Stream.of(event, event2), Arrays.stream(moreEvents)));
    }

    default @Nullable S evolve(@Nullable S state, @NonNull List<E> events) {
        return evolve(state, events.stream());
    }

    /**
     * Evolve initial state from events
     *
     * @return The evolved state
     */
    default @Nullable S evolve(@NonNull List<E> events) {
        return evolve(initialState(), events.stream());
    }

    default @Nullable S evolve(@Nullable S state, @NonNull Stream<E> events) {
        // reduce doesn't accept null as identity or intermediate result
        S current = state;
        for (E event : (Iterable<E>) events.sequential()::iterator) {
            current = evolve(current, event);
        }
        return current;
    }

    default @Nullable S evolve(@NonNull Stream<E> events) {
        return evolve(initialState(), events);
    }

    static <S, E> View<S, E> create(@Nullable S initialState, @NonNull BiFunction<@Nullable S, E, @Nullable S> evolve) {
        return new View<>() {
            @Override
            public @Nullable S initialState() {
                return initialState;
            }

            @Override
            public @Nullable S evolve(@Nullable S state, @NonNull E event) {
                return evolve.apply(state, event);
            }
        };
    }
}
