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


package org.cartstream.dsl.decider;

import org.jspecify.annotations.NonNull;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * A decider is a model that can be implemented to get a structured way to implement decision logic for a business entity (typically aggregate) or use case.
 * <p>
 * {@link #decide(Object, Object)} either accepts a command by returning exactly one new event, or rejects it by throwing an exception.
 * {@link #evolve(Object, Object)} is total: an event that doesn't apply to the given state returns the state unchanged.
 *
 * @param <C> The type of commands that the decider can handle
 * @param <S> The state that the decider work
 * @param <E> The type of events that the decider returns
 */
public interface Decider<C, S, E> {
    S initialState();

    @NonNull
    E decide(@NonNull C command, S state);

    S evolve(S state, @NonNull E event);

    default boolean isTerminal(S state) {
        return false;
    }

    /**
     * Apply {@code events} in order to {@code state}.
     */
    default S fold(S state, List<E> events) {
        requireNonNull(events, "Events cannot be null");
        for (E event : events) {
            state = evolve(state, event);
        }
        return state;
    }

    default S fold(S state, Stream<E> events) {
        requireNonNull(events, "Events cannot be null");
        return fold(state, events.toList());
    }

    /**
     * Rebuild the state from {@code events} and decide on {@code command} against it.
     *
     * @return The new event and the state after the new event has been applied
     */
    @NonNull
    default Decision<S, E> decideOnEvents(List<E> events, C command) {
        return decideOnState(fold(initialState(), events), command);
    }

    @NonNull
    default Decision<S, E> decideOnState(S state, C command) {
        requireNonNull(command, "Command cannot be null");
        E event = decide(command, state);
        requireNonNull(event, "Decider must return an event or throw");
        return new Decision<>(evolve(state, event), event);
    }

    record Decision<S, E>(S state, E event) {
    }

    static <C, S, E> Decider<C, S, E> create(S initialState, @NonNull BiFunction<C, S, E> decide, @NonNull BiFunction<S, E, S> evolve) {
        return create(initialState, decide, evolve, __ -> false);
    }

    static <C, S, E> Decider<C, S, E> create(S initialState, @NonNull BiFunction<C, S, E> decide, @NonNull BiFunction<S, E, S> evolve,
                                             @NonNull Predicate<S> isTerminal) {
        requireNonNull(decide, "decide cannot be null");
        requireNonNull(evolve, "evolve cannot be null");
        requireNonNull(isTerminal, "isTerminal cannot be null");

        return new Decider<>() {
            @Override
            public S initialState() {
                return initialState;
            }

            @NonNull
            @Override
            public E decide(@NonNull C command, S state) {
                return decide.apply(command, state);
            }

            @Override
            public S evolve(S state, @NonNull E event) {
                return evolve.apply(state, event);
            }

            @Override
            public boolean isTerminal(S state) {
                return isTerminal.test(state);
            }
        };
    }
}
