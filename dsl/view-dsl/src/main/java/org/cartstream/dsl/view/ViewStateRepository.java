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

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * An interface that finds and saves the view state.
 *
 * @param <S>  The state to store
 * @param <ID> The id that uniquely identifies the state
 */
public interface ViewStateRepository<S, ID> {
    Optional<@NonNull S> findById(@NonNull ID id);

    void save(@NonNull ID id, @NonNull S state);

    /**
     * Apply {@code fn} to the current state of {@code id} (or {@code null} if there is none) and save the result.
     * Nothing is saved if {@code fn} returns {@code null} or the current state itself. This default implementation is not atomic,
     * implementations that are used concurrently should override it.
     */
    default void update(@NonNull ID id, UnaryOperator<@Nullable S> fn) {
        S currentState = findById(id).orElse(null);
        S updatedState = fn.apply(currentState);
        if (updatedState != null && updatedState != currentState) {
            save(id, updatedState);
        }
    }
}
