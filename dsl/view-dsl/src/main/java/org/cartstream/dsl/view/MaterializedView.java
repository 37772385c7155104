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

import org.jspecify.annotations.Nullable;

import java.util.function.Function;

/**
 * A materialized view combines a {@link View} and a {@link ViewStateRepository} to make updates from events in a convenient manner.
 * <p>
 * Updates are not idempotent, each event must be applied exactly once and in the order it was written.
 */
public interface MaterializedView<E> {
    void update(E event);

    /**
     * Create a materialized view where the id of the view document is derived from each event. Events for which {@code idMapper}
     * returns {@code null} are ignored, as are events after which the view is still absent or unchanged.
     */
    static <S, E, ID> MaterializedView<E> create(Function<E, @Nullable ID> idMapper, View<S, E> view, ViewStateRepository<S, ID> repository) {
        return event -> {
            ID id = idMapper.apply(event);
            if (id != null) {
                repository.update(id, currentState -> view.evolve(currentState == null ? view.initialState() : currentState, event));
            }
        };
    }
}
