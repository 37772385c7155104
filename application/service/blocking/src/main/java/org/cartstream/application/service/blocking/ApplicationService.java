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


package org.cartstream.application.service.blocking;

import org.cartstream.eventstore.api.EventStoreException;
import org.cartstream.eventstore.api.WriteConditionNotFulfilledException;
import org.cartstream.eventstore.api.WriteResult;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.function.Consumer;

/**
 * An application service handles one command for one stream at a time: it loads the events of the stream, rebuilds the current state,
 * lets the domain model decide and writes the resulting event under optimistic concurrency control. Nothing is retried, a conflicting
 * write is reported to the caller.
 *
 * @param <C> The type of the commands
 * @param <E> The type of your domain events
 */
public interface ApplicationService<C, E> {

    /**
     * Handle {@code command} for the stream {@code streamId}, then execute {@code sideEffect} synchronously with the new events
     * <i>after</i> they have been written to the event store.
     *
     * @param streamId        The id of the stream to load events from and also write the new event to.
     * @param command         The command to handle
     * @param expectedVersion The version the caller expects the stream to have. If {@code null}, the version of the stream when it was read is used.
     * @param sideEffect      Side effect executed after the new events have been written, may be {@code null}
     * @return The result of the write. Its stream version is the version to pass as {@code expectedVersion} in the next call.
     * @throws WriteConditionNotFulfilledException If the stream doesn't have the expected version when the events are written
     * @throws EventStoreException                 If the events couldn't be stored
     */
    WriteResult execute(String streamId, C command, @Nullable Long expectedVersion, @Nullable Consumer<List<E>> sideEffect);

    default WriteResult execute(String streamId, C command, @Nullable Long expectedVersion) {
        return execute(streamId, command, expectedVersion, null);
    }

    default WriteResult execute(String streamId, C command) {
        return execute(streamId, command, null, null);
    }

    default WriteResult execute(String streamId, C command, Consumer<List<E>> sideEffect) {
        return execute(streamId, command, null, sideEffect);
    }
}
