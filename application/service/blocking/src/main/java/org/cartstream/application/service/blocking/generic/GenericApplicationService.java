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


package org.cartstream.application.service.blocking.generic;

import io.cloudevents.CloudEvent;
import org.cartstream.application.converter.CloudEventConverter;
import org.cartstream.application.service.blocking.ApplicationService;
import org.cartstream.dsl.decider.Decider;
import org.cartstream.eventstore.api.WriteResult;
import org.cartstream.eventstore.api.blocking.EventStore;
import org.cartstream.eventstore.api.blocking.EventStream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static org.cartstream.eventstore.api.WriteCondition.streamVersionEq;

/**
 * A generic application service that lets a {@link Decider} handle commands. It is stateless and can be used concurrently, the event store
 * guarantees that of two concurrent commands for the same stream with the same expected version only one is written.
 *
 * @param <C> The type of the commands
 * @param <S> The state of the decider
 * @param <E> The type of the event to store. Normally this would be your custom "DomainEvent" class.
 */
public class GenericApplicationService<C, S, E> implements ApplicationService<C, E> {
    private static final Logger log = LoggerFactory.getLogger(GenericApplicationService.class);

    private final EventStore eventStore;
    private final CloudEventConverter<E> cloudEventConverter;
    private final Decider<C, S, E> decider;

    /**
     * Create a GenericApplicationService with the supplied {@link EventStore}, {@link CloudEventConverter} and {@link Decider}.
     *
     * @param eventStore          The event store to use
     * @param cloudEventConverter The cloud event converter
     * @param decider             The decider that handles the commands
     */
    public GenericApplicationService(EventStore eventStore, CloudEventConverter<E> cloudEventConverter, Decider<C, S, E> decider) {
        if (eventStore == null) throw new IllegalArgumentException(EventStore.class.getSimpleName() + " cannot be null");
        if (cloudEventConverter == null) throw new IllegalArgumentException(CloudEventConverter.class.getSimpleName() + " cannot be null");
        if (decider == null) throw new IllegalArgumentException(Decider.class.getSimpleName() + " cannot be null");
        this.eventStore = eventStore;
        this.cloudEventConverter = cloudEventConverter;
        this.decider = decider;
    }

    @Override
    public WriteResult execute(String streamId, C command, @Nullable Long expectedVersion, @Nullable Consumer<List<E>> sideEffect) {
        Objects.requireNonNull(streamId, "Stream id cannot be null");
        Objects.requireNonNull(command, "Command cannot be null");

        // Read all events from the event store for a particular stream
        EventStream<CloudEvent> eventStream = eventStore.read(streamId);

        // Rebuild the current state and let the decider handle the command
        List<E> eventsInStream = cloudEventConverter.toDomainEvents(eventStream.events()).toList();
        Decider.Decision<S, E> decision = decider.decideOnEvents(eventsInStream, command);
        List<E> newEvents = List.of(decision.event());

        // Write the new event, conditioned on the version the caller saw (or the version that was read)
        long versionToExpect = expectedVersion == null ? eventStream.version() : expectedVersion;
        Stream<CloudEvent> newCloudEvents = cloudEventConverter.toCloudEvents(newEvents.stream());
        WriteResult writeResult = eventStore.write(streamId, streamVersionEq(versionToExpect), newCloudEvents);
        log.debug("Handled {} for stream {}, version {} -> {}", command.getClass().getSimpleName(), streamId, writeResult.getOldStreamVersion(), writeResult.getStreamVersion());

        if (sideEffect != null) {
            sideEffect.accept(newEvents);
        }
        return writeResult;
    }
}
