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


package org.cartstream.eventstore.inmemory;

import io.cloudevents.CloudEvent;
import io.cloudevents.SpecVersion;
import org.cartstream.eventstore.api.WriteCondition;
import org.cartstream.eventstore.api.WriteConditionNotFulfilledException;
import org.cartstream.eventstore.api.WriteResult;
import org.cartstream.eventstore.api.blocking.EventStore;
import org.cartstream.eventstore.api.blocking.EventStoreOperations;
import org.cartstream.eventstore.api.blocking.EventStoreQueries;
import org.cartstream.eventstore.api.blocking.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;
import static org.cartstream.cloudevents.StreamCloudEventExtension.positionInStream;

/**
 * This is an {@link EventStore} that stores events in-memory. This is mainly useful for testing
 * and/or demo purposes. It also supports the {@link EventStoreOperations} and {@link EventStoreQueries} contracts.
 * <p>
 * Writes to the same stream are serialized, writes to different streams are not.
 */
public class InMemoryEventStore implements EventStore, EventStoreOperations, EventStoreQueries {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentMap<String, List<CloudEvent>> state = new ConcurrentHashMap<>();

    @Override
    public EventStream<CloudEvent> read(String streamId, int skip, int limit) {
        requireNonNull(streamId, "Stream id cannot be null");
        requireTrue(skip >= 0, "skip cannot be negative");
        requireTrue(limit >= 0, "limit cannot be negative");
        List<CloudEvent> events = state.get(streamId);
        if (events == null) {
            return new EventStreamImpl(streamId, 0, Collections.emptyList());
        } else if (skip == 0 && limit == Integer.MAX_VALUE) {
            return new EventStreamImpl(streamId, events.size(), events);
        }
        int from = Math.min(skip, events.size());
        int to = (int) Math.min((long) from + limit, events.size());
        return new EventStreamImpl(streamId, events.size(), events.subList(from, to));
    }

    @Override
    public WriteResult write(String streamId, WriteCondition writeCondition, Stream<CloudEvent> events) {
        requireNonNull(streamId, "Stream id cannot be null");
        requireTrue(writeCondition != null, WriteCondition.class.getSimpleName() + " cannot be null");
        requireNonNull(events, "Events cannot be null");
        List<CloudEvent> newEvents = events.peek(e -> requireTrue(e.getSpecVersion() == SpecVersion.V1, "Spec version needs to be " + SpecVersion.V1))
                .collect(Collectors.toList());

        final AtomicReference<WriteResult> writeResult = new AtomicReference<>();
        state.compute(streamId, (__, currentEvents) -> {
            long currentStreamVersion = currentEvents == null ? 0 : currentEvents.size();
            if (!writeCondition.isFulfilledBy(currentStreamVersion)) {
                throw new WriteConditionNotFulfilledException(streamId, currentStreamVersion, writeCondition);
            }

            writeResult.set(new WriteResult(streamId, currentStreamVersion, currentStreamVersion + newEvents.size()));
            if (newEvents.isEmpty()) {
                return currentEvents;
            }

            List<CloudEvent> eventList = currentEvents == null ? new ArrayList<>() : new ArrayList<>(currentEvents);
            long streamVersion = currentStreamVersion;
            for (CloudEvent newEvent : newEvents) {
                eventList.add(positionInStream(newEvent, streamId, ++streamVersion));
            }
            return Collections.unmodifiableList(eventList);
        });

        log.debug("Wrote {} event(s) to stream {}: {}", newEvents.size(), streamId, writeResult.get());
        return writeResult.get();
    }

    @Override
    public WriteResult write(String streamId, Stream<CloudEvent> events) {
        return write(streamId, WriteCondition.anyStreamVersion(), events);
    }

    @Override
    public boolean exists(String streamId) {
        return state.containsKey(streamId);
    }

    @Override
    public void deleteEventStream(String streamId) {
        requireNonNull(streamId, "StreamId cannot be null");
        if (state.remove(streamId) != null) {
            log.info("Deleted stream {}", streamId);
        }
    }

    @Override
    public Stream<String> streamIds() {
        return List.copyOf(state.keySet()).stream();
    }

    private static class EventStreamImpl implements EventStream<CloudEvent> {
        private final String streamId;
        private final long version;
        private final List<CloudEvent> events;

        EventStreamImpl(String streamId, long version, List<CloudEvent> events) {
            this.streamId = streamId;
            this.version = version;
            this.events = Collections.unmodifiableList(events);
        }

        @Override
        public String id() {
            return streamId;
        }

        @Override
        public long version() {
            return version;
        }

        @Override
        public Stream<CloudEvent> events() {
            return events.stream();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof EventStreamImpl)) return false;
            EventStreamImpl that = (EventStreamImpl) o;
            return version == that.version &&
                    Objects.equals(streamId, that.streamId) &&
                    Objects.equals(events, that.events);
        }

        @Override
        public int hashCode() {
            return Objects.hash(streamId, version, events);
        }

        @Override
        public String toString() {
            return "EventStreamImpl{" +
                    "streamId='" + streamId + '\'' +
                    ", version=" + version +
                    ", events=" + events +
                    '}';
        }
    }

    private static void requireTrue(boolean bool, String message) {
        if (!bool) {
            throw new IllegalArgumentException(message);
        }
    }
}
