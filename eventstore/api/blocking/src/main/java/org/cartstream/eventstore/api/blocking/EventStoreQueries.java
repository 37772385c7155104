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


package org.cartstream.eventstore.api.blocking;

import io.cloudevents.CloudEvent;

import java.util.stream.Stream;

/**
 * Cross-stream read capabilities that may be supported by an {@link EventStore} implementation. These are used to build
 * projections spanning many streams and are not part of a "transactional" use case.
 */
public interface EventStoreQueries extends ReadEventStream {

    /**
     * @return The ids of all streams that currently contain at least one event, in no particular order.
     */
    Stream<String> streamIds();

    /**
     * Read every stream in the event store. A stream deleted after {@link #streamIds()} was evaluated is skipped.
     *
     * @return One {@link EventStream} per non-empty stream.
     */
    default Stream<EventStream<CloudEvent>> readAll() {
        return streamIds().map(this::read).filter(eventStream -> !eventStream.isEmpty());
    }

    /**
     * @return Every event in the event store, stream by stream. Events of one stream are always returned in stream version order,
     * there's no ordering guarantee across streams.
     */
    default Stream<CloudEvent> all() {
        return readAll().flatMap(EventStream::events);
    }
}
