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
import org.cartstream.eventstore.api.EventStoreException;
import org.cartstream.eventstore.api.WriteCondition;
import org.cartstream.eventstore.api.WriteConditionNotFulfilledException;
import org.cartstream.eventstore.api.WriteResult;

import java.util.stream.Stream;

import static org.cartstream.eventstore.api.WriteCondition.streamVersionEq;

/**
 * An interface that should be implemented by event stores that supports conditional writes to an event stream.
 * The condition is evaluated and the events appended atomically with respect to other writers of the same stream.
 */
public interface ConditionallyWriteToEventStream {

    /**
     * A convenience function that writes events to an event store if the stream version is equal to {@code expectedStreamVersion}.
     *
     * @param streamId              The id of the stream
     * @param expectedStreamVersion The stream must be equal to this version in order for the events to be written
     * @param events                The events to be appended/written to the stream
     * @return The result of the write
     * @throws WriteConditionNotFulfilledException When the stream version didn't match and the events couldn't be written
     * @throws EventStoreException                 When the events couldn't be durably stored
     * @see #write(String, WriteCondition, Stream) for more advanced write conditions
     */
    default WriteResult write(String streamId, long expectedStreamVersion, Stream<CloudEvent> events) {
        return write(streamId, streamVersionEq(expectedStreamVersion), events);
    }

    /**
     * Conditionally write to an event store. Either all events are written and the stream version is increased by the number
     * of events, or nothing is written.
     *
     * @param streamId       The id of the stream
     * @param writeCondition The write condition that must be fulfilled for the events to be written
     * @param events         The events to be appended/written to the stream
     * @return The result of the write
     * @throws WriteConditionNotFulfilledException When the <code>writeCondition</code> was not fulfilled and the events couldn't be written
     * @throws EventStoreException                 When the events couldn't be durably stored
     */
    WriteResult write(String streamId, WriteCondition writeCondition, Stream<CloudEvent> events);
}
