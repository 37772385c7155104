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

import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Represents an event stream, i.e. the ordered events of one stream id together with the version of the stream at the time it was read.
 */
@SuppressWarnings("NullableProblems")
public interface EventStream<T> extends Iterable<T> {

    /**
     * @return The id of the event stream
     */
    String id();

    /**
     * The event stream version. It is equal to {@code 0} if event stream is empty, otherwise it's the number of events in the stream.
     * Use it as expected version when writing events derived from this stream.
     *
     * @return The current version of the event stream
     * @see #isEmpty()
     */
    long version();

    /**
     * @return The events as a {@link Stream}.
     */
    Stream<T> events();

    @Override
    default Iterator<T> iterator() {
        return events().iterator();
    }

    /**
     * @return {@code true} if event stream is empty, {@code false} otherwise.
     */
    default boolean isEmpty() {
        return version() == 0;
    }

    /**
     * @return The events in this stream as a list
     */
    default List<T> eventList() {
        return events().collect(Collectors.toList());
    }

    /**
     * Apply a mapping function to the {@link EventStream}
     *
     * @param fn   The function to apply for each event.
     * @param <T2> The return type
     * @return A new {@link EventStream} where events are converted to {@code T2}. Id and version are retained.
     */
    default <T2> EventStream<T2> map(Function<T, T2> fn) {
        EventStream<T> original = this;
        return new EventStream<>() {

            @Override
            public String id() {
                return original.id();
            }

            @Override
            public long version() {
                return original.version();
            }

            @Override
            public Stream<T2> events() {
                return original.events().map(fn);
            }

            @Override
            public String toString() {
                return "EventStream{id='" + id() + "', version=" + version() + '}';
            }
        };
    }
}
