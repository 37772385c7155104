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


package org.cartstream.eventstore.api;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * Thrown when the event store cannot read or durably write a stream. Nothing has been written when this is thrown
 * from a write, and the command that caused the write must be regarded as failed.
 */
public class EventStoreException extends RuntimeException {
    // null when the failure isn't tied to a single stream, for example while recovering all streams
    public final @Nullable String eventStreamId;

    public EventStoreException(@Nullable String eventStreamId, String message, Throwable cause) {
        super(message, cause);
        this.eventStreamId = eventStreamId;
    }

    public EventStoreException(@Nullable String eventStreamId, String message) {
        super(message);
        this.eventStreamId = eventStreamId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventStoreException)) return false;
        EventStoreException that = (EventStoreException) o;
        return Objects.equals(eventStreamId, that.eventStreamId) && Objects.equals(getMessage(), that.getMessage());
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventStreamId, getMessage());
    }

    @Override
    public String toString() {
        return EventStoreException.class.getSimpleName() + "[eventStreamId='" + eventStreamId + "', message=" + getMessage() + "]";
    }
}
