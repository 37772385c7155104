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

/**
 * Administrative operations that may be supported by an {@link EventStore} implementation. These are never used when handling commands.
 */
public interface EventStoreOperations {

    /**
     * Delete all events and metadata associated with an event stream. Deleting a stream that doesn't exist is a no-op.
     *
     * @param streamId The id of the stream to delete
     */
    void deleteEventStream(String streamId);
}
