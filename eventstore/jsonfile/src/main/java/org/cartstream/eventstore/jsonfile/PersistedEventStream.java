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


package org.cartstream.eventstore.jsonfile;

import io.cloudevents.CloudEvent;

import java.time.Instant;
import java.util.List;

/**
 * The on-disk representation of one stream. Each event is stored in CloudEvents JSON format and carries its own position
 * in the stream as the {@code streamversion} attribute.
 */
record PersistedEventStream(String streamId, long version, Instant lastUpdated, List<CloudEvent> events) {
}
