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

/**
 * A write condition may be applied when writing events to an event store. If the write condition is not fulfilled the events
 * will not be written.
 */
public sealed interface WriteCondition {

    /**
     * Stream version doesn't matter, essentially the same as an unconditional write condition.
     *
     * @return A {@link WriteCondition} with the behavior specified above.
     */
    static WriteCondition anyStreamVersion() {
        return AnyStreamVersion.INSTANCE;
    }

    /**
     * Stream version must be equal to the specified {@code version} in order for the events to be written
     * to the event store. A version of {@code 0} means that the stream must not exist.
     *
     * @return A {@link WriteCondition} with the behavior specified above.
     */
    static WriteCondition streamVersionEq(long version) {
        return new StreamVersionEq(version);
    }

    /**
     * @param currentStreamVersion The version of the stream at the time of the write
     * @return {@code true} if events may be written to a stream that has {@code currentStreamVersion}.
     */
    boolean isFulfilledBy(long currentStreamVersion);

    default boolean isAnyStreamVersion() {
        return this instanceof AnyStreamVersion;
    }

    final class AnyStreamVersion implements WriteCondition {
        private static final AnyStreamVersion INSTANCE = new AnyStreamVersion();

        private AnyStreamVersion() {
        }

        @Override
        public boolean isFulfilledBy(long currentStreamVersion) {
            return true;
        }

        @Override
        public String toString() {
            return "any";
        }
    }

    record StreamVersionEq(long version) implements WriteCondition {

        public StreamVersionEq {
            if (version < 0) {
                throw new IllegalArgumentException("Expected stream version cannot be negative");
            }
        }

        @Override
        public boolean isFulfilledBy(long currentStreamVersion) {
            return currentStreamVersion == version;
        }

        @Override
        public String toString() {
            return "to be equal to " + version;
        }
    }
}
