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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Configuration for the {@link JsonFileEventStore}
 */
@NullMarked
public class JsonFileEventStoreConfig {
    public final Path dataDirectory;
    public final boolean cacheEvents;
    public final boolean forceWrites;
    @Nullable
    public final ObjectMapper objectMapper;
    public final Clock clock;

    /**
     * Create a {@link JsonFileEventStoreConfig} that stores one file per stream in {@code dataDirectory}, keeps the events of
     * every stream cached in memory and forces every write to disk before it's made visible.
     *
     * @param dataDirectory The directory in which stream files are stored. It's created if it doesn't exist.
     */
    public JsonFileEventStoreConfig(Path dataDirectory) {
        this(dataDirectory, true, true, null, Clock.systemUTC());
    }

    private JsonFileEventStoreConfig(Path dataDirectory, boolean cacheEvents, boolean forceWrites, @Nullable ObjectMapper objectMapper, Clock clock) {
        Objects.requireNonNull(dataDirectory, "Data directory cannot be null");
        Objects.requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.dataDirectory = dataDirectory;
        this.cacheEvents = cacheEvents;
        this.forceWrites = forceWrites;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JsonFileEventStoreConfig)) return false;
        JsonFileEventStoreConfig that = (JsonFileEventStoreConfig) o;
        return cacheEvents == that.cacheEvents && forceWrites == that.forceWrites && Objects.equals(dataDirectory, that.dataDirectory)
                && Objects.equals(objectMapper, that.objectMapper) && Objects.equals(clock, that.clock);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataDirectory, cacheEvents, forceWrites, objectMapper, clock);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", JsonFileEventStoreConfig.class.getSimpleName() + "[", "]")
                .add("dataDirectory=" + dataDirectory)
                .add("cacheEvents=" + cacheEvents)
                .add("forceWrites=" + forceWrites)
                .add("clock=" + clock)
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private Path dataDirectory;
        private boolean cacheEvents = true;
        private boolean forceWrites = true;
        private ObjectMapper objectMapper;
        private Clock clock = Clock.systemUTC();

        /**
         * @param dataDirectory The directory in which stream files are stored. It's created if it doesn't exist.
         * @return The builder instance
         */
        @NullMarked
        public Builder dataDirectory(Path dataDirectory) {
            this.dataDirectory = dataDirectory;
            return this;
        }

        /**
         * @param cacheEvents {@code true} to keep the events of every stream in memory after they've been durably written (default),
         *                    {@code false} to only keep the version of each stream in memory and read events from disk.
         * @return The builder instance
         */
        public Builder cacheEvents(boolean cacheEvents) {
            this.cacheEvents = cacheEvents;
            return this;
        }

        /**
         * @param forceWrites {@code true} to flush each stream file to the storage device before replacing the previous file (default).
         *                    Only disable this in tests.
         * @return The builder instance
         */
        public Builder forceWrites(boolean forceWrites) {
            this.forceWrites = forceWrites;
            return this;
        }

        /**
         * @param objectMapper The {@link ObjectMapper} to base serialization on. It's copied, the supplied instance is never modified. May be <code>null</code>.
         * @return The builder instance
         */
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * @param clock The clock used to stamp the last update time of stream files
         * @return The builder instance
         */
        @NullMarked
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public JsonFileEventStoreConfig build() {
            return new JsonFileEventStoreConfig(dataDirectory, cacheEvents, forceWrites, objectMapper, clock);
        }
    }
}
