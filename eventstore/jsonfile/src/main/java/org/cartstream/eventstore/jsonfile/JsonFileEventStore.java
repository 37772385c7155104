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
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.cloudevents.CloudEvent;
import io.cloudevents.SpecVersion;
import io.cloudevents.jackson.JsonFormat;
import org.cartstream.cloudevents.StreamExtensionGetter;
import org.cartstream.eventstore.api.EventStoreException;
import org.cartstream.eventstore.api.WriteCondition;
import org.cartstream.eventstore.api.WriteConditionNotFulfilledException;
import org.cartstream.eventstore.api.WriteResult;
import org.cartstream.eventstore.api.blocking.EventStore;
import org.cartstream.eventstore.api.blocking.EventStoreOperations;
import org.cartstream.eventstore.api.blocking.EventStoreQueries;
import org.cartstream.eventstore.api.blocking.EventStream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.READ;
import static java.nio.file.StandardOpenOption.WRITE;
import static java.util.Objects.requireNonNull;
import static org.cartstream.cloudevents.StreamCloudEventExtension.positionInStream;

/**
 * An {@link EventStore} that persists each stream as a JSON file in a directory. The file is the single source of truth for a stream:
 * a write produces a complete new file in a temporary location which is forced to disk and then atomically moved over the previous one,
 * so a reader never observes a partially written stream. The in-memory index (and, optionally, the cached events) of a stream is only
 * updated after its file has been replaced.
 * <p>
 * When the store is created it scans the data directory once and rebuilds the version of every stream from the files it finds.
 * Writes to the same stream are serialized, writes to different streams proceed in parallel.
 */
public class JsonFileEventStore implements EventStore, EventStoreOperations, EventStoreQueries {
    private static final Logger log = LoggerFactory.getLogger(JsonFileEventStore.class);

    static final String STREAM_FILE_SUFFIX = ".json";
    static final String TEMP_FILE_SUFFIX = ".tmp";

    private final Path dataDirectory;
    private final boolean cacheEvents;
    private final boolean forceWrites;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final ObjectWriter streamFileWriter;
    private final ConcurrentMap<String, StreamEntry> streams = new ConcurrentHashMap<>();

    /**
     * Create a {@link JsonFileEventStore} with default configuration storing its files in {@code dataDirectory}
     *
     * @param dataDirectory The directory in which stream files are stored
     */
    public JsonFileEventStore(Path dataDirectory) {
        this(new JsonFileEventStoreConfig(dataDirectory));
    }

    /**
     * Create a {@link JsonFileEventStore} and recover all streams found in the configured data directory.
     *
     * @param config The configuration to use
     * @throws EventStoreException If the data directory cannot be created or a stream file is unreadable or inconsistent
     */
    public JsonFileEventStore(JsonFileEventStoreConfig config) {
        requireNonNull(config, JsonFileEventStoreConfig.class.getSimpleName() + " cannot be null");
        this.dataDirectory = config.dataDirectory;
        this.cacheEvents = config.cacheEvents;
        this.forceWrites = config.forceWrites;
        this.clock = config.clock;
        ObjectMapper baseObjectMapper = config.objectMapper == null ? new ObjectMapper() : config.objectMapper.copy();
        this.objectMapper = baseObjectMapper
                .registerModule(JsonFormat.getCloudEventJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.streamFileWriter = objectMapper.writerWithDefaultPrettyPrinter();
        recover();
    }

    @Override
    public EventStream<CloudEvent> read(String streamId, int skip, int limit) {
        requireNonNull(streamId, "Stream id cannot be null");
        requireTrue(skip >= 0, "skip cannot be negative");
        requireTrue(limit >= 0, "limit cannot be negative");

        StreamEntry entry = streams.get(streamId);
        StreamState state = entry == null ? StreamState.EMPTY : entry.state;
        if (state.version == 0) {
            return new EventStreamImpl(streamId, 0, Collections.emptyList());
        }

        final long version;
        final List<CloudEvent> events;
        if (state.events != null) {
            version = state.version;
            events = state.events;
        } else {
            // Files are replaced atomically so the version is taken from the file to stay consistent with its events
            PersistedEventStream persisted = readStreamFile(streamId);
            if (persisted == null) {
                return new EventStreamImpl(streamId, 0, Collections.emptyList());
            }
            version = persisted.version();
            events = persisted.events();
        }

        int from = Math.min(skip, events.size());
        int to = (int) Math.min((long) from + limit, events.size());
        return new EventStreamImpl(streamId, version, events.subList(from, to));
    }

    @Override
    public WriteResult write(String streamId, WriteCondition writeCondition, Stream<CloudEvent> events) {
        requireNonNull(streamId, "Stream id cannot be null");
        requireTrue(writeCondition != null, WriteCondition.class.getSimpleName() + " cannot be null");
        requireNonNull(events, "Events cannot be null");
        List<CloudEvent> newEvents = events.peek(e -> requireTrue(e.getSpecVersion() == SpecVersion.V1, "Spec version needs to be " + SpecVersion.V1))
                .collect(Collectors.toList());

        StreamEntry entry = streams.computeIfAbsent(streamId, __ -> new StreamEntry());
        synchronized (entry) {
            StreamState current = entry.state;
            if (!writeCondition.isFulfilledBy(current.version)) {
                throw new WriteConditionNotFulfilledException(streamId, current.version, writeCondition);
            }

            if (newEvents.isEmpty()) {
                return new WriteResult(streamId, current.version, current.version);
            }

            List<CloudEvent> existingEvents = current.version == 0 ? Collections.emptyList() : currentEvents(streamId, current);
            List<CloudEvent> allEvents = new ArrayList<>(existingEvents.size() + newEvents.size());
            allEvents.addAll(existingEvents);
            long streamVersion = current.version;
            for (CloudEvent newEvent : newEvents) {
                allEvents.add(positionInStream(newEvent, streamId, ++streamVersion));
            }

            writeStreamFile(streamId, allEvents);
            entry.state = new StreamState(allEvents.size(), cacheEvents ? Collections.unmodifiableList(allEvents) : null);

            WriteResult writeResult = new WriteResult(streamId, current.version, streamVersion);
            log.debug("Wrote {} event(s) to stream {}: {}", newEvents.size(), streamId, writeResult);
            return writeResult;
        }
    }

    @Override
    public WriteResult write(String streamId, Stream<CloudEvent> events) {
        return write(streamId, WriteCondition.anyStreamVersion(), events);
    }

    @Override
    public boolean exists(String streamId) {
        StreamEntry entry = streams.get(streamId);
        return entry != null && entry.state.version > 0;
    }

    @Override
    public Stream<String> streamIds() {
        return streams.entrySet().stream()
                .filter(e -> e.getValue().state.version > 0)
                .map(java.util.Map.Entry::getKey)
                .collect(Collectors.toList())
                .stream();
    }

    @Override
    public void deleteEventStream(String streamId) {
        requireNonNull(streamId, "StreamId cannot be null");
        StreamEntry entry = streams.get(streamId);
        if (entry == null) {
            return;
        }

        synchronized (entry) {
            try {
                if (Files.deleteIfExists(streamFile(streamId))) {
                    log.info("Deleted stream {}", streamId);
                }
            } catch (IOException e) {
                throw new EventStoreException(streamId, "Failed to delete stream file of " + streamId, e);
            }
            entry.state = StreamState.EMPTY;
        }
    }

    /**
     * @return The directory where stream files are kept
     */
    public Path dataDirectory() {
        return dataDirectory;
    }

    private List<CloudEvent> currentEvents(String streamId, StreamState state) {
        if (state.events != null) {
            return state.events;
        }
        PersistedEventStream persisted = readStreamFile(streamId);
        if (persisted == null || persisted.version() != state.version) {
            throw new EventStoreException(streamId, "Stream file of " + streamId + " doesn't match the recorded stream version " + state.version);
        }
        return persisted.events();
    }

    private void writeStreamFile(String streamId, List<CloudEvent> events) {
        PersistedEventStream persisted = new PersistedEventStream(streamId, events.size(), clock.instant(), events);
        Path streamFile = streamFile(streamId);
        Path tempFile = null;
        try {
            byte[] bytes = streamFileWriter.writeValueAsBytes(persisted);
            tempFile = Files.createTempFile(dataDirectory, streamFile.getFileName().toString() + ".", TEMP_FILE_SUFFIX);
            try (FileChannel channel = FileChannel.open(tempFile, WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                if (forceWrites) {
                    channel.force(true);
                }
            }
            Files.move(tempFile, streamFile, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(tempFile, e);
            throw new EventStoreException(streamId, "Failed to write stream file of " + streamId + ", no events were written", e);
        }
        if (forceWrites) {
            forceDataDirectory(streamId);
        }
    }

    // The rename is only durable once the directory entry is flushed
    private void forceDataDirectory(String streamId) {
        try {
            forceDirectory(dataDirectory);
        } catch (IOException e) {
            // The stream file is in place at this point, some platforms (Windows) can't open a directory for syncing
            log.warn("Failed to flush {} after writing stream {}, the write may not survive a crash", dataDirectory, streamId, e);
        }
    }

    static void forceDirectory(Path directory) throws IOException {
        try (FileChannel channel = FileChannel.open(directory, READ)) {
            channel.force(true);
        }
    }

    private @Nullable PersistedEventStream readStreamFile(String streamId) {
        Path streamFile = streamFile(streamId);
        try {
            return readAndVerify(streamFile);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new EventStoreException(streamId, "Failed to read stream file of " + streamId, e);
        }
    }

    private PersistedEventStream readAndVerify(Path streamFile) throws IOException {
        PersistedEventStream persisted = objectMapper.readValue(Files.readAllBytes(streamFile), PersistedEventStream.class);
        String streamId = persisted.streamId();
        if (streamId == null || persisted.events() == null) {
            throw new EventStoreException(null, "Stream file " + streamFile + " doesn't contain a stream id and events");
        }
        if (!streamFile.getFileName().toString().equals(fileName(streamId))) {
            throw new EventStoreException(streamId, "Stream file " + streamFile + " contains stream " + streamId);
        }
        if (persisted.version() != persisted.events().size()) {
            throw new EventStoreException(streamId, "Stream file " + streamFile + " has version " + persisted.version() + " but contains " + persisted.events().size() + " events");
        }

        List<CloudEvent> events = new ArrayList<>(persisted.events().size());
        long expectedPosition = 0;
        for (CloudEvent event : persisted.events()) {
            expectedPosition++;
            long position = StreamExtensionGetter.getStreamVersion(event);
            if (position != expectedPosition) {
                throw new EventStoreException(streamId, "Stream file " + streamFile + " has an event at position " + position + " where " + expectedPosition + " was expected");
            }
            events.add(positionInStream(event, streamId, position));
        }
        return new PersistedEventStream(streamId, persisted.version(), persisted.lastUpdated(), Collections.unmodifiableList(events));
    }

    private void recover() {
        try {
            Files.createDirectories(dataDirectory);
        } catch (IOException e) {
            throw new EventStoreException(null, "Failed to create data directory " + dataDirectory, e);
        }

        long numberOfEvents = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dataDirectory)) {
            for (Path file : files) {
                String fileName = file.getFileName().toString();
                if (fileName.endsWith(TEMP_FILE_SUFFIX)) {
                    log.warn("Removing {} left behind by an interrupted write", file);
                    Files.deleteIfExists(file);
                } else if (fileName.endsWith(STREAM_FILE_SUFFIX) && Files.isRegularFile(file)) {
                    PersistedEventStream persisted = readAndVerify(file);
                    StreamEntry entry = new StreamEntry();
                    entry.state = new StreamState(persisted.version(), cacheEvents ? persisted.events() : null);
                    streams.put(persisted.streamId(), entry);
                    numberOfEvents += persisted.version();
                }
            }
        } catch (IOException e) {
            throw new EventStoreException(null, "Failed to recover streams from " + dataDirectory, e);
        }
        log.info("Recovered {} stream(s) with {} event(s) from {}", streams.size(), numberOfEvents, dataDirectory);
    }

    private Path streamFile(String streamId) {
        return dataDirectory.resolve(fileName(streamId));
    }

    static String fileName(String streamId) {
        return URLEncoder.encode(streamId, UTF_8) + STREAM_FILE_SUFFIX;
    }

    private static void deleteQuietly(@Nullable Path file, Exception cause) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    private static void requireTrue(boolean bool, String message) {
        if (!bool) {
            throw new IllegalArgumentException(message);
        }
    }

    private static final class StreamEntry {
        private volatile StreamState state = StreamState.EMPTY;
    }

    // Events are null when only the version is kept in memory
    private static final class StreamState {
        private static final StreamState EMPTY = new StreamState(0, Collections.emptyList());

        private final long version;
        @Nullable
        private final List<CloudEvent> events;

        private StreamState(long version, @Nullable List<CloudEvent> events) {
            this.version = version;
            this.events = events;
        }
    }

    private static class EventStreamImpl implements EventStream<CloudEvent> {
        private final String streamId;
        private final long version;
        private final List<CloudEvent> events;

        EventStreamImpl(String streamId, long version, List<CloudEvent> events) {
            this.streamId = streamId;
            this.version = version;
            this.events = events;
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
            return version == that.version && Objects.equals(streamId, that.streamId) && Objects.equals(events, that.events);
        }

        @Override
        public int hashCode() {
            return Objects.hash(streamId, version, events);
        }

        @Override
        public String toString() {
            return "EventStreamImpl{streamId='" + streamId + "', version=" + version + ", events=" + events.size() + '}';
        }
    }
}
