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

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.cartstream.cloudevents.StreamExtensionGetter;
import org.cartstream.eventstore.api.EventStoreException;
import org.cartstream.eventstore.api.WriteConditionNotFulfilledException;
import org.cartstream.eventstore.api.WriteResult;
import org.cartstream.eventstore.api.blocking.EventStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class JsonFileEventStoreTest {
    private static final URI SOURCE = URI.create("urn:cartstream:test");

    @TempDir
    Path dataDirectory;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void jackson_core_on_the_classpath_is_the_release_that_databind_is_built_for() {
        // When
        Version core = com.fasterxml.jackson.core.json.PackageVersion.VERSION;
        Version databind = com.fasterxml.jackson.databind.cfg.PackageVersion.VERSION;

        // Then
        assertThat(core.getMinorVersion()).isEqualTo(databind.getMinorVersion());
        assertThat(core.getMajorVersion()).isEqualTo(databind.getMajorVersion());
    }

    @Test
    void read_of_a_stream_that_doesnt_exist_returns_an_empty_stream_with_version_zero() {
        // Given
        JsonFileEventStore eventStore = new JsonFileEventStore(dataDirectory);

        // When
        EventStream<CloudEvent> eventStream = eventStore.read("cart-1");

        // Then
        assertAll(
                () -> assertThat(eventStream.version()).isZero(),
                () -> assertThat(eventStream.isEmpty()).isTrue(),
                () -> assertThat(eventStream.eventList()).isEmpty(),
                () -> assertThat(eventStore.exists("cart-1")).isFalse()
        );
    }

    @Test
    void events_are_read_back_in_the_order_they_were_written_with_their_position_in_the_stream() {
        // Given
        JsonFileEventStore eventStore = new JsonFileEventStore(dataDirectory);

        // When
        WriteResult first = eventStore.write("cart-1", 0, Stream.of(event("Opened", "{\"n\":1}")));
        WriteResult second = eventStore.write("cart-1", 1, Stream.of(event("Added", "{\"n\":2}"), event("Added", "{\"n\":3}")));

        // Then
        EventStream<CloudEvent> eventStream = eventStore.read("cart-1");
        assertAll(
                () -> assertThat(first.getStreamVersion()).isEqualTo(1),
                () -> assertThat(second.getOldStreamVersion()).isEqualTo(1),
                () -> assertThat(second.getStreamVersion()).isEqualTo(3),
                () -> assertThat(eventStream.version()).isEqualTo(3),
                () -> assertThat(eventStream.events().map(CloudEvent::getType)).containsExactly("Opened", "Added", "Added"),
                () -> assertThat(eventStream.events().map(StreamExtensionGetter::getStreamVersion)).containsExactly(1L, 2L, 3L),
                () -> assertThat(eventStream.events().map(StreamExtensionGetter::getStreamId)).containsOnly("cart-1")
        );
    }

    @Test
    void writing_an_empty_batch_leaves_the_stream_untouched() {
        // Given
        JsonFileEventStore eventStore = new JsonFileEventStore(dataDirectory);

        // When
        WriteResult writeResult = eventStore.write("cart-1", 0, Stream.empty());

        // Then
        assertAll(
                () -> assertThat(writeResult.anEventWasWritten()).isFalse(),
                () -> assertThat(eventStore.exists("cart-1")).isFalse(),
                () -> assertThat(streamFiles()).isEmpty()
        );
    }

    @Test
    void skip_and_limit_select_a_range_of_events_but_the_version_is_that_of_the_whole_stream() {
        // Given
        JsonFileEventStore eventStore = new JsonFileEventStore(dataDirectory);
        eventStore.write("cart-1", Stream.of(event("A"), event("B"), event("C"), event("D")));

        // When
        EventStream<CloudEvent> eventStream = eventStore.read("cart-1", 1, 2);

        // Then
        assertThat(eventStream.version()).isEqualTo(4);
        assertThat(eventStream.events().map(CloudEvent::getType)).containsExactly("B", "C");
    }

    @Test
    void stream_ids_with_characters_that_are_not_allowed_in_file_names_are_supported() {
        // Given
        JsonFileEventStore eventStore = new JsonFileEventStore(dataDirectory);

        // When
        eventStore.write("carts/../1 2", 0, Stream.of(event("A")));

        // Then
        JsonFileEventStore reopened = new JsonFileEventStore(dataDirectory);
        assertThat(reopened.read("carts/../1 2").version()).isEqualTo(1);
        assertThat(reopened.streamIds()).containsExactly("carts/../1 2");
        assertThat(streamFiles()).hasSize(1);
    }

    @Nested
    @DisplayName("write condition")
    class WriteConditionTest {

        @Test
        void write_fails_and_nothing_is_written_when_expected_version_doesnt_match() {
            // Given
            JsonFileEventStore eventStore = new JsonFileEventStore(dataDirectory);
            eventStore.write("cart-1", 0, Stream.of(event("A")));

            // When
            Throwable throwable = catchThrowable(() -> eventStore.write("cart-1", 0, Stream.of(event("B"))));

            // Then
            assertThat(throwable).isExactlyInstanceOf(WriteConditionNotFulfilledException.class);
            WriteConditionNotFulfilledException e = (WriteConditionNotFulfilledException) throwable;
            assertAll(
                    () -> assertThat(e.eventStreamId).isEqualTo("cart-1"),
                    () -> assertThat(e.eventStreamVersion).isEqualTo(1),
                    () -> assertThat(eventStore.read("cart-1").events().map(CloudEvent::getType)).containsExactly("A")
            );
        }

        @Test
        void expecting_version_zero_succeeds_only_for_a_new_stream() {
            // Given
            JsonFileEventStore eventStore = new JsonFileEventStore(dataDirectory);

            // When
            WriteResult writeResult = eventStore.write("cart-1", 0, Stream.of(event("A")));

            // Then
            assertThat(writeResult.getStreamVersion()).isEqualTo(1);
            assertThat(catchThrowable(() -> eventStore.write("cart-1", 0, Stream.of(event("A"))))).isInstanceOf(WriteConditionNotFulfilledException.class);
        }

        @Test
        void only_one_of_two_concurrent_writers_with_the_same_expected_version_succeeds() throws Exception {
            // Given
            JsonFileEventStore eventStore = new JsonFileEventStore(dataDirectory);
            eventStore.write("cart-1", 0, Stream.of(event("Opened")));
            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            Callable<WriteResult> writer = () -> {
                start.await();
                return eventStore.write("cart-1", 1, Stream.of(event("Added")));
            };

            // When
            List<Future<WriteResult>> futures = List.of(executor.submit(writer), executor.submit(writer));
            start.countDown();
            List<Throwable> failures = new ArrayList<>();
            List<WriteResult> successes = new ArrayList<>();
            for (Future<WriteResult> future : futures) {
                try {
                    successes.add(future.get(10, TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    failures.add(e.getCause());
                }
            }
            executor.shutdownNow();

            // Then
            assertAll(
                    () -> assertThat(successes).hasSize(1),
                    () -> assertThat(failures).singleElement().isInstanceOf(WriteConditionNotFulfilledException.class),
                    () -> assertThat(new JsonFileEventStore(dataDirectory).read("cart-1").version()).isEqualTo(2)
            );
        }
    }

    @Nested
    @DisplayName("durability")
    class DurabilityTest {

        @Test
        void events_survive_a_restart_of_the_event_store() throws IOException {
            // Given
            JsonFileEventStore eventStore = new JsonFileEventStore(dataDirectory);
            eventStore.write("cart-1", 0, Stream.of(event("Opened", "{\"customerId\":\"c1\"}")));
            eventStore.write("cart-1", 1, Stream.of(event("Added", "{\"productId\":\"product-001\"}")));
            eventStore.write("cart-2", 0, Stream.of(event("Opened", "{\"customerId\":\"c2\"}")));

            // When
            JsonFileEventStore reopened = new JsonFileEventStore(dataDirectory);

            // Then
            EventStream<CloudEvent> eventStream = reopened.read("cart-1");
            assertThat(eventStream.version()).isEqualTo(2);
            assertThat(eventStream.events().map(CloudEvent::getType)).containsExactly("Opened", "Added");
            assertThat(eventStream.events().map(StreamExtensionGetter::getStreamVersion)).containsExactly(1L, 2L);
            assertThat(json(eventStream.eventList().get(1))).isEqualTo(objectMapper.readTree("{\"productId\":\"product-001\"}"));
            assertThat(reopened.streamIds()).containsExactlyInAnyOrder("cart-1", "cart-2");
        }

        @Test
        void a_restarted_event_store_continues_the_version_sequence_of_a_stream() {
            // Given
            new JsonFileEventStore(dataDirectory).write("cart-1", 0, Stream.of(event("A"), event("B")));

            // When
            JsonFileEventStore reopened = new JsonFileEventStore(dataDirectory);
            Throwable stale = catchThrowable(() -> reopened.write("cart-1", 0, Stream.of(event("C"))));
            WriteResult writeResult = reopened.write("cart-1", 2, Stream.of(event("C")));

            // Then
            assertThat(stale).isInstanceOf(WriteConditionNotFulfilledException.class);
            assertThat(writeResult.getStreamVersion()).isEqualTo(3);
        }

        @Test
        @DisabledOnOs(OS.WINDOWS)
        void forced_writes_flush_the_data_directory_after_replacing_the_stream_file() {
            // Given
            JsonFileEventStoreConfig config = new JsonFileEventStoreConfig.Builder().dataDirectory(dataDirectory).forceWrites(true).build();
            JsonFileEventStore eventStore = new JsonFileEventStore(config);

            // When
            eventStore.write("cart-1", 0, Stream.of(event("A")));
            eventStore.write("cart-1", 1, Stream.of(event("B")));

            // Then
            assertAll(
                    () -> assertThatCode(() -> JsonFileEventStore.forceDirectory(dataDirectory)).doesNotThrowAnyException(),
                    () -> assertThat(Files.exists(dataDirectory.resolve("cart-1.json"))).isTrue(),
                    () -> assertThat(new JsonFileEventStore(dataDirectory).read("cart-1").version()).isEqualTo(2)
            );
        }

        @Test
        void events_are_read_from_disk_when_caching_is_disabled() {
            // Given
            JsonFileEventStoreConfig config = new JsonFileEventStoreConfig.Builder().dataDirectory(dataDirectory).cacheEvents(false).build();
            JsonFileEventStore eventStore = new JsonFileEventStore(config);
            eventStore.write("cart-1", 0, Stream.of(event("A")));

            // When
            eventStore.write("cart-1", 1, Stream.of(event("B")));

            // Then
            assertThat(eventStore.read("cart-1").events().map(CloudEvent::getType)).containsExactly("A", "B");
            assertThat(eventStore.read("cart-1", 1, 1).version()).isEqualTo(2);
        }

        @Test
        void stream_file_records_when_the_stream_was_last_updated() throws IOException {
            // Given
            Instant now = Instant.parse("2024-05-01T10:15:30Z");
            JsonFileEventStoreConfig config = new JsonFileEventStoreConfig.Builder().dataDirectory(dataDirectory).clock(Clock.fixed(now, ZoneOffset.UTC)).build();
            JsonFileEventStore eventStore = new JsonFileEventStore(config);

            // When
            eventStore.write("cart-1", 0, Stream.of(event("A")));

            // Then
            JsonNode file = objectMapper.readTree(dataDirectory.resolve("cart-1.json").toFile());
            assertAll(
                    () -> assertThat(file.get("streamId").asText()).isEqualTo("cart-1"),
                    () -> assertThat(file.get("version").asLong()).isEqualTo(1),
                    () -> assertThat(file.get("lastUpdated").asText()).isEqualTo("2024-05-01T10:15:30Z"),
                    () -> assertThat(file.get("events")).hasSize(1)
            );
        }

        @Test
        void a_failed_write_leaves_the_stream_and_its_version_unchanged() throws IOException {
            // Given
            JsonFileEventStore eventStore = new JsonFileEventStore(dataDirectory);
            // A non-empty directory in place of the stream file makes the final move fail
            Path blocked = Files.createDirectories(dataDirectory.resolve("cart-1.json"));
            Files.writeString(blocked.resolve("occupied"), "x");

            // When
            Throwable throwable = catchThrowable(() -> eventStore.write("cart-1", 0, Stream.of(event("A"))));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(EventStoreException.class),
                    () -> assertThat(((EventStoreException) throwable).eventStreamId).isEqualTo("cart-1"),
                    () -> assertThat(eventStore.read("cart-1").version()).isZero(),
                    () -> assertThat(eventStore.exists("cart-1")).isFalse(),
                    () -> assertThat(filesEndingWith(JsonFileEventStore.TEMP_FILE_SUFFIX)).isEmpty()
            );
        }
    }

    @Nested
    @DisplayName("recovery")
    class RecoveryTest {

        @Test
        void temporary_files_left_by_an_interrupted_write_are_removed_and_ignored() throws IOException {
            // Given
            new JsonFileEventStore(dataDirectory).write("cart-1", 0, Stream.of(event("A")));
            Files.writeString(dataDirectory.resolve("cart-1.json.12345.tmp"), "{\"streamId\":\"cart-1\",\"vers");

            // When
            JsonFileEventStore reopened = new JsonFileEventStore(dataDirectory);

            // Then
            assertThat(reopened.read("cart-1").version()).isEqualTo(1);
            assertThat(filesEndingWith(JsonFileEventStore.TEMP_FILE_SUFFIX)).isEmpty();
        }

        @Test
        void startup_fails_when_a_stream_file_is_corrupt() throws IOException {
            // Given
            Files.writeString(dataDirectory.resolve("cart-1.json"), "{\"streamId\":\"cart-1\",\"vers");

            // When
            Throwable throwable = catchThrowable(() -> new JsonFileEventStore(dataDirectory));

            // Then
            assertThat(throwable).isExactlyInstanceOf(EventStoreException.class);
        }

        @Test
        void startup_fails_when_the_version_of_a_stream_file_doesnt_match_its_events() throws IOException {
            // Given
            new JsonFileEventStore(dataDirectory).write("cart-1", 0, Stream.of(event("A"), event("B")));
            Path file = dataDirectory.resolve("cart-1.json");
            Files.writeString(file, Files.readString(file).replaceFirst("\"version\" : 2", "\"version\" : 3"));

            // When
            Throwable throwable = catchThrowable(() -> new JsonFileEventStore(dataDirectory));

            // Then
            assertThat(throwable).isExactlyInstanceOf(EventStoreException.class).hasMessageContaining("has version 3 but contains 2 events");
        }

        @Test
        void startup_fails_when_a_stream_file_contains_another_stream() throws IOException {
            // Given
            new JsonFileEventStore(dataDirectory).write("cart-1", 0, Stream.of(event("A")));
            Files.move(dataDirectory.resolve("cart-1.json"), dataDirectory.resolve("cart-2.json"));

            // When
            Throwable throwable = catchThrowable(() -> new JsonFileEventStore(dataDirectory));

            // Then
            assertThat(throwable).isExactlyInstanceOf(EventStoreException.class).hasMessageContaining("contains stream cart-1");
        }

        @Test
        void the_data_directory_is_created_when_missing() {
            // Given
            Path nested = dataDirectory.resolve("nested").resolve("carts");

            // When
            JsonFileEventStore eventStore = new JsonFileEventStore(nested);

            // Then
            assertThat(nested).isDirectory();
            assertThat(eventStore.dataDirectory()).isEqualTo(nested);
        }
    }

    @Nested
    @DisplayName("operations")
    class OperationsTest {

        @Test
        void delete_event_stream_removes_the_stream_and_its_file() {
            // Given
            JsonFileEventStore eventStore = new JsonFileEventStore(dataDirectory);
            eventStore.write("cart-1", 0, Stream.of(event("A")));
            eventStore.write("cart-2", 0, Stream.of(event("A")));

            // When
            eventStore.deleteEventStream("cart-1");

            // Then
            assertAll(
                    () -> assertThat(eventStore.exists("cart-1")).isFalse(),
                    () -> assertThat(eventStore.read("cart-1").version()).isZero(),
                    () -> assertThat(eventStore.streamIds()).containsExactly("cart-2"),
                    () -> assertThat(new JsonFileEventStore(dataDirectory).streamIds()).containsExactly("cart-2")
            );
        }

        @Test
        void read_all_returns_every_non_empty_stream() {
            // Given
            JsonFileEventStore eventStore = new JsonFileEventStore(dataDirectory);
            eventStore.write("cart-1", 0, Stream.of(event("A")));
            eventStore.write("cart-2", 0, Stream.of(event("A"), event("B")));
            eventStore.write("cart-3", 0, Stream.empty());

            // When
            List<EventStream<CloudEvent>> streams = eventStore.readAll().collect(Collectors.toList());

            // Then
            assertThat(streams).extracting(EventStream::id).containsExactlyInAnyOrder("cart-1", "cart-2");
            assertThat(eventStore.all().count()).isEqualTo(3);
        }
    }

    private List<Path> streamFiles() {
        return filesEndingWith(JsonFileEventStore.STREAM_FILE_SUFFIX);
    }

    private List<Path> filesEndingWith(String suffix) {
        try (Stream<Path> files = Files.list(dataDirectory)) {
            return files.filter(file -> file.getFileName().toString().endsWith(suffix)).collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private JsonNode json(CloudEvent cloudEvent) throws IOException {
        return objectMapper.readTree(cloudEvent.getData().toBytes());
    }

    private static CloudEvent event(String type) {
        return event(type, "{}");
    }

    private static CloudEvent event(String type, String json) {
        return CloudEventBuilder.v1()
                .withId(UUID.randomUUID().toString())
                .withSource(SOURCE)
                .withType(type)
                .withDataContentType("application/json")
                .withData(json.getBytes(UTF_8))
                .build();
    }
}
