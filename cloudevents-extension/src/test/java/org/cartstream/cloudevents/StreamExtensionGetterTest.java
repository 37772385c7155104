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


package org.cartstream.cloudevents;

import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.cartstream.cloudevents.StreamCloudEventExtension.STREAM_ID;
import static org.cartstream.cloudevents.StreamCloudEventExtension.STREAM_VERSION;

@DisplayNameGeneration(ReplaceUnderscores.class)
class StreamExtensionGetterTest {

    @Test
    void stream_id_and_version_are_read_from_a_positioned_cloud_event() {
        // When
        CloudEvent cloudEvent = StreamCloudEventExtension.positionInStream(cloudEvent(), "cart-1", 3);

        // Then
        assertThat(StreamExtensionGetter.getStreamId(cloudEvent)).isEqualTo("cart-1");
        assertThat(StreamExtensionGetter.getStreamVersion(cloudEvent)).isEqualTo(3L);
    }

    @Test
    void repositioning_a_cloud_event_overwrites_the_previous_position() {
        // Given
        CloudEvent cloudEvent = StreamCloudEventExtension.positionInStream(cloudEvent(), "cart-1", 3);

        // When
        CloudEvent repositioned = StreamCloudEventExtension.positionInStream(cloudEvent, "cart-2", 7);

        // Then
        assertThat(repositioned.getExtension(STREAM_ID)).isEqualTo("cart-2");
        assertThat(StreamExtensionGetter.getStreamVersion(repositioned)).isEqualTo(7L);
    }

    @Test
    void stream_version_accepts_integer_values() {
        // Given
        CloudEvent cloudEvent = CloudEventBuilder.v1(cloudEvent()).withExtension(STREAM_VERSION, 2).build();

        // When
        long streamVersion = StreamExtensionGetter.getStreamVersion(cloudEvent);

        // Then
        assertThat(streamVersion).isEqualTo(2L);
    }

    @Test
    void getting_the_stream_id_from_a_cloud_event_without_extension_is_rejected() {
        // When
        Throwable throwable = catchThrowable(() -> StreamExtensionGetter.getStreamId(cloudEvent()));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessageContaining(STREAM_ID);
    }

    @Test
    void stream_version_less_than_one_is_not_allowed() {
        // When
        Throwable throwable = catchThrowable(() -> new StreamCloudEventExtension("cart-1", 0));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Stream version cannot be less than 1");
    }

    private static CloudEvent cloudEvent() {
        return CloudEventBuilder.v1()
                .withId("id")
                .withSource(URI.create("urn:test"))
                .withType("Tested")
                .withData("{}".getBytes(UTF_8))
                .build();
    }
}
