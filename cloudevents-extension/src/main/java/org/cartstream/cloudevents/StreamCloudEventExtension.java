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
import io.cloudevents.CloudEventExtension;
import io.cloudevents.CloudEventExtensions;
import io.cloudevents.core.builder.CloudEventBuilder;

import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * A {@link CloudEventExtension} that adds the stream id and the position of the event in the stream (the stream version)
 * to a {@link CloudEvent}. Event stores apply this extension to every event they persist, callers never need to add it themselves.
 */
public class StreamCloudEventExtension implements CloudEventExtension {
    public static final String STREAM_ID = "streamid";
    public static final String STREAM_VERSION = "streamversion";

    static final Set<String> KEYS = Set.of(STREAM_ID, STREAM_VERSION);

    private String streamId;
    private long streamVersion;

    public StreamCloudEventExtension(String streamId, long streamVersion) {
        Objects.requireNonNull(streamId, "StreamId cannot be null");
        if (streamVersion < 1) {
            throw new IllegalArgumentException("Stream version cannot be less than 1");
        }
        this.streamId = streamId;
        this.streamVersion = streamVersion;
    }

    public static StreamCloudEventExtension stream(String streamId, long streamVersion) {
        return new StreamCloudEventExtension(streamId, streamVersion);
    }

    /**
     * Return a copy of {@code cloudEvent} positioned at {@code streamVersion} in stream {@code streamId}.
     * Any existing stream id or stream version attribute is overwritten.
     */
    public static CloudEvent positionInStream(CloudEvent cloudEvent, String streamId, long streamVersion) {
        Objects.requireNonNull(cloudEvent, CloudEvent.class.getSimpleName() + " cannot be null");
        return CloudEventBuilder.v1(cloudEvent).withExtension(stream(streamId, streamVersion)).build();
    }

    @Override
    public void readFrom(CloudEventExtensions extensions) {
        Object streamId = extensions.getExtension(STREAM_ID);
        if (streamId != null) {
            this.streamId = streamId.toString();
        }

        Object streamVersion = extensions.getExtension(STREAM_VERSION);
        if (streamVersion instanceof Number) {
            this.streamVersion = ((Number) streamVersion).longValue();
        }
    }

    @Override
    public Object getValue(String key) throws IllegalArgumentException {
        if (STREAM_ID.equals(key)) {
            return this.streamId;
        } else if (STREAM_VERSION.equals(key)) {
            return this.streamVersion;
        }
        throw new IllegalArgumentException(this.getClass().getSimpleName() + " doesn't expect the attribute key \"" + key + "\"");
    }

    @Override
    public Set<String> getKeys() {
        return KEYS;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StreamCloudEventExtension)) return false;
        StreamCloudEventExtension that = (StreamCloudEventExtension) o;
        return streamVersion == that.streamVersion && Objects.equals(streamId, that.streamId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, streamVersion);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", StreamCloudEventExtension.class.getSimpleName() + "[", "]")
                .add("streamId='" + streamId + "'")
                .add("streamVersion=" + streamVersion)
                .toString();
    }
}
