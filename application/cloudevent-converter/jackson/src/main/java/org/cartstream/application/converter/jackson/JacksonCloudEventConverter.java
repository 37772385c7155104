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


package org.cartstream.application.converter.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventData;
import io.cloudevents.core.builder.CloudEventBuilder;
import io.cloudevents.core.data.PojoCloudEventData;
import org.cartstream.application.converter.CloudEventConverter;
import org.cartstream.application.typemapper.CloudEventTypeMapper;
import org.cartstream.application.typemapper.ReflectionCloudEventTypeMapper;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.OffsetDateTime;
import java.util.UUID;
import java.util.function.Function;

import static java.time.ZoneOffset.UTC;
import static java.util.Objects.requireNonNull;

/**
 * An {@link CloudEventConverter} that uses a Jackson {@link ObjectMapper} to serialize a domain event to JSON (content type {@value #DEFAULT_CONTENT_TYPE}) that is used as data in a {@link CloudEvent}.
 * <p>
 * The {@link ObjectMapper} must be able to serialize every field of the domain events, register {@code JavaTimeModule} if they contain {@code java.time} types.
 *
 * @param <T> The type of your domain event(s) to convert
 */
public class JacksonCloudEventConverter<T> implements CloudEventConverter<T> {
    private static final String DEFAULT_CONTENT_TYPE = "application/json";

    private final ObjectMapper objectMapper;
    private final URI cloudEventSource;
    private final Class<T> domainEventType;
    private final Function<T, String> idMapper;
    private final CloudEventTypeMapper<T> cloudEventTypeMapper;
    private final Function<T, OffsetDateTime> timeMapper;
    private final Function<T, @Nullable String> subjectMapper;
    private final String contentType;

    /**
     * Create a new instance of the {@link JacksonCloudEventConverter} that does the following:
     * <ol>
     *     <li>Uses a random UUID as cloud event id</li>
     *     <li>Uses the simple name of the domain event class as cloud event type if {@code domainEventType} is sealed, otherwise the fully-qualified name</li>
     *     <li>Uses {@code OffsetDateTime.now(UTC)} as cloud event time</li>
     *     <li>No subject</li>
     * </ol>
     * Use {@link Builder} for more advanced configuration.
     *
     * @param objectMapper     The ObjectMapper instance to use
     * @param cloudEventSource The cloud event source.
     * @param domainEventType  The base type of the domain events
     * @see Builder The Builder for more advanced configuration
     */
    public JacksonCloudEventConverter(ObjectMapper objectMapper, URI cloudEventSource, Class<T> domainEventType) {
        this(objectMapper, cloudEventSource, domainEventType, defaultIdMapperFunction(), defaultTypeMapper(domainEventType), defaultTimeMapperFunction(), defaultSubjectMapperFunction(), DEFAULT_CONTENT_TYPE);
    }

    private JacksonCloudEventConverter(ObjectMapper objectMapper, URI cloudEventSource, Class<T> domainEventType, Function<T, String> idMapper, CloudEventTypeMapper<T> cloudEventTypeMapper,
                                       Function<T, OffsetDateTime> timeMapper, Function<T, @Nullable String> subjectMapper, String contentType) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(cloudEventSource, "cloudEventSource cannot be null");
        requireNonNull(domainEventType, "domainEventType cannot be null");
        requireNonNull(idMapper, "idMapper cannot be null");
        requireNonNull(cloudEventTypeMapper, CloudEventTypeMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(timeMapper, "timeMapper cannot be null");
        requireNonNull(subjectMapper, "subjectMapper cannot be null");
        requireNonNull(contentType, "contentType cannot be null");
        this.objectMapper = objectMapper;
        this.cloudEventSource = cloudEventSource;
        this.domainEventType = domainEventType;
        this.idMapper = idMapper;
        this.timeMapper = timeMapper;
        this.subjectMapper = subjectMapper;
        this.contentType = contentType;
        this.cloudEventTypeMapper = cloudEventTypeMapper;
    }

    /**
     * Converts the {@code domainEvent} into a {@link CloudEvent} using {@link ObjectMapper}.
     *
     * @param domainEvent The domain event to convert
     * @return A {@link CloudEvent} converted from the <code>domainEvent</code>.
     */
    @Override
    public CloudEvent toCloudEvent(T domainEvent) {
        requireNonNull(domainEvent, "Domain event cannot be null");
        // Serialized lazily, and only once, when the data is first requested as bytes
        PojoCloudEventData<T> cloudEventData = PojoCloudEventData.wrap(domainEvent, objectMapper::writeValueAsBytes);
        return CloudEventBuilder.v1()
                .withId(idMapper.apply(domainEvent))
                .withSource(cloudEventSource)
                .withType(cloudEventTypeMapper.getCloudEventType(domainEvent))
                .withTime(timeMapper.apply(domainEvent))
                .withSubject(subjectMapper.apply(domainEvent))
                .withDataContentType(contentType)
                .withData(cloudEventData)
                .build();
    }

    /**
     * Converts the {@link CloudEvent} back into a {@code domainEvent} using {@link ObjectMapper}.
     *
     * @param cloudEvent The cloud event to convert
     * @return A <code>domainEvent</code> converted from a {@link CloudEvent}.
     */
    @Override
    public T toDomainEvent(CloudEvent cloudEvent) {
        requireNonNull(cloudEvent, CloudEvent.class.getSimpleName() + " cannot be null");
        Class<? extends T> type = cloudEventTypeMapper.getDomainEventType(cloudEvent.getType());
        CloudEventData data = requireNonNull(cloudEvent.getData(), "cloud event data cannot be null");

        if (data instanceof PojoCloudEventData && type.isInstance(((PojoCloudEventData<?>) data).getValue())) {
            return type.cast(((PojoCloudEventData<?>) data).getValue());
        }

        try {
            return objectMapper.readValue(data.toBytes(), type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to convert cloud event " + cloudEvent.getId() + " of type " + cloudEvent.getType() + " to a " + domainEventType.getSimpleName(), e);
        }
    }

    @Override
    public String getCloudEventType(Class<? extends T> type) {
        return cloudEventTypeMapper.getCloudEventType(type);
    }

    public static final class Builder<T> {
        private final ObjectMapper objectMapper;
        private final URI cloudEventSource;
        private final Class<T> domainEventType;
        private String contentType = DEFAULT_CONTENT_TYPE;
        private Function<T, String> idMapper = defaultIdMapperFunction();
        private CloudEventTypeMapper<T> cloudEventTypeMapper;
        private Function<T, OffsetDateTime> timeMapper = defaultTimeMapperFunction();
        private Function<T, @Nullable String> subjectMapper = defaultSubjectMapperFunction();

        public Builder(ObjectMapper objectMapper, URI cloudEventSource, Class<T> domainEventType) {
            requireNonNull(domainEventType, "domainEventType cannot be null");
            this.objectMapper = objectMapper;
            this.cloudEventSource = cloudEventSource;
            this.domainEventType = domainEventType;
            this.cloudEventTypeMapper = defaultTypeMapper(domainEventType);
        }

        /**
         * @param contentType Specify the content type to use in the generated cloud event
         */
        public Builder<T> contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        /**
         * @param idMapper A function that generates the cloud event id based on the domain event. By default, a random UUID is used.
         */
        public Builder<T> idMapper(Function<T, String> idMapper) {
            this.idMapper = idMapper;
            return this;
        }

        /**
         * @param cloudEventTypeMapper Maps between domain event classes and cloud event types.
         */
        public Builder<T> typeMapper(CloudEventTypeMapper<T> cloudEventTypeMapper) {
            this.cloudEventTypeMapper = cloudEventTypeMapper;
            return this;
        }

        /**
         * @param timeMapper A function that generates the cloud event time based on the domain event. By default, {@code OffsetDateTime.now(UTC)} is always returned.
         */
        public Builder<T> timeMapper(Function<T, OffsetDateTime> timeMapper) {
            this.timeMapper = timeMapper;
            return this;
        }

        /**
         * @param subjectMapper A function that generates the cloud event subject based on the domain event. By default, {@code null} is always returned.
         */
        public Builder<T> subjectMapper(Function<T, @Nullable String> subjectMapper) {
            this.subjectMapper = subjectMapper;
            return this;
        }

        /**
         * @return A {@link JacksonCloudEventConverter} instance with the configured settings
         */
        public JacksonCloudEventConverter<T> build() {
            return new JacksonCloudEventConverter<>(objectMapper, cloudEventSource, domainEventType, idMapper, cloudEventTypeMapper, timeMapper, subjectMapper, contentType);
        }
    }

    private static <T> Function<T, String> defaultIdMapperFunction() {
        return __ -> UUID.randomUUID().toString();
    }

    private static <T> CloudEventTypeMapper<T> defaultTypeMapper(Class<T> domainEventType) {
        return domainEventType.isSealed() ? ReflectionCloudEventTypeMapper.simple(domainEventType) : ReflectionCloudEventTypeMapper.qualified(domainEventType);
    }

    private static <T> Function<T, OffsetDateTime> defaultTimeMapperFunction() {
        return __ -> OffsetDateTime.now(UTC);
    }

    private static <T> Function<T, @Nullable String> defaultSubjectMapperFunction() {
        return __ -> null;
    }
}
