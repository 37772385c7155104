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


package org.cartstream.application.typemapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A reflection-based {@link CloudEventTypeMapper} that uses either the qualified or simple name of a domain event class
 * as cloud event type.
 *
 * @param <T> The base-type of your domain events
 */
public class ReflectionCloudEventTypeMapper<T> implements CloudEventTypeMapper<T> {
    private final Class<T> domainEventType;
    private final boolean simpleName;
    private final Map<String, Class<? extends T>> simpleNameToClass;

    private ReflectionCloudEventTypeMapper(Class<T> domainEventType, boolean simpleName) {
        Objects.requireNonNull(domainEventType, "domainEventType cannot be null");
        this.domainEventType = domainEventType;
        this.simpleName = simpleName;
        this.simpleNameToClass = simpleName ? concreteSubclassesBySimpleName(domainEventType) : Collections.emptyMap();
    }

    @Override
    public String getCloudEventType(Class<? extends T> type) {
        Objects.requireNonNull(type, "type cannot be null");
        return simpleName ? type.getSimpleName() : type.getName();
    }

    @Override
    public Class<? extends T> getDomainEventType(String cloudEventType) {
        Objects.requireNonNull(cloudEventType, "cloudEventType cannot be null");
        if (simpleName) {
            Class<? extends T> type = simpleNameToClass.get(cloudEventType);
            if (type == null) {
                throw new IllegalArgumentException("Unknown cloud event type " + cloudEventType + ", expected one of " + simpleNameToClass.keySet());
            }
            return type;
        }

        final Class<?> type;
        try {
            type = Class.forName(cloudEventType);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Unknown cloud event type " + cloudEventType, e);
        }
        if (!domainEventType.isAssignableFrom(type)) {
            throw new IllegalArgumentException("Cloud event type " + cloudEventType + " is not a " + domainEventType.getName());
        }
        return type.asSubclass(domainEventType);
    }

    /**
     * Create an instance of {@link ReflectionCloudEventTypeMapper} that uses the simple name of a class as cloud event type.
     * The domain event types are resolved from the permitted subclasses of the sealed {@code domainEventType}, which
     * allows nested event records.
     *
     * @throws IllegalArgumentException If {@code domainEventType} is not sealed or two event classes share the same simple name
     */
    public static <T> ReflectionCloudEventTypeMapper<T> simple(Class<T> domainEventType) {
        return new ReflectionCloudEventTypeMapper<>(domainEventType, true);
    }

    /**
     * @return An instance of {@link ReflectionCloudEventTypeMapper} that uses the fully qualified name of a class as cloud event type
     */
    public static <T> ReflectionCloudEventTypeMapper<T> qualified(Class<T> domainEventType) {
        return new ReflectionCloudEventTypeMapper<>(domainEventType, false);
    }

    private static <T> Map<String, Class<? extends T>> concreteSubclassesBySimpleName(Class<T> domainEventType) {
        if (!domainEventType.isSealed()) {
            throw new IllegalArgumentException(domainEventType.getName() + " must be sealed to map simple class names to domain event types");
        }
        Map<String, Class<? extends T>> types = new LinkedHashMap<>();
        collect(domainEventType, domainEventType, types);
        return Collections.unmodifiableMap(types);
    }

    private static <T> void collect(Class<T> root, Class<?> type, Map<String, Class<? extends T>> types) {
        if (type.isSealed()) {
            for (Class<?> permitted : type.getPermittedSubclasses()) {
                collect(root, permitted, types);
            }
        } else {
            Class<? extends T> previous = types.put(type.getSimpleName(), type.asSubclass(root));
            if (previous != null && previous != type) {
                throw new IllegalArgumentException("Both " + previous.getName() + " and " + type.getName() + " have simple name " + type.getSimpleName());
            }
        }
    }
}
