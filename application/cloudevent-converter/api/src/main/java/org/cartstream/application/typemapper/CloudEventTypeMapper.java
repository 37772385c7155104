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

/**
 * A cloud event type mapper gets the cloud event type from a class or instance of your domain event type and vice versa.
 * It's different from a "CloudEventConverter" in that it only deals with the type of the cloud event.
 *
 * @param <T> The base type of your domain events
 */
public interface CloudEventTypeMapper<T> extends CloudEventTypeGetter<T>, DomainEventTypeGetter<T> {
}
