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

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ReflectionCloudEventTypeMapperTest {

    sealed interface AccountEvent permits AccountOpened, AccountClosed, Transfer {
    }

    record AccountOpened(String id) implements AccountEvent {
    }

    record AccountClosed(String id) implements AccountEvent {
    }

    sealed interface Transfer extends AccountEvent permits MoneyDeposited {
    }

    record MoneyDeposited(String id, int amount) implements Transfer {
    }

    @Test
    void simple_mapper_uses_the_simple_class_name_as_cloud_event_type() {
        ReflectionCloudEventTypeMapper<AccountEvent> mapper = ReflectionCloudEventTypeMapper.simple(AccountEvent.class);

        assertThat(mapper.getCloudEventType(new AccountOpened("1"))).isEqualTo("AccountOpened");
        assertThat(mapper.getCloudEventType(MoneyDeposited.class)).isEqualTo("MoneyDeposited");
    }

    @Test
    void simple_mapper_resolves_nested_permitted_subclasses() {
        ReflectionCloudEventTypeMapper<AccountEvent> mapper = ReflectionCloudEventTypeMapper.simple(AccountEvent.class);

        assertThat(mapper.getDomainEventType("AccountClosed")).isEqualTo(AccountClosed.class);
        assertThat(mapper.getDomainEventType("MoneyDeposited")).isEqualTo(MoneyDeposited.class);
    }

    @Test
    void simple_mapper_rejects_unknown_cloud_event_types() {
        ReflectionCloudEventTypeMapper<AccountEvent> mapper = ReflectionCloudEventTypeMapper.simple(AccountEvent.class);

        Throwable throwable = catchThrowable(() -> mapper.getDomainEventType("AccountFrozen"));

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessageStartingWith("Unknown cloud event type AccountFrozen");
    }

    @Test
    void simple_mapper_requires_a_sealed_domain_event_type() {
        Throwable throwable = catchThrowable(() -> ReflectionCloudEventTypeMapper.simple(Object.class));

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void qualified_mapper_uses_the_fully_qualified_class_name() {
        ReflectionCloudEventTypeMapper<AccountEvent> mapper = ReflectionCloudEventTypeMapper.qualified(AccountEvent.class);

        String cloudEventType = mapper.getCloudEventType(AccountOpened.class);

        assertThat(cloudEventType).isEqualTo(AccountOpened.class.getName());
        assertThat(mapper.getDomainEventType(cloudEventType)).isEqualTo(AccountOpened.class);
        assertThat(catchThrowable(() -> mapper.getDomainEventType(String.class.getName()))).isInstanceOf(IllegalArgumentException.class);
    }
}
