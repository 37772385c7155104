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


package org.cartstream.example.domain.shoppingcart.application;

import org.cartstream.eventstore.api.EventStoreException;
import org.cartstream.eventstore.api.WriteCondition;
import org.cartstream.eventstore.api.WriteConditionNotFulfilledException;
import org.cartstream.example.domain.shoppingcart.model.IllegalShoppingCartStateException;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ErrorCategoryTest {

    @Test
    void failures_are_categorized_by_exception_type() {
        assertThat(ErrorCategory.of(new UnknownProductException("product-9"))).isEqualTo(ErrorCategory.VALIDATION);
        assertThat(ErrorCategory.of(new ValidationException("bad"))).isEqualTo(ErrorCategory.VALIDATION);
        assertThat(ErrorCategory.of(new IllegalShoppingCartStateException("cart-1", "closed"))).isEqualTo(ErrorCategory.ILLEGAL_STATE);
        assertThat(ErrorCategory.of(new WriteConditionNotFulfilledException("cart-1", 2, WriteCondition.streamVersionEq(1), "conflict")))
                .isEqualTo(ErrorCategory.CONCURRENCY_CONFLICT);
        assertThat(ErrorCategory.of(new ShoppingCartNotFoundException("cart-1"))).isEqualTo(ErrorCategory.NOT_FOUND);
        assertThat(ErrorCategory.of(new EventStoreException("cart-1", "disk full", new IOException("disk full")))).isEqualTo(ErrorCategory.STORAGE_FAILURE);
        assertThat(ErrorCategory.of(new NullPointerException())).isEqualTo(ErrorCategory.INTERNAL);
    }
}
