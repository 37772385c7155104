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
import org.cartstream.eventstore.api.WriteConditionNotFulfilledException;
import org.cartstream.example.domain.shoppingcart.model.IllegalShoppingCartStateException;

import static java.util.Objects.requireNonNull;

/**
 * The categories of failures that a caller of {@link ShoppingCarts} can distinguish, for example to choose an HTTP status code.
 */
public enum ErrorCategory {
    /**
     * The input was rejected before the command was handled
     */
    VALIDATION,
    /**
     * The command is not allowed in the current state of the shopping cart
     */
    ILLEGAL_STATE,
    /**
     * The shopping cart was changed after the caller read it, read it again and retry
     */
    CONCURRENCY_CONFLICT,
    NOT_FOUND,
    /**
     * The events couldn't be read or durably stored, the command had no effect
     */
    STORAGE_FAILURE,
    INTERNAL;

    public static ErrorCategory of(Throwable throwable) {
        requireNonNull(throwable, "throwable cannot be null");
        if (throwable instanceof ValidationException) {
            return VALIDATION;
        } else if (throwable instanceof IllegalShoppingCartStateException) {
            return ILLEGAL_STATE;
        } else if (throwable instanceof WriteConditionNotFulfilledException) {
            return CONCURRENCY_CONFLICT;
        } else if (throwable instanceof ShoppingCartNotFoundException) {
            return NOT_FOUND;
        } else if (throwable instanceof EventStoreException) {
            return STORAGE_FAILURE;
        }
        return INTERNAL;
    }
}
