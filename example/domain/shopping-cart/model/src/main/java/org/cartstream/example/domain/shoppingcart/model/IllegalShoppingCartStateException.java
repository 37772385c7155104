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


package org.cartstream.example.domain.shoppingcart.model;

import java.util.Objects;

/**
 * Thrown when a command is not allowed in the current state of a shopping cart. Nothing is written when this is thrown.
 */
public class IllegalShoppingCartStateException extends IllegalStateException {
    public final String shoppingCartId;

    public IllegalShoppingCartStateException(String shoppingCartId, String message) {
        super(message);
        this.shoppingCartId = shoppingCartId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IllegalShoppingCartStateException)) return false;
        IllegalShoppingCartStateException that = (IllegalShoppingCartStateException) o;
        return Objects.equals(shoppingCartId, that.shoppingCartId) && Objects.equals(getMessage(), that.getMessage());
    }

    @Override
    public int hashCode() {
        return Objects.hash(shoppingCartId, getMessage());
    }

    @Override
    public String toString() {
        return "IllegalShoppingCartStateException{" +
                "shoppingCartId=" + shoppingCartId +
                ", message=" + getMessage() +
                '}';
    }
}
