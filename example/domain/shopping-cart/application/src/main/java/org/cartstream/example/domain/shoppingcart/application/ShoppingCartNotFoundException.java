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

import java.util.Objects;

public class ShoppingCartNotFoundException extends RuntimeException {
    public final String shoppingCartId;

    public ShoppingCartNotFoundException(String shoppingCartId) {
        super("Shopping cart " + shoppingCartId + " not found");
        this.shoppingCartId = shoppingCartId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShoppingCartNotFoundException)) return false;
        ShoppingCartNotFoundException that = (ShoppingCartNotFoundException) o;
        return Objects.equals(shoppingCartId, that.shoppingCartId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shoppingCartId);
    }

    @Override
    public String toString() {
        return "ShoppingCartNotFoundException{shoppingCartId=" + shoppingCartId + '}';
    }
}
