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

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Looks up the current unit price of a product.
 */
@FunctionalInterface
public interface ProductPriceLookup {

    /**
     * @return The unit price, or empty if the product is unknown
     */
    Optional<BigDecimal> priceOf(String productId);
}
