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

import org.jspecify.annotations.Nullable;

/**
 * Parses the version a caller expects a shopping cart to have, as sent in a conditional request (for example an {@code If-Match} header).
 */
public final class ExpectedVersion {

    private ExpectedVersion() {
    }

    /**
     * @param token The version, optionally in double quotes. {@code null} or blank means that the caller has no expectation.
     * @return The expected version, or {@code null} if the caller has no expectation
     * @throws ValidationException If the token is not a non-negative integer
     */
    public static @Nullable Long parse(@Nullable String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        String version = token.trim();
        if (version.length() >= 2 && version.startsWith("\"") && version.endsWith("\"")) {
            version = version.substring(1, version.length() - 1);
        }
        if (version.isEmpty() || !version.chars().allMatch(Character::isDigit)) {
            throw new ValidationException("Invalid expected version: " + token);
        }
        try {
            return Long.parseLong(version);
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid expected version: " + token, e);
        }
    }
}
