/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.tessera.workflow;

import java.time.Duration;
import java.util.Locale;

/**
 * Parses durations written as {@code 500ms}, {@code 30s}, {@code 5m} or {@code 2h}.
 * A bare number is read as seconds.
 */
final class DurationFormat {

    private DurationFormat() {
    }

    static Duration parse(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Duration cannot be null");
        }
        if (value instanceof Number) {
            long seconds = ((Number) value).longValue();
            return checked(Duration.ofSeconds(seconds), value);
        }
        String trimmed = value.toString().trim().toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Duration cannot be empty");
        }
        try {
            if (trimmed.endsWith("ms")) {
                return checked(Duration.ofMillis(Long.parseLong(number(trimmed, 2))), value);
            } else if (trimmed.endsWith("s")) {
                return checked(Duration.ofSeconds(Long.parseLong(number(trimmed, 1))), value);
            } else if (trimmed.endsWith("m")) {
                return checked(Duration.ofMinutes(Long.parseLong(number(trimmed, 1))), value);
            } else if (trimmed.endsWith("h")) {
                return checked(Duration.ofHours(Long.parseLong(number(trimmed, 1))), value);
            } else {
                return checked(Duration.ofSeconds(Long.parseLong(trimmed)), value);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration '" + value + "', expected e.g. 500ms, 30s, 5m or 2h");
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Duration out of range: " + value);
        }
    }

    static boolean isValid(Object value) {
        try {
            parse(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String number(String text, int suffixLength) {
        return text.substring(0, text.length() - suffixLength).trim();
    }

    private static Duration checked(Duration duration, Object original) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration cannot be negative: " + original);
        }
        return duration;
    }
}
