package dev.mars.txtime.api;

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

import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A logical transaction timestamp: wall-clock seconds plus a tie-break increment.
 *
 * <p>Timestamps are totally ordered by seconds, then increment. In documents they are
 * stored as the literal {@code {"$timestamp": {"t": seconds, "i": increment}}}.</p>
 *
 * @param seconds   seconds since the epoch
 * @param increment tie-break counter within the second
 */
public record Timestamp(long seconds, int increment) implements Comparable<Timestamp> {

    public static final String SECONDS_KEY = "t";
    public static final String INCREMENT_KEY = "i";

    public Timestamp {
        if (seconds < 0) {
            throw new IllegalArgumentException("Timestamp seconds cannot be negative: " + seconds);
        }
        if (increment < 0) {
            throw new IllegalArgumentException("Timestamp increment cannot be negative: " + increment);
        }
    }

    public static Timestamp ofSeconds(long seconds) {
        return new Timestamp(seconds, 0);
    }

    public static Timestamp of(Instant instant) {
        Objects.requireNonNull(instant, "instant cannot be null");
        return new Timestamp(instant.getEpochSecond(), 0);
    }

    /**
     * Returns the wall-clock instant of this timestamp, dropping the increment.
     */
    public Instant toInstant() {
        return Instant.ofEpochSecond(seconds);
    }

    public boolean isAfter(Timestamp other) {
        return compareTo(other) > 0;
    }

    public boolean isBefore(Timestamp other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Timestamp other) {
        int bySeconds = Long.compare(seconds, other.seconds);
        return bySeconds != 0 ? bySeconds : Integer.compare(increment, other.increment);
    }

    /**
     * Encodes this timestamp as its document literal.
     */
    public JsonObject toDocument() {
        return new JsonObject().put(TemporalFields.TIMESTAMP_LITERAL,
            new JsonObject().put(SECONDS_KEY, seconds).put(INCREMENT_KEY, increment));
    }

    /**
     * Checks whether a document value is a timestamp literal.
     */
    public static boolean isLiteral(Object value) {
        JsonObject inner = literalBody(value);
        return inner != null
            && inner.getValue(SECONDS_KEY) instanceof Number
            && inner.getValue(INCREMENT_KEY) instanceof Number;
    }

    /**
     * Decodes a timestamp literal.
     *
     * @throws IllegalArgumentException if the value is not a timestamp literal
     */
    public static Timestamp fromDocument(Object value) {
        if (!isLiteral(value)) {
            throw new IllegalArgumentException("Not a timestamp literal: " + value);
        }
        JsonObject inner = literalBody(value);
        return new Timestamp(((Number) inner.getValue(SECONDS_KEY)).longValue(),
            ((Number) inner.getValue(INCREMENT_KEY)).intValue());
    }

    private static JsonObject literalBody(Object value) {
        JsonObject doc;
        if (value instanceof JsonObject) {
            doc = (JsonObject) value;
        } else if (value instanceof Map) {
            doc = new JsonObject(castMap(value));
        } else {
            return null;
        }
        if (doc.size() != 1) {
            return null;
        }
        Object body = doc.getValue(TemporalFields.TIMESTAMP_LITERAL);
        return body instanceof JsonObject ? (JsonObject) body : null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object value) {
        return (Map<String, Object>) value;
    }

    @Override
    public String toString() {
        return "Timestamp(" + seconds + ", " + increment + ")";
    }
}
