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

import java.util.Objects;
import java.util.Optional;

/**
 * The half-open transaction-time interval {@code [start, end)} of one document version.
 *
 * <p>An interval whose end is Open (absent) is the interval of the current version and
 * extends through now and onward.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public final class Interval {

    private final Timestamp start;
    private final Timestamp end;

    /**
     * Creates a new interval.
     *
     * @param start The start of the interval, inclusive
     * @param end The end of the interval, exclusive ({@code null} for Open)
     */
    public Interval(Timestamp start, Timestamp end) {
        this.start = Objects.requireNonNull(start, "Interval start cannot be null");
        if (end != null && !end.isAfter(start)) {
            throw new IllegalArgumentException("Interval end " + end + " must be after start " + start);
        }
        this.end = end;
    }

    public static Interval open(Timestamp start) {
        return new Interval(start, null);
    }

    public static Interval closed(Timestamp start, Timestamp end) {
        return new Interval(start, Objects.requireNonNull(end, "Closed interval requires an end"));
    }

    public Timestamp getStart() {
        return start;
    }

    /**
     * Gets the end of the interval.
     *
     * @return The end, or empty when the interval is Open
     */
    public Optional<Timestamp> getEnd() {
        return Optional.ofNullable(end);
    }

    public boolean isOpen() {
        return end == null;
    }

    /**
     * Checks if a point in time falls within this interval.
     *
     * @param time The time to check
     * @return true if {@code start <= time < end}
     */
    public boolean contains(Timestamp time) {
        if (time == null) {
            return false;
        }
        if (time.isBefore(start)) {
            return false;
        }
        return end == null || time.isBefore(end);
    }

    /**
     * Checks if this interval shares at least one instant with the closed range
     * {@code [from, to]}; either bound may be {@code null} for unbounded.
     */
    public boolean intersects(Timestamp from, Timestamp to) {
        if (to != null && start.isAfter(to)) {
            return false;
        }
        return from == null || end == null || end.isAfter(from);
    }

    /**
     * Checks whether {@code next} directly follows this interval with no gap and no overlap.
     */
    public boolean isFollowedBy(Interval next) {
        return end != null && end.equals(next.start);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Interval that = (Interval) o;
        return start.equals(that.start) && Objects.equals(end, that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + (end != null ? end.toString() : "Open") + ")";
    }
}
