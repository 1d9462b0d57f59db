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
 * Chooses which versions of a chain a find targets.
 *
 * <p>The set of kinds is closed. Instances are produced by the selector parser from the
 * reserved {@code transaction} query field, or directly through the factories below.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public final class TemporalSelector {

    /**
     * Kind of temporal selection.
     */
    public enum Kind {
        /** No selector given: current versions only. */
        DEFAULT,
        /** Explicit {@code {current: true}}. */
        CURRENT,
        /** Every version of every chain. */
        ALL,
        /** The versions valid at one point in time. */
        AT,
        /** The versions whose interval intersects a range. */
        IN_RANGE
    }

    private static final TemporalSelector DEFAULT = new TemporalSelector(Kind.DEFAULT, null, null);
    private static final TemporalSelector CURRENT = new TemporalSelector(Kind.CURRENT, null, null);
    private static final TemporalSelector ALL = new TemporalSelector(Kind.ALL, null, null);

    private final Kind kind;
    private final Timestamp from;
    private final Timestamp to;

    private TemporalSelector(Kind kind, Timestamp from, Timestamp to) {
        this.kind = kind;
        this.from = from;
        this.to = to;
    }

    public static TemporalSelector defaultSelector() {
        return DEFAULT;
    }

    public static TemporalSelector current() {
        return CURRENT;
    }

    public static TemporalSelector all() {
        return ALL;
    }

    public static TemporalSelector at(Timestamp time) {
        Objects.requireNonNull(time, "Point in time cannot be null");
        return new TemporalSelector(Kind.AT, time, time);
    }

    /**
     * Creates a range selector. At least one bound must be given.
     *
     * @param from lower bound, or {@code null} for unbounded
     * @param to upper bound, or {@code null} for unbounded
     */
    public static TemporalSelector inRange(Timestamp from, Timestamp to) {
        if (from == null && to == null) {
            throw new IllegalArgumentException("At least one range bound must be concrete");
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("Range start " + from + " is after range end " + to);
        }
        return new TemporalSelector(Kind.IN_RANGE, from, to);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * True for selectors that only target the current version of each chain.
     */
    public boolean isCurrentOnly() {
        return kind == Kind.DEFAULT || kind == Kind.CURRENT;
    }

    /**
     * Point in time of an {@link Kind#AT} selector.
     */
    public Optional<Timestamp> getAt() {
        return kind == Kind.AT ? Optional.of(from) : Optional.empty();
    }

    /**
     * Lower bound of an {@link Kind#IN_RANGE} selector.
     */
    public Optional<Timestamp> getFrom() {
        return kind == Kind.IN_RANGE ? Optional.ofNullable(from) : Optional.empty();
    }

    /**
     * Upper bound of an {@link Kind#IN_RANGE} selector.
     */
    public Optional<Timestamp> getTo() {
        return kind == Kind.IN_RANGE ? Optional.ofNullable(to) : Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TemporalSelector that = (TemporalSelector) o;
        return kind == that.kind && Objects.equals(from, that.from) && Objects.equals(to, that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, from, to);
    }

    @Override
    public String toString() {
        switch (kind) {
            case AT:
                return "TemporalSelector{at=" + from + "}";
            case IN_RANGE:
                return "TemporalSelector{inrange=[" + from + ", " + to + "]}";
            default:
                return "TemporalSelector{" + kind + "}";
        }
    }
}
