package dev.mars.txtime.core.repository;

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

import dev.mars.txtime.api.Interval;
import dev.mars.txtime.api.Timestamp;

import java.util.Objects;
import java.util.Optional;

/**
 * One version of a typed value together with its transaction-time interval.
 *
 * @param <T> the value type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public class VersionedValue<T> {

    private final Object id;
    private final T value;
    private final Interval interval;

    public VersionedValue(Object id, T value, Interval interval) {
        this.id = Objects.requireNonNull(id, "Identifier cannot be null");
        this.value = Objects.requireNonNull(value, "Value cannot be null");
        this.interval = Objects.requireNonNull(interval, "Interval cannot be null");
    }

    public Object getId() {
        return id;
    }

    public T getValue() {
        return value;
    }

    public Interval getInterval() {
        return interval;
    }

    public Timestamp getTransactionStart() {
        return interval.getStart();
    }

    /**
     * Empty while this version is current.
     */
    public Optional<Timestamp> getTransactionEnd() {
        return interval.getEnd();
    }

    public boolean isCurrent() {
        return interval.isOpen();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VersionedValue<?> that = (VersionedValue<?>) o;
        return Objects.equals(id, that.id) && Objects.equals(value, that.value)
            && Objects.equals(interval, that.interval);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, value, interval);
    }

    @Override
    public String toString() {
        return "VersionedValue{id=" + id + ", interval=" + interval + ", value=" + value + "}";
    }
}
