package dev.mars.txtime.api.store;

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

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Definition of a secondary index: an ordered key spec plus uniqueness and retention options.
 *
 * <p>The key spec maps dotted field paths to a direction ({@code 1} or {@code -1}); its field
 * order is significant.</p>
 */
public final class IndexDefinition {

    private final String name;
    private final JsonObject keys;
    private final boolean unique;
    private final Long expireAfterSeconds;

    private IndexDefinition(Builder builder) {
        this.keys = builder.keys.copy();
        this.name = builder.name != null ? builder.name : defaultName(this.keys);
        this.unique = builder.unique;
        this.expireAfterSeconds = builder.expireAfterSeconds;
    }

    public static Builder builder(JsonObject keys) {
        return new Builder(keys);
    }

    /**
     * Derives the conventional index name, e.g. {@code sku_1_qty_-1}.
     */
    public static String defaultName(JsonObject keys) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Object> entry : keys) {
            if (sb.length() > 0) {
                sb.append('_');
            }
            sb.append(entry.getKey()).append('_').append(entry.getValue());
        }
        return sb.toString();
    }

    public String getName() { return name; }
    public JsonObject getKeys() { return keys.copy(); }
    public boolean isUnique() { return unique; }
    public Optional<Long> getExpireAfterSeconds() { return Optional.ofNullable(expireAfterSeconds); }

    /**
     * Returns a copy of this definition with another key spec, keeping the name only if it
     * was chosen explicitly.
     */
    public IndexDefinition withKeys(JsonObject newKeys, boolean keepName) {
        Builder builder = new Builder(newKeys).unique(unique);
        if (keepName) {
            builder.name(name);
        }
        if (expireAfterSeconds != null) {
            builder.expireAfterSeconds(expireAfterSeconds);
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IndexDefinition that = (IndexDefinition) o;
        return unique == that.unique && name.equals(that.name) && keys.equals(that.keys)
            && Objects.equals(expireAfterSeconds, that.expireAfterSeconds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, keys, unique, expireAfterSeconds);
    }

    @Override
    public String toString() {
        return "IndexDefinition{name='" + name + "', keys=" + keys.encode() + ", unique=" + unique
            + ", expireAfterSeconds=" + expireAfterSeconds + "}";
    }

    /**
     * Builder for IndexDefinition.
     */
    public static class Builder {
        private final JsonObject keys;
        private String name;
        private boolean unique;
        private Long expireAfterSeconds;

        private Builder(JsonObject keys) {
            this.keys = Objects.requireNonNull(keys, "Index keys cannot be null");
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder unique(boolean unique) {
            this.unique = unique;
            return this;
        }

        public Builder expireAfterSeconds(long seconds) {
            if (seconds < 0) {
                throw new IllegalArgumentException("expireAfterSeconds cannot be negative");
            }
            this.expireAfterSeconds = seconds;
            return this;
        }

        public IndexDefinition build() {
            if (keys.isEmpty()) {
                throw new IllegalArgumentException("Index key spec cannot be empty");
            }
            return new IndexDefinition(this);
        }
    }
}
