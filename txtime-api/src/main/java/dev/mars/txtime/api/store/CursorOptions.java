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

/**
 * Options for a store cursor.
 */
public final class CursorOptions {

    private static final CursorOptions DEFAULTS = builder().build();

    private final JsonObject sort;
    private final int skip;
    private final int limit;
    private final boolean noTimeout;

    private CursorOptions(Builder builder) {
        this.sort = builder.sort != null ? builder.sort.copy() : new JsonObject();
        this.skip = builder.skip;
        this.limit = builder.limit;
        this.noTimeout = builder.noTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CursorOptions defaults() {
        return DEFAULTS;
    }

    /** Sort spec; empty for store order. */
    public JsonObject getSort() { return sort.copy(); }
    public int getSkip() { return skip; }
    /** Maximum number of results; 0 means unlimited. */
    public int getLimit() { return limit; }
    /** Whether the cursor is exempt from the store's idle timeout. */
    public boolean isNoTimeout() { return noTimeout; }

    /**
     * Builder for CursorOptions.
     */
    public static class Builder {
        private JsonObject sort;
        private int skip = 0;
        private int limit = 0;
        private boolean noTimeout = false;

        public Builder sort(JsonObject sort) {
            this.sort = sort;
            return this;
        }

        public Builder skip(int skip) {
            if (skip < 0) {
                throw new IllegalArgumentException("Skip cannot be negative");
            }
            this.skip = skip;
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("Limit cannot be negative");
            }
            this.limit = limit;
            return this;
        }

        public Builder noTimeout(boolean noTimeout) {
            this.noTimeout = noTimeout;
            return this;
        }

        public CursorOptions build() {
            return new CursorOptions(this);
        }
    }
}
