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

/**
 * Sort and paging options of a find. The sort spec may use the reserved
 * {@code transaction} key to order versions chronologically.
 */
public final class FindOptions {

    private final JsonObject sort;
    private final int skip;
    private final int limit;

    private FindOptions(JsonObject sort, int skip, int limit) {
        this.sort = sort != null ? sort.copy() : new JsonObject();
        this.skip = skip;
        this.limit = limit;
    }

    public static FindOptions defaults() {
        return new FindOptions(null, 0, 0);
    }

    public static FindOptions sortedBy(JsonObject sort) {
        return new FindOptions(sort, 0, 0);
    }

    public FindOptions withSort(JsonObject newSort) {
        return new FindOptions(newSort, skip, limit);
    }

    public FindOptions withSkip(int newSkip) {
        return new FindOptions(sort, newSkip, limit);
    }

    public FindOptions withLimit(int newLimit) {
        return new FindOptions(sort, skip, newLimit);
    }

    public JsonObject getSort() { return sort.copy(); }
    public int getSkip() { return skip; }
    public int getLimit() { return limit; }
}
