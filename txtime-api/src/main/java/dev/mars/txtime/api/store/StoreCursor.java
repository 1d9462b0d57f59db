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
 * Forward-only cursor over the records of one collection that match a predicate.
 *
 * <p>An unsorted cursor reads the collection live: records inserted or relocated ahead of
 * its position while it is open may be returned. Callers that write while scanning must
 * track the locations they produced themselves.</p>
 */
public interface StoreCursor extends AutoCloseable {

    /**
     * Whether the cursor is positioned on a matching record.
     */
    boolean ok();

    /**
     * Location of the current record.
     *
     * @throws IllegalStateException if {@link #ok()} is false
     */
    RecordLocation location();

    /**
     * A copy of the current record.
     *
     * @throws IllegalStateException if {@link #ok()} is false
     */
    JsonObject current();

    /**
     * Moves to the next matching record.
     */
    void advance();

    /**
     * Yield point: lets the store reclaim resources between records. Returns false if the
     * cursor cannot continue (for example because its collection was dropped).
     */
    boolean yieldPoint();

    /**
     * Identifier assigned by the store.
     */
    long id();

    @Override
    void close();
}
