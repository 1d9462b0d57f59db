package dev.mars.txtime.memory;

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
 * One record slot's content. The document is never mutated after it is stored.
 *
 * @param document the stored document
 * @param size     encoded size in bytes
 * @param capacity bytes reserved for the slot; an update that outgrows it moves the record
 */
record StoredRecord(JsonObject document, int size, int capacity) {

    boolean fits(int newSize) {
        return newSize <= capacity;
    }
}
