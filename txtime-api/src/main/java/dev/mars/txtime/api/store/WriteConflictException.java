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
package dev.mars.txtime.api.store;

import dev.mars.txtime.api.error.TxTimeErrorCodes;

/**
 * The record at a location no longer holds the expected document, so a
 * compare-on-location update was refused.
 */
public class WriteConflictException extends StoreException {

    private final RecordLocation location;

    public WriteConflictException(String collection, RecordLocation location) {
        super(TxTimeErrorCodes.WRITE_CONFLICT,
            "Record at " + location + " in " + collection + " changed concurrently", false, null);
        this.location = location;
    }

    public RecordLocation getLocation() {
        return location;
    }
}
