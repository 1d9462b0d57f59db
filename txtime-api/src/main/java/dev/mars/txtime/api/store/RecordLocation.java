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

/**
 * Physical position of a record inside a collection. Locations may be reused by the
 * store once the record that held them moved or was removed.
 *
 * @param slot store-assigned slot number
 */
public record RecordLocation(long slot) implements Comparable<RecordLocation> {

    @Override
    public int compareTo(RecordLocation other) {
        return Long.compare(slot, other.slot);
    }

    @Override
    public String toString() {
        return "loc:" + slot;
    }
}
