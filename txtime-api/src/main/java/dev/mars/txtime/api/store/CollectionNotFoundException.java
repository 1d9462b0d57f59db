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
 * The addressed collection does not exist in the store.
 */
public class CollectionNotFoundException extends StoreException {

    private final String collection;

    public CollectionNotFoundException(String collection) {
        super(TxTimeErrorCodes.COLLECTION_NOT_FOUND, "Collection not found: " + collection, false, null);
        this.collection = collection;
    }

    public String getCollection() {
        return collection;
    }
}
