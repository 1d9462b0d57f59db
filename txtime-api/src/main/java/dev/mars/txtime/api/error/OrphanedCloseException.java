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
package dev.mars.txtime.api.error;

import io.vertx.core.json.JsonObject;

/**
 * A version was closed but its successor could not be inserted, leaving the chain
 * without a current version.
 *
 * <p>The exception carries everything needed to finish the transition later: inserting
 * {@link #getSuccessor()} restores a current version whose start equals the closed
 * version's end.</p>
 */
public class OrphanedCloseException extends TemporalException {

    private final String collection;
    private final Object stableId;
    private final JsonObject closedVersion;
    private final JsonObject successor;

    public OrphanedCloseException(String collection, Object stableId, JsonObject closedVersion,
                                  JsonObject successor, Throwable cause) {
        super(TxTimeErrorCodes.ORPHANED_CLOSE,
            "Version of '" + stableId + "' in " + collection + " was closed but its successor was not inserted",
            successor.encode(), cause);
        this.collection = collection;
        this.stableId = stableId;
        this.closedVersion = closedVersion.copy();
        this.successor = successor.copy();
    }

    public String getCollection() {
        return collection;
    }

    public Object getStableId() {
        return stableId;
    }

    public JsonObject getClosedVersion() {
        return closedVersion.copy();
    }

    public JsonObject getSuccessor() {
        return successor.copy();
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
