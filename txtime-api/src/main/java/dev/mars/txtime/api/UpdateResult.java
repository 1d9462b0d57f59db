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

/**
 * Outcome of an update request.
 *
 * @param matched number of current documents matched
 * @param modified number of documents transitioned to a new version
 * @param upsertedId stable identifier of an upserted document, or null
 * @param interrupted true if the scan stopped early at a yield point
 */
public record UpdateResult(long matched, long modified, Object upsertedId, boolean interrupted) {

    public static UpdateResult none() {
        return new UpdateResult(0, 0, null, false);
    }

    public boolean isUpsert() {
        return upsertedId != null;
    }
}
