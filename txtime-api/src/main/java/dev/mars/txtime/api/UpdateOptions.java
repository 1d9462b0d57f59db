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
 * Options of an update request.
 *
 * @param upsert start a new document when nothing current matches
 * @param multi update every matching document instead of the first one
 */
public record UpdateOptions(boolean upsert, boolean multi) {

    public static UpdateOptions single() {
        return new UpdateOptions(false, false);
    }

    public static UpdateOptions multiple() {
        return new UpdateOptions(false, true);
    }

    public static UpdateOptions upsertSingle() {
        return new UpdateOptions(true, false);
    }
}
