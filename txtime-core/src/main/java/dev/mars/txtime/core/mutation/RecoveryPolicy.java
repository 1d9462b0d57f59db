package dev.mars.txtime.core.mutation;

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
 * What the mutation protocol does when a successor insert fails after the previous
 * version was already closed.
 */
public enum RecoveryPolicy {

    /**
     * Re-open the closed version and rethrow the insert failure. Falls back to
     * {@link #SURFACE} if the closed version cannot be re-opened.
     */
    COMPENSATE,

    /**
     * Leave the chain without a current version and throw
     * {@link dev.mars.txtime.api.error.OrphanedCloseException} carrying the successor.
     */
    SURFACE
}
