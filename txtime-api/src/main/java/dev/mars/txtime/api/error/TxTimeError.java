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

import java.time.Instant;

/**
 * Immutable error record describing a TxTime failure.
 * 
 * @param code      The standard error code (e.g., TXTERR0553)
 * @param message   Human-readable error message
 * @param timestamp When the error occurred
 * @param details   Optional additional details (can be null)
 */
public record TxTimeError(
    String code,
    String message,
    Instant timestamp,
    String details
) {
    /**
     * Creates an error with code and message, using current timestamp.
     */
    public static TxTimeError of(String code, String message) {
        return new TxTimeError(code, message, Instant.now(), null);
    }

    /**
     * Creates an error with code, message, and details, using current timestamp.
     */
    public static TxTimeError of(String code, String message, String details) {
        return new TxTimeError(code, message, Instant.now(), details);
    }

    /**
     * Creates a collection not found error.
     */
    public static TxTimeError collectionNotFound(String collection) {
        return of(TxTimeErrorCodes.COLLECTION_NOT_FOUND,
                  "Collection not found: " + collection);
    }

    /**
     * Creates a validation failed error.
     */
    public static TxTimeError validationFailed(String message) {
        return of(TxTimeErrorCodes.VALIDATION_FAILED, message);
    }

    /**
     * Creates an internal error.
     */
    public static TxTimeError internalError(String message) {
        return of(TxTimeErrorCodes.INTERNAL_ERROR, message);
    }
}
