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

/**
 * Standard error codes for the TxTime overlay.
 * 
 * Error code ranges:
 * - TXTERR0001-0049: General/System errors
 * - TXTERR0100-0149: Collection/Configuration errors
 * - TXTERR0250-0299: Version chain errors (invariants and partial failures)
 * - TXTERR0500-0549: Storage/Resource errors
 * - TXTERR0550-0599: Validation errors
 */
public final class TxTimeErrorCodes {

    private TxTimeErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "TXTERR0001";
    public static final String OPERATION_INTERRUPTED = "TXTERR0002";

    // ========================================================================
    // Collection/Configuration Errors (0100-0149)
    // ========================================================================
    public static final String COLLECTION_NOT_FOUND = "TXTERR0100";
    public static final String COLLECTION_OPTIONS_CONFLICT = "TXTERR0101";
    public static final String NOT_TEMPORAL_COLLECTION = "TXTERR0102";

    // ========================================================================
    // Version Chain Errors (0250-0299)
    // ========================================================================
    public static final String MALFORMED_VERSION = "TXTERR0250";
    public static final String CLOSE_HISTORIC_VERSION = "TXTERR0251";
    public static final String ADVANCE_FROM_OPEN_VERSION = "TXTERR0252";
    public static final String NON_MONOTONIC_CLOCK = "TXTERR0253";
    public static final String ORPHANED_CLOSE = "TXTERR0260";

    // ========================================================================
    // Storage/Resource Errors (0500-0549)
    // ========================================================================
    public static final String DOCUMENT_TOO_LARGE = "TXTERR0500";
    public static final String STORE_FAILURE = "TXTERR0501";
    public static final String DUPLICATE_KEY = "TXTERR0502";
    public static final String WRITE_CONFLICT = "TXTERR0503";
    public static final String CURSOR_TIMEOUT = "TXTERR0504";

    // ========================================================================
    // Validation Errors (0550-0599)
    // ========================================================================
    public static final String VALIDATION_FAILED = "TXTERR0550";
    public static final String UNKNOWN_TEMPORAL_SELECTOR = "TXTERR0551";
    public static final String INVALID_RANGE = "TXTERR0552";
    public static final String NON_CURRENT_MUTATION = "TXTERR0553";
    public static final String MIXED_UPDATE_STYLES = "TXTERR0554";
    public static final String MULTI_REQUIRES_OPERATORS = "TXTERR0555";
    public static final String UNKNOWN_UPDATE_OPERATOR = "TXTERR0556";
    public static final String IDENTIFIER_CHANGED = "TXTERR0557";
    public static final String INVALID_FIELD_VALUE = "TXTERR0558";
    public static final String INVALID_INDEX_SPEC = "TXTERR0559";
}
