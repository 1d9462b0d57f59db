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
 * Reserved field and operator names of the transaction-time document format.
 *
 * <p>These names are part of the on-disk layout and of the query language, so they
 * must never change between releases:</p>
 * <pre>{@code
 * { "_id": { "_id": "order-1",
 *            "transaction_start": { "$timestamp": { "t": 1000, "i": 0 } },
 *            "transaction_end": null },
 *   "status": "NEW" }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public final class TemporalFields {

    private TemporalFields() {
        // Constants only
    }

    /** The identifier field; holds the composite key on temporal collections. */
    public static final String ID = "_id";

    /** Interval start inside the composite key. */
    public static final String TRANSACTION_START = "transaction_start";

    /** Interval end inside the composite key; {@code null} means Open. */
    public static final String TRANSACTION_END = "transaction_end";

    /** Dotted path of the stable identifier. */
    public static final String STABLE_ID_PATH = ID + "." + ID;

    /** Dotted path of the interval start. */
    public static final String TRANSACTION_START_PATH = ID + "." + TRANSACTION_START;

    /** Dotted path of the interval end. */
    public static final String TRANSACTION_END_PATH = ID + "." + TRANSACTION_END;

    /**
     * Reserved key used as temporal selector in queries, as chronological sort key
     * and as the interval-end placeholder in index key specs.
     */
    public static final String SELECTOR = "transaction";

    public static final String SELECTOR_CURRENT = "current";
    public static final String SELECTOR_ALL = "all";
    public static final String SELECTOR_AT = "at";
    public static final String SELECTOR_IN_RANGE = "inrange";

    /** Wrapper key of a logical timestamp literal. */
    public static final String TIMESTAMP_LITERAL = "$timestamp";

    public static final String OP_OPEN_GT = "$tgt";
    public static final String OP_OPEN_GTE = "$tgte";
    public static final String OP_OPEN_LT = "$tlt";
    public static final String OP_OPEN_LTE = "$tlte";
}
