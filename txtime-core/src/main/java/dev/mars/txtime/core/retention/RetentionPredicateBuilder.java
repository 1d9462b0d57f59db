package dev.mars.txtime.core.retention;

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

import dev.mars.txtime.api.TemporalFields;
import dev.mars.txtime.api.Timestamp;
import dev.mars.txtime.api.error.TemporalValidationException;
import dev.mars.txtime.api.error.TxTimeErrorCodes;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.Objects;

/**
 * Builds the predicate selecting documents whose retention field is older than a cutoff.
 *
 * <p>The field may hold wall-clock instants or logical timestamps, so both forms are
 * matched:</p>
 * <pre>{@code
 * {"$or": [{"_id.transaction_end": {"$lt": <now - cutoff>}},
 *          {"_id.transaction_end": {"$tlt": {"$timestamp": {"t": <now - cutoff>, "i": 0}}}}]}
 * }</pre>
 *
 * <p>An Open interval end is never older than the cutoff, so current versions are never
 * selected.</p>
 */
public final class RetentionPredicateBuilder {

    private RetentionPredicateBuilder() {
    }

    /**
     * @param field the dotted path of the retention field
     * @param cutoffSeconds documents older than this many seconds are selected
     * @param now the wall-clock reference time
     * @throws TemporalValidationException if the field is the interval start or the cutoff
     *         is negative
     */
    public static JsonObject purgeQuery(String field, long cutoffSeconds, Instant now) {
        Objects.requireNonNull(field, "Retention field cannot be null");
        Objects.requireNonNull(now, "Reference time cannot be null");
        if (TemporalFields.TRANSACTION_START_PATH.equals(field)) {
            throw new TemporalValidationException(TxTimeErrorCodes.VALIDATION_FAILED,
                "Retention cannot be based on " + TemporalFields.TRANSACTION_START_PATH
                    + "; it would purge current versions");
        }
        if (cutoffSeconds < 0) {
            throw new TemporalValidationException(TxTimeErrorCodes.VALIDATION_FAILED,
                "Retention cutoff cannot be negative: " + cutoffSeconds);
        }
        Instant threshold = now.minusSeconds(cutoffSeconds);
        Timestamp logicalThreshold = Timestamp.ofSeconds(Math.max(0L, threshold.getEpochSecond()));
        return new JsonObject().put("$or", new JsonArray()
            .add(new JsonObject().put(field, new JsonObject().put("$lt", threshold)))
            .add(new JsonObject().put(field,
                new JsonObject().put(TemporalFields.OP_OPEN_LT, logicalThreshold.toDocument()))));
    }
}
