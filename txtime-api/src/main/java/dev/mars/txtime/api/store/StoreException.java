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

import dev.mars.txtime.api.error.TemporalException;
import dev.mars.txtime.api.error.TxTimeErrorCodes;

/**
 * Failure reported by a {@link DocumentStore} primitive.
 */
public class StoreException extends TemporalException {

    private final boolean retryable;

    public StoreException(String message) {
        this(TxTimeErrorCodes.STORE_FAILURE, message, false, null);
    }

    public StoreException(String message, boolean retryable, Throwable cause) {
        this(TxTimeErrorCodes.STORE_FAILURE, message, retryable, cause);
    }

    protected StoreException(String code, String message, boolean retryable, Throwable cause) {
        super(code, message, cause);
        this.retryable = retryable;
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }
}
