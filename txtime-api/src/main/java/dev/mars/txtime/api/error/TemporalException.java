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
 * Base class of all TxTime failures. Every instance carries one of the
 * {@link TxTimeErrorCodes} so callers can react without parsing messages.
 */
public class TemporalException extends RuntimeException {

    private final String code;
    private final String details;

    public TemporalException(String code, String message) {
        this(code, message, null, null);
    }

    public TemporalException(String code, String message, Throwable cause) {
        this(code, message, null, cause);
    }

    public TemporalException(String code, String message, String details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details;
    }

    public String getCode() {
        return code;
    }

    public String getDetails() {
        return details;
    }

    /**
     * Whether repeating the same operation may succeed.
     */
    public boolean isRetryable() {
        return false;
    }

    public TxTimeError toError() {
        return TxTimeError.of(code, getMessage(), details);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }
}
