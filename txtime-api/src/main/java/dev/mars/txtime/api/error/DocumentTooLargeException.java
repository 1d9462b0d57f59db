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
 * A version would exceed the maximum document size.
 */
public class DocumentTooLargeException extends TemporalException {

    private final int size;
    private final int limit;

    public DocumentTooLargeException(int size, int limit) {
        super(TxTimeErrorCodes.DOCUMENT_TOO_LARGE,
            "Document of " + size + " bytes exceeds the maximum of " + limit + " bytes");
        this.size = size;
        this.limit = limit;
    }

    public int getSize() {
        return size;
    }

    public int getLimit() {
        return limit;
    }
}
