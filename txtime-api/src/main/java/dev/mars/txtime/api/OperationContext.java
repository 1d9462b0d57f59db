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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-request context of a multi-document operation.
 *
 * <p>A request may be cancelled at any time; the cancellation takes effect at the next
 * yield point between candidate documents. Documents already transitioned keep their
 * new state.</p>
 */
public final class OperationContext {

    /**
     * Called at every yield point of a scan.
     */
    @FunctionalInterface
    public interface YieldObserver {
        void onYield(OperationContext context, long scanned);
    }

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final YieldObserver observer;

    private OperationContext(YieldObserver observer) {
        this.observer = observer;
    }

    public static OperationContext create() {
        return new OperationContext(null);
    }

    public static OperationContext withObserver(YieldObserver observer) {
        return new OperationContext(observer);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Notifies the observer that the scan reached a yield point.
     */
    public void yielded(long scanned) {
        if (observer != null) {
            observer.onYield(this, scanned);
        }
    }
}
