package dev.mars.txtime.core.clock;

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

import dev.mars.txtime.api.Timestamp;
import dev.mars.txtime.api.TransactionClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Transaction clock built from wall-clock seconds and a per-second increment.
 *
 * <p>The increment restarts at 1 whenever the wall clock reaches a new second and counts
 * up otherwise, including when the wall clock steps backwards. When the increment would
 * overflow, the clock borrows the next second. Every value returned is strictly greater
 * than the one before.</p>
 */
public class HybridTransactionClock implements TransactionClock {
    private static final Logger logger = LoggerFactory.getLogger(HybridTransactionClock.class);

    private final Clock wallClock;
    private final int maxIncrement;
    private long lastSeconds = -1;
    private int lastIncrement;

    public HybridTransactionClock() {
        this(Clock.systemUTC());
    }

    public HybridTransactionClock(Clock wallClock) {
        this(wallClock, Integer.MAX_VALUE);
    }

    HybridTransactionClock(Clock wallClock, int maxIncrement) {
        this.wallClock = Objects.requireNonNull(wallClock, "Wall clock cannot be null");
        if (maxIncrement < 1) {
            throw new IllegalArgumentException("maxIncrement must be positive");
        }
        this.maxIncrement = maxIncrement;
    }

    @Override
    public synchronized Timestamp next() {
        long wallSeconds = wallClock.instant().getEpochSecond();
        if (wallSeconds > lastSeconds) {
            lastSeconds = wallSeconds;
            lastIncrement = 1;
        } else if (lastIncrement >= maxIncrement) {
            lastSeconds++;
            lastIncrement = 1;
            logger.debug("Increment exhausted, borrowing second {}", lastSeconds);
        } else {
            lastIncrement++;
        }
        return new Timestamp(lastSeconds, lastIncrement);
    }

    @Override
    public Instant wallTime() {
        return wallClock.instant();
    }
}
