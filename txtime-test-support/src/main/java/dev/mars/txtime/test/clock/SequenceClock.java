package dev.mars.txtime.test.clock;

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

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * A {@link TransactionClock} that hands out scripted timestamps.
 *
 * <p>Scripted values are returned first, in order. Once the script is exhausted the clock
 * keeps counting from the last value it returned, bumping the increment, so tests that
 * only care about a few instants do not have to script every call.</p>
 *
 * <pre>{@code
 * SequenceClock clock = SequenceClock.ofSeconds(1000, 2000, 3000);
 * }</pre>
 */
public class SequenceClock implements TransactionClock {

    private final Deque<Timestamp> script = new ArrayDeque<>();
    private Timestamp last;
    private Instant wallTime;
    private int issued;

    public SequenceClock(Timestamp... timestamps) {
        for (Timestamp timestamp : timestamps) {
            script.addLast(Objects.requireNonNull(timestamp, "Scripted timestamp cannot be null"));
        }
        this.last = new Timestamp(0, 0);
    }

    public static SequenceClock ofSeconds(long... seconds) {
        Timestamp[] timestamps = new Timestamp[seconds.length];
        for (int i = 0; i < seconds.length; i++) {
            timestamps[i] = Timestamp.ofSeconds(seconds[i]);
        }
        return new SequenceClock(timestamps);
    }

    /**
     * Appends timestamps to the remaining script.
     */
    public synchronized SequenceClock then(Timestamp... timestamps) {
        for (Timestamp timestamp : timestamps) {
            script.addLast(timestamp);
        }
        return this;
    }

    public synchronized SequenceClock thenSeconds(long... seconds) {
        for (long s : seconds) {
            script.addLast(Timestamp.ofSeconds(s));
        }
        return this;
    }

    @Override
    public synchronized Timestamp next() {
        Timestamp value = script.isEmpty()
            ? new Timestamp(last.seconds(), last.increment() + 1)
            : script.removeFirst();
        last = value;
        issued++;
        return value;
    }

    /**
     * The configured wall time, or the seconds of the last issued timestamp if none was set.
     */
    @Override
    public synchronized Instant wallTime() {
        return wallTime != null ? wallTime : last.toInstant();
    }

    public synchronized void setWallTime(Instant wallTime) {
        this.wallTime = Objects.requireNonNull(wallTime, "Wall time cannot be null");
    }

    public synchronized Timestamp lastIssued() {
        return last;
    }

    public synchronized int issuedCount() {
        return issued;
    }

    public synchronized int remaining() {
        return script.size();
    }
}
