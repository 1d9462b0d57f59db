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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class TemporalSelectorTest {

    @Test
    @DisplayName("default and current selectors are current-only")
    void currentOnlyKinds() {
        assertTrue(TemporalSelector.defaultSelector().isCurrentOnly());
        assertTrue(TemporalSelector.current().isCurrentOnly());
        assertFalse(TemporalSelector.all().isCurrentOnly());
        assertFalse(TemporalSelector.at(Timestamp.ofSeconds(5)).isCurrentOnly());
    }

    @Test
    @DisplayName("at() exposes its point in time only")
    void atSelector() {
        TemporalSelector selector = TemporalSelector.at(Timestamp.ofSeconds(2500));

        assertEquals(TemporalSelector.Kind.AT, selector.getKind());
        assertEquals(Timestamp.ofSeconds(2500), selector.getAt().orElseThrow());
        assertTrue(selector.getFrom().isEmpty());
        assertTrue(selector.getTo().isEmpty());
    }

    @Test
    @DisplayName("inRange() accepts one open bound but not two")
    void inRangeBounds() {
        TemporalSelector fromOnly = TemporalSelector.inRange(Timestamp.ofSeconds(10), null);

        assertEquals(Timestamp.ofSeconds(10), fromOnly.getFrom().orElseThrow());
        assertTrue(fromOnly.getTo().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> TemporalSelector.inRange(null, null));
        assertThrows(IllegalArgumentException.class,
            () -> TemporalSelector.inRange(Timestamp.ofSeconds(20), Timestamp.ofSeconds(10)));
    }

    @Test
    @DisplayName("selectors compare by value")
    void valueEquality() {
        assertEquals(TemporalSelector.at(Timestamp.ofSeconds(1)), TemporalSelector.at(Timestamp.ofSeconds(1)));
        assertNotEquals(TemporalSelector.current(), TemporalSelector.defaultSelector());
    }
}
