package dev.mars.txtime.core.query;

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

import dev.mars.txtime.api.TemporalSelector;
import io.vertx.core.json.JsonObject;

/**
 * A caller query after the temporal selector has been extracted and compiled into
 * boundary predicates.
 *
 * @param selector the parsed selector, {@link TemporalSelector.Kind#DEFAULT} when absent
 * @param predicate the store-level predicate
 */
public record CompiledQuery(TemporalSelector selector, JsonObject predicate) {
}
