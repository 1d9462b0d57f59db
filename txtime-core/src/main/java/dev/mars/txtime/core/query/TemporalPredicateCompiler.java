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

import dev.mars.txtime.api.TemporalFields;
import dev.mars.txtime.api.TemporalSelector;
import dev.mars.txtime.api.Timestamp;
import dev.mars.txtime.api.error.TemporalValidationException;
import dev.mars.txtime.api.error.TxTimeErrorCodes;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.Map;

/**
 * Compiles temporal selectors into boundary predicates over the interval fields and
 * rewrites caller queries and sorts for temporal collections.
 *
 * <table>
 *   <caption>Selector compilation</caption>
 *   <tr><th>selector</th><th>predicate</th></tr>
 *   <tr><td>absent, current</td><td>{@code _id.transaction_end == null}</td></tr>
 *   <tr><td>all</td><td>none</td></tr>
 *   <tr><td>at T</td><td>{@code start $tlte T} and {@code end $tgt T}</td></tr>
 *   <tr><td>inrange [T1, T2]</td><td>{@code end $tgt T1} and {@code start $tlte T2}, each only when concrete</td></tr>
 * </table>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public final class TemporalPredicateCompiler {

    private TemporalPredicateCompiler() {
    }

    /**
     * Compiles a selector into a predicate; empty for {@link TemporalSelector.Kind#ALL}.
     */
    public static JsonObject compile(TemporalSelector selector) {
        JsonObject clause = new JsonObject();
        switch (selector.getKind()) {
            case DEFAULT:
            case CURRENT:
                clause.putNull(TemporalFields.TRANSACTION_END_PATH);
                break;
            case ALL:
                break;
            case AT:
                Timestamp at = selector.getAt().orElseThrow();
                clause.put(TemporalFields.TRANSACTION_START_PATH, operator(TemporalFields.OP_OPEN_LTE, at));
                clause.put(TemporalFields.TRANSACTION_END_PATH, operator(TemporalFields.OP_OPEN_GT, at));
                break;
            case IN_RANGE:
                selector.getFrom().ifPresent(from ->
                    clause.put(TemporalFields.TRANSACTION_END_PATH, operator(TemporalFields.OP_OPEN_GT, from)));
                selector.getTo().ifPresent(to ->
                    clause.put(TemporalFields.TRANSACTION_START_PATH, operator(TemporalFields.OP_OPEN_LTE, to)));
                break;
            default:
                throw new IllegalStateException("Unhandled selector kind: " + selector.getKind());
        }
        return clause;
    }

    /**
     * Compiles a find query. The reserved {@code transaction} field is removed and
     * replaced by its boundary predicates.
     *
     * @param temporal whether the target collection is temporal
     * @throws TemporalValidationException for invalid selectors, or {@code NOT_TEMPORAL_COLLECTION}
     *         when a selector targets a plain collection
     */
    public static CompiledQuery compileQuery(JsonObject query, boolean temporal) {
        JsonObject criteria = query == null ? new JsonObject() : query.copy();
        boolean hasSelector = criteria.containsKey(TemporalFields.SELECTOR);
        Object rawSelector = criteria.getMap().remove(TemporalFields.SELECTOR);
        if (!temporal) {
            if (hasSelector) {
                throw new TemporalValidationException(TxTimeErrorCodes.NOT_TEMPORAL_COLLECTION,
                    "Temporal selector used on a non-temporal collection");
            }
            return new CompiledQuery(TemporalSelector.defaultSelector(), criteria);
        }
        TemporalSelector selector = TemporalSelectorParser.parse(rawSelector);
        JsonObject predicate = and(compile(selector), rewriteIdentifier(criteria));
        return new CompiledQuery(selector, predicate);
    }

    /**
     * Compiles the query of an update or delete on a temporal collection. Only current
     * versions may be mutated.
     *
     * @throws TemporalValidationException with {@code NON_CURRENT_MUTATION} when the query
     *         targets historical versions
     */
    public static JsonObject compileMutationQuery(JsonObject query) {
        JsonObject criteria = query == null ? new JsonObject() : query.copy();
        Object rawSelector = criteria.getMap().remove(TemporalFields.SELECTOR);
        TemporalSelector selector = TemporalSelectorParser.parse(rawSelector);
        if (!selector.isCurrentOnly()) {
            throw new TemporalValidationException(TxTimeErrorCodes.NON_CURRENT_MUTATION,
                "Updates and deletes can only target current versions, got " + selector);
        }
        if (criteria.containsKey(TemporalFields.TRANSACTION_END_PATH)) {
            Object end = criteria.getMap().remove(TemporalFields.TRANSACTION_END_PATH);
            if (end != null) {
                throw new TemporalValidationException(TxTimeErrorCodes.NON_CURRENT_MUTATION,
                    "Updates and deletes cannot select on " + TemporalFields.TRANSACTION_END_PATH
                        + " other than null");
            }
        }
        return and(compile(TemporalSelector.current()), rewriteIdentifier(criteria));
    }

    /**
     * Replaces the reserved {@code transaction} sort key with the interval end.
     */
    public static JsonObject rewriteSort(JsonObject sort) {
        JsonObject rewritten = new JsonObject();
        if (sort == null) {
            return rewritten;
        }
        for (Map.Entry<String, Object> entry : sort.getMap().entrySet()) {
            String key = TemporalFields.SELECTOR.equals(entry.getKey())
                ? TemporalFields.TRANSACTION_END_PATH
                : entry.getKey();
            rewritten.put(key, entry.getValue());
        }
        return rewritten;
    }

    /**
     * Conjunction of two predicates: a merge when their keys are disjoint, an
     * {@code $and} otherwise.
     */
    public static JsonObject and(JsonObject clause, JsonObject criteria) {
        if (clause.isEmpty()) {
            return criteria.copy();
        }
        if (criteria.isEmpty()) {
            return clause.copy();
        }
        boolean collides = criteria.fieldNames().stream().anyMatch(clause::containsKey);
        if (collides) {
            return new JsonObject().put("$and", new JsonArray().add(clause.copy()).add(criteria.copy()));
        }
        JsonObject merged = clause.copy();
        for (Map.Entry<String, Object> entry : criteria.copy().getMap().entrySet()) {
            merged.put(entry.getKey(), entry.getValue());
        }
        return merged;
    }

    /**
     * Rewrites a bare identifier criterion {@code {_id: X}} to {@code {"_id._id": X}}.
     * Operator documents and composite keys are left alone.
     */
    static JsonObject rewriteIdentifier(JsonObject criteria) {
        if (!criteria.containsKey(TemporalFields.ID)) {
            return criteria;
        }
        Object id = criteria.getMap().get(TemporalFields.ID);
        Map<String, Object> asDocument = TemporalSelectorParser.asMap(id);
        if (asDocument != null && !Timestamp.isLiteral(id)
                && (isOperatorDocument(asDocument) || isComposite(asDocument))) {
            return criteria;
        }
        JsonObject rewritten = new JsonObject();
        for (Map.Entry<String, Object> entry : criteria.getMap().entrySet()) {
            if (TemporalFields.ID.equals(entry.getKey())) {
                rewritten.put(TemporalFields.STABLE_ID_PATH, entry.getValue());
            } else {
                rewritten.put(entry.getKey(), entry.getValue());
            }
        }
        return rewritten;
    }

    private static boolean isOperatorDocument(Map<String, Object> document) {
        return !document.isEmpty() && document.keySet().stream().allMatch(key -> key.startsWith("$"));
    }

    private static boolean isComposite(Map<String, Object> document) {
        return document.containsKey(TemporalFields.ID)
            || document.containsKey(TemporalFields.TRANSACTION_START)
            || document.containsKey(TemporalFields.TRANSACTION_END);
    }

    private static JsonObject operator(String name, Timestamp operand) {
        return new JsonObject().put(name, operand.toDocument());
    }
}
