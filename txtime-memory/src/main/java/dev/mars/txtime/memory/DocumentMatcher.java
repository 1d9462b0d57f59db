package dev.mars.txtime.memory;

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
import dev.mars.txtime.api.error.TemporalValidationException;
import dev.mars.txtime.api.error.TxTimeErrorCodes;
import dev.mars.txtime.api.query.OpenAwareOperator;
import dev.mars.txtime.api.query.ValueOrdering;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates query predicates against documents.
 *
 * <p>Supported: implicit equality ({@code null} also matches a missing field, array fields
 * match on any element), {@code $eq $ne $gt $gte $lt $lte $in $nin $exists}, the
 * Open-aware operators {@code $tgt $tgte $tlt $tlte}, and the logical combinators
 * {@code $and $or $nor}. Keys may be dotted paths.</p>
 */
final class DocumentMatcher {

    private DocumentMatcher() {
    }

    static boolean matches(JsonObject document, JsonObject predicate) {
        if (predicate == null || predicate.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> clause : predicate.getMap().entrySet()) {
            if (!matchesClause(document, clause.getKey(), clause.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesClause(JsonObject document, String key, Object condition) {
        switch (key) {
            case "$and":
                for (Object sub : branches(key, condition)) {
                    if (!matches(document, toPredicate(key, sub))) {
                        return false;
                    }
                }
                return true;
            case "$or":
                for (Object sub : branches(key, condition)) {
                    if (matches(document, toPredicate(key, sub))) {
                        return true;
                    }
                }
                return false;
            case "$nor":
                for (Object sub : branches(key, condition)) {
                    if (matches(document, toPredicate(key, sub))) {
                        return false;
                    }
                }
                return true;
            default:
                if (key.startsWith("$")) {
                    throw invalid("Unknown top-level operator " + key);
                }
                return matchesField(FieldPaths.resolve(document, key), condition);
        }
    }

    private static boolean matchesField(FieldPaths.FieldValue field, Object condition) {
        if (isOperatorDocument(condition)) {
            for (Map.Entry<String, Object> op : FieldPaths.asMap(condition).entrySet()) {
                if (!matchesOperator(field, op.getKey(), op.getValue())) {
                    return false;
                }
            }
            return true;
        }
        return equalsCondition(field, condition);
    }

    private static boolean matchesOperator(FieldPaths.FieldValue field, String operator, Object operand) {
        Optional<OpenAwareOperator> openAware = OpenAwareOperator.fromName(operator);
        if (openAware.isPresent()) {
            return openAware.get().test(field.present(), field.value(), operand);
        }
        switch (operator) {
            case "$eq":
                return equalsCondition(field, operand);
            case "$ne":
                return !equalsCondition(field, operand);
            case "$gt":
                return compareCondition(field, operand, 1, false);
            case "$gte":
                return compareCondition(field, operand, 1, true);
            case "$lt":
                return compareCondition(field, operand, -1, false);
            case "$lte":
                return compareCondition(field, operand, -1, true);
            case "$in":
                return inCondition(field, operand);
            case "$nin":
                return !inCondition(field, operand);
            case "$exists":
                if (!(operand instanceof Boolean)) {
                    throw invalid("$exists requires a boolean");
                }
                return field.present() == (Boolean) operand;
            default:
                throw invalid("Unknown query operator " + operator);
        }
    }

    private static boolean equalsCondition(FieldPaths.FieldValue field, Object expected) {
        if (expected == null) {
            return !field.present() || field.value() == null;
        }
        if (!field.present()) {
            return false;
        }
        if (ValueOrdering.valueEquals(field.value(), expected)) {
            return true;
        }
        List<Object> elements = FieldPaths.asList(field.value());
        if (elements != null && FieldPaths.asList(expected) == null) {
            for (Object element : elements) {
                if (ValueOrdering.valueEquals(element, expected)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean compareCondition(FieldPaths.FieldValue field, Object operand, int sign, boolean inclusive) {
        if (!field.present() || !ValueOrdering.comparable(field.value(), operand)) {
            return false;
        }
        int comparison = ValueOrdering.compare(field.value(), operand) * sign;
        return comparison > 0 || (inclusive && comparison == 0);
    }

    private static boolean inCondition(FieldPaths.FieldValue field, Object operand) {
        List<Object> candidates = FieldPaths.asList(operand);
        if (candidates == null) {
            throw invalid("$in and $nin require an array");
        }
        for (Object candidate : candidates) {
            if (equalsCondition(field, candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A non-empty document whose keys are all operators; timestamp literals are values.
     */
    static boolean isOperatorDocument(Object value) {
        Map<String, Object> map = FieldPaths.asMap(value);
        if (map == null || map.isEmpty() || Timestamp.isLiteral(value)) {
            return false;
        }
        for (String key : map.keySet()) {
            if (!key.startsWith("$")) {
                return false;
            }
        }
        return true;
    }

    private static List<Object> branches(String operator, Object condition) {
        List<Object> list = FieldPaths.asList(condition);
        if (list == null || list.isEmpty()) {
            throw invalid(operator + " requires a non-empty array");
        }
        return list;
    }

    private static JsonObject toPredicate(String operator, Object branch) {
        Map<String, Object> map = FieldPaths.asMap(branch);
        if (map == null) {
            throw invalid(operator + " branches must be documents");
        }
        return branch instanceof JsonObject ? (JsonObject) branch : new JsonObject(map);
    }

    private static TemporalValidationException invalid(String message) {
        return new TemporalValidationException(TxTimeErrorCodes.VALIDATION_FAILED, message);
    }
}
