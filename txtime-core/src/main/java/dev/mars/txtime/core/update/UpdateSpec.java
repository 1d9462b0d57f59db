package dev.mars.txtime.core.update;

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
import dev.mars.txtime.api.error.TemporalValidationException;
import dev.mars.txtime.api.error.TxTimeErrorCodes;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A validated update document.
 *
 * <p>An update is either a full replacement of the document's fields or a list of
 * field operators:</p>
 * <pre>{@code
 * {"$set": {"status": "SHIPPED"}, "$inc": {"qty": -1}, "$unset": {"hold": ""}}
 * }</pre>
 *
 * <p>Validation happens entirely in {@link #parse(JsonObject, boolean)}, before any
 * document is read or written.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public final class UpdateSpec {

    public static final String SET = "$set";
    public static final String UNSET = "$unset";
    public static final String INC = "$inc";

    public enum Style {
        OPERATORS,
        REPLACEMENT
    }

    /**
     * One field operation of an operator-style update.
     */
    public record Operation(String operator, String path, Object operand) {
    }

    private final Style style;
    private final JsonObject replacement;
    private final List<Operation> operations;

    private UpdateSpec(Style style, JsonObject replacement, List<Operation> operations) {
        this.style = style;
        this.replacement = replacement;
        this.operations = operations;
    }

    /**
     * Validates an update document.
     *
     * @param multi whether the update targets every matching document
     * @throws TemporalValidationException when the update document is invalid
     */
    public static UpdateSpec parse(JsonObject update, boolean multi) {
        Objects.requireNonNull(update, "Update document cannot be null");
        long operatorKeys = update.fieldNames().stream().filter(key -> key.startsWith("$")).count();
        if (operatorKeys > 0 && operatorKeys < update.size()) {
            throw new TemporalValidationException(TxTimeErrorCodes.MIXED_UPDATE_STYLES,
                "Update document mixes operators and replacement fields", update.encode());
        }
        if (operatorKeys == 0) {
            if (multi) {
                throw new TemporalValidationException(TxTimeErrorCodes.MULTI_REQUIRES_OPERATORS,
                    "A multi-document update requires update operators", update.encode());
            }
            return new UpdateSpec(Style.REPLACEMENT, update.copy(), Collections.emptyList());
        }

        List<Operation> operations = new ArrayList<>();
        List<String> paths = new ArrayList<>();
        for (Map.Entry<String, Object> entry : update.getMap().entrySet()) {
            String operator = entry.getKey();
            if (!SET.equals(operator) && !UNSET.equals(operator) && !INC.equals(operator)) {
                throw new TemporalValidationException(TxTimeErrorCodes.UNKNOWN_UPDATE_OPERATOR,
                    "Unknown update operator '" + operator + "'", update.encode());
            }
            Map<String, Object> operands = asMap(entry.getValue());
            if (operands == null) {
                throw new TemporalValidationException(TxTimeErrorCodes.VALIDATION_FAILED,
                    "Operand of " + operator + " must be a document", String.valueOf(entry.getValue()));
            }
            for (Map.Entry<String, Object> operand : operands.entrySet()) {
                String path = operand.getKey();
                validatePath(operator, path, paths);
                if (INC.equals(operator) && !(operand.getValue() instanceof Number)) {
                    throw new TemporalValidationException(TxTimeErrorCodes.INVALID_FIELD_VALUE,
                        "$inc requires a numeric operand for '" + path + "'", String.valueOf(operand.getValue()));
                }
                paths.add(path);
                operations.add(new Operation(operator, path, operand.getValue()));
            }
        }
        return new UpdateSpec(Style.OPERATORS, null, Collections.unmodifiableList(operations));
    }

    private static void validatePath(String operator, String path, List<String> seen) {
        if (path.isEmpty() || path.startsWith(".") || path.endsWith(".") || path.contains("..")
                || path.startsWith("$")) {
            throw new TemporalValidationException(TxTimeErrorCodes.VALIDATION_FAILED,
                "Invalid field path '" + path + "' in " + operator);
        }
        if (path.equals(TemporalFields.ID) || path.startsWith(TemporalFields.ID + ".")) {
            throw new TemporalValidationException(TxTimeErrorCodes.IDENTIFIER_CHANGED,
                operator + " cannot modify the identifier field '" + path + "'");
        }
        for (String other : seen) {
            if (other.equals(path) || other.startsWith(path + ".") || path.startsWith(other + ".")) {
                throw new TemporalValidationException(TxTimeErrorCodes.VALIDATION_FAILED,
                    "Update paths '" + other + "' and '" + path + "' conflict");
            }
        }
    }

    public Style getStyle() {
        return style;
    }

    public List<Operation> getOperations() {
        return operations;
    }

    /**
     * The replacement document of a replacement-style update, including any identifier
     * it names.
     */
    public JsonObject getReplacement() {
        if (style != Style.REPLACEMENT) {
            throw new IllegalStateException("Update is not a replacement");
        }
        return replacement.copy();
    }

    /**
     * Computes the new fields of a document. The argument is not modified.
     *
     * @param fields the current fields, without the identifier
     */
    public JsonObject apply(JsonObject fields) {
        if (style == Style.REPLACEMENT) {
            return replacement.copy();
        }
        JsonObject result = fields.copy();
        for (Operation operation : operations) {
            switch (operation.operator()) {
                case SET:
                    UpdateOperators.set(result, operation.path(), operation.operand());
                    break;
                case UNSET:
                    UpdateOperators.unset(result, operation.path());
                    break;
                case INC:
                    UpdateOperators.inc(result, operation.path(), (Number) operation.operand());
                    break;
                default:
                    throw new IllegalStateException("Unhandled operator " + operation.operator());
            }
        }
        return result;
    }

    /**
     * Builds the document inserted by an upsert that matched nothing: the replacement
     * (keeping the query's identifier when it names none), or the query's equality
     * fields with the operators applied.
     */
    public JsonObject upsertSeed(JsonObject query) {
        JsonObject seed = new JsonObject();
        Object queryId = null;
        boolean hasQueryId = false;
        if (query != null) {
            for (Map.Entry<String, Object> entry : query.getMap().entrySet()) {
                String key = entry.getKey();
                Object value = entry.getValue();
                if (key.startsWith("$") || TemporalFields.SELECTOR.equals(key) || isOperatorDocument(value)) {
                    continue;
                }
                if (TemporalFields.ID.equals(key) || TemporalFields.STABLE_ID_PATH.equals(key)) {
                    queryId = value;
                    hasQueryId = true;
                } else if (!key.startsWith(TemporalFields.ID + ".")) {
                    UpdateOperators.set(seed, key, value);
                }
            }
        }
        JsonObject document;
        if (style == Style.REPLACEMENT) {
            document = replacement.copy();
        } else {
            document = apply(seed);
        }
        if (hasQueryId && !document.containsKey(TemporalFields.ID)) {
            JsonObject withId = new JsonObject().put(TemporalFields.ID, queryId);
            for (Map.Entry<String, Object> entry : document.getMap().entrySet()) {
                withId.put(entry.getKey(), entry.getValue());
            }
            document = withId;
        }
        return document;
    }

    private static boolean isOperatorDocument(Object value) {
        Map<String, Object> document = asMap(value);
        return document != null && !document.isEmpty()
            && document.keySet().stream().anyMatch(key -> key.startsWith("$"))
            && !document.containsKey(TemporalFields.TIMESTAMP_LITERAL);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        if (value instanceof JsonObject) {
            return ((JsonObject) value).getMap();
        }
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return null;
    }

    @Override
    public String toString() {
        if (style == Style.REPLACEMENT) {
            return "UpdateSpec{replacement=" + replacement.encode() + "}";
        }
        JsonArray ops = new JsonArray();
        operations.forEach(op -> ops.add(op.operator() + " " + op.path()));
        return "UpdateSpec{operations=" + ops.encode() + "}";
    }
}
