package dev.mars.txtime.api.query;

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

import java.util.Arrays;
import java.util.Optional;

/**
 * Comparison operators that treat {@code null} (Open) as positive infinity.
 *
 * <p>Open is strictly greater than every concrete value and equal only to Open. A missing
 * field never matches. Concrete values are compared with {@link ValueOrdering} and only
 * match when both sides share a type bracket.</p>
 *
 * <table>
 *   <caption>Open handling</caption>
 *   <tr><th>field</th><th>operand</th><th>$tgt</th><th>$tgte</th><th>$tlt</th><th>$tlte</th></tr>
 *   <tr><td>Open</td><td>T</td><td>true</td><td>true</td><td>false</td><td>false</td></tr>
 *   <tr><td>Open</td><td>Open</td><td>false</td><td>true</td><td>false</td><td>true</td></tr>
 *   <tr><td>T</td><td>Open</td><td>false</td><td>false</td><td>true</td><td>true</td></tr>
 * </table>
 */
public enum OpenAwareOperator {

    GREATER_THAN(TemporalFields.OP_OPEN_GT) {
        @Override
        boolean accept(int comparison) {
            return comparison > 0;
        }
    },
    GREATER_THAN_OR_EQUAL(TemporalFields.OP_OPEN_GTE) {
        @Override
        boolean accept(int comparison) {
            return comparison >= 0;
        }
    },
    LESS_THAN(TemporalFields.OP_OPEN_LT) {
        @Override
        boolean accept(int comparison) {
            return comparison < 0;
        }
    },
    LESS_THAN_OR_EQUAL(TemporalFields.OP_OPEN_LTE) {
        @Override
        boolean accept(int comparison) {
            return comparison <= 0;
        }
    };

    private final String operatorName;

    OpenAwareOperator(String operatorName) {
        this.operatorName = operatorName;
    }

    public String operatorName() {
        return operatorName;
    }

    public static Optional<OpenAwareOperator> fromName(String name) {
        return Arrays.stream(values()).filter(op -> op.operatorName.equals(name)).findFirst();
    }

    abstract boolean accept(int comparison);

    /**
     * Evaluates {@code fieldValue <op> operand}.
     *
     * @param present whether the field exists in the document
     * @param fieldValue the field value, {@code null} meaning Open
     * @param operand the operand, {@code null} meaning Open
     */
    public boolean test(boolean present, Object fieldValue, Object operand) {
        if (!present) {
            return false;
        }
        boolean fieldOpen = fieldValue == null;
        boolean operandOpen = operand == null;
        if (fieldOpen || operandOpen) {
            int comparison = fieldOpen && operandOpen ? 0 : (fieldOpen ? 1 : -1);
            return accept(comparison);
        }
        if (!ValueOrdering.comparable(fieldValue, operand)) {
            return false;
        }
        return accept(ValueOrdering.compare(fieldValue, operand));
    }
}
