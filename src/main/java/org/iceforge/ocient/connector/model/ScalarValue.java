package org.iceforge.ocient.connector.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * A single cell of a collection-format row, decoded into a closed set of variants.
 *
 * <p>Arrays and objects have no variant of their own; they are kept as {@link StringValue}
 * holding their JSON text.
 */
public sealed interface ScalarValue
        permits ScalarValue.NumberValue, ScalarValue.StringValue, ScalarValue.BoolValue, ScalarValue.NullValue {

    /**
     * Generic text rendering used when a cell lands in a text column or a distinct-value list.
     */
    String asText();

    default boolean isNull() {
        return false;
    }

    static ScalarValue of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NullValue.INSTANCE;
        }
        if (node.isNumber()) {
            return new NumberValue(node.doubleValue());
        }
        if (node.isTextual()) {
            return new StringValue(node.textValue());
        }
        if (node.isBoolean()) {
            return new BoolValue(node.booleanValue());
        }
        return new StringValue(node.toString());
    }

    record NumberValue(double value) implements ScalarValue {
        @Override
        public String asText() {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Double.toString(value);
            }
            // plain notation, no exponent and no trailing zeros
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }
    }

    record StringValue(String value) implements ScalarValue {
        public StringValue {
            value = value == null ? "" : value;
        }

        @Override
        public String asText() {
            return value;
        }
    }

    record BoolValue(boolean value) implements ScalarValue {
        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    enum NullValue implements ScalarValue {
        INSTANCE;

        @Override
        public String asText() {
            return "";
        }

        @Override
        public boolean isNull() {
            return true;
        }
    }
}
