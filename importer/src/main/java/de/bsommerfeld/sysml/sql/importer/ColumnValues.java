package de.bsommerfeld.sysml.sql.importer;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.sysml.sql.core.util.CanonicalJson;

import java.util.Locale;

/**
 * Converts JSON attribute values into values for a column of a given
 * declared type. Values that do not fit the column raise
 * {@link IllegalArgumentException}; the importer stores NULL for them.
 */
final class ColumnValues {

    private ColumnValues() {
    }

    /**
     * @param coerceStringBooleans accept {@code "true"}/{@code "false"} for
     *                             integer columns
     */
    static Object convert(JsonNode value, String columnType, boolean coerceStringBooleans) {
        if (value == null || value.isNull()) {
            return null;
        }
        String type = columnType == null ? "" : columnType.toUpperCase(Locale.ROOT);
        switch (type) {
            case "INTEGER":
            case "INT":
                return toInteger(value, coerceStringBooleans);
            case "REAL":
                if (value.isNumber()) {
                    return value.doubleValue();
                }
                throw mismatch(value, type);
            case "TEXT":
                if (value.isTextual()) {
                    return value.asText();
                }
                if (value.isContainerNode()) {
                    return CanonicalJson.write(value);
                }
                throw mismatch(value, type);
            default:
                return toAny(value);
        }
    }

    private static Object toInteger(JsonNode value, boolean coerceStringBooleans) {
        if (value.isBoolean()) {
            return value.booleanValue() ? 1L : 0L;
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return value.longValue();
        }
        if (value.isFloatingPointNumber() && value.canConvertToExactIntegral() && value.canConvertToLong()) {
            return value.longValue();
        }
        if (coerceStringBooleans && value.isTextual()) {
            if ("true".equals(value.asText())) {
                return 1L;
            }
            if ("false".equals(value.asText())) {
                return 0L;
            }
        }
        throw mismatch(value, "INTEGER");
    }

    private static Object toAny(JsonNode value) {
        if (value.isTextual()) {
            return value.asText();
        }
        if (value.isBoolean()) {
            return value.booleanValue() ? 1L : 0L;
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return value.longValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        return CanonicalJson.write(value);
    }

    private static IllegalArgumentException mismatch(JsonNode value, String type) {
        return new IllegalArgumentException(value.getNodeType() + " value does not fit a " + type + " column");
    }
}
