package de.bsommerfeld.sysml.sql.importer;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.sysml.sql.core.domain.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Recognizes reference values: an object {@code {"@id": "..."}} or a
 * non-empty array made only of such objects. In lenient mode a reference
 * object may carry further keys besides {@code @id}.
 */
final class References {

    private References() {
    }

    /** Target ids of a reference value, or {@code null} if the value is not a reference. */
    static List<String> targets(JsonNode value, boolean lenient) {
        if (value == null) {
            return null;
        }
        if (value.isObject()) {
            return isReference(value, lenient) ? List.of(value.get(Element.ID).asText()) : null;
        }
        if (value.isArray() && !value.isEmpty()) {
            List<String> ids = new ArrayList<>(value.size());
            for (JsonNode item : value) {
                if (!isReference(item, lenient)) {
                    return null;
                }
                ids.add(item.get(Element.ID).asText());
            }
            return ids;
        }
        return null;
    }

    static boolean isReference(JsonNode node, boolean lenient) {
        if (node == null || !node.isObject()) {
            return false;
        }
        JsonNode id = node.get(Element.ID);
        if (id == null || !id.isTextual() || id.asText().isEmpty()) {
            return false;
        }
        return lenient || node.size() == 1;
    }

    /** Null, or an empty array: carries neither a value nor a reference. */
    static boolean isAbsent(JsonNode value) {
        return value == null || value.isNull() || (value.isArray() && value.isEmpty());
    }
}
