package de.bsommerfeld.sysml.sql.importer;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.sysml.sql.core.domain.Element;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/** Turns a raw record into an {@link Element}, rejecting records without identity. */
final class ElementReader {

    private ElementReader() {
    }

    static Element read(JsonNode record, long index) throws ImportException {
        if (record == null || !record.isObject()) {
            throw ImportException.malformedElement(index, null, "not a JSON object");
        }
        String id = requiredText(record, Element.ID, index, null);
        String type = requiredText(record, Element.TYPE, index, id);

        Map<String, JsonNode> properties = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if (!Element.ID.equals(name) && !Element.TYPE.equals(name)) {
                properties.put(name, field.getValue());
            }
        }
        return new Element(id, type, properties);
    }

    private static String requiredText(JsonNode record, String key, long index, String id) throws ImportException {
        JsonNode value = record.get(key);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw ImportException.malformedElement(index, id, "missing or blank " + key);
        }
        return value.asText();
    }
}
