package de.bsommerfeld.sysml.sql.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One model element as delivered by the API or a JSON dump. The identifier
 * and type tag are pulled out of the record, every other attribute stays in
 * {@link #properties()} in document order.
 *
 * @param id         the {@code @id} of the element
 * @param type       the {@code @type} tag, e.g. {@code PartUsage}
 * @param properties the remaining attributes, unmodifiable
 */
public record Element(String id, String type, Map<String, JsonNode> properties) {

    public static final String ID = "@id";
    public static final String TYPE = "@type";

    public Element {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public JsonNode property(String name) {
        return properties.get(name);
    }
}
