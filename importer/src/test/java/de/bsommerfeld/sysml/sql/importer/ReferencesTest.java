package de.bsommerfeld.sysml.sql.importer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferencesTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Test
    void targets_shouldRecognizeSingleReference() throws Exception {
        assertEquals(List.of("a"), References.targets(json("{\"@id\": \"a\"}"), false));
    }

    @Test
    void targets_shouldRecognizeReferenceArrays() throws Exception {
        assertEquals(List.of("a", "b"), References.targets(json("[{\"@id\": \"a\"}, {\"@id\": \"b\"}]"), false));
    }

    @Test
    void targets_shouldRejectMixedArrays() throws Exception {
        assertNull(References.targets(json("[{\"@id\": \"a\"}, \"b\"]"), false));
    }

    @Test
    void targets_shouldRejectEmptyArrayAndScalars() throws Exception {
        assertNull(References.targets(json("[]"), false));
        assertNull(References.targets(json("\"a\""), false));
        assertNull(References.targets(json("{\"name\": \"a\"}"), false));
    }

    @Test
    void targets_shouldAcceptExtraKeysOnlyWhenLenient() throws Exception {
        JsonNode value = json("{\"@id\": \"a\", \"@type\": \"Element\"}");

        assertNull(References.targets(value, false));
        assertEquals(List.of("a"), References.targets(value, true));
    }
}
