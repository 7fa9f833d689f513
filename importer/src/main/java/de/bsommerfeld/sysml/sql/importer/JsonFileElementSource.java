package de.bsommerfeld.sysml.sql.importer;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Streams the records of a JSON file holding one top-level array. Only one
 * record is materialized at a time, so dumps larger than the heap import
 * fine; every pass re-reads the file.
 */
public class JsonFileElementSource implements ElementSource {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path file;

    public JsonFileElementSource(Path file) {
        this.file = file;
    }

    @Override
    public void forEach(RecordVisitor visitor) throws ImportException {
        try (JsonParser parser = MAPPER.createParser(file.toFile())) {
            if (parser.nextToken() != JsonToken.START_ARRAY) {
                throw new ImportException(ImportException.Kind.MALFORMED_DOCUMENT,
                        file + " does not contain a JSON array");
            }
            long index = 0;
            while (parser.nextToken() != JsonToken.END_ARRAY) {
                if (parser.currentToken() == null) {
                    throw new ImportException(ImportException.Kind.MALFORMED_DOCUMENT,
                            file + " ends inside the element array");
                }
                JsonNode record = MAPPER.readTree(parser);
                visitor.visit(record, index++);
            }
        } catch (JsonProcessingException e) {
            throw new ImportException(ImportException.Kind.MALFORMED_DOCUMENT,
                    "Invalid JSON in " + file + ": " + e.getOriginalMessage(), null, e);
        } catch (IOException e) {
            throw new ImportException(ImportException.Kind.IO, "Failed to read " + file, null, e);
        }
    }

    @Override
    public String describe() {
        return file.toString();
    }
}
