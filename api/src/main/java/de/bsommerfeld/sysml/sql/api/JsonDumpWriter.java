package de.bsommerfeld.sysml.sql.api;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes fetched records into one JSON array file as pages arrive, so a dump
 * never has to be held in memory twice. {@link #close()} terminates the
 * array; the file is valid JSON even if the fetch failed midway.
 */
public class JsonDumpWriter implements PageListener, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(JsonDumpWriter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path file;
    private final JsonGenerator generator;
    private long written;

    public JsonDumpWriter(Path file, boolean pretty) throws IOException {
        this.file = file;
        this.generator = MAPPER.getFactory().createGenerator(file.toFile(), JsonEncoding.UTF8);
        if (pretty) {
            generator.useDefaultPrettyPrinter();
        }
        generator.writeStartArray();
    }

    @Override
    public void onPage(int pageNumber, List<JsonNode> records) throws IOException {
        for (JsonNode record : records) {
            MAPPER.writeTree(generator, record);
        }
        generator.flush();
        written += records.size();
    }

    public long getWritten() {
        return written;
    }

    @Override
    public void close() throws IOException {
        try {
            generator.writeEndArray();
        } finally {
            generator.close();
        }
        LOG.info("Wrote {} records to {}", written, file);
    }
}
