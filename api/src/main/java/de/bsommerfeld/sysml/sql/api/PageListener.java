package de.bsommerfeld.sysml.sql.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.List;

/** Receives each page as it arrives, on the fetcher's thread. */
@FunctionalInterface
public interface PageListener {

    PageListener NONE = (pageNumber, records) -> {
    };

    void onPage(int pageNumber, List<JsonNode> records) throws IOException;
}
