package de.bsommerfeld.sysml.sql.core.event;

import java.time.Duration;

/**
 * Events shared by the fetch and import pipelines and the command line
 * front end that reports on them.
 */
public class SyncEvents {

    /** Marker for high-frequency progress events. */
    public interface ProgressEvent {
    }

    /**
     * A page of elements arrived.
     *
     * @param pageNumber   1-based page counter
     * @param pageRecords  records on this page
     * @param totalRecords records received so far, this page included
     */
    public record PageFetchedEvent(int pageNumber, int pageRecords, long totalRecords) implements ProgressEvent {
    }

    /**
     * The importer finished another batch of rows.
     *
     * @param phase   {@code elements} or {@code relations}
     * @param rows    rows written in this phase so far
     * @param elapsed time since the import started
     */
    public record ImportProgressEvent(String phase, long rows, Duration elapsed) implements ProgressEvent {
    }

    public record ImportFinishedEvent(long elements, long relations, int danglingReferences, Duration elapsed) {
    }
}
