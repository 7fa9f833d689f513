package de.bsommerfeld.sysml.sql.api;

import java.net.URI;

/**
 * A failed retrieval. No partial result accompanies it.
 */
public class FetchException extends Exception {

    public enum Kind {
        /** I/O errors, 5xx or 429 persisted through every retry. */
        TRANSIENT_EXHAUSTED,
        /** The server answered with a non-retryable status. */
        HTTP_STATUS,
        /** Unparseable {@code Link} header or a pagination loop. */
        MALFORMED_PAGINATION,
        /** A body that is not the expected JSON. */
        MALFORMED_RESPONSE,
        TIMEOUT,
        TLS,
        /** The requested project, branch or commit could not be determined. */
        SELECTION,
        /** A fetched page could not be persisted locally. */
        IO
    }

    private final Kind kind;
    private final URI uri;
    private final int status;

    public FetchException(Kind kind, String message, URI uri) {
        this(kind, message, uri, -1, null);
    }

    public FetchException(Kind kind, String message, URI uri, int status, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.uri = uri;
        this.status = status;
    }

    public Kind getKind() {
        return kind;
    }

    /** The request that failed, {@code null} for selection errors without one. */
    public URI getUri() {
        return uri;
    }

    /** HTTP status of the failing response, -1 if there was none. */
    public int getStatus() {
        return status;
    }
}
