package de.bsommerfeld.sysml.sql.api;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Issues GET requests. Completes exceptionally on I/O, TLS or timeout
 * failures; any status code, including errors, completes normally.
 */
public interface HttpTransport {

    CompletableFuture<ApiResponse> get(URI uri, Duration timeout);
}
