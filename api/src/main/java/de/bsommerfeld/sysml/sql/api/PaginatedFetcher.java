package de.bsommerfeld.sysml.sql.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import de.bsommerfeld.sysml.sql.core.event.ApplicationEventBus;
import de.bsommerfeld.sysml.sql.core.event.SyncEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Retrieves every record behind a cursor-paginated endpoint.
 *
 * <h3>Pagination</h3>
 * Each page body is a JSON array. The next page is the {@code rel="next"}
 * target of the response's {@code Link} header; a response without one is
 * the last page. Pages are requested strictly one after another, so records
 * come back in server order.
 *
 * <h3>Threading</h3>
 * All continuation work (parsing, listener calls, the next request) runs on
 * one dedicated thread. Retries are scheduled on it through
 * {@link CompletableFuture#delayedExecutor}; nothing blocks while waiting.
 *
 * <h3>Failures</h3>
 * I/O errors, 5xx and 429 responses are retried with exponential backoff.
 * Everything else fails the whole retrieval with a {@link FetchException};
 * a partial result is never returned.
 *
 * <pre>
 * fetchAllAsync(start)
 *   └ request(uri, attempt) ──transient──▶ delayedExecutor ──▶ request(uri, attempt + 1)
 *       └ accept(page) → listener, PageFetchedEvent
 *           └ next link? → request(next, 0) : complete(records)
 * </pre>
 */
public class PaginatedFetcher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(PaginatedFetcher.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpTransport transport;
    private final FetchOptions options;
    private final ApplicationEventBus eventBus;
    private final ExecutorService executor;

    @Inject
    public PaginatedFetcher(HttpTransport transport, FetchOptions options, ApplicationEventBus eventBus) {
        this.transport = transport;
        this.options = options;
        this.eventBus = eventBus;
        this.executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("sysml-fetch-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * Fetches all pages starting at {@code start}. The future fails with a
     * {@link FetchException} (wrapped in a {@link CompletionException} for
     * dependent stages) or, past the overall deadline, a
     * {@link TimeoutException}.
     */
    public CompletableFuture<List<JsonNode>> fetchAllAsync(URI start, PageListener listener) {
        Pagination pagination = new Pagination(start, listener);
        return CompletableFuture.supplyAsync(() -> start, executor)
                .thenCompose(uri -> fetchFrom(uri, pagination))
                .orTimeout(options.overallTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    public List<JsonNode> fetchAll(URI start, PageListener listener) throws FetchException, InterruptedException {
        return await(fetchAllAsync(start, listener), start);
    }

    /** Fetches a single JSON document, with the same retry policy as pages. */
    public JsonNode fetchDocument(URI uri) throws FetchException, InterruptedException {
        CompletableFuture<JsonNode> document = request(uri, 0)
                .thenApply(response -> {
                    try {
                        return MAPPER.readTree(response.body());
                    } catch (IOException e) {
                        throw new CompletionException(new FetchException(FetchException.Kind.MALFORMED_RESPONSE,
                                "Response of " + uri + " is not valid JSON", uri, response.status(), e));
                    }
                })
                .orTimeout(options.overallTimeout().toMillis(), TimeUnit.MILLISECONDS);
        return await(document, uri);
    }

    private <T> T await(CompletableFuture<T> future, URI uri) throws FetchException, InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            if (cause instanceof FetchException fetchException) {
                throw fetchException;
            }
            if (cause instanceof TimeoutException) {
                throw new FetchException(FetchException.Kind.TIMEOUT,
                        "Retrieval from " + uri + " did not finish within " + options.overallTimeout(), uri);
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Unexpected failure fetching " + uri, cause);
        }
    }

    private CompletableFuture<List<JsonNode>> fetchFrom(URI uri, Pagination pagination) {
        return request(uri, 0).thenComposeAsync(response -> {
            URI next;
            try {
                next = pagination.accept(response);
            } catch (FetchException e) {
                return CompletableFuture.<List<JsonNode>>failedFuture(e);
            }
            if (next == null) {
                LOG.info("Fetched {} records in {} pages", pagination.records.size(), pagination.pages);
                return CompletableFuture.completedFuture(pagination.records);
            }
            return fetchFrom(next, pagination);
        }, executor);
    }

    private CompletableFuture<ApiResponse> request(URI uri, int attempt) {
        return transport.get(uri, options.requestTimeout())
                .handleAsync((response, error) -> {
                    Throwable cause = unwrap(error);
                    if (cause == null && response.isSuccess()) {
                        return CompletableFuture.<ApiResponse>completedFuture(response);
                    }
                    if (isTransient(cause, response)) {
                        if (attempt < options.maxRetries()) {
                            long delay = options.backoff(attempt).toMillis();
                            LOG.warn("Request to {} failed ({}), retry {}/{} in {} ms", uri,
                                    describe(cause, response), attempt + 1, options.maxRetries(), delay);
                            Executor delayed = CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS, executor);
                            return CompletableFuture.supplyAsync(() -> uri, delayed)
                                    .thenCompose(u -> request(u, attempt + 1));
                        }
                        return CompletableFuture.<ApiResponse>failedFuture(new FetchException(
                                FetchException.Kind.TRANSIENT_EXHAUSTED,
                                "Request to " + uri + " still failing after " + options.maxRetries() + " retries: "
                                        + describe(cause, response),
                                uri, response != null ? response.status() : -1, cause));
                    }
                    return CompletableFuture.<ApiResponse>failedFuture(classify(uri, cause, response));
                }, executor)
                .thenCompose(Function.identity());
    }

    static boolean isTransient(Throwable cause, ApiResponse response) {
        if (cause != null) {
            return cause instanceof IOException
                    && !(cause instanceof HttpTimeoutException)
                    && !(cause instanceof SSLException);
        }
        return response.status() == 429 || response.status() >= 500;
    }

    private static FetchException classify(URI uri, Throwable cause, ApiResponse response) {
        if (cause instanceof HttpTimeoutException) {
            return new FetchException(FetchException.Kind.TIMEOUT, "Request to " + uri + " timed out", uri, -1, cause);
        }
        if (cause instanceof SSLException) {
            return new FetchException(FetchException.Kind.TLS,
                    "TLS handshake with " + uri.getHost() + " failed: " + cause.getMessage(), uri, -1, cause);
        }
        if (cause != null) {
            return new FetchException(FetchException.Kind.TRANSIENT_EXHAUSTED,
                    "Request to " + uri + " failed: " + cause, uri, -1, cause);
        }
        return new FetchException(FetchException.Kind.HTTP_STATUS,
                "Server answered " + response.status() + " for " + uri, uri, response.status(), null);
    }

    private static String describe(Throwable cause, ApiResponse response) {
        return cause != null ? cause.toString() : "HTTP " + response.status();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    /** Progress of one retrieval. Only touched from the fetcher thread. */
    private final class Pagination {

        private final PageListener listener;
        private final Set<URI> visited = new HashSet<>();
        private final List<JsonNode> records = new ArrayList<>();
        private int pages;

        Pagination(URI start, PageListener listener) {
            this.listener = listener;
            visited.add(start);
        }

        /** Consumes a page and returns the next page's URI, or {@code null} when done. */
        URI accept(ApiResponse response) throws FetchException {
            URI uri = response.uri();
            JsonNode body;
            try {
                body = MAPPER.readTree(response.body());
            } catch (JsonProcessingException e) {
                throw new FetchException(FetchException.Kind.MALFORMED_RESPONSE,
                        "Page " + uri + " is not valid JSON: " + e.getOriginalMessage(), uri, response.status(), e);
            } catch (IOException e) {
                throw new FetchException(FetchException.Kind.MALFORMED_RESPONSE,
                        "Page " + uri + " could not be read", uri, response.status(), e);
            }
            if (body == null || !body.isArray()) {
                throw new FetchException(FetchException.Kind.MALFORMED_RESPONSE,
                        "Page " + uri + " is not a JSON array", uri, response.status(), null);
            }
            if (body.isEmpty()) {
                LOG.warn("Received an empty page from {}, stopping", uri);
                return null;
            }

            List<JsonNode> page = new ArrayList<>(body.size());
            body.forEach(page::add);
            records.addAll(page);
            pages++;
            try {
                listener.onPage(pages, page);
            } catch (IOException e) {
                throw new FetchException(FetchException.Kind.IO,
                        "Failed to store page " + pages + ": " + e.getMessage(), uri, response.status(), e);
            }
            eventBus.post(new SyncEvents.PageFetchedEvent(pages, page.size(), records.size()));
            LOG.debug("Page {} from {} with {} records", pages, uri, page.size());

            Map<String, URI> links;
            try {
                links = LinkHeader.parse(response.headerValues("Link"), uri);
            } catch (IllegalArgumentException e) {
                throw new FetchException(FetchException.Kind.MALFORMED_PAGINATION, e.getMessage(), uri,
                        response.status(), e);
            }
            URI next = links.get("next");
            if (next == null) {
                return null;
            }
            if (!visited.add(next)) {
                throw new FetchException(FetchException.Kind.MALFORMED_PAGINATION,
                        "Pagination loop: " + next + " was already requested", uri, response.status(), null);
            }
            return next;
        }
    }
}
