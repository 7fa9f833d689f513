package de.bsommerfeld.sysml.sql.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.sysml.sql.core.event.ApplicationEventBus;
import de.bsommerfeld.sysml.sql.core.event.SyncEvents;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class PaginatedFetcherTest {

    private static final String PAGE_1 = "https://api.example.com/elements";
    private static final String PAGE_2 = "https://api.example.com/elements?page=2";
    private static final String PAGE_3 = "https://api.example.com/elements?page=3";

    private ScriptedTransport transport;
    private ApplicationEventBus eventBus;
    private PaginatedFetcher fetcher;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        eventBus = new ApplicationEventBus();
        fetcher = new PaginatedFetcher(transport,
                new FetchOptions(2, Duration.ofMillis(1), Duration.ofSeconds(5), Duration.ofSeconds(30)), eventBus);
    }

    @AfterEach
    void tearDown() {
        fetcher.close();
    }

    private static List<String> ids(List<JsonNode> records) {
        List<String> ids = new ArrayList<>();
        records.forEach(r -> ids.add(r.path("@id").asText()));
        return ids;
    }

    // -- Pagination --

    @Test
    void fetchAll_shouldFollowNextLinksInOrder() throws Exception {
        transport.respond(PAGE_1, 200, "[{\"@id\": \"a\"}, {\"@id\": \"b\"}]", "<" + PAGE_2 + ">; rel=\"next\"")
                .respond(PAGE_2, 200, "[{\"@id\": \"c\"}]", "<" + PAGE_3 + ">; rel=\"next\"")
                .respond(PAGE_3, 200, "[{\"@id\": \"d\"}]");

        List<JsonNode> records = fetcher.fetchAll(URI.create(PAGE_1), PageListener.NONE);

        assertEquals(List.of("a", "b", "c", "d"), ids(records));
        assertEquals(List.of(URI.create(PAGE_1), URI.create(PAGE_2), URI.create(PAGE_3)), transport.requests());
    }

    @Test
    void fetchAll_shouldResolveRelativeNextLinks() throws Exception {
        transport.respond(PAGE_1, 200, "[{\"@id\": \"a\"}]", "</elements?page=2>; rel=\"next\"")
                .respond(PAGE_2, 200, "[{\"@id\": \"b\"}]");

        assertEquals(List.of("a", "b"), ids(fetcher.fetchAll(URI.create(PAGE_1), PageListener.NONE)));
    }

    @Test
    void fetchAll_shouldStopAtEmptyPage() throws Exception {
        transport.respond(PAGE_1, 200, "[{\"@id\": \"a\"}]", "<" + PAGE_2 + ">; rel=\"next\"")
                .respond(PAGE_2, 200, "[]", "<" + PAGE_3 + ">; rel=\"next\"");

        assertEquals(List.of("a"), ids(fetcher.fetchAll(URI.create(PAGE_1), PageListener.NONE)));
        assertFalse(transport.requests().contains(URI.create(PAGE_3)));
    }

    @Test
    void fetchAll_shouldDetectPaginationLoop() {
        transport.respond(PAGE_1, 200, "[{\"@id\": \"a\"}]", "<" + PAGE_2 + ">; rel=\"next\"")
                .respond(PAGE_2, 200, "[{\"@id\": \"b\"}]", "<" + PAGE_1 + ">; rel=\"next\"");

        FetchException e = assertThrows(FetchException.class,
                () -> fetcher.fetchAll(URI.create(PAGE_1), PageListener.NONE));

        assertEquals(FetchException.Kind.MALFORMED_PAGINATION, e.getKind());
    }

    @Test
    void fetchAll_shouldRejectMalformedLinkHeader() {
        transport.respond(PAGE_1, 200, "[{\"@id\": \"a\"}]", "next page please");

        FetchException e = assertThrows(FetchException.class,
                () -> fetcher.fetchAll(URI.create(PAGE_1), PageListener.NONE));

        assertEquals(FetchException.Kind.MALFORMED_PAGINATION, e.getKind());
    }

    @Test
    void fetchAll_shouldRejectNonArrayBody() {
        transport.respond(PAGE_1, 200, "{\"@id\": \"a\"}");

        FetchException e = assertThrows(FetchException.class,
                () -> fetcher.fetchAll(URI.create(PAGE_1), PageListener.NONE));

        assertEquals(FetchException.Kind.MALFORMED_RESPONSE, e.getKind());
    }

    @Test
    void fetchAll_shouldHandPagesToListenerAndEventBus() throws Exception {
        transport.respond(PAGE_1, 200, "[{\"@id\": \"a\"}, {\"@id\": \"b\"}]", "<" + PAGE_2 + ">; rel=\"next\"")
                .respond(PAGE_2, 200, "[{\"@id\": \"c\"}]");
        List<Integer> pageSizes = new CopyOnWriteArrayList<>();
        PageEvents events = new PageEvents();
        eventBus.register(events);

        fetcher.fetchAll(URI.create(PAGE_1), (pageNumber, records) -> pageSizes.add(records.size()));

        assertEquals(List.of(2, 1), pageSizes);
        assertEquals(2, events.received.size());
        assertEquals(3, events.received.get(1).totalRecords());
    }

    @Test
    void fetchAll_shouldReportListenerFailureAsIo() {
        transport.respond(PAGE_1, 200, "[{\"@id\": \"a\"}]");

        FetchException e = assertThrows(FetchException.class, () -> fetcher.fetchAll(URI.create(PAGE_1),
                (pageNumber, records) -> {
                    throw new IOException("disk full");
                }));

        assertEquals(FetchException.Kind.IO, e.getKind());
    }

    // -- Retries --

    @Test
    void fetchAll_shouldRetryTransientFailures() throws Exception {
        transport.fail(PAGE_1, new ConnectException("refused"))
                .respond(PAGE_1, 503, "")
                .respond(PAGE_1, 200, "[{\"@id\": \"a\"}]");

        assertEquals(List.of("a"), ids(fetcher.fetchAll(URI.create(PAGE_1), PageListener.NONE)));
        assertEquals(3, transport.requests().size());
    }

    @Test
    void fetchAll_shouldRetryMidPaginationAndContinueFromSamePage() throws Exception {
        transport.respond(PAGE_1, 200, "[{\"@id\": \"a\"}, {\"@id\": \"b\"}]", "<" + PAGE_2 + ">; rel=\"next\"")
                .respond(PAGE_2, 503, "")
                .respond(PAGE_2, 200, "[{\"@id\": \"c\"}]", "<" + PAGE_3 + ">; rel=\"next\"")
                .respond(PAGE_3, 200, "[{\"@id\": \"d\"}]");

        List<JsonNode> records = fetcher.fetchAll(URI.create(PAGE_1), PageListener.NONE);

        assertEquals(List.of("a", "b", "c", "d"), ids(records));
        assertEquals(List.of(URI.create(PAGE_1), URI.create(PAGE_2), URI.create(PAGE_2), URI.create(PAGE_3)),
                transport.requests());
    }

    @Test
    void fetchAll_shouldRetryTooManyRequests() throws Exception {
        transport.respond(PAGE_1, 429, "")
                .respond(PAGE_1, 200, "[{\"@id\": \"a\"}]");

        assertEquals(List.of("a"), ids(fetcher.fetchAll(URI.create(PAGE_1), PageListener.NONE)));
    }

    @Test
    void fetchAll_shouldGiveUpAfterMaxRetries() {
        transport.respond(PAGE_1, 500, "oops");

        FetchException e = assertThrows(FetchException.class,
                () -> fetcher.fetchAll(URI.create(PAGE_1), PageListener.NONE));

        assertEquals(FetchException.Kind.TRANSIENT_EXHAUSTED, e.getKind());
        assertEquals(500, e.getStatus());
        assertEquals(3, transport.requests().size());
    }

    @Test
    void fetchAll_shouldNotRetryClientErrors() {
        transport.respond(PAGE_1, 403, "forbidden");

        FetchException e = assertThrows(FetchException.class,
                () -> fetcher.fetchAll(URI.create(PAGE_1), PageListener.NONE));

        assertEquals(FetchException.Kind.HTTP_STATUS, e.getKind());
        assertEquals(403, e.getStatus());
        assertEquals(1, transport.requests().size());
    }

    @Test
    void fetchAll_shouldClassifyRequestTimeout() {
        transport.fail(PAGE_1, new HttpTimeoutException("request timed out"));

        FetchException e = assertThrows(FetchException.class,
                () -> fetcher.fetchAll(URI.create(PAGE_1), PageListener.NONE));

        assertEquals(FetchException.Kind.TIMEOUT, e.getKind());
        assertEquals(1, transport.requests().size());
    }

    @Test
    void fetchAll_shouldClassifyTlsFailure() {
        transport.fail(PAGE_1, new SSLHandshakeException("PKIX path building failed"));

        FetchException e = assertThrows(FetchException.class,
                () -> fetcher.fetchAll(URI.create(PAGE_1), PageListener.NONE));

        assertEquals(FetchException.Kind.TLS, e.getKind());
    }

    @Test
    void fetchAll_shouldEnforceOverallDeadline() {
        HttpTransport hanging = (uri, timeout) -> new CompletableFuture<>();
        try (PaginatedFetcher slow = new PaginatedFetcher(hanging,
                new FetchOptions(0, Duration.ofMillis(1), Duration.ofSeconds(5), Duration.ofMillis(100)), eventBus)) {

            FetchException e = assertThrows(FetchException.class,
                    () -> slow.fetchAll(URI.create(PAGE_1), PageListener.NONE));

            assertEquals(FetchException.Kind.TIMEOUT, e.getKind());
        }
    }

    // -- Single documents --

    @Test
    void fetchDocument_shouldParseObject() throws Exception {
        transport.respond(PAGE_1, 200, "{\"@id\": \"p\", \"name\": \"Vehicle\"}");

        assertEquals("Vehicle", fetcher.fetchDocument(URI.create(PAGE_1)).path("name").asText());
    }

    static class PageEvents {
        final List<SyncEvents.PageFetchedEvent> received = new CopyOnWriteArrayList<>();

        @Subscribe
        public void onPage(SyncEvents.PageFetchedEvent event) {
            received.add(event);
        }
    }
}
