package de.bsommerfeld.sysml.sql.api;

import de.bsommerfeld.sysml.sql.core.event.ApplicationEventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SysmlApiClientTest {

    private static final String BASE = "https://sysml.example.com/api";

    private ScriptedTransport transport;
    private PaginatedFetcher fetcher;
    private SysmlApiClient client;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        fetcher = new PaginatedFetcher(transport,
                new FetchOptions(0, Duration.ofMillis(1), Duration.ofSeconds(5), Duration.ofSeconds(30)),
                new ApplicationEventBus());
        client = new SysmlApiClient(URI.create(BASE + "/"), fetcher);

        transport.respond(BASE + "/projects", 200, """
                [
                  {"@id": "p1", "@type": "Project", "name": "Vehicle Model", "defaultBranch": {"@id": "b1"}},
                  {"@id": "p2", "@type": "Project", "name": "Vehicle Library", "defaultBranch": {"@id": "b3"}},
                  {"@id": "p3", "@type": "Project", "name": "Drone", "defaultBranch": {"@id": "b4"}}
                ]
                """)
                .respond(BASE + "/projects/p1", 200,
                        "{\"@id\": \"p1\", \"name\": \"Vehicle Model\", \"defaultBranch\": {\"@id\": \"b1\"}}")
                .respond(BASE + "/projects/p1/branches", 200, """
                        [
                          {"@id": "b1", "name": "main", "head": {"@id": "c1"}},
                          {"@id": "b2", "name": "feature/wheels", "head": {"@id": "c2"}}
                        ]
                        """)
                .respond(BASE + "/projects/p1/branches/b1", 200,
                        "{\"@id\": \"b1\", \"name\": \"main\", \"head\": {\"@id\": \"c1\"}}")
                .respond(BASE + "/projects/p1/branches/b2", 200,
                        "{\"@id\": \"b2\", \"name\": \"feature/wheels\", \"head\": {\"@id\": \"c2\"}}")
                .respond(BASE + "/projects/p3/branches/b4", 200,
                        "{\"@id\": \"b4\", \"name\": \"main\", \"head\": null}");
    }

    @AfterEach
    void tearDown() {
        fetcher.close();
    }

    // -- Project selection --

    @Test
    void resolve_shouldUseProjectIdAndCommitIdDirectly() throws Exception {
        ModelReference reference = client.resolve(ProjectSelector.byId("p9"), CommitSelector.commitId("c9"));

        assertEquals(new ModelReference("p9", "c9"), reference);
        assertTrue(transport.requests().isEmpty());
    }

    @Test
    void resolve_shouldSelectProjectByUniqueNamePrefix() throws Exception {
        ModelReference reference = client.resolve(ProjectSelector.byName("Vehicle M"), CommitSelector.defaultBranch());

        assertEquals(new ModelReference("p1", "c1"), reference);
    }

    @Test
    void resolve_shouldRejectAmbiguousProjectName() {
        FetchException e = assertThrows(FetchException.class,
                () -> client.resolve(ProjectSelector.byName("Vehicle"), CommitSelector.defaultBranch()));

        assertEquals(FetchException.Kind.SELECTION, e.getKind());
        assertTrue(e.getMessage().contains("Vehicle Model"));
        assertTrue(e.getMessage().contains("Vehicle Library"));
    }

    @Test
    void resolve_shouldRejectUnknownProjectName() {
        FetchException e = assertThrows(FetchException.class,
                () -> client.resolve(ProjectSelector.byName("Ship"), CommitSelector.defaultBranch()));

        assertEquals(FetchException.Kind.SELECTION, e.getKind());
        assertTrue(e.getMessage().contains("Drone"));
    }

    // -- Commit selection --

    @Test
    void resolve_shouldLoadProjectForDefaultBranchWhenSelectedById() throws Exception {
        ModelReference reference = client.resolve(ProjectSelector.byId("p1"), CommitSelector.defaultBranch());

        assertEquals("c1", reference.commitId());
        assertTrue(transport.requests().contains(URI.create(BASE + "/projects/p1")));
    }

    @Test
    void resolve_shouldUseHeadOfBranchById() throws Exception {
        assertEquals("c2", client.resolve(ProjectSelector.byId("p1"), CommitSelector.branchId("b2")).commitId());
    }

    @Test
    void resolve_shouldUseHeadOfBranchByNamePrefix() throws Exception {
        assertEquals("c2", client.resolve(ProjectSelector.byId("p1"), CommitSelector.branchName("feature")).commitId());
    }

    @Test
    void resolve_shouldReportUnknownBranchIdAsSelectionError() {
        FetchException e = assertThrows(FetchException.class,
                () -> client.resolve(ProjectSelector.byId("p1"), CommitSelector.branchId("nope")));

        assertEquals(FetchException.Kind.SELECTION, e.getKind());
    }

    @Test
    void resolve_shouldRejectBranchWithoutHead() {
        FetchException e = assertThrows(FetchException.class,
                () -> client.resolve(ProjectSelector.byName("Drone"), CommitSelector.defaultBranch()));

        assertEquals(FetchException.Kind.SELECTION, e.getKind());
    }

    // -- URLs --

    @Test
    void elementsUri_shouldIncludeEncodedPageSize() {
        URI uri = client.elementsUri(new ModelReference("p1", "c1"), 500);

        assertEquals(BASE + "/projects/p1/commits/c1/elements?page%5Bsize%5D=500", uri.toString());
    }

    @Test
    void elementsUri_shouldOmitPageSizeWhenUnset() {
        assertEquals(BASE + "/projects/p1/commits/c1/elements",
                client.elementsUri(new ModelReference("p1", "c1"), null).toString());
    }

    @Test
    void selectors_shouldRequireExactlyOneChoice() {
        assertThrows(IllegalArgumentException.class, () -> new ProjectSelector("p", "name"));
        assertThrows(IllegalArgumentException.class, () -> new CommitSelector(CommitSelector.Kind.COMMIT_ID, null));
    }
}
