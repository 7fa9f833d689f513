package de.bsommerfeld.sysml.sql.cli.command;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import de.bsommerfeld.sysml.sql.cli.SysmlSqlApp;
import de.bsommerfeld.sysml.sql.core.config.ApplicationMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fetches a three-element model from a local HTTP server that pages two
 * elements at a time.
 */
class FetchCommandTest {

    private static final String ELEMENTS = "/api/projects/p1/commits/c1/elements";

    @TempDir
    Path tempDir;

    private HttpServer server;
    private String baseUrl;
    private Path dbFile;
    private Path configFile;
    private final StringWriter out = new StringWriter();
    private final List<String> requests = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api", this::handle);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/api/";
        dbFile = tempDir.resolve("model.db");
        configFile = tempDir.resolve("config.toml");
        Files.writeString(configFile, """
                [fetch]
                max-retries = 0
                """);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String query = exchange.getRequestURI().getRawQuery();
        requests.add(query == null ? path : path + "?" + query);
        switch (path) {
            case "/api/projects" -> send(exchange, 200, """
                    [{"@id": "p1", "name": "Vehicle Model", "defaultBranch": {"@id": "b1"}},
                     {"@id": "p2", "name": "Vehicle Drone", "defaultBranch": {"@id": "b2"}}]""", null);
            case "/api/projects/p1" -> send(exchange, 200, """
                    {"@id": "p1", "name": "Vehicle Model", "defaultBranch": {"@id": "b1"}}""", null);
            case "/api/projects/p1/branches/b1" -> send(exchange, 200, """
                    {"@id": "b1", "name": "main", "head": {"@id": "c1"}}""", null);
            case ELEMENTS -> {
                if (query != null && query.contains("after")) {
                    send(exchange, 200, """
                            [{"@id": "C", "@type": "PartUsage", "declaredName": "hub", "owner": {"@id": "B"}}]""",
                            null);
                } else {
                    send(exchange, 200, """
                            [{"@id": "A", "@type": "PartDefinition", "declaredName": "Vehicle"},
                             {"@id": "B", "@type": "PartUsage", "declaredName": "wheel",
                              "definition": [{"@id": "A"}]}]""",
                            "<" + ELEMENTS + "?page[after]=B>; rel=\"next\"");
                }
            }
            default -> send(exchange, 404, "{}", null);
        }
    }

    private static void send(HttpExchange exchange, int status, String body, String link) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        if (link != null) {
            exchange.getResponseHeaders().add("Link", link);
        }
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream stream = exchange.getResponseBody()) {
            stream.write(bytes);
        }
    }

    private int run(String... args) {
        CommandLine commandLine = SysmlSqlApp.commandLine(ApplicationMode.PROD);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(new StringWriter(), true));
        List<String> arguments = new ArrayList<>(List.of("--config", configFile.toString(), dbFile.toString()));
        arguments.addAll(List.of(args));
        return commandLine.execute(arguments.toArray(new String[0]));
    }

    private long count(String sql) throws SQLException {
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbFile.toAbsolutePath());
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    @Test
    void fetch_shouldImportAllPagesOfDefaultBranch() throws Exception {
        assertEquals(0, run("init-db"));

        assertEquals(0, run("fetch", baseUrl, "--project-name", "Vehicle M", "--page-size", "2"));

        assertEquals(3, count("SELECT COUNT(*) FROM elements"));
        assertEquals(2, count("SELECT COUNT(*) FROM relations"));
        assertTrue(requests.contains(ELEMENTS + "?page%5Bsize%5D=2"), requests.toString());
        assertTrue(out.toString().contains("Imported 3 elements and 2 relations"), out.toString());
    }

    @Test
    void fetch_shouldDumpWithoutImporting() throws Exception {
        Path dump = tempDir.resolve("model.json");

        assertEquals(0, run("fetch", baseUrl, "--project-id", "p1", "--commit-id", "c1",
                "--dump-json", dump.toString(), "--no-import"));

        String json = Files.readString(dump);
        assertTrue(json.contains("\"hub\""));
        assertTrue(json.trim().startsWith("["));
        assertFalse(Files.exists(dbFile));
        assertFalse(requests.contains("/api/projects/p1"));
    }

    @Test
    void fetch_shouldFailOnAmbiguousProjectName() {
        assertEquals(1, run("fetch", baseUrl, "--project-name", "Vehicle", "--no-import"));
        assertFalse(requests.stream().anyMatch(r -> r.startsWith(ELEMENTS)));
    }

    @Test
    void fetch_shouldFailOnUnknownCommit() {
        assertEquals(1, run("fetch", baseUrl, "--project-id", "p1", "--commit-id", "missing", "--no-import"));
    }

    @Test
    void fetch_shouldRequireProjectSelector() {
        assertEquals(1, run("fetch", baseUrl, "--no-import"));
    }

    @Test
    void fetch_shouldRejectBothProjectSelectors() {
        assertEquals(1, run("fetch", baseUrl, "--project-id", "p1", "--project-name", "Veh"));
    }
}
