package exray.bridge.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import exray.bridge.config.BridgeConfig;
import exray.bridge.config.Dependencies;
import exray.bridge.server.BridgeNettyServer;
import exray.bridge.testing.FakeWorkflowEngine;
import exray.bridge.testing.InMemoryArtifactStore;
import org.junit.jupiter.api.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints.
 * Netty, controllers, orchestrator and H2 registry are real; the engine and object store are in memory.
 */
class HttpEndpointIntegrationTest {

        private static final ObjectMapper MAPPER = new ObjectMapper();

        private Dependencies deps;
        private FakeWorkflowEngine engine;
        private InMemoryArtifactStore store;
        private HttpClient httpClient;
        private String baseUrl;

        @BeforeEach
        void setUp() throws Exception {
                // Stop any existing server instance
                if (BridgeNettyServer.isRunning()) {
                        BridgeNettyServer.stop();
                }

                int port = freePort();
                BridgeConfig config = BridgeConfig.defaults()
                                .withServerPort(port)
                                .withDatabaseUrl("jdbc:h2:mem:test-http-" + System.nanoTime()
                                                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
                engine = new FakeWorkflowEngine();
                store = new InMemoryArtifactStore(config.artifactBucket());
                deps = Dependencies.create(config, engine, store, Optional::empty);

                assertTrue(BridgeNettyServer.start(port, deps));
                baseUrl = "http://localhost:" + port;

                httpClient = HttpClient.newBuilder()
                                .version(HttpClient.Version.HTTP_1_1)
                                .connectTimeout(Duration.ofSeconds(5))
                                .build();
        }

        @AfterEach
        void tearDown() {
                BridgeNettyServer.stop();
                deps.close();
        }

        @Test
        @DisplayName("Health reports both services and overall status")
        void health() throws Exception {
                HttpResponse<String> healthy = get("/api/v1/health");
                assertEquals(200, healthy.statusCode());
                JsonNode body = MAPPER.readTree(healthy.body());
                assertEquals("healthy", body.get("overall_status").asText());
                assertTrue(body.get("cluster") == null || body.get("cluster").isNull());

                engine.setReachable(false);
                store.setReachable(false);
                JsonNode degraded = MAPPER.readTree(get("/api/v1/health").body());
                assertEquals("unhealthy", degraded.get("overall_status").asText());
                assertEquals("error", degraded.get("services").get("argo").get("status").asText());
                assertEquals("error", degraded.get("services").get("minio").get("status").asText());
        }

        @Test
        @DisplayName("Full HTTP flow: submit ctgan, poll, fetch result and logs")
        void ctganFlow() throws Exception {
                engine.setNextPhase("Running");

                Map<String, String> fields = new LinkedHashMap<>();
                fields.put("no_of_epochs", "25");
                fields.put("cpu_limit", "1");
                HttpResponse<String> created = postForm("/api/v1/runs/ctgan", fields,
                                Map.of("file", new Part("people data.csv", "name,age\nann,31\n")));

                assertEquals(201, created.statusCode(), "Body: " + created.body());
                JsonNode run = MAPPER.readTree(created.body());
                String runId = run.get("run_id").asText();
                assertEquals("ctgan", run.get("workflow_kind").asText());
                assertEquals("Running", run.get("status").get("phase").asText());
                assertEquals("25", run.get("parameters").get("no_of_epochs").asText());
                assertEquals("1", run.get("parameters").get("cpu_limit").asText());
                assertEquals("people data.csv", run.get("original_filename").asText());
                assertTrue(store.contains("input/" + runId + "_people_data.csv"));

                // Result is not ready while the workflow runs
                HttpResponse<String> early = get("/api/v1/runs/" + runId + "/result");
                assertEquals(409, early.statusCode());
                assertTrue(MAPPER.readTree(early.body()).has("error"));

                // Workflow finishes and writes its output
                String engineName = run.get("engine_name").asText();
                engine.workflow(engineName, "Succeeded");
                store.put("output/" + runId + "_people_data.csv", "synthetic");

                JsonNode refreshed = MAPPER.readTree(get("/api/v1/runs/" + runId).body());
                assertEquals("Succeeded", refreshed.get("status").get("phase").asText());

                int fetchesBeforeResult = engine.fetchCount();
                HttpResponse<String> result = get("/api/v1/runs/" + runId + "/result");
                assertEquals(200, result.statusCode(), "Body: " + result.body());
                assertEquals(fetchesBeforeResult, engine.fetchCount(), "finished run with a stored key skips the engine");
                JsonNode link = MAPPER.readTree(result.body());
                assertEquals(runId, link.get("run_id").asText());
                assertTrue(link.get("download_url").asText().contains("output/" + runId + "_people_data.csv"));

                JsonNode list = MAPPER.readTree(get("/api/v1/runs?refresh=false").body());
                assertEquals(1, list.get("runs").size());

                engine.putLogs(engineName, null, "main", "epoch 1\nepoch 2\n");
                HttpResponse<String> logs = get("/api/v1/runs/" + runId + "/logs?tail=5");
                assertEquals(200, logs.statusCode());
                assertTrue(logs.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"));
                assertEquals("epoch 1\nepoch 2\n", logs.body());
        }

        @Test
        @DisplayName("Custom runs need a .py script")
        void customValidation() throws Exception {
                Map<String, Part> files = new LinkedHashMap<>();
                files.put("data_file", new Part("rows.csv", "x\n1\n"));
                files.put("python_file", new Part("fn.txt", "def process(df): return df\n"));

                HttpResponse<String> response = postForm("/api/v1/runs/custom", Map.of(), files);

                assertEquals(400, response.statusCode());
                assertTrue(engine.submitted().isEmpty());

                files.put("python_file", new Part("fn.py", "def process(df): return df\n"));
                HttpResponse<String> accepted = postForm("/api/v1/runs/custom", Map.of(), files);
                assertEquals(201, accepted.statusCode(), "Body: " + accepted.body());
                assertEquals("fn.py", MAPPER.readTree(accepted.body()).get("original_script_filename").asText());
        }

        @Test
        void llmRequiresLabelsAndFile() throws Exception {
                HttpResponse<String> noLabels = postForm("/api/v1/runs/llm", Map.of("model", "llama3"),
                                Map.of("file", new Part("d.csv", "t\n")));
                assertEquals(400, noLabels.statusCode());

                HttpResponse<String> noFile = postForm("/api/v1/runs/llm",
                                Map.of("model", "llama3", "labels", "a,b"), Map.of());
                assertEquals(400, noFile.statusCode());
                assertTrue(noFile.body().contains("file is required"));
        }

        @Test
        void engineRejectionIsBadGateway() throws Exception {
                engine.failSubmissions(500);

                HttpResponse<String> response = postForm("/api/v1/runs/ctgan", Map.of(),
                                Map.of("file", new Part("d.csv", "t\n")));

                assertEquals(502, response.statusCode());
                assertEquals(0, MAPPER.readTree(get("/api/v1/runs").body()).get("runs").size());
        }

        @Test
        void unknownRunsAndPaths() throws Exception {
                assertEquals(404, get("/api/v1/runs/does-not-exist").statusCode());
                assertEquals(404, get("/api/v1/runs/does-not-exist/result").statusCode());
                assertEquals(404, get("/api/v1/runs/does-not-exist/logs").statusCode());
                assertEquals(404, get("/api/v1/nothing-here").statusCode());
                assertEquals(400, get("/api/v1/runs/x/logs?tail=lots").statusCode());
        }

        // --- Helpers ---

        private record Part(String filename, String content) {
        }

        private HttpResponse<String> get(String path) throws Exception {
                return httpClient.send(
                                HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET().build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<String> postForm(String path, Map<String, String> fields, Map<String, Part> files)
                        throws Exception {
                String boundary = "----exray" + UUID.randomUUID().toString().replace("-", "");
                ByteArrayOutputStream body = new ByteArrayOutputStream();
                for (Map.Entry<String, String> field : fields.entrySet()) {
                        write(body, "--" + boundary + "\r\n"
                                        + "Content-Disposition: form-data; name=\"" + field.getKey() + "\"\r\n\r\n"
                                        + field.getValue() + "\r\n");
                }
                for (Map.Entry<String, Part> file : files.entrySet()) {
                        write(body, "--" + boundary + "\r\n"
                                        + "Content-Disposition: form-data; name=\"" + file.getKey()
                                        + "\"; filename=\"" + file.getValue().filename() + "\"\r\n"
                                        + "Content-Type: application/octet-stream\r\n\r\n"
                                        + file.getValue().content() + "\r\n");
                }
                write(body, "--" + boundary + "--\r\n");

                return httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + path))
                                                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                                                .POST(HttpRequest.BodyPublishers.ofByteArray(body.toByteArray()))
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private static void write(ByteArrayOutputStream out, String s) {
                out.writeBytes(s.getBytes(StandardCharsets.UTF_8));
        }

        private static int freePort() throws IOException {
                try (ServerSocket socket = new ServerSocket(0)) {
                        return socket.getLocalPort();
                }
        }
}
