package forkpool.local.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import forkpool.local.config.Dependencies;
import forkpool.local.config.PoolConfig;
import forkpool.local.error.TaskCancelledException;
import forkpool.local.model.TaskHandle;
import forkpool.local.process.Slf4jExecutionStreams;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits the monitoring endpoints of a running server
 * while real processes occupy the pool.
 */
class HttpEndpointIntegrationTest {

        private static final ObjectMapper MAPPER = new ObjectMapper();

        private Dependencies deps;
        private HttpClient httpClient;
        private String baseUrl;

        @BeforeEach
        void setUp() {
                PoolConfig config = PoolConfig.defaults()
                                .withMaxTasks(1)
                                .withServerHost("127.0.0.1")
                                .withServerPort(0)
                                .withKillGracePeriod(Duration.ofMillis(300));

                deps = Dependencies.create(config);
                assertTrue(deps.startServer(), "server should start");
                baseUrl = "http://127.0.0.1:" + deps.server().port();

                httpClient = HttpClient.newBuilder()
                                .connectTimeout(Duration.ofSeconds(5))
                                .build();
        }

        @AfterEach
        void tearDown() {
                deps.close();
        }

        @Test
        @DisplayName("Empty pool: both task lists are empty arrays")
        void emptyPoolReturnsEmptyArrays() throws Exception {
                HttpResponse<String> running = get("/api/local/tasks/running");
                HttpResponse<String> waiting = get("/api/local/tasks/waiting");

                assertEquals(200, running.statusCode());
                assertEquals(200, waiting.statusCode());
                assertEquals("[]", running.body());
                assertEquals("[]", waiting.body());
                assertTrue(running.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
        }

        @Test
        @DisplayName("Busy pool: running and waiting tasks are listed with their execution")
        void busyPoolListsRunningAndWaitingTasks() throws Exception {
                Instant now = Instant.now();
                TaskHandle<Instant> longTask = TaskHandle.<Instant>builder()
                                .command("sleep 30")
                                .context(now)
                                .jobId("job-long")
                                .executionId("exec-1")
                                .build();
                TaskHandle<Instant> queuedTask = TaskHandle.<Instant>builder()
                                .command("echo queued")
                                .context(now.plusSeconds(1))
                                .jobId("job-queued")
                                .build();

                CompletableFuture<Void> longFuture = deps.platform().fork(longTask,
                                new Slf4jExecutionStreams(longTask.id()));
                CompletableFuture<Void> queuedFuture = deps.platform().fork(queuedTask,
                                new Slf4jExecutionStreams(queuedTask.id()));

                JsonNode running = MAPPER.readTree(get("/api/local/tasks/running").body());
                assertEquals(1, running.size());
                assertEquals(longTask.id(), running.get(0).get("id").asText());
                assertEquals("sleep 30", running.get(0).get("command").asText());
                JsonNode execution = running.get(0).get("execution");
                assertEquals("RUNNING", execution.get("status").asText());
                assertEquals("job-long", execution.get("jobId").asText());
                assertEquals("exec-1", execution.get("executionId").asText());

                JsonNode waiting = MAPPER.readTree(get("/api/local/tasks/waiting").body());
                assertEquals(1, waiting.size());
                assertEquals(queuedTask.id(), waiting.get(0).get("id").asText());
                assertEquals("echo queued", waiting.get(0).get("command").asText());
                assertEquals("WAITING", waiting.get(0).get("execution").get("status").asText());

                // Monitoring never changes the pool
                assertEquals(1, deps.pool().runningCount());
                assertEquals(1, deps.pool().waitingCount());

                // Cancel the long task, the queued one then runs to completion
                assertTrue(deps.platform().cancel(longTask));
                ExecutionException cancelled = assertThrows(ExecutionException.class,
                                () -> longFuture.get(10, TimeUnit.SECONDS));
                assertInstanceOf(TaskCancelledException.class, cancelled.getCause());
                queuedFuture.get(10, TimeUnit.SECONDS);

                assertEquals("[]", get("/api/local/tasks/running").body());
                assertEquals("[]", get("/api/local/tasks/waiting").body());
        }

        @Test
        void healthReportsPoolOccupancy() throws Exception {
                HttpResponse<String> response = get("/api/local/health");

                assertEquals(200, response.statusCode());
                JsonNode health = MAPPER.readTree(response.body());
                assertEquals("healthy", health.get("status").asText());
                assertEquals(1, health.get("capacity").asInt());
                assertEquals(0, health.get("runningTasks").asInt());
                assertEquals(0, health.get("waitingTasks").asInt());
                assertEquals(0, health.get("liveProcesses").asInt());
        }

        @Test
        void unknownPathReturns404() throws Exception {
                HttpResponse<String> response = get("/api/local/nothing-here");

                assertEquals(404, response.statusCode());
                assertEquals("not found", MAPPER.readTree(response.body()).get("error").asText());
        }

        @Test
        void postToTaskListIsNotRouted() throws Exception {
                HttpResponse<String> response = httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + "/api/local/tasks/running"))
                                                .POST(HttpRequest.BodyPublishers.ofString("{}"))
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());

                assertEquals(404, response.statusCode());
        }

        private HttpResponse<String> get(String path) throws Exception {
                return httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + path))
                                                .GET()
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
        }
}
