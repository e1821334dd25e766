package org.stianloader.shyresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.shyresolve.popularity.FetchFailure;
import org.stianloader.shyresolve.popularity.FetchOutcome;
import org.stianloader.shyresolve.popularity.HttpPopularityOracle;
import org.stianloader.shyresolve.popularity.PopularityStats;
import org.stianloader.shyresolve.popularity.cache.FilePopularityCache;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

public class HttpPopularityOracleTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    static void respond(@NotNull HttpExchange exchange, int status, @NotNull String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @TempDir
    Path cacheDir;

    private ExecutorService executor;
    private final Map<String, String> requests = new ConcurrentHashMap<>();
    private HttpServer server;

    @AfterEach
    public void stopServer() {
        this.server.stop(0);
        this.executor.shutdownNow();
    }

    @BeforeEach
    public void startServer() throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        this.executor = Executors.newCachedThreadPool();
        this.server.setExecutor(this.executor);
        this.server.createContext("/api/packages/", (exchange) -> {
            String path = exchange.getRequestURI().getRawPath();
            this.requests.merge(path, exchange.getRequestHeaders().getFirst("Accept"), (a, b) -> b);
            if (path.equals("/api/packages/sampleproject/recent")) {
                respond(exchange, 200, "{\"data\": {\"last_day\": 1128, \"last_month\": 28830, \"last_week\": 7099}, \"package\": \"sampleproject\", \"type\": \"recent_downloads\"}");
            } else if (path.equals("/api/packages/negative/recent")) {
                respond(exchange, 200, "{\"data\": {\"last_day\": -1, \"last_month\": 2, \"last_week\": 1}}");
            } else if (path.equals("/api/packages/fractional/recent")) {
                respond(exchange, 200, "{\"data\": {\"last_day\": 1.5, \"last_month\": 2, \"last_week\": 1}}");
            } else if (path.equals("/api/packages/truncated/recent")) {
                respond(exchange, 200, "{\"data\": {\"last_day\": 1");
            } else if (path.equals("/api/packages/shape/recent")) {
                respond(exchange, 200, "[1, 2, 3]");
            } else if (path.equals("/api/packages/slow/recent")) {
                try {
                    Thread.sleep(3000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                respond(exchange, 200, "{\"data\": {\"last_day\": 1, \"last_month\": 1, \"last_week\": 1}}");
            } else {
                respond(exchange, 404, "{\"message\": \"Not Found\"}");
            }
        });
        this.server.start();
    }

    @NotNull
    private HttpPopularityOracle oracle(@NotNull FilePopularityCache cache, int timeout) {
        return new HttpPopularityOracle(this.baseURI(), timeout, cache, new MutableClock(NOW));
    }

    @NotNull
    private URI baseURI() {
        return URI.create("http://" + InetAddress.getLoopbackAddress().getHostAddress() + ":" + this.server.getAddress().getPort() + "/api");
    }

    @Test
    public void testBadStatus() {
        FilePopularityCache cache = new FilePopularityCache(this.cacheDir, new MutableClock(NOW));
        FetchOutcome outcome = this.oracle(cache, 5000).fetch("missing");
        assertFalse(outcome.isSuccess());
        assertEquals(FetchFailure.BAD_STATUS, outcome.getFailure().get());
        assertTrue(outcome.getDetail().contains("404"), outcome.getDetail());
        assertFalse(cache.get("missing").isPresent());
    }

    @Test
    public void testMalformedResponses() {
        FilePopularityCache cache = new FilePopularityCache(this.cacheDir, new MutableClock(NOW));
        HttpPopularityOracle oracle = this.oracle(cache, 5000);
        for (String name : new String[] {"negative", "fractional", "truncated", "shape"}) {
            FetchOutcome outcome = oracle.fetch(name);
            assertEquals(FetchFailure.MALFORMED_RESPONSE, outcome.getFailure().orElse(null), name);
            assertFalse(cache.get(name).isPresent(), name);
        }
    }

    @Test
    public void testRequestURI() {
        HttpPopularityOracle oracle = new HttpPopularityOracle(URI.create("https://pypistats.org/api"), 1000,
                new FilePopularityCache(this.cacheDir, new MutableClock(NOW)), new MutableClock(NOW));
        assertEquals(URI.create("https://pypistats.org/api/"), oracle.getBase());
        assertEquals(URI.create("https://pypistats.org/api/packages/requests/recent"), oracle.getRequestURI("requests"));
        assertEquals(URI.create("https://pypistats.org/api/packages/my%20package/recent"), oracle.getRequestURI("my package"));
        assertEquals(URI.create("https://pypistats.org/api/packages/..%2Fadmin/recent"), oracle.getRequestURI("../admin"));
    }

    @Test
    public void testTrackedDomains() {
        FilePopularityCache cache = new FilePopularityCache(this.cacheDir, new MutableClock(NOW));
        HttpPopularityOracle pypi = new HttpPopularityOracle(URI.create("https://pypistats.org/api"), 1000, cache, new MutableClock(NOW));
        assertEquals(Collections.singleton(HttpPopularityOracle.PYPI_DOMAIN), pypi.getTrackedDomains());
        assertTrue(pypi.isTracked("pypi.org"));
        assertTrue(pypi.isTracked("PyPI.org"));
        assertFalse(pypi.isTracked("files.pythonhosted.org"));
        assertFalse(pypi.isTracked("mirror.example.com"));
        assertFalse(pypi.isTracked(""));

        HttpPopularityOracle mirrors = new HttpPopularityOracle(URI.create("https://stats.example.com/api"), 1000, cache, new MutableClock(NOW),
                Arrays.asList(" Mirror.Example.com", "pypi.org"));
        assertTrue(mirrors.isTracked("mirror.example.com"));
        assertTrue(mirrors.isTracked("pypi.org"));
        assertFalse(mirrors.isTracked("test.pypi.org"));
    }

    @Test
    public void testSuccess() {
        FilePopularityCache cache = new FilePopularityCache(this.cacheDir, new MutableClock(NOW));
        FetchOutcome outcome = this.oracle(cache, 5000).fetch("sampleproject");
        assertTrue(outcome.isSuccess(), outcome.toString());
        assertEquals(new PopularityStats("sampleproject", 1128, 7099, 28830, NOW), outcome.getStats().get());
        assertEquals("application/json", this.requests.get("/api/packages/sampleproject/recent"));

        // successful fetches are written through to the cache
        assertEquals(new PopularityStats("sampleproject", 1128, 7099, 28830, NOW), cache.get("sampleproject").get().stats());
    }

    @Test
    public void testTimeout() {
        FilePopularityCache cache = new FilePopularityCache(this.cacheDir, new MutableClock(NOW));
        FetchOutcome outcome = this.oracle(cache, 250).fetch("slow");
        assertEquals(FetchFailure.TIMEOUT, outcome.getFailure().orElse(null), outcome.toString());
    }

    @Test
    public void testUnreachable() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }
        HttpPopularityOracle oracle = new HttpPopularityOracle(URI.create("http://" + InetAddress.getLoopbackAddress().getHostAddress() + ":" + port + "/api"), 2000,
                new FilePopularityCache(this.cacheDir, new MutableClock(NOW)), new MutableClock(NOW));
        FetchOutcome outcome = oracle.fetch("sampleproject");
        assertEquals(FetchFailure.UNREACHABLE, outcome.getFailure().orElse(null), outcome.toString());
    }
}
