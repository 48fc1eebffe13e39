package fr.lapetina.mockllm.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.mockllm.api.dto.AgentRequest;
import fr.lapetina.mockllm.api.dto.GenerativeResponses;
import fr.lapetina.mockllm.api.dto.SessionRequests;
import fr.lapetina.mockllm.domain.model.GenerateRequest;
import fr.lapetina.mockllm.domain.model.GenerateResult;
import fr.lapetina.mockllm.domain.model.SimulationState;
import fr.lapetina.mockllm.domain.model.StreamChunk;
import fr.lapetina.mockllm.domain.model.StreamEvent;
import fr.lapetina.mockllm.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mockllm.session.SessionEvent;
import fr.lapetina.mockllm.session.SessionNotFoundException;
import fr.lapetina.mockllm.session.SessionStore;
import fr.lapetina.mockllm.simulator.AnalyzeResult;
import fr.lapetina.mockllm.simulator.ChaosController;
import fr.lapetina.mockllm.simulator.ChatResult;
import fr.lapetina.mockllm.simulator.InferenceSimulator;
import fr.lapetina.mockllm.simulator.ServiceUnavailableException;
import fr.lapetina.mockllm.simulator.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /v1beta/models/{model}:{action} - Generative API (also under /v1)
 *   actions: generateContent, streamGenerateContent, embedContent, batchEmbedContents,
 *   predict, countTokens
 * - POST /api/v1/agent/chat - Simulated chat
 * - POST /api/v1/agent/analyze - Simulated analysis (IO or CPU bound)
 * - GET /health - Health check with the current chaos state
 * - GET / - Service information
 * - GET /metrics - Prometheus metrics endpoint
 * - POST /admin/chaos/{latency_spike|memory_leak|cpu_spike|error_rate} - Inject chaos
 * - POST /admin/reset - Restore the baseline
 * - GET /agents - List the mock agent
 * - POST /sessions - Create a session
 * - POST /sessions/{id}/events - Append an event
 * - GET /sessions/{id}/events?min_offset=&wait_for_data= - Long-poll events
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final Pattern GENERATIVE_PATH =
            Pattern.compile("^/v1(?:beta)?/models/([^:]+):([A-Za-z]+)$");
    private static final Pattern SESSION_EVENTS_PATH =
            Pattern.compile("^/sessions/([^/]+)/events/?$");

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final InferenceSimulator simulator;
    private final ChaosController chaos;
    private final SessionStore sessionStore;
    private final MetricsRegistry metricsRegistry;
    private final Duration requestTimeout;
    private final Duration maxWaitForData;

    public HttpServer(
            int port,
            int backlog,
            int workerThreads,
            Duration requestTimeout,
            Duration maxWaitForData,
            InferenceSimulator simulator,
            SessionStore sessionStore,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.simulator = simulator;
        this.chaos = simulator.getChaos();
        this.sessionStore = sessionStore;
        this.metricsRegistry = metricsRegistry;
        this.requestTimeout = requestTimeout;
        this.maxWaitForData = maxWaitForData;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(port), backlog
        );

        // Workers only wait on scheduler futures and long polls
        this.executor = Executors.newFixedThreadPool(workerThreads, new WorkerThreadFactory());
        server.setExecutor(executor);

        // Register handlers
        GenerativeHandler generativeHandler = new GenerativeHandler();
        server.createContext("/v1beta/", generativeHandler);
        server.createContext("/v1/", generativeHandler);
        server.createContext("/api/v1/agent/", new AgentHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin/", new AdminHandler());
        server.createContext("/agents", new AgentsHandler());
        server.createContext("/sessions", new SessionsHandler());
        server.createContext("/", new RootHandler());

        log.info("HTTP server configured on port {}", port);
    }

    public void start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
    }

    /**
     * Bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdownNow();
        log.info("HTTP server stopped");
    }

    // ==================== BASE HANDLER ====================

    /**
     * Sets the MDC request id, maps domain exceptions to status codes and records metrics.
     */
    private abstract class InstrumentedHandler implements HttpHandler {
        private final String endpoint;

        InstrumentedHandler(String endpoint) {
            this.endpoint = endpoint;
        }

        abstract void doHandle(HttpExchange exchange) throws Exception;

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = UUID.randomUUID().toString();
            MDC.put("requestId", requestId);
            long start = System.nanoTime();

            try {
                doHandle(exchange);
            } catch (Exception e) {
                handleFailure(exchange, unwrap(e));
            } finally {
                int status = exchange.getResponseCode();
                metricsRegistry.incrementRequestCount(endpoint, status);
                metricsRegistry.recordLatency(endpoint, Duration.ofNanos(System.nanoTime() - start));
                exchange.close();
                MDC.clear();
            }
        }

        private void handleFailure(HttpExchange exchange, Throwable error) throws IOException {
            if (exchange.getResponseCode() != -1) {
                log.warn("Error after response started: path={}, error={}",
                        exchange.getRequestURI().getPath(), error.toString());
                return;
            }
            if (error instanceof ServiceUnavailableException) {
                metricsRegistry.incrementInjectedErrors();
                sendError(exchange, 503, ServiceUnavailableException.MESSAGE);
            } else if (error instanceof JsonProcessingException) {
                log.debug("Malformed request body: {}", error.getMessage());
                sendError(exchange, 400, "Malformed JSON body");
            } else if (error instanceof IllegalArgumentException) {
                sendError(exchange, 400, error.getMessage());
            } else if (error instanceof SessionNotFoundException) {
                sendError(exchange, 404, error.getMessage());
            } else if (error instanceof TimeoutException) {
                log.warn("Simulated work timed out: path={}", exchange.getRequestURI().getPath());
                sendError(exchange, 504, "Gateway Timeout");
            } else if (error instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                sendError(exchange, 503, "Server shutting down");
            } else {
                log.error("Error handling request: path={}", exchange.getRequestURI().getPath(), error);
                sendError(exchange, 500, "Internal server error: " + error.getMessage());
            }
        }
    }

    // ==================== GENERATIVE HANDLER ====================

    private class GenerativeHandler extends InstrumentedHandler {
        GenerativeHandler() {
            super("generative");
        }

        @Override
        void doHandle(HttpExchange exchange) throws Exception {
            Matcher matcher = GENERATIVE_PATH.matcher(exchange.getRequestURI().getPath());
            if (!matcher.matches()) {
                sendError(exchange, 404, "Not Found");
                return;
            }
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String model = matcher.group(1);
            String action = matcher.group(2);
            log.debug("Generative request: model={}, action={}", model, action);

            switch (action) {
                case "generateContent" -> handleGenerate(exchange);
                case "streamGenerateContent" -> handleStream(exchange);
                case "embedContent" -> handleEmbed(exchange, false);
                case "predict" -> handleEmbed(exchange, true);
                case "batchEmbedContents" -> handleBatchEmbed(exchange);
                case "countTokens" -> sendJson(exchange, 200,
                        GenerativeResponses.countTokens(simulator.countTokens()));
                default -> sendError(exchange, 404, "Unknown action: " + action);
            }
        }

        private void handleGenerate(HttpExchange exchange) throws IOException {
            JsonNode body = readRequiredJson(exchange);
            GenerateResult result = simulator.generate(GenerateRequest.fromJson(body));
            sendJson(exchange, 200, GenerativeResponses.fromResult(result));
        }

        private void handleStream(HttpExchange exchange) throws IOException {
            JsonNode body = readJson(exchange);
            String prompt = body != null ? GenerateRequest.fromJson(body).promptText() : "";
            TokenStream stream = simulator.streamGenerate(prompt);

            exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
            exchange.getResponseHeaders().set("Cache-Control", "no-cache");
            exchange.getResponseHeaders().set("X-Accel-Buffering", "no");
            exchange.sendResponseHeaders(200, 0);

            try (OutputStream os = exchange.getResponseBody()) {
                while (stream.hasNext()) {
                    StreamEvent event = stream.next();
                    String data;
                    if (event.isTerminator()) {
                        data = "[DONE]";
                    } else {
                        StreamChunk chunk = (StreamChunk) event;
                        data = objectMapper.writeValueAsString(GenerativeResponses.fromChunk(
                                chunk, InferenceSimulator.STREAM_PROMPT_TOKENS));
                    }
                    os.write(("data: " + data + "\n\n").getBytes(StandardCharsets.UTF_8));
                    os.flush();
                }
            } catch (IOException e) {
                log.debug("Stream client disconnected: {}", e.getMessage());
            }
        }

        private void handleEmbed(HttpExchange exchange, boolean predict) throws IOException {
            JsonNode body = readRequiredJson(exchange);
            JsonNode instances = body.get("instances");
            if (instances != null && instances.isArray()) {
                sendJson(exchange, 200, GenerativeResponses.predict(simulator.embed(instances.size())));
            } else if (predict) {
                sendError(exchange, 400, "Missing 'instances' array");
            } else {
                sendJson(exchange, 200, GenerativeResponses.embedContent(simulator.embedding(0)));
            }
        }

        private void handleBatchEmbed(HttpExchange exchange) throws IOException {
            JsonNode requests = null;
            try {
                JsonNode body = readJson(exchange);
                requests = body != null ? body.get("requests") : null;
            } catch (JsonProcessingException e) {
                log.debug("Unparseable batch embedding body, returning fallback vector");
            }

            List<double[]> vectors = requests != null && requests.isArray()
                    ? simulator.embed(requests.size())
                    : List.of(simulator.embedding(0));
            sendJson(exchange, 200, GenerativeResponses.batchEmbedContents(vectors));
        }
    }

    // ==================== AGENT HANDLER ====================

    private class AgentHandler extends InstrumentedHandler {
        AgentHandler() {
            super("agent");
        }

        @Override
        void doHandle(HttpExchange exchange) throws Exception {
            String path = exchange.getRequestURI().getPath();
            boolean chat = path.equals("/api/v1/agent/chat");
            boolean analyze = path.equals("/api/v1/agent/analyze");
            if (!chat && !analyze) {
                sendError(exchange, 404, "Not Found");
                return;
            }
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            AgentRequest request;
            try (InputStream is = exchange.getRequestBody()) {
                request = objectMapper.readValue(is, AgentRequest.class);
            }
            if (request == null || request.getQuery() == null) {
                sendError(exchange, 400, "Missing 'query' field");
                return;
            }

            if (chat) {
                ChatResult result = await(simulator.chat(request.getQuery()));
                Map<String, Object> response = new LinkedHashMap<>();
                response.put("response_text", result.responseText());
                response.put("processing_time", result.formattedProcessingTime());
                response.put("server_memory_usage_mb", result.memoryUsageMb());
                sendJson(exchange, 200, response);
            } else {
                AnalyzeResult result = await(simulator.analyze());
                Map<String, Object> response = new LinkedHashMap<>();
                response.put("status", result.status());
                response.put("mode", result.mode().name());
                sendJson(exchange, 200, response);
            }
        }
    }

    // ==================== HEALTH / ROOT / METRICS ====================

    private class HealthHandler extends InstrumentedHandler {
        HealthHandler() {
            super("health");
        }

        @Override
        void doHandle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "healthy");
            health.put("timestamp", System.currentTimeMillis() / 1000);
            health.put("config", chaosView(chaos.snapshot()));
            sendJson(exchange, 200, health);
        }
    }

    private class RootHandler extends InstrumentedHandler {
        RootHandler() {
            super("root");
        }

        @Override
        void doHandle(HttpExchange exchange) throws IOException {
            if (!exchange.getRequestURI().getPath().equals("/")) {
                sendError(exchange, 404, "Not Found");
                return;
            }
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            SimulationState state = chaos.snapshot();
            Map<String, Object> config = new LinkedHashMap<>();
            config.put("min_latency", state.latencyMin());
            config.put("max_latency", state.latencyMax());
            config.put("token_delay", simulator.getTokenDelay().toMillis() / 1000.0);
            config.put("token_count", simulator.getTokenCount());
            config.put("embedding_dimension", simulator.getEmbeddingDimension());

            Map<String, Object> info = new LinkedHashMap<>();
            info.put("service", "Mock LLM Server");
            info.put("version", "1.0.0");
            info.put("config", config);
            sendJson(exchange, 200, info);
        }
    }

    private class MetricsHandler extends InstrumentedHandler {
        MetricsHandler() {
            super("metrics");
        }

        @Override
        void doHandle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler extends InstrumentedHandler {
        AdminHandler() {
            super("admin");
        }

        @Override
        void doHandle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            if (path.equals("/admin/chaos") && "GET".equals(method)) {
                sendJson(exchange, 200, chaosView(chaos.snapshot()));
                return;
            }
            if (!"POST".equals(method)) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            switch (path) {
                case "/admin/chaos/latency_spike" -> {
                    chaos.activateLatencySpike();
                    sendStatus(exchange, "LATENCY SPIKE ACTIVATED");
                }
                case "/admin/chaos/memory_leak" -> {
                    chaos.activateMemoryLeak();
                    sendStatus(exchange, "MEMORY LEAK ACTIVATED");
                }
                case "/admin/chaos/cpu_spike" -> {
                    chaos.activateCpuStress();
                    sendStatus(exchange, "CPU STRESS ACTIVATED");
                }
                case "/admin/chaos/error_rate" -> handleErrorRate(exchange);
                case "/admin/reset" -> {
                    chaos.reset();
                    sendStatus(exchange, "SYSTEM NORMALIZED");
                }
                default -> sendError(exchange, 404, "Not Found");
            }
        }

        private void handleErrorRate(HttpExchange exchange) throws IOException {
            JsonNode body = readRequiredJson(exchange);
            JsonNode rate = body.get("error_rate");
            if (rate == null || !rate.isNumber()) {
                sendError(exchange, 400, "Missing numeric 'error_rate' field");
                return;
            }
            chaos.setErrorRate(rate.asDouble());

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("status", "ERROR RATE SET");
            response.put("error_rate", chaos.snapshot().errorRate());
            sendJson(exchange, 200, response);
        }

        private void sendStatus(HttpExchange exchange, String status) throws IOException {
            sendJson(exchange, 200, Map.of("status", status));
        }
    }

    // ==================== SESSION HANDLERS ====================

    private class AgentsHandler extends InstrumentedHandler {
        AgentsHandler() {
            super("agents");
        }

        @Override
        void doHandle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            sendJson(exchange, 200, sessionStore.listAgents());
        }
    }

    private class SessionsHandler extends InstrumentedHandler {
        SessionsHandler() {
            super("sessions");
        }

        @Override
        void doHandle(HttpExchange exchange) throws Exception {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            if (path.equals("/sessions") || path.equals("/sessions/")) {
                if (!"POST".equals(method)) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }
                SessionRequests.CreateSession request = readBody(exchange, SessionRequests.CreateSession.class);
                String agentId = request != null ? request.getAgentId() : null;
                sendJson(exchange, 200, sessionStore.createSession(agentId));
                return;
            }

            Matcher matcher = SESSION_EVENTS_PATH.matcher(path);
            if (!matcher.matches()) {
                sendError(exchange, 404, "Not Found");
                return;
            }
            String sessionId = matcher.group(1);

            if ("POST".equals(method)) {
                SessionRequests.CreateEvent request = readBody(exchange, SessionRequests.CreateEvent.class);
                if (request == null || request.getKind() == null || request.getSource() == null) {
                    sendError(exchange, 400, "Fields 'kind' and 'source' are required");
                    return;
                }
                SessionEvent event = sessionStore.appendEvent(
                        sessionId, request.getKind(), request.getSource(), request.getMessage());
                sendJson(exchange, 200, event);
            } else if ("GET".equals(method)) {
                Map<String, String> query = parseQuery(exchange.getRequestURI().getRawQuery());
                long minOffset = parseLong(query.get("min_offset"), 0);
                double waitSeconds = parseDouble(query.get("wait_for_data"), 0);
                Duration wait = Duration.ofMillis(Math.round(waitSeconds * 1000));
                if (wait.compareTo(maxWaitForData) > 0) {
                    wait = maxWaitForData;
                }
                List<SessionEvent> events = sessionStore.awaitEvents(sessionId, minOffset, wait);
                sendJson(exchange, 200, events);
            } else {
                sendError(exchange, 405, "Method Not Allowed");
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private <T> T await(CompletableFuture<T> future) throws Exception {
        try {
            return future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static Map<String, Object> chaosView(SimulationState state) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("latency_min", state.latencyMin());
        view.put("latency_max", state.latencyMax());
        view.put("error_rate", state.errorRate());
        view.put("memory_leak_active", state.memoryLeakActive());
        view.put("cpu_stress_active", state.cpuStressActive());
        return view;
    }

    /**
     * Reads the body as a JSON tree, null when the body is empty.
     */
    private JsonNode readJson(HttpExchange exchange) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            byte[] bytes = is.readAllBytes();
            if (bytes.length == 0) {
                return null;
            }
            JsonNode node = objectMapper.readTree(bytes);
            return node == null || node.isMissingNode() ? null : node;
        }
    }

    private JsonNode readRequiredJson(HttpExchange exchange) throws IOException {
        JsonNode body = readJson(exchange);
        if (body == null || !body.isObject()) {
            throw new IllegalArgumentException("Request body must be a JSON object");
        }
        return body;
    }

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        JsonNode body = readJson(exchange);
        return body != null ? objectMapper.treeToValue(body, type) : null;
    }

    private static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            params.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer: " + value, e);
        }
    }

    private static double parseDouble(String value, double defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number: " + value, e);
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "Unknown error");
        sendJson(exchange, statusCode, error);
    }

    /**
     * Thread factory for HTTP worker threads.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "http-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
