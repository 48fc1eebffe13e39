package fr.lapetina.mockllm.infrastructure.http;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Blocking HTTP client used by virtual users.
 *
 * The transport and the target base URL are injected, so the load generator can be pointed
 * at any deployment (or a stub in tests) without touching global networking state.
 */
public class LoadHttpClient {

    private static final Logger log = LoggerFactory.getLogger(LoadHttpClient.class);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;

    public LoadHttpClient(HttpClient httpClient, String baseUrl, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.baseUrl = normalize(baseUrl);
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "Request timeout is required");
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        log.info("LoadHttpClient initialised: baseUrl={}, requestTimeoutMs={}", this.baseUrl, requestTimeout.toMillis());
    }

    /**
     * Creates a client with its own HTTP/1.1 transport.
     */
    public static LoadHttpClient create(String baseUrl, Duration connectTimeout, Duration requestTimeout) {
        HttpClient transport = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        return new LoadHttpClient(transport, baseUrl, requestTimeout);
    }

    /**
     * Status, body and wall-clock time of one exchange.
     */
    public record Response(int statusCode, String body, Duration elapsed) {

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }

        public long bodyLength() {
            return body != null ? body.getBytes(StandardCharsets.UTF_8).length : 0;
        }
    }

    public Response get(String path) throws IOException, InterruptedException {
        return get(path, requestTimeout);
    }

    /**
     * GET with an explicit timeout, for long polls that outlast the default one.
     */
    public Response get(String path, Duration timeout) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(resolve(path))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(request);
    }

    public Response postJson(String path, Object body) throws IOException, InterruptedException {
        String json = objectMapper.writeValueAsString(body);
        HttpRequest request = HttpRequest.newBuilder(resolve(path))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        return send(request);
    }

    protected Response send(HttpRequest request) throws IOException, InterruptedException {
        long start = System.nanoTime();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        log.debug("{} {} -> status={}, latencyMs={}",
                request.method(), request.uri(), response.statusCode(), elapsed.toMillis());
        return new Response(response.statusCode(), response.body(), elapsed);
    }

    public JsonNode readTree(String body) throws IOException {
        return objectMapper.readTree(body);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    private URI resolve(String path) {
        return URI.create(baseUrl + (path.startsWith("/") ? path : "/" + path));
    }

    private static String normalize(String baseUrl) {
        Objects.requireNonNull(baseUrl, "Base URL is required");
        String trimmed = baseUrl.trim();
        if (!trimmed.startsWith("http://") && !trimmed.startsWith("https://")) {
            throw new IllegalArgumentException("Base URL must start with http:// or https://, got " + baseUrl);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
