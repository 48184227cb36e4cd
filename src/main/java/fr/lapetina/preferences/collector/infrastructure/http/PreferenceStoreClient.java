package fr.lapetina.preferences.collector.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.preferences.collector.domain.model.ComparisonSubmission;
import fr.lapetina.preferences.collector.domain.model.ErrorType;
import fr.lapetina.preferences.collector.domain.model.QueuedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the remote preference store.
 *
 * Uses java.net.http.HttpClient with one blocking POST per record.
 * Includes a circuit breaker so a flush against a dead store fails fast
 * instead of waiting out a timeout per record.
 */
public class PreferenceStoreClient implements RemoteClient, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PreferenceStoreClient.class);

    static final String PREFERENCES_PATH = "api/preferences";
    static final String HEALTH_PATH = "api/health";
    static final String API_KEY_HEADER = "X-API-Key";
    static final String ANNOTATOR_PREFIX = "platform_";
    static final int DEFAULT_DIMENSION_SCORE = 3;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final URI baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;

    public PreferenceStoreClient(
            URI baseUrl,
            String apiKey,
            Duration connectTimeout,
            Duration requestTimeout,
            int failureThreshold,
            Duration circuitBreakerRecoveryTimeout
    ) {
        String base = baseUrl.toString();
        this.baseUrl = URI.create(base.endsWith("/") ? base : base + "/");
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
        this.circuitBreaker = new CircuitBreaker(
                this.baseUrl.toString(), failureThreshold, circuitBreakerRecoveryTimeout);

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public PreferenceStoreClient(URI baseUrl, String apiKey) {
        this(baseUrl, apiKey, Duration.ofSeconds(10), Duration.ofSeconds(10), 5, Duration.ofSeconds(30));
    }

    /**
     * Posts one record to the store. Never throws.
     */
    @Override
    public SendResult send(QueuedRecord record) {
        if (!circuitBreaker.tryAcquire()) {
            log.warn("Send blocked by circuit breaker: recordId={}, domain={}",
                    record.recordId(), record.domain());
            return SendResult.failure(ErrorType.CIRCUIT_OPEN,
                    "Circuit breaker is open for store: " + baseUrl);
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(buildPayload(record));
        } catch (JsonProcessingException e) {
            circuitBreaker.releaseProbe();
            log.error("Failed to encode record: recordId={}", record.recordId(), e);
            return SendResult.failure(ErrorType.SERIALIZATION_ERROR,
                    "Failed to encode record: " + e.getOriginalMessage());
        }

        HttpRequest request = newRequest(PREFERENCES_PATH)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        Instant startTime = Instant.now();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return handleResponse(record, response, Duration.between(startTime, Instant.now()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            circuitBreaker.releaseProbe();
            log.warn("Send interrupted: recordId={}", record.recordId());
            return SendResult.failure(ErrorType.INTERNAL_ERROR, "Interrupted while sending");
        } catch (IOException e) {
            circuitBreaker.onFailure();
            ErrorType errorType = classifyException(e);
            log.error("Send failed: recordId={}, domain={}, errorType={}, error={}",
                    record.recordId(), record.domain(), errorType, e.toString());
            return SendResult.failure(errorType, e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }

    private SendResult handleResponse(QueuedRecord record, HttpResponse<String> response, Duration latency) {
        int statusCode = response.statusCode();

        if (statusCode >= 200 && statusCode < 300) {
            circuitBreaker.onSuccess();
            String hash = readField(response.body(), "hash");
            log.debug("Record stored: recordId={}, domain={}, status={}, hash={}, latencyMs={}",
                    record.recordId(), record.domain(), statusCode, hash, latency.toMillis());
            return SendResult.success(hash);
        }

        ErrorType errorType;
        if (statusCode >= 400 && statusCode < 500) {
            // The store answered; a rejected record says nothing about its health
            circuitBreaker.onSuccess();
            errorType = ErrorType.CLIENT_ERROR;
        } else {
            circuitBreaker.onFailure();
            errorType = ErrorType.STORE_ERROR;
        }

        String message = readField(response.body(), "detail");
        if (message == null) {
            message = readField(response.body(), "error");
        }
        if (message == null) {
            message = "HTTP " + statusCode;
        }

        log.warn("Store rejected record: recordId={}, domain={}, status={}, errorType={}, error={}, latencyMs={}",
                record.recordId(), record.domain(), statusCode, errorType, message, latency.toMillis());
        return SendResult.failure(errorType, message);
    }

    Map<String, Object> buildPayload(QueuedRecord record) throws JsonProcessingException {
        ComparisonSubmission submission = record.submission();

        Map<String, Object> notes = new LinkedHashMap<>();
        notes.put("session", submission.sessionId());
        notes.put("confidence", submission.confidence());
        notes.put("response_time_a", submission.latencyA());
        notes.put("response_time_b", submission.latencyB());
        notes.put("accepted_at", record.acceptedAt());
        if (!submission.context().isEmpty()) {
            notes.put("context", submission.context());
        }

        Map<String, Integer> dimensionScores = new LinkedHashMap<>();
        dimensionScores.put("accuracy", DEFAULT_DIMENSION_SCORE);
        dimensionScores.put("safety", DEFAULT_DIMENSION_SCORE);
        dimensionScores.put("actionability", DEFAULT_DIMENSION_SCORE);
        dimensionScores.put("clarity", DEFAULT_DIMENSION_SCORE);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("domain", record.domain());
        body.put("category", record.category());
        body.put("prompt", submission.prompt());
        body.put("response_a", submission.responseA());
        body.put("response_b", submission.responseB());
        body.put("preference", submission.chosen() != null ? submission.chosen().name() : null);
        body.put("annotator_id", ANNOTATOR_PREFIX + submission.producerId());
        body.put("dimension_scores", dimensionScores);
        body.put("response_a_model", submission.responseAModel());
        body.put("response_b_model", submission.responseBModel());
        body.put("notes", objectMapper.writeValueAsString(notes));
        return body;
    }

    private HttpRequest.Builder newRequest(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(baseUrl.resolve(path))
                .timeout(requestTimeout);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header(API_KEY_HEADER, apiKey);
        }
        return builder;
    }

    private String readField(String body, String field) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body).get(field);
            return node != null && !node.isNull() ? node.asText() : null;
        } catch (JsonProcessingException e) {
            log.debug("Store response is not JSON: field={}, error={}", field, e.getOriginalMessage());
            return null;
        }
    }

    private ErrorType classifyException(IOException e) {
        // A connect timeout means the store is unreachable, not slow
        if (e instanceof HttpTimeoutException && !(e instanceof HttpConnectTimeoutException)) {
            return ErrorType.TIMEOUT;
        }
        return ErrorType.STORE_ERROR;
    }

    /**
     * Probes the store's health endpoint.
     *
     * @return true if the store answered 200
     */
    public boolean healthCheck() {
        HttpRequest request = newRequest(HEALTH_PATH).GET().build();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            boolean healthy = response.statusCode() == 200;
            if (healthy) {
                log.debug("Store health check passed: baseUrl={}", baseUrl);
            } else {
                log.warn("Store health check failed: baseUrl={}, status={}", baseUrl, response.statusCode());
            }
            return healthy;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (IOException e) {
            log.warn("Store health check error: baseUrl={}, error={}", baseUrl, e.toString());
            return false;
        }
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    @Override
    public void close() {
        // HttpClient has no close() before Java 21
    }
}
