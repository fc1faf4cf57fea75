package com.williamcallahan.keycoordinator.service.classify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openai.core.http.Headers;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.williamcallahan.keycoordinator.domain.failure.ProviderFailure;
import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.DateTimeException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Converts SDK and HTTP client exceptions into a provider-neutral {@link ProviderFailure}.
 *
 * <p>This is the only place that knows the shape of provider errors: OpenAI SDK exceptions,
 * Spring WebClient exceptions with JSON error bodies, JDK timeouts and explicit
 * {@link ProviderCallException}s.</p>
 */
public class ProviderErrorNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ProviderErrorNormalizer.class);

    static final String CODE_QUEUE_EXCEEDED = "queue_exceeded";
    static final String CODE_TOO_MANY_REQUESTS = "too_many_requests_error";
    static final String CODE_RATE_LIMIT_EXCEEDED = "rate_limit_exceeded";
    static final String CODE_INSUFFICIENT_QUOTA = "insufficient_quota";
    static final String CODE_QUOTA_EXCEEDED = "quota_exceeded";
    static final String CODE_RESOURCE_EXHAUSTED = "RESOURCE_EXHAUSTED";
    static final String CODE_BILLING_LIMIT = "billing_hard_limit_reached";

    private static final int MAX_CAUSE_DEPTH = 10;

    private final ObjectMapper objectMapper;
    private final RateLimitHeaderParser headerParser;

    public ProviderErrorNormalizer(ObjectMapper objectMapper, RateLimitHeaderParser headerParser) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.headerParser = Objects.requireNonNull(headerParser, "headerParser");
    }

    /**
     * Normalizes a failure thrown by a unit of work.
     *
     * <p>Wrapper exceptions are unwrapped until a recognized provider or transport error is found;
     * anything unrecognized becomes a status-less failure whose message is still scanned for known
     * provider codes.</p>
     *
     * @param failure exception thrown by the provider call
     * @return normalized failure, never null
     */
    public ProviderFailure normalize(Throwable failure) {
        Objects.requireNonNull(failure, "failure");
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            Optional<ProviderFailure> recognized = normalizeRecognized(current);
            if (recognized.isPresent()) {
                return recognized.get();
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        String message = describe(failure);
        return ProviderFailure.ofStatus(ProviderFailure.NO_STATUS, sniffProviderCode(message), message);
    }

    private Optional<ProviderFailure> normalizeRecognized(Throwable candidate) {
        if (candidate instanceof ProviderCallException callException) {
            String code = callException.providerCode() != null
                    ? callException.providerCode()
                    : sniffProviderCode(callException.getMessage());
            return Optional.of(new ProviderFailure(
                    callException.httpStatus(), code, describe(callException), false, callException.retryAfter()));
        }
        if (candidate instanceof OpenAIServiceException serviceException) {
            String message = describe(serviceException);
            ProviderFailure normalized =
                    ProviderFailure.ofStatus(serviceException.statusCode(), sniffProviderCode(message), message);
            return Optional.of(withHint(normalized, name -> firstHeaderValue(serviceException.headers(), name)));
        }
        if (candidate instanceof WebClientResponseException responseException) {
            String message = describe(responseException);
            String code = extractBodyCode(responseException.getResponseBodyAsString())
                    .orElseGet(() -> sniffProviderCode(message));
            ProviderFailure normalized =
                    ProviderFailure.ofStatus(responseException.getStatusCode().value(), code, message);
            HttpHeaders headers = responseException.getHeaders();
            return Optional.of(withHint(normalized, headers::getFirst));
        }
        if (candidate instanceof OpenAIIoException
                || candidate instanceof WebClientRequestException
                || candidate instanceof TimeoutException
                || candidate instanceof HttpTimeoutException
                || candidate instanceof IOException) {
            return Optional.of(ProviderFailure.timeout(describe(candidate)));
        }
        return Optional.empty();
    }

    private ProviderFailure withHint(ProviderFailure normalized, UnaryOperator<String> headerLookup) {
        try {
            return headerParser.parseRetryHint(headerLookup)
                    .map(normalized::withRetryAfter)
                    .orElse(normalized);
        } catch (IllegalArgumentException | DateTimeException | ArithmeticException invalidHeader) {
            log.debug("Ignoring unparseable rate limit header: {}", invalidHeader.getMessage());
            return normalized;
        }
    }

    /**
     * Reads the provider error code from a JSON error body.
     *
     * <p>Checks {@code error.code}, {@code error.status}, {@code error.type}, {@code code},
     * {@code type} and {@code detail.error} in that order.</p>
     */
    Optional<String> extractBodyCode(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException notJson) {
            return Optional.ofNullable(sniffProviderCode(body));
        }
        if (root == null || !root.isObject()) {
            return Optional.ofNullable(sniffProviderCode(body));
        }
        List<JsonNode> candidates = List.of(
                root.path("error").path("code"),
                root.path("error").path("status"),
                root.path("error").path("type"),
                root.path("code"),
                root.path("type"),
                root.path("detail").path("error"));
        for (JsonNode candidate : candidates) {
            if (candidate.isTextual() && !candidate.asText().isBlank()) {
                return Optional.of(candidate.asText().trim());
            }
        }
        return Optional.ofNullable(sniffProviderCode(body));
    }

    /**
     * Finds a known provider error code inside a free-form message.
     *
     * @return the canonical code, or null when none is recognized
     */
    static String sniffProviderCode(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains(CODE_QUEUE_EXCEEDED)
                || normalized.contains("queue exceeded")
                || normalized.contains("high traffic")) {
            return CODE_QUEUE_EXCEEDED;
        }
        if (normalized.contains(CODE_INSUFFICIENT_QUOTA)) {
            return CODE_INSUFFICIENT_QUOTA;
        }
        if (normalized.contains(CODE_BILLING_LIMIT)) {
            return CODE_BILLING_LIMIT;
        }
        if (normalized.contains("resource_exhausted")) {
            return CODE_RESOURCE_EXHAUSTED;
        }
        if (normalized.contains(CODE_QUOTA_EXCEEDED) || normalized.contains("exceeded your current quota")) {
            return CODE_QUOTA_EXCEEDED;
        }
        if (normalized.contains(CODE_TOO_MANY_REQUESTS)) {
            return CODE_TOO_MANY_REQUESTS;
        }
        if (normalized.contains(CODE_RATE_LIMIT_EXCEEDED)) {
            return CODE_RATE_LIMIT_EXCEEDED;
        }
        return null;
    }

    private static String firstHeaderValue(Headers headers, String name) {
        if (headers == null) {
            return null;
        }
        for (String headerName : headers.names()) {
            if (headerName != null && headerName.equalsIgnoreCase(name)) {
                List<String> values = headers.values(headerName);
                return values == null || values.isEmpty() ? null : values.get(0);
            }
        }
        return null;
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        String typeName = failure.getClass().getSimpleName();
        return message == null || message.isBlank() ? typeName : typeName + ": " + message;
    }
}
