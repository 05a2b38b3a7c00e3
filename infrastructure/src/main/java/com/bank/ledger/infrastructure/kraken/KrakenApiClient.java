package com.bank.ledger.infrastructure.kraken;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Minimal Kraken REST client.
 * Private calls are signed and retried with backoff while Kraken reports a rate limit;
 * once retries run out the last response is returned for the caller to inspect.
 * Public calls go through a circuit breaker.
 */
public class KrakenApiClient {

    private static final Logger log = LoggerFactory.getLogger(KrakenApiClient.class);

    private static final String PRIVATE_PATH = "/0/private/";
    private static final String PUBLIC_PATH = "/0/public/";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final String apiSecret;
    private final Retry privateRetry;
    private final CircuitBreaker publicCircuitBreaker;
    private final AtomicLong lastNonce = new AtomicLong();

    public KrakenApiClient(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl,
                           String apiKey, String apiSecret, Retry privateRetry,
                           CircuitBreaker publicCircuitBreaker) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.privateRetry = privateRetry;
        this.publicCircuitBreaker = publicCircuitBreaker;
    }

    /**
     * Kraken signals rate limiting in the error array ("EAPI:Rate limit exceeded")
     */
    public static boolean isRateLimitError(JsonNode response) {
        if (response == null) {
            return false;
        }
        String message = String.join(" ", errors(response)).toLowerCase();
        return message.contains("rate limit") || message.contains("exceeded");
    }

    /**
     * Entries of the response error array, empty when the call succeeded
     */
    public static List<String> errors(JsonNode response) {
        List<String> errors = new ArrayList<>();
        JsonNode error = response.path("error");
        if (error.isArray()) {
            error.forEach(e -> errors.add(e.asText()));
        } else if (!error.isMissingNode() && !error.isNull() && !error.asText().isEmpty()) {
            errors.add(error.asText());
        }
        return errors;
    }

    public boolean hasCredentials() {
        return apiKey != null && !apiKey.isBlank() && apiSecret != null && !apiSecret.isBlank();
    }

    public JsonNode queryPrivate(String method, Map<String, String> params) {
        if (!hasCredentials()) {
            throw new IllegalStateException("Set KRAKEN_KEY and KRAKEN_SECRET environment variables.");
        }
        try {
            return privateRetry.executeSupplier(() -> postSigned(method, params));
        } catch (RestClientException e) {
            throw new KrakenApiException("Kraken " + method + " request failed: " + e.getMessage(), e);
        }
    }

    public JsonNode queryPublic(String method, Map<String, String> params) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(baseUrl + PUBLIC_PATH + method);
        params.forEach((name, value) -> uri.queryParam(name, value));
        String url = uri.build().toUriString();
        try {
            return publicCircuitBreaker.executeSupplier(() ->
                    parse(restTemplate.getForEntity(url, String.class).getBody()));
        } catch (RestClientException e) {
            throw new KrakenApiException("Kraken " + method + " request failed: " + e.getMessage(), e);
        }
    }

    private JsonNode postSigned(String method, Map<String, String> params) {
        String path = PRIVATE_PATH + method;
        String nonce = String.valueOf(nextNonce());

        Map<String, String> form = new LinkedHashMap<>();
        form.put("nonce", nonce);
        form.putAll(params);
        String postData = form.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.set("API-Key", apiKey);
        headers.set("API-Sign", KrakenSignature.sign(path, nonce, postData, apiSecret));

        ResponseEntity<String> response = restTemplate.exchange(
                baseUrl + path, HttpMethod.POST, new HttpEntity<>(postData, headers), String.class);
        JsonNode body = parse(response.getBody());
        if (isRateLimitError(body)) {
            log.warn("Kraken {} rate limited: {}", method, errors(body));
        }
        return body;
    }

    /**
     * Strictly increasing, microsecond based
     */
    private long nextNonce() {
        long candidate = System.currentTimeMillis() * 1000;
        return lastNonce.updateAndGet(last -> Math.max(last + 1, candidate));
    }

    private JsonNode parse(String body) {
        try {
            return objectMapper.readTree(body == null ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new KrakenApiException("Kraken returned malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
