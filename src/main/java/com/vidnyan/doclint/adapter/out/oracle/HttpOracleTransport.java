package com.vidnyan.doclint.adapter.out.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.doclint.application.port.out.OracleTransport;
import com.vidnyan.doclint.config.OracleProperties;
import com.vidnyan.doclint.domain.oracle.OracleFailureClassifier;
import com.vidnyan.doclint.domain.oracle.OracleTransportException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;

/**
 * Oracle transport for OpenAI-compatible chat-completions endpoints.
 * Requests JSON-object output and turns every non-2xx answer into an
 * {@link OracleTransportException} carrying the status and the vendor error type.
 */
@Slf4j
public class HttpOracleTransport implements OracleTransport {

    private static final String COMPLETIONS_PATH = "/chat/completions";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final OracleProperties properties;

    public HttpOracleTransport(ObjectMapper objectMapper, OracleProperties properties) {
        this(HttpClient.newBuilder()
                        .connectTimeout(properties.getConnectTimeout())
                        .build(),
                objectMapper, properties);
    }

    HttpOracleTransport(HttpClient httpClient, ObjectMapper objectMapper, OracleProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public String call(String prompt) {
        String apiKey = properties.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new OracleTransportException(401, "missing_api_key", "No API key configured (doclint.oracle.api-key)");
        }
        log.debug("Oracle request - Model: {}, prompt: {} chars", properties.getModel(), prompt.length());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(trimTrailingSlash(properties.getBaseUrl()) + COMPLETIONS_PATH))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(prompt)))
                .timeout(properties.getRequestTimeout())
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new OracleTransportException("Oracle request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleTransportException("Oracle request interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.error("Oracle API error: {} - {}", status, response.body());
            throw toException(status, response.body());
        }
        return content(response.body());
    }

    @Override
    public String model() {
        return properties.getModel();
    }

    private String requestBody(String prompt) {
        Map<String, Object> body = Map.of(
                "model", properties.getModel(),
                "temperature", properties.getTemperature(),
                "response_format", Map.of("type", "json_object"),
                "messages", List.of(
                        Map.of("role", "system", "content", properties.getSystemPrompt()),
                        Map.of("role", "user", "content", prompt)));
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new OracleTransportException("Cannot serialize oracle request: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Message content of the first choice; empty when the response carries none,
     * which the judgment parser reports as a malformed response.
     */
    private String content(String body) {
        try {
            JsonNode content = objectMapper.readTree(body).path("choices").path(0).path("message").path("content");
            if (!content.isTextual()) {
                log.warn("Oracle response has no message content");
                return "";
            }
            log.debug("Oracle response received: {} chars", content.asText().length());
            return content.asText();
        } catch (JsonProcessingException e) {
            log.warn("Oracle response is not JSON: {}", e.getOriginalMessage());
            return "";
        }
    }

    private OracleTransportException toException(int status, String body) {
        String errorType = null;
        String message = null;
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            String code = error.path("code").asText(null);
            errorType = OracleFailureClassifier.INSUFFICIENT_QUOTA.equals(code)
                    ? code
                    : error.path("type").asText(null);
            message = error.path("message").asText(null);
        } catch (JsonProcessingException e) {
            log.debug("Oracle error body is not JSON: {}", e.getOriginalMessage());
        }
        String detail = message != null && !message.isBlank() ? message : "HTTP " + status;
        return new OracleTransportException(status, errorType, status + " " + detail);
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
