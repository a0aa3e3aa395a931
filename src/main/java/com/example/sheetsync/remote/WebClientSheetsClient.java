package com.example.sheetsync.remote;

import com.example.sheetsync.config.RemoteSettings;
import com.example.sheetsync.error.RemoteStoreException;
import com.example.sheetsync.model.Operation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calls the Apps Script endpoint. Everything travels as query parameters of a single
 * GET, as the script only reads {@code e.parameter}; objects are sent as JSON strings.
 */
public class WebClientSheetsClient implements SheetsClient {

    private static final Logger logger = LoggerFactory.getLogger(WebClientSheetsClient.class);

    private final WebClient webClient;
    private final RemoteSettings settings;
    private final ObjectMapper objectMapper;

    public WebClientSheetsClient(WebClient webClient, RemoteSettings settings, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.settings = settings;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<RemoteResponse> execute(Operation operation) {
        Map<String, String> params = queryParams(operation);
        logger.debug("Remote {} {} ({} params)", operation.getKind().wireName(), operation.getTable(), params.size());
        return webClient.get()
                .uri(settings.getBaseUrl(), builder -> buildUri(builder, params))
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> parse(response.statusCode().value(), response.headers().asHttpHeaders(), body)))
                .timeout(settings.getTimeout());
    }

    Map<String, String> queryParams(Operation operation) {
        Map<String, String> params = new LinkedHashMap<>();
        if (operation.getData() != null) {
            operation.getData().forEach((field, value) -> {
                if (value != null) params.put(field, stringify(value));
            });
        }
        if (settings.getToken() != null && !settings.getToken().isBlank()) {
            params.put("token", settings.getToken());
        }
        params.put("action", "crud");
        params.put("table", operation.getTable());
        params.put("operation", operation.getKind().wireName());
        if (operation.getId() != null) params.put("id", operation.getId());
        if (operation.getFilters() != null && !operation.getFilters().isEmpty()) {
            params.put("filters", stringify(operation.getFilters()));
        }
        if (operation.getPage() != null) {
            params.put("page", String.valueOf(operation.getPage().getPage()));
            params.put("limit", String.valueOf(operation.getPage().getLimit()));
        }
        return params;
    }

    private URI buildUri(UriBuilder builder, Map<String, String> params) {
        // values go in as template variables so JSON braces are encoded instead of expanded
        Map<String, Object> variables = new HashMap<>();
        int i = 0;
        for (Map.Entry<String, String> param : params.entrySet()) {
            String var = "p" + i++;
            builder.queryParam(param.getKey(), "{" + var + "}");
            variables.put(var, param.getValue());
        }
        return builder.build(variables);
    }

    RemoteResponse parse(int status, HttpHeaders headers, String body) {
        JsonNode json = readJson(body, status);
        if (status >= 400) {
            String message = json != null && json.hasNonNull("message")
                    ? json.get("message").asText()
                    : "HTTP " + status;
            Long retryAfter = parseRetryAfter(headers.getFirst(HttpHeaders.RETRY_AFTER));
            throw new RemoteStoreException(status, message, retryAfter);
        }
        if (json == null) {
            throw new DecodingException("Invalid JSON response from server (HTTP " + status + ")");
        }
        if (!json.path("ok").asBoolean(false)) {
            throw RemoteStoreException.rejected(json.path("message").asText("API request failed"));
        }
        JsonNode data = json.has("data") ? json.get("data") : json;
        String message = json.hasNonNull("message") ? json.get("message").asText() : null;
        return new RemoteResponse(true, data, message, json.get("pagination"));
    }

    private JsonNode readJson(String body, int status) {
        if (body == null || body.isBlank()) return null;
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            if (status >= 400) return null;
            throw new DecodingException("Invalid JSON response from server", e);
        }
    }

    private String stringify(Object value) {
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable: " + value, e);
        }
    }

    private static Long parseRetryAfter(String header) {
        if (header == null || header.isBlank()) return null;
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            logger.debug("Ignoring non-numeric Retry-After header: {}", header);
            return null;
        }
    }
}
