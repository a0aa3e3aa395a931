package com.example.sheetsync.remote;

import com.example.sheetsync.config.RemoteSettings;
import com.example.sheetsync.error.RemoteStoreException;
import com.example.sheetsync.model.Operation;
import com.example.sheetsync.model.Pagination;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class WebClientSheetsClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private WebClientSheetsClient client(HttpStatus status, String body, HttpHeaders extraHeaders) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    ClientResponse.Builder response = ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .headers(h -> h.addAll(extraHeaders))
                            .body(body);
                    return Mono.just(response.build());
                })
                .build();
        RemoteSettings settings = RemoteSettings.builder()
                .baseUrl("http://sheets.test/exec")
                .token("secret")
                .timeout(Duration.ofSeconds(2))
                .build();
        return new WebClientSheetsClient(webClient, settings, objectMapper);
    }

    @Test
    void testExecute_ListSendsSingleGetWithQueryParams() {
        // Given
        WebClientSheetsClient client = client(HttpStatus.OK, "{\"ok\":true,\"data\":[{\"id\":\"P1\"}]}", new HttpHeaders());
        Operation operation = Operation.list("Proyectos", Map.of("estado", "Activo"), new Pagination(2, 25));

        // When / Then
        StepVerifier.create(client.execute(operation))
                .assertNext(response -> {
                    assertTrue(response.isOk());
                    assertEquals("P1", response.getData().get(0).get("id").asText());
                })
                .verifyComplete();

        Map<String, String> params = UriComponentsBuilder.fromUri(lastRequest.get().url()).build(true)
                .getQueryParams().toSingleValueMap();
        assertEquals("GET", lastRequest.get().method().name());
        assertEquals("crud", params.get("action"));
        assertEquals("Proyectos", params.get("table"));
        assertEquals("list", params.get("operation"));
        assertEquals("secret", params.get("token"));
        assertEquals("2", params.get("page"));
        assertEquals("25", params.get("limit"));
        assertTrue(params.containsKey("filters"));
    }

    @Test
    void testQueryParams_FlattensRecordFields() {
        WebClientSheetsClient client = client(HttpStatus.OK, "{}", new HttpHeaders());

        Map<String, String> params = client.queryParams(
                Operation.update("Materiales", "M1", Map.of("stock_actual", 5, "tags", Map.of("a", 1))));

        assertEquals("5", params.get("stock_actual"));
        assertEquals("{\"a\":1}", params.get("tags"));
        assertEquals("M1", params.get("id"));
        assertEquals("update", params.get("operation"));
    }

    @Test
    void testExecute_OkFalseIsRejection() {
        WebClientSheetsClient client = client(HttpStatus.OK, "{\"ok\":false,\"message\":\"Field nombre is required\"}", new HttpHeaders());

        StepVerifier.create(client.execute(Operation.create("Proyectos", Map.of())))
                .expectErrorSatisfies(e -> {
                    assertTrue(e instanceof RemoteStoreException);
                    assertTrue(((RemoteStoreException) e).isRejectedByStore());
                    assertEquals("Field nombre is required", e.getMessage());
                })
                .verify();
    }

    @Test
    void testExecute_HttpErrorCarriesStatusAndRetryAfter() {
        // Given
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.RETRY_AFTER, "4");
        WebClientSheetsClient client = client(HttpStatus.TOO_MANY_REQUESTS, "{\"message\":\"slow down\"}", headers);

        // When / Then
        StepVerifier.create(client.execute(Operation.get("Proyectos", "P1")))
                .expectErrorSatisfies(e -> {
                    RemoteStoreException remote = (RemoteStoreException) e;
                    assertEquals(429, remote.getStatus());
                    assertEquals(4L, remote.getRetryAfterSeconds());
                    assertEquals("slow down", remote.getMessage());
                })
                .verify();
    }

    @Test
    void testExecute_MalformedJsonIsDecodingError() {
        WebClientSheetsClient client = client(HttpStatus.OK, "<html>oops</html>", new HttpHeaders());

        StepVerifier.create(client.execute(Operation.get("Proyectos", "P1")))
                .expectError(DecodingException.class)
                .verify();
    }
}
