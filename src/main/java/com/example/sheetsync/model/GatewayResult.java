package com.example.sheetsync.model;

import com.example.sheetsync.error.ClassifiedError;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * What the UI gets back from any gateway call. Failures are values, never exceptions.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayResult<T> {
    boolean ok;
    T data;
    String message;
    /** Stale data served because the remote call failed. */
    boolean fromCache;
    boolean cacheHit;
    ClassifiedError error;
    String eventId;
    Instant timestamp;

    public static <T> GatewayResult<T> failure(ClassifiedError error, Instant at) {
        return GatewayResult.<T>builder()
                .ok(false)
                .message(error.getUserMessage())
                .error(error)
                .timestamp(at)
                .build();
    }
}
