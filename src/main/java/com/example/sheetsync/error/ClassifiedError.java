package com.example.sheetsync.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClassifiedError {
    ErrorKind kind;
    ErrorSeverity severity;
    String message;
    String userMessage;
    boolean retryable;
    Integer httpStatus;
    /** Server hint for rate-limited calls, in seconds. */
    Long retryAfter;
    Map<String, Object> context;

    public int responseStatus() {
        return httpStatus != null && httpStatus >= 400 ? httpStatus : kind.defaultStatus();
    }
}
