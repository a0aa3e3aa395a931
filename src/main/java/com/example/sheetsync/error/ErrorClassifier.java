package com.example.sheetsync.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.WriteTimeoutException;
import org.springframework.core.codec.DecodingException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Maps transport and response failures to a {@link ClassifiedError}. Stateless:
 * the same failure and context always produce an equal result.
 */
@Component
public class ErrorClassifier {

    static final String NOT_FOUND_MESSAGE = "El registro solicitado no existe";

    public ClassifiedError classify(Throwable failure, Map<String, Object> context) {
        Map<String, Object> ctx = context == null ? Map.of() : Map.copyOf(context);

        if (failure instanceof ClassifiedException) {
            return ((ClassifiedException) failure).getError();
        }
        if (failure instanceof RemoteStoreException) {
            RemoteStoreException remote = (RemoteStoreException) failure;
            if (remote.isRejectedByStore()) {
                return build(fromMessage(remote.getMessage()), remote.getMessage(), null, null, ctx);
            }
            return build(fromStatus(remote.getStatus()), remote.getMessage(), remote.getStatus(),
                    remote.getStatus() == 429 ? remote.getRetryAfterSeconds() : null, ctx);
        }
        if (failure instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) failure;
            int status = response.getStatusCode().value();
            Long retryAfter = status == 429 ? parseRetryAfter(response.getHeaders().getFirst("Retry-After")) : null;
            return build(fromStatus(status), response.getMessage(), status, retryAfter, ctx);
        }
        if (failure instanceof TimeoutException) {
            return build(ErrorKind.TIMEOUT, describe(failure, "Remote call exceeded its deadline"), null, null, ctx);
        }
        if (failure instanceof DecodingException || failure instanceof JsonProcessingException) {
            return build(ErrorKind.SERVER, "Invalid JSON response from server: " + failure.getMessage(), null, null, ctx);
        }

        Throwable transport = failure instanceof WebClientRequestException ? rootCause(failure) : failure;
        if (transport instanceof SocketTimeoutException || isReadTimeout(transport)) {
            return build(ErrorKind.TIMEOUT, describe(transport, "Socket timeout"), null, null, ctx);
        }
        if (transport instanceof ConnectException || transport instanceof UnknownHostException
                || transport instanceof NoRouteToHostException || transport instanceof IOException
                || failure instanceof WebClientRequestException) {
            return build(ErrorKind.NETWORK, describe(transport, "Network failure"), null, null, ctx);
        }
        return build(ErrorKind.UNKNOWN, describe(failure, "Unknown error occurred"), null, null, ctx);
    }

    /**
     * Kind for an HTTP status. 2xx and 3xx never reach here as failures and map to UNKNOWN.
     */
    public ErrorKind fromStatus(Integer status) {
        if (status == null) return ErrorKind.UNKNOWN;
        switch (status) {
            case 401:
            case 403:
                return ErrorKind.AUTH;
            case 408:
            case 504:
                return ErrorKind.TIMEOUT;
            case 409:
                return ErrorKind.CONFLICT;
            case 429:
                return ErrorKind.RATE_LIMIT;
            case 400:
            case 404:
            case 422:
                return ErrorKind.VALIDATION;
            default:
                if (status >= 500) return ErrorKind.SERVER;
                if (status >= 400) return ErrorKind.VALIDATION;
                return ErrorKind.UNKNOWN;
        }
    }

    private ErrorKind fromMessage(String message) {
        String m = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (m.contains("valid") || m.contains("required") || m.contains("schema")) return ErrorKind.VALIDATION;
        if (m.contains("permission") || m.contains("unauthorized") || m.contains("forbidden")
                || m.contains("token")) return ErrorKind.AUTH;
        if (m.contains("conflict")) return ErrorKind.CONFLICT;
        if (m.contains("timeout")) return ErrorKind.TIMEOUT;
        return ErrorKind.SERVER;
    }

    private ClassifiedError build(ErrorKind kind, String message, Integer status, Long retryAfter,
                                  Map<String, Object> context) {
        return ClassifiedError.builder()
                .kind(kind)
                .severity(kind.severity())
                .message(message)
                .userMessage(status != null && status == 404 ? NOT_FOUND_MESSAGE : kind.userMessage())
                .retryable(kind.isRetryable())
                .httpStatus(status)
                .retryAfter(retryAfter)
                .context(context)
                .build();
    }

    private static boolean isReadTimeout(Throwable t) {
        return t instanceof ReadTimeoutException || t instanceof WriteTimeoutException;
    }

    private static Throwable rootCause(Throwable t) {
        Throwable current = t;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable t, String fallback) {
        return t.getMessage() != null ? t.getMessage() : fallback;
    }

    static Long parseRetryAfter(String header) {
        if (header == null || header.isBlank()) return null;
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
