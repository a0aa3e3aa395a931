package com.example.sheetsync.error;

import lombok.Getter;

/**
 * Raised by the remote store client for a non-2xx reply or an {@code ok:false} payload.
 */
@Getter
public class RemoteStoreException extends RuntimeException {

    /** HTTP status, or null when the store answered 2xx but rejected the request. */
    private final Integer status;
    private final Long retryAfterSeconds;

    public RemoteStoreException(Integer status, String message, Long retryAfterSeconds) {
        super(message);
        this.status = status;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static RemoteStoreException rejected(String message) {
        return new RemoteStoreException(null, message, null);
    }

    public boolean isRejectedByStore() {
        return status == null;
    }
}
