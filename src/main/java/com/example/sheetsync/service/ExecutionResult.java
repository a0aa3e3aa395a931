package com.example.sheetsync.service;

import lombok.Value;

import java.time.Duration;

@Value
public class ExecutionResult<T> {
    T data;
    /** Served from cache after the remote call failed. */
    boolean fromCache;
    String message;
    Duration cacheAge;
    int attempts;

    public static <T> ExecutionResult<T> fresh(T data, int attempts) {
        return new ExecutionResult<>(data, false, null, null, attempts);
    }

    public static <T> ExecutionResult<T> fallback(T data, String message, Duration age, int attempts) {
        return new ExecutionResult<>(data, true, message, age, attempts);
    }
}
