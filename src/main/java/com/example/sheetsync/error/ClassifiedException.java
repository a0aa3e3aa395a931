package com.example.sheetsync.error;

import lombok.Getter;

/**
 * Carries a {@link ClassifiedError} through reactive pipelines.
 */
@Getter
public class ClassifiedException extends RuntimeException {

    private final ClassifiedError error;

    public ClassifiedException(ClassifiedError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }
}
