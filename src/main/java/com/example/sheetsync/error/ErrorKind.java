package com.example.sheetsync.error;

/**
 * Failure taxonomy of the remote store boundary. Each kind fixes retryability,
 * severity and the message shown to end users.
 */
public enum ErrorKind {
    NETWORK(true, ErrorSeverity.MEDIUM, 503,
            "Problema de conexión. Por favor, verifica tu conexión a internet."),
    TIMEOUT(true, ErrorSeverity.MEDIUM, 504,
            "La operación tardó demasiado tiempo. Inténtalo de nuevo."),
    AUTH(false, ErrorSeverity.MEDIUM, 401,
            "No tienes permisos para realizar esta operación. Inicia sesión nuevamente."),
    VALIDATION(false, ErrorSeverity.LOW, 422,
            "Los datos ingresados no son válidos. Revisa la información."),
    CONFLICT(false, ErrorSeverity.MEDIUM, 409,
            "Los datos han sido modificados por otro usuario. Actualiza la página."),
    RATE_LIMIT(true, ErrorSeverity.MEDIUM, 429,
            "Demasiadas solicitudes. Espera un momento antes de intentar de nuevo."),
    SERVER(true, ErrorSeverity.HIGH, 502,
            "Error interno del servidor. Inténtalo más tarde."),
    UNKNOWN(false, ErrorSeverity.HIGH, 500,
            "Ha ocurrido un error inesperado. Contacta al soporte técnico.");

    private final boolean retryable;
    private final ErrorSeverity severity;
    private final int defaultStatus;
    private final String userMessage;

    ErrorKind(boolean retryable, ErrorSeverity severity, int defaultStatus, String userMessage) {
        this.retryable = retryable;
        this.severity = severity;
        this.defaultStatus = defaultStatus;
        this.userMessage = userMessage;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public ErrorSeverity severity() {
        return severity;
    }

    /** Status used when answering the UI and the remote reply carried none. */
    public int defaultStatus() {
        return defaultStatus;
    }

    public String userMessage() {
        return userMessage;
    }
}
