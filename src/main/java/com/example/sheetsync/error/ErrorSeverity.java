package com.example.sheetsync.error;

public enum ErrorSeverity {
    LOW, MEDIUM, HIGH, CRITICAL
}
