package com.bmsedge.analytics.exception;

/**
 * Base exception for all failures raised by the analysis engine
 */
public class StatisticsException extends RuntimeException {
    private final ErrorKind kind;

    public StatisticsException(String message, ErrorKind kind) {
        super(message);
        this.kind = kind;
    }

    public StatisticsException(String message, ErrorKind kind, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getErrorCode() {
        return kind.getCode();
    }
}
