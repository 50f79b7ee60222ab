package com.bmsedge.analytics.exception;

public class InsufficientDataException extends StatisticsException {

    public InsufficientDataException(String message) {
        super(message, ErrorKind.INSUFFICIENT_DATA);
    }

    public InsufficientDataException(String message, ErrorKind kind) {
        super(message, checkKind(kind));
    }

    private static ErrorKind checkKind(ErrorKind kind) {
        if (kind != ErrorKind.INSUFFICIENT_DATA
                && kind != ErrorKind.INSUFFICIENT_SAMPLES
                && kind != ErrorKind.INSUFFICIENT_HISTORY) {
            throw new IllegalArgumentException("Not an insufficiency kind: " + kind);
        }
        return kind;
    }
}
