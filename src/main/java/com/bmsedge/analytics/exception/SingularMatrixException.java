package com.bmsedge.analytics.exception;

public class SingularMatrixException extends StatisticsException {

    public SingularMatrixException(String message) {
        super(message, ErrorKind.SINGULAR_MATRIX);
    }
}
