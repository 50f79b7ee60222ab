package com.bmsedge.analytics.exception;

public class InvalidParameterException extends StatisticsException {

    public InvalidParameterException(String message) {
        super(message, ErrorKind.INVALID_PARAMETER);
    }
}
