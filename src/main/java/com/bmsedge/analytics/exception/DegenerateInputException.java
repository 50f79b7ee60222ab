package com.bmsedge.analytics.exception;

public class DegenerateInputException extends StatisticsException {

    public DegenerateInputException(String message) {
        super(message, ErrorKind.DEGENERATE_INPUT);
    }
}
