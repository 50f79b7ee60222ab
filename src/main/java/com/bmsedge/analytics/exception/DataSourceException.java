package com.bmsedge.analytics.exception;

public class DataSourceException extends StatisticsException {

    public DataSourceException(String message) {
        super(message, ErrorKind.DATA_SOURCE);
    }

    public DataSourceException(String message, Throwable cause) {
        super(message, ErrorKind.DATA_SOURCE, cause);
    }
}
