package com.autotrader.exception;

import java.util.Map;

/** An order could not be placed or confirmed by the exchange. */
public class ExecutionException extends BaseException {

    public ExecutionException(String message) {
        super(ErrorCode.BROKER_ERROR, message);
    }

    public ExecutionException(String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, cause);
    }

    public ExecutionException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, details, cause);
    }
}
