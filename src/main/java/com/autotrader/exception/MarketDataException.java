package com.autotrader.exception;

public class MarketDataException extends BaseException {

    public MarketDataException(String message) {
        super(ErrorCode.MARKET_DATA_ERROR, message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(ErrorCode.MARKET_DATA_ERROR, message, cause);
    }
}
