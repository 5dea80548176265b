package com.autotrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", false),
    NOT_FOUND("NOT_FOUND", false),
    INVALID_STATE("INVALID_STATE", false),
    MARKET_DATA_ERROR("MARKET_DATA_ERROR", true),
    BROKER_ERROR("BROKER_ERROR", true),
    INTERNAL_ERROR("INTERNAL_ERROR", false);

    private final String code;
    private final boolean retryable;
}
