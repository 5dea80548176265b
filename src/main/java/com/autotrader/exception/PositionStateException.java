package com.autotrader.exception;

import java.util.Map;

/** A position operation is not allowed in the position's current status. */
public class PositionStateException extends BaseException {

    public PositionStateException(String message, String positionId) {
        super(ErrorCode.INVALID_STATE, message, positionId != null ? Map.of("positionId", positionId) : Map.of());
    }
}
