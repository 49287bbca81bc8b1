package com.depositpool.deposit;

import lombok.Getter;

/**
 * Rejected deposit request. Nothing was allocated or persisted.
 */
@Getter
public class DepositRequestException extends RuntimeException {

    public enum ErrorCode {
        INVALID_AMOUNT,
        AMOUNT_TOO_SMALL,
        AMOUNT_TOO_LARGE,
        UNSUPPORTED_CURRENCY
    }

    private final ErrorCode errorCode;

    public DepositRequestException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
