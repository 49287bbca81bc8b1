package com.depositpool.domain;

public enum DepositEventType {
    ADDRESS_ASSIGNED,
    DEPOSIT_PARTIALLY_CONFIRMED,
    DEPOSIT_CONFIRMED,
    DEPOSIT_EXPIRED,
    ADDRESS_RELEASED
}
