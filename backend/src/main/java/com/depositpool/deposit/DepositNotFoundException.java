package com.depositpool.deposit;

public class DepositNotFoundException extends RuntimeException {

    public DepositNotFoundException(String requestId) {
        super("Deposit request not found: " + requestId);
    }
}
