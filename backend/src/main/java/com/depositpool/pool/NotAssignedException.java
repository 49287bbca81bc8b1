package com.depositpool.pool;

/**
 * Address transition requested for an address that is not in the expected status or not held by the given deposit.
 */
public class NotAssignedException extends RuntimeException {

    public NotAssignedException(String message) {
        super(message);
    }
}
