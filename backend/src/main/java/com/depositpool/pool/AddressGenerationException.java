package com.depositpool.pool;

public class AddressGenerationException extends RuntimeException {

    public AddressGenerationException(String message) {
        super(message);
    }

    public AddressGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
