package com.depositpool.chain;

import lombok.Getter;

import java.time.Duration;
import java.util.Optional;

/**
 * Transient chain provider failure (HTTP error, timeout, rate limit). Never turned into a deposit failure.
 */
@Getter
public class ChainUnavailableException extends RuntimeException {

    /** Provider's suggested wait before the next attempt, when it gave one. */
    private final Duration retryAfter;

    public ChainUnavailableException(String message) {
        this(message, null, null);
    }

    public ChainUnavailableException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public ChainUnavailableException(String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> retryAfterHint() {
        return Optional.ofNullable(retryAfter);
    }
}
