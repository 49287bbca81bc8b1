package com.depositpool.monitor;

import com.depositpool.chain.ChainClient;
import com.depositpool.chain.ChainTransactionObservation;
import com.depositpool.chain.ChainUnavailableException;
import com.depositpool.common.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Calls the chain client and retries ChainUnavailableException with exponential backoff, honouring the provider's
 * retry hint. Each attempt only gets the time left until the deadline; the executor gives up (rethrowing the last
 * failure) when attempts run out or the next wait would pass the deadline.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChainQueryExecutor {

    private final ChainClient chainClient;
    private final RetryPolicy retryPolicy;

    public List<ChainTransactionObservation> fetch(String address, Long sinceBlockHeight, Instant deadline) {
        ChainUnavailableException last = null;
        for (int attempt = 0; attempt < retryPolicy.getMaxAttempts(); attempt++) {
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                if (last == null) {
                    last = new ChainUnavailableException("Deadline passed before querying " + address);
                }
                break;
            }
            try {
                return attempt(address, sinceBlockHeight, remaining);
            } catch (ChainUnavailableException e) {
                last = e;
                if (attempt + 1 >= retryPolicy.getMaxAttempts()) {
                    break;
                }
                long delayMs = retryPolicy.delayMs(attempt, e.getRetryAfter());
                if (Instant.now().plusMillis(delayMs).isAfter(deadline)) {
                    log.debug("Retry for {} would pass its deadline; giving up after attempt {}", address, attempt + 1);
                    break;
                }
                log.debug("Chain unavailable for {} (attempt {}), retrying in {} ms: {}",
                        address, attempt + 1, delayMs, e.getMessage());
                sleep(delayMs);
            }
        }
        throw last;
    }

    private List<ChainTransactionObservation> attempt(String address, Long sinceBlockHeight, Duration budget) {
        return Mono.fromCallable(() -> chainClient.fetchTransactions(address, sinceBlockHeight))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(budget)
                .onErrorMap(TimeoutException.class, e -> new ChainUnavailableException(
                        "Query for " + address + " exceeded its " + budget.toMillis() + " ms budget", e))
                .defaultIfEmpty(List.of())
                .block();
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChainUnavailableException("Interrupted while waiting to retry", e);
        }
    }
}
