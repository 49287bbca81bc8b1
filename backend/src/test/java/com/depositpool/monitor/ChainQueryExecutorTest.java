package com.depositpool.monitor;

import com.depositpool.chain.ChainClient;
import com.depositpool.chain.ChainTransactionObservation;
import com.depositpool.chain.ChainUnavailableException;
import com.depositpool.common.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChainQueryExecutorTest {

    @Mock
    private ChainClient chainClient;

    private ChainQueryExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new ChainQueryExecutor(chainClient, new RetryPolicy(1L, 5L, 0, 3));
    }

    @Test
    void transientFailures_retriedUntilSuccess() {
        List<ChainTransactionObservation> observed = List.of(new ChainTransactionObservation(
                "tx1", "TADDR", "USDT", BigDecimal.ONE, 10L, 1, Instant.now()));
        when(chainClient.fetchTransactions("TADDR", 5L))
                .thenThrow(new ChainUnavailableException("503"))
                .thenThrow(new ChainUnavailableException("timeout"))
                .thenReturn(observed);

        assertThat(executor.fetch("TADDR", 5L, Instant.now().plusSeconds(5))).isEqualTo(observed);
        verify(chainClient, times(3)).fetchTransactions("TADDR", 5L);
    }

    @Test
    void attemptsExhausted_rethrowsLastFailure() {
        when(chainClient.fetchTransactions("TADDR", null))
                .thenThrow(new ChainUnavailableException("first"))
                .thenThrow(new ChainUnavailableException("second"))
                .thenThrow(new ChainUnavailableException("third"));

        assertThatThrownBy(() -> executor.fetch("TADDR", null, Instant.now().plusSeconds(5)))
                .isInstanceOf(ChainUnavailableException.class)
                .hasMessage("third");
        verify(chainClient, times(3)).fetchTransactions("TADDR", null);
    }

    @Test
    @DisplayName("a Retry-After hint that overshoots the deadline stops retrying")
    void retryHintPastDeadline_givesUp() {
        when(chainClient.fetchTransactions("TADDR", null))
                .thenThrow(new ChainUnavailableException("429", Duration.ofSeconds(30), null));

        assertThatThrownBy(() -> executor.fetch("TADDR", null, Instant.now().plusMillis(200)))
                .isInstanceOf(ChainUnavailableException.class);
        verify(chainClient, times(1)).fetchTransactions("TADDR", null);
    }

    @Test
    @DisplayName("an attempt still running at the deadline is cut off instead of running to completion")
    void slowAttempt_boundedByDeadline() {
        ChainClient slow = (address, since) -> {
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new ChainUnavailableException("503");
        };
        ChainQueryExecutor bounded = new ChainQueryExecutor(slow, new RetryPolicy(1L, 5L, 0, 5));
        Instant start = Instant.now();

        assertThatThrownBy(() -> bounded.fetch("TADDR", null, start.plusMillis(350)))
                .isInstanceOf(ChainUnavailableException.class);
        assertThat(Duration.between(start, Instant.now())).isLessThan(Duration.ofMillis(500));
    }

    @Test
    void deadlineAlreadyPassed_noQuery() {
        assertThatThrownBy(() -> executor.fetch("TADDR", null, Instant.now().minusMillis(1)))
                .isInstanceOf(ChainUnavailableException.class);
        verify(chainClient, never()).fetchTransactions("TADDR", null);
    }
}
