package com.depositpool.deposit;

import com.depositpool.domain.DepositState;

import java.math.BigDecimal;
import java.time.Instant;

public record DepositStatusView(
        String requestId,
        DepositState state,
        long confirmationsObserved,
        int confirmationThreshold,
        BigDecimal requestedAmount,
        BigDecimal receivedAmount,
        String currency,
        String address,
        Instant expiresAt) {
}
