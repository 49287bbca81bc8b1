package com.depositpool.deposit;

import java.time.Instant;

/**
 * What the caller shows the payer: where to send, which request it belongs to, and until when.
 */
public record DepositTicket(String address, String requestId, Instant expiresAt) {
}
