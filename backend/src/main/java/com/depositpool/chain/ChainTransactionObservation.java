package com.depositpool.chain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One transfer as seen by the chain client at query time. Not persisted; the tx hash is its idempotency key.
 *
 * @param blockHeight   null while the transfer is not yet in a block
 * @param confirmations 0 while unconfirmed
 */
public record ChainTransactionObservation(
        String txHash,
        String toAddress,
        String asset,
        BigDecimal amount,
        Long blockHeight,
        long confirmations,
        Instant blockTimestamp) {
}
