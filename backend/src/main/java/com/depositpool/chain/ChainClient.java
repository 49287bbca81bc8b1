package com.depositpool.chain;

import java.util.List;

/**
 * Blockchain data provider behind a stable contract. Implementations translate provider responses and errors
 * into this contract and never retry; retry with backoff is the caller's job.
 */
public interface ChainClient {

    /**
     * Incoming transfers to {@code address} in blocks at or above {@code sinceBlockHeight}, plus transfers not
     * yet included in a block.
     *
     * @param sinceBlockHeight inclusive lower bound, or null for the provider's full recent window
     * @throws ChainUnavailableException on any provider failure, including rate limiting
     */
    List<ChainTransactionObservation> fetchTransactions(String address, Long sinceBlockHeight);
}
