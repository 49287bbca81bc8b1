package com.depositpool.pool;

import java.util.List;

/**
 * Source of fresh chain addresses for replenishment (wallet service / HSM). Key material never enters this process.
 */
public interface AddressGenerator {

    /**
     * @return up to {@code count} new addresses; fewer is allowed
     * @throws AddressGenerationException when the generator cannot be reached or answers with an error
     */
    List<String> generate(int count);
}
