package com.depositpool.pool;

import java.util.List;

/**
 * Outcome of a bulk address import.
 *
 * @param skipped already in the pool, or repeated within the batch
 * @param errors  one message per rejected (invalid) entry
 */
public record ImportResult(int added, int skipped, List<String> errors) {
}
