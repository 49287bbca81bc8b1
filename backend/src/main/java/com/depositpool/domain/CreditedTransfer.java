package com.depositpool.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * A transfer counted toward a deposit, keyed by tx hash in {@link DepositRequest#getCredited()}.
 * Amount is credited once; confirmations only grow.
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class CreditedTransfer {

    private BigDecimal amount;
    /** Null while the transfer is still unconfirmed (not yet in a block). */
    private Long blockHeight;
    private long confirmations;
}
