package com.depositpool.monitor;

import com.depositpool.chain.ChainTransactionObservation;
import com.depositpool.domain.CreditedTransfer;
import com.depositpool.domain.DepositEventType;
import com.depositpool.domain.DepositRequest;
import com.depositpool.domain.DepositState;
import com.depositpool.monitor.config.MonitorProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Pure deposit transitions; no I/O. Mutates the given deposit and reports what changed.
 * <ul>
 *   <li>Each transfer is credited once, keyed by tx hash; later sightings only raise its confirmations.</li>
 *   <li>Confirmations never decrease, so a reorg or stale provider answer cannot move a deposit backwards.</li>
 *   <li>CONFIRMED needs received + tolerance &ge; requested and every credited transfer at the threshold.</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class DepositStateMachine {

    private final MonitorProperties monitorProperties;

    public StateTransition apply(DepositRequest deposit, List<ChainTransactionObservation> observations, Instant now) {
        if (deposit.isTerminal() || observations == null || observations.isEmpty()) {
            return StateTransition.NONE;
        }
        boolean changed = false;
        for (ChainTransactionObservation o : observations) {
            if (!matches(deposit, o)) {
                continue;
            }
            CreditedTransfer existing = deposit.getCredited().get(o.txHash());
            if (existing == null) {
                deposit.getCredited().put(o.txHash(),
                        new CreditedTransfer(o.amount(), o.blockHeight(), o.confirmations()));
                deposit.setReceivedAmount(deposit.getReceivedAmount().add(o.amount()));
                changed = true;
            } else {
                if (o.confirmations() > existing.getConfirmations()) {
                    existing.setConfirmations(o.confirmations());
                    changed = true;
                }
                if (existing.getBlockHeight() == null && o.blockHeight() != null) {
                    existing.setBlockHeight(o.blockHeight());
                    changed = true;
                }
            }
            if (o.confirmations() > deposit.getConfirmationsObserved()) {
                deposit.setConfirmationsObserved(o.confirmations());
                changed = true;
            }
        }
        if (!changed) {
            return StateTransition.NONE;
        }
        deposit.setScanFromBlock(nextScanFrom(deposit));

        List<DepositEventType> events = new ArrayList<>();
        if (isFullyConfirmed(deposit)) {
            deposit.setState(DepositState.CONFIRMED);
            deposit.setCompletedAt(now);
            events.add(DepositEventType.DEPOSIT_CONFIRMED);
        } else if (deposit.getState() == DepositState.PENDING && !deposit.getCredited().isEmpty()) {
            deposit.setState(DepositState.PARTIALLY_CONFIRMED);
            events.add(DepositEventType.DEPOSIT_PARTIALLY_CONFIRMED);
        }
        enqueue(deposit, events);
        return new StateTransition(true, events);
    }

    /** PENDING / PARTIALLY_CONFIRMED → EXPIRED once {@code now} is past expiresAt. */
    public StateTransition expire(DepositRequest deposit, Instant now) {
        if (deposit.isTerminal() || deposit.getExpiresAt() == null || !now.isAfter(deposit.getExpiresAt())) {
            return StateTransition.NONE;
        }
        deposit.setState(DepositState.EXPIRED);
        deposit.setCompletedAt(now);
        List<DepositEventType> events = List.of(DepositEventType.DEPOSIT_EXPIRED);
        enqueue(deposit, events);
        return new StateTransition(true, events);
    }

    private boolean matches(DepositRequest deposit, ChainTransactionObservation o) {
        if (o.txHash() == null || o.amount() == null || o.amount().signum() <= 0) {
            return false;
        }
        if (!deposit.getAddress().equals(o.toAddress()) || !deposit.getCurrency().equals(o.asset())) {
            return false;
        }
        // transfers to a reused address from before this assignment belong to an earlier deposit
        return o.blockTimestamp() == null || deposit.getCreatedAt() == null
                || !o.blockTimestamp().isBefore(deposit.getCreatedAt());
    }

    private boolean isFullyConfirmed(DepositRequest deposit) {
        if (deposit.getCredited().isEmpty()) {
            return false;
        }
        BigDecimal covered = deposit.getReceivedAmount().add(monitorProperties.getAmountTolerance());
        if (covered.compareTo(deposit.getRequestedAmount()) < 0) {
            return false;
        }
        int threshold = monitorProperties.getConfirmationThreshold();
        return deposit.getCredited().values().stream().allMatch(t -> t.getConfirmations() >= threshold);
    }

    /**
     * Lowest block of a credited transfer still below the threshold, so it keeps being re-read;
     * otherwise one past the highest credited block.
     */
    private Long nextScanFrom(DepositRequest deposit) {
        int threshold = monitorProperties.getConfirmationThreshold();
        Long lowestPending = null;
        Long highest = null;
        for (CreditedTransfer t : deposit.getCredited().values()) {
            Long block = t.getBlockHeight();
            if (block == null) {
                continue;
            }
            if (t.getConfirmations() < threshold && (lowestPending == null || block < lowestPending)) {
                lowestPending = block;
            }
            if (highest == null || block > highest) {
                highest = block;
            }
        }
        if (lowestPending != null) {
            return lowestPending;
        }
        return highest != null ? highest + 1 : deposit.getScanFromBlock();
    }

    private static void enqueue(DepositRequest deposit, List<DepositEventType> events) {
        for (DepositEventType type : events) {
            if (!deposit.getUnpublishedEvents().contains(type)) {
                deposit.getUnpublishedEvents().add(type);
            }
        }
    }
}
