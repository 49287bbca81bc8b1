package com.depositpool.monitor;

import com.depositpool.chain.ChainTransactionObservation;
import com.depositpool.config.AsyncConfig;
import com.depositpool.domain.AddressStatus;
import com.depositpool.domain.DepositEventType;
import com.depositpool.domain.DepositRequest;
import com.depositpool.domain.DepositRequestRepository;
import com.depositpool.domain.DepositState;
import com.depositpool.domain.PoolAddress;
import com.depositpool.event.DepositEventEmitter;
import com.depositpool.monitor.config.MonitorProperties;
import com.depositpool.pool.NotAssignedException;
import com.depositpool.pool.PoolManager;
import com.depositpool.pool.config.PoolProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Drives deposits through PENDING → PARTIALLY_CONFIRMED → CONFIRMED / EXPIRED and hands their addresses back to the
 * pool. One cycle:
 * <ol>
 *   <li>poll every active deposit of this shard on the monitor executor, each bounded by the per-address timeout;</li>
 *   <li>expire overdue deposits;</li>
 *   <li>reclaim addresses left behind by a crash (orphaned, terminal, or never switched to MONITORING);</li>
 *   <li>release addresses whose cooldown has elapsed.</li>
 * </ol>
 * Chain failures never change deposit state; the deposit is simply polled again next cycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DepositMonitor {

    static final Set<DepositState> ACTIVE_STATES = EnumSet.of(DepositState.PENDING, DepositState.PARTIALLY_CONFIRMED);
    static final int MAX_CONFLICT_RETRIES = 5;

    private final DepositRequestRepository depositRequestRepository;
    private final PoolManager poolManager;
    private final ChainQueryExecutor chainQueryExecutor;
    private final DepositStateMachine stateMachine;
    private final DepositEventEmitter eventEmitter;
    private final MonitorProperties monitorProperties;
    private final PoolProperties poolProperties;
    @Qualifier(AsyncConfig.MONITOR_EXECUTOR)
    private final ThreadPoolTaskExecutor monitorExecutor;

    /** Starts watching a freshly persisted deposit: its address moves ASSIGNED → MONITORING. */
    public void watch(DepositRequest deposit) {
        poolManager.beginMonitoring(deposit.getAddress(), deposit.getId());
        log.info("Monitoring deposit {} on {} ({} {})", deposit.getId(), deposit.getAddress(),
                deposit.getRequestedAmount(), deposit.getCurrency());
    }

    public MonitorCycleReport runCycle() {
        List<DepositRequest> active = depositRequestRepository.findByStateIn(ACTIVE_STATES).stream()
                .filter(d -> monitorProperties.owns(d.getAddress()))
                .toList();

        Map<String, Future<?>> tasks = new LinkedHashMap<>();
        int deferred = 0;
        for (DepositRequest deposit : active) {
            try {
                tasks.put(deposit.getId(), monitorExecutor.submit(() -> pollDeposit(deposit.getId())));
            } catch (TaskRejectedException e) {
                deferred++;
            }
        }
        if (deferred > 0) {
            log.warn("Monitor executor saturated; {} of {} deposit polls deferred to the next cycle",
                    deferred, active.size());
        }
        int failed = 0;
        int timedOut = 0;
        long timeoutMs = monitorProperties.getPerAddressTimeout().toMillis();
        for (Map.Entry<String, Future<?>> task : tasks.entrySet()) {
            try {
                task.getValue().get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                task.getValue().cancel(true);
                timedOut++;
                log.warn("Poll of deposit {} exceeded {} ms; abandoned until next cycle", task.getKey(), timeoutMs);
            } catch (ExecutionException e) {
                failed++;
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Poll of deposit {} failed: {}", task.getKey(), cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                tasks.values().forEach(f -> f.cancel(true));
                log.warn("Monitor cycle interrupted");
                break;
            }
        }

        int expired = expireOverdue();
        int reclaimed = reclaimStaleAssignments();
        int released = releaseCooledDown();
        MonitorCycleReport report = new MonitorCycleReport(tasks.size(), deferred, failed, timedOut, expired, reclaimed,
                released);
        if (!active.isEmpty() || expired + reclaimed + released > 0) {
            log.info("Monitor cycle: {}", report);
        }
        return report;
    }

    /**
     * Queries the chain for one deposit and applies what it sees.
     *
     * @throws com.depositpool.chain.ChainUnavailableException when the chain stays unavailable until the deadline
     */
    public void pollDeposit(String depositId) {
        Optional<DepositRequest> found = depositRequestRepository.findById(depositId);
        if (found.isEmpty() || found.get().isTerminal()) {
            return;
        }
        DepositRequest deposit = found.get();
        Instant deadline = Instant.now().plus(monitorProperties.getPerAddressTimeout());
        List<ChainTransactionObservation> observations =
                chainQueryExecutor.fetch(deposit.getAddress(), deposit.getScanFromBlock(), deadline);
        updateDeposit(depositId, d -> {
            d.setLastPolledAt(Instant.now());
            return stateMachine.apply(d, observations, Instant.now());
        }, true);
    }

    /**
     * Applies a transfer pushed by a chain notification instead of found by polling. It goes through the same merge
     * as a poll, so a hash already credited is not counted twice and confirmations only grow. The poll watermark
     * is left where polling put it.
     *
     * @return the deposit after the update; empty when no active deposit watches the destination address
     */
    public Optional<DepositRequest> onObservation(ChainTransactionObservation observation) {
        if (observation == null || observation.toAddress() == null) {
            return Optional.empty();
        }
        Optional<DepositRequest> target = depositRequestRepository
                .findFirstByAddressAndStateInOrderByCreatedAtDesc(observation.toAddress(), ACTIVE_STATES);
        if (target.isEmpty()) {
            log.debug("No active deposit on {} for notified tx {}", observation.toAddress(), observation.txHash());
            return Optional.empty();
        }
        return updateDeposit(target.get().getId(), d -> {
            Long watermark = d.getScanFromBlock();
            StateTransition transition = stateMachine.apply(d, List.of(observation), Instant.now());
            d.setScanFromBlock(watermark);
            return transition;
        }, false);
    }

    /** Expires every overdue active deposit of this shard. */
    public int expireOverdue() {
        int expired = 0;
        List<DepositRequest> overdue = depositRequestRepository.findByStateInAndExpiresAtBefore(ACTIVE_STATES, Instant.now());
        for (DepositRequest deposit : overdue) {
            if (!monitorProperties.owns(deposit.getAddress())) {
                continue;
            }
            try {
                if (expire(deposit.getId()).map(DepositRequest::getState).orElse(null) == DepositState.EXPIRED) {
                    expired++;
                }
            } catch (Exception e) {
                log.warn("Expiry of deposit {} failed: {}", deposit.getId(), e.getMessage());
            }
        }
        return expired;
    }

    /**
     * Read-path expiry: an overdue deposit gets one last poll (best effort), then expires if still unconfirmed.
     *
     * @return the deposit as stored afterwards
     */
    public Optional<DepositRequest> expireIfOverdue(String depositId) {
        Optional<DepositRequest> found = depositRequestRepository.findById(depositId);
        if (found.isEmpty() || found.get().isTerminal() || !Instant.now().isAfter(found.get().getExpiresAt())) {
            return found;
        }
        try {
            pollDeposit(depositId);
        } catch (Exception e) {
            log.debug("Final poll before expiring {} failed: {}", depositId, e.getMessage());
        }
        return expire(depositId);
    }

    /**
     * Returns crash leftovers to a consistent state: an ASSIGNED address whose deposit was never saved (after the
     * orphan grace) or any held address whose deposit is terminal goes to COOLDOWN; an address still ASSIGNED to a
     * live deposit after the grace is switched to MONITORING.
     */
    public int reclaimStaleAssignments() {
        int reclaimed = 0;
        Instant graceCutoff = Instant.now().minus(poolProperties.getOrphanGrace());
        for (PoolAddress address : poolManager.heldAddresses()) {
            if (!monitorProperties.owns(address.getAddress()) || address.getAssignedDepositId() == null) {
                continue;
            }
            boolean pastGrace = address.getAssignedAt() == null || address.getAssignedAt().isBefore(graceCutoff);
            try {
                Optional<DepositRequest> deposit = depositRequestRepository.findById(address.getAssignedDepositId());
                if (deposit.isEmpty()) {
                    if (pastGrace) {
                        log.warn("Reclaiming orphaned address {} (deposit {} never persisted)",
                                address.getAddress(), address.getAssignedDepositId());
                        poolManager.beginCooldown(address.getAddress(), address.getAssignedDepositId());
                        reclaimed++;
                    }
                } else if (deposit.get().isTerminal()) {
                    log.warn("Address {} still held by {} deposit {}; moving to cooldown",
                            address.getAddress(), deposit.get().getState(), deposit.get().getId());
                    poolManager.beginCooldown(address.getAddress(), deposit.get().getId());
                    reclaimed++;
                } else if (address.getStatus() == AddressStatus.ASSIGNED && pastGrace) {
                    poolManager.beginMonitoring(address.getAddress(), deposit.get().getId());
                    reclaimed++;
                }
            } catch (NotAssignedException e) {
                log.debug("Address {} changed concurrently: {}", address.getAddress(), e.getMessage());
            }
        }
        return reclaimed;
    }

    /**
     * Releases every COOLDOWN address of this shard whose quarantine has elapsed and emits ADDRESS_RELEASED for its
     * last deposit. The event is put in the deposit outbox before the release so a crash cannot lose it.
     */
    public int releaseCooledDown() {
        int released = 0;
        for (PoolAddress address : poolManager.dueForRelease(Instant.now())) {
            if (!monitorProperties.owns(address.getAddress())) {
                continue;
            }
            String depositId = address.getAssignedDepositId();
            try {
                if (depositId != null) {
                    depositRequestRepository.addUnpublishedEvent(depositId, DepositEventType.ADDRESS_RELEASED);
                }
                poolManager.release(address.getAddress());
                released++;
            } catch (NotAssignedException e) {
                log.debug("Address {} already released: {}", address.getAddress(), e.getMessage());
                continue;
            }
            if (depositId != null) {
                depositRequestRepository.findById(depositId)
                        .ifPresent(d -> eventEmitter.emit(DepositEventType.ADDRESS_RELEASED, d));
            }
        }
        return released;
    }

    private Optional<DepositRequest> expire(String depositId) {
        return updateDeposit(depositId, d -> stateMachine.expire(d, Instant.now()), false);
    }

    /**
     * Load-mutate-save under optimistic locking, re-reading on conflict. After a successful save the address is
     * moved to cooldown when the deposit became terminal and the produced events are emitted.
     */
    private Optional<DepositRequest> updateDeposit(String depositId,
                                                   Function<DepositRequest, StateTransition> mutation,
                                                   boolean saveUnchanged) {
        for (int attempt = 0; attempt < MAX_CONFLICT_RETRIES; attempt++) {
            Optional<DepositRequest> found = depositRequestRepository.findById(depositId);
            if (found.isEmpty() || found.get().isTerminal()) {
                return found;
            }
            DepositRequest deposit = found.get();
            DepositState before = deposit.getState();
            StateTransition transition = mutation.apply(deposit);
            if (!transition.changed() && !saveUnchanged) {
                return Optional.of(deposit);
            }
            DepositRequest saved;
            try {
                saved = depositRequestRepository.save(deposit);
            } catch (OptimisticLockingFailureException e) {
                log.debug("Concurrent update of deposit {} (attempt {}); reloading", depositId, attempt + 1);
                continue;
            }
            afterSave(saved, before, transition);
            return Optional.of(saved);
        }
        log.warn("Gave up updating deposit {} after {} conflicts", depositId, MAX_CONFLICT_RETRIES);
        return depositRequestRepository.findById(depositId);
    }

    private void afterSave(DepositRequest deposit, DepositState before, StateTransition transition) {
        if (deposit.getState() != before) {
            log.info("Deposit {} {} → {} (received {} / {} {}, confirmations {})", deposit.getId(), before,
                    deposit.getState(), deposit.getReceivedAmount(), deposit.getRequestedAmount(),
                    deposit.getCurrency(), deposit.getConfirmationsObserved());
        }
        if (deposit.isTerminal()) {
            try {
                poolManager.beginCooldown(deposit.getAddress(), deposit.getId());
            } catch (NotAssignedException e) {
                log.error("Address {} not held by terminal deposit {}: {}", deposit.getAddress(), deposit.getId(),
                        e.getMessage());
            }
        }
        for (DepositEventType type : transition.events()) {
            eventEmitter.emit(type, deposit);
        }
    }
}
