package com.depositpool.pool;

import com.depositpool.common.TronAddressCodec;
import com.depositpool.domain.AddressStatus;
import com.depositpool.domain.PoolAddress;
import com.depositpool.domain.PoolAddressRepository;
import com.depositpool.domain.PoolExhaustedEvent;
import com.depositpool.pool.config.PoolProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the address lifecycle AVAILABLE → ASSIGNED → MONITORING → COOLDOWN → AVAILABLE.
 * Every transition is one conditional findAndModify, so concurrent callers (threads or instances) can never
 * hold the same address for two deposits. Allocation does no chain I/O.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PoolManager {

    static final double HIGH_UTILIZATION_PERCENT = 90.0;

    private final PoolAddressRepository poolAddressRepository;
    private final PoolProperties poolProperties;
    private final AddressGenerator addressGenerator;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final AtomicBoolean replenishing = new AtomicBoolean(false);

    /**
     * Hands the longest-idle AVAILABLE address to {@code requestId}.
     *
     * @throws PoolExhaustedException when nothing is AVAILABLE; an async replenish is requested first
     */
    public PoolAddress allocate(String requestId) {
        Optional<PoolAddress> claimed = poolAddressRepository.claimNextAvailable(requestId, Instant.now());
        if (claimed.isEmpty()) {
            log.warn("Address pool exhausted while allocating for deposit {}", requestId);
            applicationEventPublisher.publishEvent(new PoolExhaustedEvent(requestId));
            throw new PoolExhaustedException("No available deposit address for request " + requestId);
        }
        PoolAddress address = claimed.get();
        log.info("Allocated address {} to deposit {} (use #{})",
                address.getAddress(), requestId, address.getUsageCount());
        return address;
    }

    /** ASSIGNED → MONITORING. Repeating the call for the same deposit is a no-op. */
    public PoolAddress beginMonitoring(String address, String requestId) {
        Optional<PoolAddress> updated = poolAddressRepository.markMonitoring(address, requestId);
        if (updated.isPresent()) {
            log.debug("Address {} monitoring for deposit {}", address, requestId);
            return updated.get();
        }
        return currentIfHeld(address, requestId, AddressStatus.MONITORING)
                .orElseThrow(() -> new NotAssignedException(
                        "Address " + address + " is not ASSIGNED to deposit " + requestId));
    }

    /** ASSIGNED/MONITORING → COOLDOWN until now + cooldown. Repeating the call for the same deposit is a no-op. */
    public PoolAddress beginCooldown(String address, String requestId) {
        Instant until = Instant.now().plus(poolProperties.getCooldown());
        Optional<PoolAddress> updated = poolAddressRepository.markCooldown(address, requestId, until);
        if (updated.isPresent()) {
            log.info("Address {} in cooldown until {} (deposit {})", address, until, requestId);
            return updated.get();
        }
        return currentIfHeld(address, requestId, AddressStatus.COOLDOWN)
                .orElseThrow(() -> new NotAssignedException(
                        "Address " + address + " is not held by deposit " + requestId));
    }

    /**
     * COOLDOWN → AVAILABLE.
     *
     * @return the address as it was just before release, so the caller still sees the owning deposit
     * @throws NotAssignedException when the address is not in COOLDOWN
     */
    public PoolAddress release(String address) {
        PoolAddress previous = poolAddressRepository.markAvailable(address, Instant.now())
                .orElseThrow(() -> new NotAssignedException("Address " + address + " is not in COOLDOWN"));
        log.info("Released address {} (was held by deposit {})", address, previous.getAssignedDepositId());
        return previous;
    }

    /** COOLDOWN addresses whose quarantine has elapsed at {@code now}. */
    public List<PoolAddress> dueForRelease(Instant now) {
        return poolAddressRepository.findByStatusAndCooldownUntilLessThanEqual(AddressStatus.COOLDOWN, now);
    }

    /** Addresses currently handed to a deposit and not yet in cooldown. */
    public List<PoolAddress> heldAddresses() {
        return poolAddressRepository.findByStatusIn(EnumSet.of(AddressStatus.ASSIGNED, AddressStatus.MONITORING));
    }

    /**
     * Tops AVAILABLE up to the configured minimum using the generator. Failures are logged; the next tick retries.
     * Runs at most once at a time per instance.
     *
     * @return number of addresses added
     */
    public int replenish() {
        if (!replenishing.compareAndSet(false, true)) {
            log.debug("Replenish already running; skipping");
            return 0;
        }
        try {
            long available = poolAddressRepository.countByStatus(AddressStatus.AVAILABLE);
            int shortfall = (int) Math.max(0, poolProperties.getMinSize() - available);
            if (shortfall == 0) {
                return 0;
            }
            log.info("Pool below minimum ({} available, min {}); requesting {} addresses",
                    available, poolProperties.getMinSize(), shortfall);
            List<String> generated = addressGenerator.generate(shortfall);
            ImportResult result = addAddresses(generated);
            if (!result.errors().isEmpty()) {
                log.warn("Generator returned {} invalid addresses: {}", result.errors().size(), result.errors());
            }
            log.info("Replenished pool with {} addresses ({} skipped)", result.added(), result.skipped());
            return result.added();
        } catch (Exception e) {
            log.warn("Pool replenish failed: {}", e.getMessage(), e);
            return 0;
        } finally {
            replenishing.set(false);
        }
    }

    /**
     * Bulk import. Invalid TRON addresses are reported in errors; addresses already present (or repeated in the
     * batch) are skipped. New addresses become AVAILABLE in input order.
     */
    public ImportResult addAddresses(Collection<String> addresses) {
        if (addresses == null || addresses.isEmpty()) {
            return new ImportResult(0, 0, List.of());
        }
        int added = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Instant now = Instant.now();
        for (String raw : addresses) {
            String address = raw != null ? raw.trim() : null;
            if (!TronAddressCodec.isValid(address)) {
                errors.add("Invalid TRON address: " + raw);
                continue;
            }
            if (!seen.add(address) || poolAddressRepository.existsById(address)) {
                skipped++;
                continue;
            }
            try {
                poolAddressRepository.insert(PoolAddress.available(address, poolAddressRepository.nextPoolSeq(), now));
                added++;
            } catch (DuplicateKeyException e) {
                skipped++;
            }
        }
        if (added > 0) {
            log.info("Imported {} pool addresses ({} skipped, {} invalid)", added, skipped, errors.size());
        }
        return new ImportResult(added, skipped, errors);
    }

    public PoolStatus poolStatus() {
        long available = poolAddressRepository.countByStatus(AddressStatus.AVAILABLE);
        long assigned = poolAddressRepository.countByStatus(AddressStatus.ASSIGNED);
        long monitoring = poolAddressRepository.countByStatus(AddressStatus.MONITORING);
        long cooldown = poolAddressRepository.countByStatus(AddressStatus.COOLDOWN);
        long total = available + assigned + monitoring + cooldown;
        double utilization = total == 0 ? 0.0 : BigDecimal.valueOf((assigned + monitoring + cooldown) * 100.0 / total)
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue();
        return new PoolStatus(total, available, assigned, monitoring, cooldown, utilization,
                healthOf(available, utilization));
    }

    PoolHealth healthOf(long available, double utilizationPercent) {
        if (available == 0) {
            return PoolHealth.CRITICAL;
        }
        if (available <= poolProperties.getLowWaterMark()) {
            return PoolHealth.WARNING;
        }
        if (utilizationPercent > HIGH_UTILIZATION_PERCENT) {
            return PoolHealth.HIGH_UTILIZATION;
        }
        return PoolHealth.EXCELLENT;
    }

    private Optional<PoolAddress> currentIfHeld(String address, String requestId, AddressStatus expected) {
        return poolAddressRepository.findById(address)
                .filter(a -> a.getStatus() == expected && requestId.equals(a.getAssignedDepositId()));
    }
}
