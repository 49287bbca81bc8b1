package com.depositpool.event;

import com.depositpool.domain.AddressStatus;
import com.depositpool.domain.DepositEventType;
import com.depositpool.domain.DepositRequest;
import com.depositpool.domain.DepositRequestRepository;
import com.depositpool.domain.PoolAddressRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Re-emits events left in deposit outboxes by a crash or a failing listener.
 * ADDRESS_RELEASED is only relayed once the address is no longer held by that deposit; until then the
 * monitor's release pass owns it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventOutboxRelayJob {

    static final int BATCH_SIZE = 200;

    private final DepositRequestRepository depositRequestRepository;
    private final PoolAddressRepository poolAddressRepository;
    private final DepositEventEmitter eventEmitter;

    @Scheduled(fixedDelayString = "${depositpool.monitor.poll-interval}")
    public void relay() {
        List<DepositRequest> pending = depositRequestRepository.findWithUnpublishedEvents(BATCH_SIZE);
        for (DepositRequest deposit : pending) {
            try {
                relay(deposit);
            } catch (Exception e) {
                log.warn("Outbox relay failed for deposit {}: {}", deposit.getId(), e.getMessage());
            }
        }
    }

    void relay(DepositRequest deposit) {
        for (DepositEventType type : List.copyOf(deposit.getUnpublishedEvents())) {
            if (type == DepositEventType.ADDRESS_RELEASED && stillHeldBy(deposit)) {
                continue;
            }
            log.debug("Relaying {} for deposit {}", type, deposit.getId());
            eventEmitter.emit(type, deposit);
        }
    }

    private boolean stillHeldBy(DepositRequest deposit) {
        return poolAddressRepository.findById(deposit.getAddress())
                .filter(a -> a.getStatus() != AddressStatus.AVAILABLE)
                .filter(a -> deposit.getId().equals(a.getAssignedDepositId()))
                .isPresent();
    }
}
