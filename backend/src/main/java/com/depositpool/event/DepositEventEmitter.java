package com.depositpool.event;

import com.depositpool.domain.DepositEventRecord;
import com.depositpool.domain.DepositEventRecordRepository;
import com.depositpool.domain.DepositEventType;
import com.depositpool.domain.DepositLifecycleEvent;
import com.depositpool.domain.DepositRequest;
import com.depositpool.domain.DepositRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Publishes deposit lifecycle events to in-process listeners, at least once per (deposit, type).
 * <p>
 * The first emit freezes the payload in deposit_events; later emits of the same pair republish that payload until
 * one delivery succeeds, then become no-ops. After a successful delivery the type is pulled from the deposit's outbox.
 * A listener failure is recorded on the event row and leaves the outbox entry for {@link EventOutboxRelayJob}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DepositEventEmitter {

    private final DepositEventRecordRepository eventRecordRepository;
    private final DepositRequestRepository depositRequestRepository;
    private final ApplicationEventPublisher applicationEventPublisher;

    public boolean emit(DepositEventType type, DepositRequest deposit) {
        return emit(DepositLifecycleEvent.of(type, deposit, Instant.now()));
    }

    /**
     * @return true when the event is delivered (now or earlier)
     */
    public boolean emit(DepositLifecycleEvent event) {
        DepositEventRecord record = recordFor(event);
        if (record.isDelivered()) {
            log.debug("Event {} already delivered", record.getId());
            depositRequestRepository.removeUnpublishedEvent(record.getDepositId(), record.getType());
            return true;
        }
        record.setDeliveryAttempts(record.getDeliveryAttempts() + 1);
        try {
            applicationEventPublisher.publishEvent(record.toEvent());
        } catch (Exception e) {
            record.setLastError(e.getMessage());
            eventRecordRepository.save(record);
            log.warn("Delivery of {} failed (attempt {}): {}", record.getId(), record.getDeliveryAttempts(),
                    e.getMessage());
            return false;
        }
        record.setDelivered(true);
        record.setDeliveredAt(Instant.now());
        record.setLastError(null);
        eventRecordRepository.save(record);
        depositRequestRepository.removeUnpublishedEvent(record.getDepositId(), record.getType());
        log.info("Emitted {} for deposit {} ({})", record.getType(), record.getDepositId(), record.getAddress());
        return true;
    }

    private DepositEventRecord recordFor(DepositLifecycleEvent event) {
        return eventRecordRepository.findByDepositIdAndType(event.depositId(), event.type())
                .orElseGet(() -> {
                    try {
                        return eventRecordRepository.insert(DepositEventRecord.from(event));
                    } catch (DuplicateKeyException e) {
                        return eventRecordRepository.findByDepositIdAndType(event.depositId(), event.type())
                                .orElseThrow(() -> e);
                    }
                });
    }
}
