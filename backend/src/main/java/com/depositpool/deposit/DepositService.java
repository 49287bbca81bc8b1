package com.depositpool.deposit;

import com.depositpool.chain.config.ChainProperties;
import com.depositpool.deposit.config.DepositProperties;
import com.depositpool.domain.DepositEventType;
import com.depositpool.domain.DepositRequest;
import com.depositpool.domain.DepositRequestRepository;
import com.depositpool.domain.DepositState;
import com.depositpool.domain.PoolAddress;
import com.depositpool.event.DepositEventEmitter;
import com.depositpool.monitor.DepositMonitor;
import com.depositpool.monitor.config.MonitorProperties;
import com.depositpool.pool.NotAssignedException;
import com.depositpool.pool.PoolManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Inbound operations: request a deposit address and read a deposit's status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DepositService {

    private final PoolManager poolManager;
    private final DepositMonitor depositMonitor;
    private final DepositRequestRepository depositRequestRepository;
    private final DepositEventEmitter eventEmitter;
    private final DepositProperties depositProperties;
    private final MonitorProperties monitorProperties;
    private final ChainProperties chainProperties;

    /**
     * Validates the request, allocates an address and starts monitoring it.
     *
     * @throws DepositRequestException                    invalid amount or unsupported currency
     * @throws com.depositpool.pool.PoolExhaustedException no address available
     */
    public DepositTicket requestDeposit(BigDecimal amount, String currency) {
        String asset = normalizeCurrency(currency);
        validateAmount(amount, chainProperties.getAssets().get(asset).getDecimals());

        String requestId = UUID.randomUUID().toString();
        PoolAddress address = poolManager.allocate(requestId);

        Instant now = Instant.now();
        DepositRequest deposit = new DepositRequest();
        deposit.setId(requestId);
        deposit.setRequestedAmount(amount);
        deposit.setCurrency(asset);
        deposit.setAddress(address.getAddress());
        deposit.setState(DepositState.PENDING);
        deposit.setCreatedAt(now);
        deposit.setExpiresAt(now.plus(monitorProperties.getExpiry()));
        deposit.setUnpublishedEvents(new ArrayList<>(List.of(DepositEventType.ADDRESS_ASSIGNED)));

        DepositRequest saved;
        try {
            saved = depositRequestRepository.insert(deposit);
        } catch (RuntimeException e) {
            log.warn("Saving deposit {} failed; returning {} to the pool via cooldown", requestId, address.getAddress());
            try {
                poolManager.beginCooldown(address.getAddress(), requestId);
            } catch (NotAssignedException nae) {
                e.addSuppressed(nae);
            }
            throw e;
        }

        try {
            depositMonitor.watch(saved);
        } catch (NotAssignedException e) {
            // stays ASSIGNED; the monitor's reclaim pass switches it to MONITORING
            log.warn("Could not start monitoring {} for deposit {}: {}", address.getAddress(), requestId, e.getMessage());
        }
        eventEmitter.emit(DepositEventType.ADDRESS_ASSIGNED, saved);
        log.info("Deposit {} requested: {} {} to {} until {}", requestId, amount, asset, address.getAddress(),
                saved.getExpiresAt());
        return new DepositTicket(saved.getAddress(), requestId, saved.getExpiresAt());
    }

    /**
     * Current status; an overdue deposit is expired on read so the caller never sees a stale PENDING.
     *
     * @throws DepositNotFoundException unknown request id
     */
    public DepositStatusView getDepositStatus(String requestId) {
        DepositRequest deposit = depositMonitor.expireIfOverdue(requestId)
                .orElseThrow(() -> new DepositNotFoundException(requestId));
        return new DepositStatusView(
                deposit.getId(),
                deposit.getState(),
                deposit.getConfirmationsObserved(),
                monitorProperties.getConfirmationThreshold(),
                deposit.getRequestedAmount(),
                deposit.getReceivedAmount(),
                deposit.getCurrency(),
                deposit.getAddress(),
                deposit.getExpiresAt());
    }

    private String normalizeCurrency(String currency) {
        String asset = currency != null ? currency.trim().toUpperCase(Locale.ROOT) : "";
        if (!chainProperties.getAssets().containsKey(asset)) {
            throw new DepositRequestException(DepositRequestException.ErrorCode.UNSUPPORTED_CURRENCY,
                    "Unsupported currency: " + currency + "; accepted: " + chainProperties.getAssets().keySet());
        }
        return asset;
    }

    private void validateAmount(BigDecimal amount, int decimals) {
        if (amount == null || amount.signum() <= 0) {
            throw new DepositRequestException(DepositRequestException.ErrorCode.INVALID_AMOUNT,
                    "Amount must be positive");
        }
        if (amount.stripTrailingZeros().scale() > decimals) {
            throw new DepositRequestException(DepositRequestException.ErrorCode.INVALID_AMOUNT,
                    "Amount " + amount.toPlainString() + " has more than " + decimals + " decimal places");
        }
        if (amount.compareTo(depositProperties.getMinAmount()) < 0) {
            throw new DepositRequestException(DepositRequestException.ErrorCode.AMOUNT_TOO_SMALL,
                    "Amount " + amount + " is below the minimum " + depositProperties.getMinAmount());
        }
        if (amount.compareTo(depositProperties.getMaxAmount()) > 0) {
            throw new DepositRequestException(DepositRequestException.ErrorCode.AMOUNT_TOO_LARGE,
                    "Amount " + amount + " is above the maximum " + depositProperties.getMaxAmount());
        }
    }
}
