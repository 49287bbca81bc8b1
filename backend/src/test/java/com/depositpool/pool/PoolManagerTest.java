package com.depositpool.pool;

import com.depositpool.common.TronTestAddresses;
import com.depositpool.domain.AddressStatus;
import com.depositpool.domain.PoolAddress;
import com.depositpool.domain.PoolAddressRepository;
import com.depositpool.domain.PoolExhaustedEvent;
import com.depositpool.pool.config.PoolProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PoolManagerTest {

    @Mock
    private PoolAddressRepository repository;
    @Mock
    private AddressGenerator addressGenerator;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private PoolProperties properties;
    private PoolManager poolManager;

    @BeforeEach
    void setUp() {
        properties = new PoolProperties();
        properties.setMinSize(5);
        properties.setLowWaterMark(2);
        properties.setCooldown(Duration.ofHours(24));
        properties.setOrphanGrace(Duration.ofMinutes(5));
        properties.setReplenishInterval(Duration.ofMinutes(5));
        poolManager = new PoolManager(repository, properties, addressGenerator, eventPublisher);
    }

    @Test
    void allocate_returnsClaimedAddress() {
        PoolAddress claimed = held("TADDR", "dep-1", AddressStatus.ASSIGNED);
        when(repository.claimNextAvailable(eq("dep-1"), any(Instant.class))).thenReturn(Optional.of(claimed));

        assertThat(poolManager.allocate("dep-1")).isSameAs(claimed);
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("empty pool reports exhaustion and requests a replenish")
    void allocate_exhausted() {
        when(repository.claimNextAvailable(eq("dep-1"), any(Instant.class))).thenReturn(Optional.empty());

        assertThatThrownBy(() -> poolManager.allocate("dep-1")).isInstanceOf(PoolExhaustedException.class);
        verify(eventPublisher).publishEvent(new PoolExhaustedEvent("dep-1"));
    }

    @Test
    void beginMonitoring_repeatForSameDeposit_isNoOp() {
        PoolAddress monitoring = held("TADDR", "dep-1", AddressStatus.MONITORING);
        when(repository.markMonitoring("TADDR", "dep-1")).thenReturn(Optional.empty());
        when(repository.findById("TADDR")).thenReturn(Optional.of(monitoring));

        assertThat(poolManager.beginMonitoring("TADDR", "dep-1")).isSameAs(monitoring);
    }

    @Test
    void beginMonitoring_heldByOtherDeposit_throws() {
        when(repository.markMonitoring("TADDR", "dep-1")).thenReturn(Optional.empty());
        when(repository.findById("TADDR")).thenReturn(Optional.of(held("TADDR", "dep-2", AddressStatus.MONITORING)));

        assertThatThrownBy(() -> poolManager.beginMonitoring("TADDR", "dep-1"))
                .isInstanceOf(NotAssignedException.class);
    }

    @Test
    void beginCooldown_setsCooldownUntilFromConfig() {
        PoolAddress cooling = held("TADDR", "dep-1", AddressStatus.COOLDOWN);
        ArgumentCaptor<Instant> until = ArgumentCaptor.forClass(Instant.class);
        when(repository.markCooldown(eq("TADDR"), eq("dep-1"), until.capture())).thenReturn(Optional.of(cooling));

        Instant before = Instant.now();
        poolManager.beginCooldown("TADDR", "dep-1");

        assertThat(until.getValue()).isBetween(before.plus(Duration.ofHours(24)),
                Instant.now().plus(Duration.ofHours(24)));
    }

    @Test
    void beginCooldown_alreadyCoolingForSameDeposit_isNoOp() {
        PoolAddress cooling = held("TADDR", "dep-1", AddressStatus.COOLDOWN);
        when(repository.markCooldown(eq("TADDR"), eq("dep-1"), any(Instant.class))).thenReturn(Optional.empty());
        when(repository.findById("TADDR")).thenReturn(Optional.of(cooling));

        assertThat(poolManager.beginCooldown("TADDR", "dep-1")).isSameAs(cooling);
    }

    @Test
    void release_notInCooldown_throws() {
        when(repository.markAvailable(eq("TADDR"), any(Instant.class))).thenReturn(Optional.empty());

        assertThatThrownBy(() -> poolManager.release("TADDR")).isInstanceOf(NotAssignedException.class);
    }

    @Test
    void release_returnsPreviousHolder() {
        when(repository.markAvailable(eq("TADDR"), any(Instant.class)))
                .thenReturn(Optional.of(held("TADDR", "dep-1", AddressStatus.COOLDOWN)));

        assertThat(poolManager.release("TADDR").getAssignedDepositId()).isEqualTo("dep-1");
    }

    @Test
    @DisplayName("replenish asks the generator for the shortfall and inserts new addresses as AVAILABLE")
    void replenish_topsUpToMinimum() {
        List<String> fresh = TronTestAddresses.random(2);
        when(repository.countByStatus(AddressStatus.AVAILABLE)).thenReturn(3L);
        when(addressGenerator.generate(2)).thenReturn(fresh);
        when(repository.existsById(anyString())).thenReturn(false);
        when(repository.nextPoolSeq()).thenReturn(10L, 11L);

        assertThat(poolManager.replenish()).isEqualTo(2);

        ArgumentCaptor<PoolAddress> inserted = ArgumentCaptor.forClass(PoolAddress.class);
        verify(repository, times(2)).insert(inserted.capture());
        assertThat(inserted.getAllValues())
                .extracting(PoolAddress::getAddress, PoolAddress::getStatus, PoolAddress::getPoolSeq)
                .containsExactly(
                        tuple(fresh.get(0), AddressStatus.AVAILABLE, 10L),
                        tuple(fresh.get(1), AddressStatus.AVAILABLE, 11L));
    }

    @Test
    void replenish_atMinimum_doesNothing() {
        when(repository.countByStatus(AddressStatus.AVAILABLE)).thenReturn(5L);

        assertThat(poolManager.replenish()).isZero();
        verify(addressGenerator, never()).generate(anyInt());
    }

    @Test
    void replenish_generatorFailure_isLoggedNotThrown() {
        when(repository.countByStatus(AddressStatus.AVAILABLE)).thenReturn(0L);
        when(addressGenerator.generate(5)).thenThrow(new AddressGenerationException("down"));

        assertThat(poolManager.replenish()).isZero();
        verify(repository, never()).insert(any(PoolAddress.class));
    }

    @Test
    @DisplayName("import skips duplicates and existing addresses and reports invalid ones")
    void addAddresses_validatesAndDeduplicates() {
        String fresh = TronTestAddresses.random();
        String existing = TronTestAddresses.random();
        when(repository.existsById(fresh)).thenReturn(false);
        when(repository.existsById(existing)).thenReturn(true);
        when(repository.nextPoolSeq()).thenReturn(1L);

        ImportResult result = poolManager.addAddresses(Arrays.asList(fresh, " " + fresh + " ", existing, "not-an-address", null));

        assertThat(result.added()).isEqualTo(1);
        assertThat(result.skipped()).isEqualTo(2);
        assertThat(result.errors()).hasSize(2);
        verify(repository, times(1)).insert(any(PoolAddress.class));
    }

    @Test
    void poolStatus_countsAndUtilization() {
        when(repository.countByStatus(AddressStatus.AVAILABLE)).thenReturn(6L);
        when(repository.countByStatus(AddressStatus.ASSIGNED)).thenReturn(1L);
        when(repository.countByStatus(AddressStatus.MONITORING)).thenReturn(2L);
        when(repository.countByStatus(AddressStatus.COOLDOWN)).thenReturn(1L);

        PoolStatus status = poolManager.poolStatus();

        assertThat(status.total()).isEqualTo(10);
        assertThat(status.available()).isEqualTo(6);
        assertThat(status.utilizationPercent()).isEqualTo(40.0);
        assertThat(status.health()).isEqualTo(PoolHealth.EXCELLENT);
    }

    @Test
    void healthOf_thresholds() {
        assertThat(poolManager.healthOf(0, 100.0)).isEqualTo(PoolHealth.CRITICAL);
        assertThat(poolManager.healthOf(2, 95.0)).isEqualTo(PoolHealth.WARNING);
        assertThat(poolManager.healthOf(3, 95.0)).isEqualTo(PoolHealth.HIGH_UTILIZATION);
        assertThat(poolManager.healthOf(3, 90.0)).isEqualTo(PoolHealth.EXCELLENT);
    }

    private static PoolAddress held(String address, String depositId, AddressStatus status) {
        PoolAddress a = PoolAddress.available(address, 1L, Instant.now());
        a.setStatus(status);
        a.setAssignedDepositId(depositId);
        a.setAssignedAt(Instant.now());
        return a;
    }
}
