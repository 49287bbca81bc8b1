package com.depositpool.deposit;

import com.depositpool.chain.ChainClient;
import com.depositpool.chain.ChainTransactionObservation;
import com.depositpool.common.TronTestAddresses;
import com.depositpool.domain.AddressStatus;
import com.depositpool.domain.DepositEventType;
import com.depositpool.domain.DepositLifecycleEvent;
import com.depositpool.domain.DepositState;
import com.depositpool.domain.PoolAddress;
import com.depositpool.domain.PoolAddressRepository;
import com.depositpool.monitor.DepositMonitor;
import com.depositpool.pool.AddressGenerator;
import com.depositpool.pool.PoolManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.event.EventListener;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Request → confirm → cooldown → release against a real MongoDB, with the chain and the address
 * generator mocked. Scheduled jobs are pushed out to an hour so the test drives every step itself.
 */
@SpringBootTest(properties = {
        "depositpool.monitor.poll-interval=PT1H",
        "depositpool.pool.replenish-interval=PT1H",
        "depositpool.monitor.confirmation-threshold=3",
        "depositpool.pool.cooldown=PT0S",
        "depositpool.pool.min-size=1"
})
@Testcontainers(disabledWithoutDocker = true)
class DepositFlowIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @MockBean
    ChainClient chainClient;
    @MockBean
    AddressGenerator addressGenerator;

    @Autowired
    DepositService depositService;
    @Autowired
    DepositMonitor depositMonitor;
    @Autowired
    PoolManager poolManager;
    @Autowired
    PoolAddressRepository poolAddressRepository;
    @Autowired
    EventCollector eventCollector;

    @Test
    void depositLifecycle_endToEnd() {
        String address = TronTestAddresses.random();
        poolManager.addAddresses(List.of(address));

        DepositTicket ticket = depositService.requestDeposit(new BigDecimal("25"), "usdt");
        assertThat(ticket.address()).isEqualTo(address);
        assertThat(poolAddressRepository.findById(address).orElseThrow().getStatus())
                .isEqualTo(AddressStatus.MONITORING);

        when(chainClient.fetchTransactions(eq(address), any())).thenReturn(List.of(
                new ChainTransactionObservation("tx-1", address, "USDT", new BigDecimal("25"),
                        100L, 3, Instant.now())));
        depositMonitor.pollDeposit(ticket.requestId());

        DepositStatusView status = depositService.getDepositStatus(ticket.requestId());
        assertThat(status.state()).isEqualTo(DepositState.CONFIRMED);
        assertThat(status.receivedAmount()).isEqualByComparingTo("25");
        assertThat(status.confirmationsObserved()).isEqualTo(3);
        assertThat(poolAddressRepository.findById(address).orElseThrow().getStatus())
                .isEqualTo(AddressStatus.COOLDOWN);

        assertThat(depositMonitor.releaseCooledDown()).isEqualTo(1);
        PoolAddress released = poolAddressRepository.findById(address).orElseThrow();
        assertThat(released.getStatus()).isEqualTo(AddressStatus.AVAILABLE);
        assertThat(released.getAssignedDepositId()).isNull();

        assertThat(eventCollector.typesFor(ticket.requestId())).containsExactly(
                DepositEventType.ADDRESS_ASSIGNED,
                DepositEventType.DEPOSIT_CONFIRMED,
                DepositEventType.ADDRESS_RELEASED);
    }

    @TestConfiguration
    static class EventCollectorConfig {
        @Bean
        EventCollector eventCollector() {
            return new EventCollector();
        }
    }

    static class EventCollector {
        private final List<DepositLifecycleEvent> events = new CopyOnWriteArrayList<>();

        @EventListener
        public void on(DepositLifecycleEvent event) {
            events.add(event);
        }

        List<DepositEventType> typesFor(String depositId) {
            return events.stream()
                    .filter(e -> e.depositId().equals(depositId))
                    .map(DepositLifecycleEvent::type)
                    .toList();
        }
    }
}
