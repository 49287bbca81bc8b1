package com.depositpool.domain;

import com.depositpool.common.TronTestAddresses;
import com.depositpool.config.MongoConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest(properties = "spring.data.mongodb.auto-index-creation=true")
@Testcontainers(disabledWithoutDocker = true)
@Import(MongoConfig.class)
class PoolAddressRepositoryIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    PoolAddressRepository repository;

    @BeforeEach
    void clean() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("never-released addresses go first (insertion order), then the longest idle")
    void claim_fifoByLastReleasedThenSeq() {
        Instant now = Instant.now();
        PoolAddress reused = PoolAddress.available("TReused", 1, now);
        reused.setLastReleasedAt(now.minusSeconds(3600));
        repository.insert(reused);
        PoolAddress recentlyReused = PoolAddress.available("TRecent", 2, now);
        recentlyReused.setLastReleasedAt(now.minusSeconds(60));
        repository.insert(recentlyReused);
        repository.insert(PoolAddress.available("TFresh2", 4, now));
        repository.insert(PoolAddress.available("TFresh1", 3, now));

        List<String> order = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            order.add(repository.claimNextAvailable("dep-" + i, now).orElseThrow().getAddress());
        }

        assertThat(order).containsExactly("TFresh1", "TFresh2", "TReused", "TRecent");
        assertThat(repository.claimNextAvailable("dep-x", now)).isEmpty();
    }

    @Test
    @DisplayName("concurrent allocation never hands one address to two deposits")
    void claim_concurrentCallers_noCollisions() throws Exception {
        int addresses = 40;
        int workers = 16;
        int attemptsPerWorker = 5;
        Instant now = Instant.now();
        List<String> pool = TronTestAddresses.random(addresses);
        for (int i = 0; i < pool.size(); i++) {
            repository.insert(PoolAddress.available(pool.get(i), i, now));
        }

        ExecutorService executor = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        Set<String> claimedBy = ConcurrentHashMap.newKeySet();
        List<Future<List<String>>> results = new ArrayList<>();
        try {
            for (int w = 0; w < workers; w++) {
                int worker = w;
                Callable<List<String>> task = () -> {
                    start.await();
                    List<String> got = new ArrayList<>();
                    for (int a = 0; a < attemptsPerWorker; a++) {
                        String depositId = "dep-" + worker + "-" + a;
                        Optional<PoolAddress> claimed = repository.claimNextAvailable(depositId, Instant.now());
                        claimed.ifPresent(c -> {
                            assertThat(c.getAssignedDepositId()).isEqualTo(depositId);
                            claimedBy.add(depositId);
                            got.add(c.getAddress());
                        });
                    }
                    return got;
                };
                results.add(executor.submit(task));
            }
            start.countDown();
            List<String> all = new ArrayList<>();
            for (Future<List<String>> f : results) {
                all.addAll(f.get(60, TimeUnit.SECONDS));
            }

            assertThat(all).hasSize(addresses).doesNotHaveDuplicates();
            assertThat(claimedBy).hasSize(addresses);
            assertThat(repository.countByStatus(AddressStatus.AVAILABLE)).isZero();
            assertThat(repository.countByStatus(AddressStatus.ASSIGNED)).isEqualTo(addresses);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("full lifecycle ASSIGNED → MONITORING → COOLDOWN → AVAILABLE with holder checks")
    void lifecycleTransitions() {
        Instant now = Instant.now();
        repository.insert(PoolAddress.available("TLife", 1, now));
        repository.claimNextAvailable("dep-1", now).orElseThrow();

        assertThat(repository.markMonitoring("TLife", "dep-other")).isEmpty();
        assertThat(repository.markMonitoring("TLife", "dep-1")).get()
                .extracting(PoolAddress::getStatus).isEqualTo(AddressStatus.MONITORING);
        assertThat(repository.markAvailable("TLife", now)).isEmpty();

        Instant until = now.plusSeconds(60);
        assertThat(repository.markCooldown("TLife", "dep-1", until)).get()
                .extracting(PoolAddress::getStatus).isEqualTo(AddressStatus.COOLDOWN);
        assertThat(repository.findByStatusAndCooldownUntilLessThanEqual(AddressStatus.COOLDOWN, now)).isEmpty();
        assertThat(repository.findByStatusAndCooldownUntilLessThanEqual(AddressStatus.COOLDOWN, until))
                .extracting(PoolAddress::getAddress).containsExactly("TLife");

        PoolAddress before = repository.markAvailable("TLife", until).orElseThrow();
        assertThat(before.getAssignedDepositId()).isEqualTo("dep-1");

        PoolAddress after = repository.findById("TLife").orElseThrow();
        assertThat(after.getStatus()).isEqualTo(AddressStatus.AVAILABLE);
        assertThat(after.getAssignedDepositId()).isNull();
        assertThat(after.getCooldownUntil()).isNull();
        assertThat(after.getLastReleasedAt()).isNotNull();
        assertThat(after.getUsageCount()).isEqualTo(1);
    }

    @Test
    void nextPoolSeq_increments() {
        long first = repository.nextPoolSeq();
        long second = repository.nextPoolSeq();
        assertThat(second).isEqualTo(first + 1);
    }
}
