package com.example.spacewars.global.persistence;

import com.example.spacewars.global.cache.CacheStats;
import com.example.spacewars.global.cache.FlushResult;
import com.example.spacewars.global.cache.FlushableCache;
import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.config.GameProperties;
import com.example.spacewars.support.GameFixture;
import com.example.spacewars.user.dto.response.UserResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PersistenceCoordinatorTest {

    private GameFixture fixture;
    private ThreadPoolTaskScheduler taskScheduler;

    @BeforeEach
    void setUp() {
        fixture = new GameFixture();
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("test-persistence-");
        taskScheduler.initialize();
    }

    @AfterEach
    void tearDown() {
        taskScheduler.shutdown();
    }

    @Test
    @DisplayName("플러시는 등록 순서와 무관하게 가드 레벨 오름차순으로 진행된다")
    void flushAllRunsInGuardLevelOrder() {
        // given
        UserResponse user = fixture.createUserAt("alpha", 100, 100);
        PersistenceCoordinator coordinator = fixture.persistenceCoordinator(taskScheduler);

        // when
        List<FlushResult> results = coordinator.flushAll();

        // then
        assertThat(results).extracting(FlushResult::kind)
                .containsExactly(EntityKind.BATTLE, EntityKind.USER, EntityKind.WORLD, EntityKind.MESSAGE);
        assertThat(results).allMatch(FlushResult::isComplete);
        assertThat(coordinator.isFullyFlushed()).isTrue();
        assertThat(fixture.messageStore.rowsFor(user.id())).hasSize(1);
    }

    @Test
    @DisplayName("한 종류의 플러시가 실패해도 나머지 종류는 계속 플러시된다")
    void failureInOneKindDoesNotStopOthers() {
        // given
        UserResponse user = fixture.createUserAt("alpha", 100, 100);
        fixture.worldStore.failures().failAlways(true);
        List<FlushableCache> caches = new ArrayList<>(fixture.caches());
        caches.add(new ExplodingCache());
        PersistenceCoordinator coordinator = new PersistenceCoordinator(caches, taskScheduler, fixture.properties);

        // when
        List<FlushResult> results = coordinator.flushAll();

        // then
        assertThat(results).hasSize(5);
        FlushResult world = results.stream().filter(r -> r.kind() == EntityKind.WORLD && r.failed() == 1)
                .findFirst().orElseThrow();
        assertThat(world.isComplete()).isFalse();
        assertThat(fixture.userCache.isDirty(user.id())).isFalse();
        assertThat(fixture.messageStore.rowsFor(user.id())).hasSize(1);
        assertThat(coordinator.isFullyFlushed()).isFalse();
    }

    @Test
    @DisplayName("자동 영속화는 주기적으로 dirty 엔티티를 저장하고 중지할 수 있다")
    void autoPersistenceFlushesPeriodically() throws Exception {
        // given
        GameProperties fastFlush = new GameProperties(
                new GameProperties.CacheSettings(20, true),
                fixture.properties.battle(),
                fixture.properties.world());
        PersistenceCoordinator coordinator = new PersistenceCoordinator(fixture.caches(), taskScheduler, fastFlush);
        fixture.createUserAt("alpha", 100, 100);
        assertThat(coordinator.isFullyFlushed()).isFalse();

        // when
        coordinator.startAutoPersistence();
        coordinator.startAutoPersistence();

        // then
        long deadline = System.currentTimeMillis() + 5000;
        while (!coordinator.isFullyFlushed() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(coordinator.isFullyFlushed()).isTrue();
        assertThat(coordinator.isAutoPersistenceRunning()).isTrue();

        coordinator.stopAutoPersistence();
        assertThat(coordinator.isAutoPersistenceRunning()).isFalse();
    }

    @Test
    @DisplayName("clearAll 후 통계의 캐시 크기는 0이다")
    void clearAllEmptiesCaches() {
        fixture.createUserAt("alpha", 100, 100);
        PersistenceCoordinator coordinator = fixture.persistenceCoordinator(taskScheduler);
        coordinator.flushAll();

        coordinator.clearAll();

        assertThat(coordinator.getStats()).extracting(CacheStats::size).containsOnly(0);
    }

    /**
     * flush 자체가 예외를 던지는 캐시
     */
    private static class ExplodingCache implements FlushableCache {

        @Override
        public EntityKind kind() {
            return EntityKind.MESSAGE;
        }

        @Override
        public FlushResult flush(LockContext ctx) {
            throw new IllegalStateException("플러시 폭발");
        }

        @Override
        public int dirtyCount() {
            return 2;
        }

        @Override
        public void clear(LockContext ctx) {
        }

        @Override
        public CacheStats getStats() {
            return new CacheStats(EntityKind.MESSAGE, 0, 2, 0, 0);
        }
    }
}
