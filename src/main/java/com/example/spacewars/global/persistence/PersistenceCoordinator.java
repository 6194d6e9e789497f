package com.example.spacewars.global.persistence;

import com.example.spacewars.global.cache.CacheStats;
import com.example.spacewars.global.cache.FlushResult;
import com.example.spacewars.global.cache.FlushableCache;
import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.config.GameProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * 모든 캐시의 write-behind 플러시 담당
 *
 * 종류별로 새 컨텍스트에서 가드 레벨 오름차순으로 플러시한다.
 * 한 종류의 실패는 로그만 남기고 다음 종류로 진행 (서비스에 치명적이지 않음).
 */
@Slf4j
@Component
public class PersistenceCoordinator {

    private final List<FlushableCache> caches;
    private final TaskScheduler taskScheduler;
    private final GameProperties properties;

    private ScheduledFuture<?> scheduledFlush;

    public PersistenceCoordinator(List<FlushableCache> caches, TaskScheduler taskScheduler, GameProperties properties) {
        List<FlushableCache> ordered = new ArrayList<>(caches);
        ordered.sort(Comparator.comparing(FlushableCache::kind));
        this.caches = List.copyOf(ordered);
        this.taskScheduler = taskScheduler;
        this.properties = properties;
    }

    public List<FlushResult> flushAll() {
        List<FlushResult> results = new ArrayList<>(caches.size());
        for (FlushableCache cache : caches) {
            try {
                results.add(cache.flush(LockContext.empty()));
            } catch (RuntimeException e) {
                log.error("캐시 플러시 중 오류: kind={}", cache.kind(), e);
                results.add(FlushResult.failedAll(cache.kind(), cache.dirtyCount()));
            }
        }
        return results;
    }

    public synchronized void startAutoPersistence() {
        if (scheduledFlush != null) {
            return;
        }
        Duration interval = Duration.ofMillis(properties.cache().persistenceIntervalMs());
        scheduledFlush = taskScheduler.scheduleAtFixedRate(() -> {
            try {
                flushAll();
            } catch (Exception e) {
                log.error("자동 영속화 실행 중 오류", e);
            }
        }, interval);
        log.info("자동 영속화 시작: interval={}ms", interval.toMillis());
    }

    public synchronized void stopAutoPersistence() {
        if (scheduledFlush != null) {
            scheduledFlush.cancel(false);
            scheduledFlush = null;
            log.info("자동 영속화 중지");
        }
    }

    public synchronized boolean isAutoPersistenceRunning() {
        return scheduledFlush != null;
    }

    public boolean isFullyFlushed() {
        return caches.stream().allMatch(cache -> cache.dirtyCount() == 0);
    }

    public void clearAll() {
        for (FlushableCache cache : caches) {
            cache.clear(LockContext.empty());
        }
    }

    public List<CacheStats> getStats() {
        return caches.stream().map(FlushableCache::getStats).toList();
    }
}
