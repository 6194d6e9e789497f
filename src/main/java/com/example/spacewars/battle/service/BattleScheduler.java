package com.example.spacewars.battle.service;

import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.config.GameProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 고정 주기로 모든 활성 배틀을 진행시키는 드라이버
 * 틱마다 빈 컨텍스트에서 시작하므로 API 요청과 같은 락 규칙으로 경쟁한다.
 * stop()은 실행 중인 틱이 끝날 때까지 기다린 뒤 반환한다.
 */
@Slf4j
@Component
public class BattleScheduler {

    private final BattleService battleService;
    private final TaskScheduler taskScheduler;
    private final GameProperties properties;
    private final Clock clock;

    private static final long STOP_AWAIT_SECONDS = 10;

    private final ReentrantLock tickInProgress = new ReentrantLock();
    private ScheduledFuture<?> scheduledTick;

    public BattleScheduler(BattleService battleService, TaskScheduler taskScheduler,
                           GameProperties properties, Clock clock) {
        this.battleService = battleService;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    public synchronized void start() {
        if (scheduledTick != null) {
            return;
        }
        Duration interval = Duration.ofMillis(properties.battle().tickIntervalMs());
        scheduledTick = taskScheduler.scheduleAtFixedRate(this::tick, interval);
        log.info("배틀 스케줄러 시작: interval={}ms", interval.toMillis());
    }

    public synchronized void stop() {
        if (scheduledTick != null) {
            scheduledTick.cancel(false);
            scheduledTick = null;
            awaitInFlightTick();
            log.info("배틀 스케줄러 중지");
        }
    }

    private void awaitInFlightTick() {
        try {
            if (tickInProgress.tryLock(STOP_AWAIT_SECONDS, TimeUnit.SECONDS)) {
                tickInProgress.unlock();
            } else {
                log.warn("실행 중인 배틀 틱이 {}초 안에 끝나지 않았습니다", STOP_AWAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("배틀 틱 종료 대기 중 인터럽트");
        }
    }

    public synchronized boolean isRunning() {
        return scheduledTick != null;
    }

    public TickReport tick() {
        tickInProgress.lock();
        try {
            TickReport report = battleService.advanceBattles(LockContext.empty(), clock.millis());
            if (!report.resolved().isEmpty() || report.failures() > 0) {
                log.info("배틀 틱: processed={}, shots={}, resolved={}, failures={}",
                        report.battlesProcessed(), report.shotsFired(), report.resolved().size(), report.failures());
            }
            return report;
        } catch (Exception e) {
            log.error("배틀 틱 실행 중 오류", e);
            return new TickReport(0, 0, 1, List.of());
        } finally {
            tickInProgress.unlock();
        }
    }
}
