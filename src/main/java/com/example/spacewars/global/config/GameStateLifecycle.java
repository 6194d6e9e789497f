package com.example.spacewars.global.config;

import com.example.spacewars.battle.service.BattleScheduler;
import com.example.spacewars.battle.service.BattleService;
import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.persistence.PersistenceCoordinator;
import com.example.spacewars.world.service.WorldService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 게임 상태 초기화/종료
 *
 * 시작: 월드 로드 -> 진행 중 배틀 복원 -> 자동 영속화 -> 배틀 스케줄러
 * 종료: 배틀 스케줄러 중지 -> 자동 영속화 중지 -> 최종 플러시 -> (모두 저장된 경우에만) 캐시 비우기
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GameStateLifecycle implements ApplicationRunner {

    private final WorldService worldService;
    private final BattleService battleService;
    private final PersistenceCoordinator persistenceCoordinator;
    private final BattleScheduler battleScheduler;
    private final GameProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        initialize();
    }

    public void initialize() {
        log.info("▶ 게임 상태 초기화 시작...");
        int objects = worldService.loadWorld(LockContext.empty());
        log.info("▶ 월드 로드 완료: spaceObjects={}", objects);
        int battles = battleService.loadActiveBattles(LockContext.empty());
        log.info("▶ 진행 중 배틀 복원 완료: battles={}", battles);

        if (properties.cache().enableAutoPersistence()) {
            persistenceCoordinator.startAutoPersistence();
        }
        if (properties.battle().schedulerEnabled()) {
            battleScheduler.start();
        }
        log.info("▶ 게임 상태 초기화 완료");
    }

    @PreDestroy
    public void shutdown() {
        log.info("▶ 게임 상태 종료 처리 시작...");
        battleScheduler.stop();
        persistenceCoordinator.stopAutoPersistence();
        persistenceCoordinator.flushAll();
        if (persistenceCoordinator.isFullyFlushed()) {
            persistenceCoordinator.clearAll();
            log.info("▶ 최종 플러시 완료, 캐시 정리");
        } else {
            // 저장 못 한 변경이 남아 있으면 캐시를 비우지 않는다
            log.warn("▶ 저장되지 않은 변경이 남아 있어 캐시를 유지합니다: {}", persistenceCoordinator.getStats());
        }
    }
}
