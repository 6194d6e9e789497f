package com.example.spacewars.battle.service;

import com.example.spacewars.global.config.GameProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/**
 * 패배한 함선의 재배치 위치 계산
 *
 * 월드 전체에서 균등 난수로 뽑되 승자 위치로부터 최소 거리 이상이어야 한다.
 * 정해진 횟수 안에 조건을 만족하지 못하면 승자 반대편 모서리로 고정 배치한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TeleportPlanner {

    private final GameProperties properties;

    public record Position(double x, double y) {

        public double distanceTo(double otherX, double otherY) {
            return Math.hypot(x - otherX, y - otherY);
        }
    }

    public Position plan(double fromX, double fromY, double worldWidth, double worldHeight) {
        return plan(fromX, fromY, worldWidth, worldHeight,
                properties.battle().minTeleportDistance(),
                properties.battle().teleportMaxAttempts(),
                ThreadLocalRandom.current());
    }

    public Position plan(double fromX, double fromY, double worldWidth, double worldHeight,
                         double minDistance, int maxAttempts, RandomGenerator random) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            Position candidate = new Position(random.nextDouble() * worldWidth, random.nextDouble() * worldHeight);
            if (candidate.distanceTo(fromX, fromY) >= minDistance) {
                return candidate;
            }
        }
        Position fallback = oppositeCorner(fromX, fromY, worldWidth, worldHeight);
        log.info("텔레포트 위치 탐색 {}회 실패, 반대편 모서리로 배치: ({}, {})", maxAttempts, fallback.x(), fallback.y());
        return fallback;
    }

    public static Position oppositeCorner(double fromX, double fromY, double worldWidth, double worldHeight) {
        double x = fromX > worldWidth / 2 ? 0 : worldWidth;
        double y = fromY > worldHeight / 2 ? 0 : worldHeight;
        return new Position(x, y);
    }
}
