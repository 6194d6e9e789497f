package com.example.spacewars.global.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 게임 서버 설정
 *
 * <pre>{@code
 * spacewars:
 *   cache:
 *     persistence-interval-ms: 30000
 *     enable-auto-persistence: true
 *   battle:
 *     tick-interval-ms: 1000
 *     scheduler-enabled: true
 *     engagement-range: 100
 *     min-teleport-distance: 1000
 *     teleport-max-attempts: 100
 *   world:
 *     width: 5000
 *     height: 5000
 * }</pre>
 */
@ConfigurationProperties(prefix = "spacewars")
public record GameProperties(
        @DefaultValue CacheSettings cache,
        @DefaultValue BattleSettings battle,
        @DefaultValue WorldSettings world) {

    public record CacheSettings(
            @DefaultValue("30000") long persistenceIntervalMs,
            @DefaultValue("true") boolean enableAutoPersistence) {

        public CacheSettings {
            if (persistenceIntervalMs <= 0) {
                throw new IllegalArgumentException(
                        "spacewars.cache.persistence-interval-ms must be positive, got: " + persistenceIntervalMs);
            }
        }
    }

    public record BattleSettings(
            @DefaultValue("1000") long tickIntervalMs,
            @DefaultValue("true") boolean schedulerEnabled,
            @DefaultValue("100") double engagementRange,
            @DefaultValue("1000") double minTeleportDistance,
            @DefaultValue("100") int teleportMaxAttempts) {

        public BattleSettings {
            if (tickIntervalMs <= 0) {
                throw new IllegalArgumentException(
                        "spacewars.battle.tick-interval-ms must be positive, got: " + tickIntervalMs);
            }
            if (engagementRange <= 0 || minTeleportDistance < 0) {
                throw new IllegalArgumentException("spacewars.battle distances must not be negative");
            }
            if (teleportMaxAttempts <= 0) {
                throw new IllegalArgumentException("spacewars.battle.teleport-max-attempts must be positive");
            }
        }
    }

    public record WorldSettings(
            @DefaultValue("5000") double width,
            @DefaultValue("5000") double height) {

        public WorldSettings {
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("spacewars.world size must be positive");
            }
        }
    }

    /**
     * 기본값만으로 구성된 설정. 스프링 컨텍스트 없이 조립하는 코드용.
     */
    public static GameProperties defaults() {
        return new GameProperties(
                new CacheSettings(30000, true),
                new BattleSettings(1000, true, 100, 1000, 100),
                new WorldSettings(5000, 5000));
    }
}
