package com.example.spacewars.battle.domain;

import com.example.spacewars.battle.domain.converter.BattleLogConverter;
import com.example.spacewars.battle.domain.converter.BattleStatsConverter;
import com.example.spacewars.battle.domain.converter.CooldownMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 배틀 엔티티
 *
 * startStats는 생성 시 한 번, endStats는 종료 시 한 번만 기록되는 이력이다.
 * 진행 중 전투의 실제 방어값은 참가 유저 엔티티에 있다.
 * 쿨다운 맵은 무기별 마지막 발사 시각(epoch ms)을 담는다.
 */
@Entity
@Table(name = "battles", indexes = {
        @Index(name = "idx_battles_attacker", columnList = "attackerId"),
        @Index(name = "idx_battles_attackee", columnList = "attackeeId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Battle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long attackerId;

    @Column(nullable = false)
    private Long attackeeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BattleState state;

    @Column(nullable = false)
    private long battleStartTime;

    private Long battleEndTime;

    private Long winnerId;

    private Long loserId;

    @Lob
    @Convert(converter = BattleStatsConverter.class)
    private BattleStats attackerStartStats;

    @Lob
    @Convert(converter = BattleStatsConverter.class)
    private BattleStats attackeeStartStats;

    @Lob
    @Convert(converter = BattleStatsConverter.class)
    private BattleStats attackerEndStats;

    @Lob
    @Convert(converter = BattleStatsConverter.class)
    private BattleStats attackeeEndStats;

    @Lob
    @Convert(converter = CooldownMapConverter.class)
    private EnumMap<WeaponType, Long> attackerWeaponCooldowns = new EnumMap<>(WeaponType.class);

    @Lob
    @Convert(converter = CooldownMapConverter.class)
    private EnumMap<WeaponType, Long> attackeeWeaponCooldowns = new EnumMap<>(WeaponType.class);

    @Lob
    @Convert(converter = BattleLogConverter.class)
    private ArrayList<BattleEvent> battleLog = new ArrayList<>();

    @Column(nullable = false)
    private double attackerTotalDamage;

    @Column(nullable = false)
    private double attackeeTotalDamage;

    /**
     * 새 배틀 생성. 모든 무기는 startTime에 즉시 발사 가능하도록
     * 마지막 발사 시각을 startTime - reload로 초기화한다.
     */
    public static Battle begin(Long attackerId, Long attackeeId,
                               BattleStats attackerStartStats, BattleStats attackeeStartStats,
                               long startTime) {
        Battle battle = new Battle();
        battle.attackerId = attackerId;
        battle.attackeeId = attackeeId;
        battle.state = BattleState.INITIATING;
        battle.battleStartTime = startTime;
        battle.attackerStartStats = attackerStartStats;
        battle.attackeeStartStats = attackeeStartStats;
        attackerStartStats.weapons().forEach((weapon, stats) ->
                battle.attackerWeaponCooldowns.put(weapon, startTime - stats.reloadMillis()));
        attackeeStartStats.weapons().forEach((weapon, stats) ->
                battle.attackeeWeaponCooldowns.put(weapon, startTime - stats.reloadMillis()));
        return battle;
    }

    public void activate() {
        if (state != BattleState.INITIATING) {
            throw new IllegalStateException("INITIATING 상태에서만 활성화할 수 있습니다: " + state);
        }
        this.state = BattleState.ACTIVE;
    }

    public boolean isEnded() {
        return battleEndTime != null || state == BattleState.RESOLVED;
    }

    public boolean involves(Long userId) {
        return attackerId.equals(userId) || attackeeId.equals(userId);
    }

    public Long participantId(BattleSide side) {
        return side == BattleSide.ATTACKER ? attackerId : attackeeId;
    }

    public BattleStats startStatsOf(BattleSide side) {
        return side == BattleSide.ATTACKER ? attackerStartStats : attackeeStartStats;
    }

    public Map<WeaponType, Long> cooldownsOf(BattleSide side) {
        return Collections.unmodifiableMap(side == BattleSide.ATTACKER ? attackerWeaponCooldowns : attackeeWeaponCooldowns);
    }

    public Long lastFiredAt(BattleSide side, WeaponType weapon) {
        return (side == BattleSide.ATTACKER ? attackerWeaponCooldowns : attackeeWeaponCooldowns).get(weapon);
    }

    public void recordShot(BattleSide side, WeaponType weapon, long firedAt) {
        (side == BattleSide.ATTACKER ? attackerWeaponCooldowns : attackeeWeaponCooldowns).put(weapon, firedAt);
    }

    public void addDamageDealt(BattleSide side, double damage) {
        if (side == BattleSide.ATTACKER) {
            attackerTotalDamage += damage;
        } else {
            attackeeTotalDamage += damage;
        }
    }

    public double totalDamageDealtBy(BattleSide side) {
        return side == BattleSide.ATTACKER ? attackerTotalDamage : attackeeTotalDamage;
    }

    public void appendEvent(BattleEvent event) {
        battleLog.add(event);
    }

    public List<BattleEvent> getBattleLog() {
        return Collections.unmodifiableList(battleLog);
    }

    public boolean hasEvent(BattleEventType type, BattleSide actor) {
        return battleLog.stream().anyMatch(event -> event.type() == type && event.actor() == actor);
    }

    /**
     * 종료 기록. 한 번만 가능하다.
     */
    public void close(Long winnerId, Long loserId,
                      BattleStats attackerEndStats, BattleStats attackeeEndStats,
                      long endTime) {
        if (isEnded() || this.attackerEndStats != null || this.attackeeEndStats != null) {
            throw new IllegalStateException("이미 종료된 배틀입니다: battleId=" + id);
        }
        this.winnerId = winnerId;
        this.loserId = loserId;
        this.attackerEndStats = attackerEndStats;
        this.attackeeEndStats = attackeeEndStats;
        this.battleEndTime = endTime;
        this.state = BattleState.RESOLVED;
    }
}
