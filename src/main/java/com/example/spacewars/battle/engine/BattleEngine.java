package com.example.spacewars.battle.engine;

import com.example.spacewars.battle.domain.Battle;
import com.example.spacewars.battle.domain.BattleEvent;
import com.example.spacewars.battle.domain.BattleEventType;
import com.example.spacewars.battle.domain.BattleSide;
import com.example.spacewars.battle.domain.WeaponStats;
import com.example.spacewars.battle.domain.WeaponType;
import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.concurrency.LockLevel;
import com.example.spacewars.user.cache.UserCache;
import com.example.spacewars.user.domain.User;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 배틀 한 건의 전투 규칙
 *
 * 무기 준비/선택은 배틀 레코드의 시작 스냅샷과 쿨다운으로 판단하지만,
 * 피해와 종료 판정은 항상 UserCache의 live 유저 방어값을 대상으로 한다.
 * 모든 연산은 BATTLE 쓰기와 USER 락을 보유한 컨텍스트를 요구한다.
 */
@Slf4j
public class BattleEngine {

    private final Battle battle;
    private final UserCache userCache;

    public BattleEngine(Battle battle, UserCache userCache) {
        this.battle = battle;
        this.userCache = userCache;
    }

    public Battle getBattle() {
        return battle;
    }

    /**
     * nowMs >= 마지막 발사 시각 + 재장전 시간
     */
    public boolean isWeaponReady(BattleSide side, WeaponType weapon, long nowMs) {
        return millisUntilReady(side, weapon, nowMs) == 0;
    }

    public List<WeaponType> getReadyWeapons(BattleSide side, long nowMs) {
        List<WeaponType> ready = new ArrayList<>();
        for (WeaponType weapon : WeaponType.values()) {
            if (isWeaponReady(side, weapon, nowMs)) {
                ready.add(weapon);
            }
        }
        return ready;
    }

    /**
     * 공격자 우선, 같은 편 안에서는 로스터 순서. 아무도 준비되지 않았으면 최소 대기 시간을 반환.
     */
    public ShotDecision selectNextShot(long nowMs) {
        for (BattleSide side : BattleSide.values()) {
            List<WeaponType> ready = getReadyWeapons(side, nowMs);
            if (!ready.isEmpty()) {
                return ShotDecision.fire(side, ready.get(0));
            }
        }
        long minWait = Long.MAX_VALUE;
        for (BattleSide side : BattleSide.values()) {
            for (WeaponType weapon : battle.startStatsOf(side).weapons().keySet()) {
                minWait = Math.min(minWait, millisUntilReady(side, weapon, nowMs));
            }
        }
        return ShotDecision.waitFor(minWait == Long.MAX_VALUE ? -1 : minWait);
    }

    /**
     * 무기 하나의 일제 사격. 상대 live 유저에 shield -> armor -> hull 순으로 피해를 적용한다.
     */
    public ShotResult fire(LockContext ctx, BattleSide side, WeaponType weapon, long nowMs) {
        ctx.requireWrite(LockLevel.BATTLE);
        WeaponStats stats = battle.startStatsOf(side).weapons().get(weapon);
        if (stats == null) {
            throw new IllegalArgumentException(side + " 에 장착되지 않은 무기: " + weapon);
        }
        double salvo = stats.salvoDamage();
        Long targetId = battle.participantId(side.opposite());

        User target = userCache.requireUnsafe(ctx, targetId);
        DamageAllocation allocation = DamageAllocation.allocate(
                target.getShieldCurrent(), target.getArmorCurrent(), target.getHullCurrent(), salvo);
        userCache.mutateUnsafe(ctx, targetId, user -> {
            user.setShieldCurrent(allocation.shieldAfter());
            user.setArmorCurrent(allocation.armorAfter());
            user.setHullCurrent(allocation.hullAfter());
        });

        List<BattleEvent> events = new ArrayList<>();
        events.add(BattleEvent.builder()
                .timestamp(nowMs)
                .type(BattleEventType.SHOT_FIRED)
                .actor(side)
                .weapon(weapon)
                .damage(salvo)
                .description(stats.count() + "x " + weapon.getKey() + " fired")
                .build());
        events.add(BattleEvent.builder()
                .timestamp(nowMs)
                .type(BattleEventType.DAMAGE_DEALT)
                .actor(side)
                .weapon(weapon)
                .damage(allocation.totalApplied())
                .description(String.format("shield %.0f / armor %.0f / hull %.0f",
                        allocation.shieldDamage(), allocation.armorDamage(), allocation.hullDamage()))
                .build());
        addBreakEvent(events, side, BattleEventType.SHIELD_BROKEN,
                allocation.shieldDamage() > 0 && allocation.shieldAfter() <= 0, nowMs);
        addBreakEvent(events, side, BattleEventType.ARMOR_BROKEN,
                allocation.armorDamage() > 0 && allocation.armorAfter() <= 0, nowMs);
        addBreakEvent(events, side, BattleEventType.HULL_DESTROYED,
                allocation.hullDamage() > 0 && allocation.hullAfter() <= 0, nowMs);

        events.forEach(battle::appendEvent);
        battle.recordShot(side, weapon, nowMs);
        battle.addDamageDealt(side, allocation.totalApplied());

        log.debug("발사: battleId={}, side={}, weapon={}, salvo={}, applied={}",
                battle.getId(), side, weapon, salvo, allocation.totalApplied());
        return new ShotResult(side, weapon, stats.count(), salvo, allocation, List.copyOf(events));
    }

    private void addBreakEvent(List<BattleEvent> events, BattleSide actor, BattleEventType type,
                               boolean broken, long nowMs) {
        if (!broken || battle.hasEvent(type, actor)) {
            return;
        }
        events.add(BattleEvent.builder()
                .timestamp(nowMs)
                .type(type)
                .actor(actor)
                .description(actor.opposite() + " " + type.name().toLowerCase())
                .build());
    }

    /**
     * 준비된 무기를 모두 발사 (공격자 먼저). 배틀이 끝나면 즉시 멈춘다.
     */
    public List<ShotResult> advance(LockContext ctx, long nowMs) {
        List<ShotResult> shots = new ArrayList<>();
        while (!isBattleOver(ctx)) {
            ShotDecision decision = selectNextShot(nowMs);
            if (!decision.isReady()) {
                break;
            }
            shots.add(fire(ctx, decision.side(), decision.weapon(), nowMs));
        }
        return shots;
    }

    /**
     * 어느 한 쪽의 live hull이 0 이하이면 종료
     */
    public boolean isBattleOver(LockContext ctx) {
        return hullOf(ctx, BattleSide.ATTACKER) <= 0 || hullOf(ctx, BattleSide.ATTACKEE) <= 0;
    }

    /**
     * 승자 = hull이 남아 있는 쪽. 둘 다 0 이하면 방어자 승리.
     */
    public BattleOutcome getOutcome(LockContext ctx) {
        BattleSide winner = hullOf(ctx, BattleSide.ATTACKER) > 0 ? BattleSide.ATTACKER : BattleSide.ATTACKEE;
        return new BattleOutcome(battle.getId(), winner,
                battle.participantId(winner), battle.participantId(winner.opposite()));
    }

    private double hullOf(LockContext ctx, BattleSide side) {
        return userCache.requireUnsafe(ctx, battle.participantId(side)).getHullCurrent();
    }

    private long millisUntilReady(BattleSide side, WeaponType weapon, long nowMs) {
        WeaponStats stats = battle.startStatsOf(side).weapons().get(weapon);
        Long lastFired = battle.lastFiredAt(side, weapon);
        if (stats == null || stats.count() <= 0 || lastFired == null) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, lastFired + stats.reloadMillis() - nowMs);
    }
}
