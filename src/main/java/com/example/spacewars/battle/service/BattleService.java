package com.example.spacewars.battle.service;

import com.example.spacewars.battle.cache.BattleCache;
import com.example.spacewars.battle.domain.Battle;
import com.example.spacewars.battle.domain.BattleEvent;
import com.example.spacewars.battle.domain.BattleEventType;
import com.example.spacewars.battle.domain.BattleSide;
import com.example.spacewars.battle.domain.BattleStats;
import com.example.spacewars.battle.dto.response.BattleResponse;
import com.example.spacewars.battle.dto.response.BattleSummaryResponse;
import com.example.spacewars.battle.engine.BattleEngine;
import com.example.spacewars.battle.engine.BattleOutcome;
import com.example.spacewars.battle.engine.ShotResult;
import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.concurrency.LockLevel;
import com.example.spacewars.global.concurrency.LockManager;
import com.example.spacewars.global.concurrency.LockMode;
import com.example.spacewars.global.config.GameProperties;
import com.example.spacewars.global.error.ErrorCode;
import com.example.spacewars.message.cache.MessageCache;
import com.example.spacewars.user.cache.UserCache;
import com.example.spacewars.user.domain.User;
import com.example.spacewars.world.cache.WorldCache;
import com.example.spacewars.world.domain.SpaceObject;
import com.example.spacewars.world.domain.World;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * 배틀 시작/진행/종료
 *
 * 락 순서: BATTLE -> USER -> WORLD -> MESSAGE_READ -> MESSAGE_WRITE -> DATABASE
 * 시작과 종료는 BATTLE + USER를 한 번에 계속 보유한 채로 수행되어
 * 같은 유저를 건드리는 다른 배틀/요청과 원자적으로 구분된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BattleService {

    private final LockManager lockManager;
    private final BattleCache battleCache;
    private final UserCache userCache;
    private final WorldCache worldCache;
    private final MessageCache messageCache;
    private final TeleportPlanner teleportPlanner;
    private final GameProperties properties;
    private final Clock clock;

    /**
     * 배틀 시작
     *
     * 검증 순서: 참가 중 여부 -> 함선 존재 -> 교전 거리 -> 무기 보유
     */
    public BattleResponse initiateBattle(LockContext ctx, Long attackerId, Long attackeeId) {
        if (attackerId.equals(attackeeId)) {
            throw ErrorCode.CANNOT_ATTACK_SELF.commonException("userId=" + attackerId);
        }
        long nowMs = clock.millis();
        long nowSec = nowMs / 1000;

        BattleResponse response = lockManager.withWrite(ctx, LockLevel.BATTLE,
                battleCtx -> lockManager.withWrite(battleCtx, LockLevel.USER, userCtx -> {
                    User attacker = userCache.mutateUnsafe(userCtx, attackerId, user -> user.updateStats(nowSec));
                    User attackee = userCache.mutateUnsafe(userCtx, attackeeId, user -> user.updateStats(nowSec));

                    if (attacker.isInBattle()) {
                        throw ErrorCode.ALREADY_IN_BATTLE.commonException("battleId=" + attacker.getCurrentBattleId());
                    }
                    if (attackee.isInBattle()) {
                        throw ErrorCode.TARGET_ALREADY_IN_BATTLE.commonException("battleId=" + attackee.getCurrentBattleId());
                    }
                    if (attacker.getShipId() == null || attackee.getShipId() == null) {
                        throw ErrorCode.SHIP_NOT_FOUND.commonException();
                    }

                    lockManager.runWithLock(userCtx, LockLevel.WORLD, LockMode.WRITE,
                            worldCtx -> engageShips(worldCtx, attacker, attackee, nowMs));

                    recoverIfDepleted(userCtx, attacker);
                    recoverIfDepleted(userCtx, attackee);

                    Battle battle = battleCache.insertUnsafe(userCtx, Battle.begin(
                            attackerId, attackeeId,
                            BattleStats.capture(attacker), BattleStats.capture(attackee),
                            nowMs));
                    Long battleId = battle.getId();

                    userCache.mutateUnsafe(userCtx, attackerId, user -> user.enterBattle(battleId));
                    userCache.mutateUnsafe(userCtx, attackeeId, user -> user.enterBattle(battleId));

                    battle.activate();
                    battle.appendEvent(BattleEvent.builder()
                            .timestamp(nowMs)
                            .type(BattleEventType.BATTLE_STARTED)
                            .actor(BattleSide.ATTACKER)
                            .description(attacker.getUsername() + " attacked " + attackee.getUsername())
                            .build());
                    battleCache.markDirtyUnsafe(userCtx, battleId);

                    log.info("배틀 시작: battleId={}, attackerId={}, attackeeId={}", battleId, attackerId, attackeeId);
                    return BattleResponse.from(battle);
                }));

        notifyQuietly(ctx, attackeeId, "You are under attack! Battle " + response.id() + " has started.", nowMs);
        return response;
    }

    /**
     * 두 함선 위치를 최신화하고 교전 거리와 무기 보유를 확인한 뒤 정지시킨다.
     */
    private void engageShips(LockContext worldCtx, User attacker, User attackee, long nowMs) {
        World world = worldCache.updateWorldUnsafe(worldCtx, w -> w.updatePhysics(nowMs));
        SpaceObject attackerShip = world.findSpaceObject(attacker.getShipId())
                .orElseThrow(() -> ErrorCode.SHIP_NOT_FOUND.commonException("shipId=" + attacker.getShipId()));
        SpaceObject attackeeShip = world.findSpaceObject(attackee.getShipId())
                .orElseThrow(() -> ErrorCode.SHIP_NOT_FOUND.commonException("shipId=" + attackee.getShipId()));

        double distance = attackerShip.distanceTo(attackeeShip.getX(), attackeeShip.getY());
        double range = properties.battle().engagementRange();
        if (distance > range) {
            throw ErrorCode.TARGET_OUT_OF_RANGE.commonException(
                    String.format("distance=%.1f, range=%.1f", distance, range));
        }
        if (!attacker.getTechCounts().hasAnyWeapon()) {
            throw ErrorCode.NO_WEAPONS_EQUIPPED.commonException("userId=" + attacker.getId());
        }
        attackerShip.stop();
        attackeeShip.stop();
    }

    private void recoverIfDepleted(LockContext userCtx, User user) {
        if (user.isDefenseDepleted() && user.getTechCounts().hasAnyDefense()) {
            userCache.mutateUnsafe(userCtx, user.getId(), User::recoverDepletedDefense);
            log.warn("방어값이 모두 0인 유저 복구: userId={}, hull={}, armor={}, shield={}",
                    user.getId(), user.getHullCurrent(), user.getArmorCurrent(), user.getShieldCurrent());
        }
    }

    /**
     * 스케줄러 틱: 활성 배틀을 ID 순서로 진행하고 끝난 배틀은 즉시 종료 처리
     * 배틀 하나의 실패는 로그만 남기고 다음 배틀로 넘어간다.
     */
    public TickReport advanceBattles(LockContext ctx, long nowMs) {
        List<Notification> notifications = new ArrayList<>();
        TickReport report = lockManager.withWrite(ctx, LockLevel.BATTLE, battleCtx -> {
            List<Battle> active = battleCache.getActiveBattlesUnsafe(battleCtx);
            int shots = 0;
            int failures = 0;
            List<ResolutionResult> resolved = new ArrayList<>();
            for (Battle battle : active) {
                try {
                    StepResult step = lockManager.withWrite(battleCtx, LockLevel.USER,
                            userCtx -> step(userCtx, battle, nowMs));
                    shots += step.shots().size();
                    notifications.addAll(step.notifications());
                    if (step.resolution() != null) {
                        resolved.add(step.resolution());
                    }
                } catch (RuntimeException e) {
                    failures++;
                    log.error("배틀 진행 중 오류: battleId={}", battle.getId(), e);
                }
            }
            return new TickReport(active.size(), shots, failures, List.copyOf(resolved));
        });
        deliver(ctx, notifications, nowMs);
        return report;
    }

    /**
     * 배틀 한 건 수동 진행
     */
    public BattleResponse advanceBattle(LockContext ctx, Long battleId, long nowMs) {
        List<Notification> notifications = new ArrayList<>();
        BattleResponse response = lockManager.withWrite(ctx, LockLevel.BATTLE, battleCtx -> {
            Battle battle = battleCache.requireUnsafe(battleCtx, battleId);
            if (battle.isEnded()) {
                throw ErrorCode.BATTLE_ALREADY_ENDED.commonException("battleId=" + battleId);
            }
            StepResult step = lockManager.withWrite(battleCtx, LockLevel.USER,
                    userCtx -> step(userCtx, battle, nowMs));
            notifications.addAll(step.notifications());
            return BattleResponse.from(battle);
        });
        deliver(ctx, notifications, nowMs);
        return response;
    }

    private StepResult step(LockContext userCtx, Battle battle, long nowMs) {
        BattleEngine engine = new BattleEngine(battle, userCache);
        List<ShotResult> shots = engine.advance(userCtx, nowMs);
        List<Notification> notifications = new ArrayList<>();
        if (!shots.isEmpty()) {
            battleCache.markDirtyUnsafe(userCtx, battle.getId());
            for (ShotResult shot : shots) {
                notifications.addAll(shotNotifications(battle, shot));
            }
        }
        ResolutionResult resolution = null;
        if (engine.isBattleOver(userCtx)) {
            resolution = resolveUnderLocks(userCtx, engine, nowMs);
            notifications.addAll(outcomeNotifications(resolution));
        }
        return new StepResult(shots, resolution, notifications);
    }

    /**
     * 종료 조건을 만족한 배틀 수동 종료
     *
     * @throws com.example.spacewars.global.error.CommonException BATTLE_ALREADY_ENDED 이미 종료됨, BATTLE_NOT_OVER 아직 진행 중
     */
    public ResolutionResult resolveBattle(LockContext ctx, Long battleId) {
        long nowMs = clock.millis();
        ResolutionResult result = lockManager.withWrite(ctx, LockLevel.BATTLE, battleCtx -> {
            Battle battle = battleCache.requireUnsafe(battleCtx, battleId);
            if (battle.isEnded()) {
                throw ErrorCode.BATTLE_ALREADY_ENDED.commonException("battleId=" + battleId);
            }
            return lockManager.withWrite(battleCtx, LockLevel.USER, userCtx -> {
                BattleEngine engine = new BattleEngine(battle, userCache);
                if (!engine.isBattleOver(userCtx)) {
                    throw ErrorCode.BATTLE_NOT_OVER.commonException("battleId=" + battleId);
                }
                return resolveUnderLocks(userCtx, engine, nowMs);
            });
        });
        deliver(ctx, outcomeNotifications(result), nowMs);
        return result;
    }

    /**
     * 종료 처리 본체. BATTLE 쓰기 + USER 락 보유 상태에서만 호출된다.
     */
    private ResolutionResult resolveUnderLocks(LockContext userCtx, BattleEngine engine, long nowMs) {
        userCtx.requireWrite(LockLevel.USER);
        Battle battle = engine.getBattle();
        BattleOutcome outcome = engine.getOutcome(userCtx);

        User attacker = userCache.requireUnsafe(userCtx, battle.getAttackerId());
        User attackee = userCache.requireUnsafe(userCtx, battle.getAttackeeId());
        BattleStats attackerEnd = BattleStats.capture(attacker);
        BattleStats attackeeEnd = BattleStats.capture(attackee);

        battle.appendEvent(BattleEvent.builder()
                .timestamp(nowMs)
                .type(BattleEventType.BATTLE_ENDED)
                .actor(outcome.winnerSide())
                .description("winner userId=" + outcome.winnerId())
                .build());
        battle.close(outcome.winnerId(), outcome.loserId(), attackerEnd, attackeeEnd, nowMs);
        battleCache.retireUnsafe(userCtx, battle);

        userCache.mutateUnsafe(userCtx, attacker.getId(), User::leaveBattle);
        userCache.mutateUnsafe(userCtx, attackee.getId(), User::leaveBattle);

        User winner = userCache.requireUnsafe(userCtx, outcome.winnerId());
        User loser = userCache.requireUnsafe(userCtx, outcome.loserId());
        double transfer = Math.min(loser.getIron(), winner.remainingIronCapacity());
        if (transfer > 0) {
            userCache.mutateUnsafe(userCtx, winner.getId(), user -> user.addIron(transfer));
            userCache.mutateUnsafe(userCtx, loser.getId(), user -> user.subtractIron(transfer));
        }

        TeleportPlanner.Position destination = lockManager.withWrite(userCtx, LockLevel.WORLD,
                worldCtx -> relocateLoser(worldCtx, winner, loser, nowMs));

        log.info("배틀 종료: battleId={}, winnerId={}, loserId={}, ironTransferred={}",
                battle.getId(), outcome.winnerId(), outcome.loserId(), transfer);
        return new ResolutionResult(battle.getId(), outcome.winnerId(), outcome.loserId(), transfer,
                destination == null ? null : destination.x(),
                destination == null ? null : destination.y());
    }

    private TeleportPlanner.Position relocateLoser(LockContext worldCtx, User winner, User loser, long nowMs) {
        World world = worldCache.getWorldUnsafe(worldCtx);
        SpaceObject winnerShip = world.findSpaceObject(winner.getShipId()).orElse(null);
        SpaceObject loserShip = world.findSpaceObject(loser.getShipId()).orElse(null);
        if (winnerShip == null || loserShip == null) {
            log.warn("함선이 없어 텔레포트 생략: winnerShip={}, loserShip={}", winner.getShipId(), loser.getShipId());
            return null;
        }
        world.updatePhysics(nowMs);
        TeleportPlanner.Position destination = teleportPlanner.plan(
                winnerShip.getX(), winnerShip.getY(), world.getWidth(), world.getHeight());
        loserShip.moveTo(destination.x(), destination.y(), nowMs);
        loserShip.stop();
        worldCache.markDirtyUnsafe(worldCtx, World.SINGLETON_ID);
        return destination;
    }

    /**
     * 재시작 시 저장소에 남아 있는 진행 중 배틀을 활성 맵으로 복원
     */
    public int loadActiveBattles(LockContext ctx) {
        return lockManager.withWrite(ctx, LockLevel.BATTLE, battleCache::loadActiveUnsafe);
    }

    public BattleResponse getBattle(LockContext ctx, Long battleId) {
        return lockManager.withRead(ctx, LockLevel.BATTLE,
                battleCtx -> BattleResponse.from(battleCache.requireUnsafe(battleCtx, battleId)));
    }

    public List<BattleSummaryResponse> getActiveBattles(LockContext ctx) {
        return lockManager.withRead(ctx, LockLevel.BATTLE,
                battleCtx -> battleCache.getActiveBattlesUnsafe(battleCtx).stream()
                        .map(BattleSummaryResponse::from)
                        .toList());
    }

    public List<BattleSummaryResponse> getBattleHistory(LockContext ctx, Long userId) {
        return lockManager.withRead(ctx, LockLevel.BATTLE,
                battleCtx -> battleCache.findBattlesForUserUnsafe(battleCtx, userId).stream()
                        .map(BattleSummaryResponse::from)
                        .toList());
    }

    private List<Notification> shotNotifications(Battle battle, ShotResult shot) {
        Long shooterId = battle.participantId(shot.side());
        Long targetId = battle.participantId(shot.side().opposite());
        String weapon = shot.weapon().getKey();
        double applied = shot.allocation().totalApplied();
        return List.of(
                new Notification(shooterId, String.format(
                        "Your %d %s hit the enemy for %.0f damage.", shot.count(), weapon, applied)),
                new Notification(targetId, String.format(
                        "Enemy %d %s hit you for %.0f damage (shield %.0f, armor %.0f, hull %.0f left).",
                        shot.count(), weapon, applied, shot.allocation().shieldAfter(),
                        shot.allocation().armorAfter(), shot.allocation().hullAfter())));
    }

    private List<Notification> outcomeNotifications(ResolutionResult result) {
        return List.of(
                new Notification(result.winnerId(), String.format(
                        "Victory! You won battle %d and collected %.0f iron.", result.battleId(), result.ironTransferred())),
                new Notification(result.loserId(), String.format(
                        "Defeat. You lost battle %d and %.0f iron. Your ship has been teleported away.",
                        result.battleId(), result.ironTransferred())));
    }

    private void deliver(LockContext ctx, List<Notification> notifications, long nowMs) {
        for (Notification notification : notifications) {
            notifyQuietly(ctx, notification.userId(), notification.content(), nowMs);
        }
    }

    /**
     * 메시지 실패는 배틀 상태 전이를 되돌리지 않는다.
     */
    private void notifyQuietly(LockContext ctx, Long userId, String content, long nowMs) {
        try {
            messageCache.sendMessage(ctx, userId, content, nowMs);
        } catch (RuntimeException e) {
            log.warn("배틀 메시지 전송 실패: userId={}, cause={}", userId, e.getMessage());
        }
    }

    private record Notification(Long userId, String content) {
    }

    private record StepResult(List<ShotResult> shots, ResolutionResult resolution, List<Notification> notifications) {
    }
}
