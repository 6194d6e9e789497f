package com.example.spacewars.battle.service;

import com.example.spacewars.battle.domain.BattleEvent;
import com.example.spacewars.battle.domain.BattleEventType;
import com.example.spacewars.battle.domain.BattleState;
import com.example.spacewars.battle.domain.BattleStats;
import com.example.spacewars.battle.dto.response.BattleResponse;
import com.example.spacewars.battle.dto.response.BattleSummaryResponse;
import com.example.spacewars.global.cache.FlushableCache;
import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.error.CommonException;
import com.example.spacewars.global.error.ErrorCode;
import com.example.spacewars.message.dto.response.MessageResponse;
import com.example.spacewars.support.GameFixture;
import com.example.spacewars.user.domain.User;
import com.example.spacewars.user.dto.response.UserResponse;
import com.example.spacewars.world.domain.SpaceObject;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BattleServiceTest {

    private GameFixture fixture;
    private BattleService battleService;
    private UserResponse alpha;
    private UserResponse bravo;

    @BeforeEach
    void setUp() {
        fixture = new GameFixture();
        battleService = fixture.battleService;
        alpha = fixture.createUserAt("alpha", 100, 100);
        bravo = fixture.createUserAt("bravo", 150, 100);
    }

    private static void assertErrorCode(ThrowingCallable call, ErrorCode expected) {
        assertThatThrownBy(call)
                .isInstanceOf(CommonException.class)
                .hasFieldOrPropertyWithValue("errorCode", expected);
    }

    private BattleResponse startBattle() {
        return battleService.initiateBattle(LockContext.empty(), alpha.id(), bravo.id());
    }

    @Test
    @DisplayName("배틀 시작 시 두 유저가 전투 상태가 되고 함선이 멈춘다")
    void initiateBattle() {
        // given
        fixture.worldService.setShipCourse(LockContext.empty(), bravo.id(), 2, 90);

        // when
        BattleResponse battle = startBattle();

        // then
        assertThat(battle.state()).isEqualTo(BattleState.ACTIVE);
        assertThat(battle.battleLog()).extracting(BattleEvent::type).containsExactly(BattleEventType.BATTLE_STARTED);
        assertThat(battle.attackerStartStats().hull().current()).isEqualTo(500);

        User attacker = fixture.user(alpha.id());
        User attackee = fixture.user(bravo.id());
        assertThat(attacker.isInBattle()).isTrue();
        assertThat(attacker.getCurrentBattleId()).isEqualTo(battle.id());
        assertThat(attackee.getCurrentBattleId()).isEqualTo(battle.id());
        assertThat(fixture.ship(bravo.shipId()).getSpeed()).isZero();

        List<MessageResponse> inbox = fixture.messageService.getMessages(LockContext.empty(), bravo.id());
        assertThat(inbox).extracting(MessageResponse::content).anyMatch(content -> content.contains("under attack"));
    }

    @Test
    @DisplayName("자기 자신은 공격할 수 없다")
    void cannotAttackSelf() {
        assertErrorCode(() -> battleService.initiateBattle(LockContext.empty(), alpha.id(), alpha.id()),
                ErrorCode.CANNOT_ATTACK_SELF);
    }

    @Test
    @DisplayName("교전 거리 밖의 대상은 공격할 수 없고 아무 상태도 바뀌지 않는다")
    void targetOutOfRange() {
        UserResponse far = fixture.createUserAt("far", 3000, 3000);

        assertErrorCode(() -> battleService.initiateBattle(LockContext.empty(), alpha.id(), far.id()),
                ErrorCode.TARGET_OUT_OF_RANGE);

        assertThat(fixture.user(alpha.id()).isInBattle()).isFalse();
        assertThat(fixture.user(far.id()).isInBattle()).isFalse();
        assertThat(battleService.getActiveBattles(LockContext.empty())).isEmpty();
    }

    @Test
    @DisplayName("이미 전투 중인 유저는 공격하거나 공격받을 수 없다")
    void participantsMustBeFree() {
        startBattle();
        UserResponse charlie = fixture.createUserAt("charlie", 120, 120);

        assertErrorCode(() -> battleService.initiateBattle(LockContext.empty(), charlie.id(), alpha.id()),
                ErrorCode.TARGET_ALREADY_IN_BATTLE);
        assertErrorCode(() -> battleService.initiateBattle(LockContext.empty(), alpha.id(), charlie.id()),
                ErrorCode.ALREADY_IN_BATTLE);
    }

    @Test
    @DisplayName("무기가 없으면 공격할 수 없고 함선도 멈추지 않는다")
    void noWeaponsEquipped() {
        // given
        fixture.updateUser(alpha.id(), user -> {
            user.getTechCounts().setPulseLaser(0);
            user.getTechCounts().setAutoTurret(0);
        });
        fixture.worldService.setShipCourse(LockContext.empty(), alpha.id(), 1, 0);

        // when / then
        assertErrorCode(this::startBattle, ErrorCode.NO_WEAPONS_EQUIPPED);
        assertThat(fixture.ship(alpha.shipId()).getSpeed()).isEqualTo(1);
    }

    @Test
    @DisplayName("방어값이 모두 0인 참가자는 시작 시 최대치의 절반으로 복구된다")
    void depletedDefenseIsRecovered() {
        // given
        fixture.updateUser(bravo.id(), user -> {
            user.setHullCurrent(0);
            user.setArmorCurrent(0);
            user.setShieldCurrent(0);
        });

        // when
        BattleResponse battle = startBattle();

        // then
        User attackee = fixture.user(bravo.id());
        assertThat(attackee.getHullCurrent()).isEqualTo(250);
        assertThat(attackee.getArmorCurrent()).isEqualTo(250);
        assertThat(attackee.getShieldCurrent()).isEqualTo(250);
        assertThat(battle.attackeeStartStats().hull().current()).isEqualTo(250);
        assertThat(battle.attackeeStartStats().hull().max()).isEqualTo(500);
    }

    @Test
    @DisplayName("틱에서 승부가 나면 철이 이동하고 패자는 멀리 텔레포트된다")
    void tickResolvesBattle() {
        // given
        fixture.updateUser(alpha.id(), user -> user.setIron(4850));
        fixture.updateUser(bravo.id(), user -> {
            user.setIron(200);
            user.setShieldCurrent(0);
            user.setArmorCurrent(0);
            user.setHullCurrent(1);
        });
        BattleResponse started = startBattle();

        // when
        TickReport report = battleService.advanceBattles(LockContext.empty(), fixture.clock.millis());

        // then
        assertThat(report.resolved()).hasSize(1);
        ResolutionResult result = report.resolved().get(0);
        assertThat(result.winnerId()).isEqualTo(alpha.id());
        assertThat(result.loserId()).isEqualTo(bravo.id());
        assertThat(result.ironTransferred()).isEqualTo(150);

        User winner = fixture.user(alpha.id());
        User loser = fixture.user(bravo.id());
        assertThat(winner.getIron()).isEqualTo(5000);
        assertThat(loser.getIron()).isEqualTo(50);
        assertThat(winner.isInBattle()).isFalse();
        assertThat(loser.isInBattle()).isFalse();
        assertThat(loser.getCurrentBattleId()).isNull();

        SpaceObject winnerShip = fixture.ship(alpha.shipId());
        SpaceObject loserShip = fixture.ship(bravo.shipId());
        assertThat(loserShip.distanceTo(winnerShip.getX(), winnerShip.getY())).isGreaterThanOrEqualTo(1000);
        assertThat(loserShip.getSpeed()).isZero();

        BattleResponse ended = battleService.getBattle(LockContext.empty(), started.id());
        assertThat(ended.isEnded()).isTrue();
        assertThat(ended.winnerId()).isEqualTo(alpha.id());
        assertThat(ended.attackeeEndStats().hull().current()).isZero();
        assertThat(ended.battleLog()).extracting(BattleEvent::type).contains(BattleEventType.BATTLE_ENDED);
        assertThat(battleService.getActiveBattles(LockContext.empty())).isEmpty();

        assertThat(fixture.messageService.getMessages(LockContext.empty(), alpha.id()))
                .extracting(MessageResponse::content).anyMatch(content -> content.startsWith("Victory"));
        assertThat(fixture.messageService.getMessages(LockContext.empty(), bravo.id()))
                .extracting(MessageResponse::content).anyMatch(content -> content.startsWith("Defeat"));
    }

    @Test
    @DisplayName("기본 장비끼리 싸우면 선공한 공격자가 이긴다")
    void fullBattleUntilResolution() {
        // given
        BattleResponse started = startBattle();
        ResolutionResult result = null;

        // when
        for (int tick = 0; tick < 200 && result == null; tick++) {
            TickReport report = battleService.advanceBattles(LockContext.empty(), fixture.clock.millis());
            assertThat(report.failures()).isZero();
            if (!report.resolved().isEmpty()) {
                result = report.resolved().get(0);
            }
            fixture.clock.advanceMillis(1000);
        }

        // then
        assertThat(result).isNotNull();
        assertThat(result.battleId()).isEqualTo(started.id());
        assertThat(result.winnerId()).isEqualTo(alpha.id());
        assertThat(fixture.user(bravo.id()).getHullCurrent()).isZero();
        assertThat(fixture.user(alpha.id()).getHullCurrent()).isPositive();
    }

    @Test
    @DisplayName("이미 종료된 배틀은 다시 종료하거나 진행할 수 없다")
    void resolveTwiceFails() {
        BattleResponse started = startBattle();
        fixture.updateUser(bravo.id(), user -> user.setHullCurrent(0));
        battleService.resolveBattle(LockContext.empty(), started.id());

        assertErrorCode(() -> battleService.resolveBattle(LockContext.empty(), started.id()),
                ErrorCode.BATTLE_ALREADY_ENDED);
        assertErrorCode(() -> battleService.advanceBattle(LockContext.empty(), started.id(), fixture.clock.millis()),
                ErrorCode.BATTLE_ALREADY_ENDED);
    }

    @Test
    @DisplayName("플러시로 캐시에서 빠진 종료 배틀도 저장소에서 읽어 종료 상태로 판단한다")
    void endedBattleAfterFlushIsStillEnded() {
        BattleResponse started = startBattle();
        fixture.updateUser(bravo.id(), user -> user.setHullCurrent(0));
        battleService.resolveBattle(LockContext.empty(), started.id());

        fixture.battleCache.flush(LockContext.empty());

        assertThat(fixture.battleCache.getStats().size()).isZero();
        assertErrorCode(() -> battleService.resolveBattle(LockContext.empty(), started.id()),
                ErrorCode.BATTLE_ALREADY_ENDED);
        assertThat(battleService.getBattle(LockContext.empty(), started.id()).isEnded()).isTrue();
    }

    @Test
    @DisplayName("양쪽 hull이 남아 있으면 종료할 수 없다")
    void resolveBeforeOverFails() {
        BattleResponse started = startBattle();

        assertErrorCode(() -> battleService.resolveBattle(LockContext.empty(), started.id()),
                ErrorCode.BATTLE_NOT_OVER);
    }

    @Test
    @DisplayName("존재하지 않는 배틀 조회는 BATTLE_NOT_FOUND")
    void unknownBattle() {
        assertErrorCode(() -> battleService.getBattle(LockContext.empty(), 404L), ErrorCode.BATTLE_NOT_FOUND);
    }

    @Test
    @DisplayName("배틀 이력은 최신순으로 참가한 배틀만 반환한다")
    void battleHistory() {
        BattleResponse first = startBattle();
        fixture.updateUser(bravo.id(), user -> user.setHullCurrent(0));
        battleService.resolveBattle(LockContext.empty(), first.id());
        fixture.updateUser(bravo.id(), User::restoreFullDefense);
        fixture.moveShip(bravo.shipId(), 150, 100);
        BattleResponse second = battleService.initiateBattle(LockContext.empty(), bravo.id(), alpha.id());

        assertThat(battleService.getBattleHistory(LockContext.empty(), alpha.id()))
                .extracting(BattleSummaryResponse::id)
                .containsExactly(second.id(), first.id());
        assertThat(battleService.getActiveBattles(LockContext.empty()))
                .extracting(BattleSummaryResponse::id)
                .containsExactly(second.id());
    }

    @Test
    @DisplayName("여러 공격자가 같은 대상을 동시에 공격하면 한 배틀만 시작되고 나머지는 거절된다")
    void concurrentInitiationAgainstSameTarget() throws InterruptedException {
        // given
        int attackerCount = 8;
        List<UserResponse> attackers = new ArrayList<>();
        for (int i = 0; i < attackerCount; i++) {
            attackers.add(fixture.createUserAt("raider" + i, 150 + (i % 4) * 10, 130 + (i / 4) * 10));
        }
        ExecutorService executorService = Executors.newFixedThreadPool(attackerCount);
        CountDownLatch ready = new CountDownLatch(attackerCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(attackerCount);
        Queue<BattleResponse> started = new ConcurrentLinkedQueue<>();
        Queue<ErrorCode> rejected = new ConcurrentLinkedQueue<>();

        // when
        for (UserResponse attacker : attackers) {
            executorService.submit(() -> {
                ready.countDown();
                try {
                    start.await();
                    started.add(battleService.initiateBattle(LockContext.empty(), attacker.id(), bravo.id()));
                } catch (CommonException e) {
                    rejected.add(e.getErrorCode());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        ready.await();
        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executorService.shutdown();

        // then
        assertThat(started).hasSize(1);
        assertThat(rejected).hasSize(attackerCount - 1).containsOnly(ErrorCode.TARGET_ALREADY_IN_BATTLE);

        BattleResponse battle = started.peek();
        User target = fixture.user(bravo.id());
        assertThat(target.isInBattle()).isTrue();
        assertThat(target.getCurrentBattleId()).isEqualTo(battle.id());
        for (UserResponse attacker : attackers) {
            User user = fixture.user(attacker.id());
            boolean isWinner = attacker.id().equals(battle.attackerId());
            assertThat(user.isInBattle()).isEqualTo(isWinner);
            assertThat(user.getCurrentBattleId()).isEqualTo(isWinner ? battle.id() : null);
        }
        assertThat(battleService.getActiveBattles(LockContext.empty()))
                .extracting(BattleSummaryResponse::id)
                .containsExactly(battle.id());
    }

    @Test
    @DisplayName("시작 스냅샷은 전투가 진행돼도 바뀌지 않고 종료 스냅샷은 재종료 시도에도 유지된다")
    void battleStatsAreWrittenOnce() {
        // given
        BattleResponse started = startBattle();
        BattleStats attackerStart = started.attackerStartStats();
        BattleStats attackeeStart = started.attackeeStartStats();

        // when
        for (int tick = 0; tick < 5; tick++) {
            battleService.advanceBattles(LockContext.empty(), fixture.clock.millis());
            fixture.clock.advanceMillis(1000);
        }
        BattleResponse inProgress = battleService.getBattle(LockContext.empty(), started.id());

        // then
        assertThat(fixture.user(bravo.id()).getShieldCurrent()).isLessThan(attackeeStart.shield().current());
        assertThat(inProgress.attackerStartStats()).isEqualTo(attackerStart);
        assertThat(inProgress.attackeeStartStats()).isEqualTo(attackeeStart);

        fixture.updateUser(bravo.id(), user -> user.setHullCurrent(0));
        battleService.resolveBattle(LockContext.empty(), started.id());
        BattleResponse resolved = battleService.getBattle(LockContext.empty(), started.id());

        assertErrorCode(() -> battleService.resolveBattle(LockContext.empty(), started.id()),
                ErrorCode.BATTLE_ALREADY_ENDED);
        BattleResponse afterRetry = battleService.getBattle(LockContext.empty(), started.id());
        assertThat(afterRetry.attackerEndStats()).isEqualTo(resolved.attackerEndStats());
        assertThat(afterRetry.attackeeEndStats()).isEqualTo(resolved.attackeeEndStats());
        assertThat(afterRetry.battleEndTime()).isEqualTo(resolved.battleEndTime());
        assertThat(afterRetry.attackerStartStats()).isEqualTo(attackerStart);
    }

    @Test
    @DisplayName("재시작 후 저장소의 진행 중 배틀을 복원하면 틱이 다시 진행하고 종료시킨다")
    void activeBattleSurvivesRestart() {
        // given
        BattleResponse started = startBattle();
        for (FlushableCache cache : fixture.caches()) {
            cache.flush(LockContext.empty());
        }
        for (FlushableCache cache : fixture.caches()) {
            cache.clear(LockContext.empty());
        }
        assertThat(battleService.getActiveBattles(LockContext.empty())).isEmpty();

        // when
        int restored = battleService.loadActiveBattles(LockContext.empty());
        fixture.updateUser(bravo.id(), user -> user.setHullCurrent(0));
        TickReport report = battleService.advanceBattles(LockContext.empty(), fixture.clock.millis());

        // then
        assertThat(restored).isEqualTo(1);
        assertThat(report.battlesProcessed()).isEqualTo(1);
        assertThat(report.resolved()).extracting(ResolutionResult::battleId).containsExactly(started.id());
        assertThat(fixture.user(alpha.id()).isInBattle()).isFalse();
        assertThat(fixture.user(bravo.id()).isInBattle()).isFalse();
        assertThat(battleService.getBattle(LockContext.empty(), started.id()).isEnded()).isTrue();
        assertThat(battleService.loadActiveBattles(LockContext.empty())).isZero();
    }
}
