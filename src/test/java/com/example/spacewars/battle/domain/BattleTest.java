package com.example.spacewars.battle.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BattleTest {

    private static BattleStats stats(double hull) {
        return new BattleStats(
                new DefenseValue(hull, 500),
                new DefenseValue(500, 500),
                new DefenseValue(500, 500),
                Map.of(WeaponType.PULSE_LASER, new WeaponStats(5, 8, 2000)));
    }

    @Test
    @DisplayName("종료 기록은 한 번만 가능하고 두 번째 시도는 기존 종료 스냅샷을 건드리지 않는다")
    void closeIsWriteOnce() {
        // given
        Battle battle = Battle.begin(1L, 2L, stats(500), stats(500), 1_000L);
        battle.activate();
        BattleStats attackerEnd = stats(420);
        BattleStats attackeeEnd = stats(0);
        battle.close(1L, 2L, attackerEnd, attackeeEnd, 5_000L);

        // when / then
        assertThatThrownBy(() -> battle.close(2L, 1L, stats(0), stats(500), 9_000L))
                .isInstanceOf(IllegalStateException.class);
        assertThat(battle.getState()).isEqualTo(BattleState.RESOLVED);
        assertThat(battle.getWinnerId()).isEqualTo(1L);
        assertThat(battle.getAttackerEndStats()).isEqualTo(attackerEnd);
        assertThat(battle.getAttackeeEndStats()).isEqualTo(attackeeEnd);
        assertThat(battle.getBattleEndTime()).isEqualTo(5_000L);
        assertThat(battle.getAttackerStartStats()).isEqualTo(stats(500));
    }

    @Test
    @DisplayName("활성화는 INITIATING 상태에서 한 번만 가능하다")
    void activateOnlyOnce() {
        Battle battle = Battle.begin(1L, 2L, stats(500), stats(500), 1_000L);
        battle.activate();

        assertThatThrownBy(battle::activate).isInstanceOf(IllegalStateException.class);
    }
}
