package com.example.spacewars.battle.dto.response;

import com.example.spacewars.battle.domain.Battle;
import com.example.spacewars.battle.domain.BattleEvent;
import com.example.spacewars.battle.domain.BattleSide;
import com.example.spacewars.battle.domain.BattleState;
import com.example.spacewars.battle.domain.BattleStats;
import com.example.spacewars.battle.domain.WeaponType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 배틀 상세. BATTLE 락 안에서 만들어진 복사본이다.
 */
public record BattleResponse(
        Long id,
        Long attackerId,
        Long attackeeId,
        BattleState state,
        long battleStartTime,
        Long battleEndTime,
        Long winnerId,
        Long loserId,
        BattleStats attackerStartStats,
        BattleStats attackeeStartStats,
        BattleStats attackerEndStats,
        BattleStats attackeeEndStats,
        Map<WeaponType, Long> attackerLastFired,
        Map<WeaponType, Long> attackeeLastFired,
        double attackerTotalDamage,
        double attackeeTotalDamage,
        List<BattleEvent> battleLog
) {
    public static BattleResponse from(Battle battle) {
        return new BattleResponse(
                battle.getId(),
                battle.getAttackerId(),
                battle.getAttackeeId(),
                battle.getState(),
                battle.getBattleStartTime(),
                battle.getBattleEndTime(),
                battle.getWinnerId(),
                battle.getLoserId(),
                battle.getAttackerStartStats(),
                battle.getAttackeeStartStats(),
                battle.getAttackerEndStats(),
                battle.getAttackeeEndStats(),
                copy(battle.cooldownsOf(BattleSide.ATTACKER)),
                copy(battle.cooldownsOf(BattleSide.ATTACKEE)),
                battle.getAttackerTotalDamage(),
                battle.getAttackeeTotalDamage(),
                List.copyOf(battle.getBattleLog()));
    }

    private static Map<WeaponType, Long> copy(Map<WeaponType, Long> cooldowns) {
        return cooldowns.isEmpty() ? Map.of() : new EnumMap<>(cooldowns);
    }

    public boolean isEnded() {
        return battleEndTime != null;
    }
}
