package com.example.spacewars.battle.dto.response;

import com.example.spacewars.battle.domain.Battle;
import com.example.spacewars.battle.domain.BattleState;

public record BattleSummaryResponse(
        Long id,
        Long attackerId,
        Long attackeeId,
        BattleState state,
        long battleStartTime,
        Long battleEndTime,
        Long winnerId,
        double attackerTotalDamage,
        double attackeeTotalDamage
) {
    public static BattleSummaryResponse from(Battle battle) {
        return new BattleSummaryResponse(
                battle.getId(),
                battle.getAttackerId(),
                battle.getAttackeeId(),
                battle.getState(),
                battle.getBattleStartTime(),
                battle.getBattleEndTime(),
                battle.getWinnerId(),
                battle.getAttackerTotalDamage(),
                battle.getAttackeeTotalDamage());
    }
}
