package com.example.spacewars.battle.engine;

import com.example.spacewars.battle.domain.BattleSide;

public record BattleOutcome(
        Long battleId,
        BattleSide winnerSide,
        Long winnerId,
        Long loserId
) {
}
