package com.example.spacewars.battle.engine;

import com.example.spacewars.battle.domain.BattleEvent;
import com.example.spacewars.battle.domain.BattleSide;
import com.example.spacewars.battle.domain.WeaponType;

import java.util.List;

public record ShotResult(
        BattleSide side,
        WeaponType weapon,
        int count,
        double salvoDamage,
        DamageAllocation allocation,
        List<BattleEvent> events
) {
}
