package com.example.spacewars.battle.domain;

public enum BattleEventType {
    BATTLE_STARTED,
    SHOT_FIRED,
    DAMAGE_DEALT,
    SHIELD_BROKEN,
    ARMOR_BROKEN,
    HULL_DESTROYED,
    BATTLE_ENDED
}
