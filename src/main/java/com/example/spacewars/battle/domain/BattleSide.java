package com.example.spacewars.battle.domain;

public enum BattleSide {
    ATTACKER,
    ATTACKEE;

    public BattleSide opposite() {
        return this == ATTACKER ? ATTACKEE : ATTACKER;
    }
}
