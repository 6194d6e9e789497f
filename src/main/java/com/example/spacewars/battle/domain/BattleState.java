package com.example.spacewars.battle.domain;

public enum BattleState {
    INITIATING, // 검증/스냅샷 중
    ACTIVE, // 교전 중
    RESOLVED // 종료 (되돌릴 수 없음)
}
