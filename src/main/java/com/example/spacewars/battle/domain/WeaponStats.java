package com.example.spacewars.battle.domain;

/**
 * 배틀 시작 시점의 무기 한 종류 스냅샷
 *
 * @param count         보유 수량
 * @param damagePerShot 1정당 피해
 * @param reloadMillis  연구 보정이 반영된 재장전 시간
 */
public record WeaponStats(int count, double damagePerShot, long reloadMillis) {

    public double salvoDamage() {
        return damagePerShot * count;
    }
}
