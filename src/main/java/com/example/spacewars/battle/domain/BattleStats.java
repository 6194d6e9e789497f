package com.example.spacewars.battle.domain;

import com.example.spacewars.user.domain.User;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 한 쪽 참가자의 방어/무기 스냅샷 (불변)
 */
public record BattleStats(
        DefenseValue hull,
        DefenseValue armor,
        DefenseValue shield,
        Map<WeaponType, WeaponStats> weapons
) {
    public BattleStats {
        EnumMap<WeaponType, WeaponStats> copy = new EnumMap<>(WeaponType.class);
        if (weapons != null) {
            copy.putAll(weapons);
        }
        weapons = Collections.unmodifiableMap(copy);
    }

    /**
     * 유저의 현재(live) 방어값과 보유 무기로 스냅샷 생성. 수량 0인 무기는 제외.
     */
    public static BattleStats capture(User user) {
        Map<WeaponType, WeaponStats> weapons = new EnumMap<>(WeaponType.class);
        for (WeaponType weapon : WeaponType.values()) {
            int count = user.getTechCounts().countOf(weapon);
            if (count > 0) {
                weapons.put(weapon, new WeaponStats(count, weapon.getDamagePerShot(),
                        weapon.reloadMillis(user.getResearch())));
            }
        }
        return new BattleStats(
                new DefenseValue(user.getHullCurrent(), user.maxHull()),
                new DefenseValue(user.getArmorCurrent(), user.maxArmor()),
                new DefenseValue(user.getShieldCurrent(), user.maxShield()),
                weapons);
    }
}
