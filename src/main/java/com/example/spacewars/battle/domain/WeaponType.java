package com.example.spacewars.battle.domain;

import com.example.spacewars.user.domain.Research;
import lombok.Getter;

/**
 * 무기 카탈로그. 선언 순서가 로스터 순서이며 같은 틱에 여러 무기가 준비되면 먼저 선언된 무기가 발사된다.
 */
@Getter
public enum WeaponType {
    PULSE_LASER("pulse_laser", 8, 2, WeaponSubtype.ENERGY),
    AUTO_TURRET("auto_turret", 10, 3, WeaponSubtype.PROJECTILE),
    PLASMA_LANCE("plasma_lance", 30, 4, WeaponSubtype.ENERGY),
    GAUSS_RIFLE("gauss_rifle", 35, 5, WeaponSubtype.PROJECTILE),
    PHOTON_TORPEDO("photon_torpedo", 120, 8, WeaponSubtype.ENERGY),
    ROCKET_LAUNCHER("rocket_launcher", 150, 10, WeaponSubtype.PROJECTILE);

    private static final double PROJECTILE_REDUCTION_PER_LEVEL = 0.10;
    private static final double ENERGY_REDUCTION_PER_LEVEL = 0.15;
    private static final double MAX_REDUCTION = 0.90;

    private final String key;
    private final double damagePerShot;
    private final double baseReloadSeconds;
    private final WeaponSubtype subtype;

    WeaponType(String key, double damagePerShot, double baseReloadSeconds, WeaponSubtype subtype) {
        this.key = key;
        this.damagePerShot = damagePerShot;
        this.baseReloadSeconds = baseReloadSeconds;
        this.subtype = subtype;
    }

    /**
     * 연구 레벨을 반영한 재장전 시간 (ms). 단축률은 최대 90%.
     */
    public long reloadMillis(Research research) {
        double reduction = switch (subtype) {
            case PROJECTILE -> research.getProjectileReloadLevel() * PROJECTILE_REDUCTION_PER_LEVEL;
            case ENERGY -> research.getEnergyRechargeLevel() * ENERGY_REDUCTION_PER_LEVEL;
        };
        double factor = 1.0 - Math.min(MAX_REDUCTION, Math.max(0, reduction));
        return Math.round(baseReloadSeconds * 1000 * factor);
    }

    public static WeaponType fromKey(String key) {
        for (WeaponType weapon : values()) {
            if (weapon.key.equals(key)) {
                return weapon;
            }
        }
        throw new IllegalArgumentException("알 수 없는 무기: " + key);
    }
}
