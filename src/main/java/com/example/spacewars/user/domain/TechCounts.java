package com.example.spacewars.user.domain;

import com.example.spacewars.battle.domain.WeaponType;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 유저가 보유한 무기/방어 장비 수량
 */
@Embeddable
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TechCounts {

    public static final int DEFENSE_POINTS_PER_UNIT = 100;

    @Column(nullable = false)
    private int pulseLaser;

    @Column(nullable = false)
    private int autoTurret;

    @Column(nullable = false)
    private int plasmaLance;

    @Column(nullable = false)
    private int gaussRifle;

    @Column(nullable = false)
    private int photonTorpedo;

    @Column(nullable = false)
    private int rocketLauncher;

    @Column(nullable = false)
    private int shipHull;

    @Column(nullable = false)
    private int kineticArmor;

    @Column(nullable = false)
    private int energyShield;

    /**
     * 신규 유저 기본 장비
     */
    public static TechCounts starter() {
        return TechCounts.builder()
                .pulseLaser(5)
                .autoTurret(5)
                .shipHull(5)
                .kineticArmor(5)
                .energyShield(5)
                .build();
    }

    public int countOf(WeaponType weapon) {
        return switch (weapon) {
            case PULSE_LASER -> pulseLaser;
            case AUTO_TURRET -> autoTurret;
            case PLASMA_LANCE -> plasmaLance;
            case GAUSS_RIFLE -> gaussRifle;
            case PHOTON_TORPEDO -> photonTorpedo;
            case ROCKET_LAUNCHER -> rocketLauncher;
        };
    }

    public boolean hasAnyWeapon() {
        for (WeaponType weapon : WeaponType.values()) {
            if (countOf(weapon) > 0) {
                return true;
            }
        }
        return false;
    }

    public boolean hasAnyDefense() {
        return shipHull > 0 || kineticArmor > 0 || energyShield > 0;
    }

    public double maxHull() {
        return shipHull * DEFENSE_POINTS_PER_UNIT;
    }

    public double maxArmor() {
        return kineticArmor * DEFENSE_POINTS_PER_UNIT;
    }

    public double maxShield() {
        return energyShield * DEFENSE_POINTS_PER_UNIT;
    }
}
