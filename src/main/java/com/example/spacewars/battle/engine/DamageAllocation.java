package com.example.spacewars.battle.engine;

/**
 * 한 번의 일제 사격 피해가 방어 계층에 배분된 결과
 * 배분 순서는 shield -> armor -> hull 이고 각 계층은 자신의 남은 값까지만 흡수한다.
 */
public record DamageAllocation(
        double shieldDamage,
        double armorDamage,
        double hullDamage,
        double shieldAfter,
        double armorAfter,
        double hullAfter
) {

    public static DamageAllocation allocate(double shield, double armor, double hull, double totalDamage) {
        double remaining = Math.max(0, totalDamage);

        double shieldDamage = Math.min(Math.max(0, shield), remaining);
        remaining -= shieldDamage;

        double armorDamage = Math.min(Math.max(0, armor), remaining);
        remaining -= armorDamage;

        double hullDamage = Math.min(Math.max(0, hull), remaining);

        return new DamageAllocation(
                shieldDamage,
                armorDamage,
                hullDamage,
                Math.max(0, shield - shieldDamage),
                Math.max(0, armor - armorDamage),
                Math.max(0, hull - hullDamage));
    }

    public double totalApplied() {
        return shieldDamage + armorDamage + hullDamage;
    }
}
