package com.example.spacewars.user.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 유저(계정) 엔티티
 * 방어 현재값(hull/armor/shield)은 진행 중인 전투의 유일한 진실 공급원이다.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String username;

    @Builder.Default
    @Column(nullable = false)
    private double iron = 0;

    @Embedded
    @Builder.Default
    private TechCounts techCounts = TechCounts.starter();

    @Embedded
    @Builder.Default
    private Research research = Research.builder().build();

    @Column(nullable = false)
    private double hullCurrent;

    @Column(nullable = false)
    private double armorCurrent;

    @Column(nullable = false)
    private double shieldCurrent;

    // 초 단위 epoch
    @Column(nullable = false)
    private long defenseLastRegen;

    @Column(nullable = false)
    private long lastUpdated;

    @Column(nullable = false)
    private boolean inBattle;

    private Long currentBattleId;

    private Long shipId;

    public double maxHull() {
        return techCounts.maxHull();
    }

    public double maxArmor() {
        return techCounts.maxArmor();
    }

    public double maxShield() {
        return techCounts.maxShield();
    }

    public double ironCapacity() {
        return research.ironCapacity();
    }

    public double remainingIronCapacity() {
        return Math.max(0, ironCapacity() - iron);
    }

    /**
     * 마지막 갱신 이후 경과 시간만큼 철 채굴(용량 상한)과 방어 재생을 반영
     */
    public void updateStats(long nowSec) {
        long elapsed = nowSec - lastUpdated;
        if (elapsed > 0) {
            iron = Math.min(iron + research.ironPerSecond() * elapsed, Math.max(iron, ironCapacity()));
            lastUpdated = nowSec;
        }
        regenerateDefense(nowSec);
    }

    /**
     * 방어 재생: 종류별 초당 1, 최대치 상한. 전투 중에는 재생하지 않는다.
     */
    public void regenerateDefense(long nowSec) {
        long elapsed = nowSec - defenseLastRegen;
        if (elapsed <= 0) {
            return;
        }
        if (!inBattle) {
            hullCurrent = Math.min(hullCurrent + elapsed, maxHull());
            armorCurrent = Math.min(armorCurrent + elapsed, maxArmor());
            shieldCurrent = Math.min(shieldCurrent + elapsed, maxShield());
        }
        defenseLastRegen = nowSec;
    }

    public boolean isDefenseDepleted() {
        return hullCurrent <= 0 && armorCurrent <= 0 && shieldCurrent <= 0;
    }

    /**
     * 방어값이 전부 0인데 장비는 있는 경우 최대치의 절반으로 복구
     *
     * @return 복구했으면 true
     */
    public boolean recoverDepletedDefense() {
        if (!isDefenseDepleted() || !techCounts.hasAnyDefense()) {
            return false;
        }
        hullCurrent = maxHull() / 2;
        armorCurrent = maxArmor() / 2;
        shieldCurrent = maxShield() / 2;
        return true;
    }

    public void restoreFullDefense() {
        hullCurrent = maxHull();
        armorCurrent = maxArmor();
        shieldCurrent = maxShield();
    }

    public void enterBattle(Long battleId) {
        this.inBattle = true;
        this.currentBattleId = battleId;
    }

    public void leaveBattle() {
        this.inBattle = false;
        this.currentBattleId = null;
    }

    public void addIron(double amount) {
        this.iron += amount;
    }

    public void subtractIron(double amount) {
        this.iron = Math.max(0, this.iron - amount);
    }
}
