package com.example.spacewars.user.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 연구 레벨
 *
 * - 철 채굴: 레벨 1에서 초당 1, 레벨마다 x1.1
 * - 철 저장 용량: 레벨 1에서 5000, 레벨마다 x2
 * - 투사체 재장전: 레벨마다 재장전 시간 10% 단축
 * - 에너지 재충전: 레벨마다 재장전 시간 15% 단축
 */
@Embeddable
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Research {

    @Builder.Default
    @Column(nullable = false)
    private int ironHarvestingLevel = 1;

    @Builder.Default
    @Column(nullable = false)
    private int ironCapacityLevel = 1;

    @Column(nullable = false)
    private int projectileReloadLevel;

    @Column(nullable = false)
    private int energyRechargeLevel;

    public double ironPerSecond() {
        return 1.0 * Math.pow(1.1, Math.max(0, ironHarvestingLevel - 1));
    }

    public double ironCapacity() {
        return 5000.0 * Math.pow(2, Math.max(0, ironCapacityLevel - 1));
    }
}
