package com.example.spacewars.battle.engine;

import com.example.spacewars.battle.domain.BattleSide;
import com.example.spacewars.battle.domain.WeaponType;

/**
 * 다음 발사 결정. 발사할 무기가 없으면 side/weapon은 null이고
 * waitMillis에 가장 빨리 준비되는 무기까지 남은 시간이 들어간다.
 */
public record ShotDecision(BattleSide side, WeaponType weapon, long waitMillis) {

    public static ShotDecision fire(BattleSide side, WeaponType weapon) {
        return new ShotDecision(side, weapon, 0);
    }

    public static ShotDecision waitFor(long waitMillis) {
        return new ShotDecision(null, null, waitMillis);
    }

    public boolean isReady() {
        return weapon != null;
    }
}
