package com.example.spacewars.battle.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * 배틀 로그 한 줄. 로그는 추가만 가능하다.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BattleEvent(
        long timestamp,
        BattleEventType type,
        BattleSide actor,
        WeaponType weapon,
        Double damage,
        String description
) {
}
