package com.example.spacewars.user.dto.response;

import com.example.spacewars.battle.domain.DefenseValue;
import com.example.spacewars.user.domain.User;

public record UserResponse(
        Long id,
        String username,
        double iron,
        double ironCapacity,
        DefenseValue hull,
        DefenseValue armor,
        DefenseValue shield,
        boolean inBattle,
        Long currentBattleId,
        Long shipId
) {
    public static UserResponse from(User user) {
        return new UserResponse(
                user.getId(),
                user.getUsername(),
                user.getIron(),
                user.ironCapacity(),
                new DefenseValue(user.getHullCurrent(), user.maxHull()),
                new DefenseValue(user.getArmorCurrent(), user.maxArmor()),
                new DefenseValue(user.getShieldCurrent(), user.maxShield()),
                user.isInBattle(),
                user.getCurrentBattleId(),
                user.getShipId());
    }
}
