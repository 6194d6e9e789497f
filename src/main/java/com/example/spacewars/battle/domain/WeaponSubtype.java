package com.example.spacewars.battle.domain;

public enum WeaponSubtype {
    PROJECTILE,
    ENERGY
}
