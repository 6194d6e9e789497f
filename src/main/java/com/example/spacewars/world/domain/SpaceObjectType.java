package com.example.spacewars.world.domain;

public enum SpaceObjectType {
    PLAYER_SHIP,
    ASTEROID,
    SHIPWRECK,
    ESCAPE_POD
}
