package com.example.spacewars.battle.domain;

public record DefenseValue(double current, double max) {
}
