package com.example.spacewars.battle.service;

public record ResolutionResult(
        Long battleId,
        Long winnerId,
        Long loserId,
        double ironTransferred,
        Double loserX,
        Double loserY
) {
}
