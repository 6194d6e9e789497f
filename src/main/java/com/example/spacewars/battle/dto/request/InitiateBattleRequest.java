package com.example.spacewars.battle.dto.request;

import jakarta.validation.constraints.NotNull;

public record InitiateBattleRequest(
        @NotNull Long attackerId,
        @NotNull Long attackeeId
) {
}
