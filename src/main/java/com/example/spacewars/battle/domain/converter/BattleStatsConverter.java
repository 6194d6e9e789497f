package com.example.spacewars.battle.domain.converter;

import com.example.spacewars.battle.domain.BattleStats;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class BattleStatsConverter extends JsonAttributeConverter<BattleStats> {

    public BattleStatsConverter() {
        super(new TypeReference<>() {
        });
    }
}
