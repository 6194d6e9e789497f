package com.example.spacewars.battle.domain.converter;

import com.example.spacewars.battle.domain.BattleEvent;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;

@Converter
public class BattleLogConverter extends JsonAttributeConverter<ArrayList<BattleEvent>> {

    public BattleLogConverter() {
        super(new TypeReference<>() {
        });
    }
}
