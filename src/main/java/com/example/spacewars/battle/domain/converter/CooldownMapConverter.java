package com.example.spacewars.battle.domain.converter;

import com.example.spacewars.battle.domain.WeaponType;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.EnumMap;

@Converter
public class CooldownMapConverter extends JsonAttributeConverter<EnumMap<WeaponType, Long>> {

    public CooldownMapConverter() {
        super(new TypeReference<>() {
        });
    }
}
