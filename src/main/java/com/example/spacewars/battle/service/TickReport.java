package com.example.spacewars.battle.service;

import java.util.List;

/**
 * 스케줄러 틱 한 번의 결과
 */
public record TickReport(
        int battlesProcessed,
        int shotsFired,
        int failures,
        List<ResolutionResult> resolved
) {
}
