package com.example.spacewars.battle.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.spacewars.battle.dto.request.InitiateBattleRequest;
import com.example.spacewars.battle.dto.response.BattleResponse;
import com.example.spacewars.battle.dto.response.BattleSummaryResponse;
import com.example.spacewars.battle.service.BattleService;
import com.example.spacewars.battle.service.ResolutionResult;
import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.dto.CommonResponse;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/battles")
@RequiredArgsConstructor
public class BattleController {

    private final BattleService battleService;

    @PostMapping
    public ResponseEntity<CommonResponse<BattleResponse>> initiateBattle(@Valid @RequestBody InitiateBattleRequest requestDto) {
        log.info("배틀 시작 요청: attackerId={}, attackeeId={}", requestDto.attackerId(), requestDto.attackeeId());
        BattleResponse battle = battleService.initiateBattle(
                LockContext.empty(), requestDto.attackerId(), requestDto.attackeeId());
        return ResponseEntity.status(HttpStatus.CREATED).body(CommonResponse.success(battle, "배틀이 시작되었습니다."));
    }

    @GetMapping("/{battleId}")
    public ResponseEntity<CommonResponse<BattleResponse>> getBattle(@PathVariable Long battleId) {
        return ResponseEntity.ok(CommonResponse.success(battleService.getBattle(LockContext.empty(), battleId)));
    }

    @GetMapping("/active")
    public ResponseEntity<CommonResponse<List<BattleSummaryResponse>>> getActiveBattles() {
        return ResponseEntity.ok(CommonResponse.success(battleService.getActiveBattles(LockContext.empty())));
    }

    @GetMapping
    public ResponseEntity<CommonResponse<List<BattleSummaryResponse>>> getBattleHistory(@RequestParam Long userId) {
        return ResponseEntity.ok(CommonResponse.success(battleService.getBattleHistory(LockContext.empty(), userId)));
    }

    @PostMapping("/{battleId}/resolve")
    public ResponseEntity<CommonResponse<ResolutionResult>> resolveBattle(@PathVariable Long battleId) {
        ResolutionResult result = battleService.resolveBattle(LockContext.empty(), battleId);
        return ResponseEntity.ok(CommonResponse.success(result, "배틀이 종료되었습니다."));
    }
}
