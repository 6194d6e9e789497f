package com.example.spacewars.global.dev;

import com.example.spacewars.battle.service.BattleScheduler;
import com.example.spacewars.battle.service.TickReport;
import com.example.spacewars.global.cache.CacheStats;
import com.example.spacewars.global.cache.FlushResult;
import com.example.spacewars.global.concurrency.LockManager;
import com.example.spacewars.global.concurrency.LockStats;
import com.example.spacewars.global.dto.CommonResponse;
import com.example.spacewars.global.persistence.PersistenceCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 개발/운영 점검용 엔드포인트
 */
@RestController
@RequestMapping("/dev")
@RequiredArgsConstructor
@Slf4j
public class DevController {

    private final LockManager lockManager;
    private final PersistenceCoordinator persistenceCoordinator;
    private final BattleScheduler battleScheduler;

    @GetMapping("/stats")
    public ResponseEntity<CommonResponse<Map<String, Object>>> stats() {
        List<LockStats> locks = lockManager.getStats();
        List<CacheStats> caches = persistenceCoordinator.getStats();
        Map<String, Object> body = Map.of(
                "locks", locks,
                "caches", caches,
                "autoPersistence", persistenceCoordinator.isAutoPersistenceRunning(),
                "battleScheduler", battleScheduler.isRunning());
        return ResponseEntity.ok(CommonResponse.success(body));
    }

    @PostMapping("/flush")
    public ResponseEntity<CommonResponse<List<FlushResult>>> flush() {
        log.info("Dev flush requested");
        return ResponseEntity.ok(CommonResponse.success(persistenceCoordinator.flushAll()));
    }

    @PostMapping("/battles/tick")
    public ResponseEntity<CommonResponse<TickReport>> tick() {
        log.info("Dev battle tick requested");
        return ResponseEntity.ok(CommonResponse.success(battleScheduler.tick()));
    }
}
