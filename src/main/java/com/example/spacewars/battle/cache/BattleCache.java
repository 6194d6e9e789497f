package com.example.spacewars.battle.cache;

import com.example.spacewars.battle.domain.Battle;
import com.example.spacewars.battle.repository.BattleStore;
import com.example.spacewars.global.cache.WriteBehindCache;
import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.concurrency.LockLevel;
import com.example.spacewars.global.concurrency.LockManager;
import com.example.spacewars.global.error.CommonException;
import com.example.spacewars.global.error.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 진행 중 배틀 캐시 (BATTLE 레벨)
 *
 * 종료된 배틀은 활성 맵에서 빠져 retired 버퍼로 옮겨지고, 다음 플러시에서 저장된 뒤 버려진다.
 * 저장소에서 읽은 종료 배틀은 반환만 하고 캐시에 올리지 않는다.
 */
@Slf4j
@Component
public class BattleCache extends WriteBehindCache<Long, Battle> {

    private final BattleStore battleStore;
    private final Map<Long, Battle> retired = new ConcurrentHashMap<>();

    public BattleCache(LockManager lockManager, BattleStore battleStore, RetryTemplate persistenceRetryTemplate) {
        super(lockManager, battleStore, persistenceRetryTemplate);
        this.battleStore = battleStore;
    }

    @Override
    protected Long idOf(Battle battle) {
        return battle.getId();
    }

    @Override
    protected CommonException notFound(Long id) {
        return ErrorCode.BATTLE_NOT_FOUND.commonException("battleId=" + id);
    }

    @Override
    protected boolean shouldCache(Battle battle) {
        return !battle.isEnded();
    }

    @Override
    protected Battle lookupCached(Long id) {
        Battle active = entries.get(id);
        return active != null ? active : retired.get(id);
    }

    @Override
    protected void afterPersisted(Long id) {
        retired.remove(id);
    }

    @Override
    protected void onClear() {
        retired.clear();
    }

    /**
     * 저장소에서 ID를 발급받아 활성 맵에 등록
     */
    public Battle insertUnsafe(LockContext ctx, Battle battle) {
        ctx.requireWrite(LockLevel.BATTLE);
        Battle saved = lockManager.withWrite(ctx, LockLevel.DATABASE, dbCtx -> battleStore.insert(battle));
        admit(saved);
        return saved;
    }

    /**
     * 활성 배틀 목록 (ID 오름차순)
     */
    public List<Battle> getActiveBattlesUnsafe(LockContext ctx) {
        ctx.requireHeld(LockLevel.BATTLE);
        return entries.values().stream()
                .sorted(Comparator.comparing(Battle::getId))
                .toList();
    }

    /**
     * 저장소의 진행 중 배틀을 활성 맵에 올린다. 이미 캐시에 있는 배틀은 캐시 사본을 유지한다.
     *
     * @return 새로 올라간 배틀 수
     */
    public int loadActiveUnsafe(LockContext ctx) {
        ctx.requireWrite(LockLevel.BATTLE);
        List<Battle> stored = lockManager.withRead(ctx, LockLevel.DATABASE, dbCtx -> battleStore.findActive());
        int loaded = 0;
        for (Battle battle : stored) {
            if (!battle.isEnded() && lookupCached(battle.getId()) == null) {
                admitIfAbsent(battle);
                loaded++;
            }
        }
        log.debug("진행 중 배틀 복원: stored={}, loaded={}", stored.size(), loaded);
        return loaded;
    }

    /**
     * 종료된 배틀을 활성 맵에서 제거하고 영속화 대기열에 넣는다.
     */
    public void retireUnsafe(LockContext ctx, Battle battle) {
        ctx.requireWrite(LockLevel.BATTLE);
        Long id = battle.getId();
        entries.remove(id);
        retired.put(id, battle);
        markDirty(id);
        log.debug("배틀 종료 처리, 영속화 대기: battleId={}", id);
    }

    /**
     * 유저의 전체 배틀 이력 (최신순). 캐시에 있는 사본이 저장소 사본보다 우선한다.
     */
    public List<Battle> findBattlesForUserUnsafe(LockContext ctx, Long userId) {
        ctx.requireHeld(LockLevel.BATTLE);
        List<Battle> stored = lockManager.withRead(ctx, LockLevel.DATABASE,
                dbCtx -> battleStore.findAllByParticipant(userId));
        return stored.stream()
                .map(battle -> Optional.ofNullable(lookupCached(battle.getId())).orElse(battle))
                .toList();
    }
}
