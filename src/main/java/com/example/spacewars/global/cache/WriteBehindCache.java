package com.example.spacewars.global.cache;

import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.concurrency.LockLevel;
import com.example.spacewars.global.concurrency.LockManager;
import com.example.spacewars.global.concurrency.LockMode;
import com.example.spacewars.global.error.CommonException;
import com.example.spacewars.global.persistence.DurableStore;
import com.example.spacewars.global.persistence.EntityKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 엔티티 종류 하나의 권위 있는 인메모리 사본 + dirty 추적
 *
 * *Unsafe 접근자는 락을 직접 잡지 않는다. 호출자가 해당 종류의 레벨을 이미 보유하고 있어야 하며
 * (쓰기 계열은 WRITE 모드), 그렇지 않으면 LockOrderViolationException.
 * 캐시 미스일 때만 DATABASE 읽기 락을 추가로 잡고 동기 로드한다.
 *
 * 같은 ID에 대한 동시 미스의 로드 자체는 중복 제거하지 않는다. 두 경로가 모두 로드할 수 있지만
 * 맵에는 먼저 넣은 사본만 남고 두 경로 모두 그 사본을 받는다.
 */
@Slf4j
public abstract class WriteBehindCache<K, V> implements FlushableCache {

    protected final LockManager lockManager;
    protected final DurableStore<K, V> store;
    private final RetryTemplate retryTemplate;
    private final LockLevel level;

    protected final Map<K, V> entries = new ConcurrentHashMap<>();
    private final Set<K> dirtyIds = ConcurrentHashMap.newKeySet();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    protected WriteBehindCache(LockManager lockManager, DurableStore<K, V> store, RetryTemplate retryTemplate) {
        this.lockManager = lockManager;
        this.store = store;
        this.retryTemplate = retryTemplate;
        this.level = store.kind().getGuardLevel();
    }

    protected abstract K idOf(V value);

    protected abstract CommonException notFound(K id);

    /**
     * 저장소에서 읽은 엔티티를 캐시에 올릴지 여부 (종료된 배틀 등은 올리지 않음)
     */
    protected boolean shouldCache(V value) {
        return true;
    }

    /**
     * 캐시에 들어온 직후 호출. 보조 인덱스 유지용.
     */
    protected void onAdmit(V value) {
    }

    @Override
    public EntityKind kind() {
        return store.kind();
    }

    public LockLevel level() {
        return level;
    }

    public Optional<V> getUnsafe(LockContext ctx, K id) {
        ctx.requireHeld(level);
        V cached = lookupCached(id);
        if (cached != null) {
            hits.incrementAndGet();
            return Optional.of(cached);
        }
        misses.incrementAndGet();
        Optional<V> loaded = lockManager.withRead(ctx, LockLevel.DATABASE, dbCtx -> store.loadById(id));
        log.debug("캐시 미스 로드: kind={}, id={}, found={}", kind(), id, loaded.isPresent());
        return loaded.map(value -> shouldCache(value) ? admitIfAbsent(value) : value);
    }

    public V requireUnsafe(LockContext ctx, K id) {
        return getUnsafe(ctx, id).orElseThrow(() -> notFound(id));
    }

    /**
     * 엔티티 변경 후 dirty 표시. 존재하지 않는 ID면 notFound 예외.
     */
    public V mutateUnsafe(LockContext ctx, K id, Consumer<V> mutation) {
        ctx.requireWrite(level);
        V value = requireUnsafe(ctx, id);
        mutation.accept(value);
        dirtyIds.add(id);
        return value;
    }

    public void markDirtyUnsafe(LockContext ctx, K id) {
        ctx.requireWrite(level);
        markDirty(id);
    }

    protected void markDirty(K id) {
        dirtyIds.add(id);
    }

    protected V lookupCached(K id) {
        return entries.get(id);
    }

    protected void admit(V value) {
        entries.put(idOf(value), value);
        onAdmit(value);
    }

    /**
     * 먼저 들어간 사본을 유지하고 그 사본을 반환. 동시 미스가 서로의 변경을 덮어쓰지 않게 한다.
     */
    protected V admitIfAbsent(V value) {
        V existing = entries.putIfAbsent(idOf(value), value);
        if (existing != null) {
            return existing;
        }
        onAdmit(value);
        return value;
    }

    public boolean isDirty(K id) {
        return dirtyIds.contains(id);
    }

    @Override
    public int dirtyCount() {
        return dirtyIds.size();
    }

    @Override
    public FlushResult flush(LockContext ctx) {
        return lockManager.withWrite(ctx, level,
                levelCtx -> lockManager.withWrite(levelCtx, LockLevel.DATABASE, this::flushDirty));
    }

    /**
     * dirty ID를 하나씩 upsert. 재시도까지 모두 실패한 ID는 dirty로 남겨 다음 틱에 다시 시도한다.
     */
    protected FlushResult flushDirty(LockContext ctx) {
        ctx.requireWrite(LockLevel.DATABASE);
        List<K> pending = new ArrayList<>(dirtyIds);
        int persisted = 0;
        int failed = 0;
        for (K id : pending) {
            V value = valueForFlush(id);
            if (value == null) {
                dirtyIds.remove(id);
                continue;
            }
            try {
                retryTemplate.execute(context -> {
                    store.upsert(value);
                    return null;
                });
                dirtyIds.remove(id);
                afterPersisted(id);
                persisted++;
            } catch (RuntimeException e) {
                failed++;
                log.warn("영속화 실패, 다음 플러시에서 재시도: kind={}, id={}, cause={}", kind(), id, e.getMessage());
            }
        }
        if (persisted > 0 || failed > 0) {
            log.info("플러시 완료: kind={}, persisted={}, failed={}", kind(), persisted, failed);
        }
        return new FlushResult(kind(), persisted, failed);
    }

    protected V valueForFlush(K id) {
        return lookupCached(id);
    }

    protected void afterPersisted(K id) {
    }

    @Override
    public void clear(LockContext ctx) {
        lockManager.runWithLock(ctx, level, LockMode.WRITE, levelCtx -> {
            entries.clear();
            onClear();
        });
    }

    protected void onClear() {
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(kind(), entries.size(), dirtyIds.size(), hits.get(), misses.get());
    }
}
