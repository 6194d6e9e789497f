package com.example.spacewars.world.cache;

import com.example.spacewars.global.cache.WriteBehindCache;
import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.concurrency.LockLevel;
import com.example.spacewars.global.concurrency.LockManager;
import com.example.spacewars.global.error.CommonException;
import com.example.spacewars.global.error.ErrorCode;
import com.example.spacewars.world.domain.SpaceObject;
import com.example.spacewars.world.domain.World;
import com.example.spacewars.world.repository.WorldStore;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * 월드 싱글톤 캐시 (WORLD 레벨, 읽기/쓰기 락)
 */
@Component
public class WorldCache extends WriteBehindCache<Long, World> {

    private final WorldStore worldStore;

    public WorldCache(LockManager lockManager, WorldStore worldStore, RetryTemplate persistenceRetryTemplate) {
        super(lockManager, worldStore, persistenceRetryTemplate);
        this.worldStore = worldStore;
    }

    @Override
    protected Long idOf(World world) {
        return world.getId();
    }

    @Override
    protected CommonException notFound(Long id) {
        // 월드는 항상 존재해야 한다
        return ErrorCode.PERSISTENCE_FAILURE.commonException("world not loaded");
    }

    public World getWorldUnsafe(LockContext ctx) {
        return requireUnsafe(ctx, World.SINGLETON_ID);
    }

    public World updateWorldUnsafe(LockContext ctx, Consumer<World> mutation) {
        return mutateUnsafe(ctx, World.SINGLETON_ID, mutation);
    }

    public SpaceObject createSpaceObjectUnsafe(LockContext ctx, SpaceObject spaceObject) {
        ctx.requireWrite(LockLevel.WORLD);
        World world = getWorldUnsafe(ctx);
        SpaceObject saved = lockManager.withWrite(ctx, LockLevel.DATABASE,
                dbCtx -> worldStore.insertSpaceObject(spaceObject));
        world.addSpaceObject(saved);
        return saved;
    }
}
