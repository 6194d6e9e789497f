package com.example.spacewars.support;

import com.example.spacewars.battle.cache.BattleCache;
import com.example.spacewars.battle.service.BattleService;
import com.example.spacewars.battle.service.TeleportPlanner;
import com.example.spacewars.global.cache.FlushableCache;
import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.concurrency.LockLevel;
import com.example.spacewars.global.concurrency.LockManager;
import com.example.spacewars.global.concurrency.LockMode;
import com.example.spacewars.global.config.GameProperties;
import com.example.spacewars.global.persistence.PersistenceCoordinator;
import com.example.spacewars.message.cache.MessageCache;
import com.example.spacewars.message.service.MessageService;
import com.example.spacewars.user.cache.UserCache;
import com.example.spacewars.user.domain.User;
import com.example.spacewars.user.dto.response.UserResponse;
import com.example.spacewars.user.service.UserService;
import com.example.spacewars.world.cache.WorldCache;
import com.example.spacewars.world.domain.SpaceObject;
import com.example.spacewars.world.service.WorldService;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.TaskScheduler;

import java.util.List;
import java.util.function.Consumer;

/**
 * 스프링 컨텍스트 없이 인메모리 저장소로 전체 서비스를 조립
 */
public class GameFixture {

    public static final long START_MILLIS = 1_700_000_000_000L;

    public final GameProperties properties = GameProperties.defaults();
    public final MutableClock clock = new MutableClock(START_MILLIS);
    public final LockManager lockManager = new LockManager();
    public final RetryTemplate retryTemplate = RetryTemplate.builder()
            .maxAttempts(3)
            .noBackoff()
            .retryOn(RuntimeException.class)
            .build();

    public final InMemoryUserStore userStore = new InMemoryUserStore();
    public final InMemoryBattleStore battleStore = new InMemoryBattleStore();
    public final InMemoryWorldStore worldStore = new InMemoryWorldStore(
            properties.world().width(), properties.world().height());
    public final InMemoryMessageStore messageStore = new InMemoryMessageStore();

    public final UserCache userCache = new UserCache(lockManager, userStore, retryTemplate);
    public final BattleCache battleCache = new BattleCache(lockManager, battleStore, retryTemplate);
    public final WorldCache worldCache = new WorldCache(lockManager, worldStore, retryTemplate);
    public final MessageCache messageCache = new MessageCache(lockManager, messageStore, retryTemplate);

    public final TeleportPlanner teleportPlanner = new TeleportPlanner(properties);
    public final UserService userService = new UserService(lockManager, userCache, worldCache, messageCache, clock);
    public final WorldService worldService = new WorldService(lockManager, worldCache, userCache, clock);
    public final MessageService messageService = new MessageService(lockManager, userCache, messageCache, clock);
    public final BattleService battleService = new BattleService(lockManager, battleCache, userCache, worldCache,
            messageCache, teleportPlanner, properties, clock);

    public List<FlushableCache> caches() {
        return List.of(messageCache, worldCache, userCache, battleCache);
    }

    public PersistenceCoordinator persistenceCoordinator(TaskScheduler taskScheduler) {
        return new PersistenceCoordinator(caches(), taskScheduler, properties);
    }

    /**
     * 유저를 만들고 함선을 지정 위치에 정지시킨다.
     */
    public UserResponse createUserAt(String username, double x, double y) {
        UserResponse user = userService.createUser(LockContext.empty(), username);
        moveShip(user.shipId(), x, y);
        return user;
    }

    public void moveShip(Long shipId, double x, double y) {
        lockManager.runWithLock(LockContext.empty(), LockLevel.WORLD, LockMode.WRITE,
                worldCtx -> worldCache.updateWorldUnsafe(worldCtx, world -> {
                    SpaceObject ship = world.findSpaceObject(shipId).orElseThrow();
                    ship.moveTo(x, y, clock.millis());
                    ship.stop();
                }));
    }

    public User user(Long userId) {
        return lockManager.withWrite(LockContext.empty(), LockLevel.USER,
                userCtx -> userCache.requireUnsafe(userCtx, userId));
    }

    public void updateUser(Long userId, Consumer<User> mutation) {
        userService.updateUser(LockContext.empty(), userId, mutation);
    }

    public SpaceObject ship(Long shipId) {
        return lockManager.withRead(LockContext.empty(), LockLevel.WORLD,
                worldCtx -> worldCache.getWorldUnsafe(worldCtx).findSpaceObject(shipId).orElseThrow());
    }
}
