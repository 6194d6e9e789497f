package com.example.spacewars.user.service;

import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.concurrency.LockLevel;
import com.example.spacewars.global.concurrency.LockManager;
import com.example.spacewars.global.error.ErrorCode;
import com.example.spacewars.message.cache.MessageCache;
import com.example.spacewars.user.cache.UserCache;
import com.example.spacewars.user.domain.User;
import com.example.spacewars.user.dto.response.UserResponse;
import com.example.spacewars.world.cache.WorldCache;
import com.example.spacewars.world.domain.SpaceObject;
import com.example.spacewars.world.domain.SpaceObjectType;
import com.example.spacewars.world.domain.World;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final LockManager lockManager;
    private final UserCache userCache;
    private final WorldCache worldCache;
    private final MessageCache messageCache;
    private final Clock clock;

    /**
     * 신규 유저 + 함선 생성. 방어값은 최대치로 시작한다.
     */
    public UserResponse createUser(LockContext ctx, String username) {
        long nowMs = clock.millis();
        long nowSec = nowMs / 1000;
        UserResponse created = lockManager.withWrite(ctx, LockLevel.USER, userCtx -> {
            if (userCache.getUserByUsernameUnsafe(userCtx, username).isPresent()) {
                throw ErrorCode.USERNAME_TAKEN.commonException("username=" + username);
            }
            User user = User.builder()
                    .username(username)
                    .lastUpdated(nowSec)
                    .defenseLastRegen(nowSec)
                    .build();
            user.restoreFullDefense();
            User saved = userCache.insertUnsafe(userCtx, user);

            SpaceObject ship = lockManager.withWrite(userCtx, LockLevel.WORLD, worldCtx -> {
                World world = worldCache.getWorldUnsafe(worldCtx);
                ThreadLocalRandom random = ThreadLocalRandom.current();
                return worldCache.createSpaceObjectUnsafe(worldCtx, SpaceObject.builder()
                        .type(SpaceObjectType.PLAYER_SHIP)
                        .x(random.nextDouble() * world.getWidth())
                        .y(random.nextDouble() * world.getHeight())
                        .lastPositionUpdateMs(nowMs)
                        .ownerId(saved.getId())
                        .build());
            });
            User linked = userCache.mutateUnsafe(userCtx, saved.getId(), u -> u.setShipId(ship.getId()));
            log.info("유저 생성: userId={}, username={}, shipId={}", linked.getId(), username, ship.getId());
            return UserResponse.from(linked);
        });

        try {
            messageCache.sendMessage(ctx, created.id(),
                    "Welcome to Spacewars, " + username + "! Navigate wisely and collect resources to upgrade your ship.",
                    nowMs);
        } catch (RuntimeException e) {
            log.warn("환영 메시지 전송 실패: userId={}, cause={}", created.id(), e.getMessage());
        }
        return created;
    }

    /**
     * 조회 시점까지의 채굴/재생을 반영한 유저 상태
     */
    public UserResponse getUser(LockContext ctx, Long userId) {
        long nowSec = clock.millis() / 1000;
        return lockManager.withWrite(ctx, LockLevel.USER, userCtx ->
                UserResponse.from(userCache.mutateUnsafe(userCtx, userId, user -> user.updateStats(nowSec))));
    }

    public UserResponse getUserByUsername(LockContext ctx, String username) {
        return lockManager.withWrite(ctx, LockLevel.USER, userCtx -> {
            User user = userCache.getUserByUsernameUnsafe(userCtx, username)
                    .orElseThrow(() -> ErrorCode.USER_NOT_FOUND.commonException("username=" + username));
            return UserResponse.from(user);
        });
    }

    public UserResponse updateUser(LockContext ctx, Long userId, Consumer<User> mutation) {
        return lockManager.withWrite(ctx, LockLevel.USER,
                userCtx -> UserResponse.from(userCache.mutateUnsafe(userCtx, userId, mutation)));
    }
}
