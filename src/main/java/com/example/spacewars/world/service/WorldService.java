package com.example.spacewars.world.service;

import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.concurrency.LockLevel;
import com.example.spacewars.global.concurrency.LockManager;
import com.example.spacewars.global.error.ErrorCode;
import com.example.spacewars.user.cache.UserCache;
import com.example.spacewars.user.domain.User;
import com.example.spacewars.world.cache.WorldCache;
import com.example.spacewars.world.domain.SpaceObject;
import com.example.spacewars.world.domain.World;
import com.example.spacewars.world.dto.response.SpaceObjectResponse;
import com.example.spacewars.world.dto.response.WorldResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Slf4j
@Service
@RequiredArgsConstructor
public class WorldService {

    private final LockManager lockManager;
    private final WorldCache worldCache;
    private final UserCache userCache;
    private final Clock clock;

    /**
     * 월드를 캐시에 올린다 (시작 시 1회)
     */
    public int loadWorld(LockContext ctx) {
        return lockManager.withRead(ctx, LockLevel.WORLD,
                worldCtx -> worldCache.getWorldUnsafe(worldCtx).getSpaceObjects().size());
    }

    /**
     * 현재 시각까지 물리 갱신 후 월드 상태 반환
     */
    public WorldResponse getWorld(LockContext ctx) {
        long nowMs = clock.millis();
        return lockManager.withWrite(ctx, LockLevel.WORLD, worldCtx ->
                WorldResponse.from(worldCache.updateWorldUnsafe(worldCtx, world -> world.updatePhysics(nowMs))));
    }

    /**
     * 함선 속도/방향 변경. 전투 중인 함선은 움직일 수 없다.
     */
    public SpaceObjectResponse setShipCourse(LockContext ctx, Long userId, double speed, double angle) {
        long nowMs = clock.millis();
        return lockManager.withWrite(ctx, LockLevel.USER, userCtx -> {
            User user = userCache.requireUnsafe(userCtx, userId);
            if (user.isInBattle()) {
                throw ErrorCode.ALREADY_IN_BATTLE.commonException("battleId=" + user.getCurrentBattleId());
            }
            if (user.getShipId() == null) {
                throw ErrorCode.SHIP_NOT_FOUND.commonException("userId=" + userId);
            }
            return lockManager.withWrite(userCtx, LockLevel.WORLD, worldCtx -> {
                World world = worldCache.updateWorldUnsafe(worldCtx, w -> w.updatePhysics(nowMs));
                SpaceObject ship = world.findSpaceObject(user.getShipId())
                        .orElseThrow(() -> ErrorCode.SHIP_NOT_FOUND.commonException("shipId=" + user.getShipId()));
                ship.setSpeed(speed);
                ship.setAngle(angle);
                log.debug("항로 변경: userId={}, speed={}, angle={}", userId, speed, angle);
                return SpaceObjectResponse.from(ship);
            });
        });
    }
}
