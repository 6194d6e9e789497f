package com.example.spacewars.world.dto.response;

import com.example.spacewars.world.domain.SpaceObject;
import com.example.spacewars.world.domain.SpaceObjectType;

public record SpaceObjectResponse(
        Long id,
        SpaceObjectType type,
        double x,
        double y,
        double speed,
        double angle,
        long lastPositionUpdateMs,
        int pictureId,
        Long ownerId
) {
    public static SpaceObjectResponse from(SpaceObject object) {
        return new SpaceObjectResponse(
                object.getId(),
                object.getType(),
                object.getX(),
                object.getY(),
                object.getSpeed(),
                object.getAngle(),
                object.getLastPositionUpdateMs(),
                object.getPictureId(),
                object.getOwnerId());
    }
}
