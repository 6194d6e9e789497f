package com.example.spacewars.world.dto.response;

import com.example.spacewars.world.domain.World;

import java.util.List;

public record WorldResponse(
        double width,
        double height,
        List<SpaceObjectResponse> spaceObjects
) {
    public static WorldResponse from(World world) {
        return new WorldResponse(
                world.getWidth(),
                world.getHeight(),
                world.getSpaceObjects().stream().map(SpaceObjectResponse::from).toList());
    }
}
