package com.example.spacewars.world.domain;

import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 월드 싱글톤 애그리거트: 크기 + 모든 공간 오브젝트
 */
public class World {

    public static final Long SINGLETON_ID = 1L;

    @Getter
    private final double width;
    @Getter
    private final double height;
    private final Map<Long, SpaceObject> spaceObjects = new TreeMap<>();

    public World(double width, double height, Collection<SpaceObject> objects) {
        this.width = width;
        this.height = height;
        for (SpaceObject object : objects) {
            spaceObjects.put(object.getId(), object);
        }
    }

    public Long getId() {
        return SINGLETON_ID;
    }

    public Optional<SpaceObject> findSpaceObject(Long id) {
        return Optional.ofNullable(id == null ? null : spaceObjects.get(id));
    }

    public Collection<SpaceObject> getSpaceObjects() {
        return Collections.unmodifiableCollection(spaceObjects.values());
    }

    /**
     * 저장소에서 ID를 받은 오브젝트를 등록
     */
    public void addSpaceObject(SpaceObject object) {
        if (object.getId() == null) {
            throw new IllegalArgumentException("저장되지 않은 오브젝트는 등록할 수 없습니다");
        }
        spaceObjects.put(object.getId(), object);
    }

    public void updatePhysics(long nowMs) {
        for (SpaceObject object : spaceObjects.values()) {
            object.advance(nowMs, width, height);
        }
    }

    public boolean contains(double x, double y) {
        return x >= 0 && x <= width && y >= 0 && y <= height;
    }
}
