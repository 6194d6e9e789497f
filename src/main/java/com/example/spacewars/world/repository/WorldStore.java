package com.example.spacewars.world.repository;

import com.example.spacewars.global.persistence.DurableStore;
import com.example.spacewars.world.domain.SpaceObject;
import com.example.spacewars.world.domain.World;

public interface WorldStore extends DurableStore<Long, World> {

    /**
     * 신규 공간 오브젝트 저장 후 ID가 채워진 엔티티 반환
     */
    SpaceObject insertSpaceObject(SpaceObject spaceObject);
}
