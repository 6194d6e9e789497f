package com.example.spacewars.world.repository;

import com.example.spacewars.global.config.GameProperties;
import com.example.spacewars.global.persistence.EntityKind;
import com.example.spacewars.world.domain.SpaceObject;
import com.example.spacewars.world.domain.World;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * 월드는 설정의 크기 + space_objects 테이블 전체로 구성된다. 항상 존재한다.
 */
@Component
@RequiredArgsConstructor
public class JpaWorldStore implements WorldStore {

    private final SpaceObjectRepository spaceObjectRepository;
    private final GameProperties properties;

    @Override
    public EntityKind kind() {
        return EntityKind.WORLD;
    }

    @Override
    public Optional<World> loadById(Long id) {
        if (!World.SINGLETON_ID.equals(id)) {
            return Optional.empty();
        }
        return Optional.of(new World(
                properties.world().width(),
                properties.world().height(),
                spaceObjectRepository.findAll()));
    }

    @Override
    @Transactional
    public void upsert(World world) {
        spaceObjectRepository.saveAll(world.getSpaceObjects());
    }

    @Override
    public void delete(Long id) {
        throw new UnsupportedOperationException("월드는 삭제할 수 없습니다");
    }

    @Override
    public SpaceObject insertSpaceObject(SpaceObject spaceObject) {
        return spaceObjectRepository.save(spaceObject);
    }
}
