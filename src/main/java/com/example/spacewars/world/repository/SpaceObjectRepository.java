package com.example.spacewars.world.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.spacewars.world.domain.SpaceObject;

@Repository
public interface SpaceObjectRepository extends JpaRepository<SpaceObject, Long> {
}
