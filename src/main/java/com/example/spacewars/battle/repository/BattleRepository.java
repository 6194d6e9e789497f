package com.example.spacewars.battle.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.spacewars.battle.domain.Battle;
import com.example.spacewars.battle.domain.BattleState;

@Repository
public interface BattleRepository extends JpaRepository<Battle, Long> {
    List<Battle> findByAttackerIdOrAttackeeIdOrderByIdDesc(Long attackerId, Long attackeeId);

    List<Battle> findByStateOrderByIdAsc(BattleState state);
}
