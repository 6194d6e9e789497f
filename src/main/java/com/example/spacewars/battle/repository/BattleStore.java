package com.example.spacewars.battle.repository;

import com.example.spacewars.battle.domain.Battle;
import com.example.spacewars.global.persistence.DurableStore;

import java.util.List;

public interface BattleStore extends DurableStore<Long, Battle> {

    /**
     * 신규 배틀 저장. 저장소가 발급한 ID가 채워진 엔티티를 반환한다.
     */
    Battle insert(Battle battle);

    /**
     * 유저가 참가한 모든 배틀 (최신순)
     */
    List<Battle> findAllByParticipant(Long userId);

    /**
     * 아직 종료되지 않은 배틀 (ID 오름차순). 재시작 시 활성 맵 복원용.
     */
    List<Battle> findActive();
}
