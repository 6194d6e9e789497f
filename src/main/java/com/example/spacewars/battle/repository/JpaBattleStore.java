package com.example.spacewars.battle.repository;

import com.example.spacewars.battle.domain.Battle;
import com.example.spacewars.battle.domain.BattleState;
import com.example.spacewars.global.persistence.EntityKind;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaBattleStore implements BattleStore {

    private final BattleRepository battleRepository;

    @Override
    public EntityKind kind() {
        return EntityKind.BATTLE;
    }

    @Override
    public Optional<Battle> loadById(Long id) {
        return battleRepository.findById(id);
    }

    /**
     * ID 발급은 배틀 시작 경로에 있으므로 일시적 DB 오류는 즉시 재시도한다.
     */
    @Override
    @Retryable(retryFor = TransientDataAccessException.class, maxAttempts = 3, backoff = @Backoff(delay = 100))
    public Battle insert(Battle battle) {
        return battleRepository.save(battle);
    }

    @Override
    public void upsert(Battle battle) {
        battleRepository.save(battle);
    }

    @Override
    public void delete(Long id) {
        battleRepository.deleteById(id);
    }

    @Override
    public List<Battle> findAllByParticipant(Long userId) {
        return battleRepository.findByAttackerIdOrAttackeeIdOrderByIdDesc(userId, userId);
    }

    @Override
    public List<Battle> findActive() {
        return battleRepository.findByStateOrderByIdAsc(BattleState.ACTIVE);
    }
}
