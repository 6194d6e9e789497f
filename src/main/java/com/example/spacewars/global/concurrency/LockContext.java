package com.example.spacewars.global.concurrency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 한 호출 경로가 현재 보유한 락 레벨 목록 (불변)
 *
 * 규칙:
 * - 새 레벨은 보유 중인 최고 레벨보다 엄격히 높을 때만 획득 가능
 * - 이미 보유한 레벨은 같은 모드(또는 더 약한 모드)로 재사용 가능
 * - READ로 보유한 레벨을 WRITE로 승격하는 것은 금지 (자기 자신과 교착)
 * - 해제는 획득의 역순 (LIFO)
 *
 * 실제 락 획득/해제는 {@link LockManager}만 수행하며, 이 클래스는 토큰 변환과 검증만 담당한다.
 */
public final class LockContext {

    private static final LockContext EMPTY = new LockContext(List.of());

    private final List<HeldLock> held;

    private LockContext(List<HeldLock> held) {
        this.held = held;
    }

    /**
     * 요청/틱 시작 시점의 빈 컨텍스트
     */
    public static LockContext empty() {
        return EMPTY;
    }

    public List<HeldLock> getHeld() {
        return held;
    }

    public boolean isEmpty() {
        return held.isEmpty();
    }

    public boolean holds(LockLevel level) {
        return modeOf(level).isPresent();
    }

    public boolean holdsWrite(LockLevel level) {
        return modeOf(level).map(mode -> mode == LockMode.WRITE).orElse(false);
    }

    public Optional<LockMode> modeOf(LockLevel level) {
        for (HeldLock lock : held) {
            if (lock.level() == level) {
                return Optional.of(lock.mode());
            }
        }
        return Optional.empty();
    }

    public Optional<LockLevel> highestLevel() {
        return held.isEmpty() ? Optional.empty() : Optional.of(held.get(held.size() - 1).level());
    }

    /**
     * level을 지금 획득(또는 재사용)할 수 있는지 여부. 예외 없이 판정만 한다.
     */
    public boolean canAcquire(LockLevel level, LockMode mode) {
        Optional<LockMode> current = modeOf(level);
        if (current.isPresent()) {
            return current.get().covers(mode);
        }
        return highestLevel().map(level::isAbove).orElse(true);
    }

    /**
     * *Unsafe 접근자의 가드. level을 어떤 모드로든 보유하고 있어야 한다.
     */
    public void requireHeld(LockLevel level) {
        if (!holds(level)) {
            throw new LockOrderViolationException(level + " 락이 필요합니다. 보유 중: " + held);
        }
    }

    public void requireWrite(LockLevel level) {
        if (!holdsWrite(level)) {
            throw new LockOrderViolationException(level + " 쓰기 락이 필요합니다. 보유 중: " + held);
        }
    }

    LockContext acquire(LockLevel level, LockMode mode) {
        Optional<LockMode> current = modeOf(level);
        if (current.isPresent()) {
            if (!current.get().covers(mode)) {
                throw new LockOrderViolationException(
                        level + " 락을 READ에서 WRITE로 승격할 수 없습니다. 보유 중: " + held);
            }
            return this;
        }
        LockLevel highest = highestLevel().orElse(null);
        if (highest != null && !level.isAbove(highest)) {
            throw new LockOrderViolationException(
                    "락 순서 위반: " + level + " 은(는) " + highest + " 보다 높아야 합니다. 보유 중: " + held);
        }
        List<HeldLock> next = new ArrayList<>(held.size() + 1);
        next.addAll(held);
        next.add(new HeldLock(level, mode));
        return new LockContext(Collections.unmodifiableList(next));
    }

    LockContext release(LockLevel level) {
        LockLevel last = highestLevel().orElseThrow(
                () -> new LockOrderViolationException("보유하지 않은 락 해제 시도: " + level));
        if (last != level) {
            throw new LockOrderViolationException(
                    "락 해제 순서 위반: 마지막 획득은 " + last + " 인데 " + level + " 해제 시도");
        }
        return held.size() == 1 ? EMPTY : new LockContext(held.subList(0, held.size() - 1));
    }

    @Override
    public String toString() {
        return "LockContext" + held;
    }
}
