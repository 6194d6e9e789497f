package com.example.spacewars.global.concurrency;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LockContextTest {

    @Test
    @DisplayName("빈 컨텍스트는 아무 레벨이나 획득할 수 있다")
    void emptyContextCanAcquireAnyLevel() {
        LockContext ctx = LockContext.empty();

        for (LockLevel level : LockLevel.values()) {
            assertThat(ctx.canAcquire(level, LockMode.WRITE)).isTrue();
        }
        assertThat(ctx.isEmpty()).isTrue();
        assertThat(ctx.highestLevel()).isEmpty();
    }

    @Test
    @DisplayName("오름차순 획득 시 보유 목록에 순서대로 쌓인다")
    void ascendingAcquisitionAccumulates() {
        // when
        LockContext ctx = LockContext.empty()
                .acquire(LockLevel.BATTLE, LockMode.WRITE)
                .acquire(LockLevel.USER, LockMode.WRITE)
                .acquire(LockLevel.WORLD, LockMode.READ);

        // then
        assertThat(ctx.getHeld()).containsExactly(
                new HeldLock(LockLevel.BATTLE, LockMode.WRITE),
                new HeldLock(LockLevel.USER, LockMode.WRITE),
                new HeldLock(LockLevel.WORLD, LockMode.READ));
        assertThat(ctx.highestLevel()).contains(LockLevel.WORLD);
        assertThat(ctx.holdsWrite(LockLevel.USER)).isTrue();
        assertThat(ctx.holdsWrite(LockLevel.WORLD)).isFalse();
        assertThat(ctx.holds(LockLevel.MESSAGE_READ)).isFalse();
    }

    @Test
    @DisplayName("낮은 레벨을 나중에 잡으면 순서 위반 예외")
    void descendingAcquisitionIsRejected() {
        LockContext ctx = LockContext.empty().acquire(LockLevel.WORLD, LockMode.READ);

        assertThat(ctx.canAcquire(LockLevel.USER, LockMode.WRITE)).isFalse();
        assertThatThrownBy(() -> ctx.acquire(LockLevel.USER, LockMode.WRITE))
                .isInstanceOf(LockOrderViolationException.class)
                .hasMessageContaining("락 순서 위반");
    }

    @Test
    @DisplayName("이미 보유한 레벨은 같은 컨텍스트를 재사용한다")
    void reacquiringHeldLevelIsIdempotent() {
        LockContext ctx = LockContext.empty()
                .acquire(LockLevel.USER, LockMode.WRITE)
                .acquire(LockLevel.DATABASE, LockMode.READ);

        assertThat(ctx.acquire(LockLevel.USER, LockMode.READ)).isSameAs(ctx);
        assertThat(ctx.acquire(LockLevel.USER, LockMode.WRITE)).isSameAs(ctx);
        assertThat(ctx.acquire(LockLevel.DATABASE, LockMode.READ)).isSameAs(ctx);
    }

    @Test
    @DisplayName("READ로 보유한 레벨을 WRITE로 승격할 수 없다")
    void readToWriteUpgradeIsRejected() {
        LockContext ctx = LockContext.empty().acquire(LockLevel.WORLD, LockMode.READ);

        assertThat(ctx.canAcquire(LockLevel.WORLD, LockMode.WRITE)).isFalse();
        assertThatThrownBy(() -> ctx.acquire(LockLevel.WORLD, LockMode.WRITE))
                .isInstanceOf(LockOrderViolationException.class)
                .hasMessageContaining("승격");
    }

    @Test
    @DisplayName("해제는 마지막에 획득한 레벨부터만 가능하다")
    void releaseMustBeLifo() {
        LockContext ctx = LockContext.empty()
                .acquire(LockLevel.BATTLE, LockMode.WRITE)
                .acquire(LockLevel.USER, LockMode.WRITE);

        assertThatThrownBy(() -> ctx.release(LockLevel.BATTLE))
                .isInstanceOf(LockOrderViolationException.class);

        LockContext afterUser = ctx.release(LockLevel.USER);
        assertThat(afterUser.highestLevel()).contains(LockLevel.BATTLE);
        assertThat(afterUser.release(LockLevel.BATTLE).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Unsafe 가드는 필요한 레벨/모드를 보유하지 않으면 실패한다")
    void requireGuards() {
        LockContext ctx = LockContext.empty().acquire(LockLevel.WORLD, LockMode.READ);

        ctx.requireHeld(LockLevel.WORLD);
        assertThatThrownBy(() -> ctx.requireWrite(LockLevel.WORLD))
                .isInstanceOf(LockOrderViolationException.class);
        assertThatThrownBy(() -> ctx.requireHeld(LockLevel.USER))
                .isInstanceOf(LockOrderViolationException.class);
    }
}
