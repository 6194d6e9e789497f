package com.example.spacewars.user.cache;

import com.example.spacewars.global.cache.WriteBehindCache;
import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.concurrency.LockLevel;
import com.example.spacewars.global.concurrency.LockManager;
import com.example.spacewars.global.error.CommonException;
import com.example.spacewars.global.error.ErrorCode;
import com.example.spacewars.user.domain.User;
import com.example.spacewars.user.repository.UserStore;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 유저 캐시 (USER 레벨)
 */
@Component
public class UserCache extends WriteBehindCache<Long, User> {

    private final UserStore userStore;
    private final Map<String, Long> usernameIndex = new ConcurrentHashMap<>();

    public UserCache(LockManager lockManager, UserStore userStore, RetryTemplate persistenceRetryTemplate) {
        super(lockManager, userStore, persistenceRetryTemplate);
        this.userStore = userStore;
    }

    @Override
    protected Long idOf(User user) {
        return user.getId();
    }

    @Override
    protected CommonException notFound(Long id) {
        return ErrorCode.USER_NOT_FOUND.commonException("userId=" + id);
    }

    @Override
    protected void onAdmit(User user) {
        usernameIndex.put(user.getUsername(), user.getId());
    }

    @Override
    protected void onClear() {
        usernameIndex.clear();
    }

    /**
     * 유저명으로 조회. 캐시에 이미 있는 사본이 저장소 사본보다 우선한다.
     */
    public Optional<User> getUserByUsernameUnsafe(LockContext ctx, String username) {
        ctx.requireHeld(LockLevel.USER);
        Long id = usernameIndex.get(username);
        if (id != null) {
            return getUnsafe(ctx, id);
        }
        Optional<User> loaded = lockManager.withRead(ctx, LockLevel.DATABASE,
                dbCtx -> userStore.loadByUsername(username));
        return loaded.map(this::admitIfAbsent);
    }

    /**
     * 신규 유저를 저장소에 넣어 ID를 받고 캐시에 올린다.
     */
    public User insertUnsafe(LockContext ctx, User user) {
        ctx.requireWrite(LockLevel.USER);
        User saved = lockManager.withWrite(ctx, LockLevel.DATABASE, dbCtx -> userStore.insert(user));
        admit(saved);
        return saved;
    }
}
