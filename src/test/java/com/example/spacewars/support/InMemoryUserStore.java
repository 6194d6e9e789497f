package com.example.spacewars.support;

import com.example.spacewars.global.persistence.EntityKind;
import com.example.spacewars.user.domain.User;
import com.example.spacewars.user.repository.UserStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryUserStore implements UserStore {

    private final Map<Long, User> rows = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger loads = new AtomicInteger();
    private final AtomicInteger upserts = new AtomicInteger();
    private final FailureInjection failures = new FailureInjection();

    @Override
    public EntityKind kind() {
        return EntityKind.USER;
    }

    @Override
    public Optional<User> loadById(Long id) {
        loads.incrementAndGet();
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public Optional<User> loadByUsername(String username) {
        loads.incrementAndGet();
        return rows.values().stream().filter(user -> user.getUsername().equals(username)).findFirst();
    }

    @Override
    public User insert(User user) {
        user.setId(sequence.incrementAndGet());
        rows.put(user.getId(), user);
        return user;
    }

    @Override
    public void upsert(User user) {
        failures.beforeWrite();
        rows.put(user.getId(), user);
        upserts.incrementAndGet();
    }

    @Override
    public void delete(Long id) {
        rows.remove(id);
    }

    /**
     * 캐시를 거치지 않고 저장소에만 넣는다 (캐시 미스 시나리오용)
     */
    public User seed(User user) {
        return insert(user);
    }

    public int loadCount() {
        return loads.get();
    }

    public int upsertCount() {
        return upserts.get();
    }

    public FailureInjection failures() {
        return failures;
    }
}
