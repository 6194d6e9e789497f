package com.example.spacewars.user.repository;

import com.example.spacewars.global.persistence.DurableStore;
import com.example.spacewars.user.domain.User;

import java.util.Optional;

public interface UserStore extends DurableStore<Long, User> {

    Optional<User> loadByUsername(String username);

    /**
     * 신규 유저 저장 후 ID가 채워진 엔티티 반환
     */
    User insert(User user);
}
