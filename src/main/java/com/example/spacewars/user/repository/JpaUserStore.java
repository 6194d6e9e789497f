package com.example.spacewars.user.repository;

import com.example.spacewars.global.persistence.EntityKind;
import com.example.spacewars.user.domain.User;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaUserStore implements UserStore {

    private final UserRepository userRepository;

    @Override
    public EntityKind kind() {
        return EntityKind.USER;
    }

    @Override
    public Optional<User> loadById(Long id) {
        return userRepository.findById(id);
    }

    @Override
    public Optional<User> loadByUsername(String username) {
        return userRepository.findByUsername(username);
    }

    @Override
    public User insert(User user) {
        return userRepository.save(user);
    }

    @Override
    public void upsert(User user) {
        userRepository.save(user);
    }

    @Override
    public void delete(Long id) {
        userRepository.deleteById(id);
    }
}
