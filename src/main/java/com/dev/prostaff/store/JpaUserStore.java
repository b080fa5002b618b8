package com.dev.prostaff.store;

import com.dev.prostaff.repository.UserRepository;
import jakarta.transaction.Transactional;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Component
public class JpaUserStore implements UserStore {

    private final UserRepository userRepository;

    public JpaUserStore(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    @Transactional
    public Optional<UserRecord> findById(UUID id) {
        return userRepository.findById(id).map(UserRecord::from);
    }
}
