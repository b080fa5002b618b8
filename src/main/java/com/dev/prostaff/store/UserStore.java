package com.dev.prostaff.store;

import java.util.Optional;
import java.util.UUID;

public interface UserStore {

    Optional<UserRecord> findById(UUID id);
}
