package com.dev.prostaff.store;

import com.dev.prostaff.domain.Role;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mutable user directory for unit tests.
 */
public class InMemoryUserStore implements UserStore {

    private final Map<UUID, UserRecord> users = new ConcurrentHashMap<>();

    public UserRecord add(UUID organizationId, Role role) {
        UUID id = UUID.randomUUID();
        UserRecord user = new UserRecord(id, organizationId, role, id + "@prostaff.gg", "Player " + id);
        users.put(id, user);
        return user;
    }

    public void put(UserRecord user) {
        users.put(user.id(), user);
    }

    /** Detaches the user from their organization, as when a member leaves the team. */
    public void removeFromOrganization(UUID userId) {
        users.computeIfPresent(userId, (id, user) ->
                new UserRecord(id, null, user.role(), user.email(), user.fullName()));
    }

    public void delete(UUID userId) {
        users.remove(userId);
    }

    @Override
    public Optional<UserRecord> findById(UUID id) {
        return Optional.ofNullable(users.get(id));
    }
}
