package com.codeheadsystems.keystone.server.store;

import com.codeheadsystems.keystone.server.model.User;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link UserStore} backed by {@link ConcurrentHashMap}s.
 * <p>
 * All accounts are lost on restart. Suitable for development and integration testing only.
 */
public class InMemoryUserStore implements UserStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryUserStore.class);

  private final ConcurrentHashMap<UUID, User> usersById = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, UUID> idsByUsername = new ConcurrentHashMap<>();

  public InMemoryUserStore() {
    log.warn("Using InMemoryUserStore: accounts will NOT survive restarts. "
        + "Replace with a persistent UserStore for production.");
  }

  @Override
  public Optional<User> getUserById(UUID id) {
    return Optional.ofNullable(usersById.get(id));
  }

  @Override
  public Optional<User> getUserByUsername(String username) {
    UUID id = idsByUsername.get(username);
    return id == null ? Optional.empty() : getUserById(id);
  }

  @Override
  public synchronized void insertUser(User user) {
    if (usersById.containsKey(user.id()) || idsByUsername.containsKey(user.username())) {
      throw new StoreConflictException("User already exists");
    }
    idsByUsername.put(user.username(), user.id());
    usersById.put(user.id(), user);
    log.debug("Inserted user {}", user.id());
  }

  @Override
  public synchronized boolean updateUser(User user) {
    User existing = usersById.get(user.id());
    if (existing == null) {
      return false;
    }
    if (!existing.username().equals(user.username())) {
      if (idsByUsername.containsKey(user.username())) {
        throw new StoreConflictException("Username is taken");
      }
      idsByUsername.remove(existing.username());
      idsByUsername.put(user.username(), user.id());
    }
    usersById.put(user.id(), user);
    return true;
  }

  @Override
  public synchronized boolean deleteUser(UUID id) {
    User removed = usersById.remove(id);
    if (removed == null) {
      return false;
    }
    idsByUsername.remove(removed.username());
    return true;
  }
}
