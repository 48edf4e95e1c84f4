package com.codeheadsystems.keystone.server.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A stored user account.
 * <p>
 * {@code passwordHash} never leaves the authority; it is left out of {@link #toString()} so it
 * cannot end up in a log line.
 *
 * @param id           the id
 * @param username     the unique username
 * @param passwordHash the encoded password hash
 * @param flags        the permission bitmask, see {@link UserFlags}
 * @param createdAt    the creation time
 */
public record User(UUID id, String username, String passwordHash, long flags, Instant createdAt) {

  public User withUsername(String username) {
    return new User(id, username, passwordHash, flags, createdAt);
  }

  public User withPasswordHash(String passwordHash) {
    return new User(id, username, passwordHash, flags, createdAt);
  }

  public User withFlags(long flags) {
    return new User(id, username, passwordHash, flags, createdAt);
  }

  @Override
  public String toString() {
    return "User[id=" + id + ", username=" + username + ", flags=" + flags + ", createdAt=" + createdAt + "]";
  }
}
