package com.codeheadsystems.keystone.server.store;

import com.codeheadsystems.keystone.server.model.User;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage abstraction for user accounts.
 * <p>
 * Implementations must be thread-safe and must enforce username uniqueness. Any method may throw
 * {@link StoreException} for backend failures.
 */
public interface UserStore {

  /**
   * Finds a user by id.
   *
   * @param id the id
   * @return the user, or empty
   */
  Optional<User> getUserById(UUID id);

  /**
   * Finds a user by exact username.
   *
   * @param username the username
   * @return the user, or empty
   */
  Optional<User> getUserByUsername(String username);

  /**
   * Inserts a new user.
   *
   * @param user the user
   * @throws StoreConflictException if the username or id is taken
   */
  void insertUser(User user);

  /**
   * Replaces the stored user with the same id.
   *
   * @param user the new state
   * @return false if no user with that id exists
   * @throws StoreConflictException if the new username belongs to another user
   */
  boolean updateUser(User user);

  /**
   * Deletes a user.
   *
   * @param id the id
   * @return whether a user was deleted
   */
  boolean deleteUser(UUID id);
}
