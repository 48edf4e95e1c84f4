package com.codeheadsystems.keystone.server.manager;

import com.codeheadsystems.keystone.error.AuthFailure;
import com.codeheadsystems.keystone.error.AuthFailureException;
import com.codeheadsystems.keystone.error.Completions;
import com.codeheadsystems.keystone.error.RequestException;
import com.codeheadsystems.keystone.model.CreateUserRequest;
import com.codeheadsystems.keystone.model.UpdateUserRequest;
import com.codeheadsystems.keystone.model.UserResponse;
import com.codeheadsystems.keystone.server.auth.AuthorityResolver;
import com.codeheadsystems.keystone.server.crypto.CredentialVerifier;
import com.codeheadsystems.keystone.server.model.User;
import com.codeheadsystems.keystone.server.model.UserFlags;
import com.codeheadsystems.keystone.server.store.StoreConflictException;
import com.codeheadsystems.keystone.server.store.StoreException;
import com.codeheadsystems.keystone.server.store.UserStore;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic account operations of the authority.
 * <p>
 * Every operation authenticates the caller from the raw {@code Authorization} header first and
 * only then looks at the request body. Returned futures fail with
 * {@link com.codeheadsystems.keystone.error.ApiException} subclasses, possibly wrapped in a
 * {@link java.util.concurrent.CompletionException}:
 * <ul>
 *   <li>{@link AuthFailureException}: 401 / 403 / 500 as per its kind</li>
 *   <li>{@link RequestException}: 400 invalid body, 404 account vanished, 409 username taken</li>
 * </ul>
 */
@Singleton
public class UserManager {

  private static final Logger log = LoggerFactory.getLogger(UserManager.class);

  private static final String USER_EXISTS = "User already exists";

  private final AuthorityResolver resolver;
  private final CredentialVerifier credentialVerifier;
  private final UserStore userStore;
  private final Clock clock;

  /**
   * Instantiates a new User manager.
   *
   * @param resolver           the resolver
   * @param credentialVerifier the credential verifier
   * @param userStore          the user store
   * @param clock              the clock
   */
  @Inject
  public UserManager(final AuthorityResolver resolver,
                     final CredentialVerifier credentialVerifier,
                     final UserStore userStore,
                     final Clock clock) {
    this.resolver = resolver;
    this.credentialVerifier = credentialVerifier;
    this.userStore = userStore;
    this.clock = clock;
  }

  /**
   * The public view of a stored user.
   *
   * @param user the user
   * @return the user response
   */
  public static UserResponse toResponse(User user) {
    return new UserResponse(user.id(), user.username(), user.flags(), user.createdAt());
  }

  // ── Current user ──────────────────────────────────────────────────────────

  public CompletableFuture<UserResponse> currentUser(String authorization) {
    log.debug("currentUser()");
    return resolver.resolveUser(authorization).thenApply(UserManager::toResponse);
  }

  /**
   * Applies a partial update to the caller's own account. Changing flags requires ADMIN.
   *
   * @param authorization the authorization header
   * @param request       the request
   * @return the updated user
   */
  public CompletableFuture<UserResponse> updateCurrentUser(String authorization, UpdateUserRequest request) {
    log.debug("updateCurrentUser({})", request);
    return resolver.resolveUser(authorization).thenCompose(user -> {
      RequestValidator.validate(request);
      if (request.flags() != null && request.flags() != user.flags()
          && !UserFlags.permits(user.flags(), UserFlags.ADMIN)) {
        throw new AuthFailureException(AuthFailure.FORBIDDEN);
      }
      User updated = user;
      if (request.username() != null) {
        updated = updated.withUsername(request.username());
      }
      if (request.flags() != null) {
        updated = updated.withFlags(request.flags());
      }
      CompletableFuture<User> pending = CompletableFuture.completedFuture(updated);
      if (request.password() != null) {
        User base = updated;
        pending = hashPassword(request.password()).thenApply(base::withPasswordHash);
      }
      return pending.thenApply(this::save).thenApply(UserManager::toResponse);
    });
  }

  public CompletableFuture<Void> deleteCurrentUser(String authorization) {
    log.debug("deleteCurrentUser()");
    return resolver.resolveUser(authorization).thenAccept(user -> {
      try {
        userStore.deleteUser(user.id());
      } catch (StoreException e) {
        log.error("Unable to delete user {}", user.id(), e);
        throw new AuthFailureException(AuthFailure.INTERNAL_FAILURE, e);
      }
      log.info("Deleted user {}", user.id());
    });
  }

  // ── Account creation ──────────────────────────────────────────────────────

  /**
   * Creates an account on behalf of a caller holding {@link UserFlags#CREATE_USER}. Callers who
   * are not admins can only grant flags they hold themselves.
   *
   * @param authorization the authorization header
   * @param request       the request
   * @return the created user
   */
  public CompletableFuture<UserResponse> createUser(String authorization, CreateUserRequest request) {
    log.debug("createUser({})", request);
    return resolver.resolveWithFlags(authorization, UserFlags.CREATE_USER).thenCompose(creator -> {
      RequestValidator.validate(request);
      if (!UserFlags.permits(creator.flags(), request.flags())) {
        throw new AuthFailureException(AuthFailure.FORBIDDEN);
      }
      if (lookupExisting(request.username())) {
        throw RequestException.conflict(USER_EXISTS);
      }
      return hashPassword(request.password())
          .thenApply(hash -> insert(request.username(), hash, request.flags()))
          .thenApply(UserManager::toResponse);
    });
  }

  /**
   * Creates an administrator account if no account with that username exists yet. Used to
   * provision the first account, which nobody could otherwise create.
   *
   * @param username the username
   * @param password the password
   * @return true if an account was created
   */
  public CompletableFuture<Boolean> bootstrapAdmin(String username, String password) {
    log.debug("bootstrapAdmin(username={})", username);
    try {
      RequestValidator.validateUsername(username);
      RequestValidator.validatePassword(password);
      if (lookupExisting(username)) {
        return CompletableFuture.completedFuture(false);
      }
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
    return hashPassword(password)
        .thenApply(hash -> insert(username, hash, UserFlags.ADMIN | UserFlags.CREATE_USER))
        .thenApply(user -> true);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private CompletableFuture<String> hashPassword(String password) {
    return credentialVerifier.hash(password).handle((hash, error) -> {
      if (error != null) {
        log.error("Password hashing failed", Completions.unwrap(error));
        throw new AuthFailureException(AuthFailure.INTERNAL_FAILURE, Completions.unwrap(error));
      }
      return hash;
    });
  }

  private boolean lookupExisting(String username) {
    try {
      return userStore.getUserByUsername(username).isPresent();
    } catch (StoreException e) {
      log.error("User lookup failed", e);
      throw new AuthFailureException(AuthFailure.INTERNAL_FAILURE, e);
    }
  }

  private User insert(String username, String passwordHash, long flags) {
    User user = new User(UUID.randomUUID(), username, passwordHash, flags, clock.instant());
    try {
      userStore.insertUser(user);
    } catch (StoreConflictException e) {
      throw RequestException.conflict(USER_EXISTS);
    } catch (StoreException e) {
      log.error("Unable to insert user", e);
      throw new AuthFailureException(AuthFailure.INTERNAL_FAILURE, e);
    }
    log.info("Created user {} with flags {}", user.id(), flags);
    return user;
  }

  private User save(User user) {
    boolean updated;
    try {
      updated = userStore.updateUser(user);
    } catch (StoreConflictException e) {
      throw RequestException.conflict(USER_EXISTS);
    } catch (StoreException e) {
      log.error("Unable to update user {}", user.id(), e);
      throw new AuthFailureException(AuthFailure.INTERNAL_FAILURE, e);
    }
    if (!updated) {
      throw RequestException.notFound("User not found");
    }
    return user;
  }
}
