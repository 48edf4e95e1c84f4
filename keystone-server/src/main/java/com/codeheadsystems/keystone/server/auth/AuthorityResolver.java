package com.codeheadsystems.keystone.server.auth;

import com.codeheadsystems.keystone.auth.BasicAuthCodec;
import com.codeheadsystems.keystone.auth.BasicAuthParseException;
import com.codeheadsystems.keystone.auth.BasicCredentials;
import com.codeheadsystems.keystone.error.AuthFailure;
import com.codeheadsystems.keystone.error.AuthFailureException;
import com.codeheadsystems.keystone.error.Completions;
import com.codeheadsystems.keystone.server.crypto.CredentialVerifier;
import com.codeheadsystems.keystone.server.link.CapabilityLinkManager;
import com.codeheadsystems.keystone.server.model.MessageLink;
import com.codeheadsystems.keystone.server.model.User;
import com.codeheadsystems.keystone.server.model.UserFlags;
import com.codeheadsystems.keystone.server.store.StoreException;
import com.codeheadsystems.keystone.server.store.UserStore;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides who a request to the authority comes from.
 * <p>
 * User resolution returns futures because password verification runs on the hashing pool. They
 * fail with {@link AuthFailureException}, possibly wrapped in a
 * {@link java.util.concurrent.CompletionException}:
 * <ul>
 *   <li>{@link AuthFailure#HEADER_MISSING} / {@link AuthFailure#HEADER_MALFORMED}: header problems</li>
 *   <li>{@link AuthFailure#CREDENTIAL_MISMATCH}: unknown user <em>or</em> wrong password. An unknown
 *       user still costs one full verification.</li>
 *   <li>{@link AuthFailure#FORBIDDEN}: authenticated, but missing a required flag</li>
 *   <li>{@link AuthFailure#INTERNAL_FAILURE}: storage error, corrupt hash, hashing timeout</li>
 * </ul>
 * Link resolution is synchronous and only ever fails with {@link AuthFailure#LINK_NOT_FOUND} or
 * {@link AuthFailure#INTERNAL_FAILURE}. Unknown, expired and wrong-message links are
 * indistinguishable.
 */
@Singleton
public class AuthorityResolver {

  private static final Logger log = LoggerFactory.getLogger(AuthorityResolver.class);

  private final UserStore userStore;
  private final CapabilityLinkManager linkManager;
  private final CredentialVerifier credentialVerifier;
  private final Clock clock;

  /**
   * Instantiates a new Authority resolver.
   *
   * @param userStore          the user store
   * @param linkManager        the link manager
   * @param credentialVerifier the credential verifier
   * @param clock              the clock used for link expiry
   */
  @Inject
  public AuthorityResolver(final UserStore userStore,
                           final CapabilityLinkManager linkManager,
                           final CredentialVerifier credentialVerifier,
                           final Clock clock) {
    this.userStore = userStore;
    this.linkManager = linkManager;
    this.credentialVerifier = credentialVerifier;
    this.clock = clock;
  }

  /**
   * Authenticates the caller from a raw {@code Authorization} header.
   *
   * @param headerValue the header value, may be null
   * @return the authenticated user
   */
  public CompletableFuture<User> resolveUser(String headerValue) {
    log.debug("resolveUser()");
    BasicCredentials credentials;
    Optional<User> candidate;
    try {
      credentials = BasicAuthCodec.decode(headerValue);
      candidate = userStore.getUserByUsername(credentials.username());
    } catch (BasicAuthParseException e) {
      return CompletableFuture.failedFuture(e);
    } catch (StoreException e) {
      log.error("User lookup failed", e);
      return CompletableFuture.failedFuture(new AuthFailureException(AuthFailure.INTERNAL_FAILURE, e));
    }
    if (candidate.isEmpty()) {
      return credentialVerifier.verifyUnknownUser(credentials.password())
          .<User>handle((ignored, error) -> {
            if (error != null) {
              log.error("Decoy verification failed", Completions.unwrap(error));
              throw new AuthFailureException(AuthFailure.INTERNAL_FAILURE, Completions.unwrap(error));
            }
            throw new AuthFailureException(AuthFailure.CREDENTIAL_MISMATCH);
          });
    }
    User user = candidate.get();
    return credentialVerifier.verify(user.passwordHash(), credentials.password())
        .handle((matches, error) -> {
          if (error != null) {
            log.error("Password verification failed for user {}", user.id(), Completions.unwrap(error));
            throw new AuthFailureException(AuthFailure.INTERNAL_FAILURE, Completions.unwrap(error));
          }
          if (!matches) {
            throw new AuthFailureException(AuthFailure.CREDENTIAL_MISMATCH);
          }
          return user;
        });
  }

  /**
   * Authenticates the caller and requires every bit of {@code requiredFlags}, unless the user is
   * an admin.
   *
   * @param headerValue   the header value
   * @param requiredFlags the required flags
   * @return the authenticated user
   */
  public CompletableFuture<User> resolveWithFlags(String headerValue, long requiredFlags) {
    log.debug("resolveWithFlags(requiredFlags={})", requiredFlags);
    return resolveUser(headerValue).thenApply(user -> {
      if (!UserFlags.permits(user.flags(), requiredFlags)) {
        throw new AuthFailureException(AuthFailure.FORBIDDEN);
      }
      return user;
    });
  }

  /**
   * Resolves a link by message and token.
   *
   * @param messageId the message id
   * @param token     the token
   * @return the link
   * @throws AuthFailureException if the link does not resolve
   */
  public MessageLink resolveLink(UUID messageId, String token) {
    log.debug("resolveLink(messageId={})", messageId);
    return usable(lookup(() -> linkManager.resolve(messageId, token)));
  }

  /**
   * Resolves a link by token alone, for the legacy {@code /links/{token}} route.
   *
   * @param token the token
   * @return the link
   * @throws AuthFailureException if the link does not resolve
   */
  public MessageLink resolveLink(String token) {
    log.debug("resolveLink()");
    return usable(lookup(() -> linkManager.resolveByToken(token)));
  }

  private Optional<MessageLink> lookup(Supplier<Optional<MessageLink>> query) {
    try {
      return query.get();
    } catch (StoreException e) {
      log.error("Link lookup failed", e);
      throw new AuthFailureException(AuthFailure.INTERNAL_FAILURE, e);
    }
  }

  private MessageLink usable(Optional<MessageLink> link) {
    if (link.isEmpty() || link.get().isExpired(clock.instant())) {
      throw new AuthFailureException(AuthFailure.LINK_NOT_FOUND);
    }
    return link.get();
  }
}
