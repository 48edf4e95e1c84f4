package com.codeheadsystems.keystone.server.manager;

import com.codeheadsystems.keystone.error.AuthFailure;
import com.codeheadsystems.keystone.error.AuthFailureException;
import com.codeheadsystems.keystone.error.RequestException;
import com.codeheadsystems.keystone.model.CreateLinkRequest;
import com.codeheadsystems.keystone.model.MessageLinkResponse;
import com.codeheadsystems.keystone.server.auth.AuthorityResolver;
import com.codeheadsystems.keystone.server.link.CapabilityLinkManager;
import com.codeheadsystems.keystone.server.model.MessageLink;
import com.codeheadsystems.keystone.server.model.User;
import com.codeheadsystems.keystone.server.store.ResourceOwnerLookup;
import com.codeheadsystems.keystone.server.store.StoreException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic link operations of the authority.
 * <p>
 * Managing links (create, list, delete) requires Basic credentials of the message owner; a
 * message the caller does not own is reported as not found. Resolving a link needs no
 * credentials: the token is the credential.
 */
@Singleton
public class MessageLinkManager {

  private static final Logger log = LoggerFactory.getLogger(MessageLinkManager.class);

  private final AuthorityResolver resolver;
  private final CapabilityLinkManager linkManager;
  private final ResourceOwnerLookup ownerLookup;
  private final Clock clock;

  /**
   * Instantiates a new Message link manager.
   *
   * @param resolver    the resolver
   * @param linkManager the link manager
   * @param ownerLookup the owner lookup
   * @param clock       the clock
   */
  @Inject
  public MessageLinkManager(final AuthorityResolver resolver,
                            final CapabilityLinkManager linkManager,
                            final ResourceOwnerLookup ownerLookup,
                            final Clock clock) {
    this.resolver = resolver;
    this.linkManager = linkManager;
    this.ownerLookup = ownerLookup;
    this.clock = clock;
  }

  public static MessageLinkResponse toResponse(MessageLink link) {
    return new MessageLinkResponse(link.token(), link.messageId(), link.access(), link.expiresAt(), link.resource());
  }

  // ── Owner operations ──────────────────────────────────────────────────────

  /**
   * Creates a link to one of the caller's messages.
   *
   * @param authorization the authorization header
   * @param messageId     the message id
   * @param request       the request, null for defaults
   * @return the created link
   */
  public CompletableFuture<MessageLinkResponse> createLink(String authorization, UUID messageId,
                                                           CreateLinkRequest request) {
    log.debug("createLink(messageId={})", messageId);
    CreateLinkRequest effective = request == null ? CreateLinkRequest.empty() : request;
    return resolver.resolveUser(authorization).thenApply(user -> {
      requireOwner(user, messageId);
      RequestValidator.validate(effective);
      Instant expiresAt = effective.expiresAfter() == null ? null : clock.instant().plus(effective.expiresAfter());
      MessageLink link = storeCall(() ->
          linkManager.create(messageId, effective.accessOrDefault(), expiresAt, effective.resource()));
      log.info("User {} created a link to message {}", user.id(), messageId);
      return toResponse(link);
    });
  }

  public CompletableFuture<List<MessageLinkResponse>> listLinks(String authorization, UUID messageId) {
    log.debug("listLinks(messageId={})", messageId);
    return resolver.resolveUser(authorization).thenApply(user -> {
      requireOwner(user, messageId);
      return storeCall(() -> linkManager.list(messageId)).stream()
          .map(MessageLinkManager::toResponse)
          .collect(Collectors.toList());
    });
  }

  /**
   * Deletes a link of one of the caller's messages.
   *
   * @param authorization the authorization header
   * @param messageId     the message id
   * @param token         the token
   * @return completes when deleted; fails with 404 if the link does not exist
   */
  public CompletableFuture<Void> deleteLink(String authorization, UUID messageId, String token) {
    log.debug("deleteLink(messageId={})", messageId);
    return resolver.resolveUser(authorization).thenAccept(user -> {
      requireOwner(user, messageId);
      if (token == null || !storeCall(() -> linkManager.delete(messageId, token))) {
        throw RequestException.notFound("Link not found");
      }
    });
  }

  // ── Public resolution ─────────────────────────────────────────────────────

  public MessageLinkResponse resolveLink(UUID messageId, String token) {
    return toResponse(resolver.resolveLink(messageId, token));
  }

  public MessageLinkResponse resolveLink(String token) {
    return toResponse(resolver.resolveLink(token));
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private void requireOwner(User user, UUID messageId) {
    Optional<UUID> owner = storeCall(() -> ownerLookup.ownerOf(messageId));
    if (owner.isEmpty() || !owner.get().equals(user.id())) {
      throw RequestException.notFound("Message not found");
    }
  }

  private <T> T storeCall(Supplier<T> call) {
    try {
      return call.get();
    } catch (StoreException e) {
      log.error("Link storage failed", e);
      throw new AuthFailureException(AuthFailure.INTERNAL_FAILURE, e);
    }
  }
}
