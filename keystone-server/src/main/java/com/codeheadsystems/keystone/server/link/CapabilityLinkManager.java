package com.codeheadsystems.keystone.server.link;

import com.codeheadsystems.keystone.server.model.MessageLink;
import com.codeheadsystems.keystone.server.store.LinkStore;
import com.codeheadsystems.keystone.server.store.StoreConflictException;
import com.codeheadsystems.keystone.server.store.StoreException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates, resolves and deletes capability links.
 * <p>
 * Tokens are drawn from {@link SecureRandom} and encoded as unpadded base64url. The manager only
 * stores the access mask; enforcing it is up to whoever serves the linked resource. Expiry is
 * not checked here either, see {@code AuthorityResolver#resolveLink}.
 */
@Singleton
public class CapabilityLinkManager {

  private static final Logger log = LoggerFactory.getLogger(CapabilityLinkManager.class);
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

  private final LinkStore linkStore;
  private final LinkConfig config;
  private final SecureRandom random;

  /**
   * Instantiates a new Capability link manager.
   *
   * @param linkStore the link store
   * @param config    the config
   */
  @Inject
  public CapabilityLinkManager(final LinkStore linkStore, final LinkConfig config) {
    this(linkStore, config, new SecureRandom());
  }

  /**
   * Instantiates a new Capability link manager with a specific token source.
   *
   * @param linkStore the link store
   * @param config    the config
   * @param random    the random
   */
  public CapabilityLinkManager(final LinkStore linkStore, final LinkConfig config, final SecureRandom random) {
    log.info("CapabilityLinkManager(tokenBytes={})", config.tokenBytes());
    this.linkStore = linkStore;
    this.config = config;
    this.random = random;
  }

  /**
   * Creates and stores a new link. A token collision is retried with a fresh token; an existing
   * link is never overwritten.
   *
   * @param messageId the message the link grants access to
   * @param access    the access bitmask
   * @param expiresAt the expiry, or null
   * @param resource  the resource sub-selector, or null
   * @return the stored link
   * @throws StoreException if the store fails or every attempt collided
   */
  public MessageLink create(UUID messageId, int access, Instant expiresAt, String resource) {
    log.debug("create(messageId={}, access={}, expiresAt={})", messageId, access, expiresAt);
    for (int attempt = 1; attempt <= config.insertAttempts(); attempt++) {
      MessageLink link = new MessageLink(newToken(), messageId, access, expiresAt, resource);
      try {
        linkStore.insertLink(link);
        return link;
      } catch (StoreConflictException e) {
        log.warn("Link token collision for message {} (attempt {} of {})",
            messageId, attempt, config.insertAttempts());
      }
    }
    throw new StoreException("Unable to allocate a unique link token after "
        + config.insertAttempts() + " attempts");
  }

  /**
   * Exact-match lookup by message and token.
   *
   * @param messageId the message id
   * @param token     the token
   * @return the link, or empty
   */
  public Optional<MessageLink> resolve(UUID messageId, String token) {
    return linkStore.getLink(messageId, token);
  }

  public Optional<MessageLink> resolveByToken(String token) {
    return linkStore.getLinkByToken(token);
  }

  public List<MessageLink> list(UUID messageId) {
    return linkStore.getLinksForMessage(messageId);
  }

  /**
   * Deletes a link. Deleting a link that does not exist is not an error.
   *
   * @param messageId the message id
   * @param token     the token
   * @return whether a link existed
   */
  public boolean delete(UUID messageId, String token) {
    log.debug("delete(messageId={})", messageId);
    return linkStore.deleteLink(messageId, token);
  }

  private String newToken() {
    byte[] bytes = new byte[config.tokenBytes()];
    random.nextBytes(bytes);
    return B64URL.encodeToString(bytes);
  }
}
