package com.codeheadsystems.keystone.server.store;

import com.codeheadsystems.keystone.server.model.MessageLink;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link LinkStore} keyed by token.
 * <p>
 * All links are lost on restart. Suitable for development and integration testing only.
 */
public class InMemoryLinkStore implements LinkStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryLinkStore.class);

  private final ConcurrentHashMap<String, MessageLink> linksByToken = new ConcurrentHashMap<>();

  public InMemoryLinkStore() {
    log.warn("Using InMemoryLinkStore: links will NOT survive restarts. "
        + "Replace with a persistent LinkStore for production.");
  }

  @Override
  public Optional<MessageLink> getLink(UUID messageId, String token) {
    return getLinkByToken(token).filter(link -> link.messageId().equals(messageId));
  }

  @Override
  public Optional<MessageLink> getLinkByToken(String token) {
    return token == null ? Optional.empty() : Optional.ofNullable(linksByToken.get(token));
  }

  @Override
  public List<MessageLink> getLinksForMessage(UUID messageId) {
    return linksByToken.values().stream()
        .filter(link -> link.messageId().equals(messageId))
        .collect(Collectors.toList());
  }

  @Override
  public void insertLink(MessageLink link) {
    if (linksByToken.putIfAbsent(link.token(), link) != null) {
      throw new StoreConflictException("Link token already exists");
    }
  }

  @Override
  public boolean deleteLink(UUID messageId, String token) {
    MessageLink existing = token == null ? null : linksByToken.get(token);
    return existing != null && existing.messageId().equals(messageId) && linksByToken.remove(token, existing);
  }
}
