package com.codeheadsystems.keystone.server.store;

import com.codeheadsystems.keystone.server.model.MessageLink;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage abstraction for capability links.
 * <p>
 * Implementations must be thread-safe and must never overwrite an existing token. Any method may
 * throw {@link StoreException} for backend failures.
 */
public interface LinkStore {

  /**
   * Looks a link up by message and token. Both must match.
   *
   * @param messageId the message id
   * @param token     the token
   * @return the link, or empty
   */
  Optional<MessageLink> getLink(UUID messageId, String token);

  /**
   * Looks a link up by token alone.
   *
   * @param token the token
   * @return the link, or empty
   */
  Optional<MessageLink> getLinkByToken(String token);

  /**
   * Lists every link of a message.
   *
   * @param messageId the message id
   * @return the links, possibly empty
   */
  List<MessageLink> getLinksForMessage(UUID messageId);

  /**
   * Inserts a new link.
   *
   * @param link the link
   * @throws StoreConflictException if the token already exists
   */
  void insertLink(MessageLink link);

  /**
   * Deletes a link.
   *
   * @param messageId the message id
   * @param token     the token
   * @return whether a link was deleted
   */
  boolean deleteLink(UUID messageId, String token);
}
