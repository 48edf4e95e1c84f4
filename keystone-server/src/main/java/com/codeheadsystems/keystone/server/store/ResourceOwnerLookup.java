package com.codeheadsystems.keystone.server.store;

import java.util.Optional;
import java.util.UUID;

/**
 * Answers who owns a linkable resource. Messages themselves live in another service; the
 * authority only needs their owner to decide who may manage their links.
 */
public interface ResourceOwnerLookup {

  /**
   * Finds the owner of a resource.
   *
   * @param resourceId the resource id
   * @return the owning user's id, or empty if the resource is unknown
   */
  Optional<UUID> ownerOf(UUID resourceId);
}
