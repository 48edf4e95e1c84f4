package com.codeheadsystems.keystone.server.store;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link ResourceOwnerLookup} that resources are registered into explicitly.
 * For development and integration testing only.
 */
public class InMemoryResourceOwnerLookup implements ResourceOwnerLookup {

  private static final Logger log = LoggerFactory.getLogger(InMemoryResourceOwnerLookup.class);

  private final ConcurrentHashMap<UUID, UUID> owners = new ConcurrentHashMap<>();

  public InMemoryResourceOwnerLookup() {
    log.warn("Using InMemoryResourceOwnerLookup: resource ownership must be registered by hand.");
  }

  /**
   * Records the owner of a resource.
   *
   * @param resourceId the resource id
   * @param ownerId    the owner id
   */
  public void register(UUID resourceId, UUID ownerId) {
    owners.put(resourceId, ownerId);
  }

  @Override
  public Optional<UUID> ownerOf(UUID resourceId) {
    return Optional.ofNullable(owners.get(resourceId));
  }
}
