package com.codeheadsystems.keystone.server.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A capability link granting access to one message.
 *
 * @param token     the unguessable bearer token, unique across all links
 * @param messageId the message the link belongs to, fixed at creation
 * @param access    the access bitmask; its meaning is up to the relying service
 * @param expiresAt when the link stops resolving, or {@code null} for never
 * @param resource  optional sub-selector within the message, or {@code null}
 */
public record MessageLink(String token, UUID messageId, int access, Instant expiresAt, String resource) {

  /**
   * Whether the link has expired at {@code now}. A link expiring exactly at {@code now} still
   * resolves.
   *
   * @param now the now
   * @return the boolean
   */
  public boolean isExpired(Instant now) {
    return expiresAt != null && now.isAfter(expiresAt);
  }

  @Override
  public String toString() {
    return "MessageLink[messageId=" + messageId + ", access=" + access + ", expiresAt=" + expiresAt
        + ", resource=" + resource + "]";
  }
}
