package com.codeheadsystems.keystone.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;

/**
 * Body of {@code POST /messages/{messageId}/links}. An empty object creates a link with no
 * access bits, no expiry and no resource restriction.
 *
 * @param access       the access bitmask, interpreted by the relying service
 * @param expiresAfter optional ISO-8601 duration after which the link stops resolving
 * @param resource     optional sub-selector restricting the link to one resource of the message
 */
public record CreateLinkRequest(
    @JsonProperty("access") Integer access,
    @JsonProperty("expires_after") Duration expiresAfter,
    @JsonProperty("resource") String resource) {

  /**
   * The request used when the caller sends no body.
   *
   * @return an all-defaults request
   */
  public static CreateLinkRequest empty() {
    return new CreateLinkRequest(null, null, null);
  }

  public int accessOrDefault() {
    return access == null ? 0 : access;
  }
}
