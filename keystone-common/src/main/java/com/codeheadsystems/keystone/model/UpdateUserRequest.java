package com.codeheadsystems.keystone.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code PATCH /users/@me}. Every member is optional; {@code null} leaves the current
 * value unchanged.
 *
 * @param username the new username
 * @param password the new plaintext password
 * @param flags    the new permission bitmask
 */
public record UpdateUserRequest(
    @JsonProperty("username") String username,
    @JsonProperty("password") String password,
    @JsonProperty("flags") Long flags) {

  @Override
  public String toString() {
    return "UpdateUserRequest[username=" + username + ", passwordChanged=" + (password != null)
        + ", flags=" + flags + "]";
  }
}
