package com.codeheadsystems.keystone.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /users}.
 *
 * @param username the new username
 * @param password the initial plaintext password
 * @param flags    the permission bitmask to grant
 */
public record CreateUserRequest(
    @JsonProperty("username") String username,
    @JsonProperty("password") String password,
    @JsonProperty("flags") long flags) {

  @Override
  public String toString() {
    return "CreateUserRequest[username=" + username + ", flags=" + flags + "]";
  }
}
