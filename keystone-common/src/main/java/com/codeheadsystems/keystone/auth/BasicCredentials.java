package com.codeheadsystems.keystone.auth;

/**
 * A username/password pair decoded from a Basic header. Lives only for one verification call.
 *
 * @param username the username
 * @param password the plaintext password
 */
public record BasicCredentials(String username, String password) {

  @Override
  public String toString() {
    return "BasicCredentials[username=" + username + ", password=***]";
  }
}
