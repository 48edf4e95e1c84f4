package com.codeheadsystems.keystone.server.link;

/**
 * Link token settings.
 *
 * @param tokenBytes     random bytes per token; 32 bytes encode to 43 URL-safe characters
 * @param insertAttempts how many fresh tokens to try when an insert collides
 */
public record LinkConfig(int tokenBytes, int insertAttempts) {

  public static final LinkConfig DEFAULT = new LinkConfig(32, 3);

  public LinkConfig {
    if (tokenBytes < 16) {
      throw new IllegalArgumentException("tokenBytes must be at least 16");
    }
    if (insertAttempts < 1) {
      throw new IllegalArgumentException("insertAttempts must be positive");
    }
  }
}
