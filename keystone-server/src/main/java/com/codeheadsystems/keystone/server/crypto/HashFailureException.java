package com.codeheadsystems.keystone.server.crypto;

/**
 * The password hashing backend failed, or a stored hash could not be parsed. Never a plain
 * mismatch: a wrong password is a {@code false} verification result.
 */
public class HashFailureException extends RuntimeException {

  public HashFailureException(final String message) {
    super(message);
  }

  public HashFailureException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
