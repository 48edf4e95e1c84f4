package com.codeheadsystems.keystone.server.crypto;

/**
 * Synchronous, CPU-bound password hashing. Callers on a request path go through
 * {@link CredentialVerifier}, which moves the work onto a dedicated pool.
 */
public interface PasswordHasher {

  /**
   * Hashes a password with a fresh random salt.
   *
   * @param password the plaintext password
   * @return a self-describing encoded hash, safe to store as is
   * @throws HashFailureException if the backend fails
   */
  String hash(String password);

  /**
   * Checks a password against a stored hash in constant time.
   *
   * @param storedHash the encoded hash produced by {@link #hash(String)}
   * @param password   the plaintext password
   * @return whether the password matches
   * @throws HashFailureException if the stored hash is malformed or the backend fails
   */
  boolean verify(String storedHash, String password);
}
