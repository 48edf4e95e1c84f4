package com.codeheadsystems.keystone.server.crypto;

/**
 * Argon2id cost parameters for newly created hashes. Verification always uses the parameters
 * embedded in the stored hash.
 *
 * @param memoryKib   memory cost in kibibytes
 * @param iterations  number of passes
 * @param parallelism degree of parallelism
 * @param saltLength  salt length in bytes
 * @param hashLength  derived key length in bytes
 */
public record HasherConfig(int memoryKib, int iterations, int parallelism, int saltLength, int hashLength) {

  /**
   * Interactive cost: 64 MiB, two passes, one lane.
   */
  public static final HasherConfig INTERACTIVE = new HasherConfig(65536, 2, 1, 16, 32);

  public HasherConfig {
    if (memoryKib < 8 * parallelism) {
      throw new IllegalArgumentException("memoryKib must be at least 8 * parallelism");
    }
    if (iterations < 1 || parallelism < 1) {
      throw new IllegalArgumentException("iterations and parallelism must be positive");
    }
    if (saltLength < 8 || hashLength < 16) {
      throw new IllegalArgumentException("salt must be at least 8 bytes and hash at least 16 bytes");
    }
  }

  /**
   * Interactive defaults with different cost parameters.
   *
   * @param memoryKib   the memory kib
   * @param iterations  the iterations
   * @param parallelism the parallelism
   * @return the hasher config
   */
  public static HasherConfig of(int memoryKib, int iterations, int parallelism) {
    return new HasherConfig(memoryKib, iterations, parallelism, INTERACTIVE.saltLength(), INTERACTIVE.hashLength());
  }
}
