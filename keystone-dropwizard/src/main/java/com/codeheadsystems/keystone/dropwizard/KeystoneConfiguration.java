package com.codeheadsystems.keystone.dropwizard;

import com.codeheadsystems.keystone.server.crypto.HasherConfig;
import com.codeheadsystems.keystone.server.link.LinkConfig;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Duration;

/**
 * Dropwizard configuration for the keystone authority.
 * <p>
 * The Argon2id defaults are interactive-strength. Lowering them is only sensible in tests.
 * <p>
 * When both {@code bootstrapAdminUsername} and {@code bootstrapAdminPassword} are set, an
 * account holding ADMIN and CREATE_USER is created at startup unless one with that username
 * already exists. Supply the password through an environment variable, not the YAML file.
 */
public class KeystoneConfiguration extends Configuration {

  /**
   * Argon2id memory cost in KiB.
   */
  @Min(8)
  private int argon2MemoryKib = HasherConfig.INTERACTIVE.memoryKib();

  /**
   * Argon2id time cost (passes over memory).
   */
  @Min(1)
  private int argon2Iterations = HasherConfig.INTERACTIVE.iterations();

  /**
   * Argon2id lanes.
   */
  @Min(1)
  private int argon2Parallelism = HasherConfig.INTERACTIVE.parallelism();

  /**
   * Size of the worker pool that runs password hashing, separate from the Jetty request threads.
   */
  @Min(1)
  private int hashingThreads = Runtime.getRuntime().availableProcessors();

  /**
   * A hash or verify still running after this many seconds fails with an internal error.
   */
  @Min(1)
  private long hashTimeoutSeconds = 10;

  /**
   * Random bytes per link token, before base64url encoding.
   */
  @Min(16)
  @Max(256)
  private int linkTokenBytes = LinkConfig.DEFAULT.tokenBytes();

  /**
   * How many fresh tokens to try when a generated token collides with a stored one.
   */
  @Min(1)
  private int linkInsertAttempts = LinkConfig.DEFAULT.insertAttempts();

  private String bootstrapAdminUsername;

  private String bootstrapAdminPassword;

  @JsonProperty
  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  @JsonProperty
  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  @JsonProperty
  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  @JsonProperty
  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  @JsonProperty
  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  @JsonProperty
  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  @JsonProperty
  public int getHashingThreads() {
    return hashingThreads;
  }

  @JsonProperty
  public void setHashingThreads(int hashingThreads) {
    this.hashingThreads = hashingThreads;
  }

  @JsonProperty
  public long getHashTimeoutSeconds() {
    return hashTimeoutSeconds;
  }

  @JsonProperty
  public void setHashTimeoutSeconds(long hashTimeoutSeconds) {
    this.hashTimeoutSeconds = hashTimeoutSeconds;
  }

  @JsonProperty
  public int getLinkTokenBytes() {
    return linkTokenBytes;
  }

  @JsonProperty
  public void setLinkTokenBytes(int linkTokenBytes) {
    this.linkTokenBytes = linkTokenBytes;
  }

  @JsonProperty
  public int getLinkInsertAttempts() {
    return linkInsertAttempts;
  }

  @JsonProperty
  public void setLinkInsertAttempts(int linkInsertAttempts) {
    this.linkInsertAttempts = linkInsertAttempts;
  }

  @JsonProperty
  public String getBootstrapAdminUsername() {
    return bootstrapAdminUsername;
  }

  @JsonProperty
  public void setBootstrapAdminUsername(String bootstrapAdminUsername) {
    this.bootstrapAdminUsername = bootstrapAdminUsername;
  }

  @JsonProperty
  public String getBootstrapAdminPassword() {
    return bootstrapAdminPassword;
  }

  @JsonProperty
  public void setBootstrapAdminPassword(String bootstrapAdminPassword) {
    this.bootstrapAdminPassword = bootstrapAdminPassword;
  }

  /**
   * The hashing parameters as the core expects them.
   *
   * @return the hasher config
   */
  public HasherConfig hasherConfig() {
    return HasherConfig.of(argon2MemoryKib, argon2Iterations, argon2Parallelism);
  }

  public LinkConfig linkConfig() {
    return new LinkConfig(linkTokenBytes, linkInsertAttempts);
  }

  public Duration hashTimeout() {
    return Duration.ofSeconds(hashTimeoutSeconds);
  }
}
