package com.codeheadsystems.keystone.server.crypto;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link PasswordHasher} on a dedicated worker pool so that hashing never occupies the
 * threads serving requests.
 * <p>
 * The pool is sized independently of the request threads. Every returned future fails with a
 * {@link java.util.concurrent.TimeoutException} once the configured timeout elapses; the
 * underlying computation cannot be interrupted and finishes in the background.
 * <p>
 * Futures fail with {@link HashFailureException} for backend errors and malformed stored hashes.
 * A wrong password is a successful {@code false}.
 */
public class CredentialVerifier {

  private static final Logger log = LoggerFactory.getLogger(CredentialVerifier.class);

  private final PasswordHasher hasher;
  private final ExecutorService hashingPool;
  private final Duration timeout;
  private volatile String decoyHash;

  /**
   * Instantiates a new Credential verifier.
   *
   * @param hasher      the hasher
   * @param hashingPool the pool hashing work runs on
   * @param timeout     the per-call timeout
   */
  public CredentialVerifier(final PasswordHasher hasher,
                            final ExecutorService hashingPool,
                            final Duration timeout) {
    log.info("CredentialVerifier(timeout={})", timeout);
    this.hasher = hasher;
    this.hashingPool = hashingPool;
    this.timeout = timeout;
  }

  /**
   * Creates a fixed pool of daemon threads named {@code keystone-hasher-N}.
   * <p>
   * The caller owns the pool; call {@link ExecutorService#shutdown()} when done. In Dropwizard
   * prefer a managed executor from {@code environment.lifecycle()}.
   *
   * @param threads the number of threads
   * @return the executor service
   */
  public static ExecutorService newHashingPool(int threads) {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(threads, r -> {
      Thread t = new Thread(r, "keystone-hasher-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  /**
   * Hashes a password off the calling thread.
   *
   * @param password the password
   * @return the encoded hash
   */
  public CompletableFuture<String> hash(String password) {
    log.debug("hash()");
    return submit(() -> hasher.hash(password));
  }

  /**
   * Verifies a password against a stored hash off the calling thread.
   *
   * @param storedHash the stored hash
   * @param password   the password
   * @return whether the password matches
   */
  public CompletableFuture<Boolean> verify(String storedHash, String password) {
    log.debug("verify()");
    return submit(() -> hasher.verify(storedHash, password));
  }

  /**
   * Verifies a password against a decoy hash that nothing matches, for a username with no user
   * behind it. Costs the same as {@link #verify(String, String)} and always completes with false.
   *
   * @param password the password
   * @return false
   */
  public CompletableFuture<Boolean> verifyUnknownUser(String password) {
    log.debug("verifyUnknownUser()");
    return submit(() -> {
      hasher.verify(decoyHash(), password);
      return false;
    });
  }

  /**
   * Whether the pool still takes new work.
   *
   * @return true while the pool is running
   */
  public boolean isAcceptingWork() {
    return !hashingPool.isShutdown();
  }

  // Created on first use, on the hashing pool, with the configured cost parameters.
  private String decoyHash() {
    String hash = decoyHash;
    if (hash == null) {
      synchronized (this) {
        if (decoyHash == null) {
          decoyHash = hasher.hash(UUID.randomUUID().toString());
        }
        hash = decoyHash;
      }
    }
    return hash;
  }

  private <T> CompletableFuture<T> submit(Supplier<T> work) {
    try {
      return CompletableFuture.supplyAsync(work, hashingPool)
          .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(new HashFailureException("Hashing pool rejected work", e));
    }
  }
}
