package com.codeheadsystems.keystone.server.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * The type Credential verifier test.
 */
class CredentialVerifierTest {

  private static final int THREADS = 8;
  private static final long WORK_MILLIS = 300;

  private ExecutorService pool;

  /**
   * Sets up.
   */
  @BeforeEach
  void setUp() {
    pool = CredentialVerifier.newHashingPool(THREADS);
  }

  /**
   * Tear down.
   */
  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  void hashThenVerify_roundTripsThroughPool() throws Exception {
    CredentialVerifier verifier = new CredentialVerifier(
        new Argon2idPasswordHasher(HasherConfig.of(1024, 1, 1)), pool, Duration.ofSeconds(30));

    String hash = verifier.hash("password1").get();

    assertThat(verifier.verify(hash, "password1").get()).isTrue();
    assertThat(verifier.verify(hash, "password2").get()).isFalse();
  }

  @Test
  void verify_runsOnHashingPool() throws Exception {
    List<String> threadNames = new ArrayList<>();
    CredentialVerifier verifier = new CredentialVerifier(new PasswordHasher() {
      @Override
      public String hash(String password) {
        return password;
      }

      @Override
      public boolean verify(String storedHash, String password) {
        synchronized (threadNames) {
          threadNames.add(Thread.currentThread().getName());
        }
        return true;
      }
    }, pool, Duration.ofSeconds(5));

    verifier.verify("x", "x").get();

    assertThat(threadNames).singleElement().asString().startsWith("keystone-hasher-");
  }

  /**
   * N concurrent verifications take about as long as one, not N times as long.
   */
  @Test
  void concurrentVerifies_overlap() throws Exception {
    CredentialVerifier verifier = new CredentialVerifier(new SlowHasher(), pool, Duration.ofSeconds(30));

    long start = System.nanoTime();
    List<CompletableFuture<Boolean>> futures = new ArrayList<>();
    for (int i = 0; i < THREADS; i++) {
      futures.add(verifier.verify("hash", "password-" + i));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
    long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

    assertThat(elapsedMillis).isLessThan(WORK_MILLIS * THREADS / 2);
  }

  @Test
  void verify_slowerThanTimeout_failsWithTimeout() {
    CredentialVerifier verifier = new CredentialVerifier(new SlowHasher(), pool, Duration.ofMillis(50));

    assertThatThrownBy(() -> verifier.verify("hash", "password").get())
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(TimeoutException.class);
  }

  @Test
  void verify_afterShutdown_failsWithHashFailure() {
    CredentialVerifier verifier = new CredentialVerifier(new SlowHasher(), pool, Duration.ofSeconds(1));
    pool.shutdown();

    assertThat(verifier.isAcceptingWork()).isFalse();
    assertThatThrownBy(() -> verifier.verify("hash", "password").get())
        .hasCauseInstanceOf(HashFailureException.class);
  }

  @Test
  void verifyUnknownUser_paysForFullVerifyAndNeverMatches() throws Exception {
    List<String> calls = new ArrayList<>();
    CredentialVerifier verifier = new CredentialVerifier(new PasswordHasher() {
      @Override
      public String hash(String password) {
        synchronized (calls) {
          calls.add("hash");
        }
        return "decoy:" + password;
      }

      @Override
      public boolean verify(String storedHash, String password) {
        synchronized (calls) {
          calls.add("verify " + storedHash.startsWith("decoy:") + " " + password);
        }
        return true;
      }
    }, pool, Duration.ofSeconds(5));

    assertThat(verifier.verifyUnknownUser("first").get()).isFalse();
    assertThat(verifier.verifyUnknownUser("second").get()).isFalse();

    assertThat(calls).containsExactly("hash", "verify true first", "verify true second");
  }

  @Test
  void verifyUnknownUser_takesAsLongAsVerify() throws Exception {
    CredentialVerifier verifier = new CredentialVerifier(new SlowHasher(), pool, Duration.ofSeconds(30));
    verifier.verifyUnknownUser("warm-up").get();

    long start = System.nanoTime();
    verifier.verifyUnknownUser("password").get();
    long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

    assertThat(elapsedMillis).isGreaterThanOrEqualTo(WORK_MILLIS);
  }

  private static class SlowHasher implements PasswordHasher {

    @Override
    public String hash(String password) {
      pause();
      return password;
    }

    @Override
    public boolean verify(String storedHash, String password) {
      pause();
      return false;
    }

    private static void pause() {
      try {
        Thread.sleep(WORK_MILLIS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new HashFailureException("interrupted", e);
      }
    }
  }
}
