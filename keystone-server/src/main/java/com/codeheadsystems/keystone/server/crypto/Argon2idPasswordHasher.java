package com.codeheadsystems.keystone.server.crypto;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.bouncycastle.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Argon2id password hasher built on BouncyCastle's {@link Argon2BytesGenerator}.
 * <p>
 * Hashes are stored in the PHC string format used by the reference implementation and
 * libsodium:
 * <pre>{@code
 *   $argon2id$v=19$m=65536,t=2,p=1$<salt, unpadded base64>$<hash, unpadded base64>
 * }</pre>
 * Salt, cost parameters and output length are all recovered from the string, so hashes created
 * with older parameters keep verifying after the configuration changes.
 */
public class Argon2idPasswordHasher implements PasswordHasher {

  private static final Logger log = LoggerFactory.getLogger(Argon2idPasswordHasher.class);

  private static final String ALGORITHM = "argon2id";
  private static final int VERSION = Argon2Parameters.ARGON2_VERSION_13;
  private static final Base64.Encoder B64 = Base64.getEncoder().withoutPadding();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  // Upper bounds applied to parameters read back from storage.
  private static final int MEMORY_HEADROOM = 4;
  private static final int MAX_ITERATIONS = 64;
  private static final int MAX_PARALLELISM = 64;

  private final HasherConfig config;
  private final SecureRandom random;
  private final int maxStoredMemoryKib;

  /**
   * Instantiates a new Argon2id password hasher.
   *
   * @param config the cost parameters for new hashes
   */
  public Argon2idPasswordHasher(final HasherConfig config) {
    this(config, new SecureRandom());
  }

  /**
   * Instantiates a new Argon2id password hasher with a specific salt source.
   *
   * @param config the config
   * @param random the random
   */
  public Argon2idPasswordHasher(final HasherConfig config, final SecureRandom random) {
    log.info("Argon2idPasswordHasher(memoryKib={}, iterations={}, parallelism={})",
        config.memoryKib(), config.iterations(), config.parallelism());
    this.config = config;
    this.random = random;
    this.maxStoredMemoryKib = (int) Math.min(Integer.MAX_VALUE,
        Math.max((long) MEMORY_HEADROOM * config.memoryKib(), HasherConfig.INTERACTIVE.memoryKib()));
  }

  /**
   * Largest memory cost a stored hash may ask for: four times the configured cost, and never less
   * than the interactive default. Anything above is refused before memory is allocated.
   *
   * @return the limit in kibibytes
   */
  int maxStoredMemoryKib() {
    return maxStoredMemoryKib;
  }

  @Override
  public String hash(String password) {
    byte[] salt = new byte[config.saltLength()];
    random.nextBytes(salt);
    byte[] derived = derive(password, salt, config.memoryKib(), config.iterations(),
        config.parallelism(), config.hashLength());
    return "$" + ALGORITHM + "$v=" + VERSION
        + "$m=" + config.memoryKib() + ",t=" + config.iterations() + ",p=" + config.parallelism()
        + "$" + B64.encodeToString(salt) + "$" + B64.encodeToString(derived);
  }

  @Override
  public boolean verify(String storedHash, String password) {
    EncodedHash encoded = parse(storedHash);
    if (encoded.memoryKib() > maxStoredMemoryKib) {
      throw new HashFailureException("Stored hash asks for " + encoded.memoryKib()
          + " KiB, above the limit of " + maxStoredMemoryKib + " KiB");
    }
    byte[] derived = derive(password, encoded.salt(), encoded.memoryKib(), encoded.iterations(),
        encoded.parallelism(), encoded.hash().length);
    return Arrays.constantTimeAreEqual(derived, encoded.hash());
  }

  private static byte[] derive(String password, byte[] salt, int memoryKib, int iterations,
                               int parallelism, int length) {
    try {
      Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
          .withVersion(VERSION)
          .withSalt(salt)
          .withMemoryAsKB(memoryKib)
          .withIterations(iterations)
          .withParallelism(parallelism)
          .build();
      Argon2BytesGenerator gen = new Argon2BytesGenerator();
      gen.init(params);
      byte[] out = new byte[length];
      gen.generateBytes(password.getBytes(StandardCharsets.UTF_8), out);
      return out;
    } catch (RuntimeException e) {
      throw new HashFailureException("Argon2id derivation failed", e);
    }
  }

  static EncodedHash parse(String storedHash) {
    if (storedHash == null) {
      throw new HashFailureException("Stored hash is absent");
    }
    // "", algorithm, version, params, salt, hash
    String[] parts = storedHash.split("\\$", -1);
    if (parts.length != 6 || !parts[0].isEmpty() || !ALGORITHM.equals(parts[1])) {
      throw new HashFailureException("Stored hash is not an argon2id PHC string");
    }
    if (!("v=" + VERSION).equals(parts[2])) {
      throw new HashFailureException("Unsupported argon2 version: " + parts[2]);
    }
    int memoryKib = -1;
    int iterations = -1;
    int parallelism = -1;
    for (String param : parts[3].split(",")) {
      int eq = param.indexOf('=');
      if (eq < 0) {
        throw new HashFailureException("Malformed argon2 parameter list");
      }
      int value = parseParameter(param.substring(eq + 1));
      switch (param.substring(0, eq)) {
        case "m" -> memoryKib = value;
        case "t" -> iterations = value;
        case "p" -> parallelism = value;
        default -> throw new HashFailureException("Unknown argon2 parameter: " + param.substring(0, eq));
      }
    }
    if (memoryKib < 8
        || iterations < 1 || iterations > MAX_ITERATIONS
        || parallelism < 1 || parallelism > MAX_PARALLELISM) {
      throw new HashFailureException("Argon2 parameters out of range");
    }
    byte[] salt;
    byte[] hash;
    try {
      salt = B64D.decode(parts[4]);
      hash = B64D.decode(parts[5]);
    } catch (IllegalArgumentException e) {
      throw new HashFailureException("Stored hash has invalid base64", e);
    }
    if (salt.length < 8 || hash.length < 16) {
      throw new HashFailureException("Stored hash has a truncated salt or digest");
    }
    return new EncodedHash(memoryKib, iterations, parallelism, salt, hash);
  }

  private static int parseParameter(String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new HashFailureException("Non-numeric argon2 parameter", e);
    }
  }

  record EncodedHash(int memoryKib, int iterations, int parallelism, byte[] salt, byte[] hash) {
  }
}
