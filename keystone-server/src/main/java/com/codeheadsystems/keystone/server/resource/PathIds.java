package com.codeheadsystems.keystone.server.resource;

import com.codeheadsystems.keystone.error.ApiException;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Parses ids taken from request paths. A malformed id is reported with the same failure as an
 * unknown one.
 */
final class PathIds {

  private PathIds() {
  }

  static UUID parse(String raw, Supplier<? extends ApiException> notFound) {
    return tryParse(raw).orElseThrow(notFound);
  }

  static Optional<UUID> tryParse(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(UUID.fromString(raw));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
