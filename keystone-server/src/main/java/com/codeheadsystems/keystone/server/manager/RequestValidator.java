package com.codeheadsystems.keystone.server.manager;

import com.codeheadsystems.keystone.error.RequestException;
import com.codeheadsystems.keystone.model.CreateLinkRequest;
import com.codeheadsystems.keystone.model.CreateUserRequest;
import com.codeheadsystems.keystone.model.UpdateUserRequest;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Input rules for request bodies. Every violation is a 400 pointing at the offending member.
 */
final class RequestValidator {

  static final int USERNAME_MIN = 3;
  static final int USERNAME_MAX = 32;
  static final int PASSWORD_MIN = 8;
  static final int PASSWORD_MAX = 120;
  static final int RESOURCE_MAX = 120;
  static final int ACCESS_MAX = Short.MAX_VALUE;
  static final Duration EXPIRES_AFTER_MIN = Duration.ofMinutes(1);
  static final Duration EXPIRES_AFTER_MAX = Duration.ofDays(3650);

  private static final Pattern USERNAME = Pattern.compile("^[\\w\\-\\s]+$", Pattern.UNICODE_CHARACTER_CLASS);

  private RequestValidator() {
  }

  static void validate(CreateUserRequest request) {
    requireBody(request);
    validateUsername(request.username());
    validatePassword(request.password());
    validateFlags(request.flags());
  }

  static void validate(UpdateUserRequest request) {
    requireBody(request);
    if (request.username() != null) {
      validateUsername(request.username());
    }
    if (request.password() != null) {
      validatePassword(request.password());
    }
    if (request.flags() != null) {
      validateFlags(request.flags());
    }
  }

  static void validate(CreateLinkRequest request) {
    requireBody(request);
    if (request.access() != null && (request.access() < 0 || request.access() > ACCESS_MAX)) {
      throw RequestException.badRequest("Access must be between 0 and " + ACCESS_MAX, "/access");
    }
    Duration expiresAfter = request.expiresAfter();
    if (expiresAfter != null
        && (expiresAfter.compareTo(EXPIRES_AFTER_MIN) < 0 || expiresAfter.compareTo(EXPIRES_AFTER_MAX) > 0)) {
      throw RequestException.badRequest("Expiry must be between one minute and ten years", "/expires_after");
    }
    String resource = request.resource();
    if (resource != null && (resource.isEmpty() || resource.length() > RESOURCE_MAX)) {
      throw RequestException.badRequest("Resource must be between 1 and " + RESOURCE_MAX + " characters",
          "/resource");
    }
  }

  static void validateUsername(String username) {
    if (username == null
        || username.length() < USERNAME_MIN
        || username.length() > USERNAME_MAX
        || !USERNAME.matcher(username).matches()) {
      throw RequestException.badRequest("Username must be " + USERNAME_MIN + " to " + USERNAME_MAX
          + " letters, digits, underscores, hyphens or spaces", "/username");
    }
  }

  static void validatePassword(String password) {
    if (password == null || password.length() < PASSWORD_MIN || password.length() > PASSWORD_MAX) {
      throw RequestException.badRequest("Password must be " + PASSWORD_MIN + " to " + PASSWORD_MAX
          + " characters", "/password");
    }
  }

  static void validateFlags(long flags) {
    if (flags < 0) {
      throw RequestException.badRequest("Flags must not be negative", "/flags");
    }
  }

  private static void requireBody(Object body) {
    if (body == null) {
      throw RequestException.badRequest("Missing request body", "");
    }
  }
}
