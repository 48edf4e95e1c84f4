package com.codeheadsystems.keystone.auth;

import com.codeheadsystems.keystone.error.AuthFailure;
import com.codeheadsystems.keystone.error.AuthFailureException;

/**
 * Raised by {@link BasicAuthCodec} when an {@code Authorization} header cannot be decoded.
 */
public class BasicAuthParseException extends AuthFailureException {

  /**
   * Why a header was rejected.
   */
  public enum Reason {
    MISSING,
    WRONG_SCHEME,
    INVALID_BASE64,
    INVALID_TEXT,
    MISSING_SEPARATOR,
    EMPTY_USERNAME,
    EMPTY_PASSWORD
  }

  private static final String WRONG_SCHEME_DETAIL = "Expected a Basic authorization token";

  private final Reason reason;

  /**
   * Instantiates a new Basic auth parse exception.
   *
   * @param reason the reason
   */
  public BasicAuthParseException(final Reason reason) {
    super(kindOf(reason), detailOf(reason));
    this.reason = reason;
  }

  private static AuthFailure kindOf(Reason reason) {
    return reason == Reason.MISSING ? AuthFailure.HEADER_MISSING : AuthFailure.HEADER_MALFORMED;
  }

  private static String detailOf(Reason reason) {
    return switch (reason) {
      case MISSING -> AuthFailure.HEADER_MISSING.detail();
      case WRONG_SCHEME -> WRONG_SCHEME_DETAIL;
      default -> AuthFailure.HEADER_MALFORMED.detail();
    };
  }

  public Reason reason() {
    return reason;
  }
}
