package com.codeheadsystems.keystone.error;

/**
 * Every way an authentication or authorization attempt can fail, with the status and detail
 * the caller sees. Internal causes are logged where they happen and never exposed here.
 */
public enum AuthFailure {

  HEADER_MISSING(401, "Missing authorization header"),
  HEADER_MALFORMED(401, "Invalid authorization header"),
  /**
   * Unknown user and wrong password are deliberately the same failure.
   */
  CREDENTIAL_MISMATCH(401, "Incorrect username or password"),
  FORBIDDEN(403, "You cannot perform this action"),
  /**
   * Unknown, expired and mismatched links all look like this.
   */
  LINK_NOT_FOUND(401, "Message link not found"),
  INTERNAL_FAILURE(500, ErrorRelay.INTERNAL_SERVER_ERROR_DETAIL),
  UPSTREAM_TRANSPORT_FAILURE(500, ErrorRelay.INTERNAL_SERVER_ERROR_DETAIL),
  /**
   * The authority answered with a failure; status and body come from that answer.
   */
  UPSTREAM_RELAYED(502, "Bad gateway");

  private final int status;
  private final String detail;

  AuthFailure(int status, String detail) {
    this.status = status;
    this.detail = detail;
  }

  public int status() {
    return status;
  }

  public String detail() {
    return detail;
  }
}
