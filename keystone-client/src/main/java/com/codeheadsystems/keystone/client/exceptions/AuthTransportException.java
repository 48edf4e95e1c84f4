package com.codeheadsystems.keystone.client.exceptions;

import com.codeheadsystems.keystone.error.AuthFailure;
import com.codeheadsystems.keystone.error.AuthFailureException;

/**
 * No usable response was obtained from the authority. The caller sees a generic 500.
 */
public class AuthTransportException extends AuthFailureException {

  /**
   * Instantiates a new Auth transport exception.
   *
   * @param cause the cause
   */
  public AuthTransportException(final Throwable cause) {
    super(AuthFailure.UPSTREAM_TRANSPORT_FAILURE, cause);
  }
}
