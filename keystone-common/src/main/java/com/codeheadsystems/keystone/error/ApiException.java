package com.codeheadsystems.keystone.error;

/**
 * Root of every failure that is allowed to reach the HTTP boundary of a keystone service.
 * Framework adapters render it with {@link #toReply(ErrorRelay)} and nothing else.
 */
public abstract class ApiException extends RuntimeException {

  protected ApiException(final String message) {
    super(message);
  }

  protected ApiException(final String message, final Throwable cause) {
    super(message, cause);
  }

  /**
   * The HTTP status the caller will see.
   *
   * @return the status
   */
  public abstract int status();

  /**
   * Renders this failure.
   *
   * @param relay the relay
   * @return the reply
   */
  public abstract ErrorReply toReply(ErrorRelay relay);
}
