package com.codeheadsystems.keystone.client.exceptions;

import com.codeheadsystems.keystone.error.AuthFailure;
import com.codeheadsystems.keystone.error.AuthFailureException;
import com.codeheadsystems.keystone.error.ErrorRelay;
import com.codeheadsystems.keystone.error.ErrorReply;

/**
 * The authority answered with a failure that is passed on to our own caller as received.
 */
public class RelayedErrorException extends AuthFailureException {

  private final ErrorReply upstream;

  /**
   * Instantiates a new Relayed error exception.
   *
   * @param upstream the reply as received from the authority
   */
  public RelayedErrorException(final ErrorReply upstream) {
    super(AuthFailure.UPSTREAM_RELAYED, "Authority answered " + upstream.status());
    this.upstream = upstream;
  }

  public ErrorReply upstream() {
    return upstream;
  }

  @Override
  public int status() {
    return upstream.status();
  }

  @Override
  public ErrorReply toReply(ErrorRelay relay) {
    return relay.normalize(upstream);
  }
}
