package com.codeheadsystems.keystone.error;

/**
 * An {@link AuthFailure} raised while resolving a caller.
 */
public class AuthFailureException extends ApiException {

  private final AuthFailure kind;
  private final String publicDetail;

  /**
   * Instantiates a new Auth failure exception with the default detail of its kind.
   *
   * @param kind the kind
   */
  public AuthFailureException(final AuthFailure kind) {
    this(kind, kind.detail());
  }

  /**
   * Instantiates a new Auth failure exception with a specific public detail.
   *
   * @param kind         the kind
   * @param publicDetail the detail sent to the caller
   */
  public AuthFailureException(final AuthFailure kind, final String publicDetail) {
    super(kind + ": " + publicDetail);
    this.kind = kind;
    this.publicDetail = publicDetail;
  }

  /**
   * Instantiates a new Auth failure exception caused by an internal error. The cause is kept for
   * logging only.
   *
   * @param kind  the kind
   * @param cause the cause
   */
  public AuthFailureException(final AuthFailure kind, final Throwable cause) {
    super(kind + ": " + kind.detail(), cause);
    this.kind = kind;
    this.publicDetail = kind.detail();
  }

  public AuthFailure kind() {
    return kind;
  }

  public String publicDetail() {
    return publicDetail;
  }

  @Override
  public int status() {
    return kind.status();
  }

  @Override
  public ErrorReply toReply(ErrorRelay relay) {
    return relay.reply(kind.status(), publicDetail);
  }
}
