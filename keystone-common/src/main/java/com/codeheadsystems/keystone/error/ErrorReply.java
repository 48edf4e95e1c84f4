package com.codeheadsystems.keystone.error;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A fully rendered error response, independent of any web framework.
 * <p>
 * The body is kept as raw bytes so that a reply relayed from the authority can be written back
 * to the caller unchanged.
 *
 * @param status      the HTTP status
 * @param body        the response body
 * @param contentType the {@code Content-Type} of the body, or {@code null} if the upstream sent none
 * @param challenge   the {@code WWW-Authenticate} value, or {@code null} for none
 */
public record ErrorReply(int status, byte[] body, String contentType, String challenge) {

  public ErrorReply {
    body = body == null ? new byte[0] : body.clone();
  }

  @Override
  public byte[] body() {
    return body.clone();
  }

  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  public ErrorReply withChallenge(String challenge) {
    return new ErrorReply(status, body, contentType, challenge);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ErrorReply other
        && status == other.status
        && Arrays.equals(body, other.body)
        && Objects.equals(contentType, other.contentType)
        && Objects.equals(challenge, other.challenge);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(body) + Objects.hash(status, contentType, challenge);
  }

  @Override
  public String toString() {
    return "ErrorReply[status=" + status + ", contentType=" + contentType
        + ", challenge=" + challenge + ", bodyLength=" + body.length + "]";
  }
}
