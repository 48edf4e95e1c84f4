package com.codeheadsystems.keystone.auth;

import com.codeheadsystems.keystone.auth.BasicAuthParseException.Reason;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Stateless codec for {@code Authorization: Basic base64(username:password)} headers.
 * <p>
 * The scheme token is matched case-insensitively and must be followed by exactly one space.
 * The decoded text must be valid UTF-8 and is split on the <em>first</em> colon, so passwords
 * may contain colons but usernames may not. Both parts must be non-empty.
 */
public final class BasicAuthCodec {

  /**
   * The scheme token including its separating space.
   */
  public static final String PREFIX = "Basic ";

  private BasicAuthCodec() {
  }

  /**
   * Decodes a header value.
   *
   * @param headerValue the raw header value, may be null
   * @return the credentials
   * @throws BasicAuthParseException if the header is absent or malformed
   */
  public static BasicCredentials decode(String headerValue) {
    if (headerValue == null || headerValue.isEmpty()) {
      throw new BasicAuthParseException(Reason.MISSING);
    }
    if (!headerValue.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
      throw new BasicAuthParseException(Reason.WRONG_SCHEME);
    }
    byte[] raw;
    try {
      raw = Base64.getDecoder().decode(headerValue.substring(PREFIX.length()));
    } catch (IllegalArgumentException e) {
      throw new BasicAuthParseException(Reason.INVALID_BASE64);
    }
    String text;
    try {
      text = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(raw))
          .toString();
    } catch (CharacterCodingException e) {
      throw new BasicAuthParseException(Reason.INVALID_TEXT);
    }
    int colon = text.indexOf(':');
    if (colon < 0) {
      throw new BasicAuthParseException(Reason.MISSING_SEPARATOR);
    }
    String username = text.substring(0, colon);
    String password = text.substring(colon + 1);
    if (username.isEmpty()) {
      throw new BasicAuthParseException(Reason.EMPTY_USERNAME);
    }
    if (password.isEmpty()) {
      throw new BasicAuthParseException(Reason.EMPTY_PASSWORD);
    }
    return new BasicCredentials(username, password);
  }

  /**
   * Encodes credentials into a header value.
   *
   * @param username the username
   * @param password the password
   * @return the header value, including the scheme
   */
  public static String encode(String username, String password) {
    String joined = username + ":" + password;
    return PREFIX + Base64.getEncoder().encodeToString(joined.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Presence check for relying services, which forward the header to the authority without
   * decoding it.
   *
   * @param headerValue the raw header value, may be null
   * @return the header value unchanged
   * @throws BasicAuthParseException with {@link Reason#MISSING} if there is no header
   */
  public static String requirePresent(String headerValue) {
    if (headerValue == null || headerValue.isBlank()) {
      throw new BasicAuthParseException(Reason.MISSING);
    }
    return headerValue;
  }
}
