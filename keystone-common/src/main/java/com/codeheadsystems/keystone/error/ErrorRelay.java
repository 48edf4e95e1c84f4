package com.codeheadsystems.keystone.error;

import com.codeheadsystems.keystone.model.error.ErrorObject;
import com.codeheadsystems.keystone.model.error.ErrorsResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shapes failures into the error envelope shared by the authority and every relying service.
 * <p>
 * Every 401 leaving a keystone service carries {@code WWW-Authenticate: Basic}. Locally produced
 * 401s get it from {@link #reply(int, ErrorsResponse)}; relayed 401s keep the upstream challenge
 * and only get the default one when the upstream sent none (see {@link #normalize(ErrorReply)}).
 */
public class ErrorRelay {

  /**
   * The challenge attached to every 401.
   */
  public static final String BASIC_CHALLENGE = "Basic";

  /**
   * Content type of the JSON envelope.
   */
  public static final String APPLICATION_JSON = "application/json";

  /**
   * Generic detail used whenever internal detail must not leave the service.
   */
  public static final String INTERNAL_SERVER_ERROR_DETAIL = "Internal server error";

  private static final Logger log = LoggerFactory.getLogger(ErrorRelay.class);
  private static final int UNAUTHORIZED = 401;

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Error relay.
   *
   * @param objectMapper the object mapper used to write the envelope
   */
  public ErrorRelay(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Builds an envelope holding exactly one error.
   *
   * @param status the status
   * @param detail the detail
   * @return the envelope
   */
  public static ErrorsResponse single(int status, String detail) {
    return new ErrorsResponse(List.of(ErrorObject.of(status, detail)));
  }

  /**
   * Renders a single-error envelope.
   *
   * @param status the status
   * @param detail the detail
   * @return the reply
   */
  public ErrorReply reply(int status, String detail) {
    return reply(status, single(status, detail));
  }

  /**
   * Renders an envelope as JSON, attaching the Basic challenge to 401s.
   *
   * @param status   the HTTP status of the reply
   * @param envelope the envelope
   * @return the reply
   */
  public ErrorReply reply(int status, ErrorsResponse envelope) {
    byte[] body;
    try {
      body = objectMapper.writeValueAsBytes(envelope);
    } catch (JsonProcessingException e) {
      log.error("Unable to write error envelope for status {}", status, e);
      return plainInternalServerError();
    }
    return new ErrorReply(status, body, APPLICATION_JSON, status == UNAUTHORIZED ? BASIC_CHALLENGE : null);
  }

  public ErrorReply internalServerError() {
    return reply(500, INTERNAL_SERVER_ERROR_DETAIL);
  }

  /**
   * Prepares a reply received from another service for relaying. Status, body and content type
   * are kept as received. A 401 without a challenge gets the Basic challenge.
   *
   * @param relayed the reply as received
   * @return the reply to send on
   */
  public ErrorReply normalize(ErrorReply relayed) {
    if (relayed.status() == UNAUTHORIZED
        && (relayed.challenge() == null || relayed.challenge().isBlank())) {
      return relayed.withChallenge(BASIC_CHALLENGE);
    }
    return relayed;
  }

  private static ErrorReply plainInternalServerError() {
    return new ErrorReply(500, INTERNAL_SERVER_ERROR_DETAIL.getBytes(StandardCharsets.UTF_8),
        "text/plain; charset=UTF-8", null);
  }
}
