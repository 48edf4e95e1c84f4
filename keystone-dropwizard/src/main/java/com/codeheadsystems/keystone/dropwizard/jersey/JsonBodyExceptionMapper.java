package com.codeheadsystems.keystone.dropwizard.jersey;

import com.codeheadsystems.keystone.error.AuthFailure;
import com.codeheadsystems.keystone.error.AuthFailureException;
import com.codeheadsystems.keystone.error.ErrorRelay;
import com.codeheadsystems.keystone.error.RequestException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.InvalidDefinitionException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a request body Jackson could not read as a 400 in the keystone error envelope, with a
 * {@code source.pointer} to the offending field when Jackson knows it.
 * <p>
 * When {@code requireCredentials} is set and the request came without an {@code Authorization}
 * header, the caller gets the missing-header 401 instead, as the resource would have answered.
 * <p>
 * Subclasses bind to subtypes of {@link JsonProcessingException}; Jersey prefers them over
 * Dropwizard's own mapper for the broader type.
 *
 * @param <E> the Jackson failure handled
 */
public abstract class JsonBodyExceptionMapper<E extends JsonProcessingException> implements ExceptionMapper<E> {

  private static final Logger log = LoggerFactory.getLogger(JsonBodyExceptionMapper.class);

  private final ErrorRelay errorRelay;
  private final boolean requireCredentials;

  @Context
  private HttpHeaders headers;

  /**
   * Instantiates a new Json body exception mapper.
   *
   * @param errorRelay         the error relay
   * @param requireCredentials whether a request without credentials is answered with a 401
   */
  protected JsonBodyExceptionMapper(ErrorRelay errorRelay, boolean requireCredentials) {
    this.errorRelay = errorRelay;
    this.requireCredentials = requireCredentials;
  }

  /**
   * The detail sent for this kind of failure.
   *
   * @return the detail
   */
  protected abstract String detail();

  @Override
  public Response toResponse(E exception) {
    return toResponse(exception, headers == null ? null : headers.getHeaderString(HttpHeaders.AUTHORIZATION));
  }

  /**
   * Renders the failure for a request that carried the given Authorization header.
   *
   * @param exception     the exception
   * @param authorization the Authorization header, or null
   * @return the response
   */
  public Response toResponse(E exception, String authorization) {
    if (exception instanceof InvalidDefinitionException definition) {
      log.error("Unable to bind JSON to {}", definition.getType(), exception);
      return ApiExceptionMapper.toResponse(errorRelay.internalServerError());
    }
    if (requireCredentials && (authorization == null || authorization.isBlank())) {
      log.debug("Unreadable body without credentials: {}", exception.getOriginalMessage());
      return ApiExceptionMapper.toResponse(
          new AuthFailureException(AuthFailure.HEADER_MISSING).toReply(errorRelay));
    }
    log.debug("Unreadable request body: {}", exception.getOriginalMessage());
    return ApiExceptionMapper.toResponse(
        RequestException.badRequest(detail(), pointer(exception)).toReply(errorRelay));
  }

  /**
   * The JSON pointer of the field Jackson failed on, or the empty pointer for the whole body.
   *
   * @param exception the exception
   * @return the pointer
   */
  static String pointer(JsonProcessingException exception) {
    if (!(exception instanceof JsonMappingException mapping)) {
      return "";
    }
    StringBuilder pointer = new StringBuilder();
    for (JsonMappingException.Reference reference : mapping.getPath()) {
      if (reference.getFieldName() != null) {
        pointer.append('/').append(reference.getFieldName().replace("~", "~0").replace("/", "~1"));
      } else if (reference.getIndex() >= 0) {
        pointer.append('/').append(reference.getIndex());
      }
    }
    return pointer.toString();
  }
}
