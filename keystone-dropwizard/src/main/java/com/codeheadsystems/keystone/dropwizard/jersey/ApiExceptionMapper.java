package com.codeheadsystems.keystone.dropwizard.jersey;

import com.codeheadsystems.keystone.error.ApiException;
import com.codeheadsystems.keystone.error.ErrorRelay;
import com.codeheadsystems.keystone.error.ErrorReply;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes an {@link ApiException} as the keystone error envelope.
 * <p>
 * The body goes out as the exact bytes of the {@link ErrorReply}, so a reply relayed from the
 * authority is not re-serialized on the way through.
 */
@Provider
public class ApiExceptionMapper implements ExceptionMapper<ApiException> {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionMapper.class);

  private final ErrorRelay errorRelay;

  /**
   * Instantiates a new Api exception mapper.
   *
   * @param errorRelay the error relay
   */
  public ApiExceptionMapper(ErrorRelay errorRelay) {
    this.errorRelay = errorRelay;
  }

  /**
   * Builds the JAX-RS response for a rendered reply.
   *
   * @param reply the reply
   * @return the response
   */
  public static Response toResponse(ErrorReply reply) {
    return builder(reply).build();
  }

  /**
   * Starts a JAX-RS response for a rendered reply, for callers that add headers of their own.
   *
   * @param reply the reply
   * @return the response builder
   */
  public static Response.ResponseBuilder builder(ErrorReply reply) {
    Response.ResponseBuilder builder = Response.status(reply.status()).entity(reply.body());
    if (reply.contentType() != null) {
      builder.type(reply.contentType());
    }
    if (reply.challenge() != null) {
      builder.header(HttpHeaders.WWW_AUTHENTICATE, reply.challenge());
    }
    return builder;
  }

  @Override
  public Response toResponse(ApiException exception) {
    if (exception.status() >= 500) {
      log.warn("Request failed with {}: {}", exception.status(), exception.getMessage(), exception.getCause());
    } else {
      log.debug("Request failed with {}: {}", exception.status(), exception.getMessage());
    }
    return toResponse(exception.toReply(errorRelay));
  }
}
