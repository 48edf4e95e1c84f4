package com.codeheadsystems.keystone.dropwizard.jersey;

import com.codeheadsystems.keystone.error.ErrorRelay;
import com.codeheadsystems.keystone.error.ErrorReply;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders failures raised by Jersey itself (unknown route, method not allowed, unsupported media
 * type and the like) as the keystone error envelope.
 * <p>
 * The status is kept and the reason phrase becomes the detail. Headers of the original response
 * such as {@code Allow} are carried over; the body and its framing headers are not.
 */
@Provider
public class WebApplicationExceptionMapper implements ExceptionMapper<WebApplicationException> {

  private static final Logger log = LoggerFactory.getLogger(WebApplicationExceptionMapper.class);

  private static final Set<String> REPLACED_HEADERS = Set.of(
      HttpHeaders.CONTENT_TYPE.toLowerCase(),
      HttpHeaders.CONTENT_LENGTH.toLowerCase(),
      HttpHeaders.WWW_AUTHENTICATE.toLowerCase());

  private final ErrorRelay errorRelay;

  /**
   * Instantiates a new Web application exception mapper.
   *
   * @param errorRelay the error relay
   */
  public WebApplicationExceptionMapper(ErrorRelay errorRelay) {
    this.errorRelay = errorRelay;
  }

  @Override
  public Response toResponse(WebApplicationException exception) {
    Response original = exception.getResponse();
    int status = original.getStatus();
    if (status >= 500) {
      log.error("Request failed with {}", status, exception);
      return ApiExceptionMapper.toResponse(errorRelay.internalServerError());
    }
    log.debug("Request failed with {}: {}", status, exception.getMessage());
    ErrorReply reply = errorRelay.reply(status, detail(original));
    Response.ResponseBuilder builder = ApiExceptionMapper.builder(reply);
    original.getStringHeaders().forEach((name, values) -> {
      if (!REPLACED_HEADERS.contains(name.toLowerCase())) {
        values.forEach(value -> builder.header(name, value));
      }
    });
    return builder.build();
  }

  private static String detail(Response original) {
    String reason = original.getStatusInfo().getReasonPhrase();
    return reason == null || reason.isBlank() ? "Request failed" : reason;
  }
}
