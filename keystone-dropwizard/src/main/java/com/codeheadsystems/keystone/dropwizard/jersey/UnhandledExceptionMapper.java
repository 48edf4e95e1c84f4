package com.codeheadsystems.keystone.dropwizard.jersey;

import com.codeheadsystems.keystone.error.ErrorRelay;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last resort for runtime failures no closer mapper claims: logged in full, answered with the
 * generic 500 envelope.
 */
@Provider
public class UnhandledExceptionMapper implements ExceptionMapper<RuntimeException> {

  private static final Logger log = LoggerFactory.getLogger(UnhandledExceptionMapper.class);

  private final ErrorRelay errorRelay;

  public UnhandledExceptionMapper(ErrorRelay errorRelay) {
    this.errorRelay = errorRelay;
  }

  @Override
  public Response toResponse(RuntimeException exception) {
    log.error("Unhandled failure in request", exception);
    return ApiExceptionMapper.toResponse(errorRelay.internalServerError());
  }
}
