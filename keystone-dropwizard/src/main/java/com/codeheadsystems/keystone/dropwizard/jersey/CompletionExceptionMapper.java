package com.codeheadsystems.keystone.dropwizard.jersey;

import com.codeheadsystems.keystone.error.ApiException;
import com.codeheadsystems.keystone.error.Completions;
import com.codeheadsystems.keystone.error.ErrorRelay;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles failures of resource methods that return a {@link java.util.concurrent.CompletionStage}.
 * Jersey hands these over still wrapped; the cause decides the response.
 */
@Provider
public class CompletionExceptionMapper implements ExceptionMapper<CompletionException> {

  private static final Logger log = LoggerFactory.getLogger(CompletionExceptionMapper.class);

  private final ErrorRelay errorRelay;
  private final ApiExceptionMapper apiExceptionMapper;
  private final WebApplicationExceptionMapper webApplicationExceptionMapper;

  /**
   * Instantiates a new Completion exception mapper.
   *
   * @param errorRelay                    the error relay
   * @param apiExceptionMapper            the api exception mapper
   * @param webApplicationExceptionMapper the web application exception mapper
   */
  public CompletionExceptionMapper(ErrorRelay errorRelay,
                                   ApiExceptionMapper apiExceptionMapper,
                                   WebApplicationExceptionMapper webApplicationExceptionMapper) {
    this.errorRelay = errorRelay;
    this.apiExceptionMapper = apiExceptionMapper;
    this.webApplicationExceptionMapper = webApplicationExceptionMapper;
  }

  @Override
  public Response toResponse(CompletionException exception) {
    Throwable cause = Completions.unwrap(exception);
    if (cause instanceof ApiException api) {
      return apiExceptionMapper.toResponse(api);
    }
    if (cause instanceof WebApplicationException web) {
      return webApplicationExceptionMapper.toResponse(web);
    }
    log.error("Unhandled failure in asynchronous request", cause);
    return ApiExceptionMapper.toResponse(errorRelay.internalServerError());
  }
}
