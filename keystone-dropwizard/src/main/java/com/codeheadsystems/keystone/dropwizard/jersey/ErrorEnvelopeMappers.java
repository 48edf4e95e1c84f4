package com.codeheadsystems.keystone.dropwizard.jersey;

import com.codeheadsystems.keystone.error.ErrorRelay;
import io.dropwizard.jersey.setup.JerseyEnvironment;

/**
 * Registers every mapper needed for all failures of a keystone service, including those raised
 * by Jersey and Jackson, to leave as the error envelope.
 */
public final class ErrorEnvelopeMappers {

  private ErrorEnvelopeMappers() {
  }

  /**
   * Registers the mappers.
   *
   * @param jersey             the jersey environment
   * @param errorRelay         the error relay
   * @param requireCredentials whether an unreadable body sent without credentials is a 401
   */
  public static void register(JerseyEnvironment jersey, ErrorRelay errorRelay, boolean requireCredentials) {
    ApiExceptionMapper apiExceptionMapper = new ApiExceptionMapper(errorRelay);
    WebApplicationExceptionMapper webApplicationExceptionMapper = new WebApplicationExceptionMapper(errorRelay);
    jersey.register(apiExceptionMapper);
    jersey.register(webApplicationExceptionMapper);
    jersey.register(new CompletionExceptionMapper(errorRelay, apiExceptionMapper, webApplicationExceptionMapper));
    jersey.register(new JsonParseExceptionMapper(errorRelay, requireCredentials));
    jersey.register(new JsonMappingExceptionMapper(errorRelay, requireCredentials));
    jersey.register(new UnhandledExceptionMapper(errorRelay));
  }
}
