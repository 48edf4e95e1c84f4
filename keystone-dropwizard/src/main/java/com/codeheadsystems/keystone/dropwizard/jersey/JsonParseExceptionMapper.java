package com.codeheadsystems.keystone.dropwizard.jersey;

import com.codeheadsystems.keystone.error.ErrorRelay;
import com.fasterxml.jackson.core.exc.StreamReadException;
import jakarta.ws.rs.ext.Provider;

/**
 * A request body that is not JSON at all.
 */
@Provider
public class JsonParseExceptionMapper extends JsonBodyExceptionMapper<StreamReadException> {

  public JsonParseExceptionMapper(ErrorRelay errorRelay, boolean requireCredentials) {
    super(errorRelay, requireCredentials);
  }

  @Override
  protected String detail() {
    return "Request body is not valid JSON";
  }
}
