package com.codeheadsystems.keystone.dropwizard.jersey;

import com.codeheadsystems.keystone.error.ErrorRelay;
import com.fasterxml.jackson.databind.DatabindException;
import jakarta.ws.rs.ext.Provider;

/**
 * A JSON request body whose fields do not fit the expected types, such as an {@code expires_after}
 * that is not an ISO-8601 duration.
 */
@Provider
public class JsonMappingExceptionMapper extends JsonBodyExceptionMapper<DatabindException> {

  public JsonMappingExceptionMapper(ErrorRelay errorRelay, boolean requireCredentials) {
    super(errorRelay, requireCredentials);
  }

  @Override
  protected String detail() {
    return "Request body has an invalid value";
  }
}
