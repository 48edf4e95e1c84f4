package com.codeheadsystems.keystone.model.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Points at the part of the request an error refers to.
 *
 * @param pointer   JSON pointer into the request body (e.g. {@code /username})
 * @param parameter name of the offending query or path parameter
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorSource(
    @JsonProperty("pointer") String pointer,
    @JsonProperty("parameter") String parameter) {

  public static ErrorSource pointer(String pointer) {
    return new ErrorSource(pointer, null);
  }

  public static ErrorSource parameter(String parameter) {
    return new ErrorSource(null, parameter);
  }
}
