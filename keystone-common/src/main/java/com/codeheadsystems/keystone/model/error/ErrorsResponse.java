package com.codeheadsystems.keystone.model.error;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * The error envelope returned by every keystone service for any failed request:
 * {@code {"errors": [ ... ]}}.
 *
 * @param errors the individual errors, never empty
 */
public record ErrorsResponse(@JsonProperty("errors") List<ErrorObject> errors) {

  public ErrorsResponse {
    errors = List.copyOf(errors);
  }
}
