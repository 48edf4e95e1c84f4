package com.codeheadsystems.keystone.model.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

/**
 * One entry of the {@code errors} list in an {@link ErrorsResponse}.
 * <p>
 * Only {@code status} and {@code detail} are always present; absent optional members are
 * omitted from the JSON rather than written as {@code null}.
 *
 * @param status HTTP status this error maps to
 * @param detail human readable explanation, safe to show to the caller
 * @param code   optional machine readable code
 * @param title  optional short summary
 * @param source optional pointer to the offending request field or parameter
 * @param meta   optional free-form string metadata
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "detail", "code", "title", "source", "meta"})
public record ErrorObject(
    @JsonProperty("status") int status,
    @JsonProperty("detail") String detail,
    @JsonProperty("code") String code,
    @JsonProperty("title") String title,
    @JsonProperty("source") ErrorSource source,
    @JsonProperty("meta") Map<String, String> meta) {

  /**
   * Creates an error carrying only a status and detail.
   *
   * @param status the status
   * @param detail the detail
   * @return the error object
   */
  public static ErrorObject of(int status, String detail) {
    return new ErrorObject(status, detail, null, null, null, null);
  }

  public ErrorObject withSource(ErrorSource source) {
    return new ErrorObject(status, detail, code, title, source, meta);
  }
}
