package com.codeheadsystems.keystone.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for a service that delegates authentication to the keystone authority.
 */
public class RelyingServiceConfiguration extends Configuration {

  /**
   * Base URL of the authority, e.g. {@code http://keystone:8080}.
   */
  @NotEmpty
  private String authorityBaseUrl;

  @Min(1)
  private long authorityConnectTimeoutSeconds = 5;

  /**
   * Upper bound on one authority call, response body included. A call that runs longer is
   * reported to our caller as an internal error.
   */
  @Min(1)
  private long authorityRequestTimeoutSeconds = 10;

  @JsonProperty
  public String getAuthorityBaseUrl() {
    return authorityBaseUrl;
  }

  @JsonProperty
  public void setAuthorityBaseUrl(String authorityBaseUrl) {
    this.authorityBaseUrl = authorityBaseUrl;
  }

  @JsonProperty
  public long getAuthorityConnectTimeoutSeconds() {
    return authorityConnectTimeoutSeconds;
  }

  @JsonProperty
  public void setAuthorityConnectTimeoutSeconds(long authorityConnectTimeoutSeconds) {
    this.authorityConnectTimeoutSeconds = authorityConnectTimeoutSeconds;
  }

  @JsonProperty
  public long getAuthorityRequestTimeoutSeconds() {
    return authorityRequestTimeoutSeconds;
  }

  @JsonProperty
  public void setAuthorityRequestTimeoutSeconds(long authorityRequestTimeoutSeconds) {
    this.authorityRequestTimeoutSeconds = authorityRequestTimeoutSeconds;
  }
}
