package com.codeheadsystems.keystone.client.model;

import java.net.URI;
import java.time.Duration;

/**
 * Network connection details for the authority service.
 *
 * @param baseUri        The base URL of the authority (e.g. http://auth:8080). Endpoint paths are appended to it.
 * @param requestTimeout Upper bound on one call to the authority, response body included.
 */
public record AuthorityConnectionInfo(URI baseUri, Duration requestTimeout) {

  public AuthorityConnectionInfo {
    if (baseUri == null) {
      throw new IllegalArgumentException("baseUri is required");
    }
    if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
  }

  /**
   * Resolves an endpoint path against the base URL, keeping any path prefix the base URL has.
   *
   * @param path the path, starting with a slash
   * @return the uri
   */
  public URI endpoint(String path) {
    String base = baseUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + path);
  }
}
