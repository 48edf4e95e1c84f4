package com.codeheadsystems.keystone.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.keystone.client.model.AuthorityConnectionInfo;
import java.net.URI;

/**
 * Health check that verifies the authority base URL is usable. It does not call the authority:
 * an unreachable authority shows up as 500s on the requests that need it.
 */
public class AuthorityConnectionHealthCheck extends HealthCheck {

  private final AuthorityConnectionInfo connectionInfo;

  /**
   * Instantiates a new Authority connection health check.
   *
   * @param connectionInfo the connection info
   */
  public AuthorityConnectionHealthCheck(AuthorityConnectionInfo connectionInfo) {
    this.connectionInfo = connectionInfo;
  }

  @Override
  protected Result check() {
    URI base = connectionInfo.baseUri();
    String scheme = base.getScheme();
    if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
      return Result.unhealthy("Authority URL must be http or https: %s", base);
    }
    if (base.getHost() == null) {
      return Result.unhealthy("Authority URL has no host: %s", base);
    }
    return Result.healthy("authority=%s", base);
  }
}
