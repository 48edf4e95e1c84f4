package com.codeheadsystems.keystone.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.keystone.server.crypto.CredentialVerifier;

/**
 * Health check that verifies the password hashing pool still accepts work.
 */
public class CredentialVerifierHealthCheck extends HealthCheck {

  private final CredentialVerifier credentialVerifier;

  /**
   * Instantiates a new Credential verifier health check.
   *
   * @param credentialVerifier the credential verifier
   */
  public CredentialVerifierHealthCheck(CredentialVerifier credentialVerifier) {
    this.credentialVerifier = credentialVerifier;
  }

  @Override
  protected Result check() {
    if (!credentialVerifier.isAcceptingWork()) {
      return Result.unhealthy("Hashing pool is shut down");
    }
    return Result.healthy();
  }
}
