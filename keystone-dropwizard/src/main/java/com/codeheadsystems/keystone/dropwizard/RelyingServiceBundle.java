package com.codeheadsystems.keystone.dropwizard;

import com.codeheadsystems.keystone.client.accessor.RemoteAuthClient;
import com.codeheadsystems.keystone.client.model.AuthorityConnectionInfo;
import com.codeheadsystems.keystone.dropwizard.health.AuthorityConnectionHealthCheck;
import com.codeheadsystems.keystone.dropwizard.jersey.ErrorEnvelopeMappers;
import com.codeheadsystems.keystone.error.ErrorRelay;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle for a service that trusts the keystone authority instead of checking
 * credentials itself.
 * <p>
 * Builds a {@link RemoteAuthClient} and registers the exception mappers, so a failure relayed
 * from the authority leaves this service exactly as the authority sent it. Resources registered
 * by the application fetch the client in their {@code run} method:
 * <pre>{@code
 *   private final RelyingServiceBundle<MyConfig> keystone = new RelyingServiceBundle<>();
 *
 *   public void initialize(Bootstrap<MyConfig> bootstrap) {
 *     bootstrap.addBundle(keystone);
 *   }
 *
 *   public void run(MyConfig config, Environment environment) {
 *     environment.jersey().register(new InboxResource(keystone.getRemoteAuthClient()));
 *   }
 * }</pre>
 */
public class RelyingServiceBundle<C extends RelyingServiceConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(RelyingServiceBundle.class);

  private RemoteAuthClient remoteAuthClient;

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // Nothing to add before the configuration is known.
  }

  @Override
  public void run(C configuration, Environment environment) {
    AuthorityConnectionInfo connectionInfo = new AuthorityConnectionInfo(
        URI.create(configuration.getAuthorityBaseUrl()),
        Duration.ofSeconds(configuration.getAuthorityRequestTimeoutSeconds()));
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(configuration.getAuthorityConnectTimeoutSeconds()))
        .build();
    ErrorRelay errorRelay = new ErrorRelay(environment.getObjectMapper());
    remoteAuthClient = new RemoteAuthClient(httpClient, environment.getObjectMapper(), connectionInfo, errorRelay);

    ErrorEnvelopeMappers.register(environment.jersey(), errorRelay, false);
    environment.healthChecks().register("authority-connection", new AuthorityConnectionHealthCheck(connectionInfo));
    log.info("Relying on authority at {}", connectionInfo.baseUri());
  }

  /**
   * The client for the configured authority. Available once the bundle has run.
   *
   * @return the remote auth client
   */
  public RemoteAuthClient getRemoteAuthClient() {
    if (remoteAuthClient == null) {
      throw new IllegalStateException("RelyingServiceBundle has not run yet");
    }
    return remoteAuthClient;
  }
}
