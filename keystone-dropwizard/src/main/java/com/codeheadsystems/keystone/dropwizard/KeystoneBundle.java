package com.codeheadsystems.keystone.dropwizard;

import com.codeheadsystems.keystone.dropwizard.health.CredentialVerifierHealthCheck;
import com.codeheadsystems.keystone.dropwizard.jersey.ErrorEnvelopeMappers;
import com.codeheadsystems.keystone.error.Completions;
import com.codeheadsystems.keystone.error.ErrorRelay;
import com.codeheadsystems.keystone.server.auth.AuthorityResolver;
import com.codeheadsystems.keystone.server.crypto.Argon2idPasswordHasher;
import com.codeheadsystems.keystone.server.crypto.CredentialVerifier;
import com.codeheadsystems.keystone.server.link.CapabilityLinkManager;
import com.codeheadsystems.keystone.server.manager.MessageLinkManager;
import com.codeheadsystems.keystone.server.manager.UserManager;
import com.codeheadsystems.keystone.server.resource.LegacyLinkResource;
import com.codeheadsystems.keystone.server.resource.LinkResource;
import com.codeheadsystems.keystone.server.resource.UserLinkResource;
import com.codeheadsystems.keystone.server.resource.UserResource;
import com.codeheadsystems.keystone.server.store.InMemoryLinkStore;
import com.codeheadsystems.keystone.server.store.InMemoryResourceOwnerLookup;
import com.codeheadsystems.keystone.server.store.InMemoryUserStore;
import com.codeheadsystems.keystone.server.store.LinkStore;
import com.codeheadsystems.keystone.server.store.ResourceOwnerLookup;
import com.codeheadsystems.keystone.server.store.UserStore;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that turns an application into the keystone authority.
 * <p>
 * Registers the user and link resources, the exception mappers that render the error envelope,
 * and a health check for the hashing pool. Password hashing runs on a managed pool of
 * {@code hashingThreads} threads, never on Jetty's request threads.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new KeystoneBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent stores and the lookup that knows who owns a message:
 * <pre>{@code
 *   bootstrap.addBundle(new KeystoneBundle<>(myUserStore, myLinkStore, myOwnerLookup));
 * }</pre>
 */
@Singleton
public class KeystoneBundle<C extends KeystoneConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(KeystoneBundle.class);

  private final UserStore userStore;
  private final LinkStore linkStore;
  private final ResourceOwnerLookup resourceOwnerLookup;
  private final Clock clock;

  /**
   * Creates a bundle backed by in-memory stores. Nobody owns any message, so links can only be
   * managed once a real {@link ResourceOwnerLookup} is supplied.
   * <p>
   * For dev/test only: all accounts and links are lost on restart.
   */
  public KeystoneBundle() {
    this(new InMemoryUserStore(), new InMemoryLinkStore(), new InMemoryResourceOwnerLookup());
    log.warn("""
        #################################################################
        # WARNING: Using ephemeral in-memory user and link stores.      #
        # All data will be lost on restart.                             #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied collaborators.
   *
   * @param userStore           the user store
   * @param linkStore           the link store
   * @param resourceOwnerLookup the resource owner lookup
   */
  @Inject
  public KeystoneBundle(UserStore userStore,
                        LinkStore linkStore,
                        ResourceOwnerLookup resourceOwnerLookup) {
    this.userStore = userStore;
    this.linkStore = linkStore;
    this.resourceOwnerLookup = resourceOwnerLookup;
    this.clock = Clock.systemUTC();
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // Nothing to add before the configuration is known.
  }

  @Override
  public void run(C configuration, Environment environment) {
    ExecutorService hashingPool = environment.lifecycle()
        .executorService("keystone-hasher-%d")
        .minThreads(configuration.getHashingThreads())
        .maxThreads(configuration.getHashingThreads())
        .build();
    CredentialVerifier credentialVerifier = new CredentialVerifier(
        new Argon2idPasswordHasher(configuration.hasherConfig()), hashingPool, configuration.hashTimeout());
    CapabilityLinkManager capabilityLinkManager = new CapabilityLinkManager(linkStore, configuration.linkConfig());
    AuthorityResolver resolver = new AuthorityResolver(userStore, capabilityLinkManager, credentialVerifier, clock);
    UserManager userManager = new UserManager(resolver, credentialVerifier, userStore, clock);
    MessageLinkManager messageLinkManager =
        new MessageLinkManager(resolver, capabilityLinkManager, resourceOwnerLookup, clock);

    ErrorRelay errorRelay = new ErrorRelay(environment.getObjectMapper());
    ErrorEnvelopeMappers.register(environment.jersey(), errorRelay, true);

    environment.jersey().register(new UserResource(userManager));
    environment.jersey().register(new LinkResource(messageLinkManager));
    environment.jersey().register(new LegacyLinkResource(messageLinkManager));
    environment.jersey().register(new UserLinkResource(messageLinkManager));
    environment.healthChecks().register("credential-verifier", new CredentialVerifierHealthCheck(credentialVerifier));

    bootstrapAdmin(configuration, userManager);
  }

  private void bootstrapAdmin(C configuration, UserManager userManager) {
    String username = configuration.getBootstrapAdminUsername();
    String password = configuration.getBootstrapAdminPassword();
    if (username == null || username.isEmpty() || password == null || password.isEmpty()) {
      return;
    }
    boolean created;
    try {
      created = userManager.bootstrapAdmin(username, password).join();
    } catch (CompletionException e) {
      throw new IllegalStateException("Unable to create bootstrap admin " + username, Completions.unwrap(e));
    }
    if (created) {
      log.info("Created bootstrap admin {}", username);
    } else {
      log.info("Bootstrap admin {} already exists", username);
    }
  }
}
