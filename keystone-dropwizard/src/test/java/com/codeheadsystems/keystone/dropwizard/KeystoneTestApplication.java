package com.codeheadsystems.keystone.dropwizard;

import com.codeheadsystems.keystone.server.store.InMemoryLinkStore;
import com.codeheadsystems.keystone.server.store.InMemoryResourceOwnerLookup;
import com.codeheadsystems.keystone.server.store.InMemoryUserStore;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Minimal authority application used only in integration tests.
 * Not part of the library's public API.
 */
public class KeystoneTestApplication extends Application<KeystoneConfiguration> {

  /**
   * Message ownership shared with the tests, which register the messages they link to.
   */
  public static final InMemoryResourceOwnerLookup OWNERS = new InMemoryResourceOwnerLookup();

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new KeystoneTestApplication().run(args);
  }

  @Override
  public String getName() {
    return "keystone-test";
  }

  @Override
  public void initialize(Bootstrap<KeystoneConfiguration> bootstrap) {
    bootstrap.addBundle(new KeystoneBundle<>(new InMemoryUserStore(), new InMemoryLinkStore(), OWNERS));
  }

  @Override
  public void run(KeystoneConfiguration configuration, Environment environment) {
    // Everything is registered by the bundle.
  }
}
