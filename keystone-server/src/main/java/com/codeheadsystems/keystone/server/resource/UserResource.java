package com.codeheadsystems.keystone.server.resource;

import com.codeheadsystems.keystone.model.CreateUserRequest;
import com.codeheadsystems.keystone.model.UpdateUserRequest;
import com.codeheadsystems.keystone.model.UserResponse;
import com.codeheadsystems.keystone.server.manager.UserManager;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import java.util.concurrent.CompletionStage;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for accounts.
 * <p>
 * Endpoints (all Basic-authenticated):
 * <ul>
 *   <li>{@code GET /users/@me}: the caller's account; relying services resolve users here</li>
 *   <li>{@code PATCH /users/@me}: update username, password or flags</li>
 *   <li>{@code DELETE /users/@me}: delete the caller's account</li>
 *   <li>{@code POST /users}: create an account, requires the CREATE_USER flag</li>
 * </ul>
 * Methods return {@link CompletionStage}s so request threads are released while passwords are
 * verified on the hashing pool.
 */
@Singleton
@Path("/users")
@Produces(MediaType.APPLICATION_JSON)
public class UserResource {

  private static final Logger log = LoggerFactory.getLogger(UserResource.class);

  private final UserManager userManager;

  /**
   * Instantiates a new User resource.
   *
   * @param userManager the user manager
   */
  @Inject
  public UserResource(final UserManager userManager) {
    this.userManager = userManager;
    log.info("UserResource({})", userManager);
  }

  @GET
  @Path("/@me")
  public CompletionStage<UserResponse> me(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization) {
    log.trace("me()");
    return userManager.currentUser(authorization);
  }

  @PATCH
  @Path("/@me")
  @Consumes(MediaType.APPLICATION_JSON)
  public CompletionStage<UserResponse> update(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization,
                                              final UpdateUserRequest request) {
    log.trace("update()");
    return userManager.updateCurrentUser(authorization, request);
  }

  /**
   * Deletes the caller's account. Completes with no entity, which JAX-RS answers with 204.
   *
   * @param authorization the authorization
   * @return the completion stage
   */
  @DELETE
  @Path("/@me")
  public CompletionStage<Void> delete(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization) {
    log.trace("delete()");
    return userManager.deleteCurrentUser(authorization);
  }

  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  public CompletionStage<UserResponse> create(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization,
                                              final CreateUserRequest request) {
    log.trace("create()");
    return userManager.createUser(authorization, request);
  }
}
