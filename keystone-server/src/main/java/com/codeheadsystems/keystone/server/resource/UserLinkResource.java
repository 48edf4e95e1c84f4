package com.codeheadsystems.keystone.server.resource;

import com.codeheadsystems.keystone.error.RequestException;
import com.codeheadsystems.keystone.model.CreateLinkRequest;
import com.codeheadsystems.keystone.model.MessageLinkResponse;
import com.codeheadsystems.keystone.server.manager.MessageLinkManager;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletionStage;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Link management for the caller's own messages, all Basic-authenticated:
 * <ul>
 *   <li>{@code GET /users/@me/messages/{messageId}/links}: list</li>
 *   <li>{@code POST /users/@me/messages/{messageId}/links}: create</li>
 *   <li>{@code DELETE /users/@me/messages/{messageId}/links?link=...}: delete, answers 204</li>
 * </ul>
 */
@Singleton
@Path("/users/@me/messages/{messageId}/links")
@Produces(MediaType.APPLICATION_JSON)
public class UserLinkResource {

  private static final Logger log = LoggerFactory.getLogger(UserLinkResource.class);

  private final MessageLinkManager messageLinkManager;

  /**
   * Instantiates a new User link resource.
   *
   * @param messageLinkManager the message link manager
   */
  @Inject
  public UserLinkResource(final MessageLinkManager messageLinkManager) {
    this.messageLinkManager = messageLinkManager;
    log.info("UserLinkResource({})", messageLinkManager);
  }

  @GET
  public CompletionStage<List<MessageLinkResponse>> list(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization,
                                                         @PathParam("messageId") final String messageId) {
    log.trace("list()");
    return messageLinkManager.listLinks(authorization, ownedMessageId(messageId));
  }

  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  public CompletionStage<MessageLinkResponse> create(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization,
                                                     @PathParam("messageId") final String messageId,
                                                     final CreateLinkRequest request) {
    log.trace("create()");
    return messageLinkManager.createLink(authorization, ownedMessageId(messageId), request);
  }

  @DELETE
  public CompletionStage<Void> delete(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization,
                                      @PathParam("messageId") final String messageId,
                                      @QueryParam("link") final String link) {
    log.trace("delete()");
    return messageLinkManager.deleteLink(authorization, ownedMessageId(messageId), link);
  }

  private static UUID ownedMessageId(String raw) {
    return PathIds.parse(raw, () -> RequestException.notFound("Message not found"));
  }
}
