package com.codeheadsystems.keystone.server.resource;

import com.codeheadsystems.keystone.error.AuthFailure;
import com.codeheadsystems.keystone.error.AuthFailureException;
import com.codeheadsystems.keystone.error.RequestException;
import com.codeheadsystems.keystone.model.CreateLinkRequest;
import com.codeheadsystems.keystone.model.MessageLinkResponse;
import com.codeheadsystems.keystone.server.manager.MessageLinkManager;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import java.util.UUID;
import java.util.concurrent.CompletionStage;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for the links of one message.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code GET /messages/{messageId}/links/{token}}: resolve a link</li>
 *   <li>{@code GET /messages/{messageId}/links?link=...} or {@code ?token=...}: legacy query form</li>
 *   <li>{@code POST /messages/{messageId}/links}: create a link (Basic, message owner only)</li>
 * </ul>
 * Failed resolutions answer 401 "Message link not found", whatever the reason.
 */
@Singleton
@Path("/messages/{messageId}/links")
@Produces(MediaType.APPLICATION_JSON)
public class LinkResource {

  private static final Logger log = LoggerFactory.getLogger(LinkResource.class);

  private final MessageLinkManager messageLinkManager;

  /**
   * Instantiates a new Link resource.
   *
   * @param messageLinkManager the message link manager
   */
  @Inject
  public LinkResource(final MessageLinkManager messageLinkManager) {
    this.messageLinkManager = messageLinkManager;
    log.info("LinkResource({})", messageLinkManager);
  }

  @GET
  @Path("/{token}")
  public MessageLinkResponse resolve(@PathParam("messageId") final String messageId,
                                     @PathParam("token") final String token) {
    log.trace("resolve()");
    return messageLinkManager.resolveLink(linkMessageId(messageId), token);
  }

  /**
   * Legacy lookup with the token in the query string. {@code link} wins when both are given.
   *
   * @param messageId the message id
   * @param link      the link
   * @param token     the token
   * @return the message link response
   */
  @GET
  public MessageLinkResponse resolveByQuery(@PathParam("messageId") final String messageId,
                                            @QueryParam("link") final String link,
                                            @QueryParam("token") final String token) {
    log.trace("resolveByQuery()");
    String effective = link != null ? link : token;
    if (effective == null || effective.isEmpty()) {
      throw RequestException.badParameter("Missing link token", "link");
    }
    return messageLinkManager.resolveLink(linkMessageId(messageId), effective);
  }

  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  public CompletionStage<MessageLinkResponse> create(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization,
                                                     @PathParam("messageId") final String messageId,
                                                     final CreateLinkRequest request) {
    log.trace("create()");
    UUID id = PathIds.parse(messageId, () -> RequestException.notFound("Message not found"));
    return messageLinkManager.createLink(authorization, id, request);
  }

  private static UUID linkMessageId(String raw) {
    return PathIds.parse(raw, () -> new AuthFailureException(AuthFailure.LINK_NOT_FOUND));
  }
}
