package com.codeheadsystems.keystone.server.resource;

import com.codeheadsystems.keystone.model.MessageLinkResponse;
import com.codeheadsystems.keystone.server.manager.MessageLinkManager;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code GET /links/{token}}: resolves a link by its token alone, for clients that do not know
 * the message id.
 */
@Singleton
@Path("/links")
@Produces(MediaType.APPLICATION_JSON)
public class LegacyLinkResource {

  private static final Logger log = LoggerFactory.getLogger(LegacyLinkResource.class);

  private final MessageLinkManager messageLinkManager;

  @Inject
  public LegacyLinkResource(final MessageLinkManager messageLinkManager) {
    this.messageLinkManager = messageLinkManager;
    log.info("LegacyLinkResource({})", messageLinkManager);
  }

  @GET
  @Path("/{token}")
  public MessageLinkResponse resolve(@PathParam("token") final String token) {
    log.trace("resolve()");
    return messageLinkManager.resolveLink(token);
  }
}
