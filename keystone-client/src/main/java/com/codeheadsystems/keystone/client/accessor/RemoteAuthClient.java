package com.codeheadsystems.keystone.client.accessor;

import com.codeheadsystems.keystone.auth.BasicAuthCodec;
import com.codeheadsystems.keystone.client.exceptions.AuthTransportException;
import com.codeheadsystems.keystone.client.exceptions.RelayedErrorException;
import com.codeheadsystems.keystone.client.model.AuthorityConnectionInfo;
import com.codeheadsystems.keystone.error.AuthFailure;
import com.codeheadsystems.keystone.error.AuthFailureException;
import com.codeheadsystems.keystone.error.Completions;
import com.codeheadsystems.keystone.error.ErrorRelay;
import com.codeheadsystems.keystone.error.ErrorReply;
import com.codeheadsystems.keystone.model.CreateLinkRequest;
import com.codeheadsystems.keystone.model.MessageLinkResponse;
import com.codeheadsystems.keystone.model.UserResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client a relying service uses to ask the authority who a caller is.
 * <p>
 * Credentials are never inspected here: the {@code Authorization} header is only checked for
 * presence and then forwarded unchanged. Returned futures fail with:
 * <ul>
 *   <li>{@link RelayedErrorException} when the authority answered with a non-2xx status. Status,
 *       body bytes, content type and {@code WWW-Authenticate} are kept exactly as received.</li>
 *   <li>{@link AuthFailureException} of kind {@link AuthFailure#LINK_NOT_FOUND} when a link lookup
 *       answered 404, so link probing looks like any other 401.</li>
 *   <li>{@link AuthTransportException} when no usable response was obtained.</li>
 * </ul>
 * Nothing is retried: {@code createLink} is not idempotent.
 */
@Singleton
public class RemoteAuthClient {

  private static final Logger log = LoggerFactory.getLogger(RemoteAuthClient.class);

  private static final String AUTHORIZATION = "Authorization";
  private static final String ACCEPT = "Accept";
  private static final String CONTENT_TYPE = "Content-Type";
  private static final String WWW_AUTHENTICATE = "WWW-Authenticate";
  private static final int NOT_FOUND = 404;

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final AuthorityConnectionInfo connectionInfo;
  private final ErrorRelay errorRelay;

  /**
   * Instantiates a new Remote auth client.
   *
   * @param httpClient     the http client
   * @param objectMapper   the object mapper
   * @param connectionInfo the connection info
   * @param errorRelay     the error relay
   */
  @Inject
  public RemoteAuthClient(final HttpClient httpClient,
                          final ObjectMapper objectMapper,
                          final AuthorityConnectionInfo connectionInfo,
                          final ErrorRelay errorRelay) {
    log.info("RemoteAuthClient({})", connectionInfo.baseUri());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.connectionInfo = connectionInfo;
    this.errorRelay = errorRelay;
  }

  // ── Users ─────────────────────────────────────────────────────────────────

  /**
   * Resolves the caller through the authority's current-user endpoint.
   *
   * @param authorization the Authorization header as received
   * @return the user
   */
  public CompletableFuture<UserResponse> resolveUser(final String authorization) {
    log.debug("resolveUser()");
    HttpRequest request;
    try {
      request = authorized(BasicAuthCodec.requirePresent(authorization), "/users/@me").GET().build();
    } catch (AuthFailureException e) {
      return CompletableFuture.failedFuture(e);
    } catch (IllegalArgumentException e) {
      return CompletableFuture.failedFuture(new AuthFailureException(AuthFailure.HEADER_MALFORMED));
    }
    return exchange(request, UserResponse.class, false);
  }

  // ── Links ─────────────────────────────────────────────────────────────────

  /**
   * Resolves a link scoped to a message. Needs no credentials.
   *
   * @param messageId the message id
   * @param token     the token
   * @return the link
   */
  public CompletableFuture<MessageLinkResponse> resolveLink(final UUID messageId, final String token) {
    log.debug("resolveLink(messageId={})", messageId);
    HttpRequest request = base("/messages/" + messageId + "/links/" + encode(token)).GET().build();
    return exchange(request, MessageLinkResponse.class, true);
  }

  /**
   * Resolves a link by its token alone.
   *
   * @param token the token
   * @return the link
   */
  public CompletableFuture<MessageLinkResponse> resolveLink(final String token) {
    log.debug("resolveLink()");
    HttpRequest request = base("/links/" + encode(token)).GET().build();
    return exchange(request, MessageLinkResponse.class, true);
  }

  /**
   * Creates a link with default settings on behalf of the message owner.
   *
   * @param authorization the owner's Authorization header as received
   * @param messageId     the message id
   * @return the created link
   */
  public CompletableFuture<MessageLinkResponse> createLink(final String authorization, final UUID messageId) {
    return createLink(authorization, messageId, CreateLinkRequest.empty());
  }

  /**
   * Creates a link on behalf of the message owner.
   *
   * @param authorization the owner's Authorization header as received
   * @param messageId     the message id
   * @param linkRequest   the link settings
   * @return the created link
   */
  public CompletableFuture<MessageLinkResponse> createLink(final String authorization,
                                                          final UUID messageId,
                                                          final CreateLinkRequest linkRequest) {
    log.debug("createLink(messageId={})", messageId);
    HttpRequest request;
    try {
      String body = objectMapper.writeValueAsString(linkRequest == null ? CreateLinkRequest.empty() : linkRequest);
      request = authorized(BasicAuthCodec.requirePresent(authorization), "/messages/" + messageId + "/links")
          .header(CONTENT_TYPE, ErrorRelay.APPLICATION_JSON)
          .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
          .build();
    } catch (AuthFailureException e) {
      return CompletableFuture.failedFuture(e);
    } catch (IllegalArgumentException e) {
      return CompletableFuture.failedFuture(new AuthFailureException(AuthFailure.HEADER_MALFORMED));
    } catch (JsonProcessingException e) {
      log.error("Unable to write link request", e);
      return CompletableFuture.failedFuture(new AuthTransportException(e));
    }
    return exchange(request, MessageLinkResponse.class, false);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private HttpRequest.Builder base(String path) {
    URI uri = connectionInfo.endpoint(path);
    return HttpRequest.newBuilder()
        .uri(uri)
        .timeout(connectionInfo.requestTimeout())
        .header(ACCEPT, ErrorRelay.APPLICATION_JSON);
  }

  private HttpRequest.Builder authorized(String authorization, String path) {
    return base(path).header(AUTHORIZATION, authorization);
  }

  private <T> CompletableFuture<T> exchange(HttpRequest request, Class<T> responseType, boolean linkLookup) {
    return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
        .handle((response, error) -> {
          if (error != null) {
            Throwable cause = Completions.unwrap(error);
            log.warn("Authority call {} {} failed: {}", request.method(), request.uri().getPath(), cause.toString());
            throw new AuthTransportException(cause);
          }
          return read(request, response, responseType, linkLookup);
        });
  }

  private <T> T read(HttpRequest request, HttpResponse<byte[]> response, Class<T> responseType, boolean linkLookup) {
    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      log.debug("Authority answered {} to {} {}", status, request.method(), request.uri().getPath());
      if (linkLookup && status == NOT_FOUND) {
        throw new AuthFailureException(AuthFailure.LINK_NOT_FOUND);
      }
      ErrorReply upstream = new ErrorReply(status, response.body(),
          response.headers().firstValue(CONTENT_TYPE).orElse(null),
          response.headers().firstValue(WWW_AUTHENTICATE).orElse(null));
      throw new RelayedErrorException(errorRelay.normalize(upstream));
    }
    try {
      return objectMapper.readValue(response.body(), responseType);
    } catch (IOException e) {
      log.error("Unreadable authority response to {} {}", request.method(), request.uri().getPath(), e);
      throw new AuthTransportException(e);
    }
  }

  private static String encode(String token) {
    return URLEncoder.encode(token == null ? "" : token, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
