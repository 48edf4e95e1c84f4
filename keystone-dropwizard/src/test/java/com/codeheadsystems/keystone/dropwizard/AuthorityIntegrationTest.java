package com.codeheadsystems.keystone.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.keystone.auth.BasicAuthCodec;
import com.codeheadsystems.keystone.model.MessageLinkResponse;
import com.codeheadsystems.keystone.model.UserResponse;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Dropwizard integration tests for {@link KeystoneBundle}.
 * <p>
 * Starts a real embedded Jetty server with cheap Argon2id settings and a bootstrap admin
 * ({@code root}) and exercises the authority endpoints over HTTP.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class AuthorityIntegrationTest {

  static final DropwizardAppExtension<KeystoneConfiguration> APP =
      new DropwizardAppExtension<>(
          KeystoneTestApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private static final String ROOT = BasicAuthCodec.encode("root", "root-password");
  private static final String MISMATCH =
      "{\"errors\":[{\"status\":401,\"detail\":\"Incorrect username or password\"}]}";

  private HttpClient httpClient;
  private ObjectMapper objectMapper;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
    objectMapper = APP.getObjectMapper();
  }

  private String baseUrl() {
    return "http://localhost:" + APP.getLocalPort();
  }

  private HttpResponse<String> send(String method, String path, String authorization, String body) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(baseUrl() + path));
    if (authorization != null) {
      builder.header("Authorization", authorization);
    }
    if (body != null) {
      builder.header("Content-Type", "application/json")
          .method(method, HttpRequest.BodyPublishers.ofString(body));
    } else {
      builder.method(method, HttpRequest.BodyPublishers.noBody());
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private String createUser(String username, String password, long flags) throws Exception {
    HttpResponse<String> response = send("POST", "/users", ROOT,
        "{\"username\":\"" + username + "\",\"password\":\"" + password + "\",\"flags\":" + flags + "}");
    assertThat(response.statusCode()).isEqualTo(200);
    return BasicAuthCodec.encode(username, password);
  }

  private static String uniqueName() {
    return "user_" + UUID.randomUUID().toString().substring(0, 8);
  }

  // ── Users ─────────────────────────────────────────────────────────────────

  @Test
  void currentUser_bootstrapAdmin() throws Exception {
    HttpResponse<String> response = send("GET", "/users/@me", ROOT, null);

    assertThat(response.statusCode()).isEqualTo(200);
    UserResponse me = objectMapper.readValue(response.body(), UserResponse.class);
    assertThat(me.username()).isEqualTo("root");
    assertThat(me.flags()).isEqualTo(6L);
    assertThat(response.body()).doesNotContain("argon2");
  }

  @Test
  void currentUser_missingHeader_is401WithChallenge() throws Exception {
    HttpResponse<String> response = send("GET", "/users/@me", null, null);

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.headers().firstValue("WWW-Authenticate")).contains("Basic");
    assertThat(response.body()).isEqualTo("{\"errors\":[{\"status\":401,\"detail\":\"Missing authorization header\"}]}");
  }

  @Test
  void currentUser_bearerToken_isMalformed() throws Exception {
    HttpResponse<String> response = send("GET", "/users/@me", "Bearer abc", null);

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.headers().firstValue("WWW-Authenticate")).contains("Basic");
  }

  /**
   * An unknown user and a wrong password must not be distinguishable.
   */
  @Test
  void currentUser_unknownUserAndWrongPassword_lookIdentical() throws Exception {
    String username = uniqueName();
    createUser(username, "right-password", 0);

    HttpResponse<String> wrongPassword =
        send("GET", "/users/@me", BasicAuthCodec.encode(username, "wrong-password"), null);
    HttpResponse<String> unknownUser =
        send("GET", "/users/@me", BasicAuthCodec.encode(uniqueName(), "wrong-password"), null);

    assertThat(wrongPassword.statusCode()).isEqualTo(401);
    assertThat(unknownUser.statusCode()).isEqualTo(401);
    assertThat(wrongPassword.body()).isEqualTo(MISMATCH).isEqualTo(unknownUser.body());
    assertThat(wrongPassword.headers().firstValue("WWW-Authenticate"))
        .isEqualTo(unknownUser.headers().firstValue("WWW-Authenticate"));
  }

  @Test
  void createUser_withoutCreateFlag_is403WithoutChallenge() throws Exception {
    String alice = createUser(uniqueName(), "alice-password", 0);

    HttpResponse<String> response = send("POST", "/users", alice,
        "{\"username\":\"" + uniqueName() + "\",\"password\":\"some-password\",\"flags\":0}");

    assertThat(response.statusCode()).isEqualTo(403);
    assertThat(response.headers().firstValue("WWW-Authenticate")).isEmpty();
  }

  @Test
  void createUser_duplicate_is409() throws Exception {
    String username = uniqueName();
    createUser(username, "first-password", 0);

    HttpResponse<String> response = send("POST", "/users", ROOT,
        "{\"username\":\"" + username + "\",\"password\":\"second-password\",\"flags\":0}");

    assertThat(response.statusCode()).isEqualTo(409);
    assertThat(response.body()).contains("User already exists");
  }

  @Test
  void createUser_invalidBody_is400WithPointer() throws Exception {
    HttpResponse<String> response = send("POST", "/users", ROOT,
        "{\"username\":\"ok_name\",\"password\":\"short\",\"flags\":0}");

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(response.body()).contains("\"pointer\":\"/password\"");
  }

  @Test
  void updateAndDeleteCurrentUser() throws Exception {
    String username = uniqueName();
    String before = createUser(username, "old-password", 0);

    HttpResponse<String> patched = send("PATCH", "/users/@me", before, "{\"password\":\"new-password\"}");
    assertThat(patched.statusCode()).isEqualTo(200);

    String after = BasicAuthCodec.encode(username, "new-password");
    assertThat(send("GET", "/users/@me", before, null).statusCode()).isEqualTo(401);
    assertThat(send("DELETE", "/users/@me", after, null).statusCode()).isEqualTo(204);
    assertThat(send("GET", "/users/@me", after, null).statusCode()).isEqualTo(401);
  }

  // ── Framework errors ──────────────────────────────────────────────────────

  @Test
  void createUser_brokenJson_is400Envelope() throws Exception {
    HttpResponse<String> response = send("POST", "/users", ROOT, "{bad");

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
        type -> assertThat(type).startsWith("application/json"));
    assertThat(response.body()).isEqualTo(
        "{\"errors\":[{\"status\":400,\"detail\":\"Request body is not valid JSON\",\"source\":{\"pointer\":\"\"}}]}");
  }

  @Test
  void createUser_brokenJsonWithoutHeader_is401WithChallenge() throws Exception {
    HttpResponse<String> response = send("POST", "/users", null, "{bad");

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.headers().firstValue("WWW-Authenticate")).contains("Basic");
    assertThat(response.body()).isEqualTo("{\"errors\":[{\"status\":401,\"detail\":\"Missing authorization header\"}]}");
  }

  @Test
  void link_unparseableExpiry_is400WithPointer() throws Exception {
    String owner = createUser(uniqueName(), "owner-password", 0);
    UUID ownerId = objectMapper.readValue(send("GET", "/users/@me", owner, null).body(), UserResponse.class).id();
    UUID messageId = UUID.randomUUID();
    KeystoneTestApplication.OWNERS.register(messageId, ownerId);

    HttpResponse<String> response = send("POST", "/messages/" + messageId + "/links", owner,
        "{\"expires_after\":\"nope\"}");

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(response.body()).startsWith("{\"errors\":[").contains("\"pointer\":\"/expires_after\"");
  }

  @Test
  void unknownRoute_is404Envelope() throws Exception {
    HttpResponse<String> response = send("GET", "/no-such-route", ROOT, null);

    assertThat(response.statusCode()).isEqualTo(404);
    assertThat(response.body()).isEqualTo("{\"errors\":[{\"status\":404,\"detail\":\"Not Found\"}]}");
  }

  @Test
  void wrongMethod_is405EnvelopeWithAllow() throws Exception {
    HttpResponse<String> response = send("PUT", "/users/@me", ROOT, null);

    assertThat(response.statusCode()).isEqualTo(405);
    assertThat(response.headers().firstValue("Allow")).isPresent();
    assertThat(response.body()).isEqualTo("{\"errors\":[{\"status\":405,\"detail\":\"Method Not Allowed\"}]}");
  }

  // ── Links ─────────────────────────────────────────────────────────────────

  @Test
  void link_createResolveAllFormsThenDelete() throws Exception {
    String username = uniqueName();
    String owner = createUser(username, "owner-password", 0);
    UUID ownerId = objectMapper.readValue(send("GET", "/users/@me", owner, null).body(), UserResponse.class).id();
    UUID messageId = UUID.randomUUID();
    KeystoneTestApplication.OWNERS.register(messageId, ownerId);

    HttpResponse<String> created = send("POST", "/messages/" + messageId + "/links", owner,
        "{\"access\":1,\"expires_after\":\"PT1H\",\"resource\":\"photo.png\"}");
    assertThat(created.statusCode()).isEqualTo(200);
    MessageLinkResponse link = objectMapper.readValue(created.body(), MessageLinkResponse.class);
    assertThat(link.messageId()).isEqualTo(messageId);
    assertThat(link.expiresAt()).isNotNull();

    for (String path : List.of(
        "/messages/" + messageId + "/links/" + link.token(),
        "/messages/" + messageId + "/links?link=" + link.token(),
        "/messages/" + messageId + "/links?token=" + link.token(),
        "/links/" + link.token())) {
      HttpResponse<String> resolved = send("GET", path, null, null);
      assertThat(resolved.statusCode()).as(path).isEqualTo(200);
      assertThat(objectMapper.readValue(resolved.body(), MessageLinkResponse.class)).as(path).isEqualTo(link);
    }

    HttpResponse<String> listed = send("GET", "/users/@me/messages/" + messageId + "/links", owner, null);
    assertThat(objectMapper.readValue(listed.body(), new TypeReference<List<MessageLinkResponse>>() { }))
        .containsExactly(link);

    assertThat(send("DELETE", "/users/@me/messages/" + messageId + "/links?link=" + link.token(), owner, null)
        .statusCode()).isEqualTo(204);
    assertThat(send("GET", "/links/" + link.token(), null, null).statusCode()).isEqualTo(401);
  }

  @Test
  void link_wrongMessage_is401() throws Exception {
    String owner = createUser(uniqueName(), "owner-password", 0);
    UUID ownerId = objectMapper.readValue(send("GET", "/users/@me", owner, null).body(), UserResponse.class).id();
    UUID messageId = UUID.randomUUID();
    KeystoneTestApplication.OWNERS.register(messageId, ownerId);
    MessageLinkResponse link = objectMapper.readValue(
        send("POST", "/messages/" + messageId + "/links", owner, "{}").body(), MessageLinkResponse.class);

    HttpResponse<String> response = send("GET", "/messages/" + UUID.randomUUID() + "/links/" + link.token(), null, null);

    assertThat(response.statusCode()).isEqualTo(401);
  }

  @Test
  void link_unknownToken_is401WithChallenge() throws Exception {
    HttpResponse<String> response = send("GET", "/links/no-such-token", null, null);

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.headers().firstValue("WWW-Authenticate")).contains("Basic");
    assertThat(response.body()).isEqualTo("{\"errors\":[{\"status\":401,\"detail\":\"Message link not found\"}]}");
  }

  @Test
  void link_malformedMessageId_is401() throws Exception {
    assertThat(send("GET", "/messages/not-a-uuid/links/abc", null, null).statusCode()).isEqualTo(401);
  }

  @Test
  void link_createForSomeoneElsesMessage_is404() throws Exception {
    String owner = createUser(uniqueName(), "owner-password", 0);
    UUID messageId = UUID.randomUUID();
    KeystoneTestApplication.OWNERS.register(messageId, UUID.randomUUID());

    HttpResponse<String> response = send("POST", "/messages/" + messageId + "/links", owner, "{}");

    assertThat(response.statusCode()).isEqualTo(404);
    assertThat(response.body()).contains("Message not found");
  }

  @Test
  void healthCheck_isRegistered() {
    assertThat(APP.getEnvironment().healthChecks().getNames()).contains("credential-verifier");
    assertThat(APP.getEnvironment().healthChecks().runHealthCheck("credential-verifier").isHealthy()).isTrue();
  }
}
