package com.codeheadsystems.keystone.server.link;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.codeheadsystems.keystone.server.model.MessageLink;
import com.codeheadsystems.keystone.server.store.InMemoryLinkStore;
import com.codeheadsystems.keystone.server.store.LinkStore;
import com.codeheadsystems.keystone.server.store.StoreConflictException;
import com.codeheadsystems.keystone.server.store.StoreException;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * The type Capability link manager test.
 */
@ExtendWith(MockitoExtension.class)
class CapabilityLinkManagerTest {

  @Mock private LinkStore mockStore;

  private CapabilityLinkManager manager;

  /**
   * Sets up.
   */
  @BeforeEach
  void setUp() {
    manager = new CapabilityLinkManager(new InMemoryLinkStore(), LinkConfig.DEFAULT);
  }

  @Test
  void create_thenResolve_returnsSameLink() {
    UUID messageId = UUID.randomUUID();
    Instant expiry = Instant.parse("2030-01-01T00:00:00Z");

    MessageLink link = manager.create(messageId, 3, expiry, "report.pdf");

    assertThat(manager.resolve(messageId, link.token())).contains(link);
    assertThat(link.access()).isEqualTo(3);
    assertThat(link.expiresAt()).isEqualTo(expiry);
    assertThat(link.resource()).isEqualTo("report.pdf");
  }

  @Test
  void resolve_differentMessage_isEmpty() {
    MessageLink link = manager.create(UUID.randomUUID(), 0, null, null);

    assertThat(manager.resolve(UUID.randomUUID(), link.token())).isEmpty();
  }

  @Test
  void create_tokensAreUrlSafeAndUnique() {
    UUID messageId = UUID.randomUUID();
    Set<String> tokens = new HashSet<>();
    for (int i = 0; i < 100; i++) {
      tokens.add(manager.create(messageId, 0, null, null).token());
    }

    assertThat(tokens).hasSize(100);
    assertThat(tokens).allSatisfy(token -> assertThat(token).hasSize(43).matches("[A-Za-z0-9_-]+"));
    assertThat(manager.list(messageId)).hasSize(100);
  }

  @Test
  void delete_isIdempotent() {
    UUID messageId = UUID.randomUUID();
    MessageLink link = manager.create(messageId, 0, null, null);

    assertThat(manager.delete(messageId, link.token())).isTrue();
    assertThat(manager.delete(messageId, link.token())).isFalse();
    assertThat(manager.resolve(messageId, link.token())).isEmpty();
  }

  @Test
  void delete_wrongMessage_keepsLink() {
    UUID messageId = UUID.randomUUID();
    MessageLink link = manager.create(messageId, 0, null, null);

    assertThat(manager.delete(UUID.randomUUID(), link.token())).isFalse();
    assertThat(manager.resolve(messageId, link.token())).isPresent();
  }

  @Test
  void create_collision_retriesWithFreshToken() {
    CapabilityLinkManager retrying = new CapabilityLinkManager(mockStore, new LinkConfig(32, 3));
    doThrow(new StoreConflictException("dup")).doNothing().when(mockStore).insertLink(any());

    MessageLink link = retrying.create(UUID.randomUUID(), 0, null, null);

    assertThat(link.token()).isNotBlank();
    verify(mockStore, times(2)).insertLink(any());
  }

  @Test
  void create_persistentCollision_isStoreFailure() {
    CapabilityLinkManager retrying = new CapabilityLinkManager(mockStore, new LinkConfig(32, 2));
    doThrow(new StoreConflictException("dup")).when(mockStore).insertLink(any());

    assertThatThrownBy(() -> retrying.create(UUID.randomUUID(), 0, null, null))
        .isInstanceOf(StoreException.class)
        .isNotInstanceOf(StoreConflictException.class);
    verify(mockStore, times(2)).insertLink(any());
  }

  @Test
  void linkToString_hidesToken() {
    MessageLink link = manager.create(UUID.randomUUID(), 0, null, null);

    assertThat(link.toString()).doesNotContain(link.token());
  }
}
