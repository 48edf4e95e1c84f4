package com.codeheadsystems.keystone.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.keystone.server.model.User;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * The type In memory user store test.
 */
class InMemoryUserStoreTest {

  private InMemoryUserStore store;

  /**
   * Sets up.
   */
  @BeforeEach
  void setUp() {
    store = new InMemoryUserStore();
  }

  private static User user(String username) {
    return new User(UUID.randomUUID(), username, "hash", 0, Instant.now());
  }

  @Test
  void insertAndLookup() {
    User alice = user("alice");
    store.insertUser(alice);

    assertThat(store.getUserById(alice.id())).contains(alice);
    assertThat(store.getUserByUsername("alice")).contains(alice);
    assertThat(store.getUserByUsername("ALICE")).isEmpty();
  }

  @Test
  void insert_duplicateUsername_conflicts() {
    store.insertUser(user("alice"));

    assertThatThrownBy(() -> store.insertUser(user("alice"))).isInstanceOf(StoreConflictException.class);
  }

  @Test
  void update_rename_movesUsernameIndex() {
    User alice = user("alice");
    store.insertUser(alice);

    assertThat(store.updateUser(alice.withUsername("alicia"))).isTrue();

    assertThat(store.getUserByUsername("alice")).isEmpty();
    assertThat(store.getUserByUsername("alicia")).map(User::id).contains(alice.id());
  }

  @Test
  void update_renameOntoTakenUsername_conflicts() {
    User alice = user("alice");
    store.insertUser(alice);
    store.insertUser(user("bob"));

    assertThatThrownBy(() -> store.updateUser(alice.withUsername("bob")))
        .isInstanceOf(StoreConflictException.class);
    assertThat(store.getUserByUsername("alice")).isPresent();
  }

  @Test
  void update_unknownUser_returnsFalse() {
    assertThat(store.updateUser(user("ghost"))).isFalse();
  }

  @Test
  void delete_freesUsername() {
    User alice = user("alice");
    store.insertUser(alice);

    assertThat(store.deleteUser(alice.id())).isTrue();
    assertThat(store.deleteUser(alice.id())).isFalse();
    assertThat(store.getUserByUsername("alice")).isEmpty();
    store.insertUser(user("alice"));
  }
}
