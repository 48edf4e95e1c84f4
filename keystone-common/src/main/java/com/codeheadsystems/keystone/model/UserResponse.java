package com.codeheadsystems.keystone.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.UUID;

/**
 * Public view of a user account. The stored password hash never appears on the wire.
 * <p>
 * Used by: {@code GET /users/@me}, {@code PATCH /users/@me}, {@code POST /users}
 *
 * @param id        the user id
 * @param username  the unique username
 * @param flags     the permission bitmask
 * @param createdAt when the account was created
 */
public record UserResponse(
    @JsonProperty("id") UUID id,
    @JsonProperty("username") String username,
    @JsonProperty("flags") long flags,
    @JsonProperty("created_at") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant createdAt) {
}
