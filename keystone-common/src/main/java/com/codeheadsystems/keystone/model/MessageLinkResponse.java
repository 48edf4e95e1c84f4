package com.codeheadsystems.keystone.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.UUID;

/**
 * Wire view of a capability link.
 * <p>
 * The {@code token} is a bearer secret: whoever holds it can read the linked message until
 * {@code expiresAt}.
 *
 * @param token     the opaque link token
 * @param messageId the message the link grants access to
 * @param access    the access bitmask
 * @param expiresAt when the link stops resolving, or {@code null} for never
 * @param resource  the resource sub-selector, or {@code null} for the whole message
 */
public record MessageLinkResponse(
    @JsonProperty("token") String token,
    @JsonProperty("message_id") UUID messageId,
    @JsonProperty("access") int access,
    @JsonProperty("expires_at") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant expiresAt,
    @JsonProperty("resource") String resource) {
}
