package com.codeheadsystems.keystone.server.store;

/**
 * A write collided with an existing row on a unique key (username, link token).
 */
public class StoreConflictException extends StoreException {

  public StoreConflictException(final String message) {
    super(message);
  }
}
