package com.codeheadsystems.keystone.server.store;

/**
 * Opaque failure of a storage collaborator. Callers log it and answer with a generic internal
 * error; nothing about it is shown to clients.
 */
public class StoreException extends RuntimeException {

  public StoreException(final String message) {
    super(message);
  }

  public StoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
