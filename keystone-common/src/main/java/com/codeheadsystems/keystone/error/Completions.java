package com.codeheadsystems.keystone.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for failures that travel through {@link java.util.concurrent.CompletableFuture}s.
 */
public final class Completions {

  private Completions() {
  }

  /**
   * Strips the {@link CompletionException} / {@link ExecutionException} wrappers that future
   * composition adds around the original failure.
   *
   * @param throwable the throwable
   * @return the innermost meaningful cause
   */
  public static Throwable unwrap(Throwable throwable) {
    Throwable current = throwable;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
