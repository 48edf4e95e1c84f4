package com.codeheadsystems.keystone.server.model;

/**
 * Bits of {@link User#flags()}.
 */
public final class UserFlags {

  public static final long NONE = 0L;

  /**
   * Implies every other flag.
   */
  public static final long ADMIN = 1L << 1;

  /**
   * May create other accounts through {@code POST /users}.
   */
  public static final long CREATE_USER = 1L << 2;

  private UserFlags() {
  }

  /**
   * Whether a user holding {@code userFlags} may perform an action requiring {@code required}.
   *
   * @param userFlags the user's flags
   * @param required  the required flags
   * @return true if every required bit is held, or the user is an admin
   */
  public static boolean permits(long userFlags, long required) {
    return (userFlags & required) == required || (userFlags & ADMIN) != 0;
  }
}
