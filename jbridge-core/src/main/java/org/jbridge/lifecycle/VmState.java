package org.jbridge.lifecycle;

import java.util.Locale;

/** States of a {@link VmController}. {@link #DESTROYED} is terminal. */
public enum VmState {
  UNINITIALIZED,
  STARTING,
  ACTIVE,
  SHUTTING_DOWN,
  DESTROYED;

  public String displayName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
