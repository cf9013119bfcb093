package org.jbridge.env;

import java.util.ArrayList;
import java.util.List;

/** What one thread knows about its attachment. Never shared between threads. */
final class ThreadEnvironment {
  /** The active environment, or null. */
  BridgeEnv env;

  /** Nested {@code attach()} calls not yet matched by {@code detach()}. */
  int attachCount;

  /** Environments displaced by callback entry; may hold nulls. */
  final List<BridgeEnv> saved = new ArrayList<>();

  /** Attached by VM creation rather than by {@code attach()}. */
  boolean creator;
}
