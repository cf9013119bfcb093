package org.jbridge.env;

/** Who is responsible for deleting the reference behind a {@link JObject}. */
public enum Ownership {
  /** A global reference created by the bridge; released exactly once by its holder. */
  OWNED,
  /** An alias to a reference someone else manages; never released by its holder. */
  BORROWED
}
