package org.jbridge.vm;

import java.nio.file.Path;
import java.util.List;
import org.jbridge.VmNotFoundException;

/** Finds the VM shared library and the class-path entries the bridge needs at startup. */
public interface VmLocator {

  /**
   * Path of the VM shared library.
   *
   * @throws VmNotFoundException when no VM installation can be found
   */
  Path locateLibrary();

  /** Jar files that must be on the VM class path, ahead of user entries. */
  default List<String> classPathEntries() {
    return List.of();
  }

  /** A locator that always answers {@code libraryPath}. */
  static VmLocator fixed(Path libraryPath) {
    return () -> libraryPath;
  }
}
