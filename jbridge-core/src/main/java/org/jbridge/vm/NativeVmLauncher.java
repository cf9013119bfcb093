package org.jbridge.vm;

import java.nio.file.Path;
import java.util.List;

/** Creates a VM from a located library and a list of option strings. */
@FunctionalInterface
public interface NativeVmLauncher {

  /** The created VM together with the environment of the creating thread. */
  record CreatedVm(NativeVm vm, NativeEnv env) {}

  /**
   * Load the VM library and create the VM. The creating thread is attached on success.
   *
   * @throws NativeVmException with the native return code when creation fails
   */
  CreatedVm createJavaVm(Path libraryPath, List<String> options) throws NativeVmException;
}
