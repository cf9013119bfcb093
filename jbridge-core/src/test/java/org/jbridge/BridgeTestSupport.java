package org.jbridge;

import java.nio.file.Paths;
import org.jbridge.lifecycle.VmOptions;
import org.jbridge.vm.VmLocator;
import org.jbridge.vm.inprocess.InProcessVmLauncher;

/** Bridges over the in-process VM for tests. Only one VM can be live at a time. */
public final class BridgeTestSupport {

  private BridgeTestSupport() {}

  public static VmLocator locator() {
    return VmLocator.fixed(Paths.get("in-process", "lib", "server", "libjvm.so"));
  }

  public static JavaBridge newBridge() {
    return new JavaBridge(locator(), new InProcessVmLauncher());
  }

  /** A started bridge; the calling thread is attached. */
  public static JavaBridge startBridge(String... args) {
    JavaBridge bridge = newBridge();
    VmOptions.Builder options = VmOptions.builder();
    for (String arg : args) {
      options.arg(arg);
    }
    bridge.start(options.build());
    return bridge;
  }
}
