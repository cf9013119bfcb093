package org.jbridge.vm.inprocess;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;
import org.jbridge.vm.Jni;
import org.jbridge.vm.NativeEnv;
import org.jbridge.vm.NativeVmException;
import org.jbridge.vm.NativeVmLauncher;

/**
 * Launches an {@link InProcessVm}.
 *
 * <p>The library path is recorded, not loaded. Like {@code JNI_CreateJavaVM}, only one VM may be
 * live in the process at a time; a second creation fails with {@code JNI_EEXIST} until the first
 * is destroyed. {@code -D} options are applied to the process system properties.
 */
public final class InProcessVmLauncher implements NativeVmLauncher {
  private static final Logger LOG = Logger.getLogger(InProcessVmLauncher.class.getName());

  private static final AtomicReference<InProcessVm> LIVE = new AtomicReference<>();

  @Override
  public CreatedVm createJavaVm(Path libraryPath, List<String> options) throws NativeVmException {
    if (libraryPath == null) {
      throw new NativeVmException(Jni.JNI_ERR, "No VM library given");
    }
    VmArguments arguments = VmArguments.parse(options);
    InProcessVm vm = new InProcessVm(libraryPath, arguments);
    if (!LIVE.compareAndSet(null, vm)) {
      throw new NativeVmException(Jni.JNI_EEXIST, "A VM already exists in this process");
    }
    for (Map.Entry<String, String> property : arguments.properties().entrySet()) {
      System.setProperty(property.getKey(), property.getValue());
    }
    if (arguments.stackBytes() > 0) {
      LOG.fine("Thread stack size " + arguments.stackBytes() + " is fixed by the host process");
    }
    NativeEnv env = vm.attachCurrentThread(false);
    LOG.info(
        "Created VM "
            + vm.id()
            + " from "
            + libraryPath
            + " with "
            + arguments.classPath().size()
            + " class path entries");
    return new CreatedVm(vm, env);
  }

  /** The live VM, or null. */
  public static InProcessVm liveVm() {
    return LIVE.get();
  }

  static void released(InProcessVm vm) {
    LIVE.compareAndSet(vm, null);
  }
}
