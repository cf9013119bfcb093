package org.jbridge.lifecycle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.jbridge.BridgeUsageException;
import org.jbridge.vm.VmLocator;
import org.junit.jupiter.api.Test;

class VmOptionsTest {
  private static final Path LIBRARY = Paths.get("libjvm.so");

  @Test
  void testClassPathInArgsIsRejected() {
    for (String arg : new String[] {"-cp", "-classpath", "-Djava.class.path=app.jar"}) {
      BridgeUsageException e =
          assertThrows(
              BridgeUsageException.class, () -> VmOptions.builder().arg(arg).build(), arg);
      assertEquals(
          "Cannot set Java class path in the \"args\" argument to startVm. "
              + "Use the classPath keyword argument instead.",
          e.getMessage());
    }
  }

  @Test
  void testDefaultsHaveNoOptions() {
    assertEquals(List.of(), VmOptions.defaults().toOptionStrings(VmLocator.fixed(LIBRARY)));
  }

  @Test
  void testOptionOrder() {
    VmLocator locator =
        new VmLocator() {
          @Override
          public Path locateLibrary() {
            return LIBRARY;
          }

          @Override
          public List<String> classPathEntries() {
            return List.of("bridge.jar");
          }
        };
    VmOptions options =
        VmOptions.builder()
            .classPath(List.of("app.jar", "lib.jar"))
            .maxHeapSize("512m")
            .runHeadless(true)
            .args(List.of("-Xrs", "-Dmode=test"))
            .build();
    assertEquals(
        List.of(
            "-Djava.class.path=bridge.jar" + File.pathSeparator + "app.jar"
                + File.pathSeparator + "lib.jar",
            "-Xmx512m",
            "-Djava.awt.headless=true",
            "-Xrs",
            "-Dmode=test"),
        options.toOptionStrings(locator));
  }
}
