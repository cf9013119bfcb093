package org.jbridge.vm;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jbridge.VmNotFoundException;

/**
 * Searches Java installations for the server VM library.
 *
 * <p>Candidates are the home of the running JVM ({@code java.home}) and then {@code JAVA_HOME},
 * each probed for the platform layouts of {@code libjvm.so}, {@code libjvm.dylib} and {@code
 * jvm.dll}, with and without a {@code jre/} directory.
 */
public final class DefaultVmLocator implements VmLocator {
  private static final Logger LOG = Logger.getLogger(DefaultVmLocator.class.getName());

  private static final String[] LIBRARY_LAYOUTS = {
    "lib/server/libjvm.so",
    "lib/server/libjvm.dylib",
    "bin/server/jvm.dll",
    "jre/lib/server/libjvm.so",
    "jre/lib/amd64/server/libjvm.so",
    "jre/bin/server/jvm.dll",
    "lib/client/libjvm.so",
    "bin/client/jvm.dll"
  };

  private final List<Path> homes;
  private final List<String> classPath;

  /** Locator over {@code java.home} and the {@code JAVA_HOME} environment variable. */
  public DefaultVmLocator() {
    this(defaultHomes(), List.of());
  }

  public DefaultVmLocator(List<Path> homes, List<String> classPath) {
    this.homes = List.copyOf(homes);
    this.classPath = List.copyOf(classPath);
  }

  private static List<Path> defaultHomes() {
    List<Path> homes = new ArrayList<>();
    String javaHome = System.getProperty("java.home");
    if (javaHome != null) {
      homes.add(Paths.get(javaHome));
    }
    String env = System.getenv("JAVA_HOME");
    if (env != null && !env.isEmpty()) {
      homes.add(Paths.get(env));
    }
    return homes;
  }

  @Override
  public Path locateLibrary() {
    for (Path home : homes) {
      for (String layout : LIBRARY_LAYOUTS) {
        Path candidate = home.resolve(layout);
        if (Files.isRegularFile(candidate)) {
          LOG.fine("Found VM library at " + candidate);
          return candidate;
        }
      }
    }
    throw new VmNotFoundException("Can't find the Java Virtual Machine (searched " + homes + ")");
  }

  @Override
  public List<String> classPathEntries() {
    return classPath;
  }
}
