package org.jbridge.vm.inprocess;

import java.io.File;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import org.jbridge.vm.Jni;
import org.jbridge.vm.NativeVmException;

/**
 * Option strings accepted by the in-process VM.
 *
 * <p>Recognized: {@code -D<name>=<value>}, {@code -Djava.class.path=<entries>}, {@code
 * -Xmx/-Xms/-Xss<size>}, {@code -Xcheck:jni}, {@code -Xrs}, {@code -verbose[:...]}, the
 * assertion switches, {@code -XX:MaxJNILocalCapacity=<n>} and {@code
 * -XX:+IgnoreUnrecognizedVMOptions}. Other {@code -XX:} options are accepted and ignored. Anything
 * else fails creation with {@code JNI_ERR} unless unrecognized options are ignored; malformed
 * values fail with {@code JNI_EINVAL}.
 */
final class VmArguments {
  private static final Logger LOG = Logger.getLogger(VmArguments.class.getName());

  static final String CLASS_PATH_PROPERTY = "java.class.path";
  static final int DEFAULT_MAX_LOCAL_CAPACITY = 65536;
  private static final long MIN_HEAP_BYTES = 2L * 1024 * 1024;

  private final List<URL> classPath = new ArrayList<>();
  private final Map<String, String> properties = new LinkedHashMap<>();
  private long maxHeapBytes = -1;
  private long initialHeapBytes = -1;
  private long stackBytes = -1;
  private int maxLocalCapacity = DEFAULT_MAX_LOCAL_CAPACITY;

  private VmArguments() {}

  static VmArguments parse(List<String> options) throws NativeVmException {
    VmArguments args = new VmArguments();
    boolean ignoreUnrecognized = options.contains("-XX:+IgnoreUnrecognizedVMOptions");
    for (String option : options) {
      if (!args.accept(option)) {
        if (ignoreUnrecognized) {
          LOG.fine("Ignoring unrecognized VM option " + option);
          continue;
        }
        throw new NativeVmException(Jni.JNI_ERR, "Unrecognized option: " + option);
      }
    }
    if (args.maxHeapBytes > 0 && args.initialHeapBytes > args.maxHeapBytes) {
      throw new NativeVmException(
          Jni.JNI_EINVAL,
          "Initial heap size set to a larger value than the maximum heap size");
    }
    return args;
  }

  private boolean accept(String option) throws NativeVmException {
    if (option.startsWith("-D")) {
      String body = option.substring(2);
      int eq = body.indexOf('=');
      String name = eq < 0 ? body : body.substring(0, eq);
      String value = eq < 0 ? "" : body.substring(eq + 1);
      if (name.isEmpty()) {
        throw new NativeVmException(Jni.JNI_EINVAL, "Empty property name in " + option);
      }
      if (name.equals(CLASS_PATH_PROPERTY)) {
        addClassPath(value);
      } else {
        properties.put(name, value);
      }
      return true;
    }
    if (option.startsWith("-Xmx")) {
      maxHeapBytes = parseSize(option, option.substring(4));
      if (maxHeapBytes < MIN_HEAP_BYTES) {
        throw new NativeVmException(Jni.JNI_EINVAL, "Too small maximum heap: " + option);
      }
      return true;
    }
    if (option.startsWith("-Xms")) {
      initialHeapBytes = parseSize(option, option.substring(4));
      return true;
    }
    if (option.startsWith("-Xss")) {
      stackBytes = parseSize(option, option.substring(4));
      return true;
    }
    if (option.equals("-Xcheck:jni")) {
      // Checks are always on in process
      return true;
    }
    if (option.startsWith("-XX:MaxJNILocalCapacity=")) {
      String value = option.substring("-XX:MaxJNILocalCapacity=".length());
      try {
        maxLocalCapacity = Integer.parseInt(value);
      } catch (NumberFormatException e) {
        throw new NativeVmException(Jni.JNI_EINVAL, "Invalid value in " + option);
      }
      if (maxLocalCapacity <= 0) {
        throw new NativeVmException(Jni.JNI_EINVAL, "Invalid value in " + option);
      }
      return true;
    }
    if (option.startsWith("-XX:")) {
      LOG.fine("VM option has no effect in process: " + option);
      return true;
    }
    return option.equals("-Xrs")
        || option.equals("-verbose")
        || option.startsWith("-verbose:")
        || option.matches("-(e|d)s?a(:.*)?")
        || option.matches("-(enable|disable)(system)?assertions(:.*)?");
  }

  private void addClassPath(String value) throws NativeVmException {
    for (String entry : value.split(File.pathSeparator)) {
      if (entry.isEmpty()) continue;
      try {
        classPath.add(Paths.get(entry).toUri().toURL());
      } catch (MalformedURLException | RuntimeException e) {
        throw new NativeVmException(Jni.JNI_EINVAL, "Bad class path entry " + entry);
      }
    }
  }

  private static long parseSize(String option, String text) throws NativeVmException {
    if (text.isEmpty()) {
      throw new NativeVmException(Jni.JNI_EINVAL, "Missing size in " + option);
    }
    char unit = Character.toLowerCase(text.charAt(text.length() - 1));
    long multiplier =
        switch (unit) {
          case 'k' -> 1024L;
          case 'm' -> 1024L * 1024;
          case 'g' -> 1024L * 1024 * 1024;
          case 't' -> 1024L * 1024 * 1024 * 1024;
          default -> 1L;
        };
    String digits = multiplier == 1L ? text : text.substring(0, text.length() - 1);
    try {
      long value = Long.parseLong(digits);
      if (value < 0) {
        throw new NumberFormatException(digits);
      }
      return Math.multiplyExact(value, multiplier);
    } catch (NumberFormatException | ArithmeticException e) {
      throw new NativeVmException(
          Jni.JNI_EINVAL, "Invalid size " + text.toLowerCase(Locale.ROOT) + " in " + option);
    }
  }

  List<URL> classPath() {
    return classPath;
  }

  Map<String, String> properties() {
    return properties;
  }

  long maxHeapBytes() {
    return maxHeapBytes;
  }

  long stackBytes() {
    return stackBytes;
  }

  int maxLocalCapacity() {
    return maxLocalCapacity;
  }
}
