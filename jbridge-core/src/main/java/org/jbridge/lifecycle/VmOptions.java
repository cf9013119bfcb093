package org.jbridge.lifecycle;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import org.jbridge.BridgeUsageException;
import org.jbridge.vm.VmLocator;

/**
 * Options for starting the VM.
 *
 * <p>The class path is only accepted through {@link Builder#classPath}; putting it into the raw
 * arguments would define it twice.
 */
public final class VmOptions {
  private final List<String> args;
  private final List<String> classPath;
  private final String maxHeapSize;
  private final boolean runHeadless;

  private VmOptions(Builder builder) {
    this.args = List.copyOf(builder.args);
    this.classPath = List.copyOf(builder.classPath);
    this.maxHeapSize = builder.maxHeapSize;
    this.runHeadless = builder.runHeadless;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** No arguments, an empty user class path and the VM's default heap. */
  public static VmOptions defaults() {
    return builder().build();
  }

  public List<String> args() {
    return args;
  }

  public List<String> classPath() {
    return classPath;
  }

  public String maxHeapSize() {
    return maxHeapSize;
  }

  public boolean runHeadless() {
    return runHeadless;
  }

  /** The option strings handed to VM creation. Locator entries precede user class path entries. */
  public List<String> toOptionStrings(VmLocator locator) {
    List<String> entries = new ArrayList<>(locator.classPathEntries());
    entries.addAll(classPath);
    List<String> options = new ArrayList<>();
    if (!entries.isEmpty()) {
      options.add("-Djava.class.path=" + String.join(File.pathSeparator, entries));
    }
    if (maxHeapSize != null) {
      options.add("-Xmx" + maxHeapSize);
    }
    if (runHeadless) {
      options.add("-Djava.awt.headless=true");
    }
    options.addAll(args);
    return options;
  }

  public static final class Builder {
    private final List<String> args = new ArrayList<>();
    private final List<String> classPath = new ArrayList<>();
    private String maxHeapSize;
    private boolean runHeadless;

    private Builder() {}

    public Builder args(List<String> values) {
      args.addAll(values);
      return this;
    }

    public Builder arg(String value) {
      args.add(value);
      return this;
    }

    public Builder classPath(List<String> entries) {
      classPath.addAll(entries);
      return this;
    }

    /** e.g. {@code 512m} */
    public Builder maxHeapSize(String size) {
      this.maxHeapSize = size;
      return this;
    }

    public Builder runHeadless(boolean headless) {
      this.runHeadless = headless;
      return this;
    }

    public VmOptions build() {
      for (String arg : args) {
        if (arg.equals("-cp")
            || arg.equals("-classpath")
            || arg.startsWith("-Djava.class.path=")) {
          throw new BridgeUsageException(
              "Cannot set Java class path in the \"args\" argument to startVm. "
                  + "Use the classPath keyword argument instead.");
        }
      }
      return new VmOptions(this);
    }
  }
}
