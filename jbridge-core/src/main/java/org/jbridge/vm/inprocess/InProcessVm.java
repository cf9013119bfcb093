package org.jbridge.vm.inprocess;

import java.io.IOException;
import java.lang.reflect.Executable;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jbridge.vm.JValue;
import org.jbridge.vm.Jni;
import org.jbridge.vm.NativeEnv;
import org.jbridge.vm.NativeMethod;
import org.jbridge.vm.NativeVm;
import org.jbridge.vm.NativeVmException;

/**
 * A VM hosted inside the running JVM.
 *
 * <p>Holds the process-wide tables a native VM keeps for its embedder: global references, method
 * and field IDs, and the environments of attached threads. Each environment keeps its own local
 * reference frames and pending exception.
 */
public final class InProcessVm implements NativeVm {
  private static final Logger LOG = Logger.getLogger(InProcessVm.class.getName());

  private static final AtomicInteger VM_IDS = new AtomicInteger();

  record MethodEntry(Executable executable, boolean isStatic) {}

  record FieldEntry(Field field, boolean isStatic) {}

  private final int id = VM_IDS.incrementAndGet();
  private final Path libraryPath;
  private final ClassLoader classLoader;
  private final boolean ownsClassLoader;
  private final int maxLocalCapacity;
  private final long maxHeapBytes;

  // Handles are never reused within one VM
  private final AtomicLong nextHandle = new AtomicLong(0x1000);
  private final Map<Long, Object> globals = new ConcurrentHashMap<>();

  private final AtomicLong nextMemberId = new AtomicLong(1);
  private final Map<Long, MethodEntry> methods = new ConcurrentHashMap<>();
  private final Map<Executable, Long> methodIds = new ConcurrentHashMap<>();
  private final Map<Long, FieldEntry> fields = new ConcurrentHashMap<>();
  private final Map<Field, Long> fieldIds = new ConcurrentHashMap<>();

  private final Map<Thread, InProcessEnv> envs = new ConcurrentHashMap<>();
  private volatile boolean destroyed;

  InProcessVm(Path libraryPath, VmArguments arguments) {
    this.libraryPath = libraryPath;
    this.maxLocalCapacity = arguments.maxLocalCapacity();
    this.maxHeapBytes = arguments.maxHeapBytes();
    List<URL> classPath = arguments.classPath();
    if (classPath.isEmpty()) {
      this.classLoader = ClassLoader.getSystemClassLoader();
      this.ownsClassLoader = false;
    } else {
      this.classLoader =
          new URLClassLoader(
              "jbridge-vm-" + id, classPath.toArray(new URL[0]), ClassLoader.getSystemClassLoader());
      this.ownsClassLoader = true;
    }
  }

  // ========== INVOCATION INTERFACE ==========

  @Override
  public NativeEnv attachCurrentThread(boolean asDaemon) throws NativeVmException {
    if (destroyed) {
      throw new NativeVmException(Jni.JNI_ERR, "The VM has been destroyed");
    }
    Thread current = Thread.currentThread();
    return envs.computeIfAbsent(current, t -> new InProcessEnv(this, t, asDaemon));
  }

  @Override
  public int detachCurrentThread() {
    InProcessEnv env = envs.remove(Thread.currentThread());
    if (env != null) {
      env.invalidate();
    }
    return Jni.JNI_OK;
  }

  @Override
  public NativeEnv getEnv() {
    return destroyed ? null : envs.get(Thread.currentThread());
  }

  @Override
  public int destroyJavaVm() {
    if (destroyed) {
      return Jni.JNI_ERR;
    }
    destroyed = true;
    Thread current = Thread.currentThread();
    long others =
        envs.entrySet().stream()
            .filter(e -> e.getKey() != current && !e.getValue().isDaemon())
            .count();
    if (others > 0) {
      LOG.warning("Destroying VM " + id + " with " + others + " non-daemon threads still attached");
    }
    envs.values().forEach(InProcessEnv::invalidate);
    envs.clear();
    int leaked = globals.size();
    globals.clear();
    methods.clear();
    methodIds.clear();
    fields.clear();
    fieldIds.clear();
    NativeBinding.unregisterAll(this);
    InProcessVmLauncher.released(this);
    if (ownsClassLoader) {
      try {
        ((URLClassLoader) classLoader).close();
      } catch (IOException e) {
        LOG.log(Level.WARNING, "Failed to close class loader of VM " + id, e);
      }
    }
    LOG.info("Destroyed VM " + id + " (" + leaked + " global references outstanding)");
    return Jni.JNI_OK;
  }

  // ========== DIAGNOSTICS ==========

  public int id() {
    return id;
  }

  public Path libraryPath() {
    return libraryPath;
  }

  public ClassLoader classLoader() {
    return classLoader;
  }

  public boolean isDestroyed() {
    return destroyed;
  }

  public int globalRefCount() {
    return globals.size();
  }

  public int attachedThreadCount() {
    return envs.size();
  }

  public int maxLocalCapacity() {
    return maxLocalCapacity;
  }

  /** The {@code -Xmx} value in bytes, or -1 when none was given. */
  public long maxHeapBytes() {
    return maxHeapBytes;
  }

  // ========== TABLES ==========

  long nextHandle() {
    return nextHandle.getAndIncrement();
  }

  long newGlobal(Object obj) {
    long handle = nextHandle();
    globals.put(handle, obj);
    return handle;
  }

  Object global(long handle) {
    return globals.get(handle);
  }

  boolean deleteGlobal(long handle) {
    return globals.remove(handle) != null;
  }

  long methodId(Executable executable) {
    return methodIds.computeIfAbsent(
        executable,
        e -> {
          long mid = nextMemberId.getAndIncrement();
          methods.put(mid, new MethodEntry(e, Modifier.isStatic(e.getModifiers())));
          return mid;
        });
  }

  MethodEntry method(long methodId) {
    MethodEntry entry = methods.get(methodId);
    if (entry == null) {
      throw new IllegalStateException("Invalid method ID " + methodId);
    }
    return entry;
  }

  long fieldId(Field field) {
    return fieldIds.computeIfAbsent(
        field,
        f -> {
          long fid = nextMemberId.getAndIncrement();
          fields.put(fid, new FieldEntry(f, Modifier.isStatic(f.getModifiers())));
          return fid;
        });
  }

  FieldEntry field(long fieldId) {
    FieldEntry entry = fields.get(fieldId);
    if (entry == null) {
      throw new IllegalStateException("Invalid field ID " + fieldId);
    }
    return entry;
  }

  // ========== NATIVE CALLBACKS ==========

  /**
   * Run a registered native method on the calling thread. A thread that was never attached gets a
   * transient environment for the duration of the call. A pending exception left by the host
   * implementation is thrown into the calling Java code.
   */
  Object invokeNative(String sig, NativeMethod method, Object[] args) throws Throwable {
    if (destroyed) {
      throw new IllegalStateException("Native method invoked after VM " + id + " was destroyed");
    }
    InProcessEnv env = envs.get(Thread.currentThread());
    boolean transientEnv = env == null;
    if (transientEnv) {
      env = new InProcessEnv(this, Thread.currentThread(), true);
    }
    List<String> parameterTypes = Descriptors.parameterTypes(sig);
    if (env.pushLocalFrame(args.length + 16) != Jni.JNI_OK) {
      throw env.takePendingException();
    }
    try {
      JValue[] values = new JValue[args.length];
      for (int i = 0; i < args.length; i++) {
        values[i] = env.toValue(parameterTypes.get(i).charAt(0), args[i]);
      }
      long result = method.invoke(env, values);
      Throwable pending = env.takePendingException();
      if (pending != null) {
        throw pending;
      }
      return fromRaw(Descriptors.returnType(sig).charAt(0), result, env);
    } finally {
      env.popLocalFrame(Jni.NULL_REF);
      if (transientEnv) {
        env.invalidate();
      }
    }
  }

  private static Object fromRaw(char type, long raw, InProcessEnv env) {
    return switch (type) {
      case 'V' -> null;
      case 'Z' -> raw != 0;
      case 'B' -> (byte) raw;
      case 'C' -> (char) raw;
      case 'S' -> (short) raw;
      case 'I' -> (int) raw;
      case 'J' -> raw;
      case 'F' -> Float.intBitsToFloat((int) raw);
      case 'D' -> Double.longBitsToDouble(raw);
      default -> env.resolveOrNull(raw);
    };
  }

  @Override
  public String toString() {
    return "InProcessVm[" + id + (destroyed ? ", destroyed" : "") + "]";
  }
}
