package org.jbridge.env;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Logger;
import org.jbridge.BridgeLimits;
import org.jbridge.BridgeUsageException;
import org.jbridge.JavaException;
import org.jbridge.NativeAllocationException;
import org.jbridge.observability.BridgeLogger;
import org.jbridge.observability.CallKind;
import org.jbridge.observability.Metrics;
import org.jbridge.vm.JValue;
import org.jbridge.vm.Jni;
import org.jbridge.vm.NativeEnv;
import org.jbridge.vm.NativeMethod;

/**
 * The calling thread's view of the VM.
 *
 * <p>Wraps a {@link NativeEnv} and converts between host values and VM values according to type
 * descriptors. Objects come back as owned {@link JObject}s backed by global references; the local
 * references created along the way live in a short local frame per call. After every native call
 * a pending VM exception is cleared and raised as a {@link JavaException}, so the native
 * environment is never left with an exception pending.
 *
 * <p>An instance belongs to the thread it was attached on and must not be shared.
 */
public final class BridgeEnv {
  private static final Logger LOG = Logger.getLogger(BridgeEnv.class.getName());

  private final NativeEnv env;
  private final ReferenceReclaimer reclaimer;
  private final ArgumentPacker packer;

  BridgeEnv(NativeEnv env, ReferenceReclaimer reclaimer, ArgumentBoxer boxer) {
    this.env = env;
    this.reclaimer = reclaimer;
    this.packer = new ArgumentPacker(this, boxer);
  }

  public NativeEnv nativeEnv() {
    return env;
  }

  public int getVersion() {
    return env.getVersion();
  }

  // ========== REFERENCES ==========

  /** Wrap a new global reference to the object behind {@code local}; 0 yields null. */
  private JObject promote(long local) {
    if (local == 0) return null;
    long global = env.newGlobalRef(local);
    reclaimer.created();
    return JObject.owned(global, reclaimer);
  }

  /** Like {@link #promote}, deleting the local reference. */
  private JObject adopt(long local) {
    JObject obj = promote(local);
    if (local != 0) env.deleteLocalRef(local);
    return obj;
  }

  private JClass adoptClass(long local, String name) {
    long global = env.newGlobalRef(local);
    env.deleteLocalRef(local);
    reclaimer.created();
    return new JClass(global, Ownership.OWNED, reclaimer, name);
  }

  /** A new owned reference to the same object. */
  public JObject newGlobalRef(JObject obj) {
    if (obj == null) return null;
    long global = env.newGlobalRef(obj.handle());
    checkException();
    reclaimer.created();
    return JObject.owned(global, reclaimer);
  }

  /** Alias a reference valid for as long as its owner keeps it, such as a callback argument. */
  public JObject borrow(long handle) {
    return handle == 0 ? null : JObject.borrowed(handle);
  }

  void deleteGlobalRef(long handle) {
    env.deleteGlobalRef(handle);
    Metrics.getInstance().recordGlobalRefReleased();
  }

  public LocalFrame pushLocalFrame(int capacity) {
    return new LocalFrame(env, capacity);
  }

  // ========== EXCEPTIONS ==========

  /**
   * The pending exception as a local reference, valid until the enclosing local frame is popped.
   * The exception stays pending.
   */
  public Optional<JObject> exceptionOccurred() {
    if (!env.exceptionCheck()) return Optional.empty();
    return Optional.ofNullable(borrow(env.exceptionOccurred()));
  }

  public void exceptionDescribe() {
    env.exceptionDescribe();
  }

  public void exceptionClear() {
    env.exceptionClear();
  }

  /** Clear a pending exception and raise it. */
  void checkException() {
    if (!env.exceptionCheck()) return;
    long local = env.exceptionOccurred();
    env.exceptionClear();
    JObject throwable = adopt(local);
    Metrics.getInstance().recordJavaException();
    throw toJavaException(throwable);
  }

  /** Describe a VM throwable as a host exception. */
  public JavaException toJavaException(JObject throwable) {
    long classRef = env.getObjectClass(throwable.handle());
    String className = safeString(classRef, "java/lang/Class", "getName");
    env.deleteLocalRef(classRef);
    String message = safeString(throwable.handle(), "java/lang/Throwable", "getMessage");
    return new JavaException(
        throwable, className != null ? className : "java.lang.Throwable", message);
  }

  /**
   * Call a no-argument String method without raising: any exception it throws is cleared and
   * yields null. Used while reporting other exceptions.
   */
  private String safeString(long obj, String declaringClass, String method) {
    long cls = env.findClass(declaringClass);
    if (cls == 0) {
      env.exceptionClear();
      return null;
    }
    long mid = env.getMethodId(cls, method, "()Ljava/lang/String;");
    env.deleteLocalRef(cls);
    if (mid == 0) {
      env.exceptionClear();
      return null;
    }
    long str = env.callObjectMethod(obj, mid);
    if (env.exceptionCheck()) {
      env.exceptionClear();
      return null;
    }
    if (str == 0) return null;
    String s = new String(env.getStringUtfChars(str), StandardCharsets.UTF_8);
    env.deleteLocalRef(str);
    return s;
  }

  // ========== CLASSES ==========

  /** Find a class by dotted or slashed name, or array descriptor. */
  public JClass findClass(String name) {
    long local = env.findClass(Signature.toSlashed(name));
    checkException();
    return adoptClass(local, name);
  }

  public JClass getObjectClass(JObject obj) {
    long local = env.getObjectClass(obj.handle());
    checkException();
    return adoptClass(local, safeString(local, "java/lang/Class", "getName"));
  }

  /** View a {@code java.lang.Class} object as a class handle. */
  public JClass asClass(JObject classObject) {
    if (classObject instanceof JClass c) return c;
    long local = env.newLocalRef(classObject.handle());
    checkException();
    return adoptClass(local, safeString(local, "java/lang/Class", "getName"));
  }

  public boolean isInstanceOf(JObject obj, JClass clazz) {
    boolean result = env.isInstanceOf(JObject.handleOf(obj), clazz.handle());
    checkException();
    return result;
  }

  public boolean isSameObject(JObject a, JObject b) {
    boolean result = env.isSameObject(JObject.handleOf(a), JObject.handleOf(b));
    checkException();
    return result;
  }

  // ========== MEMBER IDS ==========

  /** Look up an instance method or constructor ({@code <init>}); null when there is none. */
  public JMethodId getMethodId(JClass clazz, String name, String sig) {
    return methodId(clazz, name, sig, false);
  }

  /** Look up a static method; null when there is none. */
  public JMethodId getStaticMethodId(JClass clazz, String name, String sig) {
    return methodId(clazz, name, sig, true);
  }

  private JMethodId methodId(JClass clazz, String name, String sig, boolean isStatic) {
    if (clazz == null) {
      throw new BridgeUsageException(
          "Class = null on call to " + (isStatic ? "getStaticMethodId" : "getMethodId"));
    }
    MethodSignature.parse(sig);
    long id =
        isStatic
            ? env.getStaticMethodId(clazz.handle(), name, sig)
            : env.getMethodId(clazz.handle(), name, sig);
    if (id == 0) {
      env.exceptionClear();
      LOG.finer("No method " + clazz.name() + "." + name + sig);
      return null;
    }
    return new JMethodId(id, name, sig, isStatic);
  }

  /** Look up an instance field; raises the VM's {@code NoSuchFieldError} when absent. */
  public JFieldId getFieldId(JClass clazz, String name, String sig) {
    long id = env.getFieldId(clazz.handle(), name, sig);
    checkException();
    return new JFieldId(id, name, sig, false);
  }

  public JFieldId getStaticFieldId(JClass clazz, String name, String sig) {
    long id = env.getStaticFieldId(clazz.handle(), name, sig);
    checkException();
    return new JFieldId(id, name, sig, true);
  }

  /** The ID of a {@code java.lang.reflect.Method} or {@code Constructor}. */
  public JMethodId fromReflectedMethod(JObject method, String sig, boolean isStatic) {
    MethodSignature.parse(sig);
    long id = env.fromReflectedMethod(method.handle());
    checkException();
    String name = safeString(method.handle(), "java/lang/reflect/Member", "getName");
    return new JMethodId(id, name, sig, isStatic);
  }

  public JFieldId fromReflectedField(JObject field, String sig, boolean isStatic) {
    long id = env.fromReflectedField(field.handle());
    checkException();
    String name = safeString(field.handle(), "java/lang/reflect/Member", "getName");
    return new JFieldId(id, name, sig, isStatic);
  }

  // ========== CALLS ==========

  /**
   * Call an instance method. Primitive results come back boxed, objects as owned handles, and
   * {@code void} as null.
   */
  public Object callMethod(JObject obj, JMethodId method, Object... args) {
    requireMethod(method);
    if (method.isStatic()) {
      throw new BridgeUsageException(
          "callMethod called with a static method. Use callStaticMethod instead");
    }
    return timed(
        CallKind.CALL_METHOD,
        method.name(),
        method.signature(),
        () -> call(JObject.handleOf(obj), method, args, false));
  }

  public Object callStaticMethod(JClass clazz, JMethodId method, Object... args) {
    requireMethod(method);
    if (!method.isStatic()) {
      throw new BridgeUsageException(
          "callStaticMethod called with an instance method. Use callMethod instead");
    }
    return timed(
        CallKind.CALL_STATIC_METHOD,
        clazz.name() + "." + method.name(),
        method.signature(),
        () -> call(clazz.handle(), method, args, true));
  }

  public JObject newObject(JClass clazz, JMethodId constructor, Object... args) {
    requireMethod(constructor);
    return timed(
        CallKind.NEW_OBJECT,
        clazz.name(),
        constructor.signature(),
        () -> {
          MethodSignature sig = constructor.parsedSignature();
          try (PackedArguments packed = packer.pack(sig, args);
              LocalFrame frame = pushLocalFrame(1)) {
            long local = env.newObject(clazz.handle(), constructor.id(), packed.values());
            checkException();
            if (local == 0) {
              throw new NativeAllocationException("Failed to allocate " + clazz.name());
            }
            return promote(local);
          }
        });
  }

  private static void requireMethod(JMethodId method) {
    if (method == null) {
      throw new BridgeUsageException("Method ID is null - check your method ID call");
    }
  }

  private Object call(long target, JMethodId method, Object[] args, boolean isStatic) {
    MethodSignature sig = method.parsedSignature();
    long id = method.id();
    try (PackedArguments packed = packer.pack(sig, args)) {
      JValue[] v = packed.values();
      Object result;
      switch (sig.returnCode()) {
        case 'V':
          if (isStatic) env.callStaticVoidMethod(target, id, v);
          else env.callVoidMethod(target, id, v);
          result = null;
          break;
        case 'Z':
          result = isStatic ? env.callStaticBooleanMethod(target, id, v)
              : env.callBooleanMethod(target, id, v);
          break;
        case 'B':
          result = isStatic ? env.callStaticByteMethod(target, id, v)
              : env.callByteMethod(target, id, v);
          break;
        case 'C':
          result = isStatic ? env.callStaticCharMethod(target, id, v)
              : env.callCharMethod(target, id, v);
          break;
        case 'S':
          result = isStatic ? env.callStaticShortMethod(target, id, v)
              : env.callShortMethod(target, id, v);
          break;
        case 'I':
          result = isStatic ? env.callStaticIntMethod(target, id, v)
              : env.callIntMethod(target, id, v);
          break;
        case 'J':
          result = isStatic ? env.callStaticLongMethod(target, id, v)
              : env.callLongMethod(target, id, v);
          break;
        case 'F':
          result = isStatic ? env.callStaticFloatMethod(target, id, v)
              : env.callFloatMethod(target, id, v);
          break;
        case 'D':
          result = isStatic ? env.callStaticDoubleMethod(target, id, v)
              : env.callDoubleMethod(target, id, v);
          break;
        default:
          try (LocalFrame frame = pushLocalFrame(1)) {
            long local = isStatic ? env.callStaticObjectMethod(target, id, v)
                : env.callObjectMethod(target, id, v);
            checkException();
            return promote(local);
          }
      }
      checkException();
      return result;
    }
  }

  private <T> T timed(CallKind kind, String target, String sig, Supplier<T> body) {
    long start = System.nanoTime();
    String errorType = null;
    try {
      return body.get();
    } catch (RuntimeException e) {
      errorType = e.getClass().getSimpleName();
      throw e;
    } finally {
      long latencyMicros = (System.nanoTime() - start) / 1000;
      Metrics.getInstance().recordCall(kind, latencyMicros, errorType == null);
      BridgeLogger.logCall(kind, target, sig, latencyMicros, errorType);
    }
  }

  // ========== FIELDS ==========

  public Object getField(JObject obj, JFieldId field) {
    if (field.isStatic()) {
      throw new BridgeUsageException(
          "getField called with a static field. Use getStaticField instead");
    }
    return timed(
        CallKind.GET_FIELD,
        field.name(),
        field.signature(),
        () -> readField(JObject.handleOf(obj), field, false));
  }

  public Object getStaticField(JClass clazz, JFieldId field) {
    if (!field.isStatic()) {
      throw new BridgeUsageException(
          "getStaticField called with an instance field. Use getField instead");
    }
    return timed(
        CallKind.GET_STATIC_FIELD,
        clazz.name() + "." + field.name(),
        field.signature(),
        () -> readField(clazz.handle(), field, true));
  }

  public void setField(JObject obj, JFieldId field, Object value) {
    if (field.isStatic()) {
      throw new BridgeUsageException(
          "setField called with a static field. Use setStaticField instead");
    }
    timed(
        CallKind.SET_FIELD,
        field.name(),
        field.signature(),
        () -> writeField(JObject.handleOf(obj), field, value, false));
  }

  public void setStaticField(JClass clazz, JFieldId field, Object value) {
    if (!field.isStatic()) {
      throw new BridgeUsageException(
          "setStaticField called with an instance field. Use setField instead");
    }
    timed(
        CallKind.SET_STATIC_FIELD,
        clazz.name() + "." + field.name(),
        field.signature(),
        () -> writeField(clazz.handle(), field, value, true));
  }

  private Object readField(long target, JFieldId field, boolean isStatic) {
    long id = field.id();
    Object result;
    switch (field.signature().charAt(0)) {
      case 'Z':
        result = isStatic ? env.getStaticBooleanField(target, id) : env.getBooleanField(target, id);
        break;
      case 'B':
        result = isStatic ? env.getStaticByteField(target, id) : env.getByteField(target, id);
        break;
      case 'C':
        result = isStatic ? env.getStaticCharField(target, id) : env.getCharField(target, id);
        break;
      case 'S':
        result = isStatic ? env.getStaticShortField(target, id) : env.getShortField(target, id);
        break;
      case 'I':
        result = isStatic ? env.getStaticIntField(target, id) : env.getIntField(target, id);
        break;
      case 'J':
        result = isStatic ? env.getStaticLongField(target, id) : env.getLongField(target, id);
        break;
      case 'F':
        result = isStatic ? env.getStaticFloatField(target, id) : env.getFloatField(target, id);
        break;
      case 'D':
        result = isStatic ? env.getStaticDoubleField(target, id) : env.getDoubleField(target, id);
        break;
      default:
        try (LocalFrame frame = pushLocalFrame(1)) {
          long local =
              isStatic ? env.getStaticObjectField(target, id) : env.getObjectField(target, id);
          checkException();
          return promote(local);
        }
    }
    checkException();
    return result;
  }

  private Void writeField(long target, JFieldId field, Object value, boolean isStatic) {
    long id = field.id();
    try (PackedArguments temporaries = new PackedArguments(0)) {
      JValue v = packer.toValue(field.signature(), value, temporaries);
      switch (field.signature().charAt(0)) {
        case 'Z':
          if (isStatic) env.setStaticBooleanField(target, id, v.getZ());
          else env.setBooleanField(target, id, v.getZ());
          break;
        case 'B':
          if (isStatic) env.setStaticByteField(target, id, v.getB());
          else env.setByteField(target, id, v.getB());
          break;
        case 'C':
          if (isStatic) env.setStaticCharField(target, id, v.getC());
          else env.setCharField(target, id, v.getC());
          break;
        case 'S':
          if (isStatic) env.setStaticShortField(target, id, v.getS());
          else env.setShortField(target, id, v.getS());
          break;
        case 'I':
          if (isStatic) env.setStaticIntField(target, id, v.getI());
          else env.setIntField(target, id, v.getI());
          break;
        case 'J':
          if (isStatic) env.setStaticLongField(target, id, v.getJ());
          else env.setLongField(target, id, v.getJ());
          break;
        case 'F':
          if (isStatic) env.setStaticFloatField(target, id, v.getF());
          else env.setFloatField(target, id, v.getF());
          break;
        case 'D':
          if (isStatic) env.setStaticDoubleField(target, id, v.getD());
          else env.setDoubleField(target, id, v.getD());
          break;
        default:
          if (isStatic) env.setStaticObjectField(target, id, v.getL());
          else env.setObjectField(target, id, v.getL());
      }
      checkException();
      return null;
    }
  }

  // ========== STRINGS ==========

  /** Create a VM string from UTF-16 code units. */
  public JObject newString(String s) {
    if (s == null) return null;
    try (LocalFrame frame = pushLocalFrame(1)) {
      long local = env.newString(s.toCharArray(), s.length());
      return promoteAllocation(local, "Failed to allocate string");
    }
  }

  /** Create a VM string from the UTF-8 encoding of {@code s}. */
  public JObject newStringUtf(String s) {
    if (s == null) return null;
    try (LocalFrame frame = pushLocalFrame(1)) {
      long local = env.newStringUtf(s.getBytes(StandardCharsets.UTF_8));
      return promoteAllocation(local, "Failed to allocate string");
    }
  }

  private JObject promoteAllocation(long local, String failure) {
    if (local == 0 || env.exceptionCheck()) {
      env.exceptionClear();
      throw new NativeAllocationException(failure);
    }
    return promote(local);
  }

  public String getString(JObject str) {
    if (str == null) return null;
    char[] chars = env.getStringChars(str.handle());
    checkException();
    return new String(chars);
  }

  public String getStringUtf(JObject str) {
    if (str == null) return null;
    byte[] utf8 = env.getStringUtfChars(str.handle());
    checkException();
    return new String(utf8, StandardCharsets.UTF_8);
  }

  public int getStringLength(JObject str) {
    int length = env.getStringLength(str.handle());
    checkException();
    return length;
  }

  // ========== PRIMITIVE ARRAYS ==========

  public int getArrayLength(JObject array) {
    int length = env.getArrayLength(array.handle());
    checkException();
    return length;
  }

  private JObject allocated(long local, String type, int size) {
    return promoteAllocation(local, "Failed to allocate " + type + " array of size " + size);
  }

  public boolean[] getBooleanArrayElements(JObject array) {
    if (array == null) return null;
    boolean[] buf = new boolean[getArrayLength(array)];
    env.getBooleanArrayRegion(array.handle(), 0, buf.length, buf);
    checkException();
    return buf;
  }

  public byte[] getByteArrayElements(JObject array) {
    if (array == null) return null;
    byte[] buf = new byte[getArrayLength(array)];
    env.getByteArrayRegion(array.handle(), 0, buf.length, buf);
    checkException();
    return buf;
  }

  public char[] getCharArrayElements(JObject array) {
    if (array == null) return null;
    char[] buf = new char[getArrayLength(array)];
    env.getCharArrayRegion(array.handle(), 0, buf.length, buf);
    checkException();
    return buf;
  }

  public short[] getShortArrayElements(JObject array) {
    if (array == null) return null;
    short[] buf = new short[getArrayLength(array)];
    env.getShortArrayRegion(array.handle(), 0, buf.length, buf);
    checkException();
    return buf;
  }

  public int[] getIntArrayElements(JObject array) {
    if (array == null) return null;
    int[] buf = new int[getArrayLength(array)];
    env.getIntArrayRegion(array.handle(), 0, buf.length, buf);
    checkException();
    return buf;
  }

  public long[] getLongArrayElements(JObject array) {
    if (array == null) return null;
    long[] buf = new long[getArrayLength(array)];
    env.getLongArrayRegion(array.handle(), 0, buf.length, buf);
    checkException();
    return buf;
  }

  public float[] getFloatArrayElements(JObject array) {
    if (array == null) return null;
    float[] buf = new float[getArrayLength(array)];
    env.getFloatArrayRegion(array.handle(), 0, buf.length, buf);
    checkException();
    return buf;
  }

  public double[] getDoubleArrayElements(JObject array) {
    if (array == null) return null;
    double[] buf = new double[getArrayLength(array)];
    env.getDoubleArrayRegion(array.handle(), 0, buf.length, buf);
    checkException();
    return buf;
  }

  public JObject makeBooleanArray(boolean[] values) {
    try (LocalFrame frame = pushLocalFrame(1)) {
      long local = env.newBooleanArray(values.length);
      JObject array = allocated(local, "boolean", values.length);
      env.setBooleanArrayRegion(local, 0, values.length, values);
      checkException();
      return array;
    }
  }

  public JObject makeByteArray(byte[] values) {
    try (LocalFrame frame = pushLocalFrame(1)) {
      long local = env.newByteArray(values.length);
      JObject array = allocated(local, "byte", values.length);
      env.setByteArrayRegion(local, 0, values.length, values);
      checkException();
      return array;
    }
  }

  public JObject makeCharArray(char[] values) {
    try (LocalFrame frame = pushLocalFrame(1)) {
      long local = env.newCharArray(values.length);
      JObject array = allocated(local, "char", values.length);
      env.setCharArrayRegion(local, 0, values.length, values);
      checkException();
      return array;
    }
  }

  public JObject makeShortArray(short[] values) {
    try (LocalFrame frame = pushLocalFrame(1)) {
      long local = env.newShortArray(values.length);
      JObject array = allocated(local, "short", values.length);
      env.setShortArrayRegion(local, 0, values.length, values);
      checkException();
      return array;
    }
  }

  public JObject makeIntArray(int[] values) {
    try (LocalFrame frame = pushLocalFrame(1)) {
      long local = env.newIntArray(values.length);
      JObject array = allocated(local, "int", values.length);
      env.setIntArrayRegion(local, 0, values.length, values);
      checkException();
      return array;
    }
  }

  public JObject makeLongArray(long[] values) {
    try (LocalFrame frame = pushLocalFrame(1)) {
      long local = env.newLongArray(values.length);
      JObject array = allocated(local, "long", values.length);
      env.setLongArrayRegion(local, 0, values.length, values);
      checkException();
      return array;
    }
  }

  public JObject makeFloatArray(float[] values) {
    try (LocalFrame frame = pushLocalFrame(1)) {
      long local = env.newFloatArray(values.length);
      JObject array = allocated(local, "float", values.length);
      env.setFloatArrayRegion(local, 0, values.length, values);
      checkException();
      return array;
    }
  }

  public JObject makeDoubleArray(double[] values) {
    try (LocalFrame frame = pushLocalFrame(1)) {
      long local = env.newDoubleArray(values.length);
      JObject array = allocated(local, "double", values.length);
      env.setDoubleArrayRegion(local, 0, values.length, values);
      checkException();
      return array;
    }
  }

  // ========== OBJECT ARRAYS ==========

  /**
   * Read every element of an object array. The local frame is reset every {@link
   * BridgeLimits#OBJECT_ARRAY_FRAME} elements, so arrays of any length stay within the VM's
   * local reference capacity.
   */
  public JObject[] getObjectArrayElements(JObject array) {
    if (array == null) return null;
    int size = getArrayLength(array);
    JObject[] result = new JObject[size];
    int frameSize = BridgeLimits.OBJECT_ARRAY_FRAME;
    long start = System.nanoTime();
    try (LocalFrame frame = pushLocalFrame(frameSize)) {
      for (int i = 0; i < size; i++) {
        if (i > 0 && i % frameSize == 0) {
          frame.reset(frameSize);
        }
        long local = env.getObjectArrayElement(array.handle(), i);
        checkException();
        result[i] = promote(local);
      }
    }
    Metrics.getInstance()
        .recordCall(CallKind.ARRAY_TRANSFER, (System.nanoTime() - start) / 1000, true);
    return result;
  }

  /** Allocate an object array of {@code size} nulls. */
  public JObject makeObjectArray(int size, JClass elementClass) {
    try (LocalFrame frame = pushLocalFrame(1)) {
      long local = env.newObjectArray(size, elementClass.handle(), Jni.NULL_REF);
      return allocated(local, "object", size);
    }
  }

  public JObject getObjectArrayElement(JObject array, int index) {
    try (LocalFrame frame = pushLocalFrame(1)) {
      long local = env.getObjectArrayElement(array.handle(), index);
      checkException();
      return promote(local);
    }
  }

  public void setObjectArrayElement(JObject array, int index, Object value) {
    try (PackedArguments temporaries = new PackedArguments(0)) {
      JValue v = packer.toValue("Ljava/lang/Object;", value, temporaries);
      env.setObjectArrayElement(array.handle(), index, v.getL());
      checkException();
    }
  }

  // ========== NATIVES ==========

  /** Bind a host implementation to a native method declared by {@code clazz}. */
  public void registerNative(
      JClass clazz, String name, String sig, NativeMethod method) {
    MethodSignature.parse(sig);
    env.registerNatives(clazz.handle(), name, sig, method);
    checkException();
  }

  @Override
  public String toString() {
    return "BridgeEnv[" + env + "]";
  }
}
