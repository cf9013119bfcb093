package org.jbridge.vm.inprocess;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jbridge.vm.JValue;
import org.jbridge.vm.Jni;
import org.jbridge.vm.NativeEnv;
import org.jbridge.vm.NativeMethod;

/**
 * The environment of one thread attached to an {@link InProcessVm}.
 *
 * <p>Checks are always on: using the environment from another thread or after detach, passing a
 * deleted reference, overflowing the local reference capacity, or calling a non-exempt function
 * with an exception pending fails with {@link IllegalStateException}, the in-process counterpart
 * of a fatal error in a native VM.
 */
final class InProcessEnv implements NativeEnv {
  private static final Logger LOG = Logger.getLogger(InProcessEnv.class.getName());

  private final InProcessVm vm;
  private final Thread owner;
  private final boolean daemon;

  // Local references of this thread; the deque holds the handles created in each frame
  private final Map<Long, Object> locals = new HashMap<>();
  private final Deque<List<Long>> frames = new ArrayDeque<>();

  private Throwable pending;
  private volatile boolean valid = true;

  InProcessEnv(InProcessVm vm, Thread owner, boolean daemon) {
    this.vm = vm;
    this.owner = owner;
    this.daemon = daemon;
    frames.push(new ArrayList<>());
  }

  boolean isDaemon() {
    return daemon;
  }

  void invalidate() {
    valid = false;
    locals.clear();
    frames.clear();
    pending = null;
  }

  int localRefCount() {
    return locals.size();
  }

  // ========== CHECKS ==========

  private void check(String function) {
    checkThread(function);
    if (pending != null) {
      throw new IllegalStateException(
          "JNI call " + function + " made with exception pending: " + pending);
    }
  }

  private void checkThread(String function) {
    if (!valid) {
      throw new IllegalStateException("JNI call " + function + " on a detached environment");
    }
    if (Thread.currentThread() != owner) {
      throw new IllegalStateException(
          "JNI call "
              + function
              + " on thread "
              + Thread.currentThread().getName()
              + " using the environment of "
              + owner.getName());
    }
  }

  // ========== REFERENCES ==========

  Object resolveOrNull(long handle) {
    if (handle == 0) return null;
    Object obj = locals.get(handle);
    if (obj == null) {
      obj = vm.global(handle);
    }
    if (obj == null) {
      throw new IllegalStateException("Invalid reference 0x" + Long.toHexString(handle));
    }
    return obj;
  }

  private <T> T resolve(long handle, Class<T> type) {
    return type.cast(resolveOrNull(handle));
  }

  private long newLocal(Object obj) {
    if (obj == null) return 0;
    if (locals.size() >= vm.maxLocalCapacity()) {
      throw new IllegalStateException(
          "Local reference table overflow (MaxJNILocalCapacity=" + vm.maxLocalCapacity() + ")");
    }
    long handle = vm.nextHandle();
    locals.put(handle, obj);
    frames.peek().add(handle);
    return handle;
  }

  JValue toValue(char type, Object arg) {
    return switch (type) {
      case 'Z' -> JValue.z((Boolean) arg);
      case 'B' -> JValue.b((Byte) arg);
      case 'C' -> JValue.c((Character) arg);
      case 'S' -> JValue.s((Short) arg);
      case 'I' -> JValue.i((Integer) arg);
      case 'J' -> JValue.j((Long) arg);
      case 'F' -> JValue.f((Float) arg);
      case 'D' -> JValue.d((Double) arg);
      default -> JValue.l(newLocal(arg));
    };
  }

  /** Clear and return the pending exception, or null. */
  Throwable takePendingException() {
    Throwable t = pending;
    pending = null;
    return t;
  }

  private void fail(Throwable t) {
    if (t instanceof InvocationTargetException ite && ite.getCause() != null) {
      t = ite.getCause();
    }
    pending = t;
  }

  @Override
  public int getVersion() {
    check("GetVersion");
    return Jni.JNI_VERSION_10;
  }

  @Override
  public long newGlobalRef(long ref) {
    check("NewGlobalRef");
    Object obj = resolveOrNull(ref);
    return obj == null ? 0 : vm.newGlobal(obj);
  }

  @Override
  public void deleteGlobalRef(long ref) {
    checkThread("DeleteGlobalRef");
    if (ref != 0 && !vm.deleteGlobal(ref)) {
      throw new IllegalStateException(
          "DeleteGlobalRef of an invalid global reference 0x" + Long.toHexString(ref));
    }
  }

  @Override
  public long newLocalRef(long ref) {
    check("NewLocalRef");
    return newLocal(resolveOrNull(ref));
  }

  @Override
  public void deleteLocalRef(long ref) {
    checkThread("DeleteLocalRef");
    if (ref == 0 || locals.remove(ref) == null) return;
    for (List<Long> frame : frames) {
      if (frame.remove(Long.valueOf(ref))) return;
    }
  }

  @Override
  public int pushLocalFrame(int capacity) {
    check("PushLocalFrame");
    if (capacity < 0 || locals.size() + capacity > vm.maxLocalCapacity()) {
      pending = new OutOfMemoryError("Could not reserve " + capacity + " local references");
      return Jni.JNI_ERR;
    }
    frames.push(new ArrayList<>(Math.min(capacity, 1024)));
    return Jni.JNI_OK;
  }

  @Override
  public long popLocalFrame(long result) {
    checkThread("PopLocalFrame");
    if (frames.size() <= 1) {
      throw new IllegalStateException("PopLocalFrame without a matching PushLocalFrame");
    }
    Object keep = resolveOrNull(result);
    for (Long handle : frames.pop()) {
      locals.remove(handle);
    }
    return newLocal(keep);
  }

  // ========== EXCEPTIONS ==========

  @Override
  public long exceptionOccurred() {
    checkThread("ExceptionOccurred");
    return newLocal(pending);
  }

  @Override
  public boolean exceptionCheck() {
    checkThread("ExceptionCheck");
    return pending != null;
  }

  @Override
  public void exceptionDescribe() {
    checkThread("ExceptionDescribe");
    if (pending != null) {
      LOG.log(Level.WARNING, "Exception in thread \"" + owner.getName() + "\"", pending);
      pending = null;
    }
  }

  @Override
  public void exceptionClear() {
    checkThread("ExceptionClear");
    pending = null;
  }

  @Override
  public int throwNew(long clazz, String message) {
    check("ThrowNew");
    Class<?> type = resolve(clazz, Class.class);
    try {
      Constructor<?> ctor = type.getConstructor(String.class);
      pending = (Throwable) ctor.newInstance(message);
      return Jni.JNI_OK;
    } catch (ReflectiveOperationException | ClassCastException e) {
      fail(e);
      return Jni.JNI_ERR;
    }
  }

  // ========== CLASSES ==========

  @Override
  public long findClass(String name) {
    check("FindClass");
    if (name == null) {
      pending = new NullPointerException("FindClass of null");
      return 0;
    }
    try {
      return newLocal(Class.forName(name.replace('/', '.'), true, vm.classLoader()));
    } catch (ClassNotFoundException | LinkageError e) {
      NoClassDefFoundError error = new NoClassDefFoundError(name);
      error.initCause(e);
      pending = error;
      return 0;
    }
  }

  @Override
  public long getObjectClass(long obj) {
    check("GetObjectClass");
    Object o = resolveOrNull(obj);
    if (o == null) {
      throw new IllegalStateException("GetObjectClass of a null reference");
    }
    return newLocal(o.getClass());
  }

  @Override
  public long getSuperclass(long clazz) {
    check("GetSuperclass");
    return newLocal(resolve(clazz, Class.class).getSuperclass());
  }

  @Override
  public boolean isInstanceOf(long obj, long clazz) {
    check("IsInstanceOf");
    Object o = resolveOrNull(obj);
    return o == null || resolve(clazz, Class.class).isInstance(o);
  }

  @Override
  public boolean isSameObject(long a, long b) {
    check("IsSameObject");
    return resolveOrNull(a) == resolveOrNull(b);
  }

  // ========== MEMBER IDS ==========

  @Override
  public long getMethodId(long clazz, String name, String sig) {
    check("GetMethodID");
    return lookupMethod(clazz, name, sig, false);
  }

  @Override
  public long getStaticMethodId(long clazz, String name, String sig) {
    check("GetStaticMethodID");
    return lookupMethod(clazz, name, sig, true);
  }

  private long lookupMethod(long clazz, String name, String sig, boolean isStatic) {
    Executable e = ReflectionCache.findMethod(resolve(clazz, Class.class), name, sig, isStatic);
    if (e == null) {
      pending = new NoSuchMethodError(name + sig);
      return 0;
    }
    return vm.methodId(e);
  }

  @Override
  public long getFieldId(long clazz, String name, String sig) {
    check("GetFieldID");
    return lookupField(clazz, name, sig, false);
  }

  @Override
  public long getStaticFieldId(long clazz, String name, String sig) {
    check("GetStaticFieldID");
    return lookupField(clazz, name, sig, true);
  }

  private long lookupField(long clazz, String name, String sig, boolean isStatic) {
    Field f = ReflectionCache.findField(resolve(clazz, Class.class), name, sig, isStatic);
    if (f == null) {
      pending = new NoSuchFieldError(name);
      return 0;
    }
    return vm.fieldId(f);
  }

  @Override
  public long fromReflectedMethod(long method) {
    check("FromReflectedMethod");
    Executable e = resolve(method, Executable.class);
    if (e instanceof Method m) {
      e = ReflectionCache.accessibleMethod(m);
    }
    return vm.methodId(e);
  }

  @Override
  public long fromReflectedField(long field) {
    check("FromReflectedField");
    return vm.fieldId(resolve(field, Field.class));
  }

  // ========== CALLS ==========

  private Object invoke(String function, long target, long methodId, JValue[] args, boolean isStatic) {
    check(function);
    InProcessVm.MethodEntry entry = vm.method(methodId);
    if (entry.isStatic() != isStatic) {
      throw new IllegalStateException(
          function + " with " + (isStatic ? "an instance" : "a static") + " method ID");
    }
    Object receiver = isStatic ? null : resolveOrNull(target);
    if (!isStatic && receiver == null) {
      pending = new NullPointerException(function + " on a null reference");
      return null;
    }
    try {
      Object[] jargs = toArguments(entry.executable(), args);
      if (entry.executable() instanceof Method m) {
        return m.invoke(receiver, jargs);
      }
      throw new IllegalStateException(function + " with a constructor ID");
    } catch (ReflectiveOperationException | IllegalArgumentException e) {
      fail(e);
      return null;
    }
  }

  private Object[] toArguments(Executable executable, JValue[] args) {
    Class<?>[] types = executable.getParameterTypes();
    if (types.length != args.length) {
      throw new IllegalStateException(
          executable + " takes " + types.length + " arguments, got " + args.length);
    }
    Object[] out = new Object[args.length];
    for (int i = 0; i < args.length; i++) {
      out[i] = fromValue(types[i], args[i]);
    }
    return out;
  }

  private Object fromValue(Class<?> type, JValue value) {
    if (type == boolean.class) return value.getZ();
    if (type == byte.class) return value.getB();
    if (type == char.class) return value.getC();
    if (type == short.class) return value.getS();
    if (type == int.class) return value.getI();
    if (type == long.class) return value.getJ();
    if (type == float.class) return value.getF();
    if (type == double.class) return value.getD();
    return resolveOrNull(value.getL());
  }

  private static boolean z(Object o) {
    return o != null && (Boolean) o;
  }

  private static char c(Object o) {
    return o == null ? 0 : (Character) o;
  }

  private static Number n(Object o) {
    if (o == null) return 0;
    if (o instanceof Character ch) return (int) ch;
    return (Number) o;
  }

  @Override
  public void callVoidMethod(long obj, long methodId, JValue... args) {
    invoke("CallVoidMethod", obj, methodId, args, false);
  }

  @Override
  public boolean callBooleanMethod(long obj, long methodId, JValue... args) {
    return z(invoke("CallBooleanMethod", obj, methodId, args, false));
  }

  @Override
  public byte callByteMethod(long obj, long methodId, JValue... args) {
    return n(invoke("CallByteMethod", obj, methodId, args, false)).byteValue();
  }

  @Override
  public char callCharMethod(long obj, long methodId, JValue... args) {
    return c(invoke("CallCharMethod", obj, methodId, args, false));
  }

  @Override
  public short callShortMethod(long obj, long methodId, JValue... args) {
    return n(invoke("CallShortMethod", obj, methodId, args, false)).shortValue();
  }

  @Override
  public int callIntMethod(long obj, long methodId, JValue... args) {
    return n(invoke("CallIntMethod", obj, methodId, args, false)).intValue();
  }

  @Override
  public long callLongMethod(long obj, long methodId, JValue... args) {
    return n(invoke("CallLongMethod", obj, methodId, args, false)).longValue();
  }

  @Override
  public float callFloatMethod(long obj, long methodId, JValue... args) {
    return n(invoke("CallFloatMethod", obj, methodId, args, false)).floatValue();
  }

  @Override
  public double callDoubleMethod(long obj, long methodId, JValue... args) {
    return n(invoke("CallDoubleMethod", obj, methodId, args, false)).doubleValue();
  }

  @Override
  public long callObjectMethod(long obj, long methodId, JValue... args) {
    return newLocal(invoke("CallObjectMethod", obj, methodId, args, false));
  }

  @Override
  public void callStaticVoidMethod(long clazz, long methodId, JValue... args) {
    invoke("CallStaticVoidMethod", clazz, methodId, args, true);
  }

  @Override
  public boolean callStaticBooleanMethod(long clazz, long methodId, JValue... args) {
    return z(invoke("CallStaticBooleanMethod", clazz, methodId, args, true));
  }

  @Override
  public byte callStaticByteMethod(long clazz, long methodId, JValue... args) {
    return n(invoke("CallStaticByteMethod", clazz, methodId, args, true)).byteValue();
  }

  @Override
  public char callStaticCharMethod(long clazz, long methodId, JValue... args) {
    return c(invoke("CallStaticCharMethod", clazz, methodId, args, true));
  }

  @Override
  public short callStaticShortMethod(long clazz, long methodId, JValue... args) {
    return n(invoke("CallStaticShortMethod", clazz, methodId, args, true)).shortValue();
  }

  @Override
  public int callStaticIntMethod(long clazz, long methodId, JValue... args) {
    return n(invoke("CallStaticIntMethod", clazz, methodId, args, true)).intValue();
  }

  @Override
  public long callStaticLongMethod(long clazz, long methodId, JValue... args) {
    return n(invoke("CallStaticLongMethod", clazz, methodId, args, true)).longValue();
  }

  @Override
  public float callStaticFloatMethod(long clazz, long methodId, JValue... args) {
    return n(invoke("CallStaticFloatMethod", clazz, methodId, args, true)).floatValue();
  }

  @Override
  public double callStaticDoubleMethod(long clazz, long methodId, JValue... args) {
    return n(invoke("CallStaticDoubleMethod", clazz, methodId, args, true)).doubleValue();
  }

  @Override
  public long callStaticObjectMethod(long clazz, long methodId, JValue... args) {
    return newLocal(invoke("CallStaticObjectMethod", clazz, methodId, args, true));
  }

  @Override
  public long newObject(long clazz, long constructorId, JValue... args) {
    check("NewObject");
    Class<?> type = resolve(clazz, Class.class);
    InProcessVm.MethodEntry entry = vm.method(constructorId);
    if (!(entry.executable() instanceof Constructor<?> ctor)) {
      throw new IllegalStateException("NewObject with a method ID that is not a constructor");
    }
    if (Modifier.isAbstract(type.getModifiers())) {
      pending = new InstantiationError(type.getName());
      return 0;
    }
    try {
      return newLocal(ctor.newInstance(toArguments(ctor, args)));
    } catch (ReflectiveOperationException | IllegalArgumentException e) {
      fail(e);
      return 0;
    }
  }

  // ========== FIELDS ==========

  private Object getField(String function, long target, long fieldId, boolean isStatic) {
    check(function);
    InProcessVm.FieldEntry entry = vm.field(fieldId);
    if (entry.isStatic() != isStatic) {
      throw new IllegalStateException(
          function + " with " + (isStatic ? "an instance" : "a static") + " field ID");
    }
    Object receiver = isStatic ? null : resolveOrNull(target);
    if (!isStatic && receiver == null) {
      pending = new NullPointerException(function + " on a null reference");
      return null;
    }
    try {
      return entry.field().get(receiver);
    } catch (IllegalAccessException | IllegalArgumentException e) {
      fail(e);
      return null;
    }
  }

  private void setField(String function, long target, long fieldId, boolean isStatic, Object v) {
    check(function);
    InProcessVm.FieldEntry entry = vm.field(fieldId);
    if (entry.isStatic() != isStatic) {
      throw new IllegalStateException(
          function + " with " + (isStatic ? "an instance" : "a static") + " field ID");
    }
    Object receiver = isStatic ? null : resolveOrNull(target);
    if (!isStatic && receiver == null) {
      pending = new NullPointerException(function + " on a null reference");
      return;
    }
    try {
      entry.field().set(receiver, v);
    } catch (IllegalAccessException | IllegalArgumentException e) {
      fail(e);
    }
  }

  @Override
  public boolean getBooleanField(long obj, long fieldId) {
    return z(getField("GetBooleanField", obj, fieldId, false));
  }

  @Override
  public byte getByteField(long obj, long fieldId) {
    return n(getField("GetByteField", obj, fieldId, false)).byteValue();
  }

  @Override
  public char getCharField(long obj, long fieldId) {
    return c(getField("GetCharField", obj, fieldId, false));
  }

  @Override
  public short getShortField(long obj, long fieldId) {
    return n(getField("GetShortField", obj, fieldId, false)).shortValue();
  }

  @Override
  public int getIntField(long obj, long fieldId) {
    return n(getField("GetIntField", obj, fieldId, false)).intValue();
  }

  @Override
  public long getLongField(long obj, long fieldId) {
    return n(getField("GetLongField", obj, fieldId, false)).longValue();
  }

  @Override
  public float getFloatField(long obj, long fieldId) {
    return n(getField("GetFloatField", obj, fieldId, false)).floatValue();
  }

  @Override
  public double getDoubleField(long obj, long fieldId) {
    return n(getField("GetDoubleField", obj, fieldId, false)).doubleValue();
  }

  @Override
  public long getObjectField(long obj, long fieldId) {
    return newLocal(getField("GetObjectField", obj, fieldId, false));
  }

  @Override
  public void setBooleanField(long obj, long fieldId, boolean value) {
    setField("SetBooleanField", obj, fieldId, false, value);
  }

  @Override
  public void setByteField(long obj, long fieldId, byte value) {
    setField("SetByteField", obj, fieldId, false, value);
  }

  @Override
  public void setCharField(long obj, long fieldId, char value) {
    setField("SetCharField", obj, fieldId, false, value);
  }

  @Override
  public void setShortField(long obj, long fieldId, short value) {
    setField("SetShortField", obj, fieldId, false, value);
  }

  @Override
  public void setIntField(long obj, long fieldId, int value) {
    setField("SetIntField", obj, fieldId, false, value);
  }

  @Override
  public void setLongField(long obj, long fieldId, long value) {
    setField("SetLongField", obj, fieldId, false, value);
  }

  @Override
  public void setFloatField(long obj, long fieldId, float value) {
    setField("SetFloatField", obj, fieldId, false, value);
  }

  @Override
  public void setDoubleField(long obj, long fieldId, double value) {
    setField("SetDoubleField", obj, fieldId, false, value);
  }

  @Override
  public void setObjectField(long obj, long fieldId, long value) {
    setField("SetObjectField", obj, fieldId, false, resolveOrNull(value));
  }

  @Override
  public boolean getStaticBooleanField(long clazz, long fieldId) {
    return z(getField("GetStaticBooleanField", clazz, fieldId, true));
  }

  @Override
  public byte getStaticByteField(long clazz, long fieldId) {
    return n(getField("GetStaticByteField", clazz, fieldId, true)).byteValue();
  }

  @Override
  public char getStaticCharField(long clazz, long fieldId) {
    return c(getField("GetStaticCharField", clazz, fieldId, true));
  }

  @Override
  public short getStaticShortField(long clazz, long fieldId) {
    return n(getField("GetStaticShortField", clazz, fieldId, true)).shortValue();
  }

  @Override
  public int getStaticIntField(long clazz, long fieldId) {
    return n(getField("GetStaticIntField", clazz, fieldId, true)).intValue();
  }

  @Override
  public long getStaticLongField(long clazz, long fieldId) {
    return n(getField("GetStaticLongField", clazz, fieldId, true)).longValue();
  }

  @Override
  public float getStaticFloatField(long clazz, long fieldId) {
    return n(getField("GetStaticFloatField", clazz, fieldId, true)).floatValue();
  }

  @Override
  public double getStaticDoubleField(long clazz, long fieldId) {
    return n(getField("GetStaticDoubleField", clazz, fieldId, true)).doubleValue();
  }

  @Override
  public long getStaticObjectField(long clazz, long fieldId) {
    return newLocal(getField("GetStaticObjectField", clazz, fieldId, true));
  }

  @Override
  public void setStaticBooleanField(long clazz, long fieldId, boolean value) {
    setField("SetStaticBooleanField", clazz, fieldId, true, value);
  }

  @Override
  public void setStaticByteField(long clazz, long fieldId, byte value) {
    setField("SetStaticByteField", clazz, fieldId, true, value);
  }

  @Override
  public void setStaticCharField(long clazz, long fieldId, char value) {
    setField("SetStaticCharField", clazz, fieldId, true, value);
  }

  @Override
  public void setStaticShortField(long clazz, long fieldId, short value) {
    setField("SetStaticShortField", clazz, fieldId, true, value);
  }

  @Override
  public void setStaticIntField(long clazz, long fieldId, int value) {
    setField("SetStaticIntField", clazz, fieldId, true, value);
  }

  @Override
  public void setStaticLongField(long clazz, long fieldId, long value) {
    setField("SetStaticLongField", clazz, fieldId, true, value);
  }

  @Override
  public void setStaticFloatField(long clazz, long fieldId, float value) {
    setField("SetStaticFloatField", clazz, fieldId, true, value);
  }

  @Override
  public void setStaticDoubleField(long clazz, long fieldId, double value) {
    setField("SetStaticDoubleField", clazz, fieldId, true, value);
  }

  @Override
  public void setStaticObjectField(long clazz, long fieldId, long value) {
    setField("SetStaticObjectField", clazz, fieldId, true, resolveOrNull(value));
  }

  // ========== STRINGS ==========

  @Override
  public long newString(char[] chars, int length) {
    check("NewString");
    if (chars == null || length < 0 || length > chars.length) {
      pending = new IllegalArgumentException("Bad buffer for NewString");
      return 0;
    }
    return newLocal(new String(chars, 0, length));
  }

  @Override
  public long newStringUtf(byte[] utf8) {
    check("NewStringUTF");
    return utf8 == null ? 0 : newLocal(new String(utf8, StandardCharsets.UTF_8));
  }

  @Override
  public int getStringLength(long str) {
    check("GetStringLength");
    return resolve(str, String.class).length();
  }

  @Override
  public char[] getStringChars(long str) {
    check("GetStringChars");
    return resolve(str, String.class).toCharArray();
  }

  @Override
  public byte[] getStringUtfChars(long str) {
    check("GetStringUTFChars");
    return resolve(str, String.class).getBytes(StandardCharsets.UTF_8);
  }

  // ========== ARRAYS ==========

  @Override
  public int getArrayLength(long array) {
    check("GetArrayLength");
    return Array.getLength(resolveOrNull(array));
  }

  private long newArray(String function, Class<?> componentType, int length) {
    check(function);
    try {
      return newLocal(Array.newInstance(componentType, length));
    } catch (NegativeArraySizeException | OutOfMemoryError e) {
      pending = e;
      return 0;
    }
  }

  @Override
  public long newBooleanArray(int length) {
    return newArray("NewBooleanArray", boolean.class, length);
  }

  @Override
  public long newByteArray(int length) {
    return newArray("NewByteArray", byte.class, length);
  }

  @Override
  public long newCharArray(int length) {
    return newArray("NewCharArray", char.class, length);
  }

  @Override
  public long newShortArray(int length) {
    return newArray("NewShortArray", short.class, length);
  }

  @Override
  public long newIntArray(int length) {
    return newArray("NewIntArray", int.class, length);
  }

  @Override
  public long newLongArray(int length) {
    return newArray("NewLongArray", long.class, length);
  }

  @Override
  public long newFloatArray(int length) {
    return newArray("NewFloatArray", float.class, length);
  }

  @Override
  public long newDoubleArray(int length) {
    return newArray("NewDoubleArray", double.class, length);
  }

  /** Bulk copy between a VM array and a host buffer, in the direction given by {@code toHost}. */
  private void region(String function, long array, int start, int length, Object buf, boolean toHost) {
    check(function);
    Object vmArray = resolveOrNull(array);
    try {
      if (toHost) {
        System.arraycopy(vmArray, start, buf, 0, length);
      } else {
        System.arraycopy(buf, 0, vmArray, start, length);
      }
    } catch (IndexOutOfBoundsException | ArrayStoreException e) {
      pending = new ArrayIndexOutOfBoundsException(e.getMessage());
    }
  }

  @Override
  public void getBooleanArrayRegion(long array, int start, int length, boolean[] buf) {
    region("GetBooleanArrayRegion", array, start, length, buf, true);
  }

  @Override
  public void getByteArrayRegion(long array, int start, int length, byte[] buf) {
    region("GetByteArrayRegion", array, start, length, buf, true);
  }

  @Override
  public void getCharArrayRegion(long array, int start, int length, char[] buf) {
    region("GetCharArrayRegion", array, start, length, buf, true);
  }

  @Override
  public void getShortArrayRegion(long array, int start, int length, short[] buf) {
    region("GetShortArrayRegion", array, start, length, buf, true);
  }

  @Override
  public void getIntArrayRegion(long array, int start, int length, int[] buf) {
    region("GetIntArrayRegion", array, start, length, buf, true);
  }

  @Override
  public void getLongArrayRegion(long array, int start, int length, long[] buf) {
    region("GetLongArrayRegion", array, start, length, buf, true);
  }

  @Override
  public void getFloatArrayRegion(long array, int start, int length, float[] buf) {
    region("GetFloatArrayRegion", array, start, length, buf, true);
  }

  @Override
  public void getDoubleArrayRegion(long array, int start, int length, double[] buf) {
    region("GetDoubleArrayRegion", array, start, length, buf, true);
  }

  @Override
  public void setBooleanArrayRegion(long array, int start, int length, boolean[] buf) {
    region("SetBooleanArrayRegion", array, start, length, buf, false);
  }

  @Override
  public void setByteArrayRegion(long array, int start, int length, byte[] buf) {
    region("SetByteArrayRegion", array, start, length, buf, false);
  }

  @Override
  public void setCharArrayRegion(long array, int start, int length, char[] buf) {
    region("SetCharArrayRegion", array, start, length, buf, false);
  }

  @Override
  public void setShortArrayRegion(long array, int start, int length, short[] buf) {
    region("SetShortArrayRegion", array, start, length, buf, false);
  }

  @Override
  public void setIntArrayRegion(long array, int start, int length, int[] buf) {
    region("SetIntArrayRegion", array, start, length, buf, false);
  }

  @Override
  public void setLongArrayRegion(long array, int start, int length, long[] buf) {
    region("SetLongArrayRegion", array, start, length, buf, false);
  }

  @Override
  public void setFloatArrayRegion(long array, int start, int length, float[] buf) {
    region("SetFloatArrayRegion", array, start, length, buf, false);
  }

  @Override
  public void setDoubleArrayRegion(long array, int start, int length, double[] buf) {
    region("SetDoubleArrayRegion", array, start, length, buf, false);
  }

  @Override
  public long newObjectArray(int length, long elementClass, long initialElement) {
    check("NewObjectArray");
    Class<?> type = resolve(elementClass, Class.class);
    Object init = resolveOrNull(initialElement);
    try {
      Object[] array = (Object[]) Array.newInstance(type, length);
      if (init != null) {
        java.util.Arrays.fill(array, init);
      }
      return newLocal(array);
    } catch (NegativeArraySizeException | OutOfMemoryError | ArrayStoreException e) {
      pending = e;
      return 0;
    }
  }

  @Override
  public long getObjectArrayElement(long array, int index) {
    check("GetObjectArrayElement");
    Object[] a = resolve(array, Object[].class);
    if (index < 0 || index >= a.length) {
      pending = new ArrayIndexOutOfBoundsException(index);
      return 0;
    }
    return newLocal(a[index]);
  }

  @Override
  public void setObjectArrayElement(long array, int index, long value) {
    check("SetObjectArrayElement");
    Object[] a = resolve(array, Object[].class);
    try {
      a[index] = resolveOrNull(value);
    } catch (ArrayIndexOutOfBoundsException | ArrayStoreException e) {
      pending = e;
    }
  }

  // ========== NATIVES ==========

  @Override
  public int registerNatives(long clazz, String name, String sig, NativeMethod method) {
    check("RegisterNatives");
    Class<?> owner = resolve(clazz, Class.class);
    if (ReflectionCache.findMethod(owner, name, sig, true) == null
        && ReflectionCache.findMethod(owner, name, sig, false) == null) {
      pending = new NoSuchMethodError(owner.getName() + "." + name + sig);
      return Jni.JNI_ERR;
    }
    NativeBinding.register(vm, owner, name, sig, method);
    LOG.fine("Registered native " + owner.getName() + "." + name + sig);
    return Jni.JNI_OK;
  }

  @Override
  public String toString() {
    return "InProcessEnv[" + owner.getName() + ", vm=" + vm.id() + "]";
  }
}
