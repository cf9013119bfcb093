package org.jbridge.util;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.arrow.vector.ValueVector;
import org.jbridge.BridgeLimits;
import org.jbridge.BridgeTypeException;
import org.jbridge.arrow.ArrowArrays;
import org.jbridge.env.ArgumentBoxer;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JClass;
import org.jbridge.env.JMethodId;
import org.jbridge.env.JObject;
import org.jbridge.env.JObjectHolder;
import org.jbridge.env.Signature;

/**
 * Best-effort conversion between plain host values and VM objects.
 *
 * <p>{@link #getNiceArg} turns strings, boxed scalars, primitive arrays, Arrow vectors and
 * iterables into VM objects when the parameter type asks for an object. {@link #getNiceResult}
 * goes the other way for strings, wrappers and primitive arrays. Anything it does not recognize is
 * passed through unchanged.
 */
public final class NiceValues {

  /** Wrapper class, by descriptor, to the primitive it wraps. */
  private static final Map<String, String> WRAPPERS =
      Map.of(
          "Ljava/lang/Boolean;", "Z",
          "Ljava/lang/Byte;", "B",
          "Ljava/lang/Character;", "C",
          "Ljava/lang/Short;", "S",
          "Ljava/lang/Integer;", "I",
          "Ljava/lang/Long;", "J",
          "Ljava/lang/Float;", "F",
          "Ljava/lang/Double;", "D");

  private static final Map<String, String> UNBOXERS =
      Map.of(
          "Z", "booleanValue",
          "B", "byteValue",
          "C", "charValue",
          "S", "shortValue",
          "I", "intValue",
          "J", "longValue",
          "F", "floatValue",
          "D", "doubleValue");

  private static final Map<String, Class<?>> PRIMITIVE_CLASSES =
      Map.of(
          "boolean", boolean.class,
          "byte", byte.class,
          "char", char.class,
          "short", short.class,
          "int", int.class,
          "long", long.class,
          "float", float.class,
          "double", double.class,
          "void", void.class);

  /** The boxer the bridge installs so that plain values can be passed to any call. */
  public static final ArgumentBoxer BOXER =
      (env, value, type) -> {
        Object nice = getNiceArg(env, value, type);
        return nice instanceof JObject o && nice != value ? o : null;
      };

  private NiceValues() {} // Prevent instantiation

  // ========== ARGUMENTS ==========

  /**
   * Convert {@code arg} for a parameter of type {@code sig}. Returns a new owned {@link JObject}
   * when a conversion was made, which the caller releases, and {@code arg} itself otherwise.
   */
  public static Object getNiceArg(BridgeEnv env, Object arg, String sig) {
    if (arg == null
        || arg instanceof JObject
        || arg instanceof JObjectHolder
        || Signature.isPrimitive(sig)) {
      return arg;
    }

    // --- 1. SCALARS INTO WRAPPERS ---
    String wrapped = WRAPPERS.get(sig);
    if (wrapped != null && isScalar(arg)) {
      return box(env, arg, wrapped);
    }
    if (isObjectLike(sig)) {
      String primitive = primitiveFor(arg);
      if (primitive != null) {
        return box(env, arg, primitive);
      }
    }

    // --- 2. STRINGS ---
    if (arg instanceof CharSequence s
        && (sig.equals("Ljava/lang/String;")
            || sig.equals("Ljava/lang/CharSequence;")
            || isObjectLike(sig))) {
      return env.newStringUtf(s.toString());
    }

    // --- 3. ARRAYS ---
    if (sig.startsWith("[")) {
      Object array = toArray(env, arg, sig);
      if (array != null) return array;
    }

    // --- 4. LAST RESORT: A CONSTRUCTOR ---
    if (sig.startsWith("L")) {
      String className = Signature.toClassName(sig);
      if (arg instanceof Number || arg instanceof Boolean) {
        return construct(env, className, "(I)V", toInt(arg), arg);
      }
      if (arg instanceof CharSequence s) {
        return construct(env, className, "(Ljava/lang/String;)V", s.toString(), arg);
      }
    }
    return arg;
  }

  private static Object toArray(BridgeEnv env, Object arg, String sig) {
    if (BridgeLimits.ARROW_ENABLED && arg instanceof ValueVector vector) {
      return ArrowArrays.toJavaArray(env, vector, sig);
    }
    switch (sig) {
      case "[Z":
        if (arg instanceof boolean[] a) return env.makeBooleanArray(a);
        break;
      case "[B":
        if (arg instanceof byte[] a) return env.makeByteArray(a);
        break;
      case "[C":
        if (arg instanceof char[] a) return env.makeCharArray(a);
        if (arg instanceof CharSequence s) return env.makeCharArray(s.toString().toCharArray());
        break;
      case "[S":
        if (arg instanceof short[] a) return env.makeShortArray(a);
        break;
      case "[I":
        if (arg instanceof int[] a) return env.makeIntArray(a);
        break;
      case "[J":
        if (arg instanceof long[] a) return env.makeLongArray(a);
        break;
      case "[F":
        if (arg instanceof float[] a) return env.makeFloatArray(a);
        break;
      case "[D":
        if (arg instanceof double[] a) return env.makeDoubleArray(a);
        break;
      default:
        break;
    }
    List<Object> elements = elementsOf(arg);
    if (elements == null) return null;
    String component = Signature.componentType(sig);
    if (Signature.isPrimitive(component)) {
      return makePrimitiveArray(env, elements, component);
    }
    return makeObjectArray(env, elements, component);
  }

  /** The elements of an iterable or a host object array, or null for anything else. */
  static List<Object> elementsOf(Object arg) {
    List<Object> out = new ArrayList<>();
    if (arg instanceof Iterable<?> it) {
      for (Object o : it) out.add(o);
      return out;
    }
    if (arg.getClass().isArray()) {
      int n = Array.getLength(arg);
      for (int i = 0; i < n; i++) out.add(Array.get(arg, i));
      return out;
    }
    return null;
  }

  private static JObject makeObjectArray(BridgeEnv env, List<Object> elements, String component) {
    JObject array;
    try (JClass elementClass = env.findClass(Signature.toClassName(component))) {
      array = env.makeObjectArray(elements.size(), elementClass);
    }
    for (int i = 0; i < elements.size(); i++) {
      Object element = elements.get(i);
      Object nice = getNiceArg(env, element, component);
      try {
        env.setObjectArrayElement(array, i, nice);
      } finally {
        if (nice != element && nice instanceof JObject o) o.close();
      }
    }
    return array;
  }

  private static JObject makePrimitiveArray(BridgeEnv env, List<Object> elements, String code) {
    int n = elements.size();
    try {
      switch (code.charAt(0)) {
        case 'Z': {
          boolean[] a = new boolean[n];
          for (int i = 0; i < n; i++) a[i] = (Boolean) elements.get(i);
          return env.makeBooleanArray(a);
        }
        case 'B': {
          byte[] a = new byte[n];
          for (int i = 0; i < n; i++) a[i] = ((Number) elements.get(i)).byteValue();
          return env.makeByteArray(a);
        }
        case 'C': {
          char[] a = new char[n];
          for (int i = 0; i < n; i++) a[i] = (Character) elements.get(i);
          return env.makeCharArray(a);
        }
        case 'S': {
          short[] a = new short[n];
          for (int i = 0; i < n; i++) a[i] = ((Number) elements.get(i)).shortValue();
          return env.makeShortArray(a);
        }
        case 'I': {
          int[] a = new int[n];
          for (int i = 0; i < n; i++) a[i] = ((Number) elements.get(i)).intValue();
          return env.makeIntArray(a);
        }
        case 'J': {
          long[] a = new long[n];
          for (int i = 0; i < n; i++) a[i] = ((Number) elements.get(i)).longValue();
          return env.makeLongArray(a);
        }
        case 'F': {
          float[] a = new float[n];
          for (int i = 0; i < n; i++) a[i] = ((Number) elements.get(i)).floatValue();
          return env.makeFloatArray(a);
        }
        default: {
          double[] a = new double[n];
          for (int i = 0; i < n; i++) a[i] = ((Number) elements.get(i)).doubleValue();
          return env.makeDoubleArray(a);
        }
      }
    } catch (ClassCastException | NullPointerException e) {
      throw new BridgeTypeException("Cannot convert elements of " + elements + " to [" + code);
    }
  }

  private static Object construct(
      BridgeEnv env, String className, String sig, Object value, Object original) {
    try (JClass clazz = env.findClass(className)) {
      JMethodId ctor = env.getMethodId(clazz, "<init>", sig);
      if (ctor == null) return original;
      return env.newObject(clazz, ctor, value);
    }
  }

  /**
   * Box a host scalar as the wrapper of {@code primitive} ({@code I}, {@code Z}, ...) through its
   * {@code valueOf}.
   */
  public static JObject box(BridgeEnv env, Object value, String primitive) {
    String wrapper = wrapperOf(primitive);
    String sig = "(" + primitive + ")L" + wrapper + ";";
    try (JClass clazz = env.findClass(wrapper)) {
      JMethodId valueOf = env.getStaticMethodId(clazz, "valueOf", sig);
      return (JObject) env.callStaticMethod(clazz, valueOf, value);
    }
  }

  /** Box as the wrapper of a primitive class such as {@code int.class}. */
  public static JObject box(BridgeEnv env, Object value, Class<?> primitiveClass) {
    if (!primitiveClass.isPrimitive() || primitiveClass == void.class) {
      throw new BridgeTypeException(primitiveClass.getName() + " is not a primitive type");
    }
    return box(env, value, Signature.forClassName(primitiveClass.getName()));
  }

  private static String wrapperOf(String primitive) {
    for (Map.Entry<String, String> e : WRAPPERS.entrySet()) {
      if (e.getValue().equals(primitive)) {
        return Signature.toClassName(e.getKey());
      }
    }
    throw new BridgeTypeException(primitive + " is not a primitive type");
  }

  private static boolean isScalar(Object arg) {
    return arg instanceof Number || arg instanceof Boolean || arg instanceof Character;
  }

  private static boolean isObjectLike(String sig) {
    return sig.equals("Ljava/lang/Object;")
        || sig.equals("Ljava/io/Serializable;")
        || sig.equals("Ljava/lang/Comparable;");
  }

  /** The primitive code of a boxed host scalar; narrower integers box as themselves. */
  private static String primitiveFor(Object arg) {
    if (arg instanceof Boolean) return "Z";
    if (arg instanceof Character) return "C";
    if (arg instanceof Byte) return "B";
    if (arg instanceof Short) return "S";
    if (arg instanceof Integer) return "I";
    if (arg instanceof Long) return "J";
    if (arg instanceof Float) return "F";
    if (arg instanceof Double) return "D";
    return null;
  }

  private static int toInt(Object arg) {
    if (arg instanceof Boolean b) return b ? 1 : 0;
    return ((Number) arg).intValue();
  }

  // ========== RESULTS ==========

  /**
   * Convert a call result declared as {@code sig} into a host value where there is a natural one.
   * The converted handle is released.
   */
  public static Object getNiceResult(BridgeEnv env, Object result, String sig) {
    if (!(result instanceof JObject obj)) {
      return result;
    }
    switch (sig) {
      case "Ljava/lang/String;":
        try (obj) {
          return env.getStringUtf(obj);
        }
      case "Ljava/lang/CharSequence;":
        try (obj) {
          return stringOf(env, obj);
        }
      case "[Z":
        try (obj) {
          return env.getBooleanArrayElements(obj);
        }
      case "[B":
        try (obj) {
          return env.getByteArrayElements(obj);
        }
      case "[C":
        try (obj) {
          return env.getCharArrayElements(obj);
        }
      case "[S":
        try (obj) {
          return env.getShortArrayElements(obj);
        }
      case "[I":
        try (obj) {
          return env.getIntArrayElements(obj);
        }
      case "[J":
        try (obj) {
          return env.getLongArrayElements(obj);
        }
      case "[F":
        try (obj) {
          return env.getFloatArrayElements(obj);
        }
      case "[D":
        try (obj) {
          return env.getDoubleArrayElements(obj);
        }
      case "Ljava/lang/Class;":
        return primitiveClassOrSelf(env, obj);
      default:
        break;
    }
    String primitive = WRAPPERS.get(sig);
    if (primitive == null && isObjectLike(sig)) {
      String runtime;
      try (JClass clazz = env.getObjectClass(obj)) {
        runtime = clazz.signature();
      }
      if (runtime.equals("Ljava/lang/String;")) {
        try (obj) {
          return env.getStringUtf(obj);
        }
      }
      primitive = WRAPPERS.get(runtime);
    }
    if (primitive != null) {
      try (obj) {
        return unbox(env, obj, primitive);
      }
    }
    return obj;
  }

  private static String stringOf(BridgeEnv env, JObject obj) {
    try (JClass clazz = env.findClass("java/lang/Object")) {
      JMethodId toString = env.getMethodId(clazz, "toString", "()Ljava/lang/String;");
      try (JObject str = (JObject) env.callMethod(obj, toString)) {
        return env.getStringUtf(str);
      }
    }
  }

  private static Object unbox(BridgeEnv env, JObject obj, String primitive) {
    String method = UNBOXERS.get(primitive);
    try (JClass clazz = env.findClass(wrapperOf(primitive))) {
      JMethodId id = env.getMethodId(clazz, method, "()" + primitive);
      return env.callMethod(obj, id);
    }
  }

  /** {@code int.class} and friends come back as host primitive classes. */
  private static Object primitiveClassOrSelf(BridgeEnv env, JObject classObject) {
    JClass clazz = env.asClass(classObject);
    Class<?> primitive = PRIMITIVE_CLASSES.get(clazz.name());
    if (primitive == null) {
      return clazz;
    }
    clazz.close();
    if (clazz != classObject) classObject.close();
    return primitive;
  }
}
