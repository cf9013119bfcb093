package org.jbridge.util;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.jbridge.BridgeUsageException;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JClass;
import org.jbridge.env.JFieldId;
import org.jbridge.env.JMethodId;
import org.jbridge.env.JObject;
import org.jbridge.env.MethodSignature;
import org.jbridge.env.Signature;

/**
 * Name-and-signature calls on top of {@link BridgeEnv}.
 *
 * <p>Arguments go through {@link NiceValues#getNiceArg} and results through {@link
 * NiceValues#getNiceResult}, so strings and boxed primitives can be passed and come back as host
 * values. Class names may be dotted or slashed.
 */
public final class JavaCalls {

  private JavaCalls() {} // Prevent instantiation

  /** A method bound to its receiver. */
  @FunctionalInterface
  public interface BoundCall {
    Object call(Object... args);
  }

  /** An instance method looked up by class, called with an explicit receiver. */
  @FunctionalInterface
  public interface UnboundCall {
    Object call(JObject receiver, Object... args);
  }

  // ========== METHODS ==========

  public static Object call(BridgeEnv env, JObject obj, String method, String sig, Object... args) {
    return makeCall(env, obj, method, sig).call(args);
  }

  public static Object staticCall(
      BridgeEnv env, String className, String method, String sig, Object... args) {
    return makeStaticCall(env, className, method, sig).call(args);
  }

  /** Look the method up once and return a reusable call on {@code obj}. */
  public static BoundCall makeCall(BridgeEnv env, JObject obj, String method, String sig) {
    if (obj == null) {
      throw new BridgeUsageException("Cannot call " + method + " on null");
    }
    JMethodId id;
    try (JClass clazz = env.getObjectClass(obj)) {
      id = requireMethod(env.getMethodId(clazz, method, sig), method, sig);
    }
    MethodSignature parsed = id.parsedSignature();
    return args -> invoke(env, parsed, args, nice -> env.callMethod(obj, id, nice));
  }

  public static UnboundCall makeCall(BridgeEnv env, String className, String method, String sig) {
    JMethodId id;
    try (JClass clazz = env.findClass(className)) {
      id = requireMethod(env.getMethodId(clazz, method, sig), method, sig);
    }
    MethodSignature parsed = id.parsedSignature();
    return (receiver, args) ->
        invoke(env, parsed, args, nice -> env.callMethod(receiver, id, nice));
  }

  public static BoundCall makeStaticCall(
      BridgeEnv env, String className, String method, String sig) {
    JClass clazz = env.findClass(className);
    JMethodId id = requireMethod(env.getStaticMethodId(clazz, method, sig), method, sig);
    MethodSignature parsed = id.parsedSignature();
    return args -> invoke(env, parsed, args, nice -> env.callStaticMethod(clazz, id, nice));
  }

  private static JMethodId requireMethod(JMethodId id, String method, String sig) {
    if (id == null) {
      throw new BridgeUsageException(
          "Could not find method name = \"" + method + "\" with signature = \"" + sig + "\"");
    }
    return id;
  }

  /** Construct an instance of {@code className} through the constructor with {@code sig}. */
  public static JObject makeInstance(BridgeEnv env, String className, String sig, Object... args) {
    try (JClass clazz = env.findClass(className)) {
      JMethodId ctor = env.getMethodId(clazz, "<init>", sig);
      if (ctor == null) {
        throw new BridgeUsageException("Could not find constructor with signature = \"" + sig + "\"");
      }
      Object[] nice = niceArgs(env, ctor.parsedSignature(), args);
      try {
        return env.newObject(clazz, ctor, nice);
      } finally {
        release(args, nice);
      }
    }
  }

  private static Object invoke(
      BridgeEnv env, MethodSignature sig, Object[] args, Function<Object[], Object> call) {
    Object[] nice = niceArgs(env, sig, args);
    try {
      return NiceValues.getNiceResult(env, call.apply(nice), sig.returnType());
    } finally {
      release(args, nice);
    }
  }

  private static Object[] niceArgs(BridgeEnv env, MethodSignature sig, Object[] args) {
    if (args == null || args.length != sig.arity()) {
      // Let the packer report the mismatch
      return args;
    }
    Object[] out = new Object[args.length];
    try {
      for (int i = 0; i < args.length; i++) {
        out[i] = NiceValues.getNiceArg(env, args[i], sig.parameters().get(i));
      }
    } catch (RuntimeException e) {
      release(args, out);
      throw e;
    }
    return out;
  }

  /** Release the objects made by {@link #niceArgs}. */
  private static void release(Object[] args, Object[] nice) {
    if (nice == args) return;
    for (int i = 0; i < nice.length; i++) {
      if (nice[i] != args[i] && nice[i] instanceof JObject o) {
        o.close();
      }
    }
  }

  // ========== FIELDS ==========

  public static Object getField(BridgeEnv env, JObject obj, String field, String sig) {
    try (JClass clazz = env.getObjectClass(obj)) {
      JFieldId id = env.getFieldId(clazz, field, sig);
      return NiceValues.getNiceResult(env, env.getField(obj, id), sig);
    }
  }

  public static void setField(BridgeEnv env, JObject obj, String field, String sig, Object value) {
    try (JClass clazz = env.getObjectClass(obj)) {
      JFieldId id = env.getFieldId(clazz, field, sig);
      Object[] nice = {NiceValues.getNiceArg(env, value, sig)};
      try {
        env.setField(obj, id, nice[0]);
      } finally {
        release(new Object[] {value}, nice);
      }
    }
  }

  public static Object getStaticField(BridgeEnv env, String className, String field, String sig) {
    try (JClass clazz = env.findClass(className)) {
      JFieldId id = env.getStaticFieldId(clazz, field, sig);
      return NiceValues.getNiceResult(env, env.getStaticField(clazz, id), sig);
    }
  }

  public static void setStaticField(
      BridgeEnv env, String className, String field, String sig, Object value) {
    try (JClass clazz = env.findClass(className)) {
      JFieldId id = env.getStaticFieldId(clazz, field, sig);
      Object[] nice = {NiceValues.getNiceArg(env, value, sig)};
      try {
        env.setStaticField(clazz, id, nice[0]);
      } finally {
        release(new Object[] {value}, nice);
      }
    }
  }

  // ========== CLASSES ==========

  /**
   * Load and initialize a class by dotted or slashed name through the loader {@code FindClass}
   * uses, which sees the VM's class path.
   */
  public static JClass classForName(BridgeEnv env, String className) {
    return env.findClass(Signature.toSlashed(className));
  }

  /** True when {@code obj} is an instance of the class named {@code className}. */
  public static boolean isInstanceOf(BridgeEnv env, Object obj, String className) {
    if (!(obj instanceof JObject o)) {
      return false;
    }
    try (JClass clazz = env.findClass(className)) {
      return env.isInstanceOf(o, clazz);
    }
  }

  public static String toString(BridgeEnv env, JObject obj) {
    if (obj == null) return null;
    return (String) call(env, obj, "toString", "()Ljava/lang/String;");
  }

  /** Names of the modifiers set in {@code flags}, as {@code java.lang.reflect.Modifier} spells them. */
  public static List<String> getModifierFlags(BridgeEnv env, int flags) {
    List<String> names = new ArrayList<>();
    for (String modifier : MODIFIERS) {
      int bit = (Integer) getStaticField(env, "java/lang/reflect/Modifier", modifier, "I");
      if ((bit & flags) != 0) {
        names.add(modifier);
      }
    }
    return names;
  }

  private static final List<String> MODIFIERS =
      List.of(
          "ABSTRACT",
          "FINAL",
          "INTERFACE",
          "NATIVE",
          "PRIVATE",
          "PROTECTED",
          "PUBLIC",
          "STATIC",
          "STRICT",
          "SYNCHRONIZED",
          "TRANSIENT",
          "VOLATILE");
}
