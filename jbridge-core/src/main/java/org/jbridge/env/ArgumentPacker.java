package org.jbridge.env;

import java.util.List;
import org.jbridge.BridgeTypeException;
import org.jbridge.BridgeUsageException;
import org.jbridge.vm.JValue;

/**
 * Converts host arguments into argument slots according to a method descriptor.
 *
 * <p>Primitive parameters accept any {@link Number}, {@link Boolean} or {@link Character} and
 * narrow it the way a Java cast does. Object parameters accept a {@link JObject}, a {@link
 * JObjectHolder}, null, or whatever the {@link ArgumentBoxer} can convert.
 */
final class ArgumentPacker {
  private final BridgeEnv env;
  private final ArgumentBoxer boxer;

  ArgumentPacker(BridgeEnv env, ArgumentBoxer boxer) {
    this.env = env;
    this.boxer = boxer;
  }

  PackedArguments pack(MethodSignature sig, Object[] args) {
    List<String> parameters = sig.parameters();
    int n = args == null ? 0 : args.length;
    if (n > parameters.size()) {
      throw new BridgeUsageException(
          "# of arguments ("
              + n
              + ") in call did not match signature ("
              + sig.parameterDescriptor()
              + ")");
    }
    if (n < parameters.size()) {
      throw new BridgeUsageException(
          "Too few arguments (" + n + ") for signature (" + sig.parameterDescriptor() + ")");
    }
    PackedArguments packed = new PackedArguments(n);
    try {
      for (int i = 0; i < n; i++) {
        packed.set(i, toValue(parameters.get(i), args[i], packed));
      }
    } catch (RuntimeException e) {
      packed.close();
      throw e;
    }
    return packed;
  }

  JValue toValue(String type, Object value, PackedArguments temporaries) {
    switch (type.charAt(0)) {
      case 'Z':
        return JValue.z(toBoolean(value));
      case 'B':
        return JValue.b((byte) toLong(value, type));
      case 'C':
        return JValue.c(toChar(value));
      case 'S':
        return JValue.s((short) toLong(value, type));
      case 'I':
        return JValue.i((int) toLong(value, type));
      case 'J':
        return JValue.j(toLong(value, type));
      case 'F':
        return JValue.f((float) toDouble(value, type));
      case 'D':
        return JValue.d(toDouble(value, type));
      default:
        return JValue.l(toReference(type, value, temporaries));
    }
  }

  private long toReference(String type, Object value, PackedArguments temporaries) {
    if (value == null) return 0;
    if (value instanceof JObject o) return o.handle();
    if (value instanceof JObjectHolder h) return JObject.handleOf(h.toJObject());
    JObject boxed = boxer.box(env, value, type);
    if (boxed == null) {
      throw new BridgeUsageException(value + " is not a Java object");
    }
    temporaries.keep(boxed);
    return boxed.handle();
  }

  private static boolean toBoolean(Object value) {
    if (value instanceof Boolean b) return b;
    if (value instanceof Number n) return n.doubleValue() != 0;
    throw cannotConvert(value, "Z");
  }

  private static long toLong(Object value, String type) {
    if (value instanceof Number n) return n.longValue();
    if (value instanceof Boolean b) return b ? 1 : 0;
    if (value instanceof Character c) return c;
    throw cannotConvert(value, type);
  }

  private static double toDouble(Object value, String type) {
    if (value instanceof Number n) return n.doubleValue();
    if (value instanceof Boolean b) return b ? 1 : 0;
    if (value instanceof Character c) return c;
    throw cannotConvert(value, type);
  }

  private static char toChar(Object value) {
    if (value instanceof Character c) return c;
    if (value instanceof CharSequence s && s.length() == 1) return s.charAt(0);
    if (value instanceof Number n) return (char) n.intValue();
    throw cannotConvert(value, "C");
  }

  private static BridgeTypeException cannotConvert(Object value, String type) {
    String from = value == null ? "null" : value.getClass().getName();
    return new BridgeTypeException("Cannot convert " + from + " to " + type);
  }
}
