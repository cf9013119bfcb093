package org.jbridge.reflect;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.jbridge.BridgeTypeException;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JClass;
import org.jbridge.env.JObject;
import org.jbridge.env.JObjectHolder;
import org.jbridge.env.Signature;
import org.jbridge.util.NiceValues;

/**
 * Converts a host value for a parameter of a reflected method, or rejects it.
 *
 * <p>Rules, in order:
 *
 * <ul>
 *   <li>null fits any reference type and no primitive type;
 *   <li>a VM object fits when it is an instance of the target type;
 *   <li>an iterable or host array fits an array type whose component type fits its first element,
 *       and is copied into a new VM array;
 *   <li>booleans, characters, numbers and strings fit primitive, wrapper, {@code String}, {@code
 *       CharSequence} and {@code Object} types of the same kind; an integer fits a {@code byte},
 *       {@code short} or {@code int} type, or its wrapper, only when its value is in range.
 * </ul>
 *
 * Objects created by a cast are added to {@code temporaries}; the caller releases them after the
 * call.
 */
final class Casts {

  private Casts() {} // Prevent instantiation

  static Object cast(BridgeEnv env, Object value, String target, List<JObject> temporaries) {
    if (target.equals("V")) {
      return null;
    }
    if (value instanceof JObjectHolder holder) {
      value = holder.toJObject();
    }
    if (value == null) {
      if (Signature.isPrimitive(target)) {
        throw new BridgeTypeException("Can't cast null to a primitive type");
      }
      return null;
    }
    if (value instanceof JObject obj) {
      return castObject(env, obj, target);
    }
    if (!isScalar(value)) {
      return castSequence(env, value, target, temporaries);
    }
    return castScalar(env, value, target, temporaries);
  }

  // ========== VM OBJECTS ==========

  private static JObject castObject(BridgeEnv env, JObject obj, String target) {
    if (!Signature.isPrimitive(target)) {
      try (JClass targetClass = env.findClass(Signature.toClassName(target))) {
        if (env.isInstanceOf(obj, targetClass)) {
          return obj;
        }
      }
    }
    String actual;
    try (JClass clazz = env.getObjectClass(obj)) {
      actual = clazz.name();
    }
    throw new BridgeTypeException(
        "Object of class " + actual + " cannot be cast to " + Signature.toDotted(target));
  }

  // ========== SEQUENCES ==========

  private static Object castSequence(
      BridgeEnv env, Object value, String target, List<JObject> temporaries) {
    if (!target.startsWith("[")) {
      throw new BridgeTypeException("Argument must not be a sequence");
    }
    String component = Signature.componentType(target);
    Object first = firstElement(value);
    if (first != null) {
      List<JObject> probe = new ArrayList<>();
      try {
        cast(env, first, component, probe);
      } finally {
        probe.forEach(JObject::close);
      }
    }
    return keep(NiceValues.getNiceArg(env, value, target), value, target, temporaries);
  }

  private static Object firstElement(Object value) {
    if (value instanceof Iterable<?> it) {
      Iterator<?> iterator = it.iterator();
      return iterator.hasNext() ? iterator.next() : null;
    }
    if (value.getClass().isArray()) {
      return Array.getLength(value) > 0 ? Array.get(value, 0) : null;
    }
    return null;
  }

  // ========== SCALARS ==========

  private static Object castScalar(
      BridgeEnv env, Object value, String target, List<JObject> temporaries) {
    switch (target) {
      case "Z":
        if (value instanceof Boolean) return value;
        break;
      case "B":
      case "S":
      case "I":
      case "J":
        if (fitsIntegral(value, target)) return value;
        break;
      case "F":
      case "D":
        if (value instanceof Number) return value;
        break;
      case "C":
        if (value instanceof Character) return value;
        if (value instanceof CharSequence s) {
          if (s.length() != 1) {
            throw new BridgeTypeException(
                "Failed to convert string of length " + s.length() + " to char");
          }
          return s.charAt(0);
        }
        break;
      case "Ljava/lang/Boolean;":
        if (value instanceof Boolean) return box(env, value, target, temporaries);
        break;
      case "Ljava/lang/Character;":
        if (value instanceof Character) return box(env, value, target, temporaries);
        break;
      case "Ljava/lang/Byte;":
      case "Ljava/lang/Short;":
      case "Ljava/lang/Integer;":
      case "Ljava/lang/Long;":
        if (fitsIntegral(value, primitiveOf(target))) {
          return box(env, value, target, temporaries);
        }
        break;
      case "Ljava/lang/Float;":
      case "Ljava/lang/Double;":
      case "Ljava/lang/Number;":
        if (value instanceof Number) {
          String as = target.equals("Ljava/lang/Number;") ? "Ljava/lang/Object;" : target;
          return box(env, value, as, temporaries);
        }
        break;
      case "Ljava/lang/String;":
      case "Ljava/lang/CharSequence;":
        if (value instanceof CharSequence) {
          return box(env, value, "Ljava/lang/String;", temporaries);
        }
        break;
      case "Ljava/lang/Object;":
        return box(env, value, target, temporaries);
      default:
        break;
    }
    throw new BridgeTypeException(
        "Failed to convert argument of type "
            + value.getClass().getName()
            + " to "
            + Signature.toDotted(target));
  }

  private static Object box(BridgeEnv env, Object value, String sig, List<JObject> temporaries) {
    return keep(NiceValues.getNiceArg(env, value, sig), value, sig, temporaries);
  }

  private static Object keep(Object converted, Object value, String sig, List<JObject> temporaries) {
    if (converted instanceof JObject o && converted != value) {
      temporaries.add(o);
      return o;
    }
    throw new BridgeTypeException(
        "Failed to convert argument of type "
            + value.getClass().getName()
            + " to "
            + Signature.toDotted(sig));
  }

  private static boolean isScalar(Object value) {
    return value instanceof Number
        || value instanceof Boolean
        || value instanceof Character
        || value instanceof CharSequence;
  }

  private static String primitiveOf(String wrapper) {
    switch (wrapper) {
      case "Ljava/lang/Byte;":
        return "B";
      case "Ljava/lang/Short;":
        return "S";
      case "Ljava/lang/Integer;":
        return "I";
      default:
        return "J";
    }
  }

  /** An integral value fits a narrower primitive only when no bits are lost. */
  private static boolean fitsIntegral(Object value, String primitive) {
    if (!(value instanceof Byte
        || value instanceof Short
        || value instanceof Integer
        || value instanceof Long)) {
      return false;
    }
    long v = ((Number) value).longValue();
    switch (primitive) {
      case "B":
        return v >= Byte.MIN_VALUE && v <= Byte.MAX_VALUE;
      case "S":
        return v >= Short.MIN_VALUE && v <= Short.MAX_VALUE;
      case "I":
        return v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE;
      default:
        return true;
    }
  }
}
