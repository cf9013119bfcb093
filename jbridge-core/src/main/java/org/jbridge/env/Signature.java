package org.jbridge.env;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jbridge.BridgeUsageException;

/** Type descriptors as the native interface writes them, and conversions between class names. */
public final class Signature {
  /** One type: a primitive code or an object type, behind any number of array dimensions. */
  public static final Pattern TYPE = Pattern.compile("\\[*(?:[ZBCSIJFD]|L[^;]+;)");

  private static final Map<String, String> PRIMITIVES =
      Map.of(
          "boolean", "Z",
          "byte", "B",
          "char", "C",
          "short", "S",
          "int", "I",
          "long", "J",
          "float", "F",
          "double", "D",
          "void", "V");

  private Signature() {} // Prevent instantiation

  /**
   * Split a run of type descriptors, such as the inside of a method descriptor's parentheses.
   *
   * @throws BridgeUsageException when the text is not a sequence of types
   */
  public static List<String> split(String types) {
    List<String> out = new ArrayList<>();
    Matcher m = TYPE.matcher(types);
    int pos = 0;
    while (pos < types.length()) {
      if (!m.find(pos) || m.start() != pos) {
        throw new BridgeUsageException("Bad function signature");
      }
      out.add(m.group());
      pos = m.end();
    }
    return out;
  }

  /** True for a single well-formed type descriptor. */
  public static boolean isType(String sig) {
    return sig != null && TYPE.matcher(sig).matches();
  }

  public static boolean isPrimitive(String sig) {
    return sig.length() == 1 && "ZBCSIJFD".indexOf(sig.charAt(0)) >= 0;
  }

  /** True for object and array types. */
  public static boolean isReference(String sig) {
    return sig.startsWith("L") || sig.startsWith("[");
  }

  public static String toSlashed(String name) {
    return name.replace('.', '/');
  }

  public static String toDotted(String name) {
    return name.replace('/', '.');
  }

  /**
   * The descriptor of a class given by name: {@code int} becomes {@code I}, {@code
   * java.lang.String} becomes {@code Ljava/lang/String;}, array names such as {@code [I} are
   * already descriptors.
   */
  public static String forClassName(String name) {
    String primitive = PRIMITIVES.get(name);
    if (primitive != null) return primitive;
    if (name.startsWith("[")) return toSlashed(name);
    return "L" + toSlashed(name) + ";";
  }

  /** The class name {@code FindClass} expects for a type descriptor. */
  public static String toClassName(String sig) {
    if (sig.startsWith("L") && sig.endsWith(";")) {
      return sig.substring(1, sig.length() - 1);
    }
    return sig;
  }

  /** The element type of an array descriptor. */
  public static String componentType(String sig) {
    if (!sig.startsWith("[")) {
      throw new BridgeUsageException(sig + " is not an array type");
    }
    return sig.substring(1);
  }
}
