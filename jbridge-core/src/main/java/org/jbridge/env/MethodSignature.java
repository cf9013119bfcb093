package org.jbridge.env;

import java.util.List;
import org.jbridge.BridgeLimits;
import org.jbridge.BridgeUsageException;
import org.jbridge.util.BoundedCache;

/** A parsed method descriptor such as {@code (Ljava/lang/String;I)V}. */
public record MethodSignature(String descriptor, List<String> parameters, String returnType) {

  private static final BoundedCache<String, MethodSignature> PARSED =
      new BoundedCache<>(BridgeLimits.MEMBER_CACHE_SIZE * 8);

  public static MethodSignature parse(String descriptor) {
    MethodSignature cached = PARSED.get(descriptor);
    if (cached != null) return cached;
    MethodSignature parsed = doParse(descriptor);
    PARSED.put(descriptor, parsed);
    return parsed;
  }

  private static MethodSignature doParse(String descriptor) {
    if (descriptor == null || !descriptor.startsWith("(")) {
      throw new BridgeUsageException("Bad function signature");
    }
    int close = descriptor.indexOf(')');
    if (close < 0) {
      throw new BridgeUsageException("Bad function signature");
    }
    List<String> parameters = Signature.split(descriptor.substring(1, close));
    String returnType = descriptor.substring(close + 1);
    if (!returnType.equals("V") && !Signature.isType(returnType)) {
      throw new BridgeUsageException("Bad function signature");
    }
    return new MethodSignature(descriptor, List.copyOf(parameters), returnType);
  }

  public int arity() {
    return parameters.size();
  }

  /** The return type code: one of {@code VZBCSIJFD}, or {@code L} for objects and arrays. */
  public char returnCode() {
    char c = returnType.charAt(0);
    return c == '[' ? 'L' : c;
  }

  /** The parameter list alone, e.g. {@code Ljava/lang/String;I}. */
  public String parameterDescriptor() {
    return descriptor.substring(1, descriptor.indexOf(')'));
  }
}
