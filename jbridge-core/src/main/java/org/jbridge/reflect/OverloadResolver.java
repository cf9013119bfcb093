package org.jbridge.reflect;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jbridge.BridgeTypeException;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JObject;
import org.jbridge.observability.BridgeEvents;
import org.jbridge.observability.BridgeLogger;

/**
 * First-match overload resolution.
 *
 * <p>All fixed-arity candidates are tried before any varargs one, each group in discovery order. A
 * fixed-arity candidate needs exactly as many parameters as there are arguments. A varargs
 * candidate needs at least all but its last, and the remaining arguments are collected into its
 * trailing array. The first candidate for which every argument survives {@link Casts} wins; there
 * is no ranking among candidates that all fit.
 */
public final class OverloadResolver {

  private OverloadResolver() {} // Prevent instantiation

  /** A chosen overload with its converted arguments. Closing releases the conversions. */
  public static final class Resolution implements AutoCloseable {
    private final OverloadDescriptor overload;
    private final Object[] args;
    private final List<JObject> temporaries;

    Resolution(OverloadDescriptor overload, Object[] args, List<JObject> temporaries) {
      this.overload = overload;
      this.args = args;
      this.temporaries = temporaries;
    }

    public OverloadDescriptor overload() {
      return overload;
    }

    /** Arguments ready to pass with {@link OverloadDescriptor#signature()}. */
    public Object[] args() {
      return args;
    }

    @Override
    public void close() {
      for (JObject t : temporaries) {
        t.close();
      }
      temporaries.clear();
    }
  }

  /**
   * Pick the overload of {@code name} that fits {@code args}.
   *
   * @throws BridgeTypeException when no candidate fits
   */
  public static Resolution resolveMethod(
      BridgeEnv env,
      String className,
      String name,
      List<OverloadDescriptor> candidates,
      Object[] args) {
    Resolution r = resolve(env, className, name, candidates, args);
    if (r == null) {
      throw new BridgeTypeException("No matching method found for " + name);
    }
    return r;
  }

  public static Resolution resolveConstructor(
      BridgeEnv env, String className, List<OverloadDescriptor> candidates, Object[] args) {
    Resolution r = resolve(env, className, "<init>", candidates, args);
    if (r == null) {
      throw new BridgeTypeException("No matching constructor found");
    }
    return r;
  }

  private static Resolution resolve(
      BridgeEnv env,
      String className,
      String name,
      List<OverloadDescriptor> candidates,
      Object[] args) {
    int n = args.length;
    List<OverloadDescriptor> ordered = new ArrayList<>(candidates.size());
    for (OverloadDescriptor c : candidates) {
      if (!c.varArgs()) ordered.add(c);
    }
    for (OverloadDescriptor c : candidates) {
      if (c.varArgs()) ordered.add(c);
    }
    for (OverloadDescriptor candidate : ordered) {
      Object[] grouped = group(candidate, args);
      if (grouped == null) continue;

      List<JObject> temporaries = new ArrayList<>();
      Object[] converted = new Object[grouped.length];
      try {
        for (int i = 0; i < grouped.length; i++) {
          converted[i] = Casts.cast(env, grouped[i], candidate.parameterTypes().get(i), temporaries);
        }
      } catch (BridgeTypeException e) {
        temporaries.forEach(JObject::close);
        continue;
      }

      BridgeLogger.logMethodResolution(
          className, name, candidates.size(), candidate.signature(), n);
      BridgeEvents.emitMethodResolution(className, name, candidates.size(), candidate.signature());
      return new Resolution(candidate, converted, temporaries);
    }
    return null;
  }

  /** The arguments as the candidate's parameters take them, or null when the arity is wrong. */
  private static Object[] group(OverloadDescriptor candidate, Object[] args) {
    int p = candidate.parameterCount();
    if (!candidate.varArgs()) {
      return args.length == p ? args : null;
    }
    int fixed = p - 1;
    if (args.length < fixed) {
      return null;
    }
    Object[] grouped = Arrays.copyOf(args, p);
    grouped[fixed] = Arrays.asList(Arrays.copyOfRange(args, fixed, args.length));
    return grouped;
  }
}
