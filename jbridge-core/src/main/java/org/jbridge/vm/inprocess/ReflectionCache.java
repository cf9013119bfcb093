package org.jbridge.vm.inprocess;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.jbridge.BridgeLimits;
import org.jbridge.util.BoundedCache;

/**
 * Member lookups behind {@code GetMethodID} and {@code GetFieldID}.
 *
 * <p>Members are keyed by name and type descriptor, the way the native interface names them.
 * Lookups see public members first, then declared members of the class and its superclasses of
 * any access. A public method declared by an inaccessible class (a private iterator class, say) is
 * replaced by the same method of a public supertype so that invocation dispatches virtually
 * without needing deep reflection.
 */
final class ReflectionCache {
  private static final Logger LOG = Logger.getLogger(ReflectionCache.class.getName());

  // --- METHOD INDEX ---
  // Key: class -> (name + descriptor) -> Method
  private static final BoundedCache<Class<?>, Map<String, Method>> methodIndex =
      new BoundedCache<>(BridgeLimits.MEMBER_CACHE_SIZE);

  // --- FIELD INDEX ---
  // Key: class -> (name + ":" + descriptor) -> Field
  private static final BoundedCache<Class<?>, Map<String, Field>> fieldIndex =
      new BoundedCache<>(BridgeLimits.MEMBER_CACHE_SIZE);

  private ReflectionCache() {} // Prevent instantiation

  // ========== DESCRIPTORS ==========

  /** The method descriptor of a method or constructor, e.g. {@code (ILjava/lang/String;)V}. */
  static String descriptor(Executable executable) {
    StringBuilder sb = new StringBuilder("(");
    for (Class<?> p : executable.getParameterTypes()) {
      sb.append(p.descriptorString());
    }
    sb.append(')');
    if (executable instanceof Method m) {
      sb.append(m.getReturnType().descriptorString());
    } else {
      sb.append('V');
    }
    return sb.toString();
  }

  // ========== METHODS ==========

  /**
   * Find a method or constructor ({@code <init>}) by descriptor.
   *
   * @return the member, or null when absent or of the other static-ness
   */
  static Executable findMethod(Class<?> clazz, String name, String sig, boolean isStatic) {
    if ("<init>".equals(name)) {
      if (isStatic) return null;
      for (Constructor<?> ctor : clazz.getDeclaredConstructors()) {
        if (descriptor(ctor).equals(sig)) {
          if (!Modifier.isPublic(ctor.getModifiers()) || !isAccessibleClass(clazz)) {
            ctor.trySetAccessible();
          }
          return ctor;
        }
      }
      return null;
    }
    Method m = methodIndex.computeIfAbsent(clazz, ReflectionCache::buildMethodIndex).get(name + sig);
    if (m == null || Modifier.isStatic(m.getModifiers()) != isStatic) {
      return null;
    }
    return m;
  }

  private static Map<String, Method> buildMethodIndex(Class<?> clazz) {
    Map<String, Method> index = new LinkedHashMap<>();
    for (Method m : clazz.getMethods()) {
      index.putIfAbsent(m.getName() + descriptor(m), accessibleMethod(m));
    }
    for (Class<?> c = clazz; c != null; c = c.getSuperclass()) {
      for (Method m : c.getDeclaredMethods()) {
        String key = m.getName() + descriptor(m);
        if (!index.containsKey(key)) {
          m.trySetAccessible();
          index.put(key, m);
        }
      }
    }
    LOG.finer("Indexed " + index.size() + " methods of " + clazz.getName());
    return Collections.unmodifiableMap(index);
  }

  /**
   * The same method as declared by a public supertype when its own declaring class cannot be
   * accessed, or the method itself when no such supertype exists.
   */
  static Method accessibleMethod(Method m) {
    if (isAccessibleClass(m.getDeclaringClass())) {
      return m;
    }
    Deque<Class<?>> pending = new ArrayDeque<>();
    Set<Class<?>> seen = new HashSet<>();
    pending.add(m.getDeclaringClass());
    while (!pending.isEmpty()) {
      Class<?> c = pending.poll();
      if (!seen.add(c)) continue;
      if (c != m.getDeclaringClass() && isAccessibleClass(c)) {
        try {
          return c.getMethod(m.getName(), m.getParameterTypes());
        } catch (NoSuchMethodException e) {
          // Not declared on this supertype; keep walking
        }
      }
      if (c.getSuperclass() != null) pending.add(c.getSuperclass());
      Collections.addAll(pending, c.getInterfaces());
    }
    m.trySetAccessible();
    return m;
  }

  /** Public, in an exported package, and nested only in public classes. */
  static boolean isAccessibleClass(Class<?> c) {
    for (Class<?> k = c; k != null; k = k.getEnclosingClass()) {
      if (!Modifier.isPublic(k.getModifiers())) return false;
    }
    return c.getModule().isExported(c.getPackageName());
  }

  // ========== FIELDS ==========

  /**
   * Find a field by name and type descriptor, searching superclasses and interface constants.
   *
   * @return the field, or null when absent or of the other static-ness
   */
  static Field findField(Class<?> clazz, String name, String sig, boolean isStatic) {
    Field f = fieldIndex.computeIfAbsent(clazz, ReflectionCache::buildFieldIndex).get(name + ":" + sig);
    if (f == null || Modifier.isStatic(f.getModifiers()) != isStatic) {
      return null;
    }
    return f;
  }

  private static Map<String, Field> buildFieldIndex(Class<?> clazz) {
    Map<String, Field> index = new LinkedHashMap<>();
    for (Class<?> c = clazz; c != null; c = c.getSuperclass()) {
      for (Field f : c.getDeclaredFields()) {
        String key = f.getName() + ":" + f.getType().descriptorString();
        if (!index.containsKey(key)) {
          if (!Modifier.isPublic(f.getModifiers()) || !isAccessibleClass(c)) {
            f.trySetAccessible();
          }
          index.put(key, f);
        }
      }
    }
    for (Field f : clazz.getFields()) {
      index.putIfAbsent(f.getName() + ":" + f.getType().descriptorString(), f);
    }
    return Collections.unmodifiableMap(index);
  }

  /** Cache statistics for diagnostics. */
  static String getStats() {
    return "methods[" + methodIndex.getStats() + "] fields[" + fieldIndex.getStats() + "]";
  }
}
