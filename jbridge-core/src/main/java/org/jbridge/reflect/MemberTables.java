package org.jbridge.reflect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.jbridge.BridgeLimits;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JClass;
import org.jbridge.env.JMethodId;
import org.jbridge.env.JObject;
import org.jbridge.env.Signature;
import org.jbridge.util.BoundedCache;

/**
 * Public members of VM classes, discovered once per class through {@code java.lang.reflect} and
 * kept in an LRU cache keyed by class name.
 *
 * <p>Methods are listed in the order {@code Class.getMethods()} returns them. {@link
 * OverloadResolver} keeps that order within the fixed-arity and the varargs candidates, which only
 * decides between overloads that both fit the same arguments.
 */
public final class MemberTables {
  private static final Logger LOG = Logger.getLogger(MemberTables.class.getName());

  /** The members of one class. Immutable. */
  public record Table(
      String className,
      Map<String, List<OverloadDescriptor>> methods,
      Map<String, List<OverloadDescriptor>> staticMethods,
      List<OverloadDescriptor> constructors,
      Map<String, String> fields,
      Map<String, String> staticFields) {

    /** Instance overloads of {@code name}, empty when there are none. */
    public List<OverloadDescriptor> methods(String name) {
      return methods.getOrDefault(name, List.of());
    }

    public List<OverloadDescriptor> staticMethods(String name) {
      return staticMethods.getOrDefault(name, List.of());
    }
  }

  private final BoundedCache<String, Table> tables;

  public MemberTables() {
    this(BridgeLimits.MEMBER_CACHE_SIZE);
  }

  MemberTables(int maxSize) {
    this.tables =
        new BoundedCache<>(
            maxSize, (name, table) -> LOG.fine("Evicted member table for " + name));
  }

  /** The table of {@code clazz}, built on first use. */
  public Table forClass(BridgeEnv env, JClass clazz) {
    Table cached = tables.get(clazz.name());
    if (cached != null) return cached;
    Table table = build(env, clazz);
    tables.put(clazz.name(), table);
    return table;
  }

  public int size() {
    return tables.size();
  }

  /** Cache statistics, see {@link BoundedCache#getStats()}. */
  public String getStats() {
    return tables.getStats();
  }

  public void clear() {
    tables.clear();
  }

  // ========== DISCOVERY ==========

  private static Table build(BridgeEnv env, JClass clazz) {
    long start = System.nanoTime();
    Reflector r = new Reflector(env);
    int staticFlag = r.staticModifier();

    // --- 1. METHODS ---
    Map<String, List<OverloadDescriptor>> methods = new LinkedHashMap<>();
    Map<String, List<OverloadDescriptor>> staticMethods = new LinkedHashMap<>();
    for (JObject m : r.members(clazz, "getMethods", "()[Ljava/lang/reflect/Method;")) {
      try (m) {
        boolean isStatic = (r.modifiers(m) & staticFlag) != 0;
        OverloadDescriptor d =
            new OverloadDescriptor(
                r.name(m), r.parameterTypes(m), r.returnType(m), r.isVarArgs(m), isStatic);
        (isStatic ? staticMethods : methods).computeIfAbsent(d.name(), k -> new ArrayList<>()).add(d);
      }
    }

    // --- 2. CONSTRUCTORS ---
    List<OverloadDescriptor> constructors = new ArrayList<>();
    for (JObject c :
        r.members(clazz, "getConstructors", "()[Ljava/lang/reflect/Constructor;")) {
      try (c) {
        constructors.add(
            new OverloadDescriptor("<init>", r.parameterTypes(c), "V", r.isVarArgs(c), false));
      }
    }

    // --- 3. FIELDS ---
    Map<String, String> fields = new LinkedHashMap<>();
    Map<String, String> staticFields = new LinkedHashMap<>();
    for (JObject f : r.members(clazz, "getFields", "()[Ljava/lang/reflect/Field;")) {
      try (f) {
        boolean isStatic = (r.modifiers(f) & staticFlag) != 0;
        (isStatic ? staticFields : fields).put(r.name(f), r.fieldType(f));
      }
    }

    Table table =
        new Table(
            clazz.name(),
            freeze(methods),
            freeze(staticMethods),
            List.copyOf(constructors),
            Collections.unmodifiableMap(fields),
            Collections.unmodifiableMap(staticFields));
    LOG.fine(
        "Built member table for "
            + clazz.name()
            + ": "
            + methods.size()
            + " methods, "
            + staticMethods.size()
            + " static methods, "
            + fields.size()
            + " fields in "
            + (System.nanoTime() - start) / 1000
            + "us");
    return table;
  }

  private static Map<String, List<OverloadDescriptor>> freeze(
      Map<String, List<OverloadDescriptor>> map) {
    Map<String, List<OverloadDescriptor>> out = new LinkedHashMap<>();
    map.forEach((k, v) -> out.put(k, List.copyOf(v)));
    return Collections.unmodifiableMap(out);
  }

  /** Reflection calls with their method IDs looked up once per table. */
  private static final class Reflector {
    private final BridgeEnv env;
    private final JMethodId getName;
    private final JMethodId getModifiers;
    private final JMethodId getParameterTypes;
    private final JMethodId isVarArgs;
    private final JMethodId getReturnType;
    private final JMethodId getType;
    private final JMethodId className;

    Reflector(BridgeEnv env) {
      this.env = env;
      try (JClass member = env.findClass("java/lang/reflect/Member");
          JClass executable = env.findClass("java/lang/reflect/Executable");
          JClass method = env.findClass("java/lang/reflect/Method");
          JClass field = env.findClass("java/lang/reflect/Field");
          JClass clazz = env.findClass("java/lang/Class")) {
        getName = env.getMethodId(member, "getName", "()Ljava/lang/String;");
        getModifiers = env.getMethodId(member, "getModifiers", "()I");
        getParameterTypes = env.getMethodId(executable, "getParameterTypes", "()[Ljava/lang/Class;");
        isVarArgs = env.getMethodId(executable, "isVarArgs", "()Z");
        getReturnType = env.getMethodId(method, "getReturnType", "()Ljava/lang/Class;");
        getType = env.getMethodId(field, "getType", "()Ljava/lang/Class;");
        className = env.getMethodId(clazz, "getName", "()Ljava/lang/String;");
      }
    }

    int staticModifier() {
      try (JClass modifier = env.findClass("java/lang/reflect/Modifier")) {
        return (Integer) env.getStaticField(modifier, env.getStaticFieldId(modifier, "STATIC", "I"));
      }
    }

    JObject[] members(JClass clazz, String accessor, String sig) {
      try (JClass classClass = env.findClass("java/lang/Class")) {
        JMethodId id = env.getMethodId(classClass, accessor, sig);
        try (JObject array = (JObject) env.callMethod(clazz, id)) {
          return env.getObjectArrayElements(array);
        }
      }
    }

    String name(JObject member) {
      return string(env.callMethod(member, getName));
    }

    int modifiers(JObject member) {
      return (Integer) env.callMethod(member, getModifiers);
    }

    boolean isVarArgs(JObject executable) {
      return (Boolean) env.callMethod(executable, isVarArgs);
    }

    List<String> parameterTypes(JObject executable) {
      List<String> types = new ArrayList<>();
      try (JObject array = (JObject) env.callMethod(executable, getParameterTypes)) {
        for (JObject type : env.getObjectArrayElements(array)) {
          try (type) {
            types.add(descriptor(type));
          }
        }
      }
      return List.copyOf(types);
    }

    String returnType(JObject method) {
      try (JObject type = (JObject) env.callMethod(method, getReturnType)) {
        return descriptor(type);
      }
    }

    String fieldType(JObject field) {
      try (JObject type = (JObject) env.callMethod(field, getType)) {
        return descriptor(type);
      }
    }

    private String descriptor(JObject classObject) {
      return Signature.forClassName(string(env.callMethod(classObject, className)));
    }

    private String string(Object str) {
      try (JObject s = (JObject) str) {
        return env.getStringUtf(s);
      }
    }
  }
}
