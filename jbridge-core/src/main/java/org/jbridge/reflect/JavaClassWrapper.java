package org.jbridge.reflect;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jbridge.NoSuchAttributeException;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JClass;
import org.jbridge.env.JFieldId;
import org.jbridge.env.JMethodId;
import org.jbridge.env.JObject;
import org.jbridge.env.JObjectHolder;
import org.jbridge.util.JavaCalls;
import org.jbridge.util.NiceValues;

/**
 * Late-bound access to a VM class: its constructors, static methods and static fields.
 *
 * <p>Works like {@link JavaWrapper}; asking for an instance field is a missing attribute.
 */
public class JavaClassWrapper implements JObjectHolder, AutoCloseable {
  private final BridgeEnv env;
  private final MemberTables tables;
  private final JClass clazz;
  private final MemberTables.Table table;

  /** @param className dotted or slashed class name */
  public JavaClassWrapper(BridgeEnv env, MemberTables tables, String className) {
    this.env = env;
    this.tables = tables;
    this.clazz = JavaCalls.classForName(env, className);
    this.table = tables.forClass(env, clazz);
  }

  /** Construct an instance with the first public constructor the arguments fit. */
  public JavaWrapper newInstance(Object... args) {
    try (OverloadResolver.Resolution r =
        OverloadResolver.resolveConstructor(env, table.className(), table.constructors(), args)) {
      JMethodId ctor = env.getMethodId(clazz, "<init>", r.overload().signature());
      return new JavaWrapper(env, tables, env.newObject(clazz, ctor, r.args()));
    }
  }

  /** Call the static method {@code name}. */
  public Object invoke(String name, Object... args) {
    List<OverloadDescriptor> candidates = table.staticMethods(name);
    if (candidates.isEmpty()) {
      throw new NoSuchAttributeException(table.className(), name);
    }
    try (OverloadResolver.Resolution r =
        OverloadResolver.resolveMethod(env, table.className(), name, candidates, args)) {
      OverloadDescriptor overload = r.overload();
      JMethodId id = env.getStaticMethodId(clazz, name, overload.signature());
      Object result = env.callStaticMethod(clazz, id, r.args());
      return wrap(NiceValues.getNiceResult(env, result, overload.returnType()));
    }
  }

  public Set<String> methodNames() {
    return table.staticMethods().keySet();
  }

  public Object get(String field) {
    String type = fieldType(field);
    JFieldId id = env.getStaticFieldId(clazz, field, type);
    return wrap(NiceValues.getNiceResult(env, env.getStaticField(clazz, id), type));
  }

  public void set(String field, Object value) {
    String type = fieldType(field);
    JFieldId id = env.getStaticFieldId(clazz, field, type);
    List<JObject> temporaries = new ArrayList<>();
    try {
      env.setStaticField(clazz, id, Casts.cast(env, value, type, temporaries));
    } finally {
      temporaries.forEach(JObject::close);
    }
  }

  public Set<String> fieldNames() {
    return table.staticFields().keySet();
  }

  private String fieldType(String field) {
    String type = table.staticFields().get(field);
    if (type == null) {
      throw new NoSuchAttributeException(table.className(), field);
    }
    return type;
  }

  private Object wrap(Object result) {
    return result instanceof JObject o ? new JavaWrapper(env, tables, o) : result;
  }

  public String className() {
    return table.className();
  }

  @Override
  public JObject toJObject() {
    return clazz;
  }

  @Override
  public void close() {
    clazz.close();
  }

  @Override
  public String toString() {
    return "JavaClassWrapper[" + table.className() + "]";
  }
}
