package org.jbridge.reflect;

import java.util.ArrayList;
import java.util.Collections;
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
 * Late-bound access to a VM object through its public instance members.
 *
 * <p>Methods are called by name with {@link #invoke}, and the overload is chosen from the
 * arguments. Fields are read and written with {@link #get} and {@link #set}. Object results come
 * back as new wrappers; strings, wrappers and primitive arrays come back as host values. Static
 * members are reached through {@link JavaClassWrapper}; asking a wrapper for a static field is
 * reported as a missing attribute.
 *
 * <p>A wrapper is bound to the environment it was created with and must stay on that thread.
 */
public class JavaWrapper implements JObjectHolder, AutoCloseable {
  private final BridgeEnv env;
  private final MemberTables tables;
  private final JObject obj;
  private final JClass clazz;
  private final MemberTables.Table table;

  public JavaWrapper(BridgeEnv env, MemberTables tables, JObject obj) {
    if (obj == null) {
      throw new IllegalArgumentException("Cannot wrap a null reference");
    }
    this.env = env;
    this.tables = tables;
    this.obj = obj;
    this.clazz = env.getObjectClass(obj);
    this.table = tables.forClass(env, clazz);
  }

  // ========== METHODS ==========

  /**
   * Call the instance method {@code name} with the first overload the arguments fit.
   *
   * @throws NoSuchAttributeException when the class has no public instance method of that name
   * @throws org.jbridge.BridgeTypeException when no overload fits
   */
  public Object invoke(String name, Object... args) {
    List<OverloadDescriptor> candidates = table.methods(name);
    if (candidates.isEmpty()) {
      throw new NoSuchAttributeException(table.className(), name);
    }
    try (OverloadResolver.Resolution r =
        OverloadResolver.resolveMethod(env, table.className(), name, candidates, args)) {
      OverloadDescriptor overload = r.overload();
      JMethodId id = env.getMethodId(clazz, name, overload.signature());
      Object result = env.callMethod(obj, id, r.args());
      return wrap(NiceValues.getNiceResult(env, result, overload.returnType()));
    }
  }

  public Set<String> methodNames() {
    return table.methods().keySet();
  }

  /** Every overload of {@code name}, as reflection reports them. */
  public List<OverloadDescriptor> overloads(String name) {
    return table.methods(name);
  }

  // ========== FIELDS ==========

  public Object get(String field) {
    String type = fieldType(field);
    JFieldId id = env.getFieldId(clazz, field, type);
    return wrap(NiceValues.getNiceResult(env, env.getField(obj, id), type));
  }

  public void set(String field, Object value) {
    String type = fieldType(field);
    JFieldId id = env.getFieldId(clazz, field, type);
    List<JObject> temporaries = new ArrayList<>();
    try {
      env.setField(obj, id, Casts.cast(env, value, type, temporaries));
    } finally {
      temporaries.forEach(JObject::close);
    }
  }

  public Set<String> fieldNames() {
    return Collections.unmodifiableSet(table.fields().keySet());
  }

  private String fieldType(String field) {
    String type = table.fields().get(field);
    if (type == null) {
      throw new NoSuchAttributeException(table.className(), field);
    }
    return type;
  }

  // ========== OBJECT ==========

  private Object wrap(Object result) {
    return result instanceof JObject o ? new JavaWrapper(env, tables, o) : result;
  }

  /** Binary name of the wrapped object's class. */
  public String className() {
    return table.className();
  }

  @Override
  public JObject toJObject() {
    return obj;
  }

  /** Release the wrapped object. */
  @Override
  public void close() {
    obj.close();
    clazz.close();
  }

  @Override
  public String toString() {
    return JavaCalls.toString(env, obj);
  }
}
