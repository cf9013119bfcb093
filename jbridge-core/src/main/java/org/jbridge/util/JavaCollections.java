package org.jbridge.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.jbridge.BridgeTypeException;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JClass;
import org.jbridge.env.JMethodId;
import org.jbridge.env.JObject;

/** Walking and building {@code java.util} collections from the host side. */
public final class JavaCollections {

  private JavaCollections() {} // Prevent instantiation

  /**
   * A lazy host iterator over a VM {@code java.util.Iterator}. Each element is fetched when the
   * host asks for it.
   *
   * @throws BridgeTypeException when {@code iterator} is not a {@code java.util.Iterator}
   */
  public static Iterator<JObject> iterateJava(BridgeEnv env, JObject iterator) {
    JClass iteratorClass = env.findClass("java/util/Iterator");
    if (iterator == null || !env.isInstanceOf(iterator, iteratorClass)) {
      String name = iterator == null ? "null" : JavaCalls.toString(env, iterator);
      iteratorClass.close();
      throw new BridgeTypeException(name + " does not implement the java.util.Iterator interface");
    }
    JMethodId hasNext = env.getMethodId(iteratorClass, "hasNext", "()Z");
    JMethodId next = env.getMethodId(iteratorClass, "next", "()Ljava/lang/Object;");
    iteratorClass.close();
    return new Iterator<>() {
      @Override
      public boolean hasNext() {
        return (Boolean) env.callMethod(iterator, hasNext);
      }

      @Override
      public JObject next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return (JObject) env.callMethod(iterator, next);
      }
    };
  }

  /** Iterate over a VM {@code java.util.Collection}. */
  public static Iterator<JObject> iterateCollection(BridgeEnv env, JObject collection) {
    JObject iterator =
        (JObject) JavaCalls.call(env, collection, "iterator", "()Ljava/util/Iterator;");
    return iterateJava(env, iterator);
  }

  /** A new {@code java.util.ArrayList} holding {@code elements}, converted as objects. */
  public static JObject makeList(BridgeEnv env, List<?> elements) {
    JObject list = JavaCalls.makeInstance(env, "java/util/ArrayList", "()V");
    if (!elements.isEmpty()) {
      JavaCalls.BoundCall add = JavaCalls.makeCall(env, list, "add", "(Ljava/lang/Object;)Z");
      for (Object element : elements) {
        add.call(element);
      }
    }
    return list;
  }

  /** A new {@code java.util.HashMap} holding the entries of {@code entries}. */
  public static JObject makeMap(BridgeEnv env, Map<String, ?> entries) {
    JObject map = JavaCalls.makeInstance(env, "java/util/HashMap", "()V");
    JavaCalls.BoundCall put =
        JavaCalls.makeCall(
            env, map, "put", "(Ljava/lang/Object;Ljava/lang/Object;)Ljava/lang/Object;");
    for (Map.Entry<String, ?> e : entries.entrySet()) {
      Object previous = put.call(e.getKey(), e.getValue());
      if (previous instanceof JObject o) o.close();
    }
    return map;
  }

  /** The {@code toString()} of every element of a {@code java.util.Enumeration}. */
  public static List<String> enumerationToStringList(BridgeEnv env, JObject enumeration) {
    JavaCalls.BoundCall hasMore = JavaCalls.makeCall(env, enumeration, "hasMoreElements", "()Z");
    JavaCalls.BoundCall next =
        JavaCalls.makeCall(env, enumeration, "nextElement", "()Ljava/lang/Object;");
    List<String> result = new ArrayList<>();
    while ((Boolean) hasMore.call()) {
      Object element = next.call();
      if (element instanceof JObject o) {
        try (o) {
          result.add(JavaCalls.toString(env, o));
        }
      } else {
        result.add(String.valueOf(element));
      }
    }
    return result;
  }

  /** Keys and values of a {@code java.util.Dictionary} such as a {@code Hashtable}, as strings. */
  public static Map<String, String> dictionaryToStringMap(BridgeEnv env, JObject dictionary) {
    List<String> keys;
    try (JObject keyEnumeration =
        (JObject) JavaCalls.call(env, dictionary, "keys", "()Ljava/util/Enumeration;")) {
      keys = enumerationToStringList(env, keyEnumeration);
    }
    JavaCalls.BoundCall get =
        JavaCalls.makeCall(env, dictionary, "get", "(Ljava/lang/Object;)Ljava/lang/Object;");
    Map<String, String> result = new LinkedHashMap<>();
    for (String key : keys) {
      Object value = get.call(key);
      if (value instanceof JObject o) {
        try (o) {
          result.put(key, JavaCalls.toString(env, o));
        }
      } else {
        result.put(key, value == null ? null : String.valueOf(value));
      }
    }
    return result;
  }
}
