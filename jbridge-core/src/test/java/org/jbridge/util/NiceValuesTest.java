package org.jbridge.util;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.jbridge.BridgeTestSupport;
import org.jbridge.BridgeTypeException;
import org.jbridge.JavaBridge;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JClass;
import org.jbridge.env.JObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NiceValuesTest {
  private JavaBridge bridge;
  private BridgeEnv env;

  @BeforeEach
  void setUp() {
    bridge = BridgeTestSupport.startBridge();
    env = bridge.env();
  }

  @AfterEach
  void tearDown() {
    bridge.kill();
  }

  private String className(Object obj) {
    try (JClass clazz = env.getObjectClass((JObject) obj)) {
      return clazz.name();
    }
  }

  @Test
  void testPassThrough() {
    Object marker = new Object();
    assertSame(marker, NiceValues.getNiceArg(env, marker, "Ljava/lang/Thread;"));
    assertEquals(5, NiceValues.getNiceArg(env, 5, "I"));
    assertNull(NiceValues.getNiceArg(env, null, "Ljava/lang/String;"));
    try (JObject s = env.newStringUtf("s")) {
      assertSame(s, NiceValues.getNiceArg(env, s, "Ljava/lang/Object;"));
    }
  }

  @Test
  void testScalarsBoxToWrappers() {
    Object boxed = NiceValues.getNiceArg(env, 7, "Ljava/lang/Long;");
    try (JObject obj = (JObject) boxed) {
      assertEquals("java.lang.Long", className(obj));
    }
    Object asObject = NiceValues.getNiceArg(env, (short) 3, "Ljava/lang/Object;");
    try (JObject obj = (JObject) asObject) {
      assertEquals("java.lang.Short", className(obj));
    }
    try (JObject flag = NiceValues.box(env, true, boolean.class)) {
      assertEquals(true, NiceValues.getNiceResult(env, env.newGlobalRef(flag), "Ljava/lang/Object;"));
    }
    assertThrows(BridgeTypeException.class, () -> NiceValues.box(env, 1, String.class));
  }

  @Test
  void testStringsAndCharArrays() {
    Object s = NiceValues.getNiceArg(env, new StringBuilder("built"), "Ljava/lang/CharSequence;");
    assertEquals("built", NiceValues.getNiceResult(env, s, "Ljava/lang/String;"));
    Object chars = NiceValues.getNiceArg(env, "abc", "[C");
    assertArrayEquals(new char[] {'a', 'b', 'c'}, (char[]) NiceValues.getNiceResult(env, chars, "[C"));
  }

  @Test
  void testListsBecomeArrays() {
    Object ints = NiceValues.getNiceArg(env, List.of(1, 2, 3), "[I");
    assertArrayEquals(new int[] {1, 2, 3}, (int[]) NiceValues.getNiceResult(env, ints, "[I"));

    Object strings = NiceValues.getNiceArg(env, new String[] {"a", "b"}, "[Ljava/lang/String;");
    try (JObject array = (JObject) strings) {
      JObject[] elements = env.getObjectArrayElements(array);
      assertEquals("a", env.getStringUtf(elements[0]));
      assertEquals("b", env.getStringUtf(elements[1]));
    }

    assertThrows(
        BridgeTypeException.class, () -> NiceValues.getNiceArg(env, List.of("x"), "[I"));
  }

  @Test
  void testConstructorAsLastResort() {
    Object big = NiceValues.getNiceArg(env, "12345678901234567890", "Ljava/math/BigInteger;");
    try (JObject obj = (JObject) big) {
      assertEquals("java.math.BigInteger", className(obj));
      assertEquals("12345678901234567890", JavaCalls.toString(env, obj));
    }
  }

  @Test
  void testResults() {
    try (JClass integer = env.findClass("java.lang.Integer")) {
      Object cls = NiceValues.getNiceResult(env, env.newGlobalRef(integer), "Ljava/lang/Class;");
      assertInstanceOf(JClass.class, cls);
      ((JClass) cls).close();
    }
    Object intClass =
        JavaCalls.getStaticField(env, "java.lang.Integer", "TYPE", "Ljava/lang/Class;");
    assertSame(int.class, intClass);

    Object list = JavaCalls.makeInstance(env, "java.util.ArrayList", "()V");
    Object same = NiceValues.getNiceResult(env, list, "Ljava/util/List;");
    assertSame(list, same);
    ((JObject) list).close();
  }
}
