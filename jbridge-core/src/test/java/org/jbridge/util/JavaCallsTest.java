package org.jbridge.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.jbridge.BridgeTestSupport;
import org.jbridge.BridgeUsageException;
import org.jbridge.JavaBridge;
import org.jbridge.JavaException;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JClass;
import org.jbridge.env.JObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JavaCallsTest {
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

  @Test
  void testHelloWorld() {
    try (JObject sb =
        JavaCalls.makeInstance(env, "java.lang.StringBuilder", "(Ljava/lang/String;)V", "Hello")) {
      JavaCalls.BoundCall append =
          JavaCalls.makeCall(env, sb, "append", "(Ljava/lang/String;)Ljava/lang/StringBuilder;");
      ((JObject) append.call(", ")).close();
      ((JObject) append.call("world")).close();
      assertEquals("Hello, world", JavaCalls.toString(env, sb));
    }
  }

  @Test
  void testStaticCallConvertsStrings() {
    assertEquals(
        42, JavaCalls.staticCall(env, "java.lang.Integer", "parseInt", "(Ljava/lang/String;)I", "42"));
    assertEquals(
        "ff",
        JavaCalls.staticCall(
            env, "java/lang/Integer", "toHexString", "(I)Ljava/lang/String;", 255));
  }

  @Test
  void testUnboundCall() {
    JavaCalls.UnboundCall length = JavaCalls.makeCall(env, "java.lang.String", "length", "()I");
    try (JObject a = env.newStringUtf("abc");
        JObject b = env.newStringUtf("abcdef")) {
      assertEquals(3, length.call(a));
      assertEquals(6, length.call(b));
    }
  }

  @Test
  void testMissingMethod() {
    try (JObject s = env.newStringUtf("s")) {
      BridgeUsageException e =
          assertThrows(
              BridgeUsageException.class, () -> JavaCalls.call(env, s, "nope", "(I)V", 1));
      assertEquals(
          "Could not find method name = \"nope\" with signature = \"(I)V\"", e.getMessage());
    }
    assertThrows(
        BridgeUsageException.class,
        () -> JavaCalls.makeInstance(env, "java.lang.String", "(JJJ)V"));
    assertThrows(BridgeUsageException.class, () -> JavaCalls.call(env, null, "toString", "()V"));
  }

  @Test
  void testArityMismatchIsReported() {
    assertThrows(
        BridgeUsageException.class,
        () -> JavaCalls.staticCall(env, "java.lang.Math", "max", "(II)I", 1));
  }

  @Test
  void testExceptionsPropagate() {
    JavaException e =
        assertThrows(
            JavaException.class,
            () ->
                JavaCalls.staticCall(
                    env, "java.lang.Integer", "parseInt", "(Ljava/lang/String;)I", "forty"));
    assertEquals("java.lang.NumberFormatException", e.getClassName());
  }

  @Test
  void testStaticFields() {
    assertEquals(
        Integer.MAX_VALUE, JavaCalls.getStaticField(env, "java.lang.Integer", "MAX_VALUE", "I"));
    assertEquals(
        "line.separator",
        JavaCalls.staticCall(
            env,
            "java.lang.String",
            "valueOf",
            "(Ljava/lang/Object;)Ljava/lang/String;",
            "line.separator"));
  }

  @Test
  void testInstanceFields() {
    try (JObject point = JavaCalls.makeInstance(env, "java.awt.Point", "(II)V", 3, 4)) {
      assertEquals(3, JavaCalls.getField(env, point, "x", "I"));
      JavaCalls.setField(env, point, "y", "I", 10);
      assertEquals(10, JavaCalls.getField(env, point, "y", "I"));
    }
  }

  @Test
  void testClassForName() {
    try (JClass list = JavaCalls.classForName(env, "java.util.ArrayList");
        JClass entry = JavaCalls.classForName(env, "java.util.Map$Entry")) {
      assertEquals("java.util.ArrayList", list.name());
      assertEquals("java.util.Map$Entry", entry.name());
    }
    assertThrows(JavaException.class, () -> JavaCalls.classForName(env, "no.such.Type"));
  }

  @Test
  void testIsInstanceOf() {
    try (JObject s = env.newStringUtf("text")) {
      assertTrue(JavaCalls.isInstanceOf(env, s, "java.lang.CharSequence"));
      assertFalse(JavaCalls.isInstanceOf(env, s, "java.lang.Number"));
    }
    assertFalse(JavaCalls.isInstanceOf(env, "host string", "java.lang.String"));
    assertFalse(JavaCalls.isInstanceOf(env, null, "java.lang.Object"));
  }

  @Test
  void testModifierFlags() {
    assertEquals(List.of("PUBLIC", "STATIC"), JavaCalls.getModifierFlags(env, 9));
    assertEquals(List.of("ABSTRACT", "INTERFACE", "PUBLIC"), JavaCalls.getModifierFlags(env, 0x601));
    assertEquals(List.of(), JavaCalls.getModifierFlags(env, 0));
  }
}
