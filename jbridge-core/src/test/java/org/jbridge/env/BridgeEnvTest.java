package org.jbridge.env;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.jbridge.BridgeTestSupport;
import org.jbridge.BridgeUsageException;
import org.jbridge.JavaBridge;
import org.jbridge.JavaException;
import org.jbridge.NativeAllocationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

class BridgeEnvTest {
  private JavaBridge bridge;
  private BridgeEnv env;

  @BeforeEach
  void setUp() {
    bridge = BridgeTestSupport.startBridge("-XX:MaxJNILocalCapacity=1024");
    env = bridge.env();
  }

  @AfterEach
  void tearDown() {
    bridge.kill();
  }

  // ========== STRINGS ==========

  @Test
  void testStringRoundTrip() {
    try (JObject s = env.newStringUtf("Hello, world")) {
      assertEquals("Hello, world", env.getStringUtf(s));
      assertEquals(12, env.getStringLength(s));
    }
  }

  @Test
  void testUnicodeAndEmptyStrings() {
    String text = "grüß dich 世界 😀";
    try (JObject utf = env.newStringUtf(text);
        JObject utf16 = env.newString(text);
        JObject empty = env.newStringUtf("")) {
      assertEquals(text, env.getStringUtf(utf));
      assertEquals(text, env.getString(utf16));
      assertEquals(text.length(), env.getStringLength(utf16));
      assertEquals("", env.getStringUtf(empty));
    }
    assertNull(env.newStringUtf(null));
  }

  @Test
  void testStringMethodCall() {
    try (JClass string = env.findClass("java.lang.String");
        JObject s = env.newStringUtf("bridge")) {
      JMethodId toUpper = env.getMethodId(string, "toUpperCase", "()Ljava/lang/String;");
      try (JObject upper = (JObject) env.callMethod(s, toUpper)) {
        assertEquals("BRIDGE", env.getStringUtf(upper));
      }
      JMethodId length = env.getMethodId(string, "length", "()I");
      assertEquals(6, env.callMethod(s, length));
    }
  }

  // ========== OBJECT ARRAYS ==========

  @Test
  void testObjectArrayOfStrings() {
    try (JClass string = env.findClass("java/lang/String");
        JObject array = env.makeObjectArray(15, string)) {
      for (int i = 0; i < 15; i++) {
        env.setObjectArrayElement(array, i, String.valueOf(i));
      }
      JObject[] elements = env.getObjectArrayElements(array);
      assertEquals(15, elements.length);
      for (int i = 0; i < 15; i++) {
        assertEquals(String.valueOf(i), env.getStringUtf(elements[i]));
        elements[i].close();
      }
    }
  }

  @Test
  void testLargeObjectArrayStaysWithinLocalCapacity() {
    int size = 5000;
    try (JClass object = env.findClass("java.lang.Object");
        JObject array = env.makeObjectArray(size, object)) {
      try (JObject element = env.newStringUtf("x")) {
        for (int i = 0; i < size; i++) {
          env.setObjectArrayElement(array, i, element);
        }
      }
      JObject[] elements = env.getObjectArrayElements(array);
      assertEquals(size, elements.length);
      assertEquals("x", env.getStringUtf(elements[size - 1]));
      for (JObject e : elements) {
        e.close();
      }
    }
  }

  @Test
  void testNegativeArraySizeFailsAllocation() {
    try (JClass object = env.findClass("java.lang.Object")) {
      assertThrows(NativeAllocationException.class, () -> env.makeObjectArray(-1, object));
    }
    assertFalse(env.exceptionOccurred().isPresent());
  }

  // ========== PRIMITIVE ARRAYS ==========

  @Test
  void testPrimitiveArrays() {
    int[] ints = {3, 1, 4, 1, 5, 9};
    double[] doubles = {0.5, -2.25};
    boolean[] flags = {true, false, true};
    char[] chars = "chars".toCharArray();
    try (JObject i = env.makeIntArray(ints);
        JObject d = env.makeDoubleArray(doubles);
        JObject z = env.makeBooleanArray(flags);
        JObject c = env.makeCharArray(chars);
        JObject b = env.makeByteArray(new byte[] {-1, 0, 1});
        JObject j = env.makeLongArray(new long[] {Long.MAX_VALUE})) {
      assertArrayEquals(ints, env.getIntArrayElements(i));
      assertArrayEquals(doubles, env.getDoubleArrayElements(d));
      assertArrayEquals(flags, env.getBooleanArrayElements(z));
      assertArrayEquals(chars, env.getCharArrayElements(c));
      assertArrayEquals(new byte[] {-1, 0, 1}, env.getByteArrayElements(b));
      assertArrayEquals(new long[] {Long.MAX_VALUE}, env.getLongArrayElements(j));
      assertEquals(6, env.getArrayLength(i));
    }
  }

  @Test
  void testArraysToString() {
    try (JClass arrays = env.findClass("java.util.Arrays");
        JObject values = env.makeIntArray(new int[] {1, 2, 3})) {
      JMethodId toString = env.getStaticMethodId(arrays, "toString", "([I)Ljava/lang/String;");
      try (JObject text = (JObject) env.callStaticMethod(arrays, toString, values)) {
        assertEquals("[1, 2, 3]", env.getStringUtf(text));
      }
    }
  }

  // ========== CALLS ==========

  @Test
  void testStaticCallWithPrimitives() {
    try (JClass math = env.findClass("java.lang.Math")) {
      JMethodId max = env.getStaticMethodId(math, "max", "(JJ)J");
      assertEquals(7L, env.callStaticMethod(math, max, 7, 3));
      JMethodId abs = env.getStaticMethodId(math, "abs", "(D)D");
      assertEquals(2.5, env.callStaticMethod(math, abs, -2.5));
    }
  }

  @Test
  void testNewObject() {
    try (JClass builder = env.findClass("java.lang.StringBuilder")) {
      JMethodId init = env.getMethodId(builder, "<init>", "(Ljava/lang/String;)V");
      JMethodId append = env.getMethodId(builder, "append", "(I)Ljava/lang/StringBuilder;");
      JMethodId toString = env.getMethodId(builder, "toString", "()Ljava/lang/String;");
      try (JObject sb = env.newObject(builder, init, "n=")) {
        ((JObject) env.callMethod(sb, append, 42)).close();
        try (JObject s = (JObject) env.callMethod(sb, toString)) {
          assertEquals("n=42", env.getStringUtf(s));
        }
      }
    }
  }

  @Test
  void testArityMismatch() {
    try (JClass math = env.findClass("java.lang.Math")) {
      JMethodId max = env.getStaticMethodId(math, "max", "(II)I");
      BridgeUsageException tooFew =
          assertThrows(BridgeUsageException.class, () -> env.callStaticMethod(math, max, 1));
      assertTrue(tooFew.getMessage().startsWith("Too few arguments"));
      BridgeUsageException tooMany =
          assertThrows(
              BridgeUsageException.class, () -> env.callStaticMethod(math, max, 1, 2, 3));
      assertTrue(tooMany.getMessage().startsWith("# of arguments"));
    }
  }

  @Test
  void testArityMismatchForEverySignatureShape() {
    try (JClass system = env.findClass("java.lang.System");
        JClass arrays = env.findClass("java.util.Arrays");
        JClass objects = env.findClass("java.util.Objects")) {
      JMethodId nanoTime = env.getStaticMethodId(system, "nanoTime", "()J");
      assertTooMany(() -> env.callStaticMethod(system, nanoTime, 1));

      JMethodId hashCode = env.getStaticMethodId(arrays, "hashCode", "([I)I");
      assertTooFew(() -> env.callStaticMethod(arrays, hashCode));
      assertTooMany(() -> env.callStaticMethod(arrays, hashCode, new int[0], 1));

      JMethodId requireNonNull =
          env.getStaticMethodId(
              objects,
              "requireNonNull",
              "(Ljava/lang/Object;Ljava/lang/String;)Ljava/lang/Object;");
      assertTooFew(() -> env.callStaticMethod(objects, requireNonNull, "x"));
      assertTooMany(() -> env.callStaticMethod(objects, requireNonNull, "x", "y", "z"));
    }
  }

  private static void assertTooFew(Executable call) {
    BridgeUsageException e = assertThrows(BridgeUsageException.class, call);
    assertTrue(e.getMessage().startsWith("Too few arguments"), e.getMessage());
  }

  private static void assertTooMany(Executable call) {
    BridgeUsageException e = assertThrows(BridgeUsageException.class, call);
    assertTrue(e.getMessage().startsWith("# of arguments"), e.getMessage());
  }

  @Test
  void testPrimitiveExtremesSurviveCalls() {
    try (JClass math = env.findClass("java.lang.Math");
        JClass bytes = env.findClass("java.lang.Byte");
        JClass shorts = env.findClass("java.lang.Short");
        JClass chars = env.findClass("java.lang.Character")) {
      JMethodId minLong = env.getStaticMethodId(math, "min", "(JJ)J");
      assertEquals(
          Long.MIN_VALUE, env.callStaticMethod(math, minLong, Long.MIN_VALUE, Long.MAX_VALUE));
      JMethodId maxLong = env.getStaticMethodId(math, "max", "(JJ)J");
      assertEquals(
          Long.MAX_VALUE, env.callStaticMethod(math, maxLong, Long.MIN_VALUE, Long.MAX_VALUE));

      JMethodId absInt = env.getStaticMethodId(math, "abs", "(I)I");
      assertEquals(Integer.MIN_VALUE, env.callStaticMethod(math, absInt, Integer.MIN_VALUE));
      JMethodId absDouble = env.getStaticMethodId(math, "abs", "(D)D");
      assertEquals(Double.MAX_VALUE, env.callStaticMethod(math, absDouble, -Double.MAX_VALUE));
      JMethodId absFloat = env.getStaticMethodId(math, "abs", "(F)F");
      assertEquals(Float.MIN_VALUE, env.callStaticMethod(math, absFloat, -Float.MIN_VALUE));

      JMethodId compareBytes = env.getStaticMethodId(bytes, "compare", "(BB)I");
      assertEquals(
          -255, env.callStaticMethod(bytes, compareBytes, Byte.MIN_VALUE, Byte.MAX_VALUE));
      JMethodId unsigned = env.getStaticMethodId(bytes, "toUnsignedInt", "(B)I");
      assertEquals(128, env.callStaticMethod(bytes, unsigned, Byte.MIN_VALUE));

      JMethodId reverseBytes = env.getStaticMethodId(shorts, "reverseBytes", "(S)S");
      assertEquals(
          Short.valueOf((short) 0x80), env.callStaticMethod(shorts, reverseBytes, Short.MIN_VALUE));

      JMethodId identity = env.getStaticMethodId(chars, "toUpperCase", "(C)C");
      assertEquals(
          Character.valueOf(Character.MAX_VALUE),
          env.callStaticMethod(chars, identity, Character.MAX_VALUE));
    }
  }

  @Test
  void testBadSignature() {
    try (JClass math = env.findClass("java.lang.Math")) {
      assertThrows(BridgeUsageException.class, () -> env.getStaticMethodId(math, "max", "II)I"));
      assertThrows(BridgeUsageException.class, () -> env.getStaticMethodId(math, "max", "(Q)I"));
    }
  }

  @Test
  void testStaticAndInstanceMisuse() {
    try (JClass integer = env.findClass("java.lang.Integer");
        JObject s = env.newStringUtf("1")) {
      JMethodId parseInt =
          env.getStaticMethodId(integer, "parseInt", "(Ljava/lang/String;)I");
      assertThrows(BridgeUsageException.class, () -> env.callMethod(s, parseInt, "1"));
      JMethodId intValue = env.getMethodId(integer, "intValue", "()I");
      assertThrows(BridgeUsageException.class, () -> env.callStaticMethod(integer, intValue));
      assertThrows(BridgeUsageException.class, () -> env.callMethod(s, null));
    }
  }

  @Test
  void testMissingMethodIsNull() {
    try (JClass integer = env.findClass("java.lang.Integer")) {
      assertNull(env.getMethodId(integer, "noSuchMethod", "()V"));
      assertNull(env.getStaticMethodId(integer, "intValue", "()I"));
    }
    assertFalse(env.exceptionOccurred().isPresent());
  }

  // ========== EXCEPTIONS ==========

  @Test
  void testMissingFieldRaisesJavaException() {
    try (JClass integer = env.findClass("java.lang.Integer")) {
      JavaException e =
          assertThrows(JavaException.class, () -> env.getFieldId(integer, "nope", "I"));
      assertEquals("java.lang.NoSuchFieldError", e.getClassName());
    }
    assertFalse(env.exceptionOccurred().isPresent());
  }

  @Test
  void testExceptionFromCallIsClearedAndRaised() {
    try (JClass integer = env.findClass("java.lang.Integer")) {
      JMethodId parseInt =
          env.getStaticMethodId(integer, "parseInt", "(Ljava/lang/String;)I");
      JavaException e =
          assertThrows(JavaException.class, () -> env.callStaticMethod(integer, parseInt, "x"));
      assertEquals("java.lang.NumberFormatException", e.getClassName());
      assertTrue(e.getJavaMessage().contains("\"x\""));
      assertNotNull(e.getThrowable());
      e.getThrowable().close();
    }
    assertFalse(env.exceptionOccurred().isPresent());
  }

  @Test
  void testMissingClassRaisesJavaException() {
    JavaException e =
        assertThrows(JavaException.class, () -> env.findClass("org.jbridge.NoSuchClass"));
    assertEquals("java.lang.NoClassDefFoundError", e.getClassName());
  }

  // ========== FIELDS ==========

  @Test
  void testStaticField() {
    try (JClass integer = env.findClass("java.lang.Integer")) {
      JFieldId max = env.getStaticFieldId(integer, "MAX_VALUE", "I");
      assertEquals(Integer.MAX_VALUE, env.getStaticField(integer, max));
      assertThrows(BridgeUsageException.class, () -> env.getField(integer, max));
    }
  }

  @Test
  void testClassQueries() {
    try (JObject s = env.newStringUtf("s");
        JClass stringClass = env.getObjectClass(s);
        JClass charSequence = env.findClass("java.lang.CharSequence");
        JClass number = env.findClass("java.lang.Number")) {
      assertEquals("java.lang.String", stringClass.name());
      assertEquals("Ljava/lang/String;", stringClass.signature());
      assertTrue(env.isInstanceOf(s, charSequence));
      assertFalse(env.isInstanceOf(s, number));
      try (JObject copy = env.newGlobalRef(s)) {
        assertTrue(env.isSameObject(s, copy));
      }
    }
  }
}
