package org.jbridge.arrow;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarCharVector;
import org.jbridge.BridgeTestSupport;
import org.jbridge.BridgeTypeException;
import org.jbridge.JavaBridge;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JObject;
import org.jbridge.util.JavaCalls;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ArrowArraysTest {
  private JavaBridge bridge;
  private BridgeEnv env;
  private BufferAllocator allocator;

  @BeforeEach
  void setUp() {
    bridge = BridgeTestSupport.startBridge();
    env = bridge.env();
    allocator = new RootAllocator();
  }

  @AfterEach
  void tearDown() {
    allocator.close();
    bridge.kill();
  }

  @Test
  void testIntVectorWithNull() {
    try (IntVector vector = new IntVector("ints", allocator)) {
      vector.allocateNew(3);
      vector.set(0, 10);
      vector.setNull(1);
      vector.set(2, -3);
      vector.setValueCount(3);
      try (JObject array = ArrowArrays.toJavaArray(env, vector, "Ljava/lang/Object;")) {
        assertArrayEquals(new int[] {10, 0, -3}, env.getIntArrayElements(array));
      }
    }
  }

  @Test
  void testConversionFollowsRequestedType() {
    try (Float8Vector vector = new Float8Vector("doubles", allocator)) {
      vector.allocateNew(2);
      vector.set(0, 1.75);
      vector.set(1, -2.5);
      vector.setValueCount(2);
      try (JObject doubles = ArrowArrays.toJavaArray(env, vector, "[D");
          JObject ints = ArrowArrays.toJavaArray(env, vector, "[I")) {
        assertArrayEquals(new double[] {1.75, -2.5}, env.getDoubleArrayElements(doubles));
        assertArrayEquals(new int[] {1, -2}, env.getIntArrayElements(ints));
      }
    }
  }

  @Test
  void testBitVector() {
    try (BitVector vector = new BitVector("bits", allocator)) {
      vector.allocateNew(2);
      vector.set(0, 1);
      vector.set(1, 0);
      vector.setValueCount(2);
      assertEquals("[Z", ArrowArrays.arrayTypeOf(vector));
      try (JObject array = ArrowArrays.toJavaArray(env, vector, "[Z")) {
        assertArrayEquals(new boolean[] {true, false}, env.getBooleanArrayElements(array));
      }
    }
  }

  @Test
  void testFromJavaArray() {
    try (JObject array = env.makeLongArray(new long[] {1L, Long.MIN_VALUE, 42L});
        FieldVector vector = ArrowArrays.fromJavaArray(env, array, "longs", allocator)) {
      BigIntVector longs = assertInstanceOf(BigIntVector.class, vector);
      assertEquals(3, longs.getValueCount());
      assertEquals(Long.MIN_VALUE, longs.get(1));
      assertEquals("longs", longs.getName());
    }
  }

  @Test
  void testVectorAsCallArgument() {
    try (IntVector vector = new IntVector("ints", allocator)) {
      vector.allocateNew(3);
      for (int i = 0; i < 3; i++) vector.set(i, i + 1);
      vector.setValueCount(3);
      assertEquals(
          "[1, 2, 3]",
          JavaCalls.staticCall(
              env, "java.util.Arrays", "toString", "([I)Ljava/lang/String;", vector));
    }
  }

  @Test
  void testUnsupportedVectors() {
    try (VarCharVector strings = new VarCharVector("strings", allocator);
        JObject noInts = env.makeIntArray(new int[0])) {
      assertThrows(BridgeTypeException.class, () -> ArrowArrays.arrayTypeOf(strings));
      try (JObject s = env.newStringUtf("not an array")) {
        assertThrows(
            BridgeTypeException.class, () -> ArrowArrays.fromJavaArray(env, s, "s", allocator));
      }
      try (FieldVector empty = ArrowArrays.fromJavaArray(env, noInts, "empty", allocator)) {
        assertEquals(0, empty.getValueCount());
      }
    }
  }
}
