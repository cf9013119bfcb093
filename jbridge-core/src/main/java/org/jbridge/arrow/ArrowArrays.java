package org.jbridge.arrow;

import java.util.logging.Logger;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.UInt2Vector;
import org.apache.arrow.vector.ValueVector;
import org.jbridge.BridgeLimits;
import org.jbridge.BridgeTypeException;
import org.jbridge.BridgeUsageException;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JClass;
import org.jbridge.env.JObject;

/**
 * Moves fixed-width Arrow vectors in and out of the VM as primitive arrays.
 *
 * <p>Vectors map to arrays as follows: {@link BitVector} {@code [Z}, {@link TinyIntVector} {@code
 * [B}, {@link UInt2Vector} {@code [C}, {@link SmallIntVector} {@code [S}, {@link IntVector} {@code
 * [I}, {@link BigIntVector} {@code [J}, {@link Float4Vector} {@code [F}, {@link Float8Vector}
 * {@code [D}. Null slots become zero. A vector can be written into any primitive array type; its
 * values are converted the way a Java cast would.
 */
public final class ArrowArrays {
  private static final Logger LOG = Logger.getLogger(ArrowArrays.class.getName());

  private ArrowArrays() {} // Prevent instantiation

  /**
   * Copy {@code vector} into a new VM array. {@code sig} selects the array type; an object type
   * such as {@code Ljava/lang/Object;} selects the vector's own array type.
   */
  public static JObject toJavaArray(BridgeEnv env, ValueVector vector, String sig) {
    requireEnabled();
    String arraySig = sig.length() == 2 && sig.charAt(0) == '[' ? sig : arrayTypeOf(vector);
    int n = vector.getValueCount();
    LOG.fine("Copying " + n + " values of " + vector.getClass().getSimpleName() + " to " + arraySig);
    switch (arraySig.charAt(1)) {
      case 'Z': {
        boolean[] a = new boolean[n];
        for (int i = 0; i < n; i++) a[i] = number(vector, i).intValue() != 0;
        return env.makeBooleanArray(a);
      }
      case 'B': {
        byte[] a = new byte[n];
        for (int i = 0; i < n; i++) a[i] = number(vector, i).byteValue();
        return env.makeByteArray(a);
      }
      case 'C': {
        char[] a = new char[n];
        for (int i = 0; i < n; i++) a[i] = (char) number(vector, i).intValue();
        return env.makeCharArray(a);
      }
      case 'S': {
        short[] a = new short[n];
        for (int i = 0; i < n; i++) a[i] = number(vector, i).shortValue();
        return env.makeShortArray(a);
      }
      case 'I': {
        int[] a = new int[n];
        for (int i = 0; i < n; i++) a[i] = number(vector, i).intValue();
        return env.makeIntArray(a);
      }
      case 'J': {
        long[] a = new long[n];
        for (int i = 0; i < n; i++) a[i] = number(vector, i).longValue();
        return env.makeLongArray(a);
      }
      case 'F': {
        float[] a = new float[n];
        for (int i = 0; i < n; i++) a[i] = number(vector, i).floatValue();
        return env.makeFloatArray(a);
      }
      case 'D': {
        double[] a = new double[n];
        for (int i = 0; i < n; i++) a[i] = number(vector, i).doubleValue();
        return env.makeDoubleArray(a);
      }
      default:
        throw new BridgeTypeException("Cannot convert an Arrow vector to " + sig);
    }
  }

  /**
   * Copy a VM primitive array into a new vector allocated from {@code allocator}. The caller owns
   * the vector.
   */
  public static FieldVector fromJavaArray(
      BridgeEnv env, JObject array, String name, BufferAllocator allocator) {
    requireEnabled();
    String sig;
    try (JClass clazz = env.getObjectClass(array)) {
      sig = clazz.name();
    }
    switch (sig) {
      case "[Z": {
        boolean[] values = env.getBooleanArrayElements(array);
        BitVector v = new BitVector(name, allocator);
        v.allocateNew(values.length);
        for (int i = 0; i < values.length; i++) v.set(i, values[i] ? 1 : 0);
        v.setValueCount(values.length);
        return v;
      }
      case "[B": {
        byte[] values = env.getByteArrayElements(array);
        TinyIntVector v = new TinyIntVector(name, allocator);
        v.allocateNew(values.length);
        for (int i = 0; i < values.length; i++) v.set(i, values[i]);
        v.setValueCount(values.length);
        return v;
      }
      case "[C": {
        char[] values = env.getCharArrayElements(array);
        UInt2Vector v = new UInt2Vector(name, allocator);
        v.allocateNew(values.length);
        for (int i = 0; i < values.length; i++) v.set(i, values[i]);
        v.setValueCount(values.length);
        return v;
      }
      case "[S": {
        short[] values = env.getShortArrayElements(array);
        SmallIntVector v = new SmallIntVector(name, allocator);
        v.allocateNew(values.length);
        for (int i = 0; i < values.length; i++) v.set(i, values[i]);
        v.setValueCount(values.length);
        return v;
      }
      case "[I": {
        int[] values = env.getIntArrayElements(array);
        IntVector v = new IntVector(name, allocator);
        v.allocateNew(values.length);
        for (int i = 0; i < values.length; i++) v.set(i, values[i]);
        v.setValueCount(values.length);
        return v;
      }
      case "[J": {
        long[] values = env.getLongArrayElements(array);
        BigIntVector v = new BigIntVector(name, allocator);
        v.allocateNew(values.length);
        for (int i = 0; i < values.length; i++) v.set(i, values[i]);
        v.setValueCount(values.length);
        return v;
      }
      case "[F": {
        float[] values = env.getFloatArrayElements(array);
        Float4Vector v = new Float4Vector(name, allocator);
        v.allocateNew(values.length);
        for (int i = 0; i < values.length; i++) v.set(i, values[i]);
        v.setValueCount(values.length);
        return v;
      }
      case "[D": {
        double[] values = env.getDoubleArrayElements(array);
        Float8Vector v = new Float8Vector(name, allocator);
        v.allocateNew(values.length);
        for (int i = 0; i < values.length; i++) v.set(i, values[i]);
        v.setValueCount(values.length);
        return v;
      }
      default:
        throw new BridgeTypeException("Cannot convert " + sig + " to an Arrow vector");
    }
  }

  /** The primitive array descriptor a vector maps to. */
  public static String arrayTypeOf(ValueVector vector) {
    if (vector instanceof BitVector) return "[Z";
    if (vector instanceof TinyIntVector) return "[B";
    if (vector instanceof UInt2Vector) return "[C";
    if (vector instanceof SmallIntVector) return "[S";
    if (vector instanceof IntVector) return "[I";
    if (vector instanceof BigIntVector) return "[J";
    if (vector instanceof Float4Vector) return "[F";
    if (vector instanceof Float8Vector) return "[D";
    throw new BridgeTypeException(
        "Unsupported Arrow vector type: " + vector.getClass().getSimpleName());
  }

  private static Number number(ValueVector vector, int index) {
    if (vector.isNull(index)) return 0;
    Object value = vector.getObject(index);
    if (value instanceof Number n) return n;
    if (value instanceof Boolean b) return b ? 1 : 0;
    if (value instanceof Character c) return (int) c;
    throw new BridgeTypeException(
        "Unsupported Arrow vector type: " + vector.getClass().getSimpleName());
  }

  private static void requireEnabled() {
    if (!BridgeLimits.ARROW_ENABLED) {
      throw new BridgeUsageException("Arrow support is disabled (jbridge.arrow.enabled=false)");
    }
  }
}
