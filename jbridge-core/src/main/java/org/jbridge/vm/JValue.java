package org.jbridge.vm;

/**
 * One argument slot of a native call, the equivalent of a {@code jvalue} union.
 *
 * <p>Primitive values are stored as raw bits; object slots carry a reference handle, with {@code 0}
 * standing for the null reference. The receiving side interprets a slot according to the declared
 * parameter type of the method it is calling, so the type tag is informational only.
 */
public final class JValue {
  /** The null object reference. */
  public static final JValue NULL = new JValue('L', 0L);

  private final char type;
  private final long bits;

  private JValue(char type, long bits) {
    this.type = type;
    this.bits = bits;
  }

  public static JValue z(boolean value) {
    return new JValue('Z', value ? 1L : 0L);
  }

  public static JValue b(byte value) {
    return new JValue('B', value);
  }

  public static JValue c(char value) {
    return new JValue('C', value);
  }

  public static JValue s(short value) {
    return new JValue('S', value);
  }

  public static JValue i(int value) {
    return new JValue('I', value);
  }

  public static JValue j(long value) {
    return new JValue('J', value);
  }

  public static JValue f(float value) {
    return new JValue('F', Float.floatToRawIntBits(value));
  }

  public static JValue d(double value) {
    return new JValue('D', Double.doubleToRawLongBits(value));
  }

  public static JValue l(long handle) {
    return handle == 0 ? NULL : new JValue('L', handle);
  }

  public char type() {
    return type;
  }

  public boolean getZ() {
    return bits != 0;
  }

  public byte getB() {
    return (byte) bits;
  }

  public char getC() {
    return (char) bits;
  }

  public short getS() {
    return (short) bits;
  }

  public int getI() {
    return (int) bits;
  }

  public long getJ() {
    return bits;
  }

  public float getF() {
    return Float.intBitsToFloat((int) bits);
  }

  public double getD() {
    return Double.longBitsToDouble(bits);
  }

  /** The reference handle carried by an object slot. */
  public long getL() {
    return bits;
  }

  @Override
  public String toString() {
    return switch (type) {
      case 'Z' -> "Z:" + getZ();
      case 'C' -> "C:" + getC();
      case 'F' -> "F:" + getF();
      case 'D' -> "D:" + getD();
      case 'L' -> "L:0x" + Long.toHexString(bits);
      default -> type + ":" + bits;
    };
  }
}
