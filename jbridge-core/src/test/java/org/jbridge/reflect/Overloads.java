package org.jbridge.reflect;

/** Overloaded members looked up by the reflection tests. */
public class Overloads {
  public static int counter = 0;

  public static final String GREETING = "hello";

  public int width;
  public String label = "none";

  public Overloads() {}

  public Overloads(int width) {
    this.width = width;
  }

  public Overloads(String label) {
    this.label = label;
  }

  public static String f(int x) {
    return "int";
  }

  public static String f(String s) {
    return "string";
  }

  public static String f(Object... rest) {
    return "varargs:" + rest.length;
  }

  public static int h(int x) {
    return x * 2;
  }

  public static int low(byte b) {
    return b;
  }

  public static int sum(int[] values) {
    int total = 0;
    for (int v : values) total += v;
    return total;
  }

  public static String join(String separator, String... parts) {
    return String.join(separator, parts);
  }

  public String describe() {
    return label + ":" + width;
  }

  public long area(long height) {
    return width * height;
  }

  public static void fail(String message) {
    throw new IllegalArgumentException(message);
  }
}
