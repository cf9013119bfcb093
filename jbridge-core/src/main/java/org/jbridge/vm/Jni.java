package org.jbridge.vm;

/** Return codes and version constants of the invocation interface. */
public final class Jni {
  public static final int JNI_OK = 0;
  public static final int JNI_ERR = -1;
  public static final int JNI_EDETACHED = -2;
  public static final int JNI_EVERSION = -3;
  public static final int JNI_ENOMEM = -4;
  public static final int JNI_EEXIST = -5;
  public static final int JNI_EINVAL = -6;

  public static final int JNI_VERSION_1_8 = 0x00010008;
  public static final int JNI_VERSION_10 = 0x000a0000;

  /** Mode argument of {@code PopLocalFrame}-style calls that carry no result. */
  public static final long NULL_REF = 0L;

  private Jni() {} // Prevent instantiation

  /** Human-readable name of a return code, for log messages. */
  public static String describe(int code) {
    return switch (code) {
      case JNI_OK -> "JNI_OK";
      case JNI_ERR -> "JNI_ERR";
      case JNI_EDETACHED -> "JNI_EDETACHED";
      case JNI_EVERSION -> "JNI_EVERSION";
      case JNI_ENOMEM -> "JNI_ENOMEM";
      case JNI_EEXIST -> "JNI_EEXIST";
      case JNI_EINVAL -> "JNI_EINVAL";
      default -> "code " + code;
    };
  }
}
