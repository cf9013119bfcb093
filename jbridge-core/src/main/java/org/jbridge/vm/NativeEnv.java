package org.jbridge.vm;

/**
 * The per-thread native function table.
 *
 * <p>Handles are {@code long} values, {@code 0} being the null reference. Functions never throw VM
 * exceptions at the caller: a failing call leaves an exception pending and returns a zero value.
 * While an exception is pending only the exception functions, reference deletion and {@link
 * #popLocalFrame} may be called. An environment is bound to the thread it was handed to.
 */
public interface NativeEnv {

  int getVersion();

  // ========== CLASSES ==========

  /** Find a class by slash-separated name or array descriptor. */
  long findClass(String name);

  long getObjectClass(long obj);

  long getSuperclass(long clazz);

  boolean isInstanceOf(long obj, long clazz);

  boolean isSameObject(long a, long b);

  // ========== REFERENCES ==========

  long newGlobalRef(long ref);

  void deleteGlobalRef(long ref);

  long newLocalRef(long ref);

  void deleteLocalRef(long ref);

  /** Push a local frame; negative on failure with an {@code OutOfMemoryError} pending. */
  int pushLocalFrame(int capacity);

  /** Pop the top frame, returning a local reference to {@code result} in the previous frame. */
  long popLocalFrame(long result);

  // ========== EXCEPTIONS ==========

  long exceptionOccurred();

  boolean exceptionCheck();

  void exceptionDescribe();

  void exceptionClear();

  int throwNew(long clazz, String message);

  // ========== MEMBER IDS ==========

  long getMethodId(long clazz, String name, String sig);

  long getStaticMethodId(long clazz, String name, String sig);

  long getFieldId(long clazz, String name, String sig);

  long getStaticFieldId(long clazz, String name, String sig);

  long fromReflectedMethod(long method);

  long fromReflectedField(long field);

  // ========== INSTANCE CALLS ==========

  void callVoidMethod(long obj, long methodId, JValue... args);

  boolean callBooleanMethod(long obj, long methodId, JValue... args);

  byte callByteMethod(long obj, long methodId, JValue... args);

  char callCharMethod(long obj, long methodId, JValue... args);

  short callShortMethod(long obj, long methodId, JValue... args);

  int callIntMethod(long obj, long methodId, JValue... args);

  long callLongMethod(long obj, long methodId, JValue... args);

  float callFloatMethod(long obj, long methodId, JValue... args);

  double callDoubleMethod(long obj, long methodId, JValue... args);

  long callObjectMethod(long obj, long methodId, JValue... args);

  // ========== STATIC CALLS ==========

  void callStaticVoidMethod(long clazz, long methodId, JValue... args);

  boolean callStaticBooleanMethod(long clazz, long methodId, JValue... args);

  byte callStaticByteMethod(long clazz, long methodId, JValue... args);

  char callStaticCharMethod(long clazz, long methodId, JValue... args);

  short callStaticShortMethod(long clazz, long methodId, JValue... args);

  int callStaticIntMethod(long clazz, long methodId, JValue... args);

  long callStaticLongMethod(long clazz, long methodId, JValue... args);

  float callStaticFloatMethod(long clazz, long methodId, JValue... args);

  double callStaticDoubleMethod(long clazz, long methodId, JValue... args);

  long callStaticObjectMethod(long clazz, long methodId, JValue... args);

  long newObject(long clazz, long constructorId, JValue... args);

  // ========== INSTANCE FIELDS ==========

  boolean getBooleanField(long obj, long fieldId);

  byte getByteField(long obj, long fieldId);

  char getCharField(long obj, long fieldId);

  short getShortField(long obj, long fieldId);

  int getIntField(long obj, long fieldId);

  long getLongField(long obj, long fieldId);

  float getFloatField(long obj, long fieldId);

  double getDoubleField(long obj, long fieldId);

  long getObjectField(long obj, long fieldId);

  void setBooleanField(long obj, long fieldId, boolean value);

  void setByteField(long obj, long fieldId, byte value);

  void setCharField(long obj, long fieldId, char value);

  void setShortField(long obj, long fieldId, short value);

  void setIntField(long obj, long fieldId, int value);

  void setLongField(long obj, long fieldId, long value);

  void setFloatField(long obj, long fieldId, float value);

  void setDoubleField(long obj, long fieldId, double value);

  void setObjectField(long obj, long fieldId, long value);

  // ========== STATIC FIELDS ==========

  boolean getStaticBooleanField(long clazz, long fieldId);

  byte getStaticByteField(long clazz, long fieldId);

  char getStaticCharField(long clazz, long fieldId);

  short getStaticShortField(long clazz, long fieldId);

  int getStaticIntField(long clazz, long fieldId);

  long getStaticLongField(long clazz, long fieldId);

  float getStaticFloatField(long clazz, long fieldId);

  double getStaticDoubleField(long clazz, long fieldId);

  long getStaticObjectField(long clazz, long fieldId);

  void setStaticBooleanField(long clazz, long fieldId, boolean value);

  void setStaticByteField(long clazz, long fieldId, byte value);

  void setStaticCharField(long clazz, long fieldId, char value);

  void setStaticShortField(long clazz, long fieldId, short value);

  void setStaticIntField(long clazz, long fieldId, int value);

  void setStaticLongField(long clazz, long fieldId, long value);

  void setStaticFloatField(long clazz, long fieldId, float value);

  void setStaticDoubleField(long clazz, long fieldId, double value);

  void setStaticObjectField(long clazz, long fieldId, long value);

  // ========== STRINGS ==========

  /** Create a string from UTF-16 code units. */
  long newString(char[] chars, int length);

  /** Create a string from UTF-8 encoded bytes. */
  long newStringUtf(byte[] utf8);

  int getStringLength(long str);

  char[] getStringChars(long str);

  byte[] getStringUtfChars(long str);

  // ========== ARRAYS ==========

  int getArrayLength(long array);

  long newBooleanArray(int length);

  long newByteArray(int length);

  long newCharArray(int length);

  long newShortArray(int length);

  long newIntArray(int length);

  long newLongArray(int length);

  long newFloatArray(int length);

  long newDoubleArray(int length);

  void getBooleanArrayRegion(long array, int start, int length, boolean[] buf);

  void getByteArrayRegion(long array, int start, int length, byte[] buf);

  void getCharArrayRegion(long array, int start, int length, char[] buf);

  void getShortArrayRegion(long array, int start, int length, short[] buf);

  void getIntArrayRegion(long array, int start, int length, int[] buf);

  void getLongArrayRegion(long array, int start, int length, long[] buf);

  void getFloatArrayRegion(long array, int start, int length, float[] buf);

  void getDoubleArrayRegion(long array, int start, int length, double[] buf);

  void setBooleanArrayRegion(long array, int start, int length, boolean[] buf);

  void setByteArrayRegion(long array, int start, int length, byte[] buf);

  void setCharArrayRegion(long array, int start, int length, char[] buf);

  void setShortArrayRegion(long array, int start, int length, short[] buf);

  void setIntArrayRegion(long array, int start, int length, int[] buf);

  void setLongArrayRegion(long array, int start, int length, long[] buf);

  void setFloatArrayRegion(long array, int start, int length, float[] buf);

  void setDoubleArrayRegion(long array, int start, int length, double[] buf);

  long newObjectArray(int length, long elementClass, long initialElement);

  long getObjectArrayElement(long array, int index);

  void setObjectArrayElement(long array, int index, long value);

  // ========== NATIVES ==========

  /** Bind a host implementation to a native method of {@code clazz}. */
  int registerNatives(long clazz, String name, String sig, NativeMethod method);
}
