package org.jbridge;

import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JClass;
import org.jbridge.env.JMethodId;
import org.jbridge.env.JObject;

/**
 * An exception thrown inside the VM during a bridge call. The VM's exception state has been
 * cleared by the time this is raised; the throwable itself stays reachable through {@link
 * #getThrowable()}.
 */
public class JavaException extends RuntimeException {
  private final transient JObject throwable;
  private final String className;
  private final String javaMessage;

  public JavaException(JObject throwable, String className, String javaMessage) {
    super(javaMessage != null ? className + ": " + javaMessage : className);
    this.throwable = throwable;
    this.className = className;
    this.javaMessage = javaMessage;
  }

  /** The VM throwable. */
  public JObject getThrowable() {
    return throwable;
  }

  /** Binary name of the throwable's class, e.g. {@code java.lang.NoSuchFieldError}. */
  public String getClassName() {
    return className;
  }

  /** The throwable's own {@code getMessage()}, or null. */
  public String getJavaMessage() {
    return javaMessage;
  }

  /**
   * Recover the cause of a wrapper exception. When the throwable is an instance of {@code
   * wrapperClassName} and has a cause, the cause is returned as a new exception; otherwise this
   * exception is returned.
   */
  public JavaException unwrap(BridgeEnv env, String wrapperClassName) {
    if (throwable == null || !className.equals(wrapperClassName)) {
      return this;
    }
    try (JClass throwableClass = env.findClass("java.lang.Throwable")) {
      JMethodId getCause =
          env.getMethodId(throwableClass, "getCause", "()Ljava/lang/Throwable;");
      JObject cause = (JObject) env.callMethod(throwable, getCause);
      return cause == null ? this : env.toJavaException(cause);
    }
  }
}
