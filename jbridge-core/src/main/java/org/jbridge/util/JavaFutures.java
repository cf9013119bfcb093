package org.jbridge.util;

import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.jbridge.JavaException;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JObject;
import org.jbridge.env.JObjectHolder;

/** {@code java.util.concurrent.FutureTask}s built around VM runnables and callables. */
public final class JavaFutures {

  private JavaFutures() {} // Prevent instantiation

  /**
   * Wrap a VM {@code Callable}, or a {@code Runnable} plus the value {@code get} returns, in a new
   * {@code FutureTask}.
   *
   * @param postProcess applied to the result of {@link JavaFuture#get}, or null
   */
  public static JavaFuture makeFutureTask(
      BridgeEnv env, JObject runnableOrCallable, Object result, Function<Object, Object> postProcess) {
    JObject task;
    if (JavaCalls.isInstanceOf(env, runnableOrCallable, "java/util/concurrent/Callable")) {
      task =
          JavaCalls.makeInstance(
              env,
              "java/util/concurrent/FutureTask",
              "(Ljava/util/concurrent/Callable;)V",
              runnableOrCallable);
    } else {
      task =
          JavaCalls.makeInstance(
              env,
              "java/util/concurrent/FutureTask",
              "(Ljava/lang/Runnable;Ljava/lang/Object;)V",
              runnableOrCallable,
              result);
    }
    return new JavaFuture(task, postProcess);
  }

  public static JavaFuture makeFutureTask(BridgeEnv env, JObject runnableOrCallable) {
    return makeFutureTask(env, runnableOrCallable, null, null);
  }

  /** A VM {@code java.util.concurrent.Future} seen from the host. */
  public static final class JavaFuture implements JObjectHolder, AutoCloseable {
    private final JObject future;
    private final Function<Object, Object> postProcess;

    public JavaFuture(JObject future, Function<Object, Object> postProcess) {
      this.future = future;
      this.postProcess = postProcess;
    }

    @Override
    public JObject toJObject() {
      return future;
    }

    /** Run the task on the calling thread; only for {@code RunnableFuture}s. */
    public void run(BridgeEnv env) {
      JavaCalls.call(env, future, "run", "()V");
    }

    /**
     * Wait for the result. A failure inside the task surfaces as the {@link JavaException} of its
     * cause rather than the VM's {@code ExecutionException}.
     */
    public Object get(BridgeEnv env) {
      try {
        return postProcess(JavaCalls.call(env, future, "get", "()Ljava/lang/Object;"));
      } catch (JavaException e) {
        throw e.unwrap(env, "java.util.concurrent.ExecutionException");
      }
    }

    public Object get(BridgeEnv env, long timeout, TimeUnit unit) {
      JObject timeUnit =
          (JObject)
              JavaCalls.getStaticField(
                  env,
                  "java/util/concurrent/TimeUnit",
                  unit.name(),
                  "Ljava/util/concurrent/TimeUnit;");
      try (timeUnit) {
        return postProcess(
            JavaCalls.call(
                env,
                future,
                "get",
                "(JLjava/util/concurrent/TimeUnit;)Ljava/lang/Object;",
                timeout,
                timeUnit));
      } catch (JavaException e) {
        throw e.unwrap(env, "java.util.concurrent.ExecutionException");
      }
    }

    public boolean cancel(BridgeEnv env, boolean mayInterruptIfRunning) {
      return (Boolean) JavaCalls.call(env, future, "cancel", "(Z)Z", mayInterruptIfRunning);
    }

    public boolean isCancelled(BridgeEnv env) {
      return (Boolean) JavaCalls.call(env, future, "isCancelled", "()Z");
    }

    public boolean isDone(BridgeEnv env) {
      return (Boolean) JavaCalls.call(env, future, "isDone", "()Z");
    }

    private Object postProcess(Object result) {
      return postProcess == null ? result : postProcess.apply(result);
    }

    @Override
    public void close() {
      future.close();
    }
  }
}
