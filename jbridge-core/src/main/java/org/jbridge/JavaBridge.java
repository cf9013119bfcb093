package org.jbridge;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.logging.Logger;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JObject;
import org.jbridge.lifecycle.VmController;
import org.jbridge.lifecycle.VmOptions;
import org.jbridge.lifecycle.VmState;
import org.jbridge.reflect.HostReferences;
import org.jbridge.reflect.JavaClassWrapper;
import org.jbridge.reflect.JavaProxy;
import org.jbridge.reflect.JavaWrapper;
import org.jbridge.reflect.MemberTables;
import org.jbridge.reflect.ProxyDispatcher;
import org.jbridge.reflect.ProxyMethod;
import org.jbridge.util.JavaCalls;
import org.jbridge.util.JavaFutures;
import org.jbridge.util.JavaFutures.JavaFuture;
import org.jbridge.util.NiceValues;
import org.jbridge.vm.DefaultVmLocator;
import org.jbridge.vm.NativeVmLauncher;
import org.jbridge.vm.VmLocator;
import org.jbridge.vm.inprocess.InProcessVmLauncher;

/**
 * Entry point of the bridge: one embedded VM and everything needed to talk to it.
 *
 * <p>Typical use:
 *
 * <pre>{@code
 * try (JavaBridge bridge = new JavaBridge()) {
 *   bridge.start(VmOptions.builder().classPath(List.of("app.jar")).build());
 *   BridgeEnv env = bridge.env();
 *   JavaClassWrapper integer = bridge.wrapClass("java.lang.Integer");
 *   Object max = integer.get("MAX_VALUE");
 * }
 * }</pre>
 *
 * <p>The thread that starts the VM is attached for it. Other threads call {@link #attach()} before
 * using the bridge and {@link #detach()} when done.
 */
public final class JavaBridge implements AutoCloseable {
  private static final Logger LOG = Logger.getLogger(JavaBridge.class.getName());

  private final VmController controller;
  private final HostReferences hostReferences = new HostReferences();
  private final MemberTables memberTables = new MemberTables();

  /** A bridge over the VM found in {@code java.home} or {@code JAVA_HOME}, hosted in process. */
  public JavaBridge() {
    this(new DefaultVmLocator(), new InProcessVmLauncher());
  }

  public JavaBridge(VmLocator locator, NativeVmLauncher launcher) {
    this.controller = new VmController(locator, launcher);
    controller.registry().setArgumentBoxer(NiceValues.BOXER);
    controller.addNativeRegistration(
        new ProxyDispatcher(controller.registry(), hostReferences).registration());
    controller.addShutdownHook(memberTables::clear);
  }

  // ========== LIFECYCLE ==========

  /** Start the VM and attach the calling thread. Does nothing when the VM is already running. */
  public void start(VmOptions options) {
    if (controller.state() == VmState.ACTIVE) {
      return;
    }
    controller.start(options);
    // The starting thread gets its own attachment; the monitor keeps the creator's
    controller.attach();
  }

  public void start() {
    start(VmOptions.defaults());
  }

  /** Shut the VM down. It cannot be started again. */
  public void kill() {
    if (hostReferences.size() > 0) {
      LOG.fine(hostReferences.size() + " proxies still registered at shutdown");
    }
    controller.kill();
  }

  @Override
  public void close() {
    kill();
  }

  public VmState state() {
    return controller.state();
  }

  public VmController controller() {
    return controller;
  }

  // ========== THREADS ==========

  public BridgeEnv attach() {
    return controller.attach();
  }

  public void detach() {
    controller.detach();
  }

  /**
   * The calling thread's environment.
   *
   * @throws LifecycleException when the thread is not attached
   */
  public BridgeEnv env() {
    return controller.registry().requireCurrent();
  }

  // ========== REFLECTION ==========

  public JavaWrapper wrap(JObject obj) {
    return new JavaWrapper(env(), memberTables, obj);
  }

  public JavaClassWrapper wrapClass(String className) {
    return new JavaClassWrapper(env(), memberTables, className);
  }

  /** Implement {@code interfaceNames} with the host methods in {@code methods}, keyed by name. */
  public JavaProxy proxy(Map<String, ProxyMethod> methods, String... interfaceNames) {
    return new JavaProxy(env(), hostReferences, methods, Arrays.asList(interfaceNames));
  }

  public HostReferences hostReferences() {
    return hostReferences;
  }

  // ========== MAIN THREAD ==========

  /** See {@link VmController#runInMainThread}. */
  public <T> T runInMainThread(Callable<T> closure, boolean synchronous) throws Exception {
    return controller.runInMainThread(closure, synchronous);
  }

  /** Run a VM {@code java.lang.Runnable} on the main thread. */
  public void executeRunnableInMainThread(JObject runnable, boolean synchronous)
      throws InterruptedException {
    runUnchecked(() -> JavaCalls.call(mainEnv(), runnable, "run", "()V"), synchronous);
  }

  /** Run a VM {@code java.util.concurrent.Callable} on the main thread and return its result. */
  public Object executeCallableInMainThread(JObject callable) throws InterruptedException {
    return runUnchecked(
        () -> JavaCalls.call(mainEnv(), callable, "call", "()Ljava/lang/Object;"), true);
  }

  /** Run a future's task on the main thread, then wait for its result on this one. */
  public Object executeFutureInMainThread(JavaFuture future) throws InterruptedException {
    runUnchecked(
        () -> {
          future.run(mainEnv());
          return null;
        },
        true);
    return future.get(env());
  }

  public JavaFuture makeFutureTask(
      JObject runnableOrCallable, Object result, Function<Object, Object> postProcess) {
    return JavaFutures.makeFutureTask(env(), runnableOrCallable, result, postProcess);
  }

  public JavaFuture makeFutureTask(JObject runnableOrCallable) {
    return JavaFutures.makeFutureTask(env(), runnableOrCallable);
  }

  private BridgeEnv mainEnv() {
    return controller.registry().requireCurrent();
  }

  private <T> T runUnchecked(Callable<T> closure, boolean synchronous)
      throws InterruptedException {
    try {
      return controller.runInMainThread(closure, synchronous);
    } catch (RuntimeException | InterruptedException e) {
      throw e;
    } catch (Exception e) {
      throw new IllegalStateException("Main thread closure failed", e);
    }
  }

  @Override
  public String toString() {
    return "JavaBridge[" + controller.state().displayName() + "]";
  }
}
