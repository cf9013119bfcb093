package org.jbridge.lifecycle;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jbridge.BridgeLimits;
import org.jbridge.BridgeSetupException;
import org.jbridge.LifecycleException;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.DeadObjectQueue;
import org.jbridge.env.EnvironmentRegistry;
import org.jbridge.env.JClass;
import org.jbridge.observability.BridgeEvents;
import org.jbridge.observability.BridgeLogger;
import org.jbridge.observability.Metrics;
import org.jbridge.vm.Jni;
import org.jbridge.vm.NativeVm;
import org.jbridge.vm.NativeVmException;
import org.jbridge.vm.NativeVmLauncher;
import org.jbridge.vm.VmLocator;

/**
 * Owns one VM from creation to destruction.
 *
 * <p>The VM is created on a dedicated monitor thread, which stays attached for the lifetime of
 * the VM. Each time it is woken the monitor drains the dead object queue, runs the closures
 * queued by {@link #runInMainThread} in submission order, and checks whether it should exit. On
 * exit it destroys the VM. A VM cannot be started again once destroyed.
 *
 * <p>Lifecycle transitions are serialized by a lock, so concurrent {@link #start} and {@link
 * #kill} calls are safe.
 */
public final class VmController {
  private static final Logger LOG = Logger.getLogger(VmController.class.getName());

  static final String MONITOR_THREAD_NAME = "JVMMonitor";

  private final VmLocator locator;
  private final NativeVmLauncher launcher;
  private final WakeEvent wake = new WakeEvent();
  private final DeadObjectQueue deadObjects = new DeadObjectQueue(wake::set);
  private final EnvironmentRegistry registry = new EnvironmentRegistry(deadObjects);
  private final ConcurrentLinkedQueue<MainThreadClosure<?>> closures =
      new ConcurrentLinkedQueue<>();
  private final List<NativeRegistration> natives = new CopyOnWriteArrayList<>();
  private final List<Runnable> shutdownHooks = new CopyOnWriteArrayList<>();
  private final ReentrantLock lifecycleLock = new ReentrantLock();

  private volatile VmState state = VmState.UNINITIALIZED;
  private volatile boolean kill;
  private volatile NativeVm vm;
  private volatile Thread monitor;
  private volatile BridgeSetupException startupFailure;
  private CountDownLatch started;
  private CountDownLatch dead;

  public VmController(VmLocator locator, NativeVmLauncher launcher) {
    this.locator = locator;
    this.launcher = launcher;
  }

  // ========== CONFIGURATION ==========

  /** Bind a native method right after the VM is created. Takes effect on the next start. */
  public void addNativeRegistration(NativeRegistration registration) {
    natives.add(registration);
  }

  /** Run before shutdown, while the VM is still usable. */
  public void addShutdownHook(Runnable hook) {
    shutdownHooks.add(hook);
  }

  public EnvironmentRegistry registry() {
    return registry;
  }

  public DeadObjectQueue deadObjects() {
    return deadObjects;
  }

  public VmState state() {
    return state;
  }

  public boolean isActive() {
    return state == VmState.ACTIVE;
  }

  /** The running VM, or null. */
  public NativeVm vm() {
    return vm;
  }

  // ========== START ==========

  /**
   * Create the VM and wait until it is ready. Does nothing when the VM is already active.
   *
   * @throws LifecycleException when the VM was already shut down
   * @throws BridgeSetupException when the VM cannot be located or created
   */
  public void start(VmOptions options) {
    lifecycleLock.lock();
    try {
      switch (state) {
        case ACTIVE:
          return;
        case SHUTTING_DOWN:
        case DESTROYED:
          throw new LifecycleException("The VM has been shut down and cannot be restarted");
        default:
          break;
      }
      transition(VmState.STARTING, Jni.JNI_OK);

      // --- 1. LOCATE ---
      Path library;
      List<String> optionStrings;
      try {
        library = locator.locateLibrary();
        optionStrings = options.toOptionStrings(locator);
      } catch (RuntimeException e) {
        transition(VmState.UNINITIALIZED, Jni.JNI_ERR);
        throw e;
      }
      LOG.info("Starting VM from " + library + " with options " + optionStrings);
      LOG.fine(BridgeLimits.getSummary());

      // --- 2. CREATE ON THE MONITOR THREAD ---
      kill = false;
      startupFailure = null;
      started = new CountDownLatch(1);
      dead = new CountDownLatch(1);
      Thread thread = new Thread(() -> monitorLoop(library, optionStrings), MONITOR_THREAD_NAME);
      thread.setDaemon(true);
      monitor = thread;
      thread.start();
      awaitUninterruptibly(started);

      if (startupFailure != null) {
        joinUninterruptibly(thread);
        monitor = null;
        transition(VmState.UNINITIALIZED, startupFailure.getReturnCode());
        throw startupFailure;
      }
      transition(VmState.ACTIVE, Jni.JNI_OK);
    } finally {
      lifecycleLock.unlock();
    }
  }

  private void monitorLoop(Path library, List<String> optionStrings) {
    BridgeEnv env;
    try {
      NativeVmLauncher.CreatedVm created = launcher.createJavaVm(library, optionStrings);
      vm = created.vm();
      registry.bind(vm);
      env = registry.bindCreator(created.env());
      for (NativeRegistration r : natives) {
        try (JClass owner = env.findClass(r.className())) {
          env.registerNative(owner, r.methodName(), r.signature(), r.method());
        }
      }
    } catch (NativeVmException e) {
      startupFailure =
          new BridgeSetupException(
              "Failed to create Java VM. Return code = " + e.getReturnCode(), e.getReturnCode());
      LOG.log(Level.SEVERE, startupFailure.getMessage(), e);
      abandonStartup();
      return;
    } catch (RuntimeException e) {
      startupFailure = new BridgeSetupException("Failed to initialize Java VM: " + e, e);
      LOG.log(Level.SEVERE, startupFailure.getMessage(), e);
      abandonStartup();
      return;
    }
    started.countDown();

    try {
      while (true) {
        wake.await();
        deadObjects.reap(env);
        runClosures();
        if (kill) break;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warning("Monitor thread interrupted; shutting the VM down");
    } finally {
      try {
        deadObjects.reap(env);
      } catch (RuntimeException e) {
        LOG.log(Level.WARNING, "Final reap failed", e);
      }
      failPendingClosures();
      registry.unbind();
      int rc = vm.destroyJavaVm();
      if (rc != Jni.JNI_OK) {
        LOG.warning("DestroyJavaVM returned " + Jni.describe(rc));
      }
      vm = null;
      dead.countDown();
    }
  }

  private void abandonStartup() {
    if (vm != null) {
      registry.unbind();
      vm.destroyJavaVm();
      vm = null;
    }
    started.countDown();
    dead.countDown();
  }

  // ========== MAIN THREAD ==========

  /**
   * Run {@code closure} on the monitor thread, inline when already on it.
   *
   * @param synchronous wait for the closure and return its result, rethrowing what it throws;
   *     otherwise return null at once
   */
  public <T> T runInMainThread(Callable<T> closure, boolean synchronous) throws Exception {
    if (Thread.currentThread() == monitor) {
      return runInline(closure);
    }
    if (state != VmState.ACTIVE) {
      throw new LifecycleException("The VM is not running (state=" + state.displayName() + ")");
    }
    return enqueue(closure, synchronous);
  }

  /** Queue {@code closure} for the monitor thread without checking the state first. */
  <T> T enqueue(Callable<T> closure, boolean synchronous) throws Exception {
    MainThreadClosure<T> queued = new MainThreadClosure<>(closure, synchronous);
    closures.add(queued);
    // The monitor may have made its final drain before the add
    if (kill && closures.remove(queued)) {
      queued.fail(new LifecycleException("The VM shut down before the closure ran"));
    } else {
      wake.set();
    }
    if (!synchronous) {
      return null;
    }
    queued.done.await();
    return queued.result();
  }

  private static <T> T runInline(Callable<T> closure) throws Exception {
    BridgeEvents.MainThreadClosureEvent event = BridgeEvents.beginClosure(true);
    boolean success = false;
    try {
      T result = closure.call();
      success = true;
      return result;
    } finally {
      BridgeEvents.endClosure(event, success);
      Metrics.getInstance().recordClosure();
    }
  }

  private void runClosures() {
    MainThreadClosure<?> closure;
    while ((closure = closures.poll()) != null) {
      closure.run();
    }
  }

  private void failPendingClosures() {
    MainThreadClosure<?> closure;
    while ((closure = closures.poll()) != null) {
      closure.fail(new LifecycleException("The VM shut down before the closure ran"));
    }
  }

  private static final class MainThreadClosure<T> {
    private final Callable<T> callable;
    private final boolean synchronous;
    private final CountDownLatch done = new CountDownLatch(1);
    private T value;
    private Throwable failure;

    MainThreadClosure(Callable<T> callable, boolean synchronous) {
      this.callable = callable;
      this.synchronous = synchronous;
    }

    void run() {
      BridgeEvents.MainThreadClosureEvent event = BridgeEvents.beginClosure(synchronous);
      try {
        value = callable.call();
      } catch (Exception | Error e) {
        failure = e;
        if (!synchronous) {
          LOG.log(Level.WARNING, "Closure run in main thread failed", e);
        }
      } finally {
        BridgeEvents.endClosure(event, failure == null);
        Metrics.getInstance().recordClosure();
        done.countDown();
      }
    }

    void fail(Throwable t) {
      failure = t;
      done.countDown();
    }

    T result() throws Exception {
      if (failure instanceof Exception e) throw e;
      if (failure instanceof Error e) throw e;
      return value;
    }
  }

  // ========== THREADS ==========

  /** Attach the calling thread; see {@link EnvironmentRegistry#attach()}. */
  public BridgeEnv attach() {
    return registry.attach();
  }

  public void detach() {
    registry.detach();
  }

  // ========== SHUTDOWN ==========

  /**
   * Shut the VM down and wait for the monitor thread to finish. A no-op when the VM was never
   * started or is already destroyed.
   *
   * @throws LifecycleException when called from the monitor thread
   */
  public void kill() {
    lifecycleLock.lock();
    try {
      if (state == VmState.UNINITIALIZED || state == VmState.DESTROYED) {
        return;
      }
      if (Thread.currentThread() == monitor) {
        throw new LifecycleException("kill() cannot be called from the monitor thread");
      }
      transition(VmState.SHUTTING_DOWN, Jni.JNI_OK);

      // --- 1. LET DEPENDENTS LET GO ---
      for (Runnable hook : shutdownHooks) {
        try {
          hook.run();
        } catch (RuntimeException e) {
          LOG.log(Level.WARNING, "Shutdown hook failed", e);
        }
      }

      // --- 2. FLUSH UNREACHABLE HANDLES INTO THE DEAD QUEUE ---
      System.gc();

      // --- 3. DETACH THIS THREAD, STOP THE MONITOR ---
      registry.detachAll();
      kill = true;
      wake.set();
      awaitUninterruptibly(dead);
      joinUninterruptibly(monitor);
      monitor = null;

      transition(VmState.DESTROYED, Jni.JNI_OK);
      BridgeLogger.dumpMetrics();
    } finally {
      lifecycleLock.unlock();
    }
  }

  private void transition(VmState to, int returnCode) {
    VmState from = state;
    state = to;
    BridgeLogger.logLifecycle(from.displayName(), to.displayName(), null);
    BridgeEvents.emitLifecycle(from.displayName(), to.displayName(), returnCode);
  }

  private static void awaitUninterruptibly(CountDownLatch latch) {
    boolean interrupted = false;
    while (true) {
      try {
        latch.await();
        break;
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private static void joinUninterruptibly(Thread thread) {
    boolean interrupted = false;
    while (true) {
      try {
        thread.join();
        break;
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public String toString() {
    return "VmController[" + state.displayName() + "]";
  }
}
