package org.jbridge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JObject;
import org.jbridge.lifecycle.VmOptions;
import org.jbridge.lifecycle.VmState;
import org.jbridge.reflect.JavaClassWrapper;
import org.jbridge.reflect.JavaProxy;
import org.jbridge.reflect.ProxyMethod;
import org.jbridge.util.JavaCalls;
import org.jbridge.util.JavaFutures.JavaFuture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class JavaBridgeTest {
  private JavaBridge bridge;

  @AfterEach
  void tearDown() {
    if (bridge != null) {
      bridge.kill();
    }
  }

  @Test
  void testHelloWorld() {
    bridge = BridgeTestSupport.startBridge();
    assertEquals(VmState.ACTIVE, bridge.state());
    BridgeEnv env = bridge.env();
    try (JObject hello = env.newStringUtf("Hello");
        JObject greeting =
            JavaCalls.makeInstance(env, "java.lang.StringBuilder", "(Ljava/lang/String;)V", hello)) {
      ((JObject) JavaCalls.call(
              env, greeting, "append", "(Ljava/lang/String;)Ljava/lang/StringBuilder;", ", world"))
          .close();
      assertEquals("Hello, world", JavaCalls.toString(env, greeting));
    }
  }

  @Test
  void testStartWithOptions() {
    bridge = BridgeTestSupport.newBridge();
    bridge.start(
        VmOptions.builder()
            .maxHeapSize("64m")
            .runHeadless(true)
            .arg("-Djbridge.test.flavor=plain")
            .build());
    assertEquals(
        "plain",
        JavaCalls.staticCall(
            bridge.env(),
            "java.lang.System",
            "getProperty",
            "(Ljava/lang/String;)Ljava/lang/String;",
            "jbridge.test.flavor"));
  }

  @Test
  void testRepeatedStartDoesNotAttachAgain() {
    bridge = BridgeTestSupport.startBridge();
    BridgeEnv env = bridge.env();
    bridge.start();
    assertEquals(VmState.ACTIVE, bridge.state());
    assertSame(env, bridge.env());

    bridge.detach();
    assertThrows(LifecycleException.class, bridge::env);
  }

  @Test
  void testWrapClass() {
    bridge = BridgeTestSupport.startBridge();
    try (JavaClassWrapper integer = bridge.wrapClass("java.lang.Integer")) {
      assertEquals(Integer.MAX_VALUE, integer.get("MAX_VALUE"));
      assertEquals(255, integer.invoke("parseInt", "ff", 16));
    }
  }

  @Test
  void testKillIsFinal() {
    bridge = BridgeTestSupport.startBridge();
    bridge.close();
    assertEquals(VmState.DESTROYED, bridge.state());
    assertThrows(LifecycleException.class, bridge::env);
    assertThrows(LifecycleException.class, bridge::start);
  }

  @Test
  void testExecuteRunnableInMainThread() throws Exception {
    bridge = BridgeTestSupport.startBridge();
    AtomicReference<String> ranOn = new AtomicReference<>();
    ProxyMethod run =
        (env, args) -> {
          ranOn.set(Thread.currentThread().getName());
          return null;
        };
    try (JavaProxy runnable = bridge.proxy(Map.of("run", run), "java.lang.Runnable")) {
      bridge.executeRunnableInMainThread(runnable.toJObject(), true);
    }
    assertEquals("JVMMonitor", ranOn.get());

    try (JObject thread = JavaCalls.makeInstance(bridge.env(), "java.lang.Thread", "()V")) {
      bridge.executeRunnableInMainThread(thread, true);
    }
  }

  @Test
  void testExecuteCallableInMainThread() throws Exception {
    bridge = BridgeTestSupport.startBridge();
    BridgeEnv env = bridge.env();
    try (JObject thread = JavaCalls.makeInstance(env, "java.lang.Thread", "()V");
        JObject callable =
            (JObject)
                JavaCalls.staticCall(
                    env,
                    "java.util.concurrent.Executors",
                    "callable",
                    "(Ljava/lang/Runnable;Ljava/lang/Object;)Ljava/util/concurrent/Callable;",
                    thread,
                    "done")) {
      assertEquals("done", bridge.executeCallableInMainThread(callable));
    }
  }

  @Test
  void testFutureInMainThread() throws Exception {
    bridge = BridgeTestSupport.startBridge();
    ProxyMethod call = (env, args) -> Thread.currentThread().getName();
    try (JavaProxy callable = bridge.proxy(Map.of("call", call), "java.util.concurrent.Callable");
        JavaFuture future = bridge.makeFutureTask(callable.toJObject())) {
      assertEquals("JVMMonitor", bridge.executeFutureInMainThread(future));
    }
  }

  @Test
  void testFutureUnwrapsExecutionException() throws Exception {
    bridge = BridgeTestSupport.startBridge();
    ProxyMethod call =
        (env, args) -> {
          throw new IllegalStateException("task failed");
        };
    try (JavaProxy callable = bridge.proxy(Map.of("call", call), "java.util.concurrent.Callable");
        JavaFuture future = bridge.makeFutureTask(callable.toJObject())) {
      JavaException e =
          assertThrows(JavaException.class, () -> bridge.executeFutureInMainThread(future));
      assertEquals("java.lang.Error", e.getClassName());
      assertTrue(e.getJavaMessage().contains("task failed"));
    }
  }

  @Test
  void testFuturePostProcessing() throws Exception {
    bridge = BridgeTestSupport.startBridge();
    try (JObject thread = JavaCalls.makeInstance(bridge.env(), "java.lang.Thread", "()V");
        JavaFuture future =
            bridge.makeFutureTask(thread, "finished", v -> v + "!")) {
      assertEquals("finished!", bridge.executeFutureInMainThread(future));
    }
  }

  @Test
  void testRunInMainThread() throws Exception {
    bridge = BridgeTestSupport.startBridge();
    String name = bridge.runInMainThread(() -> Thread.currentThread().getName(), true);
    assertEquals("JVMMonitor", name);
    assertNull(bridge.runInMainThread(() -> "ignored", false));
  }

  @Test
  void testWorkerThreadAttachment() throws Exception {
    bridge = BridgeTestSupport.startBridge();
    AtomicReference<Object> result = new AtomicReference<>();
    Thread worker =
        new Thread(
            () -> {
              BridgeEnv env = bridge.attach();
              try {
                result.set(
                    JavaCalls.staticCall(
                        env, "java.lang.Math", "addExact", "(II)I", 20, 22));
              } finally {
                bridge.detach();
              }
            });
    worker.start();
    worker.join();
    assertEquals(42, result.get());
  }
}
