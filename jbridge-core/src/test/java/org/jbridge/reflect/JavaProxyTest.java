package org.jbridge.reflect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.jbridge.BridgeTestSupport;
import org.jbridge.JavaBridge;
import org.jbridge.JavaException;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JObject;
import org.jbridge.util.JavaCalls;
import org.jbridge.util.JavaCollections;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JavaProxyTest {
  private JavaBridge bridge;
  private BridgeEnv env;

  @BeforeEach
  void setUp() {
    bridge = BridgeTestSupport.startBridge();
    env = bridge.env();
  }

  @AfterEach
  void tearDown() {
    bridge.kill();
  }

  @Test
  void testRunnable() {
    AtomicInteger runs = new AtomicInteger();
    Map<String, ProxyMethod> methods =
        Map.of(
            "run",
            (callbackEnv, args) -> {
              runs.incrementAndGet();
              return null;
            });
    try (JavaProxy runnable = bridge.proxy(methods, "java.lang.Runnable")) {
      JavaCalls.call(env, runnable.toJObject(), "run", "()V");
      JavaCalls.call(env, runnable.toJObject(), "run", "()V");
      assertEquals(2, runs.get());
      assertEquals(1, bridge.hostReferences().size());
    }
    assertEquals(0, bridge.hostReferences().size());
  }

  @Test
  void testCallableResult() {
    Map<String, ProxyMethod> methods = Map.of("call", (callbackEnv, args) -> "hi");
    try (JavaProxy callable = bridge.proxy(methods, "java.util.concurrent.Callable")) {
      assertEquals(
          "hi", JavaCalls.call(env, callable.toJObject(), "call", "()Ljava/lang/Object;"));
    }
  }

  @Test
  void testArgumentsArriveAsVmObjects() {
    Map<String, ProxyMethod> methods =
        Map.of(
            "apply",
            (callbackEnv, args) -> callbackEnv.getStringUtf(args[0]).toUpperCase() + "!");
    try (JavaProxy function = bridge.proxy(methods, "java.util.function.Function")) {
      assertEquals(
          "ABC!",
          JavaCalls.call(
              env,
              function.toJObject(),
              "apply",
              "(Ljava/lang/Object;)Ljava/lang/Object;",
              "abc"));
    }
  }

  @Test
  void testProxyUsedByJavaCode() {
    // Longest first
    ProxyMethod compare =
        (callbackEnv, args) ->
            callbackEnv.getStringLength(args[1]) - callbackEnv.getStringLength(args[0]);
    try (JavaProxy comparator = bridge.proxy(Map.of("compare", compare), "java.util.Comparator");
        JObject list = JavaCollections.makeList(env, List.of("bb", "a", "dddd", "ccc"))) {
      JavaCalls.staticCall(
          env,
          "java.util.Collections",
          "sort",
          "(Ljava/util/List;Ljava/util/Comparator;)V",
          list,
          comparator);
      assertEquals("[dddd, ccc, bb, a]", JavaCalls.toString(env, list));
    }
  }

  @Test
  void testHostExceptionBecomesJavaError() {
    Map<String, ProxyMethod> methods =
        Map.of(
            "run",
            (callbackEnv, args) -> {
              throw new IllegalStateException("boom");
            });
    try (JavaProxy runnable = bridge.proxy(methods, "java.lang.Runnable")) {
      JavaException e =
          assertThrows(
              JavaException.class, () -> JavaCalls.call(env, runnable.toJObject(), "run", "()V"));
      assertEquals("java.lang.Error", e.getClassName());
      assertTrue(e.getJavaMessage().startsWith("Host exception: "), e.getJavaMessage());
      assertTrue(e.getJavaMessage().contains("boom"));
    }
  }

  @Test
  void testUnimplementedMethod() {
    try (JavaProxy iterator = bridge.proxy(Map.of(), "java.util.Iterator")) {
      JavaException e =
          assertThrows(
              JavaException.class,
              () -> JavaCalls.call(env, iterator.toJObject(), "hasNext", "()Z"));
      assertEquals("java.lang.Error", e.getClassName());
      assertTrue(e.getJavaMessage().contains("does not implement hasNext"));
    }
  }

  @Test
  void testObjectMethodsAnsweredLocally() {
    try (JavaProxy runnable = bridge.proxy(Map.of(), "java.lang.Runnable")) {
      assertEquals(
          "HostProxy[" + runnable.id() + "]", JavaCalls.toString(env, runnable.toJObject()));
      assertEquals(
          Long.hashCode(runnable.id()),
          JavaCalls.call(env, runnable.toJObject(), "hashCode", "()I"));
      assertTrue(JavaCalls.isInstanceOf(env, runnable.toJObject(), "java.lang.reflect.Proxy"));
    }
  }

  @Test
  void testClosedProxyFails() {
    JavaProxy runnable =
        bridge.proxy(Map.of("run", (callbackEnv, args) -> null), "java.lang.Runnable");
    try (JObject kept = env.newGlobalRef(runnable.toJObject())) {
      runnable.close();
      JavaException e =
          assertThrows(JavaException.class, () -> JavaCalls.call(env, kept, "run", "()V"));
      assertEquals("java.lang.Error", e.getClassName());
    }
  }

  @Test
  void testSeveralInterfaces() {
    Map<String, ProxyMethod> methods =
        Map.of("run", (callbackEnv, args) -> null, "call", (callbackEnv, args) -> 7);
    try (JavaProxy both =
        bridge.proxy(methods, "java.lang.Runnable", "java.util.concurrent.Callable")) {
      assertEquals(
          List.of("java.lang.Runnable", "java.util.concurrent.Callable"), both.interfaceNames());
      assertEquals(7, JavaCalls.call(env, both.toJObject(), "call", "()Ljava/lang/Object;"));
      assertThrows(IllegalArgumentException.class, () -> bridge.proxy(methods));
    }
  }
}
