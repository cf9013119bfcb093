package org.jbridge.env;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.jbridge.BridgeTestSupport;
import org.jbridge.JavaBridge;
import org.jbridge.LifecycleException;
import org.jbridge.vm.inprocess.InProcessVm;
import org.jbridge.vm.inprocess.InProcessVmLauncher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EnvironmentRegistryTest {
  private JavaBridge bridge;
  private EnvironmentRegistry registry;
  private ExecutorService worker;

  @BeforeEach
  void setUp() {
    bridge = BridgeTestSupport.startBridge();
    registry = bridge.controller().registry();
    worker = Executors.newSingleThreadExecutor();
  }

  @AfterEach
  void tearDown() {
    worker.shutdownNow();
    bridge.kill();
  }

  @Test
  void testAttachIsCounted() throws Exception {
    InProcessVm vm = InProcessVmLauncher.liveVm();
    int attachedBefore = vm.attachedThreadCount();
    worker
        .submit(
            () -> {
              assertNull(registry.current());
              BridgeEnv first = registry.attach();
              BridgeEnv second = registry.attach();
              BridgeEnv third = registry.attach();
              assertSame(first, second);
              assertSame(first, third);
              assertEquals(3, registry.attachCount());
              assertEquals(attachedBefore + 1, vm.attachedThreadCount());

              registry.detach();
              registry.detach();
              assertNotNull(registry.current());
              registry.detach();
              assertNull(registry.current());
              assertEquals(attachedBefore, vm.attachedThreadCount());

              assertThrows(LifecycleException.class, registry::detach);
              return null;
            })
        .get();
  }

  @Test
  void testAttachedThreadCanCall() throws Exception {
    String result =
        worker
            .submit(
                () -> {
                  BridgeEnv env = bridge.attach();
                  try (JObject s = env.newStringUtf("from a worker")) {
                    return env.getStringUtf(s);
                  } finally {
                    bridge.detach();
                  }
                })
            .get();
    assertEquals("from a worker", result);
  }

  @Test
  void testUnattachedThreadHasNoEnvironment() throws Exception {
    worker
        .submit(
            () -> {
              assertNull(registry.current());
              assertThrows(LifecycleException.class, bridge::env);
              return null;
            })
        .get();
  }

  @Test
  void testEnterAndExitRestoreTheThreadEnvironment() {
    BridgeEnv own = registry.current();
    BridgeEnv callback = registry.enter(own.nativeEnv());
    assertSame(callback, registry.current());
    registry.exit();
    assertSame(own, registry.current());
    assertThrows(LifecycleException.class, registry::exit);
  }

  @Test
  void testNoEnvironmentAfterKill() {
    bridge.kill();
    assertNull(registry.current());
    assertThrows(LifecycleException.class, registry::attach);
  }
}
