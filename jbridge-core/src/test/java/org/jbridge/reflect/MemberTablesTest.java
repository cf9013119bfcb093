package org.jbridge.reflect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.jbridge.BridgeTestSupport;
import org.jbridge.JavaBridge;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JClass;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MemberTablesTest {
  private final Logger logger = Logger.getLogger(MemberTables.class.getName());
  private final List<String> messages = new CopyOnWriteArrayList<>();
  private final Handler capture =
      new Handler() {
        @Override
        public void publish(LogRecord record) {
          messages.add(record.getMessage());
        }

        @Override
        public void flush() {}

        @Override
        public void close() {}
      };

  private Level previousLevel;
  private JavaBridge bridge;
  private BridgeEnv env;

  @BeforeEach
  void setUp() {
    previousLevel = logger.getLevel();
    logger.setLevel(Level.FINE);
    capture.setLevel(Level.ALL);
    logger.addHandler(capture);
    bridge = BridgeTestSupport.startBridge();
    env = bridge.env();
  }

  @AfterEach
  void tearDown() {
    logger.removeHandler(capture);
    logger.setLevel(previousLevel);
    bridge.kill();
  }

  @Test
  void testTableListsPublicMembers() {
    MemberTables tables = new MemberTables();
    try (JClass clazz = env.findClass(Overloads.class.getName())) {
      MemberTables.Table table = tables.forClass(env, clazz);
      assertEquals(3, table.staticMethods("f").size());
      assertEquals(3, table.constructors().size());
      assertTrue(table.methods("f").isEmpty());
      assertEquals("I", table.fields().get("width"));
      assertEquals("Ljava/lang/String;", table.staticFields().get("GREETING"));
      assertSame(table, tables.forClass(env, clazz));
    }
  }

  @Test
  void testEvictionIsLogged() {
    MemberTables tables = new MemberTables(1);
    try (JClass string = env.findClass("java.lang.String");
        JClass integer = env.findClass("java.lang.Integer")) {
      tables.forClass(env, string);
      tables.forClass(env, integer);
    }
    assertEquals(1, tables.size());
    assertTrue(tables.getStats().contains("evictions=1"), tables.getStats());
    assertTrue(messages.contains("Evicted member table for java.lang.String"), messages.toString());
  }
}
