package org.jbridge.reflect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.jbridge.BridgeTestSupport;
import org.jbridge.BridgeTypeException;
import org.jbridge.JavaBridge;
import org.jbridge.NoSuchAttributeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JavaWrapperTest {
  private JavaBridge bridge;

  @BeforeEach
  void setUp() {
    bridge = BridgeTestSupport.startBridge();
  }

  @AfterEach
  void tearDown() {
    bridge.kill();
  }

  @Test
  void testArrayList() {
    try (JavaClassWrapper arrayList = bridge.wrapClass("java.util.ArrayList");
        JavaWrapper list = arrayList.newInstance()) {
      assertEquals("java.util.ArrayList", list.className());
      assertEquals(true, list.invoke("add", "a"));
      assertEquals(true, list.invoke("add", 2));
      list.invoke("add", 0, "first");
      assertEquals(3, list.invoke("size"));
      assertEquals("first", list.invoke("get", 0));
      assertEquals(2, list.invoke("get", 2));
      assertEquals("[first, a, 2]", list.toString());
      assertThrows(NoSuchAttributeException.class, () -> list.invoke("nope"));
    }
  }

  @Test
  void testObjectResultsAreWrapped() {
    try (JavaClassWrapper arrayList = bridge.wrapClass("java.util.ArrayList");
        JavaWrapper list = arrayList.newInstance()) {
      list.invoke("add", "x");
      Object iterator = list.invoke("iterator");
      assertInstanceOf(JavaWrapper.class, iterator);
      try (JavaWrapper it = (JavaWrapper) iterator) {
        assertEquals(true, it.invoke("hasNext"));
        assertEquals("x", it.invoke("next"));
        assertEquals(false, it.invoke("hasNext"));
      }
    }
  }

  @Test
  void testConstructorsAndFields() {
    try (JavaClassWrapper cls = bridge.wrapClass(Overloads.class.getName());
        JavaWrapper plain = cls.newInstance();
        JavaWrapper wide = cls.newInstance(4);
        JavaWrapper named = cls.newInstance("named")) {
      assertEquals("none:0", plain.invoke("describe"));
      assertEquals("none:4", wide.invoke("describe"));
      assertEquals("named:0", named.invoke("describe"));

      wide.set("width", 7);
      wide.set("label", "box");
      assertEquals(7, wide.get("width"));
      assertEquals("box", wide.get("label"));
      assertEquals(21L, wide.invoke("area", 3));
      assertTrue(wide.fieldNames().containsAll(List.of("width", "label")));

      wide.set("label", null);
      assertEquals(null, wide.get("label"));
    }
  }

  @Test
  void testFieldTypeIsChecked() {
    try (JavaClassWrapper cls = bridge.wrapClass(Overloads.class.getName());
        JavaWrapper obj = cls.newInstance()) {
      assertThrows(BridgeTypeException.class, () -> obj.set("width", "wide"));
      BridgeTypeException e =
          assertThrows(BridgeTypeException.class, () -> obj.set("width", null));
      assertEquals("Can't cast null to a primitive type", e.getMessage());
    }
  }

  @Test
  void testStaticMembersOnlyThroughTheClass() {
    try (JavaClassWrapper cls = bridge.wrapClass(Overloads.class.getName());
        JavaWrapper obj = cls.newInstance()) {
      assertThrows(NoSuchAttributeException.class, () -> obj.get("counter"));
      assertThrows(NoSuchAttributeException.class, () -> obj.invoke("h", 1));
      assertThrows(NoSuchAttributeException.class, () -> cls.get("width"));
      assertThrows(NoSuchAttributeException.class, () -> cls.invoke("describe"));

      assertEquals("hello", cls.get("GREETING"));
      cls.set("counter", 5);
      assertEquals(5, cls.get("counter"));
      cls.set("counter", 0);
      assertTrue(cls.fieldNames().contains("counter"));
    }
  }

  @Test
  void testNoMatchingConstructor() {
    try (JavaClassWrapper cls = bridge.wrapClass(Overloads.class.getName())) {
      BridgeTypeException e =
          assertThrows(BridgeTypeException.class, () -> cls.newInstance(1, 2));
      assertEquals("No matching constructor found", e.getMessage());
    }
  }

  @Test
  void testOverloadsAreListed() {
    try (JavaClassWrapper cls = bridge.wrapClass(Overloads.class.getName());
        JavaWrapper obj = cls.newInstance()) {
      List<OverloadDescriptor> area = obj.overloads("area");
      assertEquals(1, area.size());
      assertEquals("(J)J", area.get(0).signature());
      assertEquals("area(J)J", area.get(0).toString());
      assertTrue(obj.methodNames().contains("describe"));
    }
  }

  @Test
  void testMemberTablesAreCached() {
    try (JavaClassWrapper first = bridge.wrapClass("java.lang.StringBuilder");
        JavaClassWrapper second = bridge.wrapClass("java/lang/StringBuilder");
        JavaWrapper sb = first.newInstance("abc")) {
      assertEquals(first.className(), second.className());
      try (JavaWrapper reversed = (JavaWrapper) sb.invoke("reverse")) {
        assertEquals("cba", reversed.toString());
      }
      assertEquals("cba", sb.toString());
    }
  }
}
