package org.jbridge.env;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.jbridge.BridgeUsageException;
import org.junit.jupiter.api.Test;

class MethodSignatureTest {

  @Test
  void testParse() {
    MethodSignature sig = MethodSignature.parse("(Ljava/lang/String;I[J)Ljava/util/List;");
    assertEquals(List.of("Ljava/lang/String;", "I", "[J"), sig.parameters());
    assertEquals("Ljava/util/List;", sig.returnType());
    assertEquals(3, sig.arity());
    assertEquals('L', sig.returnCode());
    assertEquals("Ljava/lang/String;I[J", sig.parameterDescriptor());
  }

  @Test
  void testReturnCodes() {
    assertEquals('V', MethodSignature.parse("()V").returnCode());
    assertEquals('D', MethodSignature.parse("(I)D").returnCode());
    assertEquals('L', MethodSignature.parse("()[I").returnCode());
    assertEquals(0, MethodSignature.parse("()Z").arity());
  }

  @Test
  void testParsedSignaturesAreCached() {
    assertSame(MethodSignature.parse("(JJ)J"), MethodSignature.parse("(JJ)J"));
  }

  @Test
  void testBadSignatures() {
    for (String bad : new String[] {"I)V", "(I", "(I)", "(I)Q", "(I)VV", "(X)V"}) {
      assertThrows(BridgeUsageException.class, () -> MethodSignature.parse(bad), bad);
    }
  }
}
