package org.jbridge.vm.inprocess;

import java.util.ArrayList;
import java.util.List;

/** Splitting of method descriptors on the VM side. */
final class Descriptors {
  private Descriptors() {}

  /** The parameter type descriptors of a method descriptor. */
  static List<String> parameterTypes(String sig) {
    List<String> types = new ArrayList<>();
    int i = sig.indexOf('(') + 1;
    int end = sig.indexOf(')');
    while (i < end) {
      int start = i;
      while (sig.charAt(i) == '[') i++;
      if (sig.charAt(i) == 'L') {
        i = sig.indexOf(';', i);
      }
      i++;
      types.add(sig.substring(start, i));
    }
    return types;
  }

  /** The return type descriptor of a method descriptor. */
  static String returnType(String sig) {
    return sig.substring(sig.indexOf(')') + 1);
  }
}
