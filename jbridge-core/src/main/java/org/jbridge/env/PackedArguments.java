package org.jbridge.env;

import java.util.ArrayList;
import java.util.List;
import org.jbridge.vm.JValue;

/** Argument slots of one call, plus the temporary objects created to fill them. */
public final class PackedArguments implements AutoCloseable {
  private final JValue[] values;
  private final List<JObject> temporaries = new ArrayList<>(0);

  PackedArguments(int size) {
    this.values = new JValue[size];
  }

  void set(int index, JValue value) {
    values[index] = value;
  }

  void keep(JObject temporary) {
    temporaries.add(temporary);
  }

  public JValue[] values() {
    return values;
  }

  /** Release the temporaries. */
  @Override
  public void close() {
    for (JObject t : temporaries) {
      t.close();
    }
    temporaries.clear();
  }
}
