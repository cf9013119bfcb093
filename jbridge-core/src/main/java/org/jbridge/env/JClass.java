package org.jbridge.env;

/**
 * A reference to a {@code java.lang.Class} inside the VM, together with the class name it was
 * resolved under.
 */
public class JClass extends JObject {
  private final String name;

  JClass(long handle, Ownership ownership, ReferenceReclaimer reclaimer, String name) {
    super(handle, ownership, reclaimer);
    this.name = Signature.toDotted(name);
  }

  /** The binary name, dotted, as returned by {@code Class.getName()}. */
  public String name() {
    return name;
  }

  /** The slash-separated internal name, e.g. {@code java/lang/String}. */
  public String slashedName() {
    return Signature.toSlashed(name);
  }

  /** The type descriptor of this class, e.g. {@code Ljava/lang/String;} or {@code [I}. */
  public String signature() {
    return Signature.forClassName(name);
  }

  @Override
  public String toString() {
    return "JClass[" + name + (isReleased() ? ", released" : "") + "]";
  }
}
