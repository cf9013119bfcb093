package org.jbridge.env;

/** A host value that stands for a VM object and can be passed wherever an object is expected. */
public interface JObjectHolder {
  JObject toJObject();
}
