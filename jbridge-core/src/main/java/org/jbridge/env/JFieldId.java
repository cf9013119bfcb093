package org.jbridge.env;

/** A resolved field, static or not according to the lookup that produced it. */
public record JFieldId(long id, String name, String signature, boolean isStatic) {}
