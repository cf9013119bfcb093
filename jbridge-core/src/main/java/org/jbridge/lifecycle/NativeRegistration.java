package org.jbridge.lifecycle;

import org.jbridge.vm.NativeMethod;

/**
 * A host implementation bound to a native method of a VM class as soon as the VM is created.
 *
 * @param className dotted or slashed name of the class declaring the native method
 */
public record NativeRegistration(
    String className, String methodName, String signature, NativeMethod method) {}
