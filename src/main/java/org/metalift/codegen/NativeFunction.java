package org.metalift.codegen;

/**
 * A callable compiled function. Arguments and result are the Java values of its descriptor's types.
 */
@FunctionalInterface
public interface NativeFunction
{
	Object invoke(Object... arguments);
}
