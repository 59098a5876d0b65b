package org.metalift.semantic.type;

/**
 * A structural type descriptor: a primitive, a parametric type, or a fixed-arity product.
 * Descriptors are immutable, acyclic and compared structurally.
 */
public interface Type
{
	String getName();

	default boolean isInteger()
	{
		return false;
	}

	default boolean isBoolean()
	{
		return false;
	}

	default boolean isTuple()
	{
		return false;
	}

	default boolean isGeneric()
	{
		return false;
	}
}
