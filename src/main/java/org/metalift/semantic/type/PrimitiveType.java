package org.metalift.semantic.type;

import java.math.BigInteger;

public final class PrimitiveType implements Type
{
	// --- Canonical Type Instances ---
	public static final PrimitiveType INT = new PrimitiveType("Int");
	public static final PrimitiveType BOOL = new PrimitiveType("Bool");
	public static final PrimitiveType NONE = new PrimitiveType("None");

	// --- Signed 32-bit range of INT ---
	public static final int MIN_INT = Integer.MIN_VALUE;
	public static final int MAX_INT = Integer.MAX_VALUE;
	public static final BigInteger MIN_INT_VALUE = BigInteger.valueOf(MIN_INT);
	public static final BigInteger MAX_INT_VALUE = BigInteger.valueOf(MAX_INT);

	private final String name;

	private PrimitiveType(String name)
	{
		this.name = name;
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public boolean isInteger()
	{
		return this == INT;
	}

	@Override
	public boolean isBoolean()
	{
		return this == BOOL;
	}

	@Override
	public String toString()
	{
		return name;
	}
}
