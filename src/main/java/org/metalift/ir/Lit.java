package org.metalift.ir;

import org.metalift.semantic.type.PrimitiveType;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A literal: a {@code Boolean} of type Bool, a {@code BigInteger} of type Int, or
 * {@code null} of type None. Booleans are kept apart from integers.
 */
public final class Lit implements Expr
{
	public static final Lit NONE = new Lit(null, PrimitiveType.NONE);
	public static final Lit TRUE = new Lit(Boolean.TRUE, PrimitiveType.BOOL);
	public static final Lit FALSE = new Lit(Boolean.FALSE, PrimitiveType.BOOL);

	private final Object value;
	private final PrimitiveType type;

	private Lit(Object value, PrimitiveType type)
	{
		this.value = value;
		this.type = type;
	}

	public static Lit of(BigInteger value)
	{
		return new Lit(Objects.requireNonNull(value, "value"), PrimitiveType.INT);
	}

	public static Lit of(long value)
	{
		return of(BigInteger.valueOf(value));
	}

	public static Lit of(boolean value)
	{
		return value ? TRUE : FALSE;
	}

	public Object getValue()
	{
		return value;
	}

	public PrimitiveType getType()
	{
		return type;
	}

	@Override
	public <R> R accept(IRVisitor<R> visitor)
	{
		return visitor.visitLit(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		Lit lit = (Lit) o;
		return Objects.equals(value, lit.value) && type.equals(lit.type);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(value, type);
	}

	@Override
	public String toString()
	{
		return IRPrinter.print(this);
	}
}
