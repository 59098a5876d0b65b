package org.metalift.ir;

import java.util.Objects;

/**
 * A starred argument, expanded in place at the call site.
 */
public final class Unpack implements Expr
{
	private final Expr value;

	public Unpack(Expr value)
	{
		this.value = Objects.requireNonNull(value, "value");
	}

	public Expr getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(IRVisitor<R> visitor)
	{
		return visitor.visitUnpack(this);
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
		return value.equals(((Unpack) o).value);
	}

	@Override
	public int hashCode()
	{
		return value.hashCode();
	}

	@Override
	public String toString()
	{
		return IRPrinter.print(this);
	}
}
