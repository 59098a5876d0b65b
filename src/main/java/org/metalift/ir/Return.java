package org.metalift.ir;

import java.util.Objects;
import java.util.Optional;

public final class Return implements Stmt
{
	private final Expr value;

	public Return(Expr value)
	{
		this.value = value;
	}

	public static Return empty()
	{
		return new Return(null);
	}

	public Optional<Expr> getValue()
	{
		return Optional.ofNullable(value);
	}

	@Override
	public <R> R accept(IRVisitor<R> visitor)
	{
		return visitor.visitReturn(this);
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
		return Objects.equals(value, ((Return) o).value);
	}

	@Override
	public int hashCode()
	{
		return Objects.hashCode(value);
	}

	@Override
	public String toString()
	{
		return IRPrinter.print(this);
	}
}
