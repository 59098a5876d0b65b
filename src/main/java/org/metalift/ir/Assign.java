package org.metalift.ir;

import java.util.Objects;

/**
 * {@code target = value}. The target is a reference to an already registered Var.
 */
public final class Assign implements Stmt
{
	private final Var target;
	private final Expr value;

	public Assign(Var target, Expr value)
	{
		this.target = Objects.requireNonNull(target, "target");
		this.value = Objects.requireNonNull(value, "value");
	}

	public Var getTarget()
	{
		return target;
	}

	public Expr getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(IRVisitor<R> visitor)
	{
		return visitor.visitAssign(this);
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
		Assign assign = (Assign) o;
		return target.equals(assign.target) && value.equals(assign.value);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(target, value);
	}

	@Override
	public String toString()
	{
		return IRPrinter.print(this);
	}
}
