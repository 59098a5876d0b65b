package org.metalift.ir;

import java.util.Objects;

/**
 * Attribute access {@code target.name}. The attribute is kept by name only.
 */
public final class Field implements Expr
{
	private final Expr target;
	private final String name;

	public Field(Expr target, String name)
	{
		this.target = Objects.requireNonNull(target, "target");
		this.name = Objects.requireNonNull(name, "name");
	}

	public Expr getTarget()
	{
		return target;
	}

	public String getName()
	{
		return name;
	}

	@Override
	public <R> R accept(IRVisitor<R> visitor)
	{
		return visitor.visitField(this);
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
		Field field = (Field) o;
		return target.equals(field.target) && name.equals(field.name);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(target, name);
	}

	@Override
	public String toString()
	{
		return IRPrinter.print(this);
	}
}
